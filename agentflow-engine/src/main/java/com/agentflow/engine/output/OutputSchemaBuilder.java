package com.agentflow.engine.output;

import com.agentflow.workflow.config.NodeConfig;
import com.agentflow.workflow.config.OutputFieldConfig;
import com.agentflow.workflow.config.OutputSchemaConfig;
import com.agentflow.workflow.type.FieldType;
import com.agentflow.workflow.type.TypeParseException;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the {@link OutputContract} of a node from its {@code output_schema} and {@code outputs}.
 * Stateless; called once per node at compile time.
 */
public final class OutputSchemaBuilder {

    public OutputContract build(NodeConfig node) {
        OutputSchemaConfig schema = node.getOutputSchema();
        if (schema == null) {
            throw new IllegalArgumentException("Node '" + node.getId() + "' has no output_schema");
        }
        List<OutputField> fields = new ArrayList<>();
        if (schema.isObject()) {
            for (OutputFieldConfig f : schema.getFields()) {
                fields.add(new OutputField(f.getName(), f.getName(), parse(node, f.getType()), f.getDescription()));
            }
            return new OutputContract(node.getId(), true, fields, schema.getDescription());
        }
        if (node.getOutputs().size() != 1) {
            throw new IllegalArgumentException("Node '" + node.getId() + "': a '" + schema.getType()
                    + "' output_schema needs exactly one output, got " + node.getOutputs().size());
        }
        fields.add(new OutputField(OutputContract.RESULT_FIELD, node.getOutputs().get(0),
                parse(node, schema.getType()), schema.getDescription()));
        return new OutputContract(node.getId(), false, fields, schema.getDescription());
    }

    private static FieldType parse(NodeConfig node, String type) {
        try {
            return FieldType.parse(type);
        } catch (TypeParseException e) {
            throw new IllegalArgumentException("Node '" + node.getId() + "' output_schema: " + e.getMessage(), e);
        }
    }
}
