package com.agentflow.engine.state;

import com.agentflow.workflow.config.StateFieldConfig;
import com.agentflow.workflow.config.StateSchema;
import com.agentflow.workflow.type.FieldType;
import com.agentflow.workflow.type.TypeParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the {@link StateRecordType} of a workflow from its declared state fields.
 * List fields get {@link MergePolicy#ORDERED_CONCATENATION}; every other type gets
 * {@link MergePolicy#LAST_WRITER_WINS}.
 */
public final class StateRecordBuilder {

    private static final Logger log = LoggerFactory.getLogger(StateRecordBuilder.class);

    public StateRecordType build(StateSchema schema) {
        List<FieldSpec> specs = new ArrayList<>();
        int index = 0;
        for (StateFieldConfig field : schema.getFields()) {
            FieldType type;
            try {
                type = FieldType.parse(field.getType());
            } catch (TypeParseException e) {
                throw new StateInitializationException(field.getName(),
                        "State field '" + field.getName() + "': " + e.getMessage());
            }
            MergePolicy policy = policyFor(type);
            Object defaultValue = field.hasDefault() ? normalizeDefault(field, type) : null;
            specs.add(new FieldSpec(index++, field.getName(), type, policy, field.isRequired(),
                    defaultValue, field.getDescription()));
        }
        StateRecordType recordType = new StateRecordType(specs);
        log.debug("State record built | fields={}", specs);
        return recordType;
    }

    public static MergePolicy policyFor(FieldType type) {
        return type.isList() ? MergePolicy.ORDERED_CONCATENATION : MergePolicy.LAST_WRITER_WINS;
    }

    private static Object normalizeDefault(StateFieldConfig field, FieldType type) {
        Object value = field.getDefaultValue();
        if (value == null) return null;
        if (!type.accepts(value)) {
            throw new StateInitializationException(field.getName(),
                    "State field '" + field.getName() + "': default " + value + " is not a " + type);
        }
        return type.normalize(value);
    }
}
