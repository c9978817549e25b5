package com.agentflow.workflow.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One execution unit: a prompt template, the state fields it may write ({@code outputs}),
 * the output schema enforced on the model response, and optional tools, LLM override and loop block.
 * <p>
 * {@code tools} entries may be plain names or {@code {name: ...}} objects.
 * {@code break_on_error} defaults to true; false makes a failure of this node non-fatal.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public final class NodeConfig {

    private final String id;
    private final String description;
    private final String prompt;
    private final Map<String, String> inputs;
    private final List<String> outputs;
    private final OutputSchemaConfig outputSchema;
    private final List<String> tools;
    private final LlmSettings llm;
    private final LoopConfig loop;
    private final boolean breakOnError;

    public NodeConfig(String id, String description, String prompt, Map<String, String> inputs,
                      List<String> outputs, OutputSchemaConfig outputSchema, List<String> tools,
                      LlmSettings llm, LoopConfig loop, boolean breakOnError) {
        this.id = id != null ? id.trim() : null;
        this.description = description;
        this.prompt = prompt != null ? prompt : "";
        this.inputs = inputs != null ? Collections.unmodifiableMap(new LinkedHashMap<>(inputs)) : Map.of();
        this.outputs = outputs != null ? List.copyOf(outputs) : List.of();
        this.outputSchema = outputSchema;
        this.tools = tools != null ? List.copyOf(tools) : List.of();
        this.llm = llm;
        this.loop = loop;
        this.breakOnError = breakOnError;
    }

    @JsonCreator
    public static NodeConfig fromJson(
            @JsonProperty("id") String id,
            @JsonProperty("description") String description,
            @JsonProperty("prompt") String prompt,
            @JsonProperty("inputs") Map<String, String> inputs,
            @JsonProperty("outputs") List<String> outputs,
            @JsonProperty("output_schema") OutputSchemaConfig outputSchema,
            @JsonProperty("tools") List<Object> tools,
            @JsonProperty("llm") LlmSettings llm,
            @JsonProperty("loop") LoopConfig loop,
            @JsonProperty("break_on_error") Boolean breakOnError) {
        return new NodeConfig(id, description, prompt, inputs, outputs, outputSchema, toolNames(tools),
                llm, loop, breakOnError == null || breakOnError);
    }

    private static List<String> toolNames(List<Object> tools) {
        if (tools == null) return List.of();
        List<String> names = new ArrayList<>(tools.size());
        for (Object t : tools) {
            if (t instanceof Map<?, ?> map) {
                Object name = map.get("name");
                if (name != null) names.add(name.toString().trim());
            } else if (t != null) {
                names.add(t.toString().trim());
            }
        }
        return names;
    }

    public String getId() {
        return id;
    }

    public String getDescription() {
        return description;
    }

    public String getPrompt() {
        return prompt;
    }

    /** Local name to template (e.g. {@code "{state.topic}"}), in declaration order. */
    public Map<String, String> getInputs() {
        return inputs;
    }

    public List<String> getOutputs() {
        return outputs;
    }

    @JsonProperty("output_schema")
    public OutputSchemaConfig getOutputSchema() {
        return outputSchema;
    }

    public List<String> getTools() {
        return tools;
    }

    public LlmSettings getLlm() {
        return llm;
    }

    public LoopConfig getLoop() {
        return loop;
    }

    @JsonProperty("break_on_error")
    public boolean isBreakOnError() {
        return breakOnError;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        NodeConfig that = (NodeConfig) o;
        return breakOnError == that.breakOnError
                && Objects.equals(id, that.id)
                && Objects.equals(description, that.description)
                && Objects.equals(prompt, that.prompt)
                && Objects.equals(inputs, that.inputs)
                && Objects.equals(outputs, that.outputs)
                && Objects.equals(outputSchema, that.outputSchema)
                && Objects.equals(tools, that.tools)
                && Objects.equals(llm, that.llm)
                && Objects.equals(loop, that.loop);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, description, prompt, inputs, outputs, outputSchema, tools, llm, loop, breakOnError);
    }
}
