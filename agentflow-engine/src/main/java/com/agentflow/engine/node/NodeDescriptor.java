package com.agentflow.engine.node;

import com.agentflow.engine.output.OutputContract;
import com.agentflow.llm.LlmOptions;
import com.agentflow.llm.ToolSpec;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Everything a {@link NodeHandler} needs to run one node, resolved at compile time: prompt and input
 * templates, output contract, bound tools, effective LLM options and limits.
 */
public final class NodeDescriptor {

    private final String id;
    private final String prompt;
    private final Map<String, String> inputs;
    private final List<String> outputs;
    private final OutputContract outputContract;
    private final List<ToolSpec> tools;
    private final LlmOptions llmOptions;
    private final int toolLoopMaxIterations;
    private final int maxOutputRetries;
    private final boolean breakOnError;

    private NodeDescriptor(Builder b) {
        this.id = Objects.requireNonNull(b.id, "id");
        this.prompt = b.prompt != null ? b.prompt : "";
        this.inputs = Collections.unmodifiableMap(new LinkedHashMap<>(b.inputs));
        this.outputs = List.copyOf(b.outputs);
        this.outputContract = Objects.requireNonNull(b.outputContract, "outputContract");
        this.tools = List.copyOf(b.tools);
        this.llmOptions = Objects.requireNonNull(b.llmOptions, "llmOptions");
        this.toolLoopMaxIterations = b.toolLoopMaxIterations;
        this.maxOutputRetries = b.maxOutputRetries;
        this.breakOnError = b.breakOnError;
    }

    public static Builder builder(String id) {
        return new Builder(id);
    }

    public String getId() { return id; }
    public String getPrompt() { return prompt; }
    public Map<String, String> getInputs() { return inputs; }
    public List<String> getOutputs() { return outputs; }
    public OutputContract getOutputContract() { return outputContract; }
    public List<ToolSpec> getTools() { return tools; }
    public boolean hasTools() { return !tools.isEmpty(); }
    public LlmOptions getLlmOptions() { return llmOptions; }
    public int getToolLoopMaxIterations() { return toolLoopMaxIterations; }
    public int getMaxOutputRetries() { return maxOutputRetries; }
    public boolean isBreakOnError() { return breakOnError; }

    @Override
    public String toString() {
        return "NodeDescriptor{id=" + id + ", outputs=" + outputs + ", tools=" + tools.size() + ", llm=" + llmOptions + "}";
    }

    public static final class Builder {
        private final String id;
        private String prompt;
        private Map<String, String> inputs = Map.of();
        private List<String> outputs = List.of();
        private OutputContract outputContract;
        private List<ToolSpec> tools = List.of();
        private LlmOptions llmOptions;
        private int toolLoopMaxIterations = 10;
        private int maxOutputRetries = 2;
        private boolean breakOnError = true;

        private Builder(String id) {
            this.id = id;
        }

        public Builder prompt(String prompt) { this.prompt = prompt; return this; }
        public Builder inputs(Map<String, String> inputs) { this.inputs = inputs != null ? inputs : Map.of(); return this; }
        public Builder outputs(List<String> outputs) { this.outputs = outputs != null ? outputs : List.of(); return this; }
        public Builder outputContract(OutputContract contract) { this.outputContract = contract; return this; }
        public Builder tools(List<ToolSpec> tools) { this.tools = tools != null ? tools : List.of(); return this; }
        public Builder llmOptions(LlmOptions options) { this.llmOptions = options; return this; }
        public Builder toolLoopMaxIterations(int n) { this.toolLoopMaxIterations = n; return this; }
        public Builder maxOutputRetries(int n) { this.maxOutputRetries = n; return this; }
        public Builder breakOnError(boolean breakOnError) { this.breakOnError = breakOnError; return this; }

        public NodeDescriptor build() {
            return new NodeDescriptor(this);
        }
    }
}
