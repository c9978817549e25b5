package com.agentflow.engine.node;

import com.agentflow.engine.output.OutputCheck;
import com.agentflow.engine.output.OutputValidationException;
import com.agentflow.engine.state.ExecutionState;
import com.agentflow.engine.template.TemplateResolver;
import com.agentflow.ledger.NodeMetrics;
import com.agentflow.ledger.metrics.CostEstimator;
import com.agentflow.llm.ChatMessage;
import com.agentflow.llm.LlmClient;
import com.agentflow.llm.LlmClientFactory;
import com.agentflow.llm.LlmResponse;
import com.agentflow.llm.StructuredResponse;
import com.agentflow.llm.TokenUsage;
import com.agentflow.llm.ToolCall;
import com.agentflow.tools.ToolExecutionException;
import com.agentflow.tools.ToolInvoker;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Runs one LLM node in two phases.
 * <p>
 * Phase A (only when the node binds tools): call the model with tools, run every requested tool,
 * append the results to the conversation and call again, until the model requests no tools or the
 * iteration cap is hit. A failing tool is reported back to the model as an error observation.
 * <p>
 * Phase B: call the model constrained to the node's output schema and check the reply against the
 * output contract. On failure the problems are appended as a correction prompt and the call is retried
 * up to {@code maxOutputRetries} times, then {@link OutputValidationException} is thrown.
 */
public final class NodeExecutor implements NodeHandler {

    private static final Logger log = LoggerFactory.getLogger(NodeExecutor.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    static final String CORRECTION_PROMPT =
            "Previous attempt failed validation. Please ensure the response matches the required schema exactly.";

    private final LlmClientFactory clientFactory;
    private final ToolInvoker toolInvoker;
    private final CostEstimator costEstimator;
    private final TemplateResolver templates = new TemplateResolver();

    public NodeExecutor(LlmClientFactory clientFactory, ToolInvoker toolInvoker, CostEstimator costEstimator) {
        this.clientFactory = Objects.requireNonNull(clientFactory, "clientFactory");
        this.toolInvoker = Objects.requireNonNull(toolInvoker, "toolInvoker");
        this.costEstimator = costEstimator != null ? costEstimator : new CostEstimator();
    }

    @Override
    public NodeResult execute(NodeDescriptor node, ExecutionState snapshot) {
        long start = System.nanoTime();
        Map<String, Object> inputs = templates.resolveInputs(node.getInputs(), snapshot);
        String prompt = templates.resolve(node.getPrompt(), inputs, snapshot);
        log.debug("Node prompt resolved | node={} | chars={} | prompt={}", node.getId(), prompt.length(), prompt);

        LlmClient client = clientFactory.create(node.getLlmOptions());
        List<ChatMessage> conversation = new ArrayList<>();
        conversation.add(ChatMessage.user(prompt));

        TokenUsage usage = TokenUsage.zero();
        int toolCalls = 0;
        String model = node.getLlmOptions().getModel();

        if (node.hasTools()) {
            ToolLoopOutcome loop = runToolLoop(node, client, conversation);
            usage = usage.plus(loop.usage);
            toolCalls = loop.toolCalls;
            if (loop.model != null) model = loop.model;
        }

        Map<String, Object> schema = node.getOutputContract().toJsonSchema();
        int maxAttempts = Math.max(0, node.getMaxOutputRetries()) + 1;
        List<String> problems = List.of();
        Map<String, Object> delta = null;
        int attempt = 0;
        while (attempt < maxAttempts) {
            attempt++;
            StructuredResponse response = client.invokeStructured(conversation, schema);
            usage = usage.plus(response.getUsage());
            if (response.getModel() != null) model = response.getModel();
            OutputCheck check = node.getOutputContract().validate(response.getValue());
            if (check.isValid()) {
                delta = check.getDelta();
                break;
            }
            problems = check.getProblems();
            log.warn("Structured output rejected | node={} | attempt={}/{} | problems={}", node.getId(), attempt, maxAttempts, problems);
            conversation.add(ChatMessage.assistant(response.getRawText() != null ? response.getRawText() : "", List.of()));
            conversation.add(ChatMessage.user(CORRECTION_PROMPT + " Problems: " + String.join("; ", problems)));
        }
        NodeMetrics metrics = metrics(node, start, usage, model, toolCalls, attempt);
        if (delta == null) {
            throw new OutputValidationException(node.getId(), attempt, problems, metrics);
        }
        log.debug("Node delta | node={} | delta={}", node.getId(), delta);
        return new NodeResult(node.getId(), delta, metrics);
    }

    private NodeMetrics metrics(NodeDescriptor node, long start, TokenUsage usage, String model, int toolCalls, int attempts) {
        long durationMs = (System.nanoTime() - start) / 1_000_000L;
        return new NodeMetrics(durationMs, usage.getPromptTokens(), usage.getCompletionTokens(),
                costEstimator.estimate(model, usage.getPromptTokens(), usage.getCompletionTokens()),
                model, node.getLlmOptions().getProvider(), toolCalls, attempts);
    }

    private ToolLoopOutcome runToolLoop(NodeDescriptor node, LlmClient client, List<ChatMessage> conversation) {
        TokenUsage usage = TokenUsage.zero();
        int toolCalls = 0;
        String model = null;
        int cap = Math.max(1, node.getToolLoopMaxIterations());
        for (int iteration = 1; iteration <= cap; iteration++) {
            LlmResponse response = client.invokeWithTools(conversation, node.getTools());
            usage = usage.plus(response.getUsage());
            if (response.getModel() != null) model = response.getModel();
            if (!response.hasToolCalls()) {
                if (response.getContent() != null && !response.getContent().isBlank()) {
                    conversation.add(ChatMessage.assistant(response.getContent(), List.of()));
                }
                return new ToolLoopOutcome(usage, toolCalls, model);
            }
            conversation.add(ChatMessage.assistant(response.getContent(), response.getToolCalls()));
            for (ToolCall call : response.getToolCalls()) {
                toolCalls++;
                conversation.add(ChatMessage.tool(call.getName(), invokeTool(node, call)));
            }
            if (iteration == cap) {
                log.warn("Tool loop cap reached | node={} | iterations={} | toolCalls={}", node.getId(), cap, toolCalls);
            }
        }
        return new ToolLoopOutcome(usage, toolCalls, model);
    }

    private String invokeTool(NodeDescriptor node, ToolCall call) {
        try {
            Object result = toolInvoker.invoke(call.getName(), call.getArguments());
            log.info("Tool call completed | node={} | tool={}", node.getId(), call.getName());
            return render(result);
        } catch (ToolExecutionException e) {
            log.warn("Tool call failed; reported to model | node={} | tool={} | error={}", node.getId(), call.getName(), e.getMessage());
            return "Error: " + e.getMessage();
        }
    }

    private static String render(Object result) {
        if (result == null) return "";
        if (result instanceof String s) return s;
        try {
            return MAPPER.writeValueAsString(result);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static final class ToolLoopOutcome {
        final TokenUsage usage;
        final int toolCalls;
        final String model;

        ToolLoopOutcome(TokenUsage usage, int toolCalls, String model) {
            this.usage = usage;
            this.toolCalls = toolCalls;
            this.model = model;
        }
    }
}
