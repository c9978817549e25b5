package com.agentflow.engine.graph;

import com.agentflow.config.EngineSettings;
import com.agentflow.engine.node.NodeDescriptor;
import com.agentflow.engine.output.OutputContract;
import com.agentflow.engine.output.OutputSchemaBuilder;
import com.agentflow.engine.state.StateRecordBuilder;
import com.agentflow.engine.state.StateRecordType;
import com.agentflow.llm.LlmOptions;
import com.agentflow.llm.ToolSpec;
import com.agentflow.tools.Tool;
import com.agentflow.tools.ToolExecutionException;
import com.agentflow.tools.ToolRegistry;
import com.agentflow.workflow.condition.Condition;
import com.agentflow.workflow.condition.ConditionParser;
import com.agentflow.workflow.condition.ConditionSyntaxException;
import com.agentflow.workflow.config.EdgeConfig;
import com.agentflow.workflow.config.ExecutionSettings;
import com.agentflow.workflow.config.LlmSettings;
import com.agentflow.workflow.config.LoopConfig;
import com.agentflow.workflow.config.NodeConfig;
import com.agentflow.workflow.config.RouteConfig;
import com.agentflow.workflow.config.WorkflowConfig;
import com.agentflow.workflow.validation.ConfigValidationException;
import com.agentflow.workflow.validation.ValidationResult;
import com.agentflow.workflow.validation.Violation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Compiles a validated {@link WorkflowConfig} into an {@link ExecutionPlan}: one {@link NodeDescriptor}
 * per node and one {@link EdgeDescriptor} per source. Route conditions are parsed here and fork-join
 * edges get their join node. Pure: no I/O and no model calls.
 * <p>
 * Settings precedence: {@code config.execution} overrides {@link EngineSettings}; node {@code llm}
 * overrides {@code config.llm}, which overrides the process LLM defaults, field by field.
 */
public final class GraphCompiler {

    private static final Logger log = LoggerFactory.getLogger(GraphCompiler.class);

    private final ToolRegistry tools;
    private final EngineSettings settings;
    private final StateRecordBuilder stateBuilder = new StateRecordBuilder();
    private final OutputSchemaBuilder outputBuilder = new OutputSchemaBuilder();

    public GraphCompiler(ToolRegistry tools, EngineSettings settings) {
        this.tools = tools != null ? tools : ToolRegistry.empty();
        this.settings = settings != null ? settings : EngineSettings.defaults();
    }

    public ExecutionPlan compile(WorkflowConfig config) {
        return compile(config, stateBuilder.build(config.getState()));
    }

    /**
     * @throws ConfigValidationException when a condition does not parse, a tool is unknown or an output
     *                                   schema cannot be built
     */
    public ExecutionPlan compile(WorkflowConfig config, StateRecordType stateType) {
        Objects.requireNonNull(config, "config");
        List<Violation> violations = new ArrayList<>();
        ExecutionSettings exec = config.getConfig().getExecution();
        int toolLoopMax = exec != null && exec.getToolLoopMaxIterations() != null
                ? exec.getToolLoopMaxIterations() : settings.getToolLoopMaxIterations();
        int maxRetries = exec != null && exec.getMaxRetries() != null
                ? exec.getMaxRetries() : settings.getOutputMaxRetries();
        Duration timeout = exec != null && exec.getTimeout() != null
                ? Duration.ofSeconds(exec.getTimeout()) : settings.getRunTimeout();
        LlmSettings workflowLlm = new LlmSettings(settings.getLlmProvider(), settings.getLlmModel(), null, null, null)
                .overriddenBy(config.getConfig().getLlm());

        Map<String, NodeDescriptor> nodes = new LinkedHashMap<>();
        for (NodeConfig node : config.getNodes()) {
            String path = "nodes[" + node.getId() + "]";
            OutputContract contract;
            try {
                contract = outputBuilder.build(node);
            } catch (IllegalArgumentException e) {
                violations.add(Violation.of(path + ".output_schema", e.getMessage()));
                continue;
            }
            List<ToolSpec> specs = new ArrayList<>();
            try {
                for (Tool tool : tools.resolve(node.getTools())) {
                    specs.add(new ToolSpec(tool.getName(), tool.getDescription(), tool.getParameters()));
                }
            } catch (ToolExecutionException e) {
                violations.add(Violation.of(path + ".tools", e.getMessage()));
                continue;
            }
            LlmSettings llm = workflowLlm.overriddenBy(node.getLlm());
            nodes.put(node.getId(), NodeDescriptor.builder(node.getId())
                    .prompt(node.getPrompt())
                    .inputs(node.getInputs())
                    .outputs(node.getOutputs())
                    .outputContract(contract)
                    .tools(specs)
                    .llmOptions(new LlmOptions(llm.getProvider(), llm.getModel(), llm.getTemperature(),
                            llm.getMaxTokens(), llm.getApiBase()))
                    .toolLoopMaxIterations(toolLoopMax)
                    .maxOutputRetries(maxRetries)
                    .breakOnError(node.isBreakOnError())
                    .build());
        }

        List<EdgeConfig> declared = config.effectiveEdges();
        Map<String, List<String>> successors = successorGraph(declared);
        Map<String, EdgeDescriptor> edges = new LinkedHashMap<>();
        for (int i = 0; i < declared.size(); i++) {
            EdgeConfig edge = declared.get(i);
            String path = i < config.getEdges().size() ? "edges[" + i + "]" : "nodes[" + edge.getFrom() + "].loop";
            if (edges.containsKey(edge.getFrom())) {
                violations.add(Violation.of(path, "'" + edge.getFrom() + "' already has an outgoing edge"));
                continue;
            }
            EdgeDescriptor compiled = compileEdge(edge, path, successors, violations);
            if (compiled != null) edges.put(edge.getFrom(), compiled);
        }

        if (!violations.isEmpty()) {
            throw new ConfigValidationException(ValidationResult.failure(violations));
        }
        ExecutionPlan plan = new ExecutionPlan(config.getName(),
                config.getFlow() != null ? config.getFlow().getVersion() : null,
                stateType, nodes, edges, timeout, config.getConfig().getGates());
        log.info("Workflow compiled | workflow={} | nodes={} | edges={} | timeout={}s",
                plan.getWorkflowName(), nodes.size(), edges.size(), timeout.getSeconds());
        return plan;
    }

    private EdgeDescriptor compileEdge(EdgeConfig edge, String path, Map<String, List<String>> successors,
                                       List<Violation> violations) {
        if (edge.hasLoop()) {
            LoopConfig loop = edge.getLoop();
            return new LoopEdge(edge.getFrom(), loop.getMaxIterations(), loop.getConditionField(), loop.getExitTo());
        }
        if (edge.hasRoutes()) {
            List<CompiledRoute> routes = new ArrayList<>();
            for (int j = 0; j < edge.getRoutes().size(); j++) {
                RouteConfig route = edge.getRoutes().get(j);
                try {
                    Condition condition = route.isDefault() ? Condition.ALWAYS : ConditionParser.parse(route.getLogic());
                    routes.add(new CompiledRoute(route.getLogic(), condition, route.getTo(), route.isDefault()));
                } catch (ConditionSyntaxException e) {
                    violations.add(Violation.of(path + ".routes[" + j + "].condition", e.getMessage()));
                }
            }
            return new ConditionalEdge(edge.getFrom(), routes);
        }
        if (edge.isFanOut()) {
            return new ForkJoinEdge(edge.getFrom(), edge.getTargets(), findJoin(edge.getTargets(), successors));
        }
        if (edge.getTargets().isEmpty()) {
            violations.add(Violation.of(path, "edge has no target"));
            return null;
        }
        return new LinearEdge(edge.getFrom(), edge.getTargets().get(0));
    }

    private static Map<String, List<String>> successorGraph(List<EdgeConfig> edges) {
        Map<String, List<String>> out = new HashMap<>();
        for (EdgeConfig e : edges) {
            out.computeIfAbsent(e.getFrom(), k -> new ArrayList<>()).addAll(e.allTargets());
        }
        return out;
    }

    /**
     * Join node of a fork: the node reachable from every branch whose farthest branch distance is smallest
     * (ties by total distance, then first reached). Branch start nodes are never the join. END when the
     * branches only meet at the end.
     */
    static String findJoin(List<String> branches, Map<String, List<String>> successors) {
        List<Map<String, Integer>> distances = new ArrayList<>();
        for (String branch : branches) {
            distances.add(distancesFrom(branch, successors));
        }
        String best = EdgeConfig.END;
        int bestMax = Integer.MAX_VALUE;
        int bestSum = Integer.MAX_VALUE;
        for (String candidate : distances.get(0).keySet()) {
            if (branches.contains(candidate) || EdgeConfig.END.equals(candidate)) continue;
            int max = 0;
            int sum = 0;
            boolean common = true;
            for (Map<String, Integer> d : distances) {
                Integer dist = d.get(candidate);
                if (dist == null) {
                    common = false;
                    break;
                }
                max = Math.max(max, dist);
                sum += dist;
            }
            if (common && (max < bestMax || (max == bestMax && sum < bestSum))) {
                best = candidate;
                bestMax = max;
                bestSum = sum;
            }
        }
        return best;
    }

    private static Map<String, Integer> distancesFrom(String start, Map<String, List<String>> successors) {
        Map<String, Integer> dist = new LinkedHashMap<>();
        Deque<String> queue = new ArrayDeque<>();
        dist.put(start, 0);
        queue.add(start);
        while (!queue.isEmpty()) {
            String current = queue.poll();
            for (String next : successors.getOrDefault(current, List.of())) {
                if (!dist.containsKey(next)) {
                    dist.put(next, dist.get(current) + 1);
                    queue.add(next);
                }
            }
        }
        return dist;
    }
}
