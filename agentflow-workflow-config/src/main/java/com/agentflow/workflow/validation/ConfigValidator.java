package com.agentflow.workflow.validation;

import com.agentflow.workflow.condition.Condition;
import com.agentflow.workflow.condition.ConditionParser;
import com.agentflow.workflow.condition.ConditionSyntaxException;
import com.agentflow.workflow.config.EdgeConfig;
import com.agentflow.workflow.config.ExecutionSettings;
import com.agentflow.workflow.config.GateAction;
import com.agentflow.workflow.config.GatesConfig;
import com.agentflow.workflow.config.LlmSettings;
import com.agentflow.workflow.config.LoopConfig;
import com.agentflow.workflow.config.NodeConfig;
import com.agentflow.workflow.config.OutputFieldConfig;
import com.agentflow.workflow.config.OutputSchemaConfig;
import com.agentflow.workflow.config.QualityGateConfig;
import com.agentflow.workflow.config.RouteConfig;
import com.agentflow.workflow.config.StateFieldConfig;
import com.agentflow.workflow.config.WorkflowConfig;
import com.agentflow.workflow.type.FieldKind;
import com.agentflow.workflow.type.FieldType;
import com.agentflow.workflow.type.TypeParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Validates a parsed {@link WorkflowConfig} in two phases.
 * <ol>
 *   <li>Structural: field types, required/default consistency, enum membership, value ranges,
 *       exactly one variant per edge.</li>
 *   <li>Graph and business logic: reference integrity, reachability from START and to END,
 *       route defaults, loop condition fields, fork fan-out, output/state alignment, prompt placeholders
 *       and tool names.</li>
 * </ol>
 * The second phase only runs when the first passes. Each phase reports every violation it finds.
 * Validation is pure; it never touches a model or a tool.
 */
public final class ConfigValidator {

    private static final Logger log = LoggerFactory.getLogger(ConfigValidator.class);

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private final Set<String> knownTools;

    /** Validator that does not check tool names. */
    public ConfigValidator() {
        this(null);
    }

    /**
     * @param knownTools names registered in the tool registry; null skips the tool-name check
     */
    public ConfigValidator(Set<String> knownTools) {
        this.knownTools = knownTools != null ? Set.copyOf(knownTools) : null;
    }

    public ValidationResult validate(WorkflowConfig config) {
        Objects.requireNonNull(config, "config");
        List<Violation> structural = new ArrayList<>();
        checkStructure(config, structural);
        if (!structural.isEmpty()) {
            log.warn("Workflow config failed structural validation | flow={} violations={}", config.getName(), structural.size());
            return ValidationResult.failure(structural);
        }
        List<Violation> graph = new ArrayList<>();
        checkGraph(config, graph);
        if (!graph.isEmpty()) {
            log.warn("Workflow config failed graph validation | flow={} violations={}", config.getName(), graph.size());
            return ValidationResult.failure(graph);
        }
        log.debug("Workflow config valid | flow={} nodes={} edges={}", config.getName(),
                config.getNodes().size(), config.getEdges().size());
        return ValidationResult.success();
    }

    /** @throws ConfigValidationException carrying every violation when the config is invalid */
    public void validateOrThrow(WorkflowConfig config) {
        ValidationResult result = validate(config);
        if (!result.isValid()) {
            throw new ConfigValidationException(result);
        }
    }

    // ---------------------------------------------------------------- structural

    private void checkStructure(WorkflowConfig config, List<Violation> out) {
        String version = config.getSchemaVersion();
        if (version != null && !WorkflowConfig.SUPPORTED_SCHEMA_VERSION.equals(version.trim())) {
            out.add(new Violation("schema_version", "unsupported schema version '" + version + "'",
                    "use '" + WorkflowConfig.SUPPORTED_SCHEMA_VERSION + "'"));
        }
        if (config.getFlow() == null || config.getFlow().getName() == null || config.getFlow().getName().isBlank()) {
            out.add(Violation.of("flow.name", "flow name is required"));
        }
        checkStateFields(config, out);
        checkNodes(config, out);
        checkEdges(config, out);
        checkSettings(config, out);
    }

    private void checkStateFields(WorkflowConfig config, List<Violation> out) {
        List<StateFieldConfig> fields = config.getState().getFields();
        if (fields.isEmpty()) {
            out.add(Violation.of("state.fields", "at least one state field is required"));
            return;
        }
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < fields.size(); i++) {
            StateFieldConfig f = fields.get(i);
            String path = "state.fields[" + (f.getName() != null ? f.getName() : String.valueOf(i)) + "]";
            if (f.getName() == null || !IDENTIFIER.matcher(f.getName()).matches()) {
                out.add(Violation.of(path, "field name must be an identifier, got '" + f.getName() + "'"));
            } else if (!seen.add(f.getName())) {
                out.add(Violation.of(path, "duplicate state field '" + f.getName() + "'"));
            }
            FieldType type = parseType(f.getType(), path + ".type", out);
            if (f.isRequired() && f.hasDefault()) {
                out.add(new Violation(path, "field is required and also declares a default",
                        "drop 'required' or remove the default"));
            }
            if (type != null && f.hasDefault() && !type.accepts(f.getDefaultValue())) {
                out.add(Violation.of(path + ".default", "default value " + f.getDefaultValue()
                        + " does not match type '" + type + "'"));
            }
        }
    }

    private void checkNodes(WorkflowConfig config, List<Violation> out) {
        List<NodeConfig> nodes = config.getNodes();
        if (nodes.isEmpty()) {
            out.add(Violation.of("nodes", "at least one node is required"));
            return;
        }
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < nodes.size(); i++) {
            NodeConfig n = nodes.get(i);
            String path = "nodes[" + (n.getId() != null ? n.getId() : String.valueOf(i)) + "]";
            if (n.getId() == null || !IDENTIFIER.matcher(n.getId()).matches()) {
                out.add(Violation.of(path, "node id must be an identifier, got '" + n.getId() + "'"));
            } else if (EdgeConfig.START.equals(n.getId()) || EdgeConfig.END.equals(n.getId())) {
                out.add(Violation.of(path, "'" + n.getId() + "' is reserved and cannot be a node id"));
            } else if (!seen.add(n.getId())) {
                out.add(Violation.of(path, "duplicate node id '" + n.getId() + "'"));
            }
            if (n.getPrompt().isBlank()) {
                out.add(Violation.of(path + ".prompt", "prompt is required"));
            }
            if (n.getOutputs().isEmpty()) {
                out.add(Violation.of(path + ".outputs", "node must declare at least one output field"));
            }
            Set<String> outputs = new HashSet<>();
            for (String o : n.getOutputs()) {
                if (!outputs.add(o)) {
                    out.add(Violation.of(path + ".outputs", "output '" + o + "' listed twice"));
                }
            }
            checkOutputSchema(n.getOutputSchema(), path + ".output_schema", out);
            checkLlm(n.getLlm(), path + ".llm", out);
            if (n.getLoop() != null) {
                checkLoop(n.getLoop(), path + ".loop", out);
            }
        }
    }

    private void checkOutputSchema(OutputSchemaConfig schema, String path, List<Violation> out) {
        if (schema == null) {
            out.add(Violation.of(path, "output_schema is required"));
            return;
        }
        FieldType type = parseType(schema.getType(), path + ".type", out);
        if (type == null) return;
        if (schema.isObject()) {
            if (schema.getFields().isEmpty()) {
                out.add(Violation.of(path + ".fields", "object output_schema must declare fields"));
            }
            Set<String> names = new HashSet<>();
            for (OutputFieldConfig f : schema.getFields()) {
                String fieldPath = path + ".fields[" + f.getName() + "]";
                if (f.getName() == null || f.getName().isBlank()) {
                    out.add(Violation.of(fieldPath, "output field name is required"));
                } else if (!names.add(f.getName())) {
                    out.add(Violation.of(fieldPath, "duplicate output field '" + f.getName() + "'"));
                }
                FieldType ft = parseType(f.getType(), fieldPath + ".type", out);
                if (ft != null && ft.getKind() == FieldKind.OBJECT) {
                    out.add(new Violation(fieldPath, "nested object output fields are not supported",
                            "use 'dict' for structured values"));
                }
            }
        } else if (!schema.getFields().isEmpty()) {
            out.add(Violation.of(path + ".fields", "only object output_schema may declare fields"));
        }
    }

    private static void checkLlm(LlmSettings llm, String path, List<Violation> out) {
        if (llm == null) return;
        if (llm.getProvider() != null && !LlmSettings.SUPPORTED_PROVIDERS.contains(llm.getProvider())) {
            out.add(new Violation(path + ".provider", "unknown provider '" + llm.getProvider() + "'",
                    NearestMatch.suggestion(llm.getProvider(), LlmSettings.SUPPORTED_PROVIDERS, "supported")));
        }
        if (llm.getTemperature() != null && (llm.getTemperature() < 0.0 || llm.getTemperature() > 1.0)) {
            out.add(Violation.of(path + ".temperature", "temperature must be between 0 and 1, got " + llm.getTemperature()));
        }
        if (llm.getMaxTokens() != null && llm.getMaxTokens() <= 0) {
            out.add(Violation.of(path + ".max_tokens", "max_tokens must be positive, got " + llm.getMaxTokens()));
        }
    }

    private static void checkLoop(LoopConfig loop, String path, List<Violation> out) {
        if (loop.getMaxIterations() < 1 || loop.getMaxIterations() > LoopConfig.MAX_ALLOWED_ITERATIONS) {
            out.add(Violation.of(path + ".max_iterations", "max_iterations must be between 1 and "
                    + LoopConfig.MAX_ALLOWED_ITERATIONS + ", got " + loop.getMaxIterations()));
        }
        if (loop.getConditionField() == null || loop.getConditionField().isBlank()) {
            out.add(Violation.of(path + ".condition_field", "condition_field is required"));
        }
        if (loop.getExitTo() == null || loop.getExitTo().isBlank()) {
            out.add(Violation.of(path + ".exit_to", "exit_to is required"));
        }
    }

    private static void checkEdges(WorkflowConfig config, List<Violation> out) {
        List<EdgeConfig> edges = config.getEdges();
        if (edges.isEmpty()) {
            out.add(Violation.of("edges", "at least one edge is required"));
            return;
        }
        for (int i = 0; i < edges.size(); i++) {
            EdgeConfig e = edges.get(i);
            String path = edgePath(i, e);
            if (e.getFrom() == null || e.getFrom().isBlank()) {
                out.add(Violation.of(path, "edge 'from' is required"));
            }
            int variants = e.declaredVariantCount();
            if (variants == 0) {
                out.add(Violation.of(path, "edge must declare one of 'to', 'routes' or 'loop'"));
            } else if (variants > 1) {
                out.add(Violation.of(path, "edge declares more than one of 'to', 'routes' and 'loop'"));
            }
            for (String t : e.getTargets()) {
                if (t.isBlank()) out.add(Violation.of(path + ".to", "edge target cannot be empty"));
            }
            for (int r = 0; r < e.getRoutes().size(); r++) {
                RouteConfig route = e.getRoutes().get(r);
                if (route.getLogic() == null || route.getLogic().isBlank()) {
                    out.add(Violation.of(path + ".routes[" + r + "]", "route condition logic is required"));
                }
                if (route.getTo() == null || route.getTo().isBlank()) {
                    out.add(Violation.of(path + ".routes[" + r + "]", "route target 'to' is required"));
                }
            }
            if (e.hasLoop()) {
                checkLoop(e.getLoop(), path + ".loop", out);
            }
        }
    }

    private static void checkSettings(WorkflowConfig config, List<Violation> out) {
        checkLlm(config.getConfig().getLlm(), "config.llm", out);
        ExecutionSettings exec = config.getConfig().getExecution();
        if (exec != null) {
            if (exec.getTimeout() != null && exec.getTimeout() <= 0) {
                out.add(Violation.of("config.execution.timeout", "timeout must be positive, got " + exec.getTimeout()));
            }
            if (exec.getMaxRetries() != null && exec.getMaxRetries() < 0) {
                out.add(Violation.of("config.execution.max_retries", "max_retries cannot be negative, got " + exec.getMaxRetries()));
            }
            if (exec.getToolLoopMaxIterations() != null && exec.getToolLoopMaxIterations() <= 0) {
                out.add(Violation.of("config.execution.tool_loop_max_iterations",
                        "tool_loop_max_iterations must be positive, got " + exec.getToolLoopMaxIterations()));
            }
        }
        GatesConfig gates = config.getConfig().getGates();
        if (gates != null) {
            if (gates.getOnFail() == GateAction.UNKNOWN) {
                out.add(new Violation("config.gates.on_fail", "unknown gate action", "use one of warn, fail, block_deploy"));
            }
            for (int i = 0; i < gates.getGates().size(); i++) {
                QualityGateConfig g = gates.getGates().get(i);
                String path = "config.gates.gates[" + i + "]";
                if (g.getMetric() == null || g.getMetric().isBlank()) {
                    out.add(Violation.of(path, "gate metric is required"));
                }
                if (g.getMin() == null && g.getMax() == null) {
                    out.add(Violation.of(path, "gate must declare min or max"));
                }
                if (g.getMin() != null && g.getMax() != null && g.getMin() > g.getMax()) {
                    out.add(Violation.of(path, "gate min " + g.getMin() + " is greater than max " + g.getMax()));
                }
            }
        }
    }

    private static FieldType parseType(String typeString, String path, List<Violation> out) {
        try {
            return FieldType.parse(typeString);
        } catch (TypeParseException e) {
            out.add(Violation.of(path, e.getMessage()));
            return null;
        }
    }

    // ---------------------------------------------------------------- graph and business logic

    private void checkGraph(WorkflowConfig config, List<Violation> out) {
        Map<String, NodeConfig> nodes = new LinkedHashMap<>();
        for (NodeConfig n : config.getNodes()) {
            nodes.put(n.getId(), n);
        }
        Map<String, FieldType> stateTypes = new LinkedHashMap<>();
        for (StateFieldConfig f : config.getState().getFields()) {
            stateTypes.put(f.getName(), FieldType.parse(f.getType()));
        }
        List<EdgeConfig> edges = config.effectiveEdges();
        List<String> labels = edgeLabels(config.getEdges().size(), edges);

        checkEdgeReferences(edges, labels, nodes, stateTypes, out);
        checkOutgoingDeclarations(edges, labels, out);
        checkNodeContracts(nodes, stateTypes, out);
        checkTools(nodes, out);

        Map<String, List<String>> successors = successors(edges, nodes.keySet());
        checkReachability(nodes, successors, out);
        checkLoopConditions(edges, labels, nodes, stateTypes, successors, out);
    }

    private static void checkEdgeReferences(List<EdgeConfig> edges, List<String> labels, Map<String, NodeConfig> nodes,
                                            Map<String, FieldType> stateTypes, List<Violation> out) {
        Set<String> nodeIds = nodes.keySet();
        Set<String> sources = new LinkedHashSet<>(nodeIds);
        sources.add(EdgeConfig.START);
        Set<String> targets = new LinkedHashSet<>(nodeIds);
        targets.add(EdgeConfig.END);

        for (int i = 0; i < edges.size(); i++) {
            EdgeConfig e = edges.get(i);
            String path = labels.get(i);
            if (EdgeConfig.END.equals(e.getFrom())) {
                out.add(Violation.of(path, "END cannot be an edge source"));
            } else if (!sources.contains(e.getFrom())) {
                out.add(new Violation(path, "'from' references unknown node '" + e.getFrom() + "'",
                        NearestMatch.suggestion(e.getFrom(), sources, "valid sources")));
            }
            if (e.isFanOut()) {
                Set<String> distinct = new LinkedHashSet<>(e.getTargets());
                if (distinct.size() < 2) {
                    out.add(Violation.of(path, "fork-join edge needs at least 2 distinct targets, got " + e.getTargets()));
                } else if (distinct.size() < e.getTargets().size()) {
                    out.add(Violation.of(path, "fork-join edge lists a target more than once: " + e.getTargets()));
                }
                for (String t : e.getTargets()) {
                    if (!nodeIds.contains(t)) {
                        out.add(new Violation(path, "fork target '" + t + "' is not a node",
                                NearestMatch.suggestion(t, nodeIds, "valid nodes")));
                    }
                }
            } else if (e.hasTo()) {
                checkTarget(path, "'to'", e.getTargets().get(0), targets, out);
            }
            if (e.hasRoutes()) {
                boolean hasDefault = false;
                for (int r = 0; r < e.getRoutes().size(); r++) {
                    RouteConfig route = e.getRoutes().get(r);
                    String routePath = path + ".routes[" + r + "]";
                    checkTarget(routePath, "route 'to'", route.getTo(), targets, out);
                    if (route.isDefault()) {
                        hasDefault = true;
                        continue;
                    }
                    Condition condition;
                    try {
                        condition = ConditionParser.parse(route.getLogic());
                    } catch (ConditionSyntaxException ex) {
                        out.add(Violation.of(routePath + ".condition", ex.getMessage()));
                        continue;
                    }
                    for (String field : condition.referencedFields()) {
                        if (!stateTypes.containsKey(field)) {
                            out.add(new Violation(routePath + ".condition",
                                    "condition references unknown state field '" + field + "'",
                                    NearestMatch.suggestion(field, stateTypes.keySet(), "state fields")));
                        }
                    }
                }
                if (!hasDefault) {
                    out.add(new Violation(path, "conditional edge has no 'default' route",
                            "add {condition: default, to: <node or END>} to the routes"));
                }
            }
            if (e.hasLoop()) {
                checkTarget(path + ".loop", "exit_to", e.getLoop().getExitTo(), targets, out);
                if (!nodeIds.contains(e.getFrom())) {
                    out.add(Violation.of(path + ".loop", "loop source must be a node"));
                }
            }
        }
    }

    private static void checkTarget(String path, String label, String target, Set<String> valid, List<Violation> out) {
        if (EdgeConfig.START.equals(target)) {
            out.add(Violation.of(path, label + " cannot target START"));
        } else if (!valid.contains(target)) {
            out.add(new Violation(path, label + " references unknown node '" + target + "'",
                    NearestMatch.suggestion(target, valid, "valid targets")));
        }
    }

    private static void checkOutgoingDeclarations(List<EdgeConfig> edges, List<String> labels, List<Violation> out) {
        Map<String, List<Integer>> bySource = new LinkedHashMap<>();
        for (int i = 0; i < edges.size(); i++) {
            bySource.computeIfAbsent(edges.get(i).getFrom(), k -> new ArrayList<>()).add(i);
        }
        List<Integer> startEdges = bySource.getOrDefault(EdgeConfig.START, List.of());
        if (startEdges.isEmpty()) {
            out.add(new Violation("edges", "no edge leaves START", "add {from: START, to: <first node>}"));
        }
        for (Map.Entry<String, List<Integer>> entry : bySource.entrySet()) {
            if (entry.getValue().size() < 2) continue;
            List<String> where = new ArrayList<>();
            for (int idx : entry.getValue()) {
                where.add(labels.get(idx));
            }
            String subject = EdgeConfig.START.equals(entry.getKey()) ? "START" : "node '" + entry.getKey() + "'";
            out.add(new Violation(where.get(1), subject + " has more than one outgoing edge declaration: " + where,
                    "merge them into a single edge with routes or a fork list"));
        }
    }

    private static void checkNodeContracts(Map<String, NodeConfig> nodes, Map<String, FieldType> stateTypes,
                                           List<Violation> out) {
        for (NodeConfig n : nodes.values()) {
            String path = "nodes[" + n.getId() + "]";
            for (String o : n.getOutputs()) {
                if (!stateTypes.containsKey(o)) {
                    out.add(new Violation(path + ".outputs", "output '" + o + "' is not a state field",
                            NearestMatch.suggestion(o, stateTypes.keySet(), "state fields")));
                }
            }
            OutputSchemaConfig schema = n.getOutputSchema();
            if (schema.isObject()) {
                Set<String> schemaNames = new LinkedHashSet<>();
                for (OutputFieldConfig f : schema.getFields()) {
                    schemaNames.add(f.getName());
                    if (!n.getOutputs().contains(f.getName())) {
                        out.add(new Violation(path + ".output_schema", "schema field '" + f.getName()
                                + "' is not a declared output", NearestMatch.suggestion(f.getName(), n.getOutputs(), "outputs")));
                        continue;
                    }
                    checkTypeAlignment(path, f.getName(), FieldType.parse(f.getType()), stateTypes, out);
                }
                for (String o : n.getOutputs()) {
                    if (!schemaNames.contains(o)) {
                        out.add(Violation.of(path + ".output_schema", "output '" + o + "' has no schema field"));
                    }
                }
            } else {
                if (n.getOutputs().size() != 1) {
                    out.add(new Violation(path + ".output_schema", "a '" + schema.getType()
                            + "' output_schema needs exactly one output, got " + n.getOutputs().size(),
                            "use type 'object' with one field per output"));
                } else {
                    checkTypeAlignment(path, n.getOutputs().get(0), FieldType.parse(schema.getType()), stateTypes, out);
                }
            }
            for (String placeholder : Placeholders.extract(n.getPrompt())) {
                checkPlaceholder(path + ".prompt", placeholder, n.getInputs().keySet(), stateTypes, out);
            }
            for (Map.Entry<String, String> input : n.getInputs().entrySet()) {
                for (String placeholder : Placeholders.extract(input.getValue())) {
                    checkPlaceholder(path + ".inputs[" + input.getKey() + "]", placeholder, Set.of(), stateTypes, out);
                }
            }
        }
    }

    private static void checkTypeAlignment(String path, String field, FieldType produced,
                                           Map<String, FieldType> stateTypes, List<Violation> out) {
        FieldType declared = stateTypes.get(field);
        if (declared != null && !declared.equals(produced)) {
            out.add(Violation.of(path + ".output_schema", "output '" + field + "' has type '" + produced
                    + "' but state field is '" + declared + "'"));
        }
    }

    private static void checkPlaceholder(String path, String placeholder, Set<String> localInputs,
                                         Map<String, FieldType> stateTypes, List<Violation> out) {
        String root = Placeholders.rootName(placeholder);
        if (!Placeholders.hasStatePrefix(placeholder) && localInputs.contains(root)) return;
        if (stateTypes.containsKey(root)) return;
        Set<String> candidates = new LinkedHashSet<>(stateTypes.keySet());
        candidates.addAll(localInputs);
        out.add(new Violation(path, "placeholder '{" + placeholder + "}' references unknown field '" + root + "'",
                NearestMatch.suggestion(root, candidates, "available fields")));
    }

    private void checkTools(Map<String, NodeConfig> nodes, List<Violation> out) {
        if (knownTools == null) return;
        for (NodeConfig n : nodes.values()) {
            for (String tool : n.getTools()) {
                if (!knownTools.contains(tool)) {
                    out.add(new Violation("nodes[" + n.getId() + "].tools", "unknown tool '" + tool + "'",
                            NearestMatch.suggestion(tool, knownTools, "registered tools")));
                }
            }
        }
    }

    private static Map<String, List<String>> successors(List<EdgeConfig> edges, Set<String> nodeIds) {
        Map<String, List<String>> out = new HashMap<>();
        for (EdgeConfig e : edges) {
            List<String> list = out.computeIfAbsent(e.getFrom(), k -> new ArrayList<>());
            for (String t : e.allTargets()) {
                if (nodeIds.contains(t) || EdgeConfig.END.equals(t)) list.add(t);
            }
        }
        return out;
    }

    private static void checkReachability(Map<String, NodeConfig> nodes, Map<String, List<String>> successors,
                                          List<Violation> out) {
        Set<String> reachable = walk(EdgeConfig.START, successors);
        Map<String, List<String>> predecessors = new HashMap<>();
        for (Map.Entry<String, List<String>> e : successors.entrySet()) {
            for (String t : e.getValue()) {
                predecessors.computeIfAbsent(t, k -> new ArrayList<>()).add(e.getKey());
            }
        }
        Set<String> reachesEnd = walk(EdgeConfig.END, predecessors);
        if (!reachable.contains(EdgeConfig.END) && successors.containsKey(EdgeConfig.START)) {
            out.add(Violation.of("edges", "no path from START to END"));
        }
        for (String id : nodes.keySet()) {
            String path = "nodes[" + id + "]";
            if (!reachable.contains(id)) {
                out.add(new Violation(path, "node '" + id + "' is not reachable from START",
                        "add an edge into '" + id + "' or remove the node"));
            }
            if (!successors.containsKey(id)) {
                out.add(new Violation(path, "node '" + id + "' has no outgoing edge",
                        "add {from: " + id + ", to: END} to end the workflow here"));
            } else if (!reachesEnd.contains(id)) {
                out.add(Violation.of(path, "node '" + id + "' has no path to END"));
            }
        }
    }

    private static void checkLoopConditions(List<EdgeConfig> edges, List<String> labels, Map<String, NodeConfig> nodes,
                                            Map<String, FieldType> stateTypes, Map<String, List<String>> successors,
                                            List<Violation> out) {
        for (int i = 0; i < edges.size(); i++) {
            EdgeConfig e = edges.get(i);
            if (!e.hasLoop() || !nodes.containsKey(e.getFrom())) continue;
            String path = labels.get(i) + ".loop.condition_field";
            String field = e.getLoop().getConditionField();
            FieldType type = stateTypes.get(field);
            if (type == null) {
                out.add(new Violation(path, "condition_field '" + field + "' is not a state field",
                        NearestMatch.suggestion(field, stateTypes.keySet(), "state fields")));
                continue;
            }
            if (type.getKind() != FieldKind.BOOLEAN) {
                out.add(Violation.of(path, "condition_field '" + field + "' must be bool, got '" + type + "'"));
            }
            boolean produced = false;
            for (NodeConfig n : nodes.values()) {
                if (n.getOutputs().contains(field) && walk(n.getId(), successors).contains(e.getFrom())) {
                    produced = true;
                    break;
                }
            }
            if (!produced) {
                out.add(new Violation(path, "condition_field '" + field + "' is not written by any node upstream of '"
                        + e.getFrom() + "'", "add '" + field + "' to the outputs of '" + e.getFrom() + "'"));
            }
        }
    }

    /** Nodes reachable from {@code origin}, including origin itself. */
    private static Set<String> walk(String origin, Map<String, List<String>> adjacency) {
        Set<String> seen = new LinkedHashSet<>();
        Deque<String> queue = new ArrayDeque<>();
        seen.add(origin);
        queue.add(origin);
        while (!queue.isEmpty()) {
            String current = queue.poll();
            for (String next : adjacency.getOrDefault(current, List.of())) {
                if (seen.add(next)) queue.add(next);
            }
        }
        return seen;
    }

    private static String edgePath(int index, EdgeConfig e) {
        return "edges[" + index + "] (" + e.describe() + ")";
    }

    /** Error labels for {@link WorkflowConfig#effectiveEdges()}: declared edges by index, node loops by node. */
    private static List<String> edgeLabels(int declared, List<EdgeConfig> edges) {
        List<String> labels = new ArrayList<>(edges.size());
        for (int i = 0; i < edges.size(); i++) {
            EdgeConfig e = edges.get(i);
            labels.add(i < declared ? edgePath(i, e) : "nodes[" + e.getFrom() + "] (" + e.describe() + ")");
        }
        return labels;
    }
}
