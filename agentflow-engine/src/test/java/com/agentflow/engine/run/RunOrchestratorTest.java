package com.agentflow.engine.run;

import com.agentflow.config.EngineSettings;
import com.agentflow.engine.graph.ForkJoinEdge;
import com.agentflow.engine.node.NodeHandler;
import com.agentflow.engine.node.NodeResult;
import com.agentflow.engine.output.OutputValidationException;
import com.agentflow.ledger.InMemoryRunRepository;
import com.agentflow.ledger.NodeMetrics;
import com.agentflow.ledger.RunCompletion;
import com.agentflow.ledger.RunRecord;
import com.agentflow.ledger.RunRepository;
import com.agentflow.ledger.RunStatus;
import com.agentflow.llm.ChatMessage;
import com.agentflow.llm.LlmClient;
import com.agentflow.llm.LlmResponse;
import com.agentflow.llm.StructuredResponse;
import com.agentflow.llm.ToolSpec;
import com.agentflow.workflow.WorkflowConfigs;
import com.agentflow.workflow.config.WorkflowConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RunOrchestratorTest {

    private static final String STATE = """
            flow: {name: article, version: "1.0"}
            state:
              fields:
                - {name: topic, type: str, required: true}
                - {name: output, type: str}
                - {name: score, type: int, default: 0}
                - {name: done, type: bool, default: false}
                - {name: pros, type: str}
                - {name: cons, type: str}
                - {name: verdict, type: str}
                - {name: notes, type: "list[str]", default: []}
            """;

    private static final String LINEAR = STATE + """
            nodes:
              - id: draft
                prompt: "Write about {state.topic}"
                outputs: [output]
                output_schema: {type: str}
            edges:
              - {from: START, to: draft}
              - {from: draft, to: END}
            """;

    private final List<RunOrchestrator> opened = new ArrayList<>();
    private final InMemoryRunRepository repository = new InMemoryRunRepository();

    @AfterEach
    void closeOrchestrators() {
        opened.forEach(RunOrchestrator::close);
    }

    private RunOrchestrator orchestrator(NodeHandler handler) {
        return track(RunOrchestrator.builder().nodeHandler(handler).repository(repository).build());
    }

    private RunOrchestrator track(RunOrchestrator orchestrator) {
        opened.add(orchestrator);
        return orchestrator;
    }

    private static WorkflowConfig parse(String yaml) {
        return WorkflowConfigs.fromYaml(yaml);
    }

    private static NodeResult result(String nodeId, Map<String, Object> delta) {
        return new NodeResult(nodeId, delta, NodeMetrics.none());
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("interrupted");
        }
    }

    @Test
    void run_linearWorkflowWritesNodeOutput() {
        RunOrchestrator orchestrator = orchestrator((node, state) ->
                result(node.getId(), Map.of("output", "An essay about " + state.get("topic"))));

        RunOutcome outcome = orchestrator.run(parse(LINEAR), Map.of("topic", "x"));

        assertTrue(outcome.isSucceeded(), outcome::toString);
        assertEquals("An essay about x", outcome.getState().get("output"));
        assertEquals(1, outcome.getMetrics().getNodeCount());
        assertNotNull(outcome.getRunId());
        InMemoryRunRepository.StoredRun stored = repository.find(outcome.getRunId()).orElseThrow();
        assertEquals(RunStatus.SUCCEEDED, stored.getStatus());
        assertEquals("article", stored.getRecord().getWorkflowName());
        assertEquals("An essay about x", stored.getCompletion().getFinalState().get("output"));
    }

    @Test
    void run_conditionalTakesDefaultWhenConditionFails() {
        List<String> visited = new CopyOnWriteArrayList<>();
        RunOrchestrator orchestrator = orchestrator((node, state) -> {
            visited.add(node.getId());
            return node.getId().equals("draft")
                    ? result("draft", Map.of("score", 5))
                    : result(node.getId(), Map.of("output", "rewritten"));
        });
        WorkflowConfig config = parse(STATE + """
                nodes:
                  - id: draft
                    prompt: "Score {state.topic}"
                    outputs: [score]
                    output_schema: {type: int}
                  - id: rewrite
                    prompt: "Rewrite {state.topic}"
                    outputs: [output]
                    output_schema: {type: str}
                edges:
                  - {from: START, to: draft}
                  - from: draft
                    routes:
                      - {condition: "state.score >= 8", to: END}
                      - {condition: default, to: rewrite}
                  - {from: rewrite, to: END}
                """);

        RunOutcome outcome = orchestrator.run(config, Map.of("topic", "x"));

        assertTrue(outcome.isSucceeded(), outcome::toString);
        assertEquals(List.of("draft", "rewrite"), visited);
        assertEquals(5L, outcome.getState().get("score"));
        assertEquals("rewritten", outcome.getState().get("output"));
    }

    private static final String LOOP = STATE + """
            nodes:
              - id: refine
                prompt: "Refine {state.topic}"
                outputs: [output, done]
                output_schema:
                  type: object
                  fields:
                    - {name: output, type: str}
                    - {name: done, type: bool}
            edges:
              - {from: START, to: refine}
              - from: refine
                loop: {max_iterations: 3, condition_field: done, exit_to: END}
            """;

    @Test
    void run_loopExitsAfterExactlyMaxIterations() {
        AtomicInteger calls = new AtomicInteger();
        RunOrchestrator orchestrator = orchestrator((node, state) -> {
            int n = calls.incrementAndGet();
            return result(node.getId(), Map.of("output", "v" + n, "done", false));
        });

        RunOutcome outcome = orchestrator.run(parse(LOOP), Map.of("topic", "x"));

        assertTrue(outcome.isSucceeded(), outcome::toString);
        assertEquals(3, calls.get());
        assertEquals("v3", outcome.getState().get("output"));
        assertEquals(List.of("refine"), outcome.getMetrics().getLoopCapHits());
        assertNull(outcome.getError());
    }

    @Test
    void run_loopExitsEarlyOnConditionField() {
        AtomicInteger calls = new AtomicInteger();
        RunOrchestrator orchestrator = orchestrator((node, state) -> {
            int n = calls.incrementAndGet();
            return result(node.getId(), Map.of("output", "v" + n, "done", n == 2));
        });

        RunOutcome outcome = orchestrator.run(parse(LOOP), Map.of("topic", "x"));

        assertEquals(2, calls.get());
        assertTrue(outcome.getMetrics().getLoopCapHits().isEmpty());
    }

    @Test
    void run_loopCountersResetBetweenRuns() {
        AtomicInteger calls = new AtomicInteger();
        RunOrchestrator orchestrator = orchestrator((node, state) -> {
            calls.incrementAndGet();
            return result(node.getId(), Map.of("output", "v", "done", false));
        });

        orchestrator.run(parse(LOOP), Map.of("topic", "x"));
        orchestrator.run(parse(LOOP), Map.of("topic", "y"));

        assertEquals(6, calls.get());
    }

    private static final String FORK = STATE + """
            nodes:
              - id: a
                prompt: "Pros of {state.topic}"
                outputs: [pros, notes, verdict]
                output_schema:
                  type: object
                  fields:
                    - {name: pros, type: str}
                    - {name: notes, type: "list[str]"}
                    - {name: verdict, type: str}
              - id: b
                prompt: "Cons of {state.topic}"
                outputs: [cons, notes, verdict]
                output_schema:
                  type: object
                  fields:
                    - {name: cons, type: str}
                    - {name: notes, type: "list[str]"}
                    - {name: verdict, type: str}
              - id: summarize
                prompt: "Summarize {state.pros} and {state.cons}"
                outputs: [output]
                output_schema: {type: str}
            edges:
              - {from: START, to: [a, b]}
              - {from: a, to: summarize}
              - {from: b, to: summarize}
              - {from: summarize, to: END}
            """;

    @Test
    void run_forkBranchesSeePreForkSnapshotAndJoinMergesBoth() {
        Map<String, Map<String, Object>> seen = Collections.synchronizedMap(new HashMap<>());
        CountDownLatch bothStarted = new CountDownLatch(2);
        AtomicInteger concurrent = new AtomicInteger();
        RunOrchestrator orchestrator = orchestrator((node, state) -> {
            seen.put(node.getId(), state.asMap());
            switch (node.getId()) {
                case "a":
                    bothStarted.countDown();
                    if (await(bothStarted)) concurrent.incrementAndGet();
                    return result("a", Map.of("pros", "cheap", "notes", List.of("from a"), "verdict", "a"));
                case "b":
                    bothStarted.countDown();
                    if (await(bothStarted)) concurrent.incrementAndGet();
                    return result("b", Map.of("cons", "slow", "notes", List.of("from b"), "verdict", "b"));
                default:
                    return result(node.getId(), Map.of("output", state.get("pros") + "/" + state.get("cons")));
            }
        });

        RunOutcome outcome = orchestrator.run(parse(FORK), Map.of("topic", "x"));

        assertTrue(outcome.isSucceeded(), outcome::toString);
        assertEquals(2, concurrent.get());
        assertNull(seen.get("a").get("cons"));
        assertNull(seen.get("b").get("pros"));
        assertEquals("cheap/slow", outcome.getState().get("output"));
        assertEquals(3, outcome.getMetrics().getNodeCount());
    }

    private static boolean await(CountDownLatch latch) {
        try {
            return latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    @Test
    void run_forkMergesInDeclarationOrderRegardlessOfCompletionOrder() {
        RunOrchestrator orchestrator = orchestrator((node, state) -> {
            switch (node.getId()) {
                case "a":
                    sleep(200);
                    return result("a", Map.of("pros", "p", "notes", List.of("from a"), "verdict", "a"));
                case "b":
                    return result("b", Map.of("cons", "c", "notes", List.of("from b"), "verdict", "b"));
                default:
                    return result(node.getId(), Map.of("output", "done"));
            }
        });

        RunOutcome outcome = orchestrator.run(parse(FORK), Map.of("topic", "x"));

        assertEquals(List.of("from a", "from b"), outcome.getState().get("notes"));
        assertEquals("b", outcome.getState().get("verdict"));
    }

    @Test
    void run_forkBranchFailureFailsRun() {
        RunOrchestrator orchestrator = orchestrator((node, state) -> {
            if (node.getId().equals("b")) {
                throw new OutputValidationException("b", 3, List.of("missing field 'cons' (str)"));
            }
            return result(node.getId(), Map.of("pros", "p", "notes", List.of(), "verdict", "a"));
        });

        RunOutcome outcome = orchestrator.run(parse(FORK), Map.of("topic", "x"));

        assertFalse(outcome.isSucceeded());
        assertEquals(ErrorKind.OUTPUT_VALIDATION, outcome.getError().getKind());
        assertEquals("b", outcome.getError().getNodeId());
    }

    @Test
    void run_timeoutFailsWithPartialState() {
        RunOrchestrator orchestrator = orchestrator((node, state) -> {
            if (node.getId().equals("draft")) {
                return result("draft", Map.of("output", "first pass"));
            }
            sleep(10_000);
            return result(node.getId(), Map.of("verdict", "too late"));
        });
        WorkflowConfig config = parse(STATE + """
                nodes:
                  - id: draft
                    prompt: "Write about {state.topic}"
                    outputs: [output]
                    output_schema: {type: str}
                  - id: review
                    prompt: "Review {state.output}"
                    outputs: [verdict]
                    output_schema: {type: str}
                edges:
                  - {from: START, to: draft}
                  - {from: draft, to: review}
                  - {from: review, to: END}
                config:
                  execution: {timeout: 1}
                """);

        long start = System.nanoTime();
        RunOutcome outcome = orchestrator.run(config, Map.of("topic", "x"));
        long elapsedMs = (System.nanoTime() - start) / 1_000_000L;

        assertEquals(ErrorKind.TIMEOUT, outcome.getError().getKind());
        assertEquals("first pass", outcome.getState().get("output"));
        assertNull(outcome.getState().get("verdict"));
        assertTrue(elapsedMs < 5_000, "took " + elapsedMs + "ms");
        assertEquals("timeout", repository.find(outcome.getRunId()).orElseThrow().getCompletion().getErrorKind());
    }

    @Test
    void run_failingRepositoryNeverFailsRun() {
        RunRepository broken = new RunRepository() {
            @Override
            public String create(RunRecord run) {
                throw new IllegalStateException("database unavailable");
            }

            @Override
            public void update(String runId, RunCompletion completion) {
                throw new IllegalStateException("database unavailable");
            }
        };
        RunOrchestrator orchestrator = track(RunOrchestrator.builder()
                .nodeHandler((node, state) -> result(node.getId(), Map.of("output", "ok")))
                .repository(broken)
                .build());

        RunOutcome outcome = orchestrator.run(parse(LINEAR), Map.of("topic", "x"));

        assertTrue(outcome.isSucceeded(), outcome::toString);
        assertTrue(outcome.getRunId().startsWith("local-"));
    }

    @Test
    void run_disabledLedgerRecordsNothing() {
        RunOrchestrator orchestrator = track(RunOrchestrator.builder()
                .settings(EngineSettings.builder().runLedgerEnabled(false).build())
                .nodeHandler((node, state) -> result(node.getId(), Map.of("output", "ok")))
                .repository(repository)
                .build());

        assertTrue(orchestrator.run(parse(LINEAR), Map.of("topic", "x")).isSucceeded());
        assertEquals(0, repository.size());
    }

    private static String gated(String onFail) {
        return LINEAR + """
                config:
                  gates:
                    on_fail: %s
                    gates:
                      - {metric: total_tokens, max: 50}
                      - {metric: node_count, min: 1}
                """.formatted(onFail);
    }

    private static final NodeHandler EXPENSIVE = (node, state) -> new NodeResult(node.getId(), Map.of("output", "long"),
            new NodeMetrics(12, 60, 40, BigDecimal.ZERO, "llama3.2", "ollama", 0, 1));

    @Test
    void run_failingGateWithFailActionFailsRun() {
        RunOutcome outcome = orchestrator(EXPENSIVE).run(parse(gated("fail")), Map.of("topic", "x"));

        assertFalse(outcome.isSucceeded());
        assertEquals(ErrorKind.QUALITY_GATE, outcome.getError().getKind());
        assertEquals("long", outcome.getState().get("output"));
        assertEquals(1, outcome.getGates().getFailed().size());
        assertEquals("total_tokens", outcome.getGates().getFailed().get(0).getMetric());
    }

    @Test
    void run_failingGateWithBlockDeploySucceedsAndBlocks() {
        RunOrchestrator orchestrator = orchestrator(EXPENSIVE);

        RunOutcome outcome = orchestrator.run(parse(gated("block_deploy")), Map.of("topic", "x"));

        assertTrue(outcome.isSucceeded(), outcome::toString);
        assertTrue(outcome.isDeployBlocked());
        assertTrue(orchestrator.getDeployBlocks().isBlocked("article"));
        assertTrue(repository.find(outcome.getRunId()).orElseThrow().getCompletion().isDeployBlocked());
    }

    @Test
    void run_failingGateWithWarnOnlyReports() {
        RunOrchestrator orchestrator = orchestrator(EXPENSIVE);

        RunOutcome outcome = orchestrator.run(parse(gated("warn")), Map.of("topic", "x"));

        assertTrue(outcome.isSucceeded(), outcome::toString);
        assertFalse(outcome.getGates().allPassed());
        assertFalse(outcome.isDeployBlocked());
        assertFalse(orchestrator.getDeployBlocks().isBlocked("article"));
    }

    @Test
    void run_nodeWithoutBreakOnErrorIsSkipped() {
        RunOrchestrator orchestrator = orchestrator((node, state) -> {
            if (node.getId().equals("enrich")) {
                throw new IllegalStateException("search backend down");
            }
            return result(node.getId(), Map.of("output", "written anyway"));
        });
        WorkflowConfig config = parse(STATE + """
                nodes:
                  - id: enrich
                    prompt: "Find notes on {state.topic}"
                    outputs: [notes]
                    output_schema: {type: "list[str]"}
                    break_on_error: false
                  - id: draft
                    prompt: "Write about {state.topic}"
                    outputs: [output]
                    output_schema: {type: str}
                edges:
                  - {from: START, to: enrich}
                  - {from: enrich, to: draft}
                  - {from: draft, to: END}
                """);

        RunOutcome outcome = orchestrator.run(config, Map.of("topic", "x"));

        assertTrue(outcome.isSucceeded(), outcome::toString);
        assertEquals("written anyway", outcome.getState().get("output"));
        assertEquals(List.of(), outcome.getState().get("notes"));
        assertEquals(1, outcome.getNodeErrors().size());
        assertEquals("enrich", outcome.getNodeErrors().get(0).getNodeId());
        assertEquals(ErrorKind.NODE_EXECUTION, outcome.getNodeErrors().get(0).getKind());
    }

    @Test
    void run_failedNodeTokensCountTowardRunTotals() {
        RunOrchestrator orchestrator = orchestrator((node, state) -> {
            if (node.getId().equals("enrich")) {
                throw new OutputValidationException("enrich", 3, List.of("missing field 'result' (list[str])"),
                        new NodeMetrics(7, 90, 30, new BigDecimal("0.000050"), "gemini-1.5-flash", "google", 0, 3));
            }
            return new NodeResult(node.getId(), Map.of("output", "written anyway"),
                    new NodeMetrics(3, 10, 5, BigDecimal.ZERO, "llama3.2", "ollama", 0, 1));
        });
        WorkflowConfig config = parse(STATE + """
                nodes:
                  - id: enrich
                    prompt: "Find notes on {state.topic}"
                    outputs: [notes]
                    output_schema: {type: "list[str]"}
                    break_on_error: false
                  - id: draft
                    prompt: "Write about {state.topic}"
                    outputs: [output]
                    output_schema: {type: str}
                edges:
                  - {from: START, to: enrich}
                  - {from: enrich, to: draft}
                  - {from: draft, to: END}
                config:
                  gates:
                    on_fail: fail
                    gates:
                      - {metric: total_tokens, max: 100}
                """);

        RunOutcome outcome = orchestrator.run(config, Map.of("topic", "x"));

        assertEquals(135, outcome.getMetrics().getTotalTokens());
        assertEquals(0, new BigDecimal("0.000050").compareTo(outcome.getMetrics().getCostUsd()));
        assertFalse(outcome.isSucceeded());
        assertEquals(ErrorKind.QUALITY_GATE, outcome.getError().getKind());
    }

    @Test
    void run_routeConditionTypoIsRejectedBeforeExecution() {
        AtomicInteger calls = new AtomicInteger();
        RunOrchestrator orchestrator = orchestrator((node, state) -> {
            calls.incrementAndGet();
            return result(node.getId(), Map.of("score", 9));
        });
        String body = STATE + """
                nodes:
                  - id: review
                    prompt: "Score {state.topic}"
                    outputs: [score]
                    output_schema: {type: int}
                  - id: rewrite
                    prompt: "Rewrite {state.topic}"
                    outputs: [output]
                    output_schema: {type: str}
                edges:
                  - {from: START, to: review}
                  - from: review
                    routes:
                      - {condition: "%s", to: END}
                      - {condition: default, to: rewrite}
                  - {from: rewrite, to: END}
                """;

        assertFalse(orchestrator.validate(parse(body.formatted("state.score >>= 8"))).isValid());
        assertFalse(orchestrator.validate(parse(body.formatted("scroe >= 8"))).isValid());
        RunOutcome outcome = orchestrator.run(parse(body.formatted("scroe >= 8")), Map.of("topic", "x"));

        assertEquals(ErrorKind.CONFIG_VALIDATION, outcome.getError().getKind());
        assertEquals("edges[1].routes[0].condition", outcome.getError().getViolations().get(0).getPath());
        assertEquals(0, calls.get());
    }

    @Test
    void run_nodeFailureStopsRunWithPartialState() {
        RunOrchestrator orchestrator = orchestrator((node, state) -> {
            throw new OutputValidationException(node.getId(), 3, List.of("missing field 'result' (str)"));
        });

        RunOutcome outcome = orchestrator.run(parse(LINEAR), Map.of("topic", "x"));

        assertFalse(outcome.isSucceeded());
        assertEquals(ErrorKind.OUTPUT_VALIDATION, outcome.getError().getKind());
        assertEquals("draft", outcome.getError().getNodeId());
        assertEquals("x", outcome.getState().get("topic"));
        RunCompletion completion = repository.find(outcome.getRunId()).orElseThrow().getCompletion();
        assertEquals(RunStatus.FAILED, completion.getStatus());
        assertEquals("output_validation", completion.getErrorKind());
    }

    @Test
    void run_invalidConfigNeverExecutesNodes() {
        AtomicInteger calls = new AtomicInteger();
        RunOrchestrator orchestrator = orchestrator((node, state) -> {
            calls.incrementAndGet();
            return result(node.getId(), Map.of());
        });

        RunOutcome outcome = orchestrator.run(parse(LINEAR.replace("to: END", "to: ENDD")), Map.of("topic", "x"));

        assertEquals(ErrorKind.CONFIG_VALIDATION, outcome.getError().getKind());
        assertFalse(outcome.getError().getViolations().isEmpty());
        assertNull(outcome.getRunId());
        assertEquals(0, calls.get());
        assertEquals(0, repository.size());
    }

    @Test
    void run_missingRequiredInputFailsBeforeExecution() {
        RunOutcome outcome = orchestrator((node, state) -> result(node.getId(), Map.of()))
                .run(parse(LINEAR), Map.of());

        assertEquals(ErrorKind.STATE_INITIALIZATION, outcome.getError().getKind());
        assertTrue(outcome.getError().getMessage().contains("topic"), outcome.getError().getMessage());
        assertNull(outcome.getRunId());
        assertEquals(0, repository.size());
    }

    @Test
    void run_loadsWorkflowFromFile() throws Exception {
        Path file = Path.of(getClass().getResource("/workflows/pros-cons.yaml").toURI());
        RunOrchestrator orchestrator = orchestrator((node, state) -> {
            switch (node.getId()) {
                case "advocate":
                    return result("advocate", Map.of("pros", "fast"));
                case "critic":
                    return result("critic", Map.of("cons", "costly"));
                default:
                    return result(node.getId(), Map.of("summary", state.get("pros") + " but " + state.get("cons")));
            }
        });

        RunOutcome outcome = orchestrator.run(file, Map.of("topic", "rewrites"));

        assertTrue(outcome.isSucceeded(), outcome::toString);
        assertEquals("pros-cons", outcome.getWorkflowName());
        assertEquals("fast but costly", outcome.getState().get("summary"));
        assertEquals("1.2", repository.find(outcome.getRunId()).orElseThrow().getRecord().getWorkflowVersion());
    }

    @Test
    void run_missingFileIsConfigLoadError() {
        RunOutcome outcome = orchestrator((node, state) -> result(node.getId(), Map.of()))
                .run(Path.of("does-not-exist.yaml"), Map.of());

        assertEquals(ErrorKind.CONFIG_LOAD, outcome.getError().getKind());
        assertNull(outcome.getRunId());
    }

    @Test
    void compile_neverCallsModel() {
        AtomicInteger clients = new AtomicInteger();
        RunOrchestrator orchestrator = track(RunOrchestrator.builder()
                .llmClients(options -> {
                    clients.incrementAndGet();
                    throw new AssertionError("no model call expected");
                })
                .build());

        assertTrue(orchestrator.validate(parse(FORK)).isValid());
        assertEquals("summarize", ((ForkJoinEdge) orchestrator.compile(parse(FORK)).entryEdge()).getJoinNode());
        assertEquals(0, clients.get());
    }

    @Test
    void run_endToEndThroughNodeExecutor() throws Exception {
        List<List<ChatMessage>> prompts = new CopyOnWriteArrayList<>();
        LlmClient model = new LlmClient() {
            @Override
            public LlmResponse invokeWithTools(List<ChatMessage> messages, List<ToolSpec> tools) {
                throw new AssertionError("no tools bound");
            }

            @Override
            public StructuredResponse invokeStructured(List<ChatMessage> messages, Map<String, Object> jsonSchema) {
                prompts.add(List.copyOf(messages));
                return StructuredResponse.of(Map.of("result", "An essay about x"));
            }
        };
        RunOrchestrator orchestrator = track(RunOrchestrator.builder()
                .llmClients(options -> model)
                .repository(repository)
                .build());

        RunOutcome outcome = orchestrator.run(parse(LINEAR), Map.of("topic", "x"));

        assertTrue(outcome.isSucceeded(), outcome::toString);
        assertEquals("An essay about x", outcome.getState().get("output"));
        assertEquals("Write about x", prompts.get(0).get(0).getContent());
        String json = WorkflowConfigs.jsonMapper().writeValueAsString(outcome);
        assertTrue(json.contains("\"status\":\"succeeded\""), json);
        assertTrue(json.contains("\"run_id\":\"" + outcome.getRunId() + "\""), json);
    }
}
