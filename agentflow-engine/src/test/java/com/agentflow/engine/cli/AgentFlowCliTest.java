package com.agentflow.engine.cli;

import com.agentflow.engine.node.NodeResult;
import com.agentflow.engine.run.RunOrchestrator;
import com.agentflow.ledger.NodeMetrics;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AgentFlowCliTest {

    private static final String WORKFLOW = """
            flow: {name: greeter}
            state:
              fields:
                - {name: name, type: str, required: true}
                - {name: times, type: int, default: 1}
                - {name: greeting, type: str}
            nodes:
              - id: greet
                prompt: "Greet {state.name} {state.times} times"
                outputs: [greeting]
                output_schema: {type: str}
            edges:
              - {from: START, to: greet}
              - {from: greet, to: END}
            """;

    @TempDir
    Path dir;

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    private static final Supplier<RunOrchestrator> ORCHESTRATOR = () -> RunOrchestrator.builder()
            .nodeHandler((node, state) -> new NodeResult(node.getId(),
                    Map.of("greeting", "Hello " + state.get("name") + " x" + state.get("times")), NodeMetrics.none()))
            .build();

    private int execute(String... args) {
        return AgentFlowCli.execute(args, new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8), ORCHESTRATOR);
    }

    private Path write(String name, String content) throws IOException {
        Path file = dir.resolve(name);
        Files.writeString(file, content);
        return file;
    }

    private String stdout() {
        return out.toString(StandardCharsets.UTF_8);
    }

    @Test
    void validate_validWorkflowExitsZero() throws IOException {
        Path file = write("greeter.yaml", WORKFLOW);

        assertEquals(AgentFlowCli.EXIT_OK, execute("validate", file.toString()));
        assertTrue(stdout().contains("\"valid\" : true"), stdout());
    }

    @Test
    void validate_invalidWorkflowListsViolations() throws IOException {
        Path file = write("broken.yaml", WORKFLOW.replace("to: END", "to: ED"));

        assertEquals(AgentFlowCli.EXIT_FAILED, execute("validate", file.toString()));
        assertTrue(stdout().contains("\"violations\""), stdout());
        assertTrue(stdout().contains("ED"), stdout());
    }

    @Test
    void validate_unreadableFileReportsLoadError() {
        assertEquals(AgentFlowCli.EXIT_FAILED, execute("validate", dir.resolve("missing.yaml").toString()));
        assertTrue(stdout().contains("config_load"), stdout());
    }

    @Test
    void run_printsOutcomeAndExitsZero() throws IOException {
        Path file = write("greeter.yaml", WORKFLOW);

        assertEquals(AgentFlowCli.EXIT_OK, execute("run", file.toString(), "name=Ada", "times=3"));
        assertTrue(stdout().contains("\"status\" : \"succeeded\""), stdout());
        assertTrue(stdout().contains("Hello Ada x3"), stdout());
    }

    @Test
    void run_failedRunExitsOne() throws IOException {
        Path file = write("greeter.yaml", WORKFLOW);

        assertEquals(AgentFlowCli.EXIT_FAILED, execute("run", file.toString()));
        assertTrue(stdout().contains("state_initialization"), stdout());
    }

    @Test
    void execute_usageErrors() {
        assertEquals(AgentFlowCli.EXIT_USAGE, execute());
        assertEquals(AgentFlowCli.EXIT_USAGE, execute("deploy", "x.yaml"));
        assertEquals(AgentFlowCli.EXIT_USAGE, execute("run", "x.yaml", "novalue"));
        assertTrue(err.toString(StandardCharsets.UTF_8).contains("Usage:"));
    }

    @Test
    void parseInputs_readsJsonValuesAndFallsBackToText() {
        Map<String, Object> inputs = AgentFlowCli.parseInputs(List.of(
                "count=3", "tags=[\"a\",\"b\"]", "topic=AI safety", "label=3 apples", "flag=true"));

        assertEquals(3, inputs.get("count"));
        assertEquals(List.of("a", "b"), inputs.get("tags"));
        assertEquals("AI safety", inputs.get("topic"));
        assertEquals("3 apples", inputs.get("label"));
        assertEquals(true, inputs.get("flag"));
    }

    @Test
    void parseInputs_rejectsMissingKey() {
        assertThrows(IllegalArgumentException.class, () -> AgentFlowCli.parseInputs(List.of("=3")));
    }
}
