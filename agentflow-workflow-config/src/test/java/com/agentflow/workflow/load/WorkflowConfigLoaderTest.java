package com.agentflow.workflow.load;

import com.agentflow.workflow.config.EdgeConfig;
import com.agentflow.workflow.config.GateAction;
import com.agentflow.workflow.config.WorkflowConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class WorkflowConfigLoaderTest {

    @TempDir
    Path tempDir;

    private static Path resource(String name) throws URISyntaxException {
        return Path.of(WorkflowConfigLoaderTest.class.getResource("/workflows/" + name).toURI());
    }

    @Test
    void load_readsYamlDocument() throws Exception {
        WorkflowConfig config = WorkflowConfigLoader.load(resource("draft-review.yaml"));

        assertEquals("draft-review", config.getName());
        assertEquals("1.2.0", config.getFlow().getVersion());
        assertEquals(4, config.getState().getFields().size());
        assertEquals(3, config.getNodes().size());
        EdgeConfig routes = config.getEdges().get(2);
        assertTrue(routes.hasRoutes());
        assertEquals("state.score >= 8", routes.getRoutes().get(0).getLogic());
        assertTrue(routes.getRoutes().get(1).isDefault());
        assertEquals(GateAction.BLOCK_DEPLOY, config.getConfig().getGates().getOnFail());
        assertEquals(60, config.getConfig().getExecution().getTimeout());
    }

    @Test
    void load_readsJsonDocument() throws Exception {
        Path file = tempDir.resolve("linear.json");
        Files.writeString(file, """
                {"flow":{"name":"linear"},
                 "state":{"fields":{"topic":"str","output":{"type":"str"}}},
                 "nodes":[{"id":"draft","prompt":"About {topic}","outputs":["output"],"output_schema":{"type":"str"}}],
                 "edges":[{"from":"START","to":"draft"},{"from":"draft","to":"END"}]}
                """);

        WorkflowConfig config = WorkflowConfigLoader.load(file);

        assertEquals("linear", config.getName());
        assertEquals("output", config.getState().getFields().get(1).getName());
        assertEquals("str", config.getState().getFields().get(0).getType());
    }

    @Test
    void load_missingFileNamesPath() {
        Path missing = tempDir.resolve("nope.yaml");

        WorkflowConfigLoadException e = assertThrows(WorkflowConfigLoadException.class,
                () -> WorkflowConfigLoader.load(missing));

        assertTrue(e.getMessage().contains("Config file not found"));
        assertEquals(missing.toString(), e.getSource());
    }

    @Test
    void parse_malformedDocumentFails() {
        WorkflowConfigLoadException e = assertThrows(WorkflowConfigLoadException.class,
                () -> WorkflowConfigLoader.parse("{\"flow\": [", false, "inline"));

        assertTrue(e.getMessage().startsWith("Failed to parse config inline"));
    }

    @Test
    void parse_emptyDocumentFails() {
        assertThrows(WorkflowConfigLoadException.class, () -> WorkflowConfigLoader.parse("  ", true, "inline"));
    }

    @Test
    void isYaml_byExtension() {
        assertTrue(WorkflowConfigLoader.isYaml(Path.of("flow.yml")));
        assertTrue(WorkflowConfigLoader.isYaml(Path.of("flow.YAML")));
        assertFalse(WorkflowConfigLoader.isYaml(Path.of("flow.json")));
    }
}
