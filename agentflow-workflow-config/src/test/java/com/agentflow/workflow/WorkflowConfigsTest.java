package com.agentflow.workflow;

import com.agentflow.workflow.config.EdgeConfig;
import com.agentflow.workflow.config.LlmSettings;
import com.agentflow.workflow.config.NodeConfig;
import com.agentflow.workflow.config.WorkflowConfig;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class WorkflowConfigsTest {

    private static final String FORK_YAML = """
            flow:
              name: pros-cons
            state:
              fields:
                - {name: topic, type: str, required: true}
                - {name: pros, type: str}
                - {name: cons, type: str}
                - {name: done, type: bool, default: false}
            nodes:
              - id: a
                prompt: "Pros of {state.topic}"
                outputs: [pros]
                output_schema: {type: str}
                tools: [echo, {name: search}]
              - id: b
                prompt: "Cons of {state.topic}"
                outputs: [cons, done]
                output_schema:
                  type: object
                  fields:
                    - {name: cons, type: str}
                    - {name: done, type: bool}
                break_on_error: false
                loop:
                  max_iterations: 3
                  condition_field: done
            edges:
              - from: START
                to: [a, b]
              - from: a
                to: END
            """;

    @Test
    void fromYaml_parsesForkListAndToolForms() {
        WorkflowConfig config = WorkflowConfigs.fromYaml(FORK_YAML);

        EdgeConfig fork = config.getEdges().get(0);
        assertTrue(fork.isFanOut());
        assertEquals(List.of("a", "b"), fork.getTargets());
        assertFalse(config.getEdges().get(1).isFanOut());

        NodeConfig a = config.findNode("a").orElseThrow();
        assertEquals(List.of("echo", "search"), a.getTools());
        assertTrue(a.isBreakOnError());
        NodeConfig b = config.findNode("b").orElseThrow();
        assertFalse(b.isBreakOnError());
        assertEquals(EdgeConfig.END, b.getLoop().getExitTo());
        assertEquals(Boolean.FALSE, config.getState().findField("done").orElseThrow().getDefaultValue());
    }

    @Test
    void effectiveEdges_appendsNodeLevelLoops() {
        WorkflowConfig config = WorkflowConfigs.fromYaml(FORK_YAML);

        List<EdgeConfig> edges = config.effectiveEdges();

        assertEquals(3, edges.size());
        EdgeConfig loop = edges.get(2);
        assertEquals("b", loop.getFrom());
        assertTrue(loop.hasLoop());
        assertEquals(List.of("b", "END"), loop.allTargets());
    }

    @Test
    void toJson_roundTripsEdgeVariants() {
        WorkflowConfig config = WorkflowConfigs.fromYaml(FORK_YAML);

        WorkflowConfig again = WorkflowConfigs.fromJson(WorkflowConfigs.toJson(config));

        assertEquals(config.getEdges(), again.getEdges());
        assertEquals(config.getNodes(), again.getNodes());
        assertEquals(config.getState(), again.getState());
    }

    @Test
    void llmSettings_overrideMergesFieldByField() {
        LlmSettings global = new LlmSettings("ollama", "llama3.2", 0.7, 512, null);
        LlmSettings node = new LlmSettings(null, "qwen2.5", null, 1024, null);

        LlmSettings merged = global.overriddenBy(node);

        assertEquals("ollama", merged.getProvider());
        assertEquals("qwen2.5", merged.getModel());
        assertEquals(0.7, merged.getTemperature());
        assertEquals(1024, merged.getMaxTokens());
        assertNull(merged.getApiBase());
    }

    @Test
    void getName_fallsBackWhenFlowMissing() {
        WorkflowConfig config = WorkflowConfigs.fromJson("{\"nodes\":[]}");

        assertEquals("unnamed", config.getName());
        assertTrue(config.getEdges().isEmpty());
    }
}
