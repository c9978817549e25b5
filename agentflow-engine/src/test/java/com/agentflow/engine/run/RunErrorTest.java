package com.agentflow.engine.run;

import com.agentflow.engine.node.NodeExecutionException;
import com.agentflow.engine.template.TemplateException;
import com.agentflow.ledger.NodeMetrics;
import com.agentflow.tools.ToolExecutionException;
import com.agentflow.workflow.WorkflowConfigs;
import com.agentflow.workflow.validation.ConfigValidationException;
import com.agentflow.workflow.validation.Violation;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RunErrorTest {

    @Test
    void from_nodeFailureKeepsNodeAndClassifiesCause() {
        RunError error = RunError.from(new NodeExecutionException("draft",
                new TemplateException("Unknown variable {state.topc}", "state.topc", "topic")));

        assertEquals(ErrorKind.TEMPLATE, error.getKind());
        assertEquals("draft", error.getNodeId());
    }

    @Test
    void from_unclassifiedCauseIsNodeExecution() {
        RunError error = RunError.from(new NodeExecutionException("draft", new IllegalStateException("boom")));

        assertEquals(ErrorKind.NODE_EXECUTION, error.getKind());
        assertEquals("node_execution", error.getKindValue());
    }

    @Test
    void from_mapsEngineExceptions() {
        assertEquals(ErrorKind.TOOL_EXECUTION, RunError.from(new ToolExecutionException("echo", "bad args")).getKind());
        assertEquals(ErrorKind.TIMEOUT, RunError.from(new WorkflowTimeoutException("w", Duration.ofSeconds(5))).getKind());
        assertEquals(ErrorKind.INTERNAL, RunError.from(new NullPointerException()).getKind());
        assertEquals("NullPointerException", RunError.from(new NullPointerException()).getMessage());
    }

    @Test
    void from_configErrorCarriesViolations() {
        Violation v = Violation.of("edges[1]", "references unknown node 'reveiw'");

        RunError error = RunError.from(new ConfigValidationException(v));

        assertEquals(ErrorKind.CONFIG_VALIDATION, error.getKind());
        assertEquals(List.of(v), error.getViolations());
        assertNull(error.getNodeId());
    }

    @Test
    void json_usesSnakeCaseAndOmitsEmpty() throws Exception {
        String json = WorkflowConfigs.jsonMapper().writeValueAsString(
                new RunError(ErrorKind.OUTPUT_VALIDATION, "bad output", "review", null));

        assertTrue(json.contains("\"kind\":\"output_validation\""), json);
        assertTrue(json.contains("\"node_id\":\"review\""), json);
        assertFalse(json.contains("violations"), json);
    }

    @Test
    void metrics_aggregateNodeRuns() {
        RunMetrics.Collector collector = new RunMetrics.Collector();
        collector.node("draft", new NodeMetrics(120, 100, 50, new BigDecimal("0.000100"), "gemini-1.5-flash", "google", 1, 1), null);
        collector.node("review", new NodeMetrics(300, 10, 5, new BigDecimal("0.000020"), "gemini-1.5-flash", "google", 0, 2), null);
        collector.loopCapHit("review");

        RunMetrics metrics = collector.snapshot(450);

        assertEquals(2, metrics.getNodeCount());
        assertEquals(165, metrics.getTotalTokens());
        assertEquals(0, new BigDecimal("0.000120").compareTo(metrics.getCostUsd()));
        assertEquals("review", metrics.getSlowestNode());
        assertEquals(List.of("review"), metrics.getLoopCapHits());
        Map<String, Double> gateMetrics = metrics.toMetricMap();
        assertEquals(450.0, gateMetrics.get("duration_ms"));
        assertEquals(1.0, gateMetrics.get("tool_calls"));
        assertNull(RunMetrics.empty(0).getSlowestNode());
    }
}
