package com.agentflow.engine.gates;

import com.agentflow.workflow.config.GateAction;
import com.agentflow.workflow.config.GatesConfig;
import com.agentflow.workflow.config.QualityGateConfig;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class QualityGateEvaluatorTest {

    private static final Map<String, Double> METRICS = Map.of(
            "cost_usd", 0.12,
            "duration_ms", 1800.0,
            "accuracy_avg", 0.91);

    private final DeployBlockRegistry blocks = new DeployBlockRegistry();
    private final QualityGateEvaluator evaluator = new QualityGateEvaluator(blocks);

    private static GatesConfig gates(GateAction onFail, QualityGateConfig... gates) {
        return new GatesConfig(List.of(gates), onFail);
    }

    @Test
    void check_comparesAgainstMinAndMax() {
        GateResult underBudget = QualityGateEvaluator.check(new QualityGateConfig("cost_usd", null, 0.5), METRICS);
        GateResult tooSlow = QualityGateEvaluator.check(new QualityGateConfig("duration_ms", null, 1000.0), METRICS);
        GateResult accurate = QualityGateEvaluator.check(new QualityGateConfig("accuracy", 0.9, null), METRICS);

        assertTrue(underBudget.isPassed());
        assertFalse(tooSlow.isPassed());
        assertEquals("Value 1800.0 exceeds maximum 1000.0", tooSlow.getMessage());
        assertTrue(accurate.isPassed());
        assertEquals(0.91, accurate.getActual());
    }

    @Test
    void check_missingMetricFails() {
        GateResult result = QualityGateEvaluator.check(new QualityGateConfig("latency_p99", null, 2.0), METRICS);

        assertFalse(result.isPassed());
        assertNull(result.getActual());
        assertTrue(result.getMessage().contains("not found"));
    }

    @Test
    void enforce_failActionThrowsWithFailedGates() {
        GateReport report = evaluator.check(gates(GateAction.FAIL,
                new QualityGateConfig("cost_usd", null, 0.01),
                new QualityGateConfig("accuracy", 0.8, null)), METRICS);

        QualityGateException e = assertThrows(QualityGateException.class, () -> evaluator.enforce("article", report));

        assertEquals(1, e.getFailedGates().size());
        assertEquals("cost_usd", e.getFailedGates().get(0).getMetric());
        assertFalse(blocks.isBlocked("article"));
    }

    @Test
    void enforce_blockDeploySetsFlag() {
        GateReport report = evaluator.check(gates(GateAction.BLOCK_DEPLOY,
                new QualityGateConfig("duration_ms", null, 1000.0)), METRICS);

        assertTrue(evaluator.enforce("article", report));
        assertTrue(blocks.isBlocked("article"));
        assertEquals(List.of("duration_ms"), blocks.failedGates("article"));
        assertFalse(blocks.isBlocked("other"));

        blocks.clear("article");
        assertFalse(blocks.isBlocked("article"));
    }

    @Test
    void enforce_warnOnlyLogs() {
        GateReport report = evaluator.check(gates(GateAction.WARN,
                new QualityGateConfig("cost_usd", null, 0.01)), METRICS);

        assertFalse(report.allPassed());
        assertFalse(evaluator.enforce("article", report));
        assertFalse(blocks.isBlocked("article"));
    }

    @Test
    void enforce_passingGatesDoNothing() {
        GateReport report = evaluator.check(gates(GateAction.FAIL,
                new QualityGateConfig("cost_usd", null, 1.0)), METRICS);

        assertTrue(report.allPassed());
        assertFalse(evaluator.enforce("article", report));
    }

    @Test
    void key_namespacesWorkflow() {
        assertEquals("deploy_block:article", DeployBlockRegistry.key("article"));
    }
}
