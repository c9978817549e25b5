package com.agentflow.engine.gates;

import com.agentflow.workflow.config.GateAction;
import com.agentflow.workflow.config.GatesConfig;
import com.agentflow.workflow.config.QualityGateConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Checks {@code config.gates} against aggregated run metrics and applies the {@code on_fail} action.
 * A metric is looked up by its name, then {@code <name>_avg}, then {@code avg_<name>}; a gate whose
 * metric cannot be found fails.
 */
public final class QualityGateEvaluator {

    private static final Logger log = LoggerFactory.getLogger(QualityGateEvaluator.class);

    private final DeployBlockRegistry deployBlocks;

    public QualityGateEvaluator(DeployBlockRegistry deployBlocks) {
        this.deployBlocks = deployBlocks != null ? deployBlocks : new DeployBlockRegistry();
    }

    public GateReport check(GatesConfig config, Map<String, Double> metrics) {
        List<GateResult> results = new ArrayList<>();
        for (QualityGateConfig gate : config.getGates()) {
            results.add(check(gate, metrics));
        }
        return new GateReport(results, config.getOnFail());
    }

    static GateResult check(QualityGateConfig gate, Map<String, Double> metrics) {
        String name = gate.getMetric();
        Double value = null;
        for (String key : List.of(name, name + "_avg", "avg_" + name)) {
            if (metrics.get(key) != null) {
                value = metrics.get(key);
                break;
            }
        }
        if (value == null) {
            log.warn("Gate metric not found | metric={}", name);
            return new GateResult(name, false, null, gate.getMax(), "Metric '" + name + "' not found in execution metrics");
        }
        if (gate.getMax() != null && value > gate.getMax()) {
            return new GateResult(name, false, value, gate.getMax(), "Value " + value + " exceeds maximum " + gate.getMax());
        }
        if (gate.getMin() != null && value < gate.getMin()) {
            return new GateResult(name, false, value, gate.getMin(), "Value " + value + " below minimum " + gate.getMin());
        }
        if (gate.getMax() != null) {
            return new GateResult(name, true, value, gate.getMax(), "Value " + value + " within maximum " + gate.getMax());
        }
        if (gate.getMin() != null) {
            return new GateResult(name, true, value, gate.getMin(), "Value " + value + " within minimum " + gate.getMin());
        }
        return new GateResult(name, true, value, null, "Value " + value + " (no threshold configured)");
    }

    /**
     * Applies the report's action when any gate failed.
     *
     * @return true when deployment of the workflow is now blocked
     * @throws QualityGateException when gates failed and the action is {@code fail}
     */
    public boolean enforce(String workflowName, GateReport report) {
        List<GateResult> failed = report.getFailed();
        if (failed.isEmpty()) {
            log.debug("All quality gates passed | workflow={}", workflowName);
            return false;
        }
        for (GateResult r : failed) {
            log.warn("Quality gate failed | workflow={} | metric={} | actual={} | threshold={}",
                    workflowName, r.getMetric(), r.getActual(), r.getThreshold());
        }
        GateAction action = report.getOnFail();
        switch (action) {
            case FAIL:
                throw new QualityGateException(workflowName, failed);
            case BLOCK_DEPLOY:
                List<String> metrics = new ArrayList<>();
                for (GateResult r : failed) {
                    metrics.add(r.getMetric());
                }
                deployBlocks.block(workflowName, metrics);
                return true;
            case WARN:
                log.warn("Quality gates failed but continuing | workflow={} | failed={}", workflowName, failed.size());
                return false;
            default:
                log.warn("Unknown gate action; treating as warn | workflow={} | action={}", workflowName, action);
                return false;
        }
    }

    public DeployBlockRegistry getDeployBlocks() {
        return deployBlocks;
    }
}
