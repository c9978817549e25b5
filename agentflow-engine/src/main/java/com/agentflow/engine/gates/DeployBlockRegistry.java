package com.agentflow.engine.gates;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Deploy-block flags set by the {@code block_deploy} gate action, keyed {@code deploy_block:<workflow>}.
 * Process-local; external deployment tooling reads it through {@link #isBlocked(String)}.
 */
public final class DeployBlockRegistry {

    private static final Logger log = LoggerFactory.getLogger(DeployBlockRegistry.class);

    private final Map<String, List<String>> blocks = new ConcurrentHashMap<>();

    static String key(String workflowName) {
        return "deploy_block:" + (workflowName != null ? workflowName : "default");
    }

    /** Blocks deployment of the workflow, remembering which gate metrics failed. */
    public void block(String workflowName, List<String> failedMetrics) {
        blocks.put(key(workflowName), List.copyOf(failedMetrics));
        log.error("Quality gates failed: deployment blocked | workflow={} | failedGates={}", workflowName, failedMetrics);
    }

    public boolean isBlocked(String workflowName) {
        return blocks.containsKey(key(workflowName));
    }

    /** Metrics of the gates that caused the block; empty when the workflow is not blocked. */
    public List<String> failedGates(String workflowName) {
        return blocks.getOrDefault(key(workflowName), List.of());
    }

    public void clear(String workflowName) {
        if (blocks.remove(key(workflowName)) != null) {
            log.info("Deploy block cleared | workflow={}", workflowName);
        }
    }
}
