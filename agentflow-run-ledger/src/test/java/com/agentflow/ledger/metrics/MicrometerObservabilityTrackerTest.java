package com.agentflow.ledger.metrics;

import com.agentflow.ledger.NodeMetrics;
import com.agentflow.ledger.RunCompletion;
import com.agentflow.ledger.RunStatus;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class MicrometerObservabilityTrackerTest {

    @Test
    void recordNodeEnd_countsExecutionsAndTokens() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        MicrometerObservabilityTracker tracker = new MicrometerObservabilityTracker(registry);
        NodeMetrics metrics = new NodeMetrics(40, 100, 50, new BigDecimal("0.001"), "gemini-1.5-flash", "google", 1, 1);

        tracker.recordNodeStart("r1", "draft");
        assertEquals(1.0, registry.get("agentflow.node.active").gauge().value());
        tracker.recordNodeEnd("r1", "draft", metrics);

        assertEquals(0.0, registry.get("agentflow.node.active").gauge().value());
        assertEquals(1.0, registry.get("agentflow.node.executions").tag("node", "draft").tag("outcome", "success").counter().count());
        assertEquals(100.0, registry.get("agentflow.llm.tokens.prompt").tag("node", "draft").counter().count());
        assertEquals(50.0, registry.get("agentflow.llm.tokens.completion").tag("node", "draft").counter().count());
        assertEquals(40.0, registry.get("agentflow.node.duration").timer().totalTime(TimeUnit.MILLISECONDS));
    }

    @Test
    void recordNodeEnd_noTokens_noTokenCounters() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        MicrometerObservabilityTracker tracker = new MicrometerObservabilityTracker(registry);

        tracker.recordNodeEnd("r1", "draft", NodeMetrics.none());

        assertNull(registry.find("agentflow.llm.tokens.prompt").counter());
        assertNull(registry.find("agentflow.llm.cost.usd").counter());
    }

    @Test
    void includeModelTag_addsModel() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        MicrometerObservabilityTracker tracker = new MicrometerObservabilityTracker(registry, true);

        tracker.recordNodeFailure("r1", "review", new NodeMetrics(5, 10, 0, null, "llama3.2", "ollama", 0, 2), "bad");

        assertEquals(10.0, registry.get("agentflow.llm.tokens.prompt").tag("model", "llama3.2").counter().count());
        assertEquals(1.0, registry.get("agentflow.node.executions").tag("outcome", "failure").counter().count());
    }

    @Test
    void recordRunEnd_countsByStatus() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        MicrometerObservabilityTracker tracker = new MicrometerObservabilityTracker(registry);

        tracker.recordRunEnd("r1", new RunCompletion(RunStatus.FAILED, 0, 12, 0, 0, null, 0, Map.of(), "NODE", "x", false));

        assertEquals(1.0, registry.get("agentflow.run.completed").tag("status", "failed").counter().count());
    }
}
