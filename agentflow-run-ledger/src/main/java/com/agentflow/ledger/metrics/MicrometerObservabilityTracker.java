package com.agentflow.ledger.metrics;

import com.agentflow.ledger.NodeMetrics;
import com.agentflow.ledger.ObservabilityTracker;
import com.agentflow.ledger.RunCompletion;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Records node and run metrics into a Micrometer registry.
 * <ul>
 *   <li>{@code agentflow.node.executions} counter, tags node, outcome</li>
 *   <li>{@code agentflow.node.duration} timer, tag node</li>
 *   <li>{@code agentflow.llm.tokens.prompt} / {@code .completion} counters, only when tokens were used</li>
 *   <li>{@code agentflow.llm.cost.usd} counter</li>
 *   <li>{@code agentflow.run.completed} counter and {@code agentflow.run.duration} timer, tag status</li>
 *   <li>{@code agentflow.node.active} gauge</li>
 * </ul>
 * Model is added as a tag only when {@code includeModelTag} is set (model names can explode cardinality).
 */
public final class MicrometerObservabilityTracker implements ObservabilityTracker {

    private static final Logger log = LoggerFactory.getLogger(MicrometerObservabilityTracker.class);

    private final MeterRegistry registry;
    private final boolean includeModelTag;
    private final AtomicInteger activeNodes = new AtomicInteger();

    public MicrometerObservabilityTracker(MeterRegistry registry, boolean includeModelTag) {
        this.registry = registry != null ? registry : new SimpleMeterRegistry();
        this.includeModelTag = includeModelTag;
        this.registry.gauge("agentflow.node.active", activeNodes);
    }

    public MicrometerObservabilityTracker(MeterRegistry registry) {
        this(registry, false);
    }

    public MeterRegistry getRegistry() {
        return registry;
    }

    @Override
    public void recordNodeStart(String runId, String nodeId) {
        activeNodes.incrementAndGet();
    }

    @Override
    public void recordNodeEnd(String runId, String nodeId, NodeMetrics metrics) {
        record(runId, nodeId, metrics, "success");
    }

    @Override
    public void recordNodeFailure(String runId, String nodeId, NodeMetrics metrics, String errorMessage) {
        record(runId, nodeId, metrics, "failure");
    }

    private void record(String runId, String nodeId, NodeMetrics metrics, String outcome) {
        activeNodes.updateAndGet(n -> Math.max(0, n - 1));
        NodeMetrics m = metrics != null ? metrics : NodeMetrics.none();
        String node = nodeId != null ? nodeId : "unknown";

        registry.counter("agentflow.node.executions", "node", node, "outcome", outcome).increment();
        Timer.builder("agentflow.node.duration")
                .tag("node", node)
                .register(registry)
                .record(m.getDurationMs(), TimeUnit.MILLISECONDS);

        String model = m.getModel() != null ? m.getModel() : "unknown";
        if (m.getPromptTokens() > 0) {
            tokenCounter("agentflow.llm.tokens.prompt", node, model).increment(m.getPromptTokens());
        }
        if (m.getCompletionTokens() > 0) {
            tokenCounter("agentflow.llm.tokens.completion", node, model).increment(m.getCompletionTokens());
        }
        if (m.getCostUsd().signum() > 0) {
            tokenCounter("agentflow.llm.cost.usd", node, model).increment(m.getCostUsd().doubleValue());
        }
        log.debug("Node metrics recorded | runId={} | node={} | outcome={} | {}", runId, node, outcome, m);
    }

    private Counter tokenCounter(String name, String node, String model) {
        Counter.Builder builder = Counter.builder(name).tag("node", node);
        if (includeModelTag) builder.tag("model", model);
        return builder.register(registry);
    }

    @Override
    public void recordRunEnd(String runId, RunCompletion completion) {
        String status = completion.getStatus().toValue();
        registry.counter("agentflow.run.completed", "status", status).increment();
        Timer.builder("agentflow.run.duration")
                .tag("status", status)
                .register(registry)
                .record(completion.getDurationMs(), TimeUnit.MILLISECONDS);
    }
}
