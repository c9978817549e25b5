package com.agentflow.engine.run;

import com.agentflow.engine.graph.CompiledRoute;
import com.agentflow.engine.graph.ConditionalEdge;
import com.agentflow.engine.graph.ControlFlowException;
import com.agentflow.engine.graph.EdgeDescriptor;
import com.agentflow.engine.graph.ExecutionPlan;
import com.agentflow.engine.graph.ForkJoinEdge;
import com.agentflow.engine.graph.LinearEdge;
import com.agentflow.engine.graph.LoopEdge;
import com.agentflow.engine.node.NodeDescriptor;
import com.agentflow.engine.node.NodeExecutionException;
import com.agentflow.engine.node.NodeHandler;
import com.agentflow.engine.node.NodeResult;
import com.agentflow.engine.output.OutputValidationException;
import com.agentflow.engine.state.ExecutionState;
import com.agentflow.engine.state.StateRecordType;
import com.agentflow.ledger.NodeMetrics;
import com.agentflow.ledger.RunLedger;
import com.agentflow.workflow.config.EdgeConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Drives one run through an {@link ExecutionPlan}. Each walk threads an immutable state snapshot:
 * a node gets the snapshot, returns a delta, and the delta is merged before the next edge is followed.
 * <p>
 * Fork branches walk concurrently from the same pre-fork snapshot up to the join node and return the
 * deltas they applied. At the join, branch deltas are merged into the pre-fork snapshot in branch
 * declaration order, so list fields concatenate in that order and, for scalar fields written by more
 * than one branch, the last declared branch wins.
 */
final class GraphTraversal {

    private static final Logger log = LoggerFactory.getLogger(GraphTraversal.class);

    private final ExecutionPlan plan;
    private final StateRecordType stateType;
    private final NodeHandler handler;
    private final RunLedger ledger;
    private final String runId;
    private final ExecutorService branchExecutor;
    private final RunMetrics.Collector metrics = new RunMetrics.Collector();
    private final List<RunError> nodeErrors = Collections.synchronizedList(new ArrayList<>());
    private final Map<String, Integer> loopIterations = new ConcurrentHashMap<>();
    private volatile ExecutionState latest;

    GraphTraversal(ExecutionPlan plan, NodeHandler handler, RunLedger ledger, String runId, ExecutorService branchExecutor) {
        this.plan = plan;
        this.stateType = plan.getStateType();
        this.handler = handler;
        this.ledger = ledger;
        this.runId = runId;
        this.branchExecutor = branchExecutor;
    }

    /** Walks from START to END and returns the final state. */
    ExecutionState run(ExecutionState initial) {
        latest = initial;
        return walk(EdgeConfig.START, initial, null, true).state;
    }

    /** Last state merged on the main path; the partial state reported when the run fails or times out. */
    ExecutionState latestState() {
        return latest;
    }

    RunMetrics.Collector metrics() {
        return metrics;
    }

    List<RunError> nodeErrors() {
        synchronized (nodeErrors) {
            return List.copyOf(nodeErrors);
        }
    }

    /**
     * Executes {@code first} (unless it is START), then follows edges until END or {@code stopAt} is next.
     * {@code stopAt} is the join node when walking a fork branch and null on the main path.
     */
    private Walk walk(String first, ExecutionState state, String stopAt, boolean mainPath) {
        List<Map<String, Object>> applied = new ArrayList<>();
        String current = first;
        while (true) {
            if (Thread.currentThread().isInterrupted()) {
                throw new CancellationException("Run " + runId + " cancelled before node '" + current + "'");
            }
            if (!EdgeConfig.START.equals(current)) {
                Map<String, Object> delta = executeNode(plan.node(current), state);
                state = stateType.merge(state, delta);
                applied.add(delta);
                if (mainPath) latest = state;
            }
            EdgeDescriptor edge = plan.edgeFrom(current);
            String next;
            if (edge instanceof ForkJoinEdge fork) {
                Walk joined = fork(fork, state);
                state = joined.state;
                applied.addAll(joined.deltas);
                if (mainPath) latest = state;
                next = fork.getJoinNode();
            } else {
                next = route(edge, state);
            }
            if (EdgeConfig.END.equals(next) || next.equals(stopAt)) {
                return new Walk(state, applied);
            }
            current = next;
        }
    }

    private String route(EdgeDescriptor edge, ExecutionState state) {
        if (edge instanceof LinearEdge linear) {
            return linear.getTarget();
        }
        if (edge instanceof ConditionalEdge conditional) {
            CompiledRoute route = conditional.select(state);
            log.info("Route selected | runId={} | from={} | condition={} | to={}",
                    runId, edge.getSource(), route.getLogic(), route.getTarget());
            return route.getTarget();
        }
        if (edge instanceof LoopEdge loop) {
            int iterations = loopIterations.merge(loop.getSource(), 1, Integer::sum);
            LoopEdge.Decision decision = loop.decide(state, iterations);
            if (decision.isExited()) {
                loopIterations.remove(loop.getSource());
                if (decision.isCapHit()) {
                    metrics.loopCapHit(loop.getSource());
                    log.warn("Loop iteration cap reached; exiting | runId={} | node={} | maxIterations={} | exitTo={}",
                            runId, loop.getSource(), loop.getMaxIterations(), loop.getExitTo());
                } else {
                    log.info("Loop exited | runId={} | node={} | iterations={} | exitTo={}",
                            runId, loop.getSource(), iterations, loop.getExitTo());
                }
            }
            return decision.getTarget();
        }
        throw new ControlFlowException(edge.getSource(), "Unsupported edge kind " + edge.getKind());
    }

    private Walk fork(ForkJoinEdge fork, ExecutionState snapshot) {
        List<String> branches = fork.getBranches();
        String join = fork.getJoinNode();
        log.info("Fork started | runId={} | from={} | branches={} | join={}", runId, fork.getSource(), branches, join);
        CompletionService<Walk> completion = new ExecutorCompletionService<>(branchExecutor);
        List<Future<Walk>> futures = new ArrayList<>(branches.size());
        for (String branch : branches) {
            futures.add(completion.submit(() -> walk(branch, snapshot, join, false)));
        }
        try {
            for (int i = 0; i < futures.size(); i++) {
                completion.take().get();
            }
        } catch (InterruptedException e) {
            cancelAll(futures);
            Thread.currentThread().interrupt();
            throw new CancellationException("Run " + runId + " interrupted while waiting at join '" + join + "'");
        } catch (ExecutionException e) {
            cancelAll(futures);
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof RuntimeException re) throw re;
            if (cause instanceof Error err) throw err;
            throw new NodeExecutionException(fork.getSource(), cause);
        }
        List<Map<String, Object>> deltas = new ArrayList<>();
        for (Future<Walk> f : futures) {
            deltas.addAll(done(f).deltas);
        }
        ExecutionState merged = stateType.mergeAll(snapshot, deltas);
        log.info("Join reached | runId={} | from={} | join={} | deltas={}", runId, fork.getSource(), join, deltas.size());
        return new Walk(merged, deltas);
    }

    private static Walk done(Future<Walk> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("Interrupted reading a completed branch");
        } catch (ExecutionException e) {
            throw new IllegalStateException("Branch already reported success", e.getCause());
        }
    }

    private static void cancelAll(List<Future<Walk>> futures) {
        for (Future<Walk> f : futures) {
            f.cancel(true);
        }
    }

    private Map<String, Object> executeNode(NodeDescriptor node, ExecutionState snapshot) {
        ledger.nodeStarted(runId, node.getId());
        log.info("Node started | runId={} | node={}", runId, node.getId());
        long start = System.nanoTime();
        try {
            NodeResult result = handler.execute(node, snapshot);
            NodeMetrics m = result.getMetrics();
            metrics.node(node.getId(), m, null);
            ledger.nodeEnded(runId, node.getId(), m);
            log.info("Node completed | runId={} | node={} | durationMs={} | tokens={} | fields={}",
                    runId, node.getId(), m.getDurationMs(), m.getTotalTokens(), result.getDelta().keySet());
            return result.getDelta();
        } catch (CancellationException e) {
            throw e;
        } catch (RuntimeException e) {
            long durationMs = (System.nanoTime() - start) / 1_000_000L;
            NodeMetrics failed = spentBefore(e).withDuration(durationMs);
            metrics.node(node.getId(), failed, e.getMessage());
            ledger.nodeFailed(runId, node.getId(), failed, e.getMessage());
            RuntimeException attributed = attributed(node.getId(), e);
            if (node.isBreakOnError()) {
                throw attributed;
            }
            log.warn("Node failed; execution continues (break_on_error=false) | runId={} | node={} | error={}",
                    runId, node.getId(), e.getMessage());
            nodeErrors.add(RunError.from(attributed));
            return Map.of();
        }
    }

    /** Tokens and cost a failed node had already spent, when the failure reports them. */
    private static NodeMetrics spentBefore(RuntimeException e) {
        Throwable t = e instanceof NodeExecutionException && e.getCause() != null ? e.getCause() : e;
        return t instanceof OutputValidationException ove ? ove.getMetrics() : NodeMetrics.none();
    }

    private static RuntimeException attributed(String nodeId, RuntimeException e) {
        if (e instanceof NodeExecutionException || e instanceof OutputValidationException || e instanceof ControlFlowException) {
            return e;
        }
        return new NodeExecutionException(nodeId, e);
    }

    /** State at the end of a walk plus every delta applied along it, in order. */
    private static final class Walk {
        private final ExecutionState state;
        private final List<Map<String, Object>> deltas;

        Walk(ExecutionState state, List<Map<String, Object>> deltas) {
            this.state = state;
            this.deltas = deltas;
        }
    }
}
