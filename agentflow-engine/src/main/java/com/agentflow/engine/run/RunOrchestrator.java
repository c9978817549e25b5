package com.agentflow.engine.run;

import com.agentflow.config.EngineSettings;
import com.agentflow.engine.gates.DeployBlockRegistry;
import com.agentflow.engine.gates.GateReport;
import com.agentflow.engine.gates.QualityGateEvaluator;
import com.agentflow.engine.graph.ExecutionPlan;
import com.agentflow.engine.graph.GraphCompiler;
import com.agentflow.engine.node.NodeExecutor;
import com.agentflow.engine.node.NodeHandler;
import com.agentflow.engine.state.ExecutionState;
import com.agentflow.engine.state.StateRecordBuilder;
import com.agentflow.engine.state.StateRecordType;
import com.agentflow.ledger.NoOpObservabilityTracker;
import com.agentflow.ledger.NoOpRunRepository;
import com.agentflow.ledger.ObservabilityTracker;
import com.agentflow.ledger.RunCompletion;
import com.agentflow.ledger.RunLedger;
import com.agentflow.ledger.RunRecord;
import com.agentflow.ledger.RunRepository;
import com.agentflow.ledger.RunStatus;
import com.agentflow.ledger.metrics.CostEstimator;
import com.agentflow.llm.LlmClientFactory;
import com.agentflow.tools.RegistryToolInvoker;
import com.agentflow.tools.ToolRegistry;
import com.agentflow.workflow.config.GatesConfig;
import com.agentflow.workflow.config.WorkflowConfig;
import com.agentflow.workflow.load.WorkflowConfigLoader;
import com.agentflow.workflow.validation.ConfigValidationException;
import com.agentflow.workflow.validation.ConfigValidator;
import com.agentflow.workflow.validation.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Top-level entry point: validate, initialize state, compile, record the run, walk the graph, check
 * quality gates, finalize the run record and return a {@link RunOutcome}.
 * <p>
 * {@link #run} never throws: every failure becomes a failed outcome with a {@link RunError}.
 * Repository and tracker failures are absorbed by {@link RunLedger} and never affect the run.
 * <p>
 * One instance per process. It owns the thread pool that runs walks and fork branches; the pool keeps
 * {@code branchPoolSize} threads warm and grows on demand so nested forks never starve.
 * Close it on shutdown.
 */
public final class RunOrchestrator implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(RunOrchestrator.class);
    private static final int SHUTDOWN_TIMEOUT_SECONDS = 30;

    private final EngineSettings settings;
    private final ConfigValidator validator;
    private final StateRecordBuilder stateBuilder = new StateRecordBuilder();
    private final GraphCompiler compiler;
    private final NodeHandler nodeHandler;
    private final RunLedger ledger;
    private final QualityGateEvaluator gates;
    private final ThreadPoolExecutor executor;

    private RunOrchestrator(Builder b) {
        this.settings = b.settings != null ? b.settings : EngineSettings.defaults();
        ToolRegistry tools = b.tools != null ? b.tools : ToolRegistry.empty();
        this.validator = new ConfigValidator(tools.names());
        this.compiler = new GraphCompiler(tools, settings);
        if (b.nodeHandler != null) {
            this.nodeHandler = b.nodeHandler;
        } else {
            Objects.requireNonNull(b.llmClients, "llmClients (or nodeHandler) is required");
            this.nodeHandler = new NodeExecutor(b.llmClients, new RegistryToolInvoker(tools),
                    b.costEstimator != null ? b.costEstimator : new CostEstimator());
        }
        this.ledger = settings.isRunLedgerEnabled()
                ? new RunLedger(b.repository, b.tracker)
                : RunLedger.disabled();
        this.gates = new QualityGateEvaluator(b.deployBlocks);
        this.executor = new ThreadPoolExecutor(settings.getBranchPoolSize(), Integer.MAX_VALUE,
                60L, TimeUnit.SECONDS, new SynchronousQueue<>(), new BranchThreadFactory());
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Validates without compiling or running. Never calls a model. */
    public ValidationResult validate(WorkflowConfig config) {
        return validator.validate(config);
    }

    /**
     * Validates and compiles.
     *
     * @throws ConfigValidationException when the config is invalid
     */
    public ExecutionPlan compile(WorkflowConfig config) {
        validator.validateOrThrow(config);
        return compiler.compile(config);
    }

    /** Loads the workflow document at {@code path} and runs it. Load failures become a failed outcome. */
    public RunOutcome run(Path path, Map<String, ?> inputs) {
        WorkflowConfig config;
        try {
            config = WorkflowConfigLoader.load(path);
        } catch (RuntimeException e) {
            log.error("Workflow load failed | path={} | error={}", path, e.getMessage());
            return RunOutcome.failed(null, String.valueOf(path), Map.of(), RunMetrics.empty(0), RunError.from(e), null, List.of());
        }
        return run(config, inputs);
    }

    public RunOutcome run(WorkflowConfig config, Map<String, ?> inputs) {
        long startMillis = System.currentTimeMillis();
        long startNanos = System.nanoTime();
        String workflow = config.getName();
        Map<String, ?> in = inputs != null ? inputs : Map.of();

        ExecutionPlan plan;
        ExecutionState initial;
        try {
            validator.validateOrThrow(config);
            StateRecordType stateType = stateBuilder.build(config.getState());
            initial = stateType.initialize(in);
            plan = compiler.compile(config, stateType);
        } catch (RuntimeException e) {
            RunError error = RunError.from(e);
            log.error("Workflow rejected before execution | workflow={} | kind={} | error={}",
                    workflow, error.getKindValue(), error.getMessage());
            return RunOutcome.failed(null, workflow, Map.of(), RunMetrics.empty(elapsedMs(startNanos)), error, null, List.of());
        }

        String runId = ledger.runStarted(new RunRecord(workflow, plan.getWorkflowVersion(), new LinkedHashMap<String, Object>(in), startMillis));
        log.info("Run started | runId={} | workflow={} | nodes={} | timeout={}s",
                runId, workflow, plan.getNodes().size(), plan.getTimeout().getSeconds());

        GraphTraversal traversal = new GraphTraversal(plan, nodeHandler, ledger, runId, executor);
        ExecutionState finalState = null;
        RunError error = null;
        try {
            finalState = traverse(plan, traversal, initial);
        } catch (RuntimeException e) {
            error = RunError.from(e);
        }

        GateReport report = null;
        boolean deployBlocked = false;
        RunMetrics metrics = traversal.metrics().snapshot(elapsedMs(startNanos));
        GatesConfig gatesConfig = plan.getGates();
        if (error == null && gatesConfig != null && !gatesConfig.getGates().isEmpty()) {
            report = gates.check(gatesConfig, metrics.toMetricMap());
            try {
                deployBlocked = gates.enforce(workflow, report);
            } catch (RuntimeException e) {
                error = RunError.from(e);
            }
        }

        RunOutcome outcome;
        if (error == null) {
            outcome = RunOutcome.succeeded(runId, workflow, finalState.asMap(), metrics, report, deployBlocked,
                    traversal.nodeErrors());
            log.info("Run completed | runId={} | workflow={} | nodes={} | tokens={} | costUsd={} | durationMs={}",
                    runId, workflow, metrics.getNodeCount(), metrics.getTotalTokens(), metrics.getCostUsd(), metrics.getDurationMs());
        } else {
            ExecutionState partial = traversal.latestState();
            outcome = RunOutcome.failed(runId, workflow, partial != null ? partial.asMap() : Map.of(), metrics, error,
                    report, traversal.nodeErrors());
            log.error("Run failed | runId={} | workflow={} | kind={} | node={} | error={}",
                    runId, workflow, error.getKindValue(), error.getNodeId(), error.getMessage());
        }
        ledger.runEnded(runId, completion(outcome));
        return outcome;
    }

    private ExecutionState traverse(ExecutionPlan plan, GraphTraversal traversal, ExecutionState initial) {
        Future<ExecutionState> future = executor.submit(() -> traversal.run(initial));
        try {
            return future.get(plan.getTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Run timed out; cancelling in-flight nodes | workflow={} | timeout={}s",
                    plan.getWorkflowName(), plan.getTimeout().getSeconds());
            throw new WorkflowTimeoutException(plan.getWorkflowName(), plan.getTimeout());
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for workflow '" + plan.getWorkflowName() + "'", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof RuntimeException re) throw re;
            if (cause instanceof Error err) throw err;
            throw new IllegalStateException(cause);
        }
    }

    private static RunCompletion completion(RunOutcome outcome) {
        RunMetrics m = outcome.getMetrics();
        RunStatus status = outcome.getStatus();
        return new RunCompletion(status, System.currentTimeMillis(), m.getDurationMs(), m.getPromptTokens(),
                m.getCompletionTokens(), m.getCostUsd(), m.getNodeCount(), outcome.getState(),
                outcome.getError() != null ? outcome.getError().getKindValue() : null,
                outcome.getError() != null ? outcome.getError().getMessage() : null,
                outcome.isDeployBlocked());
    }

    private static long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000L;
    }

    public DeployBlockRegistry getDeployBlocks() {
        return gates.getDeployBlocks();
    }

    public EngineSettings getSettings() {
        return settings;
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) executor.shutdownNow();
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static final class BranchThreadFactory implements ThreadFactory {
        private final AtomicInteger count = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "agentflow-branch-" + count.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }

    public static final class Builder {
        private EngineSettings settings;
        private ToolRegistry tools;
        private LlmClientFactory llmClients;
        private NodeHandler nodeHandler;
        private RunRepository repository = new NoOpRunRepository();
        private ObservabilityTracker tracker = NoOpObservabilityTracker.INSTANCE;
        private CostEstimator costEstimator;
        private DeployBlockRegistry deployBlocks;

        public Builder settings(EngineSettings settings) { this.settings = settings; return this; }
        public Builder tools(ToolRegistry tools) { this.tools = tools; return this; }
        public Builder llmClients(LlmClientFactory llmClients) { this.llmClients = llmClients; return this; }
        /** Replaces the default {@link NodeExecutor}; {@code llmClients} is then not needed. */
        public Builder nodeHandler(NodeHandler nodeHandler) { this.nodeHandler = nodeHandler; return this; }
        public Builder repository(RunRepository repository) { this.repository = repository; return this; }
        public Builder tracker(ObservabilityTracker tracker) { this.tracker = tracker; return this; }
        public Builder costEstimator(CostEstimator costEstimator) { this.costEstimator = costEstimator; return this; }
        public Builder deployBlocks(DeployBlockRegistry deployBlocks) { this.deployBlocks = deployBlocks; return this; }

        public RunOrchestrator build() {
            return new RunOrchestrator(this);
        }
    }
}
