package com.agentflow.engine.cli;

import com.agentflow.config.EngineSettings;
import com.agentflow.engine.run.RunError;
import com.agentflow.engine.run.RunOrchestrator;
import com.agentflow.engine.run.RunOutcome;
import com.agentflow.ledger.InMemoryRunRepository;
import com.agentflow.ledger.NoOpObservabilityTracker;
import com.agentflow.ledger.metrics.MicrometerObservabilityTracker;
import com.agentflow.llm.ProviderLlmClientFactory;
import com.agentflow.llm.ollama.OllamaLlmClientFactory;
import com.agentflow.tools.ToolRegistry;
import com.agentflow.tools.builtin.EchoTool;
import com.agentflow.workflow.WorkflowConfigs;
import com.agentflow.workflow.config.WorkflowConfig;
import com.agentflow.workflow.load.WorkflowConfigLoader;
import com.agentflow.workflow.validation.ValidationResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectReader;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.io.PrintStream;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Command line entry point.
 * <pre>
 *   agentflow validate &lt;workflow.yaml&gt;
 *   agentflow run &lt;workflow.yaml&gt; [key=value ...]
 * </pre>
 * Input values are parsed as JSON when they are valid JSON ({@code count=3}, {@code tags=["a"]}) and taken
 * as plain strings otherwise. Results are printed as JSON. Exit code 0 on success, 1 on a failed run or an
 * invalid config, 2 on a usage error.
 */
public final class AgentFlowCli {

    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_USAGE = 2;

    private static final String USAGE = "Usage: agentflow validate <file> | agentflow run <file> [key=value ...]";

    private AgentFlowCli() {
    }

    public static void main(String[] args) {
        int code = execute(args, System.out, System.err, AgentFlowCli::defaultOrchestrator);
        System.exit(code);
    }

    /** Process wiring: Ollama client, built-in tools, in-memory run ledger with Micrometer metrics. */
    static RunOrchestrator defaultOrchestrator() {
        EngineSettings settings = EngineSettings.fromEnvironment();
        RunOrchestrator.Builder builder = RunOrchestrator.builder()
                .settings(settings)
                .tools(ToolRegistry.builder().register(new EchoTool()).build())
                .llmClients(ProviderLlmClientFactory.builder()
                        .register(OllamaLlmClientFactory.PROVIDER, new OllamaLlmClientFactory(settings.getOllamaBaseUrl()))
                        .build());
        if (settings.isRunLedgerEnabled()) {
            builder.repository(new InMemoryRunRepository())
                    .tracker(new MicrometerObservabilityTracker(new SimpleMeterRegistry()));
        } else {
            builder.tracker(NoOpObservabilityTracker.INSTANCE);
        }
        return builder.build();
    }

    static int execute(String[] args, PrintStream out, PrintStream err, Supplier<RunOrchestrator> orchestrators) {
        if (args == null || args.length < 2) {
            err.println(USAGE);
            return EXIT_USAGE;
        }
        String command = args[0];
        Path file = Path.of(args[1]);
        List<String> rest = Arrays.asList(args).subList(2, args.length);
        switch (command) {
            case "validate":
                if (!rest.isEmpty()) {
                    err.println(USAGE);
                    return EXIT_USAGE;
                }
                return validate(file, out, err, orchestrators);
            case "run":
                Map<String, Object> inputs;
                try {
                    inputs = parseInputs(rest);
                } catch (IllegalArgumentException e) {
                    err.println(e.getMessage());
                    err.println(USAGE);
                    return EXIT_USAGE;
                }
                return run(file, inputs, out, orchestrators);
            default:
                err.println("Unknown command: " + command);
                err.println(USAGE);
                return EXIT_USAGE;
        }
    }

    private static int validate(Path file, PrintStream out, PrintStream err, Supplier<RunOrchestrator> orchestrators) {
        WorkflowConfig config;
        try {
            config = WorkflowConfigLoader.load(file);
        } catch (RuntimeException e) {
            out.println(toJson(Map.of("valid", false, "error", RunError.from(e))));
            return EXIT_FAILED;
        }
        try (RunOrchestrator orchestrator = orchestrators.get()) {
            ValidationResult result = orchestrator.validate(config);
            Map<String, Object> report = new LinkedHashMap<>();
            report.put("workflow", config.getName());
            report.put("valid", result.isValid());
            if (!result.isValid()) report.put("violations", result.getViolations());
            out.println(toJson(report));
            return result.isValid() ? EXIT_OK : EXIT_FAILED;
        }
    }

    private static int run(Path file, Map<String, Object> inputs, PrintStream out, Supplier<RunOrchestrator> orchestrators) {
        try (RunOrchestrator orchestrator = orchestrators.get()) {
            RunOutcome outcome = orchestrator.run(file, inputs);
            out.println(toJson(outcome));
            return outcome.isSucceeded() ? EXIT_OK : EXIT_FAILED;
        }
    }

    /** Parses {@code key=value} arguments. */
    static Map<String, Object> parseInputs(List<String> args) {
        ObjectReader reader = WorkflowConfigs.jsonMapper().readerFor(Object.class)
                .with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
        Map<String, Object> inputs = new LinkedHashMap<>();
        for (String arg : args) {
            int eq = arg.indexOf('=');
            if (eq <= 0) {
                throw new IllegalArgumentException("Expected key=value but got '" + arg + "'");
            }
            String key = arg.substring(0, eq).trim();
            String raw = arg.substring(eq + 1);
            Object value;
            try {
                value = reader.readValue(raw);
            } catch (JsonProcessingException e) {
                value = raw;
            }
            inputs.put(key, value);
        }
        return inputs;
    }

    private static String toJson(Object value) {
        try {
            return WorkflowConfigs.jsonMapper().writerWithDefaultPrettyPrinter().writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize result: " + e.getMessage(), e);
        }
    }
}
