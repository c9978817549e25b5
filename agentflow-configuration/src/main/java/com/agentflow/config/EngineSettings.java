package com.agentflow.config;

import java.time.Duration;
import java.util.Objects;
import java.util.function.Function;

/**
 * Process-wide engine settings loaded from environment variables.
 * <p>
 * Limits: AGENTFLOW_TOOL_LOOP_MAX_ITERATIONS, AGENTFLOW_OUTPUT_MAX_RETRIES, AGENTFLOW_RUN_TIMEOUT_SECONDS,
 * AGENTFLOW_BRANCH_POOL_SIZE. A workflow's {@code config.execution} block overrides the first three per run.
 * <p>
 * LLM defaults: AGENTFLOW_LLM_PROVIDER, AGENTFLOW_LLM_MODEL, AGENTFLOW_OLLAMA_BASE_URL. Run ledger: AGENTFLOW_RUN_LEDGER.
 */
public final class EngineSettings {

    public static final String ENV_TOOL_LOOP_MAX_ITERATIONS = "AGENTFLOW_TOOL_LOOP_MAX_ITERATIONS";
    public static final String ENV_OUTPUT_MAX_RETRIES = "AGENTFLOW_OUTPUT_MAX_RETRIES";
    public static final String ENV_RUN_TIMEOUT_SECONDS = "AGENTFLOW_RUN_TIMEOUT_SECONDS";
    public static final String ENV_BRANCH_POOL_SIZE = "AGENTFLOW_BRANCH_POOL_SIZE";
    public static final String ENV_RUN_LEDGER = "AGENTFLOW_RUN_LEDGER";
    public static final String ENV_LLM_PROVIDER = "AGENTFLOW_LLM_PROVIDER";
    public static final String ENV_LLM_MODEL = "AGENTFLOW_LLM_MODEL";
    public static final String ENV_OLLAMA_BASE_URL = "AGENTFLOW_OLLAMA_BASE_URL";

    public static final int DEFAULT_TOOL_LOOP_MAX_ITERATIONS = 10;
    public static final int DEFAULT_OUTPUT_MAX_RETRIES = 2;
    public static final int DEFAULT_RUN_TIMEOUT_SECONDS = 120;
    public static final int DEFAULT_BRANCH_POOL_SIZE = 8;
    /** Default true; set false to skip run records and per-node observability. */
    public static final boolean DEFAULT_RUN_LEDGER = true;
    public static final String DEFAULT_LLM_PROVIDER = "ollama";
    public static final String DEFAULT_LLM_MODEL = "llama3.2";
    public static final String DEFAULT_OLLAMA_BASE_URL = "http://localhost:11434";

    private final int toolLoopMaxIterations;
    private final int outputMaxRetries;
    private final int runTimeoutSeconds;
    private final int branchPoolSize;
    private final boolean runLedgerEnabled;
    private final String llmProvider;
    private final String llmModel;
    private final String ollamaBaseUrl;

    private EngineSettings(Builder b) {
        this.toolLoopMaxIterations = b.toolLoopMaxIterations;
        this.outputMaxRetries = b.outputMaxRetries;
        this.runTimeoutSeconds = b.runTimeoutSeconds;
        this.branchPoolSize = b.branchPoolSize;
        this.runLedgerEnabled = b.runLedgerEnabled;
        this.llmProvider = b.llmProvider;
        this.llmModel = b.llmModel;
        this.ollamaBaseUrl = b.ollamaBaseUrl;
    }

    /** Settings with every value at its default. */
    public static EngineSettings defaults() {
        return builder().build();
    }

    public static EngineSettings fromEnvironment() {
        return fromEnvironment(System::getenv);
    }

    /**
     * Reads settings through {@code env} (normally {@link System#getenv(String)}).
     * Blank, unparsable or non-positive values fall back to the defaults.
     */
    public static EngineSettings fromEnvironment(Function<String, String> env) {
        Objects.requireNonNull(env, "env");
        return builder()
                .toolLoopMaxIterations(parsePositiveInt(env.apply(ENV_TOOL_LOOP_MAX_ITERATIONS), DEFAULT_TOOL_LOOP_MAX_ITERATIONS))
                .outputMaxRetries(parseNonNegativeInt(env.apply(ENV_OUTPUT_MAX_RETRIES), DEFAULT_OUTPUT_MAX_RETRIES))
                .runTimeoutSeconds(parsePositiveInt(env.apply(ENV_RUN_TIMEOUT_SECONDS), DEFAULT_RUN_TIMEOUT_SECONDS))
                .branchPoolSize(parsePositiveInt(env.apply(ENV_BRANCH_POOL_SIZE), DEFAULT_BRANCH_POOL_SIZE))
                .runLedgerEnabled(parseBoolean(env.apply(ENV_RUN_LEDGER), DEFAULT_RUN_LEDGER))
                .llmProvider(getEnv(env, ENV_LLM_PROVIDER, DEFAULT_LLM_PROVIDER))
                .llmModel(getEnv(env, ENV_LLM_MODEL, DEFAULT_LLM_MODEL))
                .ollamaBaseUrl(getEnv(env, ENV_OLLAMA_BASE_URL, DEFAULT_OLLAMA_BASE_URL))
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Builder pre-filled with this instance's values. */
    public Builder toBuilder() {
        return builder()
                .toolLoopMaxIterations(toolLoopMaxIterations)
                .outputMaxRetries(outputMaxRetries)
                .runTimeoutSeconds(runTimeoutSeconds)
                .branchPoolSize(branchPoolSize)
                .runLedgerEnabled(runLedgerEnabled)
                .llmProvider(llmProvider)
                .llmModel(llmModel)
                .ollamaBaseUrl(ollamaBaseUrl);
    }

    /** Cap on model round trips in a node's tool-calling loop. Default 10. */
    public int getToolLoopMaxIterations() {
        return toolLoopMaxIterations;
    }

    /** Extra structured-output attempts after the first fails validation. Default 2. */
    public int getOutputMaxRetries() {
        return outputMaxRetries;
    }

    public int getRunTimeoutSeconds() {
        return runTimeoutSeconds;
    }

    public Duration getRunTimeout() {
        return Duration.ofSeconds(runTimeoutSeconds);
    }

    /** Threads available to fork-join branches across all runs of one orchestrator. Default 8. */
    public int getBranchPoolSize() {
        return branchPoolSize;
    }

    public boolean isRunLedgerEnabled() {
        return runLedgerEnabled;
    }

    public String getLlmProvider() {
        return llmProvider;
    }

    public String getLlmModel() {
        return llmModel;
    }

    public String getOllamaBaseUrl() {
        return ollamaBaseUrl;
    }

    @Override
    public String toString() {
        return "EngineSettings{toolLoopMaxIterations=" + toolLoopMaxIterations
                + ", outputMaxRetries=" + outputMaxRetries
                + ", runTimeoutSeconds=" + runTimeoutSeconds
                + ", branchPoolSize=" + branchPoolSize
                + ", runLedgerEnabled=" + runLedgerEnabled
                + ", llmProvider=" + llmProvider
                + ", llmModel=" + llmModel
                + ", ollamaBaseUrl=" + ollamaBaseUrl + "}";
    }

    private static boolean parseBoolean(String value, boolean defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        return "true".equalsIgnoreCase(value.trim()) || "1".equals(value.trim());
    }

    private static int parsePositiveInt(String value, int defaultValue) {
        int parsed = parseInt(value, defaultValue);
        return parsed > 0 ? parsed : defaultValue;
    }

    private static int parseNonNegativeInt(String value, int defaultValue) {
        int parsed = parseInt(value, defaultValue);
        return parsed >= 0 ? parsed : defaultValue;
    }

    private static int parseInt(String value, int defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    private static String getEnv(Function<String, String> env, String key, String defaultValue) {
        String v = env.apply(key);
        return (v != null && !v.isBlank()) ? v.trim() : defaultValue;
    }

    public static final class Builder {
        private int toolLoopMaxIterations = DEFAULT_TOOL_LOOP_MAX_ITERATIONS;
        private int outputMaxRetries = DEFAULT_OUTPUT_MAX_RETRIES;
        private int runTimeoutSeconds = DEFAULT_RUN_TIMEOUT_SECONDS;
        private int branchPoolSize = DEFAULT_BRANCH_POOL_SIZE;
        private boolean runLedgerEnabled = DEFAULT_RUN_LEDGER;
        private String llmProvider = DEFAULT_LLM_PROVIDER;
        private String llmModel = DEFAULT_LLM_MODEL;
        private String ollamaBaseUrl = DEFAULT_OLLAMA_BASE_URL;

        public Builder toolLoopMaxIterations(int toolLoopMaxIterations) {
            this.toolLoopMaxIterations = toolLoopMaxIterations;
            return this;
        }

        public Builder outputMaxRetries(int outputMaxRetries) {
            this.outputMaxRetries = outputMaxRetries;
            return this;
        }

        public Builder runTimeoutSeconds(int runTimeoutSeconds) {
            this.runTimeoutSeconds = runTimeoutSeconds;
            return this;
        }

        public Builder branchPoolSize(int branchPoolSize) {
            this.branchPoolSize = branchPoolSize;
            return this;
        }

        public Builder runLedgerEnabled(boolean runLedgerEnabled) {
            this.runLedgerEnabled = runLedgerEnabled;
            return this;
        }

        public Builder llmProvider(String llmProvider) {
            this.llmProvider = llmProvider != null ? llmProvider : DEFAULT_LLM_PROVIDER;
            return this;
        }

        public Builder llmModel(String llmModel) {
            this.llmModel = llmModel != null ? llmModel : DEFAULT_LLM_MODEL;
            return this;
        }

        public Builder ollamaBaseUrl(String ollamaBaseUrl) {
            this.ollamaBaseUrl = ollamaBaseUrl != null ? ollamaBaseUrl : DEFAULT_OLLAMA_BASE_URL;
            return this;
        }

        public EngineSettings build() {
            return new EngineSettings(this);
        }
    }
}
