package com.agentflow.config;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EngineSettingsTest {

    @Test
    void fromEnvironment_usesDefaultsWhenUnset() {
        EngineSettings settings = EngineSettings.fromEnvironment(Map.<String, String>of()::get);

        assertEquals(10, settings.getToolLoopMaxIterations());
        assertEquals(2, settings.getOutputMaxRetries());
        assertEquals(Duration.ofSeconds(120), settings.getRunTimeout());
        assertEquals(8, settings.getBranchPoolSize());
        assertTrue(settings.isRunLedgerEnabled());
        assertEquals("ollama", settings.getLlmProvider());
        assertEquals("llama3.2", settings.getLlmModel());
        assertEquals("http://localhost:11434", settings.getOllamaBaseUrl());
    }

    @Test
    void fromEnvironment_readsOverrides() {
        Map<String, String> env = Map.of(
                EngineSettings.ENV_TOOL_LOOP_MAX_ITERATIONS, "4",
                EngineSettings.ENV_OUTPUT_MAX_RETRIES, "0",
                EngineSettings.ENV_RUN_TIMEOUT_SECONDS, " 30 ",
                EngineSettings.ENV_RUN_LEDGER, "false",
                EngineSettings.ENV_LLM_MODEL, "qwen2.5",
                EngineSettings.ENV_OLLAMA_BASE_URL, "http://gpu-box:11434");

        EngineSettings settings = EngineSettings.fromEnvironment(env::get);

        assertEquals(4, settings.getToolLoopMaxIterations());
        assertEquals(0, settings.getOutputMaxRetries());
        assertEquals(30, settings.getRunTimeoutSeconds());
        assertFalse(settings.isRunLedgerEnabled());
        assertEquals("qwen2.5", settings.getLlmModel());
        assertEquals("http://gpu-box:11434", settings.getOllamaBaseUrl());
    }

    @Test
    void fromEnvironment_invalidValuesFallBack() {
        Map<String, String> env = Map.of(
                EngineSettings.ENV_TOOL_LOOP_MAX_ITERATIONS, "ten",
                EngineSettings.ENV_OUTPUT_MAX_RETRIES, "-1",
                EngineSettings.ENV_BRANCH_POOL_SIZE, "0");

        EngineSettings settings = EngineSettings.fromEnvironment(env::get);

        assertEquals(EngineSettings.DEFAULT_TOOL_LOOP_MAX_ITERATIONS, settings.getToolLoopMaxIterations());
        assertEquals(EngineSettings.DEFAULT_OUTPUT_MAX_RETRIES, settings.getOutputMaxRetries());
        assertEquals(EngineSettings.DEFAULT_BRANCH_POOL_SIZE, settings.getBranchPoolSize());
    }

    @Test
    void toBuilder_copiesValues() {
        EngineSettings base = EngineSettings.builder().runTimeoutSeconds(5).llmModel("m").build();

        EngineSettings copy = base.toBuilder().outputMaxRetries(7).build();

        assertEquals(5, copy.getRunTimeoutSeconds());
        assertEquals("m", copy.getLlmModel());
        assertEquals(7, copy.getOutputMaxRetries());
    }
}
