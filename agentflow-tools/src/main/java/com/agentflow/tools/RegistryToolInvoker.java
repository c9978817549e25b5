package com.agentflow.tools;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;

/**
 * {@link ToolInvoker} backed by a {@link ToolRegistry}. Every failure surfaces as {@link ToolExecutionException}.
 */
public final class RegistryToolInvoker implements ToolInvoker {

    private static final Logger log = LoggerFactory.getLogger(RegistryToolInvoker.class);

    private final ToolRegistry registry;

    public RegistryToolInvoker(ToolRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    @Override
    public Object invoke(String name, Map<String, Object> arguments) {
        Tool tool = registry.find(name)
                .orElseThrow(() -> new ToolExecutionException(name, "Unknown tool: " + name));
        Map<String, Object> args = arguments != null ? arguments : Map.of();
        long start = System.nanoTime();
        try {
            Object result = tool.execute(args);
            log.debug("Tool call completed | tool={} durationMs={}", name, (System.nanoTime() - start) / 1_000_000);
            return result;
        } catch (ToolExecutionException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ToolExecutionException(name, "Tool " + name + " interrupted", e);
        } catch (Exception e) {
            log.warn("Tool call failed | tool={} durationMs={} error={}", name, (System.nanoTime() - start) / 1_000_000, e.toString());
            throw new ToolExecutionException(name, "Tool " + name + " failed: " + e.getMessage(), e);
        }
    }

    public ToolRegistry getRegistry() {
        return registry;
    }
}
