package com.agentflow.workflow.load;

import com.agentflow.workflow.WorkflowConfigs;
import com.agentflow.workflow.config.WorkflowConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Loads a workflow document from disk. Files ending in {@code .yaml} or {@code .yml} are read as YAML,
 * everything else as JSON. Missing files and parse errors surface as {@link WorkflowConfigLoadException}.
 */
public final class WorkflowConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(WorkflowConfigLoader.class);

    private WorkflowConfigLoader() {
    }

    public static WorkflowConfig load(Path path) {
        if (path == null) {
            throw new WorkflowConfigLoadException("null", "Config path is null", null);
        }
        String source = path.toString();
        String content;
        try {
            content = Files.readString(path, StandardCharsets.UTF_8);
        } catch (NoSuchFileException e) {
            throw new WorkflowConfigLoadException(source, "Config file not found: " + source, e);
        } catch (IOException e) {
            throw new WorkflowConfigLoadException(source, "Failed to read config file " + source + ": " + e.getMessage(), e);
        }
        WorkflowConfig config = parse(content, isYaml(path), source);
        log.info("Loaded workflow config | path={} flow={} nodes={} edges={}",
                source, config.getName(), config.getNodes().size(), config.getEdges().size());
        return config;
    }

    /**
     * Parses document text.
     *
     * @param yaml   true for YAML, false for JSON
     * @param source label used in error messages (file name, "inline", ...)
     */
    public static WorkflowConfig parse(String content, boolean yaml, String source) {
        if (content == null || content.isBlank()) {
            throw new WorkflowConfigLoadException(source, "Config document is empty: " + source, null);
        }
        try {
            return yaml ? WorkflowConfigs.fromYaml(content) : WorkflowConfigs.fromJson(content);
        } catch (UncheckedIOException e) {
            IOException cause = e.getCause();
            throw new WorkflowConfigLoadException(source,
                    "Failed to parse config " + source + ": " + (cause != null ? cause.getMessage() : e.getMessage()), e);
        }
    }

    static boolean isYaml(Path path) {
        Path fileName = path.getFileName();
        if (fileName == null) return false;
        String name = fileName.toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".yaml") || name.endsWith(".yml");
    }
}
