package com.agentflow.llm.ollama;

import com.agentflow.llm.ChatMessage;
import com.agentflow.llm.LlmClient;
import com.agentflow.llm.LlmException;
import com.agentflow.llm.LlmOptions;
import com.agentflow.llm.LlmResponse;
import com.agentflow.llm.StructuredResponse;
import com.agentflow.llm.TokenUsage;
import com.agentflow.llm.ToolCall;
import com.agentflow.llm.ToolSpec;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * {@link LlmClient} for the Ollama chat API ({@code POST <baseUrl>/api/chat}, non-streaming).
 * Tool-enabled calls send {@code tools}; structured calls send the JSON schema as {@code format}
 * and parse the reply content as a JSON object.
 */
public final class OllamaLlmClient implements LlmClient {

    private static final Logger log = LoggerFactory.getLogger(OllamaLlmClient.class);

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() { };
    static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(120);

    private final String baseUrl;
    private final LlmOptions options;
    private final HttpClient httpClient;

    public OllamaLlmClient(String baseUrl, LlmOptions options, HttpClient httpClient) {
        this.baseUrl = stripTrailingSlash(Objects.requireNonNull(baseUrl, "baseUrl").trim());
        this.options = Objects.requireNonNull(options, "options");
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
    }

    @Override
    public LlmResponse invokeWithTools(List<ChatMessage> messages, List<ToolSpec> tools) {
        List<OllamaChatRequest.Tool> wireTools = new ArrayList<>();
        if (tools != null) {
            for (ToolSpec t : tools) {
                wireTools.add(new OllamaChatRequest.Tool(t.getName(), t.getDescription(), t.getParameters()));
            }
        }
        OllamaChatResponse resp = chat(new OllamaChatRequest(options.getModel(), toWire(messages), wireTools, null, requestOptions()));
        OllamaChatResponse.Message message = resp.getMessage();
        List<ToolCall> calls = new ArrayList<>();
        if (message != null && message.getToolCalls() != null) {
            for (OllamaChatResponse.ToolCall c : message.getToolCalls()) {
                if (c.getFunction() == null || c.getFunction().getName() == null) continue;
                calls.add(new ToolCall(c.getId(), c.getFunction().getName(), c.getFunction().getArguments()));
            }
        }
        return new LlmResponse(message != null ? message.getContent() : "", calls, usage(resp), modelOf(resp));
    }

    @Override
    public StructuredResponse invokeStructured(List<ChatMessage> messages, Map<String, Object> jsonSchema) {
        Object format = jsonSchema != null ? jsonSchema : "json";
        OllamaChatResponse resp = chat(new OllamaChatRequest(options.getModel(), toWire(messages), null, format, requestOptions()));
        String content = resp.getMessage() != null && resp.getMessage().getContent() != null ? resp.getMessage().getContent() : "";
        Map<String, Object> value = null;
        try {
            Object parsed = MAPPER.readValue(content, Object.class);
            if (parsed instanceof Map) {
                value = MAPPER.convertValue(parsed, MAP_TYPE);
            }
        } catch (JsonProcessingException e) {
            log.debug("Structured reply is not JSON | model={} error={}", options.getModel(), e.getOriginalMessage());
        }
        return new StructuredResponse(value, content, usage(resp), modelOf(resp));
    }

    private OllamaChatResponse chat(OllamaChatRequest req) {
        String json;
        try {
            json = MAPPER.writeValueAsString(req);
        } catch (JsonProcessingException e) {
            throw new LlmException("Failed to serialize Ollama request: " + e.getOriginalMessage(), e);
        }
        HttpRequest request = HttpRequest.newBuilder(URI.create(baseUrl + "/api/chat"))
                .header("Content-Type", "application/json")
                .timeout(REQUEST_TIMEOUT)
                .POST(HttpRequest.BodyPublishers.ofString(json, StandardCharsets.UTF_8))
                .build();
        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LlmException("Ollama call interrupted", e);
        } catch (IOException e) {
            throw new LlmException("Ollama call failed: " + e.getMessage(), e);
        }
        if (response.statusCode() != 200) {
            throw new LlmException("Ollama API error: " + response.statusCode() + " " + response.body());
        }
        try {
            OllamaChatResponse resp = MAPPER.readValue(response.body(), OllamaChatResponse.class);
            if (resp == null) {
                throw new LlmException("Ollama API returned an empty body");
            }
            return resp;
        } catch (JsonProcessingException e) {
            throw new LlmException("Unreadable Ollama response: " + e.getOriginalMessage(), e);
        }
    }

    private static List<OllamaChatRequest.Message> toWire(List<ChatMessage> messages) {
        List<OllamaChatRequest.Message> out = new ArrayList<>();
        if (messages == null) return out;
        for (ChatMessage m : messages) {
            List<OllamaChatRequest.ToolCall> calls = new ArrayList<>();
            for (ToolCall c : m.getToolCalls()) {
                calls.add(new OllamaChatRequest.ToolCall(c.getName(), c.getArguments()));
            }
            out.add(new OllamaChatRequest.Message(m.getRole(), m.getContent(), calls, m.getToolName()));
        }
        return out;
    }

    private Map<String, Object> requestOptions() {
        Map<String, Object> out = new LinkedHashMap<>();
        if (options.getTemperature() != null) out.put("temperature", options.getTemperature());
        if (options.getMaxTokens() != null) out.put("num_predict", options.getMaxTokens());
        return out;
    }

    private static TokenUsage usage(OllamaChatResponse resp) {
        long prompt = resp.getPromptEvalCount() != null ? resp.getPromptEvalCount() : 0;
        long completion = resp.getEvalCount() != null ? resp.getEvalCount() : 0;
        return new TokenUsage(prompt, completion);
    }

    private String modelOf(OllamaChatResponse resp) {
        return resp.getModel() != null && !resp.getModel().isBlank() ? resp.getModel() : options.getModel();
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public LlmOptions getOptions() {
        return options;
    }
}
