package com.agentflow.llm.ollama;

import com.agentflow.llm.LlmClient;
import com.agentflow.llm.LlmClientFactory;
import com.agentflow.llm.LlmOptions;

import java.net.http.HttpClient;
import java.time.Duration;

/**
 * Creates {@link OllamaLlmClient}s sharing one {@link HttpClient}. A node's {@code api_base} overrides the base URL.
 */
public final class OllamaLlmClientFactory implements LlmClientFactory {

    public static final String PROVIDER = "ollama";
    public static final String DEFAULT_BASE_URL = "http://localhost:11434";

    private final String baseUrl;
    private final HttpClient httpClient;

    public OllamaLlmClientFactory(String baseUrl) {
        this(baseUrl, HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(10)).build());
    }

    public OllamaLlmClientFactory(String baseUrl, HttpClient httpClient) {
        this.baseUrl = baseUrl != null && !baseUrl.isBlank() ? baseUrl.trim() : DEFAULT_BASE_URL;
        this.httpClient = httpClient;
    }

    @Override
    public LlmClient create(LlmOptions options) {
        String url = options.getApiBase() != null && !options.getApiBase().isBlank() ? options.getApiBase() : baseUrl;
        return new OllamaLlmClient(url, options, httpClient);
    }

    public String getBaseUrl() {
        return baseUrl;
    }
}
