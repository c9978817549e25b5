package com.agentflow.llm.ollama;

import com.agentflow.llm.ChatMessage;
import com.agentflow.llm.LlmClient;
import com.agentflow.llm.LlmException;
import com.agentflow.llm.LlmOptions;
import com.agentflow.llm.LlmResponse;
import com.agentflow.llm.StructuredResponse;
import com.agentflow.llm.ToolCall;
import com.agentflow.llm.ToolSpec;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class OllamaLlmClientTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private HttpServer server;
    private final AtomicReference<String> lastRequest = new AtomicReference<>();
    private final AtomicReference<String> nextBody = new AtomicReference<>();
    private final AtomicInteger nextStatus = new AtomicInteger(200);

    @BeforeEach
    void startServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/api/chat", exchange -> {
            lastRequest.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            byte[] body = nextBody.get().getBytes(StandardCharsets.UTF_8);
            exchange.getResponseHeaders().add("Content-Type", "application/json");
            exchange.sendResponseHeaders(nextStatus.get(), body.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(body);
            }
        });
        server.start();
    }

    @AfterEach
    void stopServer() {
        server.stop(0);
    }

    private LlmClient client(Double temperature) {
        String baseUrl = "http://127.0.0.1:" + server.getAddress().getPort() + "/";
        return new OllamaLlmClientFactory(baseUrl).create(new LlmOptions("ollama", "llama3.2", temperature, 256, null));
    }

    @Test
    void invokeWithTools_sendsToolsAndParsesToolCalls() throws Exception {
        nextBody.set("""
                {"model":"llama3.2","message":{"role":"assistant","content":"",
                  "tool_calls":[{"function":{"name":"echo","arguments":{"input":"hi"}}}]},
                 "done":true,"prompt_eval_count":12,"eval_count":5}
                """);

        LlmResponse response = client(0.2).invokeWithTools(
                List.of(ChatMessage.user("Say hi")),
                List.of(new ToolSpec("echo", "Echoes", Map.of("type", "object"))));

        assertTrue(response.hasToolCalls());
        ToolCall call = response.getToolCalls().get(0);
        assertEquals("echo", call.getName());
        assertEquals(Map.of("input", "hi"), call.getArguments());
        assertEquals(12, response.getUsage().getPromptTokens());
        assertEquals(5, response.getUsage().getCompletionTokens());

        JsonNode sent = MAPPER.readTree(lastRequest.get());
        assertEquals("llama3.2", sent.path("model").asText());
        assertFalse(sent.path("stream").asBoolean(true));
        assertEquals("echo", sent.path("tools").get(0).path("function").path("name").asText());
        assertEquals("function", sent.path("tools").get(0).path("type").asText());
        assertEquals(0.2, sent.path("options").path("temperature").asDouble());
        assertEquals(256, sent.path("options").path("num_predict").asInt());
        assertTrue(sent.path("format").isMissingNode());
    }

    @Test
    void invokeWithTools_sendsToolResultMessages() throws Exception {
        nextBody.set("{\"message\":{\"role\":\"assistant\",\"content\":\"done\"}}");

        LlmResponse response = client(null).invokeWithTools(List.of(
                ChatMessage.user("Say hi"),
                ChatMessage.assistant("", List.of(new ToolCall(null, "echo", Map.of("input", "hi")))),
                ChatMessage.tool("echo", "ECHO: hi")), List.of());

        assertEquals("done", response.getContent());
        assertEquals("llama3.2", response.getModel());
        JsonNode messages = MAPPER.readTree(lastRequest.get()).path("messages");
        assertEquals("echo", messages.get(1).path("tool_calls").get(0).path("function").path("name").asText());
        assertEquals("tool", messages.get(2).path("role").asText());
        assertEquals("echo", messages.get(2).path("tool_name").asText());
        assertTrue(MAPPER.readTree(lastRequest.get()).path("options").path("temperature").isMissingNode());
    }

    @Test
    void invokeStructured_sendsSchemaAsFormatAndParsesObject() throws Exception {
        nextBody.set("""
                {"model":"llama3.2","message":{"role":"assistant","content":"{\\"score\\": 8, \\"notes\\": [\\"tight\\"]}"},
                 "prompt_eval_count":30,"eval_count":9}
                """);
        Map<String, Object> schema = Map.of("type", "object", "properties", Map.of("score", Map.of("type", "integer")));

        StructuredResponse response = client(null).invokeStructured(List.of(ChatMessage.user("Score it")), schema);

        assertTrue(response.isParsed());
        assertEquals(8, response.getValue().get("score"));
        assertEquals(List.of("tight"), response.getValue().get("notes"));
        assertEquals(39, response.getUsage().getTotalTokens());
        JsonNode sent = MAPPER.readTree(lastRequest.get());
        assertEquals("object", sent.path("format").path("type").asText());
        assertTrue(sent.path("tools").isMissingNode());
    }

    @Test
    void invokeStructured_nonJsonReplyIsUnparsed() {
        nextBody.set("{\"message\":{\"role\":\"assistant\",\"content\":\"Sure! The score is 8.\"}}");

        StructuredResponse response = client(null).invokeStructured(List.of(ChatMessage.user("Score it")), Map.of());

        assertFalse(response.isParsed());
        assertNull(response.getValue());
        assertEquals("Sure! The score is 8.", response.getRawText());
    }

    @Test
    void httpErrorRaisesLlmException() {
        nextStatus.set(500);
        nextBody.set("{\"error\":\"model not found\"}");

        LlmException e = assertThrows(LlmException.class,
                () -> client(null).invokeWithTools(List.of(ChatMessage.user("x")), List.of()));

        assertTrue(e.getMessage().startsWith("Ollama API error: 500"));
    }

    @Test
    void factory_apiBaseOverridesDefault() {
        OllamaLlmClientFactory factory = new OllamaLlmClientFactory(null);

        OllamaLlmClient defaulted = (OllamaLlmClient) factory.create(new LlmOptions("ollama", "m", null, null, null));
        OllamaLlmClient overridden = (OllamaLlmClient) factory.create(new LlmOptions("ollama", "m", null, null, "http://gpu:11434/"));

        assertEquals(OllamaLlmClientFactory.DEFAULT_BASE_URL, defaulted.getBaseUrl());
        assertEquals("http://gpu:11434", overridden.getBaseUrl());
    }
}
