package com.dealerscout.core.llm;

import com.dealerscout.core.model.ScrapeConfig;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;

/**
 * OpenAI 호환 /v1/chat/completions 클라이언트(java.net.http + Jackson).
 * temperature=0, 응답은 choices[0].message.content.
 */
public class OpenAiChatClient implements LlmClient {

    private static final Logger LOG = LoggerFactory.getLogger(OpenAiChatClient.class);

    /** 테스트/모킹용 송신 훅 */
    @FunctionalInterface
    public interface HttpSender {
        HttpResponse<String> send(HttpRequest req) throws Exception;
    }

    private final ObjectMapper om = new ObjectMapper();
    private final ScrapeConfig.LlmCfg cfg;
    private final String apiKey;
    private final HttpSender sender;

    public OpenAiChatClient(ScrapeConfig.LlmCfg cfg, String apiKey) {
        this(cfg, apiKey, defaultSender(cfg));
    }

    /** 테스트용 생성자(송신 훅 주입) */
    public OpenAiChatClient(ScrapeConfig.LlmCfg cfg, String apiKey, HttpSender sender) {
        this.cfg = Objects.requireNonNull(cfg, "cfg");
        if (apiKey == null || apiKey.isBlank()) throw new IllegalArgumentException("apiKey is blank");
        this.apiKey = apiKey;
        this.sender = Objects.requireNonNull(sender, "sender");
    }

    /**
     * llm.enabled이고 API 키 환경변수가 있으면 클라이언트, 아니면 null.
     */
    public static OpenAiChatClient fromConfig(ScrapeConfig.LlmCfg cfg) {
        if (cfg == null || !cfg.isEnabled()) return null;
        String key = System.getenv(cfg.getApiKeyEnv());
        if (key == null || key.isBlank()) {
            LOG.warn("LLM fallback enabled but ${} is not set; LLM extraction disabled", cfg.getApiKeyEnv());
            return null;
        }
        return new OpenAiChatClient(cfg, key);
    }

    private static HttpSender defaultSender(ScrapeConfig.LlmCfg cfg) {
        HttpClient client = HttpClient.newBuilder()
                .connectTimeout(Duration.ofMillis(cfg.getTimeoutMs()))
                .build();
        return req -> client.send(req, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
    }

    @Override
    public String complete(String systemPrompt, String userContent) throws LlmException {
        String body = requestBody(systemPrompt, userContent);
        HttpRequest req = HttpRequest.newBuilder(URI.create(cfg.getEndpoint()))
                .timeout(Duration.ofMillis(cfg.getTimeoutMs()))
                .header("Authorization", "Bearer " + apiKey)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body, StandardCharsets.UTF_8))
                .build();

        HttpResponse<String> resp;
        try {
            resp = sender.send(req);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new LlmException("LLM request interrupted", ie);
        } catch (Exception e) {
            throw new LlmException("LLM request failed: " + e.getMessage(), e);
        }

        int sc = resp.statusCode();
        if (sc == 429) throw new LlmException("LLM rate limit exceeded (429)");
        if (sc < 200 || sc >= 300) {
            throw new LlmException("LLM returned HTTP " + sc + ": " + clamp(resp.body(), 300));
        }
        return contentOf(resp.body());
    }

    String requestBody(String systemPrompt, String userContent) throws LlmException {
        ObjectNode root = om.createObjectNode();
        root.put("model", cfg.getModel());
        root.put("temperature", 0);
        ArrayNode messages = root.putArray("messages");
        messages.addObject().put("role", "system").put("content", systemPrompt);
        messages.addObject().put("role", "user").put("content", userContent);
        try {
            return om.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new LlmException("cannot encode LLM request", e);
        }
    }

    String contentOf(String responseBody) throws LlmException {
        try {
            JsonNode content = om.readTree(responseBody == null ? "" : responseBody)
                    .path("choices").path(0).path("message").path("content");
            if (!content.isTextual()) throw new LlmException("LLM response has no message content");
            return content.asText();
        } catch (JsonProcessingException e) {
            throw new LlmException("LLM response is not JSON", e);
        }
    }

    private static String clamp(String s, int max) {
        if (s == null) return "";
        return s.length() <= max ? s : s.substring(0, max) + "...";
    }
}
