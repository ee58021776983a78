package com.vedant.salesanalyst.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vedant.salesanalyst.exception.LlmException;
import com.vedant.salesanalyst.llm.EmbeddingModel;
import com.vedant.salesanalyst.llm.LanguageModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.*;

/**
 * Talks to an OpenAI-compatible provider (OpenRouter by default) for chat completions
 * and embeddings.
 */
@Service
public class LLMService implements LanguageModel, EmbeddingModel {

    private static final Logger log = LoggerFactory.getLogger(LLMService.class);

    private final String apiKey;
    private final String apiUrl;
    private final String embeddingUrl;
    private final String model;
    private final String embeddingModel;
    private final HttpClient httpClient;
    private final ObjectMapper mapper = new ObjectMapper();

    @Autowired
    public LLMService(
            @Value("${llm.api.key:}") String apiKey,
            @Value("${llm.api.url:https://openrouter.ai/api/v1/chat/completions}") String apiUrl,
            @Value("${llm.embedding.url:https://openrouter.ai/api/v1/embeddings}") String embeddingUrl,
            @Value("${llm.model:openai/gpt-4o-mini}") String model,
            @Value("${llm.embedding.model:openai/text-embedding-3-small}") String embeddingModel
    ) {
        this(apiKey, apiUrl, embeddingUrl, model, embeddingModel, HttpClient.newHttpClient());
    }

    LLMService(String apiKey, String apiUrl, String embeddingUrl, String model, String embeddingModel,
               HttpClient httpClient) {
        this.apiKey = apiKey;
        this.apiUrl = apiUrl;
        this.embeddingUrl = embeddingUrl;
        this.model = model;
        this.embeddingModel = embeddingModel;
        this.httpClient = httpClient;
    }

    /* ============================================================
       COMPLETION
       ============================================================ */
    @Override
    public String complete(String prompt, double temperature, int maxTokens) {
        Map<String, Object> payload = new HashMap<>();
        payload.put("model", model);
        payload.put("messages", List.of(Map.of("role", "user", "content", prompt)));
        payload.put("max_tokens", maxTokens);
        payload.put("temperature", temperature);

        JsonNode root = post(apiUrl, payload);
        JsonNode choices = root.path("choices");
        JsonNode contentNode = choices.isArray() && choices.size() > 0
                ? choices.get(0).path("message").path("content")
                : null;

        if (contentNode == null || contentNode.isMissingNode() || contentNode.isNull()) {
            log.error("LLM response missing 'message.content'");
            throw new LlmException("LLM response missing 'message.content'");
        }
        return contentNode.asText().trim();
    }

    /* ============================================================
       EMBEDDING
       ============================================================ */
    @Override
    public float[] embed(String text) {
        Map<String, Object> payload = new HashMap<>();
        payload.put("model", embeddingModel);
        payload.put("input", text);

        JsonNode root = post(embeddingUrl, payload);
        JsonNode data = root.path("data");
        JsonNode vector = data.isArray() && data.size() > 0 ? data.get(0).path("embedding") : null;

        if (vector == null || !vector.isArray() || vector.size() == 0) {
            log.error("Embedding response missing 'data[0].embedding'");
            throw new LlmException("Embedding response missing 'data[0].embedding'");
        }
        float[] out = new float[vector.size()];
        for (int i = 0; i < out.length; i++) {
            out[i] = (float) vector.get(i).asDouble();
        }
        return out;
    }

    private JsonNode post(String url, Map<String, Object> payload) {
        if (apiKey == null || apiKey.isBlank()) {
            log.warn("API KEY missing, cannot call {}", url);
            throw new LlmException("LLM API key is not configured (llm.api.key)");
        }
        try {
            String body = mapper.writeValueAsString(payload);

            HttpRequest request = HttpRequest.newBuilder()
                    .uri(URI.create(url))
                    .header("Authorization", "Bearer " + apiKey)
                    .header("Content-Type", "application/json")
                    .header("HTTP-Referer", "http://localhost")
                    .header("X-Title", "SalesAnalyst")
                    .POST(HttpRequest.BodyPublishers.ofString(body))
                    .build();

            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());

            log.debug("=== LLM RAW RESPONSE ===\n{}\n=========================", response.body());

            if (response.statusCode() < 200 || response.statusCode() >= 300) {
                log.error("LLM returned non-200 status: {}", response.statusCode());
                throw new LlmException("LLM provider returned HTTP " + response.statusCode());
            }
            return mapper.readTree(response.body());
        } catch (IOException e) {
            throw new LlmException("LLM call to " + url + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LlmException("LLM call to " + url + " was interrupted", e);
        }
    }
}
