package com.aistudio.orchestrator.provider;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link TextGenerationProvider} over the Anthropic Messages API.
 *
 * Raw {@link HttpClient} rather than an SDK: one REST endpoint, and the exact
 * request on the wire stays visible when debugging prompts.
 */
@Component
public class ClaudeTextProvider implements TextGenerationProvider {

    private static final Logger log = LoggerFactory.getLogger(ClaudeTextProvider.class);

    private static final String PROVIDER = "anthropic";
    private static final String API_VER  = "2023-06-01";

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    // -------------------------------------------------------------------------
    // Wire records
    // -------------------------------------------------------------------------

    public record Message(String role, String content) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record MessagesResponse(List<ContentBlock> content) {
        @JsonIgnoreProperties(ignoreUnknown = true)
        public record ContentBlock(String type, String text) {}

        public String firstText() {
            return content == null ? null : content.stream()
                    .filter(b -> "text".equals(b.type()))
                    .map(ContentBlock::text)
                    .findFirst()
                    .orElse(null);
        }
    }

    // -------------------------------------------------------------------------
    // Fields
    // -------------------------------------------------------------------------

    private final HttpClient   http;
    private final ObjectMapper json;
    private final String       apiKey;
    private final String       model;
    private final String       baseUrl;

    public ClaudeTextProvider(@Value("${ai-studio.providers.text.api-key:}") String apiKey,
                              @Value("${ai-studio.providers.text.model:claude-sonnet-4-5}") String model,
                              @Value("${ai-studio.providers.text.base-url:https://api.anthropic.com}") String baseUrl,
                              ObjectMapper objectMapper) {
        this.apiKey  = apiKey;
        this.model   = model;
        this.baseUrl = baseUrl;
        this.json    = objectMapper;
        this.http    = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    // -------------------------------------------------------------------------
    // TextGenerationProvider
    // -------------------------------------------------------------------------

    @Override
    public String complete(String system, String prompt, int maxTokens) {
        if (apiKey == null || apiKey.isBlank()) {
            throw new ProviderException(PROVIDER, 0, "no API key configured (ai-studio.providers.text.api-key)");
        }
        try {
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("model", model);
            body.put("max_tokens", maxTokens);
            if (system != null && !system.isBlank()) body.put("system", system);
            body.put("messages", List.of(new Message("user", prompt)));

            HttpRequest request = HttpRequest.newBuilder()
                    .uri(URI.create(baseUrl + "/v1/messages"))
                    .timeout(Duration.ofSeconds(120))
                    .header("content-type",      "application/json")
                    .header("x-api-key",         apiKey)
                    .header("anthropic-version", API_VER)
                    .POST(HttpRequest.BodyPublishers.ofString(json.writeValueAsString(body)))
                    .build();

            HttpResponse<String> response = http.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() != 200) {
                throw new ProviderException(PROVIDER, response.statusCode(), response.body());
            }

            String text = json.readValue(response.body(), MessagesResponse.class).firstText();
            if (text == null) {
                throw new ProviderException(PROVIDER, response.statusCode(), "no text block in response");
            }
            log.debug("Text completion: {} chars (model={})", text.length(), model);
            return text;

        } catch (ProviderException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProviderException(PROVIDER, "call interrupted", e);
        } catch (Exception e) {
            throw new ProviderException(PROVIDER, "call failed", e);
        }
    }

    @Override
    public Map<String, Object> completeJson(String system, String prompt, int maxTokens) {
        String reply = complete(system, prompt, maxTokens);
        String candidate = ResponseParser.extractJson(reply)
                .orElseThrow(() -> new ProviderException(PROVIDER, 200, "reply contains no JSON object"));
        try {
            return json.readValue(candidate, MAP_TYPE);
        } catch (Exception e) {
            throw new ProviderException(PROVIDER, "reply is not valid JSON", e);
        }
    }
}
