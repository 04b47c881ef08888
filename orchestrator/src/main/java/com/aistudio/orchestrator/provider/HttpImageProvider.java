package com.aistudio.orchestrator.provider;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
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
import java.util.Map;

/**
 * HTTP client for the image-generation service.
 *
 * One endpoint, {@code POST /images/generate}, answering
 * {@code {"image_url": "..."}}. Called from worker threads, so blocking
 * I/O is acceptable.
 */
@Component
public class HttpImageProvider implements ImageGenerationProvider {

    private static final Logger log = LoggerFactory.getLogger(HttpImageProvider.class);

    private static final String PROVIDER = "image-service";

    @JsonIgnoreProperties(ignoreUnknown = true)
    record GenerateResponse(@JsonProperty("image_url") String imageUrl) {}

    private final HttpClient   http;
    private final ObjectMapper json;
    private final String       baseUrl;

    public HttpImageProvider(@Value("${ai-studio.providers.image.base-url:http://localhost:8100}") String baseUrl,
                             ObjectMapper objectMapper) {
        this.baseUrl = baseUrl;
        this.json    = objectMapper;
        this.http    = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    @Override
    public GeneratedImage generate(String prompt, String style) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("prompt", prompt);
        if (style != null) payload.put("style", style);

        long started = System.currentTimeMillis();
        String respBody = post("/images/generate", toJson(payload), Duration.ofSeconds(180));
        try {
            GenerateResponse resp = json.readValue(respBody, GenerateResponse.class);
            if (resp.imageUrl() == null || resp.imageUrl().isBlank()) {
                throw new ProviderException(PROVIDER, 200, "response has no image_url");
            }
            long elapsed = System.currentTimeMillis() - started;
            log.info("Generated image {} in {} ms", resp.imageUrl(), elapsed);
            return new GeneratedImage(resp.imageUrl(), prompt, elapsed);
        } catch (JsonProcessingException e) {
            throw new ProviderException(PROVIDER, "failed to parse generate response", e);
        }
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    private String post(String path, String jsonBody, Duration timeout) {
        try {
            HttpRequest req = HttpRequest.newBuilder()
                    .uri(URI.create(baseUrl + path))
                    .timeout(timeout)
                    .header("Content-Type", "application/json")
                    .header("Accept",       "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(jsonBody))
                    .build();
            HttpResponse<String> resp = http.send(req, HttpResponse.BodyHandlers.ofString());
            if (resp.statusCode() < 200 || resp.statusCode() >= 300) {
                throw new ProviderException(PROVIDER, resp.statusCode(), resp.body());
            }
            return resp.body();
        } catch (ProviderException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProviderException(PROVIDER, path + " interrupted", e);
        } catch (Exception e) {
            throw new ProviderException(PROVIDER, path + " failed", e);
        }
    }

    private String toJson(Object obj) {
        try {
            return json.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            throw new ProviderException(PROVIDER, "JSON serialization failed", e);
        }
    }
}
