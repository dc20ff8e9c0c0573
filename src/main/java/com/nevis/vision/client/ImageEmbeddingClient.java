package com.nevis.vision.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.nevis.vision.availability.HealthProbe;
import com.nevis.vision.model.Capability;
import com.nevis.vision.model.ImageSource;
import com.nevis.vision.normalize.ResponseNormalizer;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;

import java.util.Base64;
import java.util.Map;

/**
 * HTTP adapter for the image-embedding service.
 */
public class ImageEmbeddingClient implements HealthProbe {

    private final RestClient restClient;
    private final RestClient probeClient;
    private final String apiKey;
    private final ResponseNormalizer normalizer;

    public ImageEmbeddingClient(RestClient restClient, RestClient probeClient, String apiKey,
                                ResponseNormalizer normalizer) {
        this.restClient = restClient;
        this.probeClient = probeClient;
        this.apiKey = apiKey;
        this.normalizer = normalizer;
    }

    public JsonNode embed(ImageSource source) {
        Map<String, String> body = source.url()
            .map(url -> Map.of("image_url", url))
            .orElseGet(() -> Map.of("image_base64", Base64.getEncoder().encodeToString(source.bytes().orElseThrow())));

        return restClient.post()
            .uri("/v1/embeddings")
            .header(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey)
            .contentType(MediaType.APPLICATION_JSON)
            .body(body)
            .retrieve()
            .body(JsonNode.class);
    }

    @Override
    public String backendId() {
        return Capability.EMBED_IMAGE.getBackendId();
    }

    @Override
    public boolean isConfigured() {
        return apiKey != null && !apiKey.isBlank();
    }

    @Override
    public boolean check() {
        JsonNode health = probeClient.get()
            .uri("/health")
            .header(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey)
            .retrieve()
            .body(JsonNode.class);
        return normalizer.isHealthy(health);
    }
}
