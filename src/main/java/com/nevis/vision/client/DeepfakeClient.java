package com.nevis.vision.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.nevis.vision.availability.HealthProbe;
import com.nevis.vision.model.Capability;
import com.nevis.vision.normalize.ResponseNormalizer;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;

import java.util.Base64;
import java.util.Map;

public class DeepfakeClient implements HealthProbe {

    private final RestClient restClient;
    private final RestClient probeClient;
    private final String apiKey;
    private final ResponseNormalizer normalizer;

    public DeepfakeClient(RestClient restClient, RestClient probeClient, String apiKey, ResponseNormalizer normalizer) {
        this.restClient = restClient;
        this.probeClient = probeClient;
        this.apiKey = apiKey;
        this.normalizer = normalizer;
    }

    public JsonNode analyze(byte[] image) {
        return restClient.post()
            .uri("/v1/analyze")
            .header(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey)
            .contentType(MediaType.APPLICATION_JSON)
            .body(Map.of("image_base64", Base64.getEncoder().encodeToString(image)))
            .retrieve()
            .body(JsonNode.class);
    }

    @Override
    public String backendId() {
        return Capability.DETECT_DEEPFAKE.getBackendId();
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
