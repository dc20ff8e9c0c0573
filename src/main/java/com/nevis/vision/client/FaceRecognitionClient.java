package com.nevis.vision.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.nevis.vision.availability.HealthProbe;
import com.nevis.vision.model.Capability;
import com.nevis.vision.normalize.ResponseNormalizer;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;

import java.util.Base64;
import java.util.Map;

/**
 * HTTP adapter for the DeepFace-style face recognition service. The service needs no credentials.
 */
public class FaceRecognitionClient implements HealthProbe {

    private final RestClient restClient;
    private final RestClient probeClient;
    private final ResponseNormalizer normalizer;

    public FaceRecognitionClient(RestClient restClient, RestClient probeClient, ResponseNormalizer normalizer) {
        this.restClient = restClient;
        this.probeClient = probeClient;
        this.normalizer = normalizer;
    }

    public JsonNode extractEmbedding(byte[] image) {
        return restClient.post()
            .uri("/api/v1/extract-embedding")
            .contentType(MediaType.APPLICATION_JSON)
            .body(Map.of("image_base64", Base64.getEncoder().encodeToString(image)))
            .retrieve()
            .body(JsonNode.class);
    }

    public JsonNode compareFaces(float[] first, float[] second, double threshold) {
        return restClient.post()
            .uri("/api/v1/compare-faces")
            .contentType(MediaType.APPLICATION_JSON)
            .body(Map.of("embedding1", first, "embedding2", second, "threshold", threshold))
            .retrieve()
            .body(JsonNode.class);
    }

    @Override
    public String backendId() {
        return Capability.COMPARE_FACES.getBackendId();
    }

    @Override
    public boolean check() {
        JsonNode health = probeClient.get()
            .uri("/api/v1/health")
            .retrieve()
            .body(JsonNode.class);
        return normalizer.isFaceServiceReady(health);
    }
}
