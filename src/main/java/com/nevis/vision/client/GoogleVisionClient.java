package com.nevis.vision.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.nevis.vision.model.ReverseSearchProvider;
import com.nevis.vision.model.ImageSource;
import com.nevis.vision.model.ReverseSearchOptions;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;

import java.util.Base64;
import java.util.List;
import java.util.Map;

/**
 * Google Cloud Vision web detection. The API offers no health endpoint, so a configured key is
 * treated as healthy and real failures are caught on the call path.
 */
public class GoogleVisionClient implements ReverseImageSearchClient {

    static final int MAX_RESULTS = 20;

    private final RestClient restClient;
    private final String apiKey;

    public GoogleVisionClient(RestClient restClient, String apiKey) {
        this.restClient = restClient;
        this.apiKey = apiKey;
    }

    @Override
    public ReverseSearchProvider provider() {
        return ReverseSearchProvider.GOOGLE_VISION;
    }

    @Override
    public JsonNode search(ImageSource source, ReverseSearchOptions options) {
        Map<String, Object> image = source.url()
            .<Map<String, Object>>map(url -> Map.of("source", Map.of("imageUri", url)))
            .orElseGet(() -> Map.of("content", Base64.getEncoder().encodeToString(source.bytes().orElseThrow())));
        Map<String, Object> request = Map.of(
            "image", image,
            "features", List.of(Map.of("type", "WEB_DETECTION", "maxResults", MAX_RESULTS)));

        return restClient.post()
            .uri(builder -> builder.path("/v1/images:annotate").queryParam("key", apiKey).build())
            .contentType(MediaType.APPLICATION_JSON)
            .body(Map.of("requests", List.of(request)))
            .retrieve()
            .body(JsonNode.class);
    }

    @Override
    public boolean isConfigured() {
        return apiKey != null && !apiKey.isBlank();
    }

    @Override
    public boolean check() {
        return isConfigured();
    }
}
