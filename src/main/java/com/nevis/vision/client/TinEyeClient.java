package com.nevis.vision.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.nevis.vision.model.ReverseSearchProvider;
import com.nevis.vision.model.ImageSource;
import com.nevis.vision.model.MatchTag;
import com.nevis.vision.model.ReverseSearchOptions;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.http.MediaType;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestClient;
import org.springframework.web.util.UriBuilder;

import java.net.URI;
import java.util.stream.Collectors;

/**
 * TinEye REST API. URL sources are searched with GET, byte sources are uploaded as multipart.
 */
public class TinEyeClient implements ReverseImageSearchClient {

    static final String API_KEY_HEADER = "X-API-KEY";
    static final int BACKLINK_LIMIT = 10;

    private final RestClient restClient;
    private final RestClient probeClient;
    private final String apiKey;

    public TinEyeClient(RestClient restClient, RestClient probeClient, String apiKey) {
        this.restClient = restClient;
        this.probeClient = probeClient;
        this.apiKey = apiKey;
    }

    @Override
    public ReverseSearchProvider provider() {
        return ReverseSearchProvider.TINEYE;
    }

    @Override
    public JsonNode search(ImageSource source, ReverseSearchOptions options) {
        if (source.isUrl()) {
            return restClient.get()
                .uri(builder -> searchUri(builder.queryParam("image_url", source.url().orElseThrow()), options))
                .header(API_KEY_HEADER, apiKey)
                .retrieve()
                .body(JsonNode.class);
        }

        MultiValueMap<String, Object> parts = new LinkedMultiValueMap<>();
        parts.add("image_upload", new ByteArrayResource(source.bytes().orElseThrow()) {
            @Override
            public String getFilename() {
                return "image";
            }
        });
        return restClient.post()
            .uri(builder -> searchUri(builder, options))
            .header(API_KEY_HEADER, apiKey)
            .contentType(MediaType.MULTIPART_FORM_DATA)
            .body(parts)
            .retrieve()
            .body(JsonNode.class);
    }

    private URI searchUri(UriBuilder builder, ReverseSearchOptions options) {
        builder.path("/search/")
            .queryParam("limit", options.limit())
            .queryParam("offset", options.offset())
            .queryParam("backlink_limit", BACKLINK_LIMIT)
            .queryParam("sort", options.sort().param())
            .queryParam("order", options.order().param());
        options.domain().ifPresent(domain -> builder.queryParam("domain", domain));
        if (!options.tagFilter().isEmpty()) {
            builder.queryParam("tags", options.tagFilter().stream()
                .map(MatchTag::name)
                .map(String::toLowerCase)
                .sorted()
                .collect(Collectors.joining(",")));
        }
        return builder.build();
    }

    @Override
    public boolean isConfigured() {
        return apiKey != null && !apiKey.isBlank();
    }

    /**
     * The index-size endpoint is cheap and authenticated, so a 2xx proves both reachability and key.
     */
    @Override
    public boolean check() {
        return probeClient.get()
            .uri("/image_count/")
            .header(API_KEY_HEADER, apiKey)
            .retrieve()
            .toBodilessEntity()
            .getStatusCode()
            .is2xxSuccessful();
    }
}
