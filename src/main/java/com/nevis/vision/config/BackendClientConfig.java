package com.nevis.vision.config;

import com.nevis.vision.client.DeepfakeClient;
import com.nevis.vision.client.FaceRecognitionClient;
import com.nevis.vision.client.GoogleVisionClient;
import com.nevis.vision.client.ImageEmbeddingClient;
import com.nevis.vision.client.ReverseImageSearchClient;
import com.nevis.vision.client.TinEyeClient;
import com.nevis.vision.normalize.ResponseNormalizer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.time.Duration;

/**
 * One {@link RestClient} for calls and one with the short probe timeout, per backend.
 */
@Slf4j
@Configuration
public class BackendClientConfig {

    @Bean
    public ImageEmbeddingClient imageEmbeddingClient(RestClient.Builder builder, VisionProperties properties,
                                                     ResponseNormalizer normalizer) {
        VisionProperties.Embedding embedding = properties.embedding();
        return new ImageEmbeddingClient(
            restClient(builder, embedding.baseUrl(), embedding.timeout()),
            restClient(builder, embedding.baseUrl(), properties.availability().probeTimeout()),
            embedding.apiKey(),
            normalizer);
    }

    @Bean
    public FaceRecognitionClient faceRecognitionClient(RestClient.Builder builder, VisionProperties properties,
                                                       ResponseNormalizer normalizer) {
        VisionProperties.Face face = properties.face();
        return new FaceRecognitionClient(
            restClient(builder, face.baseUrl(), face.timeout()),
            restClient(builder, face.baseUrl(), properties.availability().probeTimeout()),
            normalizer);
    }

    @Bean
    public DeepfakeClient deepfakeClient(RestClient.Builder builder, VisionProperties properties,
                                         ResponseNormalizer normalizer) {
        VisionProperties.Deepfake deepfake = properties.deepfake();
        return new DeepfakeClient(
            restClient(builder, deepfake.baseUrl(), deepfake.timeout()),
            restClient(builder, deepfake.baseUrl(), properties.availability().probeTimeout()),
            deepfake.apiKey(),
            normalizer);
    }

    @Bean
    public ReverseImageSearchClient reverseImageSearchClient(RestClient.Builder builder, VisionProperties properties) {
        VisionProperties.ReverseSearch search = properties.reverseSearch();
        String baseUrl = search.resolvedBaseUrl();
        log.info("Reverse image search provider: {} ({})", search.provider().getId(), baseUrl);

        return switch (search.provider()) {
            case TINEYE -> new TinEyeClient(
                restClient(builder, baseUrl, search.timeout()),
                restClient(builder, baseUrl, properties.availability().probeTimeout()),
                search.apiKey());
            case GOOGLE_VISION -> new GoogleVisionClient(restClient(builder, baseUrl, search.timeout()), search.apiKey());
        };
    }

    private RestClient restClient(RestClient.Builder builder, String baseUrl, Duration timeout) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(timeout);
        requestFactory.setReadTimeout(timeout);
        return builder.clone()
            .baseUrl(baseUrl)
            .requestFactory(requestFactory)
            .build();
    }
}
