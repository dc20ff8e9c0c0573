package com.nevis.vision.service;

import com.nevis.vision.availability.AvailabilityCache;
import com.nevis.vision.availability.BackendState;
import com.nevis.vision.client.DeepfakeClient;
import com.nevis.vision.client.FaceRecognitionClient;
import com.nevis.vision.client.ImageEmbeddingClient;
import com.nevis.vision.client.ReverseImageSearchClient;
import com.nevis.vision.config.VisionProperties;
import com.nevis.vision.exception.InvalidInputException;
import com.nevis.vision.infra.OutboundRateLimiter;
import com.nevis.vision.model.Capability;
import com.nevis.vision.model.ComparisonResult;
import com.nevis.vision.model.DeepfakeResult;
import com.nevis.vision.model.Embedding;
import com.nevis.vision.model.EmbeddingResult;
import com.nevis.vision.model.FaceEmbeddingResult;
import com.nevis.vision.model.ImageSource;
import com.nevis.vision.model.ReverseSearchOptions;
import com.nevis.vision.model.ReverseSearchResult;
import com.nevis.vision.normalize.ResponseNormalizer;
import com.nevis.vision.retry.BackendRetryExecutor;
import com.nevis.vision.retry.CallResult;
import com.nevis.vision.retry.RetryConfig;
import com.nevis.vision.scoring.VectorMath;
import com.nevis.vision.synth.DeterministicSynthesizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientResponseException;

import java.time.Clock;
import java.util.Map;
import java.util.function.Function;
import java.util.function.Supplier;

@Slf4j
@Service
@RequiredArgsConstructor
public class ServiceGatewayImpl implements ServiceGateway {

    static final String MOCK_REVERSE_PROVIDER = "mock-reverse-search";

    private final AvailabilityCache availabilityCache;
    private final BackendRetryExecutor retryExecutor;
    private final OutboundRateLimiter rateLimiter;
    private final ResponseNormalizer normalizer;
    private final DeterministicSynthesizer synthesizer;
    private final ImageEmbeddingClient embeddingClient;
    private final FaceRecognitionClient faceClient;
    private final DeepfakeClient deepfakeClient;
    private final ReverseImageSearchClient reverseSearchClient;
    private final VisionProperties properties;
    private final Clock clock;

    @Override
    public EmbeddingResult embedImage(ImageSource source, RetryConfig retry) {
        if (source == null) {
            throw new InvalidInputException("Image source is required");
        }
        int dimension = properties.embedding().dimension();
        String modelVersion = properties.embedding().modelVersion();
        long started = clock.millis();

        return route(Capability.EMBED_IMAGE, retry,
            () -> normalizer.toEmbedding(embeddingClient.embed(source), dimension, modelVersion, elapsed(started)),
            reason -> new EmbeddingResult(
                synthesizer.embedding(source.contentKey(), dimension),
                modelVersion + reason.getSuffix(),
                elapsed(started)));
    }

    @Override
    public FaceEmbeddingResult extractFaceEmbedding(byte[] image) {
        requireImage(image);
        int dimension = properties.face().dimension();
        String modelVersion = properties.face().modelVersion();
        long started = clock.millis();

        return route(Capability.COMPARE_FACES, null,
            () -> {
                try {
                    return normalizer.toFaceEmbedding(faceClient.extractEmbedding(image), dimension,
                        modelVersion, elapsed(started));
                } catch (RestClientResponseException e) {
                    if (e.getStatusCode().is4xxClientError() && normalizer.isNoFaceDetected(e.getResponseBodyAsString())) {
                        return FaceEmbeddingResult.noFace(modelVersion, elapsed(started));
                    }
                    throw e;
                }
            },
            reason -> synthesizer.face(image, dimension, modelVersion + reason.getSuffix(), elapsed(started)));
    }

    @Override
    public ComparisonResult compareFaces(float[] first, float[] second, Double threshold) {
        int dimension = properties.face().dimension();
        requireEmbedding("first", first, dimension);
        requireEmbedding("second", second, dimension);
        double effectiveThreshold = threshold == null ? properties.face().threshold() : threshold;
        if (Double.isNaN(effectiveThreshold) || effectiveThreshold < 0 || effectiveThreshold > 2) {
            throw new InvalidInputException("Threshold must be between 0 and 2, got " + threshold);
        }
        String modelVersion = properties.face().modelVersion();
        long started = clock.millis();

        return route(Capability.COMPARE_FACES, null,
            () -> normalizer.toComparison(faceClient.compareFaces(first, second, effectiveThreshold),
                effectiveThreshold, modelVersion, elapsed(started)),
            reason -> VectorMath.compare(Embedding.of(first), Embedding.of(second), effectiveThreshold,
                modelVersion + reason.getSuffix(), elapsed(started)));
    }

    @Override
    public DeepfakeResult detectDeepfake(byte[] image, RetryConfig retry) {
        requireImage(image);
        String modelVersion = properties.deepfake().modelVersion();
        long started = clock.millis();

        return route(Capability.DETECT_DEEPFAKE, retry,
            () -> normalizer.toDeepfake(deepfakeClient.analyze(image), modelVersion, elapsed(started)),
            reason -> synthesizer.deepfake(image, modelVersion + reason.getSuffix(), elapsed(started)));
    }

    @Override
    public ReverseSearchResult searchReverseImage(ImageSource source, ReverseSearchOptions options) {
        if (source == null) {
            throw new InvalidInputException("Image source is required");
        }
        ReverseSearchOptions effective = options == null ? ReverseSearchOptions.defaults() : options;
        String provider = reverseSearchClient.provider().getId();
        long started = clock.millis();

        return route(Capability.SEARCH_REVERSE_IMAGE, effective.retryOverride().orElse(null),
            () -> normalizer.toReverseSearch(reverseSearchClient.provider(),
                reverseSearchClient.search(source, effective), effective, elapsed(started)),
            reason -> synthesizer.reverseSearch(source.contentKey(), effective,
                reason == FallbackReason.UNAVAILABLE ? MOCK_REVERSE_PROVIDER : provider + reason.getSuffix(),
                elapsed(started)));
    }

    @Override
    public Map<String, BackendState> availability() {
        return availabilityCache.snapshot();
    }

    /**
     * Whether a real call's outcome is replaced by a synthetic result. Any failure is.
     */
    static boolean shouldSynthesize(CallResult<?> result) {
        return result.isFailure();
    }

    private <T> T route(Capability capability, RetryConfig retry, Supplier<T> realCall,
                        Function<FallbackReason, T> fallback) {
        String backendId = capability.getBackendId();
        if (!availabilityCache.isAvailable(backendId)) {
            log.debug("{} served synthetically, backend {} unavailable", capability.getId(), backendId);
            return fallback.apply(FallbackReason.UNAVAILABLE);
        }

        RetryConfig config = retry == null ? properties.retry().toRetryConfig() : retry;
        CallResult<T> result = retryExecutor.execute(backendId, config,
            () -> rateLimiter.execute(backendId, realCall));

        if (shouldSynthesize(result)) {
            result.error().ifPresent(error -> log.warn("{} failed after {} attempts ({}), falling back to synthetic result",
                capability.getId(), result.attemptsMade(), error.code()));
            availabilityCache.markUnavailable(backendId);
            return fallback.apply(FallbackReason.DEGRADED);
        }
        return result.value();
    }

    private long elapsed(long started) {
        return Math.max(0, clock.millis() - started);
    }

    private static void requireImage(byte[] image) {
        if (image == null || image.length == 0) {
            throw new InvalidInputException("Image buffer cannot be empty");
        }
    }

    private static void requireEmbedding(String name, float[] embedding, int dimension) {
        if (embedding == null || embedding.length == 0) {
            throw new InvalidInputException("The " + name + " embedding cannot be empty");
        }
        if (embedding.length != dimension) {
            throw new InvalidInputException(String.format("The %s embedding must have %d dimensions, got %d",
                name, dimension, embedding.length));
        }
        for (float value : embedding) {
            if (!Float.isFinite(value)) {
                throw new InvalidInputException("The " + name + " embedding contains a non-finite value");
            }
        }
    }
}
