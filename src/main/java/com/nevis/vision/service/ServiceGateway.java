package com.nevis.vision.service;

import com.nevis.vision.availability.BackendState;
import com.nevis.vision.model.ComparisonResult;
import com.nevis.vision.model.DeepfakeResult;
import com.nevis.vision.model.EmbeddingResult;
import com.nevis.vision.model.FaceEmbeddingResult;
import com.nevis.vision.model.ImageSource;
import com.nevis.vision.model.ReverseSearchOptions;
import com.nevis.vision.model.ReverseSearchResult;
import com.nevis.vision.retry.RetryConfig;

import java.util.Map;

/**
 * Entry point for every vision capability. Each call either returns the backend's answer or a
 * deterministic synthetic one; only invalid caller input raises
 * {@link com.nevis.vision.exception.InvalidInputException}.
 */
public interface ServiceGateway {

    default EmbeddingResult embedImage(ImageSource source) {
        return embedImage(source, null);
    }

    /**
     * @param retry per-call retry override, or {@code null} for the configured defaults
     */
    EmbeddingResult embedImage(ImageSource source, RetryConfig retry);

    FaceEmbeddingResult extractFaceEmbedding(byte[] image);

    default ComparisonResult compareFaces(float[] first, float[] second) {
        return compareFaces(first, second, null);
    }

    /**
     * @param threshold distance threshold, or {@code null} for the configured one
     */
    ComparisonResult compareFaces(float[] first, float[] second, Double threshold);

    default DeepfakeResult detectDeepfake(byte[] image) {
        return detectDeepfake(image, null);
    }

    DeepfakeResult detectDeepfake(byte[] image, RetryConfig retry);

    ReverseSearchResult searchReverseImage(ImageSource source, ReverseSearchOptions options);

    Map<String, BackendState> availability();
}
