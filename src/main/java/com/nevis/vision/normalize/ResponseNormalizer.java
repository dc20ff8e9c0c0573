package com.nevis.vision.normalize;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nevis.vision.exception.MalformedPayloadException;
import com.nevis.vision.model.Backlink;
import com.nevis.vision.model.BoundingBox;
import com.nevis.vision.model.ComparisonResult;
import com.nevis.vision.model.DeepfakeDetails;
import com.nevis.vision.model.DeepfakeResult;
import com.nevis.vision.model.Embedding;
import com.nevis.vision.model.EmbeddingResult;
import com.nevis.vision.model.FaceEmbeddingResult;
import com.nevis.vision.model.LightingAnalysis;
import com.nevis.vision.model.Match;
import com.nevis.vision.model.MatchTag;
import com.nevis.vision.model.ReverseSearchOptions;
import com.nevis.vision.model.ReverseSearchProvider;
import com.nevis.vision.model.ReverseSearchResult;
import com.nevis.vision.model.SearchStats;
import com.nevis.vision.scoring.VectorMath;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Translates backend-specific JSON into the canonical result types. Upstream field names stop here.
 * Optional fields may be missing; required ones raise {@link MalformedPayloadException}.
 */
@Component
@RequiredArgsConstructor
public class ResponseNormalizer {

    public static final String NO_FACE_DETECTED = "NO_FACE_DETECTED";

    static final int MAX_GOOGLE_VISION_MATCHES = 20;
    private static final int MAX_RAW_MESSAGE_LENGTH = 200;

    private final ObjectMapper objectMapper;

    public JsonNode parse(String body) {
        if (body == null || body.isBlank()) {
            throw new MalformedPayloadException("Empty response body");
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new MalformedPayloadException("Response body is not valid JSON", e);
        }
    }

    /**
     * Human-readable messages carried by an error body, in upstream order.
     */
    public List<String> errorMessages(String body) {
        if (body == null || body.isBlank()) {
            return List.of();
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            String raw = body.trim();
            return List.of(raw.length() > MAX_RAW_MESSAGE_LENGTH ? raw.substring(0, MAX_RAW_MESSAGE_LENGTH) : raw);
        }
        if (root == null || !root.isObject()) {
            return List.of();
        }

        List<String> messages = new ArrayList<>();
        for (JsonNode message : root.path("messages")) {
            if (message.isTextual() && !message.asText().isBlank()) {
                messages.add(message.asText());
            }
        }
        JsonNode error = root.path("error");
        if (error.isTextual() && !error.asText().isBlank()) {
            messages.add(error.asText());
        } else if (error.path("message").isTextual()) {
            messages.add(error.path("message").asText());
        }
        if (root.path("message").isTextual() && !root.path("message").asText().isBlank()) {
            messages.add(root.path("message").asText());
        }
        return messages;
    }

    public boolean isNoFaceDetected(String errorBody) {
        if (errorBody == null || errorBody.isBlank()) {
            return false;
        }
        try {
            return NO_FACE_DETECTED.equals(objectMapper.readTree(errorBody).path("code").asText(null));
        } catch (JsonProcessingException e) {
            return false;
        }
    }

    /**
     * A health body counts as healthy unless it says otherwise through its status or model flag.
     */
    public boolean isHealthy(JsonNode health) {
        if (health == null || health.isMissingNode() || health.isNull()) {
            return true;
        }
        JsonNode status = health.path("status");
        if (status.isTextual()) {
            String value = status.asText().toLowerCase();
            if (!value.equals("healthy") && !value.equals("ok") && !value.equals("up")) {
                return false;
            }
        }
        JsonNode modelLoaded = health.path("model_loaded");
        return !modelLoaded.isBoolean() || modelLoaded.asBoolean();
    }

    /**
     * The face service is usable only once it reports {@code status: healthy} with its model loaded.
     */
    public boolean isFaceServiceReady(JsonNode health) {
        if (health == null) {
            return false;
        }
        return "healthy".equals(health.path("status").asText(null))
            && health.path("model_loaded").asBoolean(false);
    }

    public EmbeddingResult toEmbedding(JsonNode payload, int dimension, String defaultModelVersion, long processingTimeMs) {
        JsonNode vectorNode = firstPresent(payload, "embedding", "vector");
        if (vectorNode.isMissingNode()) {
            vectorNode = payload.path("data").path(0).path("embedding");
        }
        Embedding embedding = readVector(vectorNode, dimension);
        String modelVersion = textOr(firstPresent(payload, "model_version", "model"), defaultModelVersion);
        return new EmbeddingResult(embedding, modelVersion, processingTimeMs);
    }

    public FaceEmbeddingResult toFaceEmbedding(JsonNode payload, int dimension, String modelVersion, long processingTimeMs) {
        JsonNode vectorNode = payload.path("embedding");
        if (vectorNode.isMissingNode() || vectorNode.isNull()) {
            return FaceEmbeddingResult.noFace(modelVersion, processingTimeMs);
        }
        Embedding embedding = readVector(vectorNode, dimension);
        int faceCount = payload.path("face_count").asInt(1);
        double faceConfidence = payload.path("face_confidence").asDouble(0);

        JsonNode area = payload.path("facial_area");
        Optional<BoundingBox> box = area.isObject()
            ? Optional.of(new BoundingBox(area.path("x").asInt(), area.path("y").asInt(),
                area.path("w").asInt(), area.path("h").asInt()))
            : Optional.empty();

        return new FaceEmbeddingResult(Optional.of(embedding), faceCount, faceConfidence, box,
            modelVersion, processingTimeMs);
    }

    /**
     * Rebuilds the comparison from the reported distance so that similarity, verdict and confidence
     * follow the local rules whatever the backend claims.
     */
    public ComparisonResult toComparison(JsonNode payload, double threshold, String modelVersion, long processingTimeMs) {
        JsonNode distance = payload.path("distance");
        JsonNode similarity = payload.path("similarity");
        double resolvedDistance;
        if (distance.isNumber()) {
            resolvedDistance = distance.asDouble();
        } else if (similarity.isNumber()) {
            resolvedDistance = 1 - similarity.asDouble();
        } else {
            throw new MalformedPayloadException("Comparison response has neither distance nor similarity");
        }
        return VectorMath.fromDistance(resolvedDistance, threshold, modelVersion, processingTimeMs);
    }

    public DeepfakeResult toDeepfake(JsonNode payload, String defaultModelVersion, long processingTimeMs) {
        JsonNode verdict = payload.path("is_deepfake");
        if (!verdict.isBoolean()) {
            throw new MalformedPayloadException("Deepfake response is missing is_deepfake");
        }
        double confidence = payload.path("confidence").asDouble(0);
        if (confidence > 1) {
            confidence = confidence / 100;
        }
        confidence = Math.max(0, Math.min(1, confidence));

        JsonNode details = firstPresent(payload, "analysis_details", "details");
        List<String> artifacts = new ArrayList<>();
        for (JsonNode artifact : firstPresent(details, "artifacts_found", "artifacts")) {
            if (artifact.isTextual()) {
                artifacts.add(artifact.asText());
            }
        }
        DeepfakeDetails normalizedDetails = new DeepfakeDetails(
            details.path("faces_detected").asInt(0),
            artifacts,
            Math.max(0, Math.min(1, details.path("consistency_score").asDouble(0))),
            details.path("compression_anomalies").asBoolean(false),
            LightingAnalysis.from(textOr(firstPresent(details, "lighting_analysis", "lighting"), null))
        );
        String modelVersion = textOr(firstPresent(payload, "model_version", "model"),
            textOr(details.path("model_version"), defaultModelVersion));

        return new DeepfakeResult(verdict.asBoolean(), confidence, normalizedDetails, modelVersion, processingTimeMs);
    }

    public ReverseSearchResult toReverseSearch(ReverseSearchProvider provider, JsonNode payload,
                                               ReverseSearchOptions options, long elapsedMs) {
        if (payload == null || payload.isMissingNode() || payload.isNull()) {
            throw new MalformedPayloadException("Empty reverse search response from " + provider.getId());
        }
        return switch (provider) {
            case TINEYE -> fromTinEye(payload, provider.getId(), elapsedMs);
            case GOOGLE_VISION -> fromGoogleVision(payload, options, provider.getId(), elapsedMs);
        };
    }

    public ReverseSearchResult fromTinEye(JsonNode payload, String provider, long elapsedMs) {
        List<Match> matches = new ArrayList<>();
        for (JsonNode raw : payload.path("results").path("matches")) {
            String imageUrl = raw.path("image_url").asText(null);
            if (imageUrl == null) {
                continue;
            }
            List<Backlink> backlinks = new ArrayList<>();
            for (JsonNode link : raw.path("backlinks")) {
                backlinks.add(new Backlink(
                    link.path("url").asText(null),
                    link.path("backlink").asText(null),
                    link.path("crawl_date").asText(null)));
            }
            Set<MatchTag> tags = EnumSet.noneOf(MatchTag.class);
            for (JsonNode tag : raw.path("tags")) {
                MatchTag.from(tag.asText()).ifPresent(tags::add);
            }
            String domain = textOr(raw.path("domain"), domainOf(imageUrl));
            matches.add(new Match(imageUrl, domain, clampScore(raw.path("score").asDouble(0)),
                null, raw.path("size").asLong(0), tags, backlinks));
        }

        JsonNode stats = payload.path("stats");
        int backlinkCount = matches.stream().mapToInt(match -> match.backlinks().size()).sum();
        SearchStats searchStats = new SearchStats(
            stats.path("query_time").isNumber() ? stats.path("query_time").asLong() : elapsedMs,
            stats.path("total_results").isNumber() ? stats.path("total_results").asInt() : matches.size(),
            stats.path("total_backlinks").isNumber() ? stats.path("total_backlinks").asInt() : backlinkCount
        );

        List<String> warnings = new ArrayList<>();
        for (JsonNode message : payload.path("messages")) {
            if (message.isTextual() && !message.asText().isBlank()) {
                warnings.add(message.asText());
            }
        }
        return new ReverseSearchResult(provider, matches, searchStats, warnings);
    }

    /**
     * Google Vision web detection. Scores arrive as 0-1 and are scaled to 0-100. The API has no
     * server-side filters, so filters and paging are applied here.
     */
    public ReverseSearchResult fromGoogleVision(JsonNode payload, ReverseSearchOptions options,
                                                String provider, long elapsedMs) {
        JsonNode first = payload.path("responses").path(0);
        JsonNode error = first.path("error");
        if (error.isObject()) {
            throw new MalformedPayloadException("Google Vision error: " + error.path("message").asText("unknown"));
        }
        JsonNode detection = first.path("webDetection");

        Map<String, Match> byUrl = new LinkedHashMap<>();
        addVisionImages(byUrl, detection.path("fullMatchingImages"), 0.98);
        addVisionImages(byUrl, detection.path("partialMatchingImages"), 0.85);
        for (JsonNode page : detection.path("pagesWithMatchingImages")) {
            String url = page.path("url").asText(null);
            if (url != null && !byUrl.containsKey(url)) {
                byUrl.put(url, visionMatch(url, page.path("score").asDouble(0.92), page.path("pageTitle").asText(null)));
            }
        }
        addVisionImages(byUrl, detection.path("visuallySimilarImages"), 0.86);

        List<Match> top = byUrl.values().stream()
            .sorted((a, b) -> Double.compare(b.score(), a.score()))
            .limit(MAX_GOOGLE_VISION_MATCHES)
            .toList();

        List<String> warnings = new ArrayList<>();
        ReverseSearchOptions applicable = options;
        if (!options.tagFilter().isEmpty()) {
            warnings.add("Tag filtering is not supported by " + provider);
            applicable = new ReverseSearchOptions(options.limit(), options.offset(), options.sort(), options.order(),
                options.domainFilter(), Set.of(), options.retry());
        }
        List<Match> filtered = MatchOrdering.filter(top, applicable);
        List<Match> page = MatchOrdering.sortAndPage(filtered, applicable);

        return new ReverseSearchResult(provider, page, new SearchStats(elapsedMs, filtered.size(), 0), warnings);
    }

    private void addVisionImages(Map<String, Match> byUrl, JsonNode images, double defaultScore) {
        for (JsonNode image : images) {
            String url = image.path("url").asText(null);
            if (url != null && !byUrl.containsKey(url)) {
                byUrl.put(url, visionMatch(url, image.path("score").asDouble(defaultScore), null));
            }
        }
    }

    private Match visionMatch(String url, double score, String pageTitle) {
        return new Match(url, domainOf(url), clampScore(score * 100), pageTitle, 0, Set.of(), List.of());
    }

    private Embedding readVector(JsonNode vectorNode, int dimension) {
        if (!vectorNode.isArray() || vectorNode.isEmpty()) {
            throw new MalformedPayloadException("Response carries no embedding vector");
        }
        if (vectorNode.size() != dimension) {
            throw new MalformedPayloadException(
                "Embedding dimension mismatch: expected " + dimension + ", got " + vectorNode.size());
        }
        double[] raw = new double[dimension];
        for (int i = 0; i < dimension; i++) {
            JsonNode value = vectorNode.get(i);
            if (!value.isNumber() || !Double.isFinite(value.asDouble())) {
                throw new MalformedPayloadException("Embedding contains a non-numeric value at index " + i);
            }
            raw[i] = value.asDouble();
        }
        return Embedding.normalized(raw);
    }

    private static JsonNode firstPresent(JsonNode node, String... fields) {
        for (String field : fields) {
            JsonNode candidate = node.path(field);
            if (!candidate.isMissingNode() && !candidate.isNull()) {
                return candidate;
            }
        }
        return node.path(fields[fields.length - 1]);
    }

    private static String textOr(JsonNode node, String fallback) {
        return node.isTextual() && !node.asText().isBlank() ? node.asText() : fallback;
    }

    private static double clampScore(double score) {
        if (Double.isNaN(score)) {
            return 0;
        }
        return Math.max(0, Math.min(100, score));
    }

    static String domainOf(String url) {
        try {
            String host = URI.create(url).getHost();
            return host == null ? "unknown" : host;
        } catch (IllegalArgumentException e) {
            return "unknown";
        }
    }
}
