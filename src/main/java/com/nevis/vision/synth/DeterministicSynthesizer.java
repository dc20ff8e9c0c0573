package com.nevis.vision.synth;

import com.nevis.vision.model.BoundingBox;
import com.nevis.vision.model.DeepfakeDetails;
import com.nevis.vision.model.DeepfakeResult;
import com.nevis.vision.model.Embedding;
import com.nevis.vision.model.FaceEmbeddingResult;
import com.nevis.vision.model.LightingAnalysis;
import com.nevis.vision.model.Match;
import com.nevis.vision.model.ReverseSearchOptions;
import com.nevis.vision.model.ReverseSearchResult;
import com.nevis.vision.model.SearchStats;
import com.nevis.vision.normalize.MatchOrdering;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Stand-in results for when no backend answer is available. Everything is derived from the
 * {@link ContentDigest} of the input, so the same bytes always produce the same result.
 */
@Component
public class DeterministicSynthesizer {

    public static final double FACE_DETECTION_RATE = 0.15;
    public static final double DEEPFAKE_RATE = 0.05;
    public static final double REVERSE_MATCH_RATE = 0.15;

    static final int FRAME_WIDTH = 640;
    static final int FRAME_HEIGHT = 480;

    static final List<String> ARTIFACTS = List.of(
        "face_boundary_blur",
        "unnatural_skin_texture",
        "asymmetric_features",
        "inconsistent_lighting",
        "eye_reflection_mismatch",
        "hair_boundary_artifacts",
        "temporal_inconsistency",
        "compression_artifacts"
    );

    static final List<String> MOCK_DOMAINS = List.of(
        "instagram.example.com",
        "facebook.example.com",
        "twitter.example.com",
        "pinterest.example.com",
        "dating-site.example.com",
        "forum.example.com",
        "blog.example.com",
        "photos.example.com"
    );

    static final List<String> MOCK_TITLES = List.of(
        "[TEST] Profile Photo",
        "[TEST] User Gallery",
        "[TEST] Shared Images",
        "[TEST] Photo Album",
        "[TEST] Image Post"
    );

    public Embedding synthesize(ContentDigest digest, int dimension) {
        if (dimension <= 0) {
            throw new IllegalArgumentException("Dimension must be positive: " + dimension);
        }
        return Embedding.normalized(digest.rawVector(dimension));
    }

    public Embedding embedding(byte[] content, int dimension) {
        return synthesize(ContentDigest.of(content), dimension);
    }

    public FaceEmbeddingResult face(byte[] content, int dimension, String modelVersion, long processingTimeMs) {
        ContentDigest digest = ContentDigest.of(content);
        if (digest.draw("face_detection") >= FACE_DETECTION_RATE) {
            return FaceEmbeddingResult.noFace(modelVersion, processingTimeMs);
        }

        double confidence = 0.85 + digest.draw("confidence") * 0.14;
        int width = 100 + digest.pick("width", 150);
        int height = 100 + digest.pick("height", 200);
        int x = digest.pick("x", FRAME_WIDTH - width);
        int y = digest.pick("y", FRAME_HEIGHT - height);

        return new FaceEmbeddingResult(
            Optional.of(synthesize(digest, dimension)),
            1,
            round2(confidence),
            Optional.of(new BoundingBox(x, y, width, height)),
            modelVersion,
            processingTimeMs
        );
    }

    public DeepfakeResult deepfake(byte[] content, String modelVersion, long processingTimeMs) {
        ContentDigest digest = ContentDigest.of(content);
        boolean isDeepfake = digest.draw("deepfake") < DEEPFAKE_RATE;

        double confidence = isDeepfake
            ? 0.75 + digest.draw("confidence") * 0.2
            : 0.90 + digest.draw("confidence") * 0.09;

        return new DeepfakeResult(isDeepfake, round2(confidence), deepfakeDetails(digest, isDeepfake),
            modelVersion, processingTimeMs);
    }

    private DeepfakeDetails deepfakeDetails(ContentDigest digest, boolean isDeepfake) {
        int faces = digest.pick("faces", 3) + 1;
        double consistency = isDeepfake
            ? 0.3 + digest.draw("consistency") * 0.3
            : 0.85 + digest.draw("consistency") * 0.15;

        List<String> artifacts = new ArrayList<>();
        if (isDeepfake) {
            int count = digest.pick("numArtifacts", 3) + 1;
            for (int i = 0; i < count; i++) {
                String artifact = ARTIFACTS.get(digest.pick("artifact" + i, ARTIFACTS.size()));
                if (!artifacts.contains(artifact)) {
                    artifacts.add(artifact);
                }
            }
        }

        double lightingDraw = digest.draw("lighting");
        LightingAnalysis lighting;
        if (isDeepfake) {
            lighting = lightingDraw < 0.6 ? LightingAnalysis.INCONSISTENT : LightingAnalysis.INCONCLUSIVE;
        } else {
            lighting = lightingDraw < 0.8 ? LightingAnalysis.CONSISTENT : LightingAnalysis.INCONCLUSIVE;
        }

        boolean compressionAnomalies = digest.draw("compression") < (isDeepfake ? 0.7 : 0.1);

        return new DeepfakeDetails(faces, artifacts, round2(consistency), compressionAnomalies, lighting);
    }

    public ReverseSearchResult reverseSearch(byte[] content, ReverseSearchOptions options,
                                             String provider, long processingTimeMs) {
        ContentDigest digest = ContentDigest.of(content);
        List<Match> candidates = new ArrayList<>();
        if (digest.draw("match") < REVERSE_MATCH_RATE) {
            candidates.add(mockMatch(digest, 0));
        }

        List<Match> filtered = MatchOrdering.filter(candidates, options);
        List<Match> page = MatchOrdering.sortAndPage(filtered, options);
        int backlinks = filtered.stream().mapToInt(match -> match.backlinks().size()).sum();

        return new ReverseSearchResult(provider, page,
            new SearchStats(processingTimeMs, filtered.size(), backlinks), List.of());
    }

    private Match mockMatch(ContentDigest digest, int index) {
        String domain = MOCK_DOMAINS.get(digest.pick("domain" + index, MOCK_DOMAINS.size()));
        String title = MOCK_TITLES.get(digest.pick("title" + index, MOCK_TITLES.size()));
        double score = Math.round(88 + digest.draw("similarity" + index) * 10);
        return new Match("https://" + domain + "/test-match-demo", domain, score, title, 0, Set.of(), List.of());
    }

    private static double round2(double value) {
        return Math.round(value * 100) / 100.0;
    }
}
