package com.nevis.vision.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.nevis.vision.scoring.ConfidenceScorer;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * A single reverse-image-search hit. Confidence is derived from the score, never set on its own.
 *
 * @param score 0-100
 * @param size  matched image size in pixels, 0 when the provider does not report it
 */
public record Match(
    String imageUrl,
    String domain,
    double score,
    String pageTitle,
    long size,
    Set<MatchTag> tags,
    List<Backlink> backlinks
) {
    public Match {
        if (Double.isNaN(score) || score < 0 || score > 100) {
            throw new IllegalArgumentException("Invalid match score: " + score);
        }
        tags = Set.copyOf(tags);
        backlinks = List.copyOf(backlinks);
    }

    @JsonProperty("confidence")
    public ConfidenceTier confidence() {
        return ConfidenceScorer.scoreToConfidence(score);
    }

    public Optional<String> latestCrawlDate() {
        return backlinks.stream()
            .map(Backlink::crawlDate)
            .filter(date -> date != null && !date.isBlank())
            .max(String::compareTo);
    }
}
