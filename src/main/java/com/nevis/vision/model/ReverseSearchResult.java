package com.nevis.vision.model;

import java.util.List;

public record ReverseSearchResult(
    String provider,
    List<Match> matches,
    SearchStats stats,
    List<String> warnings
) {
    public ReverseSearchResult {
        matches = List.copyOf(matches);
        warnings = List.copyOf(warnings);
    }
}
