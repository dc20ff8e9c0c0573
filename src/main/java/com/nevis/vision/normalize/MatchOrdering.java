package com.nevis.vision.normalize;

import com.nevis.vision.model.Match;
import com.nevis.vision.model.MatchTag;
import com.nevis.vision.model.ReverseSearchOptions;
import com.nevis.vision.model.SortOrder;

import java.util.Comparator;
import java.util.List;

/**
 * Applies search filters, ordering and paging to matches that were not filtered upstream.
 */
public final class MatchOrdering {

    private MatchOrdering() {
    }

    public static List<Match> filter(List<Match> matches, ReverseSearchOptions options) {
        return matches.stream()
            .filter(match -> options.domain().map(domain -> matchesDomain(match, domain)).orElse(true))
            .filter(match -> options.tagFilter().isEmpty() || hasAnyTag(match, options))
            .toList();
    }

    public static List<Match> sortAndPage(List<Match> matches, ReverseSearchOptions options) {
        Comparator<Match> comparator = switch (options.sort()) {
            case SCORE -> Comparator.comparingDouble(Match::score);
            case SIZE -> Comparator.comparingLong(Match::size);
            case CRAWL_DATE -> Comparator.comparing((Match match) -> match.latestCrawlDate().orElse(""));
        };
        if (options.order() == SortOrder.DESC) {
            comparator = comparator.reversed();
        }
        return matches.stream()
            .sorted(comparator)
            .skip(options.offset())
            .limit(options.limit())
            .toList();
    }

    private static boolean matchesDomain(Match match, String domain) {
        String candidate = match.domain() == null ? "" : match.domain().toLowerCase();
        return candidate.equals(domain) || candidate.endsWith("." + domain);
    }

    private static boolean hasAnyTag(Match match, ReverseSearchOptions options) {
        for (MatchTag tag : options.tagFilter()) {
            if (match.tags().contains(tag)) {
                return true;
            }
        }
        return false;
    }
}
