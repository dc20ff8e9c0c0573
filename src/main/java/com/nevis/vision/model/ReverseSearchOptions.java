package com.nevis.vision.model;

import com.nevis.vision.exception.InvalidInputException;
import com.nevis.vision.retry.RetryConfig;

import java.util.Optional;
import java.util.Set;

/**
 * Paging, ordering and filtering for a reverse image search. A null retry config means the
 * capability defaults apply.
 */
public record ReverseSearchOptions(
    int limit,
    int offset,
    SortField sort,
    SortOrder order,
    String domainFilter,
    Set<MatchTag> tagFilter,
    RetryConfig retry
) {
    public static final int DEFAULT_LIMIT = 50;
    public static final int MAX_LIMIT = 100;
    public static final int MIN_DOMAIN_FILTER_LENGTH = 5;

    public ReverseSearchOptions {
        if (limit < 1 || limit > MAX_LIMIT) {
            throw new InvalidInputException("Limit must be between 1 and " + MAX_LIMIT + ": " + limit);
        }
        if (offset < 0) {
            throw new InvalidInputException("Offset cannot be negative: " + offset);
        }
        if (domainFilter != null) {
            domainFilter = domainFilter.trim().toLowerCase();
            if (domainFilter.length() < MIN_DOMAIN_FILTER_LENGTH) {
                throw new InvalidInputException(
                    "Domain filter must be at least " + MIN_DOMAIN_FILTER_LENGTH + " characters");
            }
        }
        sort = sort == null ? SortField.SCORE : sort;
        order = order == null ? SortOrder.DESC : order;
        tagFilter = tagFilter == null ? Set.of() : Set.copyOf(tagFilter);
    }

    public static ReverseSearchOptions defaults() {
        return new ReverseSearchOptions(DEFAULT_LIMIT, 0, SortField.SCORE, SortOrder.DESC, null, Set.of(), null);
    }

    public Optional<String> domain() {
        return Optional.ofNullable(domainFilter);
    }

    public Optional<RetryConfig> retryOverride() {
        return Optional.ofNullable(retry);
    }

    public ReverseSearchOptions withRetry(RetryConfig retryConfig) {
        return new ReverseSearchOptions(limit, offset, sort, order, domainFilter, tagFilter, retryConfig);
    }
}
