package com.nevis.vision.service;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Why a synthetic result was produced. The suffix is appended to the reported model version.
 */
@Getter
@RequiredArgsConstructor
public enum FallbackReason {
    UNAVAILABLE("-mock"),
    DEGRADED("-degraded");

    private final String suffix;
}
