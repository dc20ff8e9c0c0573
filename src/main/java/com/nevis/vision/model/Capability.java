package com.nevis.vision.model;

import lombok.Getter;

/**
 * Vision capabilities fronted by the gateway. Each one is served by exactly one backend.
 */
@Getter
public enum Capability {

    EMBED_IMAGE("embed-image", "image-similarity"),
    COMPARE_FACES("compare-faces", "face-recognition"),
    DETECT_DEEPFAKE("detect-deepfake", "deepfake-detection"),
    SEARCH_REVERSE_IMAGE("search-reverse-image", "reverse-image-search");

    private final String id;
    private final String backendId;

    Capability(String id, String backendId) {
        this.id = id;
        this.backendId = backendId;
    }
}
