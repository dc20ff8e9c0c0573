package com.nevis.vision.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ReverseSearchProvider {
    TINEYE("tineye", "https://api.tineye.com/rest"),
    GOOGLE_VISION("google-vision", "https://vision.googleapis.com");

    private final String id;
    private final String defaultBaseUrl;
}
