package com.nevis.vision.availability;

public enum BackendState {
    UNPROBED,
    AVAILABLE,
    UNAVAILABLE
}
