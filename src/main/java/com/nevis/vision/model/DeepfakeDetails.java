package com.nevis.vision.model;

import java.util.List;

public record DeepfakeDetails(
    int facesDetected,
    List<String> artifacts,
    double consistencyScore,
    boolean compressionAnomalies,
    LightingAnalysis lighting
) {
    public DeepfakeDetails {
        artifacts = List.copyOf(artifacts);
    }
}
