package com.nevis.vision.controller;

import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;

public record CompareFacesRequest(
    @NotNull @NotEmpty
    float[] embedding1,

    @NotNull @NotEmpty
    float[] embedding2,

    Double threshold
) {}
