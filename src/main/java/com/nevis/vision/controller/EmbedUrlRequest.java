package com.nevis.vision.controller;

import jakarta.validation.constraints.NotBlank;

public record EmbedUrlRequest(
    @NotBlank
    String imageUrl
) {}
