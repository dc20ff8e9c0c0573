package com.nevis.vision.controller;

import jakarta.validation.constraints.NotBlank;

import java.util.List;

public record ReverseSearchRequest(
    @NotBlank
    String imageUrl,
    Integer limit,
    Integer offset,
    String sort,
    String order,
    String domain,
    List<String> tags
) {}
