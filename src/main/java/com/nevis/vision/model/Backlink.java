package com.nevis.vision.model;

public record Backlink(
    String imageUrl,
    String pageUrl,
    String crawlDate
) {}
