package com.nevis.vision.model;

public record BoundingBox(int x, int y, int w, int h) {}
