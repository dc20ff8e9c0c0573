package com.nevis.vision.controller;

public record ErrorResponse(String message, int status, long timestamp) {}
