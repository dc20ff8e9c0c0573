package com.nevis.vision.model;

import com.nevis.vision.exception.InvalidInputException;

import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * Either raw image bytes or a publicly reachable image URL.
 */
public final class ImageSource {

    private final byte[] bytes;
    private final String url;

    private ImageSource(byte[] bytes, String url) {
        this.bytes = bytes;
        this.url = url;
    }

    public static ImageSource ofBytes(byte[] bytes) {
        if (bytes == null || bytes.length == 0) {
            throw new InvalidInputException("Image buffer cannot be empty");
        }
        return new ImageSource(bytes.clone(), null);
    }

    public static ImageSource ofUrl(String url) {
        if (url == null || url.isBlank()) {
            throw new InvalidInputException("Image URL cannot be empty");
        }
        String trimmed = url.trim();
        try {
            URI uri = new URI(trimmed);
            String scheme = uri.getScheme();
            if (uri.getHost() == null || scheme == null
                || !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))) {
                throw new InvalidInputException("Image URL must be an absolute http(s) URL: " + trimmed);
            }
        } catch (URISyntaxException e) {
            throw new InvalidInputException("Malformed image URL: " + trimmed);
        }
        return new ImageSource(null, trimmed);
    }

    public boolean isUrl() {
        return url != null;
    }

    public Optional<byte[]> bytes() {
        return Optional.ofNullable(bytes).map(byte[]::clone);
    }

    public Optional<String> url() {
        return Optional.ofNullable(url);
    }

    /**
     * Bytes that identify this input for synthetic results: the image itself, or the UTF-8 URL.
     */
    public byte[] contentKey() {
        return isUrl() ? url.getBytes(StandardCharsets.UTF_8) : bytes.clone();
    }

    @Override
    public String toString() {
        return isUrl() ? "ImageSource[url=" + url + "]" : "ImageSource[bytes=" + bytes.length + "]";
    }
}
