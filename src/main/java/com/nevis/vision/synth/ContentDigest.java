package com.nevis.vision.synth;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * SHA-256 fingerprint of some input, used as the only source of randomness for synthetic results.
 * Every value drawn from it is a pure function of the input bytes and a facet name, so synthetic
 * output is identical across calls, processes and runs.
 */
public final class ContentDigest {

    private static final int WINDOW = 4;
    private static final int WINDOW_SPAN = 60;
    private static final double WINDOW_MAX = 0xffff;
    private static final double DRAW_RANGE = 0x1_0000_0000L;

    private final String hex;

    private ContentDigest(String hex) {
        this.hex = hex;
    }

    public static ContentDigest of(byte[] content) {
        return new ContentDigest(HexFormat.of().formatHex(digest("SHA-256", content)));
    }

    public String hex() {
        return hex;
    }

    /**
     * Uniform value in [0, 1) for one facet of the input. Different facet names give
     * uncorrelated values.
     */
    public double draw(String facet) {
        byte[] facetDigest = digest("MD5", (hex + facet).getBytes(StandardCharsets.UTF_8));
        long leading = Long.parseLong(HexFormat.of().formatHex(facetDigest, 0, 4), 16);
        return leading / DRAW_RANGE;
    }

    /**
     * Integer in [0, bound) for one facet of the input.
     */
    public int pick(String facet, int bound) {
        return (int) Math.floor(draw(facet) * bound);
    }

    /**
     * Raw coordinates in [-1, 1], read from overlapping 4-hex-character windows that advance by two
     * characters and wrap every 60 characters.
     */
    public double[] rawVector(int dimension) {
        double[] raw = new double[dimension];
        for (int i = 0; i < dimension; i++) {
            int start = (i * 2) % WINDOW_SPAN;
            int window = Integer.parseInt(hex.substring(start, start + WINDOW), 16);
            raw[i] = window / WINDOW_MAX * 2 - 1;
        }
        return raw;
    }

    private static byte[] digest(String algorithm, byte[] content) {
        try {
            return MessageDigest.getInstance(algorithm).digest(content);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(algorithm + " is not available", e);
        }
    }

    @Override
    public String toString() {
        return "ContentDigest[" + hex.substring(0, 12) + "]";
    }
}
