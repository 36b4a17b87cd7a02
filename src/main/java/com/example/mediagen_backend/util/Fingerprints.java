package com.example.mediagen_backend.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Stable cache keys for generation requests and media payloads.
 */
public final class Fingerprints {
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private Fingerprints() {
    }

    /**
     * Lower-cases, trims and collapses whitespace runs to a single space.
     */
    public static String normalizePrompt(String prompt) {
        if (prompt == null) {
            return "";
        }
        return WHITESPACE.matcher(prompt.toLowerCase(Locale.ROOT).trim()).replaceAll(" ");
    }

    /**
     * Key for a prompt entry: MD5 over {@code model:normalizedPrompt}.
     */
    public static String promptKey(String prompt, String model) {
        return digest("MD5", (model == null ? "" : model) + ":" + normalizePrompt(prompt));
    }

    /**
     * Key for a media entry: SHA-256 over the raw bytes.
     */
    public static String contentHash(byte[] content) {
        return digest("SHA-256", content == null ? new byte[0] : content);
    }

    public static String contentHash(String content) {
        return contentHash(content == null ? new byte[0] : content.getBytes(StandardCharsets.UTF_8));
    }

    private static String digest(String algorithm, String value) {
        return digest(algorithm, value.getBytes(StandardCharsets.UTF_8));
    }

    private static String digest(String algorithm, byte[] value) {
        try {
            MessageDigest md = MessageDigest.getInstance(algorithm);
            return HexFormat.of().formatHex(md.digest(value));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(algorithm + " not available", e);
        }
    }
}
