package com.ryuqq.feed.adapter.file.support;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Maps cache keys to file-system-safe base names.
 *
 * <p>Every character outside {@code [a-zA-Z0-9._-]} becomes {@code _}. Names longer than
 * 150 characters keep an 80 character prefix and a 40 character suffix around a short
 * SHA-256 of the original key, so distinct long keys stay distinct.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class SafeNames {

    private static final int MAX_LENGTH = 150;
    private static final int PREFIX_LENGTH = 80;
    private static final int SUFFIX_LENGTH = 40;

    private SafeNames() {
    }

    /**
     * Returns the safe base name of a key.
     *
     * @param key the raw key
     * @return a name usable as a file name prefix
     * @throws IllegalArgumentException if key is null or blank
     */
    public static String of(String key) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("key cannot be null or blank");
        }
        String sanitized = key.replaceAll("[^a-zA-Z0-9._-]", "_");
        if (sanitized.length() <= MAX_LENGTH) {
            return sanitized;
        }
        String prefix = sanitized.substring(0, PREFIX_LENGTH);
        String suffix = sanitized.substring(sanitized.length() - SUFFIX_LENGTH);
        return prefix + "_" + shortSha256(key) + "_" + suffix;
    }

    private static String shortSha256(String input) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            byte[] digest = md.digest(input.getBytes(StandardCharsets.UTF_8));
            StringBuilder sb = new StringBuilder();
            for (int i = 0; i < 6; i++) {
                sb.append(String.format("%02x", digest[i]));
            }
            return sb.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is required by every JDK", e);
        }
    }
}
