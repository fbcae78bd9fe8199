package com.sop.network.core.model;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * One row of a document's revision history.
 *
 * @param revision    revision label, e.g. {@code 1.2}
 * @param date        date as written in the document
 * @param description change description
 * @param contentHash short hash of the description
 */
public record Version(String revision, String date, String description, String contentHash) {

    public static Version of(String revision, String date, String description) {
        return new Version(revision, date, description, hash(description));
    }

    private static String hash(String text) {
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256")
                    .digest((text != null ? text : "").getBytes(StandardCharsets.UTF_8));
            StringBuilder hex = new StringBuilder();
            for (int i = 0; i < 4; i++) {
                hex.append(String.format("%02x", digest[i]));
            }
            return hex.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
