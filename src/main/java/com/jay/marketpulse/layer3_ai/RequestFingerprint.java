package com.jay.marketpulse.layer3_ai;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Objects;

/**
 * Identity of a generation request: what it is about, which prompt template,
 * and which data snapshot (the trading date for scheduled and on-demand work).
 */
public record RequestFingerprint(String subject, String template, String snapshotVersion) {

    public RequestFingerprint {
        Objects.requireNonNull(subject, "subject");
        Objects.requireNonNull(template, "template");
        Objects.requireNonNull(snapshotVersion, "snapshotVersion");
    }

    /** SHA-256 over the length-prefixed components, hex encoded. */
    public String key() {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            for (String part : new String[]{subject, template, snapshotVersion}) {
                byte[] bytes = part.getBytes(StandardCharsets.UTF_8);
                digest.update((bytes.length + ":").getBytes(StandardCharsets.US_ASCII));
                digest.update(bytes);
            }
            return HexFormat.of().formatHex(digest.digest());
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    @Override
    public String toString() {
        return subject + "/" + template + "@" + snapshotVersion;
    }
}
