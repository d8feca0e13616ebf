package de.mirkosertic.sheetwatch.diff;

import de.mirkosertic.sheetwatch.baseline.BaselineJson;
import de.mirkosertic.sheetwatch.model.WorkbookSnapshot;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Deterministic content hash of a {@link WorkbookSnapshot}.
 * <p>
 * The hash is SHA-256 over the canonical JSON rendering, in which worksheets and cell addresses appear in
 * sorted order. Two snapshots with equal cells therefore hash identically regardless of the order in which
 * the extractor encountered the worksheets.
 */
public final class ContentFingerprint {

    private ContentFingerprint() {
    }

    public static String of(final WorkbookSnapshot snapshot) {
        return sha256Hex(BaselineJson.toCanonicalString(snapshot));
    }

    /**
     * Lower-case hex SHA-256 of the UTF-8 bytes of {@code content}.
     */
    public static String sha256Hex(final String content) {
        final MessageDigest digest;
        try {
            digest = MessageDigest.getInstance("SHA-256");
        } catch (final NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
        final byte[] hash = digest.digest(content.getBytes(StandardCharsets.UTF_8));
        final StringBuilder hexString = new StringBuilder(hash.length * 2);
        for (final byte b : hash) {
            final String hex = Integer.toHexString(0xff & b);
            if (hex.length() == 1) {
                hexString.append('0');
            }
            hexString.append(hex);
        }
        return hexString.toString();
    }
}
