package de.vzg.pubmed.tools.cache;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.DigestInputStream;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;

/**
 * How a cache artifact is tied to the state of its source file. An artifact whose stored fingerprint
 * differs from the one computed for the current source is stale.
 */
public enum CacheFingerprint {

    /**
     * Presence of the artifact alone makes it valid. Changes to the source go unnoticed.
     */
    NONE {
        @Override
        public String compute(Path source) {
            return null;
        }
    },

    /**
     * File size and last modification time.
     */
    METADATA {
        @Override
        public String compute(Path source) throws IOException {
            return "size=" + Files.size(source) + ";mtime=" + Files.getLastModifiedTime(source).toMillis();
        }
    },

    /**
     * SHA-256 of the file content. Reads the whole source on every lookup.
     */
    SHA256 {
        @Override
        public String compute(Path source) throws IOException {
            MessageDigest digest;
            try {
                digest = MessageDigest.getInstance("SHA-256");
            } catch (NoSuchAlgorithmException e) {
                throw new IllegalStateException("SHA-256 not available", e);
            }
            try (InputStream is = new DigestInputStream(Files.newInputStream(source), digest)) {
                is.transferTo(OutputStream.nullOutputStream());
            }
            return "sha256=" + HexFormat.of().formatHex(digest.digest());
        }
    };

    /**
     * @param source the source file
     * @return the fingerprint, or null if this strategy does not fingerprint
     * @throws IOException if the source cannot be inspected
     */
    public abstract String compute(Path source) throws IOException;

    public static CacheFingerprint fromName(String name) {
        return valueOf(name.trim().toUpperCase(Locale.ROOT).replace("-", ""));
    }
}
