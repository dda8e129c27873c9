/*
 * Copyright 2026 Mark Andrew Ray-Smith
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package dev.mars.docstore.storage;

import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * A 256-bit AES key for document envelopes.
 * <p>
 * Keys are owned by the bootstrap layer and handed to each store at construction; the
 * store never derives or persists them. {@link #deriveFrom(String)} hashes an operator
 * secret with SHA-256, so the same secret must be supplied on every start to read data
 * written earlier.
 */
public final class EncryptionKey {

    /** Key length in bytes. */
    public static final int LENGTH = 32;

    private final byte[] key;

    private EncryptionKey(byte[] key) {
        this.key = key;
    }

    /**
     * Derives a key as {@code SHA-256(secret)} over the secret's UTF-8 bytes.
     *
     * @throws IllegalArgumentException if the secret is null or blank
     */
    public static EncryptionKey deriveFrom(String secret) {
        if (secret == null || secret.isBlank()) {
            throw new IllegalArgumentException("Encryption secret must not be blank");
        }
        return new EncryptionKey(sha256(secret.getBytes(StandardCharsets.UTF_8)));
    }

    /**
     * Wraps raw key bytes. The array is copied.
     *
     * @throws IllegalArgumentException unless exactly {@value #LENGTH} bytes are given
     */
    public static EncryptionKey of(byte[] raw) {
        if (raw == null || raw.length != LENGTH) {
            throw new IllegalArgumentException("AES-256 key must be " + LENGTH + " bytes");
        }
        return new EncryptionKey(raw.clone());
    }

    SecretKey secretKey() {
        return new SecretKeySpec(key, "AES");
    }

    /**
     * Short, non-reversible identifier of this key, for logs. Two stores with different
     * fingerprints cannot read each other's documents.
     */
    public String fingerprint() {
        return HexFormat.of().formatHex(sha256(key), 0, 4);
    }

    private static byte[] sha256(byte[] input) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(input);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof EncryptionKey)) {
            return false;
        }
        return MessageDigest.isEqual(key, ((EncryptionKey) o).key);
    }

    @Override
    public int hashCode() {
        return fingerprint().hashCode();
    }

    @Override
    public String toString() {
        return "EncryptionKey{fingerprint=" + fingerprint() + '}';
    }
}
