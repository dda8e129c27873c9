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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Base64;

/**
 * Authenticated-encryption wrapper for serialized documents.
 * <p>
 * <b>Envelope format:</b>
 * <pre>
 * { "v": 1, "alg": "aes-256-gcm", "iv": "&lt;base64, 12 bytes&gt;",
 *   "tag": "&lt;base64, 16 bytes&gt;", "payload": "&lt;base64 ciphertext&gt;" }
 * </pre>
 * Every {@link #wrap} draws a fresh 96-bit nonce from {@link SecureRandom}; a nonce is never
 * reused under one key. The 128-bit GCM tag is split off the cipher output and stored next
 * to the ciphertext.
 */
public final class EncryptionEnvelope {

    /** Envelope schema version. */
    public static final int VERSION = 1;

    /** The only implemented algorithm identifier. */
    public static final String ALGORITHM = "aes-256-gcm";

    private static final String TRANSFORMATION = "AES/GCM/NoPadding";
    private static final int IV_LENGTH = 12;
    private static final int TAG_LENGTH = 16;
    private static final int TAG_BITS = TAG_LENGTH * 8;

    private static final String FIELD_VERSION = "v";
    private static final String FIELD_ALGORITHM = "alg";
    private static final String FIELD_IV = "iv";
    private static final String FIELD_TAG = "tag";
    private static final String FIELD_PAYLOAD = "payload";

    private final EncryptionKey key;
    private final ObjectMapper mapper;
    private final SecureRandom random = new SecureRandom();

    /**
     * @throws IllegalArgumentException if {@code algorithm} is not {@value #ALGORITHM}
     */
    public EncryptionEnvelope(EncryptionKey key, String algorithm, ObjectMapper mapper) {
        requireSupported(algorithm);
        this.key = key;
        this.mapper = mapper;
    }

    /**
     * Rejects algorithm identifiers other than {@value #ALGORITHM}.
     *
     * @throws IllegalArgumentException for unknown identifiers
     */
    public static void requireSupported(String algorithm) {
        if (!ALGORITHM.equals(algorithm)) {
            throw new IllegalArgumentException("Unsupported encryption algorithm: " + algorithm +
                    " (supported: " + ALGORITHM + ")");
        }
    }

    /**
     * Structural test: an object with {@code v == 1} and {@code iv}, {@code tag}, {@code payload}.
     */
    public static boolean isEnvelope(JsonNode node) {
        return node != null
                && node.isObject()
                && node.path(FIELD_VERSION).isIntegralNumber()
                && node.path(FIELD_VERSION).asInt() == VERSION
                && node.has(FIELD_IV)
                && node.has(FIELD_TAG)
                && node.has(FIELD_PAYLOAD);
    }

    /**
     * Encrypts {@code plaintext} under a fresh nonce.
     */
    public ObjectNode wrap(byte[] plaintext) {
        byte[] iv = new byte[IV_LENGTH];
        random.nextBytes(iv);
        byte[] sealed;
        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.ENCRYPT_MODE, key.secretKey(), new GCMParameterSpec(TAG_BITS, iv));
            sealed = cipher.doFinal(plaintext);
        } catch (GeneralSecurityException e) {
            throw new StorageException("AES-GCM encryption failed", e);
        }

        // JCE appends the tag to the ciphertext
        byte[] ciphertext = Arrays.copyOfRange(sealed, 0, sealed.length - TAG_LENGTH);
        byte[] tag = Arrays.copyOfRange(sealed, sealed.length - TAG_LENGTH, sealed.length);

        Base64.Encoder b64 = Base64.getEncoder();
        ObjectNode envelope = mapper.createObjectNode();
        envelope.put(FIELD_VERSION, VERSION);
        envelope.put(FIELD_ALGORITHM, ALGORITHM);
        envelope.put(FIELD_IV, b64.encodeToString(iv));
        envelope.put(FIELD_TAG, b64.encodeToString(tag));
        envelope.put(FIELD_PAYLOAD, b64.encodeToString(ciphertext));
        return envelope;
    }

    /**
     * Authenticates and decrypts an envelope.
     *
     * @throws DecryptionException on a malformed envelope, an unknown algorithm, or a failed
     *                             authentication check (wrong key or tampered data)
     */
    public byte[] unwrap(JsonNode envelope) {
        if (!isEnvelope(envelope)) {
            throw new DecryptionException("Not an encryption envelope");
        }
        JsonNode alg = envelope.get(FIELD_ALGORITHM);
        if (alg != null && !ALGORITHM.equals(alg.asText())) {
            throw new DecryptionException("Envelope uses unsupported algorithm: " + alg.asText());
        }

        byte[] iv = decodeField(envelope, FIELD_IV);
        byte[] tag = decodeField(envelope, FIELD_TAG);
        byte[] ciphertext = decodeField(envelope, FIELD_PAYLOAD);
        if (iv.length != IV_LENGTH) {
            throw new DecryptionException("Envelope iv must be " + IV_LENGTH + " bytes, got " + iv.length);
        }
        if (tag.length != TAG_LENGTH) {
            throw new DecryptionException("Envelope tag must be " + TAG_LENGTH + " bytes, got " + tag.length);
        }

        byte[] sealed = new byte[ciphertext.length + TAG_LENGTH];
        System.arraycopy(ciphertext, 0, sealed, 0, ciphertext.length);
        System.arraycopy(tag, 0, sealed, ciphertext.length, TAG_LENGTH);

        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.DECRYPT_MODE, key.secretKey(), new GCMParameterSpec(TAG_BITS, iv));
            return cipher.doFinal(sealed);
        } catch (AEADBadTagException e) {
            throw new DecryptionException("Envelope authentication failed (wrong key " +
                    key.fingerprint() + " or tampered data)", e);
        } catch (GeneralSecurityException e) {
            throw new DecryptionException("AES-GCM decryption failed", e);
        }
    }

    private static byte[] decodeField(JsonNode envelope, String field) {
        JsonNode node = envelope.get(field);
        if (node == null || !node.isTextual()) {
            throw new DecryptionException("Envelope field '" + field + "' must be a base64 string");
        }
        try {
            return Base64.getDecoder().decode(node.asText());
        } catch (IllegalArgumentException e) {
            throw new DecryptionException("Envelope field '" + field + "' is not valid base64", e);
        }
    }
}
