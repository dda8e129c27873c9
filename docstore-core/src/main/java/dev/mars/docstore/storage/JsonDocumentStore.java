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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.nio.file.attribute.FileTime;
import java.util.Arrays;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * File-backed implementation of {@link DocumentStore}.
 * <p>
 * <b>Write path:</b> serialize (pretty-printed, or encrypted into an envelope when a key is
 * configured) → exclusive lock → {@link AtomicFileWriter} → release.
 * <p>
 * <b>Read path:</b> shared lock → read bytes → release → {@link RecoveryDecoder} →
 * open the envelope if one is present and a key is configured → return.
 * <ul>
 *   <li>Concatenated values are merged and the document is rewritten in its single-value
 *       form on the same call (unless {@link RaceRecoveryPolicy#FAIL}).</li>
 *   <li>Unreadable bytes, or an envelope that fails authentication, are moved aside to
 *       {@code <name>.corrupt.<epoch-seconds>} and the default value is served.</li>
 *   <li>An absent file yields the default without touching the filesystem.</li>
 * </ul>
 * <p>
 * <b>Thread Safety:</b> instances are safe for concurrent use. No lock or descriptor is held
 * between calls.
 */
public final class JsonDocumentStore implements DocumentStore {

    // ========================================================================
    // Logger
    // ========================================================================

    private static final Logger LOG = LoggerFactory.getLogger(JsonDocumentStore.class);

    // ========================================================================
    // State
    // ========================================================================

    private final DocumentPaths paths;
    private final Supplier<JsonNode> defaultFactory;
    private final ObjectMapper mapper;
    private final ObjectWriter prettyWriter;
    private final LockManager locks;
    private final AtomicFileWriter writer;
    private final RecoveryDecoder decoder;
    private final EncryptionEnvelope envelope;
    private final RaceRecoveryPolicy raceRecoveryPolicy;
    private final boolean strictDecryption;
    private final boolean cacheEnabled;

    private volatile CachedDocument cache;

    // ========================================================================
    // Constructor
    // ========================================================================

    /**
     * Creates an unencrypted store.
     *
     * @param baseDir        directory holding the document
     * @param fileName       document file name inside {@code baseDir}
     * @param defaultFactory produces the value served when the document is absent or unreadable
     * @param config         store settings; only the per-document options are used
     */
    public JsonDocumentStore(Path baseDir, String fileName, Supplier<JsonNode> defaultFactory,
                             DocumentStoreConfig config) {
        this(baseDir, fileName, defaultFactory, null, config, new ObjectMapper());
    }

    /**
     * Creates a store, encrypted when {@code key} is non-null.
     *
     * @param key    encryption key owned by the bootstrap layer, or {@code null} for plain JSON
     * @param mapper Jackson mapper used for parsing and serialization
     * @throws IllegalArgumentException if a key is given and the configured algorithm is unknown
     */
    public JsonDocumentStore(Path baseDir, String fileName, Supplier<JsonNode> defaultFactory,
                             EncryptionKey key, DocumentStoreConfig config, ObjectMapper mapper) {
        this.paths = DocumentPaths.of(baseDir, fileName);
        this.defaultFactory = Objects.requireNonNull(defaultFactory, "defaultFactory");
        this.mapper = mapper;
        this.prettyWriter = mapper.writerWithDefaultPrettyPrinter();
        this.locks = LockManager.create(paths.lockFile(), config.lockMode());
        this.writer = new AtomicFileWriter(config);
        this.decoder = new RecoveryDecoder(mapper);
        this.envelope = key != null ? new EncryptionEnvelope(key, config.encryptionAlgorithm(), mapper) : null;
        this.raceRecoveryPolicy = config.raceRecoveryPolicy();
        this.strictDecryption = config.strictDecryption();
        this.cacheEnabled = config.cacheEnabled();

        LOG.debug("JsonDocumentStore created: file={}, encrypted={}, crossProcessLocking={}, racePolicy={}, cache={}",
                paths.file(), envelope != null, locks.isCrossProcess(), raceRecoveryPolicy, cacheEnabled);
    }

    @Override
    public Path path() {
        return paths.file();
    }

    @Override
    public boolean isCrossProcessSafe() {
        return locks.isCrossProcess();
    }

    /** Whether documents are written as encryption envelopes. */
    public boolean isEncrypted() {
        return envelope != null;
    }

    // ========================================================================
    // Init / Write
    // ========================================================================

    @Override
    public void init() {
        Path file = paths.file();
        if (Files.exists(file)) {
            LOG.debug("Document already present: {}", file);
            return;
        }
        JsonNode initial = newDefault();
        byte[] payload = serialize(initial);
        try (LockHandle lock = locks.acquire(false)) {
            // Re-check under the lock: another process may have created it meanwhile
            if (Files.exists(file)) {
                LOG.debug("Document created concurrently, leaving it: {}", file);
                return;
            }
            writer.write(paths, payload);
            remember(initial);
        }
        LOG.info("Initialized document {} with default value", file);
    }

    @Override
    public void write(JsonNode value) {
        Objects.requireNonNull(value, "value");
        byte[] payload = serialize(value);
        try (LockHandle lock = locks.acquire(false)) {
            writer.write(paths, payload);
            remember(value);
        }
    }

    private byte[] serialize(JsonNode value) {
        try {
            if (envelope == null) {
                return prettyWriter.writeValueAsBytes(value);
            }
            byte[] plaintext = mapper.writeValueAsBytes(value);
            return prettyWriter.writeValueAsBytes(envelope.wrap(plaintext));
        } catch (JsonProcessingException e) {
            LOG.error("Cannot serialize value for {}: {}", paths.file(), e.getMessage(), e);
            throw new SerializationException("Cannot serialize value for " + paths.file(), e);
        }
    }

    // ========================================================================
    // Read
    // ========================================================================

    @Override
    public JsonNode read() {
        return read(true);
    }

    private JsonNode read(boolean retryIfChanged) {
        Path file = paths.file();
        if (!Files.exists(file)) {
            LOG.trace("Document absent, serving default: {}", file);
            return newDefault();
        }

        if (cacheEnabled) {
            CachedDocument cached = cache;
            if (cached != null && cached.stamp().equals(stampOrNull(file))) {
                LOG.trace("Serving {} from cache", file);
                return cached.value().deepCopy();
            }
        }

        byte[] raw;
        FileStamp stamp;
        try (LockHandle lock = locks.acquire(true)) {
            stamp = stampOrNull(file);
            raw = Files.readAllBytes(file);
        } catch (NoSuchFileException e) {
            LOG.debug("Document disappeared before it could be read, serving default: {}", file);
            return newDefault();
        } catch (IOException e) {
            LOG.error("Failed to read {}: {}", file, e.getMessage(), e);
            throw new StorageException("Failed to read " + file, e);
        }

        if (raw.length == 0) {
            LOG.debug("Document empty, serving default: {}", file);
            return newDefault();
        }
        return interpret(raw, stamp, retryIfChanged);
    }

    private JsonNode interpret(byte[] raw, FileStamp stamp, boolean retryIfChanged) {
        Path file = paths.file();
        RecoveryDecoder.Decoded outer;
        try {
            outer = decoder.decode(raw);
        } catch (CorruptDocumentException e) {
            return quarantine(raw, e, retryIfChanged);
        }
        checkRacePolicy(outer);

        JsonNode value = outer.value();
        boolean heal = outer.hadExtraData();

        if (EncryptionEnvelope.isEnvelope(value)) {
            if (envelope == null) {
                LOG.warn("Document {} is encrypted but no encryption key is configured; returning the envelope as-is",
                        file);
            } else {
                try {
                    RecoveryDecoder.Decoded inner = decoder.decode(envelope.unwrap(value));
                    checkRacePolicy(inner);
                    value = inner.value();
                    heal |= inner.hadExtraData();
                } catch (DecryptionException e) {
                    if (strictDecryption) {
                        LOG.error("Cannot decrypt {}: {}", file, e.getMessage());
                        throw e;
                    }
                    LOG.error("Cannot decrypt {}: {}. Check that the same encryption secret is supplied on every " +
                            "start; the file is moved aside and the default value served.", file, e.getMessage());
                    return quarantine(raw, e, retryIfChanged);
                } catch (CorruptDocumentException e) {
                    return quarantine(raw, e, retryIfChanged);
                }
            }
        } else if (envelope != null) {
            LOG.debug("Document {} is plain JSON; it will be encrypted on the next write", file);
        }

        if (heal) {
            LOG.warn("Recovered {} with extra JSON data; rewriting canonical file", file);
            try {
                write(value);
            } catch (StorageException e) {
                LOG.warn("Failed to rewrite recovered {}: {}", file, e.getMessage(), e);
            }
            return value.deepCopy();
        }

        if (cacheEnabled && stamp != null) {
            cache = new CachedDocument(stamp, value.deepCopy());
        }
        return value;
    }

    private void checkRacePolicy(RecoveryDecoder.Decoded decoded) {
        if (decoded.hadExtraData() && raceRecoveryPolicy == RaceRecoveryPolicy.FAIL) {
            LOG.error("Document {} holds {} concatenated values and race recovery is FAIL",
                    paths.file(), decoded.valueCount());
            throw new ConcurrentWriteException(paths.file(), decoded.valueCount());
        }
    }

    // ========================================================================
    // Corruption Handling
    // ========================================================================

    /**
     * Moves unreadable bytes aside and serves the default.
     * <p>
     * Runs under the exclusive lock and only moves the file if it still holds {@code raw};
     * if a writer replaced it meanwhile, the read is retried once instead.
     */
    private JsonNode quarantine(byte[] raw, Exception cause, boolean retryIfChanged) {
        Path file = paths.file();
        LOG.warn("Document {} is unreadable ({}); serving default", file, cause.getMessage());
        cache = null;

        boolean changed = false;
        try (LockHandle lock = locks.acquire(false)) {
            if (!Files.exists(file)) {
                return newDefault();
            }
            if (!Arrays.equals(raw, Files.readAllBytes(file))) {
                changed = true;
            } else {
                Path target = quarantineTarget();
                Files.move(file, target);
                LOG.warn("Quarantined unreadable document {} as {}", file, target.getFileName());
            }
        } catch (IOException | LockAcquisitionException e) {
            LOG.warn("Could not quarantine {}: {}", file, e.getMessage(), e);
        }

        if (changed) {
            if (retryIfChanged) {
                LOG.debug("Document {} changed while it was being recovered, reading again", file);
                return read(false);
            }
            LOG.warn("Document {} keeps changing under recovery; leaving it in place", file);
        }
        return newDefault();
    }

    private Path quarantineTarget() {
        Path base = paths.quarantineFile(System.currentTimeMillis() / 1000);
        Path target = base;
        int suffix = 1;
        while (Files.exists(target)) {
            target = base.resolveSibling(base.getFileName() + "." + suffix++);
        }
        return target;
    }

    // ========================================================================
    // Internal Helpers
    // ========================================================================

    private JsonNode newDefault() {
        JsonNode value = defaultFactory.get();
        if (value == null) {
            throw new IllegalStateException("Default factory for " + paths.file() + " returned null");
        }
        return value;
    }

    private void remember(JsonNode value) {
        if (!cacheEnabled) {
            return;
        }
        FileStamp stamp = stampOrNull(paths.file());
        cache = stamp != null ? new CachedDocument(stamp, value.deepCopy()) : null;
    }

    private static FileStamp stampOrNull(Path file) {
        try {
            BasicFileAttributes attrs = Files.readAttributes(file, BasicFileAttributes.class);
            return new FileStamp(attrs.fileKey(), attrs.size(), attrs.lastModifiedTime());
        } catch (IOException e) {
            LOG.trace("Cannot stat {}: {}", file, e.getMessage());
            return null;
        }
    }

    /**
     * Identity of one version of the file. Atomic renames give every write a new file key
     * on filesystems that expose one.
     */
    private record FileStamp(Object fileKey, long size, FileTime modified) {
    }

    private record CachedDocument(FileStamp stamp, JsonNode value) {
    }
}
