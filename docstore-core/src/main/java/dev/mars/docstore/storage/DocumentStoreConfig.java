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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;
import java.util.Properties;

/**
 * Configuration for document stores.
 * <p>
 * Configuration is resolved with the following priority (highest first):
 * <ol>
 *   <li>Programmatic values set via {@link Builder}</li>
 *   <li>System properties (e.g., {@code -Ddocstore.dataDir=/path})</li>
 *   <li>Environment variables (e.g., {@code DOCSTORE_DATA_DIR})</li>
 *   <li>Properties file ({@code docstore.properties} on classpath or in working directory)</li>
 *   <li>Default values</li>
 * </ol>
 *
 * <h2>Configuration Properties</h2>
 * <table border="1">
 *   <tr><th>Property</th><th>System Property</th><th>Env Variable</th><th>Default</th></tr>
 *   <tr><td>dataDir</td><td>docstore.dataDir</td><td>DOCSTORE_DATA_DIR</td><td>server-data</td></tr>
 *   <tr><td>encryptionSecret</td><td>docstore.encryptionSecret</td><td>DOCSTORE_ENCRYPTION_SECRET</td><td>(none)</td></tr>
 *   <tr><td>encryptionAlgorithm</td><td>docstore.encryptionAlgorithm</td><td>DOCSTORE_ENCRYPTION_ALGORITHM</td><td>aes-256-gcm</td></tr>
 *   <tr><td>syncEnabled</td><td>docstore.syncEnabled</td><td>DOCSTORE_SYNC_ENABLED</td><td>true</td></tr>
 *   <tr><td>verifyWrites</td><td>docstore.verifyWrites</td><td>DOCSTORE_VERIFY_WRITES</td><td>false</td></tr>
 *   <tr><td>lockMode</td><td>docstore.lockMode</td><td>DOCSTORE_LOCK_MODE</td><td>AUTO</td></tr>
 *   <tr><td>cacheEnabled</td><td>docstore.cacheEnabled</td><td>DOCSTORE_CACHE_ENABLED</td><td>false</td></tr>
 *   <tr><td>raceRecoveryPolicy</td><td>docstore.raceRecoveryPolicy</td><td>DOCSTORE_RACE_RECOVERY_POLICY</td><td>MERGE</td></tr>
 *   <tr><td>strictDecryption</td><td>docstore.strictDecryption</td><td>DOCSTORE_STRICT_DECRYPTION</td><td>false</td></tr>
 *   <tr><td>minFreeSpaceMb</td><td>docstore.minFreeSpaceMb</td><td>DOCSTORE_MIN_FREE_SPACE_MB</td><td>16</td></tr>
 *   <tr><td>maxDocumentSizeMb</td><td>docstore.maxDocumentSizeMb</td><td>DOCSTORE_MAX_DOCUMENT_SIZE_MB</td><td>64</td></tr>
 * </table>
 *
 * <h2>Example Properties File</h2>
 * <pre>
 * # docstore.properties
 * docstore.dataDir=/var/lib/app/server-data
 * docstore.lockMode=ADVISORY
 * docstore.raceRecoveryPolicy=MERGE
 * </pre>
 * The encryption secret is better supplied through the environment than a checked-in file.
 *
 * <h2>Programmatic Configuration</h2>
 * <pre>
 * DocumentStoreConfig config = DocumentStoreConfig.builder()
 *     .dataDir(Path.of("/var/lib/app/server-data"))
 *     .encryptionSecret(System.getenv("APP_DATA_KEY"))
 *     .build();
 *
 * DocumentRegistry registry = new DocumentRegistry(config);
 * </pre>
 */
public final class DocumentStoreConfig {

    private static final Logger LOG = LoggerFactory.getLogger(DocumentStoreConfig.class);

    private static final String PROPERTIES_FILE = "docstore.properties";

    // Property keys
    private static final String PROP_DATA_DIR = "docstore.dataDir";
    private static final String PROP_ENCRYPTION_SECRET = "docstore.encryptionSecret";
    private static final String PROP_ENCRYPTION_ALGORITHM = "docstore.encryptionAlgorithm";
    private static final String PROP_SYNC_ENABLED = "docstore.syncEnabled";
    private static final String PROP_VERIFY_WRITES = "docstore.verifyWrites";
    private static final String PROP_LOCK_MODE = "docstore.lockMode";
    private static final String PROP_CACHE_ENABLED = "docstore.cacheEnabled";
    private static final String PROP_RACE_RECOVERY_POLICY = "docstore.raceRecoveryPolicy";
    private static final String PROP_STRICT_DECRYPTION = "docstore.strictDecryption";
    private static final String PROP_MIN_FREE_SPACE_MB = "docstore.minFreeSpaceMb";
    private static final String PROP_MAX_DOCUMENT_SIZE_MB = "docstore.maxDocumentSizeMb";

    // Environment variable keys
    private static final String ENV_DATA_DIR = "DOCSTORE_DATA_DIR";
    private static final String ENV_ENCRYPTION_SECRET = "DOCSTORE_ENCRYPTION_SECRET";
    private static final String ENV_ENCRYPTION_ALGORITHM = "DOCSTORE_ENCRYPTION_ALGORITHM";
    private static final String ENV_SYNC_ENABLED = "DOCSTORE_SYNC_ENABLED";
    private static final String ENV_VERIFY_WRITES = "DOCSTORE_VERIFY_WRITES";
    private static final String ENV_LOCK_MODE = "DOCSTORE_LOCK_MODE";
    private static final String ENV_CACHE_ENABLED = "DOCSTORE_CACHE_ENABLED";
    private static final String ENV_RACE_RECOVERY_POLICY = "DOCSTORE_RACE_RECOVERY_POLICY";
    private static final String ENV_STRICT_DECRYPTION = "DOCSTORE_STRICT_DECRYPTION";
    private static final String ENV_MIN_FREE_SPACE_MB = "DOCSTORE_MIN_FREE_SPACE_MB";
    private static final String ENV_MAX_DOCUMENT_SIZE_MB = "DOCSTORE_MAX_DOCUMENT_SIZE_MB";

    // Defaults
    private static final Path DEFAULT_DATA_DIR = Path.of("server-data");
    private static final String DEFAULT_ENCRYPTION_ALGORITHM = EncryptionEnvelope.ALGORITHM;
    private static final boolean DEFAULT_SYNC_ENABLED = true;
    private static final boolean DEFAULT_VERIFY_WRITES = false;
    private static final LockMode DEFAULT_LOCK_MODE = LockMode.AUTO;
    private static final boolean DEFAULT_CACHE_ENABLED = false;
    private static final RaceRecoveryPolicy DEFAULT_RACE_RECOVERY_POLICY = RaceRecoveryPolicy.MERGE;
    private static final boolean DEFAULT_STRICT_DECRYPTION = false;
    private static final int DEFAULT_MIN_FREE_SPACE_MB = 16;
    private static final int DEFAULT_MAX_DOCUMENT_SIZE_MB = 64;

    private final Path dataDir;
    private final String encryptionSecret;
    private final String encryptionAlgorithm;
    private final boolean syncEnabled;
    private final boolean verifyWrites;
    private final LockMode lockMode;
    private final boolean cacheEnabled;
    private final RaceRecoveryPolicy raceRecoveryPolicy;
    private final boolean strictDecryption;
    private final int minFreeSpaceMb;
    private final int maxDocumentSizeMb;

    private DocumentStoreConfig(Builder builder) {
        this.dataDir = builder.dataDir;
        this.encryptionSecret = builder.encryptionSecret;
        this.encryptionAlgorithm = builder.encryptionAlgorithm;
        this.syncEnabled = builder.syncEnabled;
        this.verifyWrites = builder.verifyWrites;
        this.lockMode = builder.lockMode;
        this.cacheEnabled = builder.cacheEnabled;
        this.raceRecoveryPolicy = builder.raceRecoveryPolicy;
        this.strictDecryption = builder.strictDecryption;
        this.minFreeSpaceMb = builder.minFreeSpaceMb;
        this.maxDocumentSizeMb = builder.maxDocumentSizeMb;
    }

    /** Base directory holding the documents. */
    public Path dataDir() {
        return dataDir;
    }

    /** Operator secret the bootstrap layer derives the encryption key from, if configured. */
    public Optional<String> encryptionSecret() {
        return Optional.ofNullable(encryptionSecret);
    }

    /** Envelope algorithm identifier. Only {@code aes-256-gcm} is accepted. */
    public String encryptionAlgorithm() {
        return encryptionAlgorithm;
    }

    /** Whether fsync is enabled (should be true in production). */
    public boolean syncEnabled() {
        return syncEnabled;
    }

    /** Whether staged files are read back and compared before the rename. */
    public boolean verifyWrites() {
        return verifyWrites;
    }

    /** How cross-process locking is obtained. */
    public LockMode lockMode() {
        return lockMode;
    }

    /** Whether reads may be served from memory while the file is unchanged. */
    public boolean cacheEnabled() {
        return cacheEnabled;
    }

    /** What to do with documents holding concatenated values. */
    public RaceRecoveryPolicy raceRecoveryPolicy() {
        return raceRecoveryPolicy;
    }

    /** Whether a failed envelope decryption propagates instead of serving the default. */
    public boolean strictDecryption() {
        return strictDecryption;
    }

    /** Minimum free disk space in MB required before writes. */
    public int minFreeSpaceMb() {
        return minFreeSpaceMb;
    }

    /** Maximum serialized document size in MB. */
    public int maxDocumentSizeMb() {
        return maxDocumentSizeMb;
    }

    /** Minimum free disk space in bytes. */
    public long minFreeSpaceBytes() {
        return (long) minFreeSpaceMb * 1024 * 1024;
    }

    /** Maximum serialized document size in bytes. */
    public long maxDocumentSizeBytes() {
        return (long) maxDocumentSizeMb * 1024 * 1024;
    }

    @Override
    public String toString() {
        return "DocumentStoreConfig{" +
                "dataDir=" + dataDir +
                ", encryption=" + (encryptionSecret != null ? encryptionAlgorithm : "disabled") +
                ", syncEnabled=" + syncEnabled +
                ", verifyWrites=" + verifyWrites +
                ", lockMode=" + lockMode +
                ", cacheEnabled=" + cacheEnabled +
                ", raceRecoveryPolicy=" + raceRecoveryPolicy +
                ", strictDecryption=" + strictDecryption +
                ", minFreeSpaceMb=" + minFreeSpaceMb +
                ", maxDocumentSizeMb=" + maxDocumentSizeMb +
                '}';
    }

    /**
     * Creates a new builder with defaults resolved from system properties,
     * environment variables, and properties file.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Loads configuration from all sources with default priority.
     * Shorthand for {@code DocumentStoreConfig.builder().build()}.
     */
    public static DocumentStoreConfig load() {
        return builder().build();
    }

    /**
     * Builder for {@link DocumentStoreConfig}.
     * <p>
     * Values not explicitly set will be resolved from system properties,
     * environment variables, properties file, or defaults (in that order).
     */
    public static final class Builder {
        private Path dataDir;
        private String encryptionSecret;
        private boolean encryptionSecretSet;
        private String encryptionAlgorithm;
        private Boolean syncEnabled;
        private Boolean verifyWrites;
        private LockMode lockMode;
        private Boolean cacheEnabled;
        private RaceRecoveryPolicy raceRecoveryPolicy;
        private Boolean strictDecryption;
        private Integer minFreeSpaceMb;
        private Integer maxDocumentSizeMb;

        private final Properties fileProperties;

        private Builder() {
            this.fileProperties = loadPropertiesFile();
        }

        /** Sets the data directory. */
        public Builder dataDir(Path dataDir) {
            this.dataDir = dataDir;
            return this;
        }

        /** Sets the data directory from a string path. */
        public Builder dataDir(String dataDir) {
            this.dataDir = Path.of(dataDir);
            return this;
        }

        /** Sets the encryption secret; {@code null} or blank explicitly disables encryption. */
        public Builder encryptionSecret(String encryptionSecret) {
            this.encryptionSecret = encryptionSecret == null || encryptionSecret.isBlank()
                    ? null : encryptionSecret.strip();
            this.encryptionSecretSet = true;
            return this;
        }

        /** Sets the envelope algorithm identifier (default: aes-256-gcm). */
        public Builder encryptionAlgorithm(String encryptionAlgorithm) {
            this.encryptionAlgorithm = encryptionAlgorithm;
            return this;
        }

        /** Enables or disables fsync (default: true). */
        public Builder syncEnabled(boolean syncEnabled) {
            this.syncEnabled = syncEnabled;
            return this;
        }

        /** Enables or disables write verification (default: false). */
        public Builder verifyWrites(boolean verifyWrites) {
            this.verifyWrites = verifyWrites;
            return this;
        }

        /** Sets the lock mode (default: AUTO). */
        public Builder lockMode(LockMode lockMode) {
            this.lockMode = lockMode;
            return this;
        }

        /** Enables or disables the read cache (default: false). */
        public Builder cacheEnabled(boolean cacheEnabled) {
            this.cacheEnabled = cacheEnabled;
            return this;
        }

        /** Sets the race recovery policy (default: MERGE). */
        public Builder raceRecoveryPolicy(RaceRecoveryPolicy raceRecoveryPolicy) {
            this.raceRecoveryPolicy = raceRecoveryPolicy;
            return this;
        }

        /** Makes failed decryption of an envelope propagate (default: false). */
        public Builder strictDecryption(boolean strictDecryption) {
            this.strictDecryption = strictDecryption;
            return this;
        }

        /** Sets minimum free disk space in MB (default: 16). */
        public Builder minFreeSpaceMb(int minFreeSpaceMb) {
            this.minFreeSpaceMb = minFreeSpaceMb;
            return this;
        }

        /** Sets maximum document size in MB (default: 64). */
        public Builder maxDocumentSizeMb(int maxDocumentSizeMb) {
            this.maxDocumentSizeMb = maxDocumentSizeMb;
            return this;
        }

        /**
         * Builds the configuration, resolving unset values from
         * system properties, environment variables, properties file, or defaults.
         *
         * @throws IllegalArgumentException if the encryption algorithm is not supported
         */
        public DocumentStoreConfig build() {
            // Resolve each value with priority: programmatic > sysprop > env > file > default
            if (dataDir == null) {
                String value = resolve(PROP_DATA_DIR, ENV_DATA_DIR);
                dataDir = value != null ? Path.of(value) : DEFAULT_DATA_DIR;
            }
            if (!encryptionSecretSet) {
                String value = resolve(PROP_ENCRYPTION_SECRET, ENV_ENCRYPTION_SECRET);
                encryptionSecret = value != null ? value.strip() : null;
            }
            if (encryptionAlgorithm == null) {
                String value = resolve(PROP_ENCRYPTION_ALGORITHM, ENV_ENCRYPTION_ALGORITHM);
                encryptionAlgorithm = value != null ? value.strip().toLowerCase(Locale.ROOT) : DEFAULT_ENCRYPTION_ALGORITHM;
            }
            if (syncEnabled == null) {
                syncEnabled = resolveBoolean(PROP_SYNC_ENABLED, ENV_SYNC_ENABLED, DEFAULT_SYNC_ENABLED);
            }
            if (verifyWrites == null) {
                verifyWrites = resolveBoolean(PROP_VERIFY_WRITES, ENV_VERIFY_WRITES, DEFAULT_VERIFY_WRITES);
            }
            if (lockMode == null) {
                lockMode = resolveEnum(PROP_LOCK_MODE, ENV_LOCK_MODE, LockMode.class, DEFAULT_LOCK_MODE);
            }
            if (cacheEnabled == null) {
                cacheEnabled = resolveBoolean(PROP_CACHE_ENABLED, ENV_CACHE_ENABLED, DEFAULT_CACHE_ENABLED);
            }
            if (raceRecoveryPolicy == null) {
                raceRecoveryPolicy = resolveEnum(PROP_RACE_RECOVERY_POLICY, ENV_RACE_RECOVERY_POLICY,
                        RaceRecoveryPolicy.class, DEFAULT_RACE_RECOVERY_POLICY);
            }
            if (strictDecryption == null) {
                strictDecryption = resolveBoolean(PROP_STRICT_DECRYPTION, ENV_STRICT_DECRYPTION, DEFAULT_STRICT_DECRYPTION);
            }
            if (minFreeSpaceMb == null) {
                minFreeSpaceMb = resolveInt(PROP_MIN_FREE_SPACE_MB, ENV_MIN_FREE_SPACE_MB, DEFAULT_MIN_FREE_SPACE_MB);
            }
            if (maxDocumentSizeMb == null) {
                maxDocumentSizeMb = resolveInt(PROP_MAX_DOCUMENT_SIZE_MB, ENV_MAX_DOCUMENT_SIZE_MB, DEFAULT_MAX_DOCUMENT_SIZE_MB);
            }

            EncryptionEnvelope.requireSupported(encryptionAlgorithm);
            return new DocumentStoreConfig(this);
        }

        /**
         * Returns the first non-blank value from system property, environment variable,
         * or properties file, or {@code null} if none is set.
         */
        private String resolve(String sysProp, String envVar) {
            // 1. System property
            String value = System.getProperty(sysProp);
            if (value != null && !value.isBlank()) {
                return value;
            }

            // 2. Environment variable
            value = System.getenv(envVar);
            if (value != null && !value.isBlank()) {
                return value;
            }

            // 3. Properties file
            value = fileProperties.getProperty(sysProp);
            if (value != null && !value.isBlank()) {
                return value;
            }

            return null;
        }

        private boolean resolveBoolean(String sysProp, String envVar, boolean defaultValue) {
            String value = resolve(sysProp, envVar);
            return value != null ? Boolean.parseBoolean(value.strip()) : defaultValue;
        }

        private int resolveInt(String sysProp, String envVar, int defaultValue) {
            String value = resolve(sysProp, envVar);
            if (value == null) {
                return defaultValue;
            }
            try {
                return Integer.parseInt(value.strip());
            } catch (NumberFormatException e) {
                LOG.warn("Ignoring invalid integer for {}: '{}', using {}", sysProp, value, defaultValue);
                return defaultValue;
            }
        }

        private <E extends Enum<E>> E resolveEnum(String sysProp, String envVar, Class<E> type, E defaultValue) {
            String value = resolve(sysProp, envVar);
            if (value == null) {
                return defaultValue;
            }
            try {
                return Enum.valueOf(type, value.strip().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                LOG.warn("Ignoring invalid {} for {}: '{}', using {}",
                        type.getSimpleName(), sysProp, value, defaultValue);
                return defaultValue;
            }
        }

        private static Properties loadPropertiesFile() {
            Properties props = new Properties();

            // Try classpath first
            try (InputStream is = DocumentStoreConfig.class.getClassLoader()
                    .getResourceAsStream(PROPERTIES_FILE)) {
                if (is != null) {
                    props.load(is);
                    return props;
                }
            } catch (IOException e) {
                LOG.warn("Could not read {} from classpath: {}", PROPERTIES_FILE, e.getMessage());
            }

            // Try working directory
            Path localFile = Path.of(PROPERTIES_FILE);
            if (Files.exists(localFile)) {
                try (InputStream is = Files.newInputStream(localFile)) {
                    props.load(is);
                } catch (IOException e) {
                    LOG.warn("Could not read {}: {}", localFile.toAbsolutePath(), e.getMessage());
                }
            }

            return props;
        }
    }
}
