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

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Bootstrap for the named documents of one application.
 * <p>
 * Derives the encryption key once from the configured secret and hands the same key,
 * data directory and settings to every store it creates. The secret itself never leaves
 * this class.
 *
 * <pre>
 * DocumentRegistry registry = new DocumentRegistry(DocumentStoreConfig.load());
 * DocumentStore users = registry.register("users.json", JsonNodeFactory.instance::arrayNode);
 * DocumentStore settings = registry.register("settings.json", JsonNodeFactory.instance::objectNode);
 * registry.initAll();
 * </pre>
 */
public final class DocumentRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(DocumentRegistry.class);

    private final DocumentStoreConfig config;
    private final ObjectMapper mapper;
    private final EncryptionKey key;
    private final Map<String, DocumentStore> stores = new LinkedHashMap<>();

    public DocumentRegistry(DocumentStoreConfig config) {
        this(config, new ObjectMapper());
    }

    public DocumentRegistry(DocumentStoreConfig config, ObjectMapper mapper) {
        this.config = Objects.requireNonNull(config, "config");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.key = config.encryptionSecret().map(EncryptionKey::deriveFrom).orElse(null);

        if (key != null) {
            LOG.info("Document encryption enabled: algorithm={}, key={}", config.encryptionAlgorithm(),
                    key.fingerprint());
        } else {
            LOG.info("Document encryption disabled; documents are stored as plain JSON");
        }
        LOG.info("Document registry data directory: {}", config.dataDir().toAbsolutePath());
    }

    /**
     * Creates and registers a store for {@code fileName} under the data directory.
     *
     * @throws IllegalStateException if the name is already registered
     */
    public synchronized DocumentStore register(String fileName, Supplier<JsonNode> defaultFactory) {
        if (stores.containsKey(fileName)) {
            throw new IllegalStateException("Document already registered: " + fileName);
        }
        DocumentStore store = new JsonDocumentStore(config.dataDir(), fileName, defaultFactory, key, config, mapper);
        stores.put(fileName, store);
        LOG.debug("Registered document {} at {}", fileName, store.path());
        return store;
    }

    /**
     * Registers a store bound to {@code T}. The default value is converted to a tree each time
     * it is needed.
     */
    public <T> TypedDocumentStore<T> registerTyped(String fileName, TypeReference<T> type, Supplier<T> defaultValue) {
        Objects.requireNonNull(defaultValue, "defaultValue");
        DocumentStore store = register(fileName, () -> mapper.valueToTree(defaultValue.get()));
        return new TypedDocumentStore<>(store, mapper, type);
    }

    /**
     * Returns the store registered under {@code fileName}.
     *
     * @throws IllegalArgumentException if nothing is registered under that name
     */
    public synchronized DocumentStore get(String fileName) {
        DocumentStore store = stores.get(fileName);
        if (store == null) {
            throw new IllegalArgumentException("Unknown document: " + fileName);
        }
        return store;
    }

    /** Registered names in registration order. */
    public synchronized List<String> names() {
        return List.copyOf(stores.keySet());
    }

    /**
     * Runs {@link DocumentStore#init()} on every registered store, in registration order.
     * Stops at the first failure.
     */
    public void initAll() {
        List<DocumentStore> snapshot;
        synchronized (this) {
            snapshot = new ArrayList<>(stores.values());
        }
        for (DocumentStore store : snapshot) {
            store.init();
        }
        LOG.info("Initialized {} document(s) in {}", snapshot.size(), config.dataDir());
    }

    public Path dataDir() {
        return config.dataDir();
    }

    public boolean isEncrypted() {
        return key != null;
    }
}
