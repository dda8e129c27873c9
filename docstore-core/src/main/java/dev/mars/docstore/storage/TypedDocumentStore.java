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
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Binds a {@link DocumentStore} to a Java type through Jackson.
 * <p>
 * Locking, atomic replacement, recovery and encryption are all done by the wrapped store;
 * this class only converts between the tree and {@code T}.
 *
 * @param <T> the document type
 */
public final class TypedDocumentStore<T> {

    private static final Logger LOG = LoggerFactory.getLogger(TypedDocumentStore.class);

    private final DocumentStore delegate;
    private final ObjectMapper mapper;
    private final JavaType type;

    public TypedDocumentStore(DocumentStore delegate, ObjectMapper mapper, Class<T> type) {
        this(delegate, mapper, mapper.constructType(type));
    }

    public TypedDocumentStore(DocumentStore delegate, ObjectMapper mapper, TypeReference<T> type) {
        this(delegate, mapper, mapper.constructType(type));
    }

    private TypedDocumentStore(DocumentStore delegate, ObjectMapper mapper, JavaType type) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.type = type;
    }

    public void init() {
        delegate.init();
    }

    /**
     * Reads the document and binds it to {@code T}.
     *
     * @throws SerializationException if the stored tree does not match {@code T}
     */
    public T read() {
        JsonNode node = delegate.read();
        try {
            return mapper.treeToValue(node, type);
        } catch (JsonProcessingException e) {
            LOG.error("Document {} does not bind to {}: {}", delegate.path(), type, e.getOriginalMessage());
            throw new SerializationException("Document " + delegate.path() + " does not bind to " + type, e);
        }
    }

    /**
     * Converts {@code value} to a tree and writes it.
     *
     * @throws SerializationException if {@code value} cannot be converted
     */
    public void write(T value) {
        Objects.requireNonNull(value, "value");
        JsonNode node;
        try {
            node = mapper.valueToTree(value);
        } catch (IllegalArgumentException e) {
            LOG.error("Cannot convert {} for {}: {}", value.getClass().getSimpleName(), delegate.path(), e.getMessage());
            throw new SerializationException("Cannot convert value for " + delegate.path(), e);
        }
        delegate.write(node);
    }

    public Path path() {
        return delegate.path();
    }

    /** The untyped store underneath. */
    public DocumentStore untyped() {
        return delegate;
    }
}
