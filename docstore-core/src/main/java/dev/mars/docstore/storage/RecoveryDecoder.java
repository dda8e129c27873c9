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

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Tolerant JSON reader for documents that may hold several concatenated top-level values.
 * <p>
 * Concatenation is what two writers leave behind when they append to one file without a lock.
 * The decoder parses value after value until the input is exhausted, then:
 * <ul>
 *   <li>no value at all, or a parse error anywhere: {@link CorruptDocumentException};</li>
 *   <li>one value: returned as-is, {@code hadExtraData = false};</li>
 *   <li>several values: merged left to right, {@code hadExtraData = true}.</li>
 * </ul>
 * <b>Merge rules:</b> array + array extends, array + object appends the object,
 * object + object copies the later keys over the earlier ones. Any other pairing stops the
 * merge and the remaining values are dropped.
 */
public final class RecoveryDecoder {

    private static final Logger LOG = LoggerFactory.getLogger(RecoveryDecoder.class);

    private final ObjectMapper mapper;

    public RecoveryDecoder(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * Result of a decode.
     *
     * @param value        the single or merged value
     * @param hadExtraData whether more than one top-level value was found
     * @param valueCount   number of top-level values parsed
     */
    public record Decoded(JsonNode value, boolean hadExtraData, int valueCount) {
    }

    /**
     * Decodes raw document bytes (any JSON encoding Jackson detects, normally UTF-8).
     *
     * @throws CorruptDocumentException if no complete JSON value can be read
     */
    public Decoded decode(byte[] raw) {
        List<JsonNode> values = parseAll(raw);
        if (values.isEmpty()) {
            throw new CorruptDocumentException("No JSON value found in " + raw.length + " bytes");
        }
        if (values.size() == 1) {
            return new Decoded(values.get(0), false, 1);
        }
        LOG.debug("Found {} concatenated top-level JSON values, merging", values.size());
        return new Decoded(merge(values), true, values.size());
    }

    private List<JsonNode> parseAll(byte[] raw) {
        List<JsonNode> values = new ArrayList<>();
        try (JsonParser parser = mapper.getFactory().createParser(raw)) {
            while (parser.nextToken() != null) {
                JsonNode value = mapper.readTree(parser);
                values.add(value);
            }
        } catch (IOException e) {
            throw new CorruptDocumentException(
                    "Unparseable JSON after " + values.size() + " value(s): " + e.getMessage(), e);
        }
        return values;
    }

    static JsonNode merge(List<JsonNode> values) {
        JsonNode combined = values.get(0);
        for (int i = 1; i < values.size(); i++) {
            JsonNode next = values.get(i);
            if (combined.isArray() && next.isArray()) {
                ((ArrayNode) combined).addAll((ArrayNode) next);
            } else if (combined.isArray() && next.isObject()) {
                ((ArrayNode) combined).add(next);
            } else if (combined.isObject() && next.isObject()) {
                ((ObjectNode) combined).setAll((ObjectNode) next);
            } else {
                LOG.debug("Cannot merge {} into {}; dropping {} trailing value(s)",
                        next.getNodeType(), combined.getNodeType(), values.size() - i);
                break;
            }
        }
        return combined;
    }
}
