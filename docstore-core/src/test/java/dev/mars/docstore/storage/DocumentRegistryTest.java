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
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link DocumentRegistry}.
 */
class DocumentRegistryTest {

    @TempDir
    Path tempDir;

    private final ObjectMapper mapper = new ObjectMapper();

    private DocumentStoreConfig config(String secret) {
        return DocumentStoreConfig.builder()
                .dataDir(tempDir)
                .encryptionSecret(secret)
                .syncEnabled(false)
                .minFreeSpaceMb(0)
                .build();
    }

    @Test
    void testInitAll_CreatesEveryRegisteredDocument() throws Exception {
        DocumentRegistry registry = new DocumentRegistry(config(null), mapper);
        registry.register("users.json", JsonNodeFactory.instance::arrayNode);
        registry.register("settings.json", JsonNodeFactory.instance::objectNode);

        registry.initAll();

        assertEquals(mapper.createArrayNode(), mapper.readTree(tempDir.resolve("users.json").toFile()));
        assertEquals(mapper.createObjectNode(), mapper.readTree(tempDir.resolve("settings.json").toFile()));
        assertFalse(registry.isEncrypted());
    }

    @Test
    void testInitAll_LeavesExistingDocumentsAlone() throws Exception {
        Files.writeString(tempDir.resolve("users.json"), "[{\"id\":\"existing\"}]");
        DocumentRegistry registry = new DocumentRegistry(config(null), mapper);
        DocumentStore users = registry.register("users.json", JsonNodeFactory.instance::arrayNode);

        registry.initAll();

        assertEquals("existing", users.read().get(0).get("id").asText());
    }

    @Test
    void testRegister_DuplicateNameRejected() {
        DocumentRegistry registry = new DocumentRegistry(config(null), mapper);
        registry.register("users.json", JsonNodeFactory.instance::arrayNode);

        assertThrows(IllegalStateException.class,
                () -> registry.register("users.json", JsonNodeFactory.instance::objectNode));
    }

    @Test
    void testGet_ReturnsRegisteredStore() {
        DocumentRegistry registry = new DocumentRegistry(config(null), mapper);
        DocumentStore users = registry.register("users.json", JsonNodeFactory.instance::arrayNode);

        assertSame(users, registry.get("users.json"));
        assertThrows(IllegalArgumentException.class, () -> registry.get("missing.json"));
    }

    @Test
    void testNames_InRegistrationOrder() {
        DocumentRegistry registry = new DocumentRegistry(config(null), mapper);
        registry.register("b.json", JsonNodeFactory.instance::arrayNode);
        registry.register("a.json", JsonNodeFactory.instance::arrayNode);
        registry.register("c.json", JsonNodeFactory.instance::arrayNode);

        assertEquals(List.of("b.json", "a.json", "c.json"), registry.names());
        assertEquals(tempDir, registry.dataDir());
    }

    @Test
    void testSecret_SharedKeyAcrossStoresAndRestarts() throws Exception {
        DocumentRegistry first = new DocumentRegistry(config("registry-secret"), mapper);
        DocumentStore users = first.register("users.json", JsonNodeFactory.instance::arrayNode);
        DocumentStore ledger = first.register("ledger.json", JsonNodeFactory.instance::arrayNode);
        first.initAll();
        users.write(mapper.createArrayNode().add("alice"));
        ledger.write(mapper.createArrayNode().add(10));

        assertTrue(first.isEncrypted());
        assertTrue(EncryptionEnvelope.isEnvelope(mapper.readTree(users.path().toFile())));

        DocumentRegistry restarted = new DocumentRegistry(config("registry-secret"), mapper);
        assertEquals("alice", restarted.register("users.json", JsonNodeFactory.instance::arrayNode)
                .read().get(0).asText());
        assertEquals(10, restarted.register("ledger.json", JsonNodeFactory.instance::arrayNode)
                .read().get(0).asInt());
    }

    @Test
    void testRegisterTyped_ConvertsDefaultAndValues() throws Exception {
        DocumentRegistry registry = new DocumentRegistry(config(null), mapper);
        TypedDocumentStore<Map<String, Integer>> limits = registry.registerTyped("limits.json",
                new TypeReference<Map<String, Integer>>() { }, () -> Map.of("daily", 500));

        registry.initAll();
        assertEquals(Map.of("daily", 500), limits.read());

        limits.write(Map.of("daily", 750));
        JsonNode onDisk = mapper.readTree(tempDir.resolve("limits.json").toFile());
        assertEquals(750, onDisk.get("daily").asInt());
        assertSame(limits.untyped(), registry.get("limits.json"));
    }
}
