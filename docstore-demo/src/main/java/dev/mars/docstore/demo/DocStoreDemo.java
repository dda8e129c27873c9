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
package dev.mars.docstore.demo;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.mars.docstore.storage.DocumentRegistry;
import dev.mars.docstore.storage.DocumentStore;
import dev.mars.docstore.storage.DocumentStoreConfig;

import java.time.Instant;

/**
 * Demo entry point for the JSON document store.
 * <p>
 * This demonstrates basic store operations:
 * <ul>
 *   <li>Registering named documents</li>
 *   <li>Creating them with defaults on first start</li>
 *   <li>Read-modify-write of a collection document</li>
 *   <li>Encryption at rest when a secret is configured</li>
 * </ul>
 *
 * <h2>Configuration</h2>
 * Configuration is handled by {@link DocumentStoreConfig} with the following priority:
 * <ol>
 *   <li>Command-line argument (data directory only)</li>
 *   <li>System properties: {@code -Ddocstore.dataDir=/path -Ddocstore.encryptionSecret=... }</li>
 *   <li>Environment variables: {@code DOCSTORE_DATA_DIR, DOCSTORE_ENCRYPTION_SECRET, ...}</li>
 *   <li>Properties file: {@code docstore.properties} on classpath or working directory</li>
 *   <li>Defaults</li>
 * </ol>
 *
 * <h2>Usage</h2>
 * <pre>
 * # Build the demo JAR
 * mvn package -pl docstore-demo -am
 *
 * # Run with default configuration (./server-data, no encryption)
 * java -jar docstore-demo/target/docstore-demo-1.0-SNAPSHOT.jar
 *
 * # Run with CLI data directory override
 * java -jar docstore-demo/target/docstore-demo-1.0-SNAPSHOT.jar /path/to/data
 *
 * # Run encrypted
 * DOCSTORE_ENCRYPTION_SECRET='change me' java -jar docstore-demo/target/docstore-demo-1.0-SNAPSHOT.jar
 * </pre>
 *
 * @see DocumentStoreConfig
 */
public class DocStoreDemo {

    public static void main(String[] args) {
        System.out.println("+---------------------------------------+");
        System.out.println("|        JSON Document Store Demo       |");
        System.out.println("+---------------------------------------+");
        System.out.println();

        // Build configuration with CLI override if provided
        DocumentStoreConfig config = args.length > 0 && !args[0].isBlank()
                ? DocumentStoreConfig.builder().dataDir(args[0]).build()
                : DocumentStoreConfig.load();

        System.out.println("Configuration: " + config);
        System.out.println();

        ObjectMapper mapper = new ObjectMapper();
        DocumentRegistry registry = new DocumentRegistry(config, mapper);
        DocumentStore users = registry.register("users.json", JsonNodeFactory.instance::arrayNode);
        DocumentStore settings = registry.register("settings.json", DocStoreDemo::defaultSettings);

        registry.initAll();
        System.out.println("[OK] Documents ready in: " + config.dataDir().toAbsolutePath());
        System.out.println("[OK] Encryption: " + (registry.isEncrypted() ? "enabled" : "disabled"));
        System.out.println("[OK] Cross-process locking: " + users.isCrossProcessSafe());

        // Bump the run counter in settings
        ObjectNode current = (ObjectNode) settings.read();
        int run = current.path("runs").asInt() + 1;
        current.put("runs", run);
        current.put("lastRun", Instant.now().toString());
        settings.write(current);
        System.out.println("[OK] Settings updated: run #" + run);

        // Append a user
        JsonNode existing = users.read();
        ArrayNode list = existing.isArray() ? (ArrayNode) existing : mapper.createArrayNode();
        System.out.println("[OK] Loaded " + list.size() + " existing user(s)");
        if (list.size() > 0) {
            System.out.println("\n  Last users:");
            int start = Math.max(0, list.size() - 3);
            for (int i = start; i < list.size(); i++) {
                JsonNode user = list.get(i);
                System.out.printf("    [%s] %s%n", user.path("id").asText(), user.path("name").asText());
            }
        }

        ObjectNode user = list.addObject();
        user.put("id", "user-" + run);
        user.put("name", "Demo User " + run);
        user.put("createdAt", Instant.now().toString());
        users.write(list);
        System.out.println("\n[OK] Added user-" + run + " (" + list.size() + " total)");

        System.out.println("\n+---------------------------------------+");
        System.out.println("|  Document store demo complete!        |");
        System.out.println("|  Run again to see the data persist.   |");
        System.out.println("+---------------------------------------+");
    }

    private static JsonNode defaultSettings() {
        ObjectNode settings = JsonNodeFactory.instance.objectNode();
        settings.put("runs", 0);
        settings.put("theme", "light");
        return settings;
    }
}
