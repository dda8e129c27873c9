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
import dev.mars.docstore.storage.ConcurrentWriteException;
import dev.mars.docstore.storage.DecryptionException;
import dev.mars.docstore.storage.DocumentStoreConfig;
import dev.mars.docstore.storage.EncryptionEnvelope;
import dev.mars.docstore.storage.EncryptionKey;
import dev.mars.docstore.storage.JsonDocumentStore;
import dev.mars.docstore.storage.LockMode;
import dev.mars.docstore.storage.RaceRecoveryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Base64;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

/**
 * Chaos testing for the JSON document store.
 * <p>
 * This class throws hostile scenarios at the store to verify its robustness:
 * <ul>
 *   <li>Concurrent writer storms from many store instances</li>
 *   <li>Readers racing writers</li>
 *   <li>Random corruption and truncation of the document</li>
 *   <li>Concatenated documents left by unlocked writers</li>
 *   <li>Tampered and foreign-key envelopes</li>
 * </ul>
 *
 * <h2>Usage</h2>
 * <pre>
 * # Build
 * mvn package -pl docstore-demo -am
 *
 * # Run all chaos tests
 * java -cp docstore-demo/target/docstore-demo-1.0-SNAPSHOT.jar:... dev.mars.docstore.demo.DocStoreChaos
 *
 * # Run specific group
 * java -cp ... dev.mars.docstore.demo.DocStoreChaos concurrent
 * java -cp ... dev.mars.docstore.demo.DocStoreChaos corruption
 * java -cp ... dev.mars.docstore.demo.DocStoreChaos encryption
 * </pre>
 *
 * @see JsonDocumentStore
 */
public class DocStoreChaos {

    private static final Logger LOG = LoggerFactory.getLogger(DocStoreChaos.class);

    private static final SecureRandom SECURE_RANDOM = new SecureRandom();
    private static final String DOC = "chaos.json";

    private final Path baseDir;
    private final ObjectMapper mapper = new ObjectMapper();
    private final AtomicInteger testsPassed = new AtomicInteger(0);
    private final AtomicInteger testsFailed = new AtomicInteger(0);

    public DocStoreChaos(Path baseDir) {
        this.baseDir = baseDir;
    }

    public static void main(String[] args) throws Exception {
        System.out.println("╔═══════════════════════════════════════════════════════════════╗");
        System.out.println("║             DOCUMENT STORE CHAOS TESTING SUITE                ║");
        System.out.println("╚═══════════════════════════════════════════════════════════════╝");
        System.out.println();

        Path chaosDir = Files.createTempDirectory("docstore-chaos-");
        System.out.println("Chaos directory: " + chaosDir.toAbsolutePath());
        System.out.println();

        DocStoreChaos chaos = new DocStoreChaos(chaosDir);

        String testFilter = args.length > 0 ? args[0].toLowerCase() : "all";

        try {
            switch (testFilter) {
                case "concurrent" -> chaos.runConcurrencyTests();
                case "corruption" -> chaos.runCorruptionTests();
                case "encryption" -> chaos.runEncryptionTests();
                case "all" -> {
                    chaos.runConcurrencyTests();
                    chaos.runCorruptionTests();
                    chaos.runEncryptionTests();
                }
                default -> {
                    System.err.println("Unknown test filter: " + testFilter);
                    System.err.println("Available: concurrent, corruption, encryption, all");
                    System.exit(1);
                }
            }
        } finally {
            System.out.println();
            System.out.println("╔═══════════════════════════════════════════════════════════════╗");
            System.out.printf("║  RESULTS: %d passed, %d failed                                 ║%n",
                    chaos.testsPassed.get(), chaos.testsFailed.get());
            System.out.println("╚═══════════════════════════════════════════════════════════════╝");

            deleteRecursively(chaosDir);
        }

        System.exit(chaos.testsFailed.get() > 0 ? 1 : 0);
    }

    // =========================================================================
    // CONCURRENCY CHAOS
    // =========================================================================

    private void runConcurrencyTests() {
        printSection("CONCURRENCY CHAOS");

        chaosTest("Writer Storm (16 stores × 50 writes)", this::writerStorm);
        chaosTest("Readers Racing Writers (8 + 8 threads)", this::readersRacingWriters);
        chaosTest("Encrypted Writer Storm (8 stores × 25 writes)", this::encryptedWriterStorm);
    }

    private void writerStorm() throws Exception {
        Path dir = createTestDir("writer-storm");
        DocumentStoreConfig config = baseConfig().raceRecoveryPolicy(RaceRecoveryPolicy.FAIL).build();
        runStorm(dir, config, null, 16, 50, 0);
    }

    private void readersRacingWriters() throws Exception {
        Path dir = createTestDir("readers-racing");
        DocumentStoreConfig config = baseConfig().raceRecoveryPolicy(RaceRecoveryPolicy.FAIL).build();
        runStorm(dir, config, null, 8, 40, 8);
    }

    private void encryptedWriterStorm() throws Exception {
        Path dir = createTestDir("encrypted-storm");
        DocumentStoreConfig config = baseConfig().raceRecoveryPolicy(RaceRecoveryPolicy.FAIL).build();
        runStorm(dir, config, EncryptionKey.deriveFrom("chaos-secret"), 8, 25, 4);
    }

    /**
     * Writers store self-describing documents; readers check that every value they see was
     * written whole by one writer.
     */
    private void runStorm(Path dir, DocumentStoreConfig config, EncryptionKey key,
                          int writers, int writesPerThread, int readers) throws Exception {
        new JsonDocumentStore(dir, DOC, JsonNodeFactory.instance::arrayNode, key, config, mapper).init();

        ExecutorService executor = Executors.newFixedThreadPool(writers + readers);
        CountDownLatch startLatch = new CountDownLatch(1);
        CountDownLatch doneLatch = new CountDownLatch(writers + readers);
        AtomicInteger errors = new AtomicInteger(0);
        AtomicInteger badReads = new AtomicInteger(0);

        for (int t = 0; t < writers; t++) {
            final int threadId = t;
            executor.submit(() -> {
                try {
                    JsonDocumentStore store = new JsonDocumentStore(dir, DOC,
                            JsonNodeFactory.instance::arrayNode, key, config, mapper);
                    startLatch.await();
                    for (int i = 0; i < writesPerThread; i++) {
                        store.write(stampedDocument(threadId, i));
                    }
                } catch (Exception e) {
                    LOG.error("Writer {} failed: {}", threadId, e.getMessage(), e);
                    errors.incrementAndGet();
                } finally {
                    doneLatch.countDown();
                }
            });
        }
        for (int r = 0; r < readers; r++) {
            executor.submit(() -> {
                try {
                    JsonDocumentStore store = new JsonDocumentStore(dir, DOC,
                            JsonNodeFactory.instance::arrayNode, key, config, mapper);
                    startLatch.await();
                    for (int i = 0; i < writesPerThread; i++) {
                        if (!isWhole(store.read())) {
                            badReads.incrementAndGet();
                        }
                    }
                } catch (Exception e) {
                    LOG.error("Reader failed: {}", e.getMessage(), e);
                    errors.incrementAndGet();
                } finally {
                    doneLatch.countDown();
                }
            });
        }

        startLatch.countDown();
        boolean finished = doneLatch.await(120, TimeUnit.SECONDS);
        executor.shutdownNow();

        if (!finished) {
            throw new AssertionError("Storm did not finish in time");
        }
        if (errors.get() > 0) {
            throw new AssertionError(errors.get() + " thread(s) failed");
        }
        if (badReads.get() > 0) {
            throw new AssertionError(badReads.get() + " read(s) saw a partial or mixed document");
        }
        JsonNode last = new JsonDocumentStore(dir, DOC, JsonNodeFactory.instance::arrayNode, key, config, mapper)
                .read();
        if (!isWhole(last) || last.size() == 0) {
            throw new AssertionError("Final document is not a complete write: " + last);
        }
        assertOnlyCanonicalFiles(dir);
    }

    private ArrayNode stampedDocument(int writer, int iteration) {
        ArrayNode doc = mapper.createArrayNode();
        for (int row = 0; row < 100; row++) {
            doc.addObject().put("w", writer).put("i", iteration).put("row", row);
        }
        return doc;
    }

    private static boolean isWhole(JsonNode doc) {
        if (!doc.isArray()) {
            return false;
        }
        if (doc.size() == 0) {
            return true;
        }
        if (doc.size() != 100) {
            return false;
        }
        int w = doc.get(0).path("w").asInt();
        int i = doc.get(0).path("i").asInt();
        for (int row = 0; row < doc.size(); row++) {
            JsonNode r = doc.get(row);
            if (r.path("w").asInt() != w || r.path("i").asInt() != i || r.path("row").asInt() != row) {
                return false;
            }
        }
        return true;
    }

    // =========================================================================
    // CORRUPTION CHAOS
    // =========================================================================

    private void runCorruptionTests() {
        printSection("CORRUPTION CHAOS");

        chaosTest("Random Garbage Replaces Document", this::randomGarbage);
        chaosTest("Truncated Document (torn copy)", this::truncatedDocument);
        chaosTest("Concatenated Arrays From Unlocked Writers", this::concatenatedArrays);
        chaosTest("Concatenated Values Under FAIL Policy", this::concatenatedUnderFailPolicy);
        chaosTest("Unlocked Mode Sequential Use", this::unlockedModeSequential);
    }

    private void randomGarbage() throws Exception {
        Path dir = createTestDir("garbage");
        JsonDocumentStore store = newStore(dir, baseConfig().build(), null);
        store.write(mapper.createArrayNode().add("precious"));

        byte[] garbage = new byte[256];
        SECURE_RANDOM.nextBytes(garbage);
        garbage[0] = '{';
        Files.write(dir.resolve(DOC), garbage);

        JsonNode value = store.read();
        if (!value.isArray() || value.size() != 0) {
            throw new AssertionError("Expected default after garbage, got " + value);
        }
        if (countQuarantined(dir) != 1) {
            throw new AssertionError("Garbage was not quarantined");
        }
        store.write(mapper.createArrayNode().add("fresh"));
        if (!"fresh".equals(store.read().get(0).asText())) {
            throw new AssertionError("Store unusable after quarantine");
        }
    }

    private void truncatedDocument() throws Exception {
        Path dir = createTestDir("truncated");
        JsonDocumentStore store = newStore(dir, baseConfig().build(), null);
        store.write(stampedDocument(1, 1));

        byte[] full = Files.readAllBytes(dir.resolve(DOC));
        Files.write(dir.resolve(DOC), Arrays.copyOf(full, full.length / 2));

        JsonNode value = store.read();
        if (value.size() != 0 || countQuarantined(dir) != 1) {
            throw new AssertionError("Truncated document not handled: " + value);
        }
    }

    private void concatenatedArrays() throws Exception {
        Path dir = createTestDir("concatenated");
        JsonDocumentStore store = newStore(dir, baseConfig().build(), null);
        Files.writeString(dir.resolve(DOC), "[{\"id\":1}]\n[{\"id\":2},{\"id\":3}]", StandardCharsets.UTF_8);

        JsonNode value = store.read();
        if (value.size() != 3) {
            throw new AssertionError("Expected 3 merged entries, got " + value);
        }
        JsonNode onDisk = mapper.readTree(dir.resolve(DOC).toFile());
        if (!onDisk.equals(value)) {
            throw new AssertionError("Merged document was not rewritten");
        }
    }

    private void concatenatedUnderFailPolicy() throws Exception {
        Path dir = createTestDir("fail-policy");
        JsonDocumentStore store = newStore(dir, baseConfig().raceRecoveryPolicy(RaceRecoveryPolicy.FAIL).build(), null);
        Files.writeString(dir.resolve(DOC), "[1][2]", StandardCharsets.UTF_8);

        try {
            store.read();
            throw new AssertionError("Expected ConcurrentWriteException");
        } catch (ConcurrentWriteException expected) {
            LOG.debug("FAIL policy raised as expected: {}", expected.getMessage());
        }
    }

    private void unlockedModeSequential() throws Exception {
        Path dir = createTestDir("unlocked");
        JsonDocumentStore store = newStore(dir, baseConfig().lockMode(LockMode.NONE).build(), null);
        for (int i = 0; i < 20; i++) {
            store.write(stampedDocument(0, i));
        }
        JsonNode value = store.read();
        if (!isWhole(value) || value.get(0).path("i").asInt() != 19) {
            throw new AssertionError("Unlocked store lost writes");
        }
        if (Files.exists(dir.resolve(DOC + ".lock"))) {
            throw new AssertionError("Unlocked store created a lock file");
        }
    }

    // =========================================================================
    // ENCRYPTION CHAOS
    // =========================================================================

    private void runEncryptionTests() {
        printSection("ENCRYPTION CHAOS");

        chaosTest("Bit Flips In Every Envelope Field", this::bitFlips);
        chaosTest("Foreign Key Opens Document", this::foreignKey);
        chaosTest("Foreign Key Under Strict Decryption", this::foreignKeyStrict);
        chaosTest("Legacy Plaintext Upgraded On Write", this::legacyPlaintextUpgrade);
    }

    private void bitFlips() throws Exception {
        EncryptionKey key = EncryptionKey.deriveFrom("bit-flip-secret");
        for (String field : new String[]{"iv", "tag", "payload"}) {
            Path dir = createTestDir("bitflip-" + field);
            JsonDocumentStore store = newStore(dir, baseConfig().build(), key);
            store.write(mapper.createArrayNode().add("balance:1000"));

            ObjectNode envelope = (ObjectNode) mapper.readTree(dir.resolve(DOC).toFile());
            byte[] bytes = Base64.getDecoder().decode(envelope.get(field).asText());
            bytes[SECURE_RANDOM.nextInt(bytes.length)] ^= (byte) (1 << SECURE_RANDOM.nextInt(8));
            envelope.put(field, Base64.getEncoder().encodeToString(bytes));
            Files.write(dir.resolve(DOC), mapper.writeValueAsBytes(envelope));

            JsonNode value = store.read();
            if (value.size() != 0) {
                throw new AssertionError("Tampered " + field + " was accepted: " + value);
            }
            if (countQuarantined(dir) != 1) {
                throw new AssertionError("Tampered " + field + " was not quarantined");
            }
        }
    }

    private void foreignKey() throws Exception {
        Path dir = createTestDir("foreign-key");
        newStore(dir, baseConfig().build(), EncryptionKey.deriveFrom("owner")).write(mapper.createArrayNode().add(1));

        JsonNode value = newStore(dir, baseConfig().build(), EncryptionKey.deriveFrom("intruder")).read();
        if (value.size() != 0 || countQuarantined(dir) != 1) {
            throw new AssertionError("Foreign key should yield default and quarantine");
        }
    }

    private void foreignKeyStrict() throws Exception {
        Path dir = createTestDir("foreign-key-strict");
        newStore(dir, baseConfig().build(), EncryptionKey.deriveFrom("owner")).write(mapper.createArrayNode().add(1));

        JsonDocumentStore strict = newStore(dir, baseConfig().strictDecryption(true).build(),
                EncryptionKey.deriveFrom("intruder"));
        try {
            strict.read();
            throw new AssertionError("Expected DecryptionException");
        } catch (DecryptionException expected) {
            LOG.debug("Strict decryption raised as expected: {}", expected.getMessage());
        }
        if (!Files.exists(dir.resolve(DOC))) {
            throw new AssertionError("Strict mode must leave the document in place");
        }
    }

    private void legacyPlaintextUpgrade() throws Exception {
        Path dir = createTestDir("legacy");
        Files.writeString(dir.resolve(DOC), "[\"legacy\"]", StandardCharsets.UTF_8);
        JsonDocumentStore store = newStore(dir, baseConfig().build(), EncryptionKey.deriveFrom("new-secret"));

        JsonNode value = store.read();
        store.write(value);

        if (!EncryptionEnvelope.isEnvelope(mapper.readTree(dir.resolve(DOC).toFile()))) {
            throw new AssertionError("Legacy document was not encrypted on write");
        }
        if (!"legacy".equals(store.read().get(0).asText())) {
            throw new AssertionError("Legacy value lost");
        }
    }

    // =========================================================================
    // UTILITIES
    // =========================================================================

    private static DocumentStoreConfig.Builder baseConfig() {
        return DocumentStoreConfig.builder()
                .encryptionSecret(null)
                .syncEnabled(false) // Speed up chaos runs
                .minFreeSpaceMb(0)
                .lockMode(LockMode.ADVISORY)
                .raceRecoveryPolicy(RaceRecoveryPolicy.MERGE)
                .strictDecryption(false);
    }

    private JsonDocumentStore newStore(Path dir, DocumentStoreConfig config, EncryptionKey key) {
        return new JsonDocumentStore(dir, DOC, JsonNodeFactory.instance::arrayNode, key, config, mapper);
    }

    private static long countQuarantined(Path dir) throws IOException {
        try (Stream<Path> files = Files.list(dir)) {
            return files.filter(p -> p.getFileName().toString().startsWith(DOC + ".corrupt.")).count();
        }
    }

    private static void assertOnlyCanonicalFiles(Path dir) throws IOException {
        try (Stream<Path> files = Files.list(dir)) {
            long strays = files.map(p -> p.getFileName().toString())
                    .filter(name -> !name.equals(DOC) && !name.equals(DOC + ".lock"))
                    .count();
            if (strays > 0) {
                throw new AssertionError(strays + " stray file(s) left in " + dir);
            }
        }
    }

    private void printSection(String name) {
        System.out.println();
        System.out.println("┌───────────────────────────────────────────────────────────────┐");
        System.out.printf("│  %-61s │%n", name);
        System.out.println("└───────────────────────────────────────────────────────────────┘");
    }

    private void chaosTest(String name, ChaosTestRunnable test) {
        System.out.printf("  %-50s ", name);
        try {
            test.run();
            System.out.println("[PASS]");
            testsPassed.incrementAndGet();
        } catch (Throwable e) {
            System.out.println("[FAIL]");
            System.err.println("    Error: " + e.getMessage());
            e.printStackTrace(System.err);
            testsFailed.incrementAndGet();
        }
    }

    private Path createTestDir(String name) throws IOException {
        Path dir = baseDir.resolve(name + "-" + System.nanoTime());
        Files.createDirectories(dir);
        return dir;
    }

    private static void deleteRecursively(Path path) {
        try {
            if (Files.isDirectory(path)) {
                try (Stream<Path> stream = Files.list(path)) {
                    stream.forEach(DocStoreChaos::deleteRecursively);
                }
            }
            Files.deleteIfExists(path);
        } catch (IOException e) {
            LOG.warn("Could not clean up {}: {}", path, e.getMessage());
        }
    }

    @FunctionalInterface
    interface ChaosTestRunnable {
        void run() throws Exception;
    }
}
