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
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link RecoveryDecoder}.
 */
class RecoveryDecoderTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final RecoveryDecoder decoder = new RecoveryDecoder(mapper);

    private RecoveryDecoder.Decoded decode(String text) {
        return decoder.decode(text.getBytes(StandardCharsets.UTF_8));
    }

    private JsonNode json(String text) throws Exception {
        return mapper.readTree(text);
    }

    @Test
    void testDecode_SingleValue_NoExtraData() throws Exception {
        RecoveryDecoder.Decoded decoded = decode("{\"a\": [1, 2]}");

        assertEquals(json("{\"a\": [1, 2]}"), decoded.value());
        assertFalse(decoded.hadExtraData());
        assertEquals(1, decoded.valueCount());
    }

    @Test
    void testDecode_SurroundingWhitespace_Ignored() throws Exception {
        RecoveryDecoder.Decoded decoded = decode("\n\t  [1]  \n\n");

        assertEquals(json("[1]"), decoded.value());
        assertFalse(decoded.hadExtraData());
    }

    @ParameterizedTest
    @ValueSource(strings = {"42", "\"text\"", "true", "null"})
    void testDecode_ScalarTopLevel_Accepted(String text) throws Exception {
        assertEquals(json(text), decode(text).value());
    }

    @Test
    void testDecode_ArraysConcatenated_Extended() throws Exception {
        RecoveryDecoder.Decoded decoded = decode("[1,2][3][4,5]");

        assertEquals(json("[1,2,3,4,5]"), decoded.value());
        assertTrue(decoded.hadExtraData());
        assertEquals(3, decoded.valueCount());
    }

    @Test
    void testDecode_ObjectsConcatenated_LaterKeysOverwrite() throws Exception {
        RecoveryDecoder.Decoded decoded = decode("{\"a\":1,\"b\":2}{\"b\":3}");

        assertEquals(json("{\"a\":1,\"b\":3}"), decoded.value());
        assertTrue(decoded.hadExtraData());
    }

    @Test
    void testDecode_ArrayThenObjects_ObjectsAppended() throws Exception {
        assertEquals(json("[1,{\"x\":1},{\"y\":2}]"), decode("[1]{\"x\":1}{\"y\":2}").value());
    }

    @Test
    void testDecode_ObjectThenArray_MergeStops() throws Exception {
        RecoveryDecoder.Decoded decoded = decode("{\"a\":1}[1]{\"b\":2}");

        assertEquals(json("{\"a\":1}"), decoded.value());
        assertTrue(decoded.hadExtraData());
        assertEquals(3, decoded.valueCount());
    }

    @Test
    void testDecode_ScalarsConcatenated_FirstKept() throws Exception {
        assertEquals(json("1"), decode("1 2").value());
    }

    @Test
    void testDecode_NewlineSeparatedValues() throws Exception {
        assertEquals(json("[1,2]"), decode("[1]\n[2]\n").value());
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "   ", "\n\n", "{", "[1,", "{\"a\":}", "nope", "[1] junk", "[1]]"})
    void testDecode_Unparseable_ThrowsCorrupt(String text) {
        assertThrows(CorruptDocumentException.class, () -> decode(text));
    }

    @Test
    void testDecode_Utf8Content() throws Exception {
        RecoveryDecoder.Decoded decoded = decode("{\"name\":\"Zoë ✓\"}");

        assertEquals("Zoë ✓", decoded.value().get("name").asText());
    }

    @Test
    void testMerge_SingleValue_ReturnedUnchanged() throws Exception {
        JsonNode only = json("[1]");

        assertSame(only, RecoveryDecoder.merge(List.of(only)));
    }
}
