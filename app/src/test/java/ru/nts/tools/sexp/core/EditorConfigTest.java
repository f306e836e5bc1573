/*
 * Copyright 2025 Aristo
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
package ru.nts.tools.sexp.core;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Тесты настроек редактора: значения по умолчанию, окружение, JSON.
 */
class EditorConfigTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void testDefaults() {
        EditorConfig config = EditorConfig.defaults();
        assertEquals(WriteGuardMode.FULL_READ, config.writeGuard());
        assertTrue(config.formatting());
        assertEquals(2000, config.maxLines());
        assertEquals(1000, config.maxLineLength());
        assertEquals(3, config.contextLines());
    }

    @Test
    void testFromEnvironment() {
        EditorConfig config = EditorConfig.fromEnvironment(Map.of(
                "NTS_SEXP_WRITE_GUARD", "partial-read",
                "NTS_SEXP_FORMAT", "false",
                "NTS_SEXP_MAX_LINES", " 500 "));
        assertEquals(WriteGuardMode.PARTIAL_READ, config.writeGuard());
        assertFalse(config.formatting());
        assertEquals(500, config.maxLines());
        assertEquals(EditorConfig.DEFAULT_MAX_LINE_LENGTH, config.maxLineLength());
    }

    @Test
    void testFromEnvironment_EmptyIsDefaults() {
        assertEquals(EditorConfig.defaults(), EditorConfig.fromEnvironment(Map.of()));
    }

    @Test
    void testFromEnvironment_BadNumber() {
        NtsParamException e = assertThrows(NtsParamException.class,
                () -> EditorConfig.fromEnvironment(Map.of("NTS_SEXP_MAX_LINES", "many")));
        assertEquals("NTS_SEXP_MAX_LINES", e.getContext().get("param"));
    }

    @Test
    void testFromJson() throws Exception {
        EditorConfig config = EditorConfig.fromJson(mapper.readTree(
                "{\"write-file-guard\": false, \"format\": false, \"max-lines\": 10, \"context-lines\": 0}"));
        assertEquals(WriteGuardMode.DISABLED, config.writeGuard());
        assertFalse(config.formatting());
        assertEquals(10, config.maxLines());
        assertEquals(0, config.contextLines());
    }

    @Test
    void testFromJson_MissingNodeIsDefaults() {
        assertEquals(EditorConfig.defaults(), EditorConfig.fromJson(null));
        assertEquals(EditorConfig.defaults(), EditorConfig.fromJson(mapper.createObjectNode()));
    }

    @Test
    void testFromJson_Rejected() throws Exception {
        assertThrows(NtsParamException.class, () -> EditorConfig.fromJson(mapper.readTree("{\"write-file-guard\": true}")));
        assertThrows(NtsParamException.class, () -> EditorConfig.fromJson(mapper.readTree("[1]")));
        assertThrows(NtsParamException.class, () -> EditorConfig.fromJson(mapper.readTree("{\"max-lines\": 0}")));
    }

    @ParameterizedTest
    @CsvSource({
            "full-read, FULL_READ",
            "FULL_READ, FULL_READ",
            ":partial-read, PARTIAL_READ",
            "false, DISABLED",
            "off, DISABLED"
    })
    void testWriteGuardModeValues(String value, WriteGuardMode expected) {
        assertEquals(expected, WriteGuardMode.fromConfigValue(value));
    }

    @Test
    void testWriteGuardModeUnknownValue() {
        NtsParamException e = assertThrows(NtsParamException.class, () -> WriteGuardMode.fromConfigValue("sometimes"));
        assertEquals(NtsErrorCode.PARAM_INVALID, e.getCode());
        assertEquals(WriteGuardMode.FULL_READ, WriteGuardMode.fromConfigValue(" "));
    }

    @Test
    void testWithers() {
        EditorConfig config = EditorConfig.defaults().withWriteGuard(WriteGuardMode.DISABLED).withFormatting(false);
        assertEquals(WriteGuardMode.DISABLED, config.writeGuard());
        assertFalse(config.formatting());
        assertEquals(EditorConfig.DEFAULT_MAX_LINES, config.maxLines());
    }
}
