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
package ru.nts.tools.sexp.tools.editing;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import ru.nts.tools.sexp.SexpEditor;
import ru.nts.tools.sexp.core.EditorConfig;
import ru.nts.tools.sexp.core.FileUtils;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Тесты инструмента правки top-level форм (ReplaceFormTool).
 */
class ReplaceFormToolTest {

    private static final String GREETER = String.join("\n",
            "(ns demo.greeter)",
            "",
            "(defn greet [n]",
            "  (str \"Hi \" n))",
            "",
            "(def default-name \"world\")",
            "");

    private final ObjectMapper mapper = new ObjectMapper();

    @TempDir
    Path tempDir;

    private SexpEditor editor;
    private ReplaceFormTool tool;
    private Path file;

    @BeforeEach
    void setUp() throws Exception {
        editor = new SexpEditor(EditorConfig.defaults());
        tool = new ReplaceFormTool(editor);
        file = tempDir.resolve("greeter.clj");
        Files.writeString(file, GREETER);
    }

    private ObjectNode params(String name, String content) {
        ObjectNode params = mapper.createObjectNode();
        params.put("path", file.toString());
        params.put("form_name", name);
        params.put("content", content);
        return params;
    }

    private static String text(JsonNode response) {
        return response.get("content").get(0).get("text").asText();
    }

    @Test
    void testReplaceAfterRead() throws Exception {
        editor.readFile(file, 0, null);

        String text = text(tool.execute(params("greet", "(defn greet [n]\n  (str \"Hello \" n))")));

        assertTrue(text.startsWith("Replace greet applied to " + file + " (1 location(s))"), text);
        assertTrue(text.contains("New CRC32C: " + Long.toHexString(FileUtils.calculateCRC32(file)).toUpperCase()));
        assertTrue(text.contains("```diff\n--- a/greeter.clj\n+++ b/greeter.clj"), text);
        assertTrue(Files.readString(file).contains("\"Hello \""));
    }

    @Test
    void testEditWithoutReadIsBlocked() throws Exception {
        JsonNode response = tool.executeWithFeedback(params("greet", "(defn greet [n] n)"));

        assertTrue(response.get("isError").asBoolean());
        assertTrue(text(response).contains("FILE_STALE"), text(response));
        assertEquals(GREETER, Files.readString(file));
    }

    @Test
    void testDryRun() throws Exception {
        editor.readFile(file, 0, null);
        ObjectNode params = params("default-name", "(def default-name \"everyone\")");
        params.put("dry_run", true);

        String text = text(tool.execute(params));

        assertTrue(text.startsWith("DRY RUN. Replace default-name would change"), text);
        assertTrue(text.contains("File NOT written."));
        assertTrue(text.contains("+(def default-name \"everyone\")"));
        assertEquals(GREETER, Files.readString(file));
    }

    @Test
    void testInsertAfter() throws Exception {
        editor.readFile(file, 0, null);
        ObjectNode params = params("greet", "(defn farewell [n]\n  (str \"Bye \" n))");
        params.put("operation", "insert_after");

        String text = text(tool.execute(params));

        assertTrue(text.startsWith("insert_after greet applied"), text);
        assertTrue(Files.readString(file).contains("(str \"Hi \" n))\n\n(defn farewell [n]\n  (str \"Bye \" n))\n\n(def default-name"));
    }

    @Test
    void testEmptyContentDeletesForm() throws Exception {
        editor.readFile(file, 0, null);

        tool.execute(params("default-name", ""));

        assertEquals("(ns demo.greeter)\n\n(defn greet [n]\n  (str \"Hi \" n))\n", Files.readString(file));
    }

    @Test
    void testRepairWarningIsReported() throws Exception {
        editor.readFile(file, 0, null);

        String text = text(tool.execute(params("greet", "(defn greet [n]\n  (str \"Hello \" n)")));

        assertTrue(text.contains("WARNING: Repaired unbalanced delimiters in new content: inserted 1 closing delimiter(s)."), text);
        assertTrue(Files.readString(file).contains("(str \"Hello \" n))\n"));
    }

    @Test
    void testUnchangedContent() throws Exception {
        editor.readFile(file, 0, null);

        String text = text(tool.execute(params("default-name", "(def default-name \"world\")")));

        assertTrue(text.contains("no changes, file left as is"), text);
        assertFalse(text.contains("```diff"));
    }

    @Test
    void testParameterErrors() throws Exception {
        editor.readFile(file, 0, null);

        ObjectNode noContent = mapper.createObjectNode();
        noContent.put("path", file.toString());
        noContent.put("form_name", "greet");
        assertTrue(text(tool.executeWithFeedback(noContent)).contains("PARAM_MISSING"));

        ObjectNode badOperation = params("greet", "(defn greet [] 1)");
        badOperation.put("operation", "swap");
        String text = text(tool.executeWithFeedback(badOperation));
        assertTrue(text.contains("PARAM_INVALID"), text);
        assertEquals(GREETER, Files.readString(file));
    }
}
