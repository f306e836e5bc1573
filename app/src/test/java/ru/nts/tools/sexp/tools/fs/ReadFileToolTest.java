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
package ru.nts.tools.sexp.tools.fs;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import ru.nts.tools.sexp.SexpEditor;
import ru.nts.tools.sexp.core.EditorConfig;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Тесты инструмента чтения (ReadFileTool).
 */
class ReadFileToolTest {

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
    private ReadFileTool tool;
    private Path file;

    @BeforeEach
    void setUp() throws Exception {
        editor = new SexpEditor(EditorConfig.defaults());
        tool = new ReadFileTool(editor);
        file = tempDir.resolve("greeter.clj");
        Files.writeString(file, GREETER);
    }

    private ObjectNode params(Path path) {
        ObjectNode params = mapper.createObjectNode();
        params.put("path", path.toString());
        return params;
    }

    private static String text(JsonNode response) {
        return response.get("content").get(0).get("text").asText();
    }

    // ==================== Свёрнутый вид ====================

    @Test
    void testCollapsedByDefault() throws Exception {
        String text = text(tool.execute(params(file)));

        assertTrue(text.startsWith("# COLLAPSED VIEW " + file), text);
        assertTrue(text.contains("Forms: 3"));
        assertTrue(text.contains("```clojure\n(ns demo.greeter ...)\n\n(defn greet [n] ...)\n\n(def default-name ...)\n```"), text);
    }

    @Test
    void testNamePatternExpandsForm() throws Exception {
        ObjectNode params = params(file);
        params.put("name_pattern", "^gr.*t$");

        String text = text(tool.execute(params));

        assertTrue(text.contains("Matching name_pattern: \"^gr.*t$\" (1 matched, 1 expanded, 2 collapsed of 3)"), text);
        assertTrue(text.contains("(defn greet [n]\n  (str \"Hi \" n))"));
    }

    @Test
    void testBothPatternsDescribed() throws Exception {
        ObjectNode params = params(file);
        params.put("name_pattern", "nothing");
        params.put("content_pattern", "world");

        String text = text(tool.execute(params));

        assertTrue(text.contains("name_pattern: \"nothing\" and content_pattern: \"world\" (1 matched"), text);
    }

    @Test
    void testTextFileWithPattern() throws Exception {
        Path notes = tempDir.resolve("notes.md");
        Files.writeString(notes, "alpha\nbeta\ngamma\n");
        ObjectNode params = params(notes);
        params.put("content_pattern", "beta");

        String text = text(tool.execute(params));

        assertTrue(text.startsWith("# COLLAPSED VIEW: " + notes), text);
        assertTrue(text.contains("Found 1 matches in 3 lines, showing 1 block(s)"));
        assertTrue(text.contains("   2 > beta"));
    }

    @Test
    void testTextFileWithoutPatternIsRaw() throws Exception {
        Path notes = tempDir.resolve("notes.md");
        Files.writeString(notes, "alpha\nbeta\n");

        String text = text(tool.execute(params(notes)));

        assertTrue(text.startsWith("### "), text);
        assertTrue(text.contains("```md\nalpha\nbeta\n```"));
    }

    // ==================== Raw ====================

    @Test
    void testRawRead() throws Exception {
        ObjectNode params = params(file);
        params.put("collapsed", false);
        params.put("offset", 2);
        params.put("limit", 2);

        String text = text(tool.execute(params));

        assertTrue(text.contains("LINES: 3-4 of 6]"), text);
        assertTrue(text.contains("File truncated (showing 2 of 6 lines). Use offset to continue."));
        assertTrue(text.contains("```clj\n(defn greet [n]\n  (str \"Hi \" n))\n```"));
    }

    @Test
    void testOnlyRawReadCountsForEditing() throws Exception {
        tool.execute(params(file));
        assertTrue(editor.getGuard().check(file).blocked(), "Свёрнутый вид не засчитывается в режиме full-read");

        ObjectNode raw = params(file);
        raw.put("collapsed", false);
        tool.execute(raw);
        assertTrue(editor.getGuard().check(file).allowed());
    }

    // ==================== Ошибки ====================

    @Test
    void testMissingFileIsReportedAsError() {
        JsonNode response = tool.executeWithFeedback(params(tempDir.resolve("missing.clj")));

        assertTrue(response.get("isError").asBoolean());
        assertTrue(text(response).contains("FILE_NOT_FOUND"));
    }

    @Test
    void testUnbalancedSourceIsReportedAsError() throws Exception {
        Path broken = tempDir.resolve("broken.clj");
        Files.writeString(broken, "(defn f [x]\n  (inc x)\n");

        JsonNode response = tool.executeWithFeedback(params(broken));

        assertTrue(response.get("isError").asBoolean());
        assertTrue(text(response).contains("DELIMITER_ERROR"), text(response));
    }

    @Test
    void testRelativePathIsRejected() {
        ObjectNode params = mapper.createObjectNode();
        params.put("path", "greeter.clj");

        JsonNode response = tool.executeWithFeedback(params);

        assertTrue(text(response).contains("PARAM_INVALID"));
    }

    @Test
    void testBadRegexIsRejected() {
        ObjectNode params = params(file);
        params.put("name_pattern", "(unclosed");

        JsonNode response = tool.executeWithFeedback(params);

        assertTrue(response.get("isError").asBoolean());
        assertTrue(text(response).contains("invalid regex"));
    }
}
