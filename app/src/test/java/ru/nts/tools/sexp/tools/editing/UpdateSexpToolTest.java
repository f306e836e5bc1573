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

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class UpdateSexpToolTest {

    private static final String COUNTER = "(defn step [x]\n  (let [y (inc x)]\n    (+ (inc x) y)))\n";

    private final ObjectMapper mapper = new ObjectMapper();

    @TempDir
    Path tempDir;

    private UpdateSexpTool tool;
    private Path file;

    @BeforeEach
    void setUp() throws Exception {
        SexpEditor editor = new SexpEditor(EditorConfig.defaults());
        tool = new UpdateSexpTool(editor);
        file = tempDir.resolve("counter.clj");
        Files.writeString(file, COUNTER);
        editor.readFile(file, 0, null);
    }

    private ObjectNode params(String match, String replacement) {
        ObjectNode params = mapper.createObjectNode();
        params.put("path", file.toString());
        params.put("match_form", match);
        params.put("new_form", replacement);
        return params;
    }

    private static String text(JsonNode response) {
        return response.get("content").get(0).get("text").asText();
    }

    @Test
    void testUniqueMatch() throws Exception {
        String text = text(tool.execute(params("(+ (inc x)\n   y)", "(* 2 y)")));

        assertTrue(text.startsWith("Update replace of (+ (inc x) y) applied to"), text);
        assertEquals("(defn step [x]\n  (let [y (inc x)]\n    (* 2 y)))\n", Files.readString(file));
    }

    @Test
    void testAmbiguousMatchListsLocations() throws Exception {
        JsonNode response = tool.executeWithFeedback(params("(inc x)", "(dec x)"));

        assertTrue(response.get("isError").asBoolean());
        String text = text(response);
        assertTrue(text.contains("EXPRESSION_AMBIGUOUS"), text);
        assertTrue(text.contains("Found at 2:11, 3:8"), text);
        assertEquals(COUNTER, Files.readString(file));
    }

    @Test
    void testReplaceAll() throws Exception {
        ObjectNode params = params("(inc x)", "(dec x)");
        params.put("replace_all", true);

        String text = text(tool.execute(params));

        assertTrue(text.contains("(2 location(s))"), text);
        assertTrue(text.contains("WARNING: Multiple occurrences matched; applied to 2 of them."));
        assertEquals(COUNTER.replace("(inc x)", "(dec x)"), Files.readString(file));
    }

    @Test
    void testInsertBefore() throws Exception {
        ObjectNode params = params("(+ (inc x) y)", "(println y)");
        params.put("operation", "insert-before");

        tool.execute(params);

        assertTrue(Files.readString(file).contains("\n    (println y)\n    (+ (inc x) y)))"));
    }

    @Test
    void testDeleteWithEmptyReplacement() throws Exception {
        tool.execute(params("y (inc x)", ""));
        assertEquals("(defn step [x]\n  (let []\n    (+ (inc x) y)))\n", Files.readString(file));
    }

    @Test
    void testNotFound() throws Exception {
        String text = text(tool.executeWithFeedback(params("(dec x)", "(inc x)")));
        assertTrue(text.contains("EXPRESSION_NOT_FOUND"), text);
    }

    @Test
    void testBrokenMatchForm() throws Exception {
        String text = text(tool.executeWithFeedback(params("(inc x", "(dec x)")));
        assertTrue(text.contains("DELIMITER_ERROR"), text);
        assertEquals(COUNTER, Files.readString(file));
    }

    @Test
    void testDryRunLeavesFile() throws Exception {
        ObjectNode params = params("(+ (inc x) y)", "(* 2 y)");
        params.put("dry_run", true);

        String text = text(tool.execute(params));

        assertTrue(text.startsWith("DRY RUN."), text);
        assertEquals(COUNTER, Files.readString(file));
    }
}
