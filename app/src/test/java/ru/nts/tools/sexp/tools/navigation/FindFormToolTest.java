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
package ru.nts.tools.sexp.tools.navigation;

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

class FindFormToolTest {

    private static final String SHAPES = String.join("\n",
            "(ns shapes.core)",
            "",
            "(defmethod area :circle [{:keys [r]}] (* Math/PI r r))",
            "(defmethod area :square [{:keys [a]}] (* a a))",
            "",
            ";; Внутренний помощник",
            "(defn- helper [x] x)",
            "",
            "#?(:clj  (def platform \"jvm\")",
            "   :cljs (def platform \"js\"))",
            "");

    private final ObjectMapper mapper = new ObjectMapper();

    @TempDir
    Path tempDir;

    private FindFormTool tool;
    private Path file;

    @BeforeEach
    void setUp() throws Exception {
        tool = new FindFormTool(new SexpEditor(EditorConfig.defaults()));
        file = tempDir.resolve("shapes.cljc");
        Files.writeString(file, SHAPES);
    }

    private ObjectNode params(String name) {
        ObjectNode params = mapper.createObjectNode();
        params.put("path", file.toString());
        params.put("form_name", name);
        return params;
    }

    private static String text(JsonNode response) {
        return response.get("content").get(0).get("text").asText();
    }

    @Test
    void testFindWithLeadingComment() throws Exception {
        String text = text(tool.execute(params("helper")));

        assertTrue(text.startsWith("Found defn- helper (line 7) in " + file), text);
        assertTrue(text.contains("Kind: function definition (private)"));
        assertTrue(text.contains("```clojure\n;; Внутренний помощник\n(defn- helper [x] x)\n```"));
    }

    @Test
    void testDispatchValueInName() throws Exception {
        String text = text(tool.execute(params("area :square")));

        assertTrue(text.contains("defmethod area :square (line 4)"), text);
        assertTrue(text.contains("Kind: multi-arity-dispatch implementation"));
        assertTrue(text.contains("(* a a)"));
    }

    @Test
    void testDispatchValueParameter() throws Exception {
        ObjectNode params = params("area");
        params.put("dispatch_value", ":circle");

        assertTrue(text(tool.execute(params)).contains("(* Math/PI r r)"));
    }

    @Test
    void testPlatformParameter() throws Exception {
        ObjectNode params = params("platform");
        params.put("platform", "cljs");

        String text = text(tool.execute(params));

        assertTrue(text.contains("def platform [cljs] (line 10)"), text);
        assertTrue(text.contains("(def platform \"js\")"));
    }

    @Test
    void testAmbiguousSelector() {
        JsonNode response = tool.executeWithFeedback(params("area"));

        assertTrue(response.get("isError").asBoolean());
        String text = text(response);
        assertTrue(text.contains("FORM_AMBIGUOUS"), text);
        assertTrue(text.contains("defmethod area :circle (line 3), defmethod area :square (line 4)"), text);
    }

    @Test
    void testNotFoundListsAvailableForms() {
        JsonNode response = tool.executeWithFeedback(params("perimeter"));

        String text = text(response);
        assertTrue(text.contains("FORM_NOT_FOUND"), text);
        assertTrue(text.contains("defn- helper (line 7)"), text);
    }

    @Test
    void testWrongFormType() {
        ObjectNode params = params("helper");
        params.put("form_type", "value binding");

        assertTrue(text(tool.executeWithFeedback(params)).contains("FORM_NOT_FOUND"));
    }

    @Test
    void testFormNameRequired() {
        ObjectNode params = mapper.createObjectNode();
        params.put("path", file.toString());

        assertTrue(text(tool.executeWithFeedback(params)).contains("PARAM_MISSING"));
    }
}
