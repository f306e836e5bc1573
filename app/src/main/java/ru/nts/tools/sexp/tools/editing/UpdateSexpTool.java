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
import ru.nts.tools.sexp.SexpEditor;
import ru.nts.tools.sexp.core.McpTool;
import ru.nts.tools.sexp.core.edit.EditResult;
import ru.nts.tools.sexp.core.forms.EditOperation;
import ru.nts.tools.sexp.tools.ToolParams;

import java.nio.file.Path;

/**
 * Правка выражений внутри файла по структурному совпадению.
 * Пробелы и переносы в match_form не важны: "(+ x\n   1)" находит "(+ x 1)".
 */
public class UpdateSexpTool implements McpTool {

    private final ObjectMapper mapper = new ObjectMapper();

    private final SexpEditor editor;

    public UpdateSexpTool(SexpEditor editor) {
        this.editor = editor;
    }

    @Override
    public String getName() {
        return "nts_update_sexp";
    }

    @Override
    public String getDescription() {
        return "Replace, or insert before/after, an expression found by structural match (whitespace-insensitive). "
                + "match_form may be several sibling expressions. Fails if the match is not unique unless replace_all=true. "
                + "Empty new_form with operation=replace deletes the match. REQUIRED: nts_read_file first.";
    }

    @Override
    public String getCategory() {
        return "editing";
    }

    @Override
    public JsonNode getInputSchema() {
        var schema = mapper.createObjectNode();
        schema.put("type", "object");
        var props = schema.putObject("properties");

        props.putObject("path").put("type", "string").put("description", "Absolute file path.");
        props.putObject("match_form").put("type", "string")
                .put("description", "Complete expression(s) to find, e.g. '(+ x 1)'.");
        props.putObject("new_form").put("type", "string").put("description", "Replacement or inserted code.");
        var op = props.putObject("operation");
        op.put("type", "string").put("description", "Default replace.");
        op.putArray("enum").add("replace").add("insert_before").add("insert_after");
        props.putObject("replace_all").put("type", "boolean").put("description", "Apply to every occurrence (default false).");
        props.putObject("dry_run").put("type", "boolean").put("description", "Run everything and return the diff without writing.");

        schema.putArray("required").add("path").add("match_form").add("new_form");
        return schema;
    }

    @Override
    public JsonNode execute(JsonNode params) throws Exception {
        Path path = ToolParams.path(params);
        String matchForm = ToolParams.requiredText(params, "match_form");
        String newForm = ToolParams.textAllowingEmpty(params, "new_form");
        EditOperation operation = EditOperation.parse(ToolParams.optionalText(params, "operation"));
        boolean replaceAll = params.path("replace_all").asBoolean(false);
        boolean dryRun = params.path("dry_run").asBoolean(false);

        EditResult result = editor.replaceExpression(path, matchForm, newForm, operation, replaceAll, dryRun);
        return ToolParams.textResponse(mapper,
                EditReport.format("Update " + operation.wireName() + " of " + oneLine(matchForm), result, dryRun));
    }

    private static String oneLine(String text) {
        String flat = text.strip().replaceAll("\\s+", " ");
        return flat.length() > 60 ? flat.substring(0, 60) + "..." : flat;
    }
}
