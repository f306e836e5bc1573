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
import ru.nts.tools.sexp.core.forms.FormSelector;
import ru.nts.tools.sexp.tools.ToolParams;

import java.nio.file.Path;

/**
 * Замена top-level формы целиком или вставка кода перед/после неё.
 * Несбалансированные скобки в новом коде чинятся автоматически (с предупреждением в ответе).
 */
public class ReplaceFormTool implements McpTool {

    private final ObjectMapper mapper = new ObjectMapper();

    private final SexpEditor editor;

    public ReplaceFormTool(SexpEditor editor) {
        this.editor = editor;
    }

    @Override
    public String getName() {
        return "nts_edit_form";
    }

    @Override
    public String getDescription() {
        return "Replace a whole top-level definition, or insert code before/after it. "
                + "Select the form by form_name (+ form_type, dispatch_value, platform when ambiguous). "
                + "Empty content with operation=replace deletes the form. REQUIRED: nts_read_file first. "
                + "Returns a unified diff.";
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
        props.putObject("form_name").put("type", "string")
                .put("description", "Definition name. 'area :circle' selects a defmethod by dispatch value.");
        props.putObject("form_type").put("type", "string").put("description", "Head symbol or category, see nts_find_form.");
        props.putObject("dispatch_value").put("type", "string").put("description", "Dispatch literal of a defmethod.");
        props.putObject("platform").put("type", "string").put("description", "Reader conditional branch: 'clj', 'cljs'...");
        props.putObject("content").put("type", "string").put("description", "New code: one or more complete forms.");
        var op = props.putObject("operation");
        op.put("type", "string").put("description", "What to do with the form (default replace).");
        op.putArray("enum").add("replace").add("insert_before").add("insert_after");
        props.putObject("dry_run").put("type", "boolean").put("description", "Run everything and return the diff without writing.");

        schema.putArray("required").add("path").add("form_name").add("content");
        return schema;
    }

    @Override
    public JsonNode execute(JsonNode params) throws Exception {
        Path path = ToolParams.path(params);
        FormSelector selector = FormSelector.parse(
                ToolParams.requiredText(params, "form_name"),
                ToolParams.optionalText(params, "form_type"),
                ToolParams.optionalText(params, "dispatch_value"),
                ToolParams.optionalText(params, "platform"));
        String content = ToolParams.textAllowingEmpty(params, "content");
        EditOperation operation = EditOperation.parse(ToolParams.optionalText(params, "operation"));
        boolean dryRun = params.path("dry_run").asBoolean(false);

        EditResult result = editor.editForm(path, selector, operation, content, dryRun);
        String action = (operation == EditOperation.REPLACE ? "Replace " : operation.wireName() + " ") + selector;
        return ToolParams.textResponse(mapper, EditReport.format(action, result, dryRun));
    }
}
