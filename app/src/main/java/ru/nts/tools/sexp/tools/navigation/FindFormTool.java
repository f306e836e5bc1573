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
import ru.nts.tools.sexp.SexpEditor;
import ru.nts.tools.sexp.core.McpTool;
import ru.nts.tools.sexp.core.NtsMatchException;
import ru.nts.tools.sexp.core.forms.FormSelector;
import ru.nts.tools.sexp.core.forms.TopLevelForm;
import ru.nts.tools.sexp.tools.ToolParams;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Поиск одной top-level формы по имени, виду, значению диспетчеризации и платформе.
 * Возвращает исходный текст формы вместе с комментариями над ней. Чтение файла не засчитывается.
 */
public class FindFormTool implements McpTool {

    private final ObjectMapper mapper = new ObjectMapper();

    private final SexpEditor editor;

    public FindFormTool(SexpEditor editor) {
        this.editor = editor;
    }

    @Override
    public String getName() {
        return "nts_find_form";
    }

    @Override
    public String getDescription() {
        return "Find one top-level definition by name and show its exact source. "
                + "Narrow with form_type ('defn', 'function definition'), dispatch_value (':circle') or platform ('clj'). "
                + "Fails with the candidate list when the selector is ambiguous or matches nothing.";
    }

    @Override
    public String getCategory() {
        return "navigation";
    }

    @Override
    public JsonNode getInputSchema() {
        var schema = mapper.createObjectNode();
        schema.put("type", "object");
        var props = schema.putObject("properties");

        props.putObject("path").put("type", "string").put("description", "Absolute file path.");
        props.putObject("form_name").put("type", "string")
                .put("description", "Definition name, bare or namespaced. 'area :circle' selects a defmethod by dispatch value.");
        props.putObject("form_type").put("type", "string")
                .put("description", "Head symbol ('defn', 'defmethod') or category ('value binding', 'function definition', 'multi-arity-dispatch implementation').");
        props.putObject("dispatch_value").put("type", "string").put("description", "Dispatch literal of a defmethod.");
        props.putObject("platform").put("type", "string").put("description", "Reader conditional branch: 'clj', 'cljs'...");

        schema.putArray("required").add("path").add("form_name");
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

        Optional<TopLevelForm> found = editor.findForm(path, selector);
        if (found.isEmpty()) {
            throw NtsMatchException.formNotFound(path, selector.toString(),
                    editor.listForms(path).stream().filter(TopLevelForm::isNamed).map(TopLevelForm::describe).toList());
        }
        TopLevelForm form = found.get();

        StringBuilder sb = new StringBuilder();
        sb.append("Found ").append(form.describe()).append(" in ").append(path).append('\n');
        sb.append("Kind: ").append(form.kind().label());
        if (form.privateForm()) {
            sb.append(" (private)");
        }
        sb.append("\n\n```clojure\n");
        if (!form.leadingComments().isEmpty()) {
            sb.append(form.leadingComments()).append('\n');
        }
        sb.append(form.node().toSource()).append("\n```");
        return ToolParams.textResponse(mapper, sb.toString());
    }
}
