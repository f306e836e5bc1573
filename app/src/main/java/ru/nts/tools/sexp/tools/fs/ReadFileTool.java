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
import ru.nts.tools.sexp.FileRead;
import ru.nts.tools.sexp.SexpEditor;
import ru.nts.tools.sexp.core.McpTool;
import ru.nts.tools.sexp.core.view.CollapsedView;
import ru.nts.tools.sexp.core.view.FileKind;
import ru.nts.tools.sexp.core.view.TextCollapsedView;
import ru.nts.tools.sexp.core.view.ViewStats;
import ru.nts.tools.sexp.tools.ToolParams;

import java.nio.file.Path;

/**
 * Чтение файла в одном из трёх режимов:
 * 1. Свёрнутый вид исходника (по умолчанию для .clj/.cljs/.cljc/.bb/.lpy): сигнатуры, совпавшие формы целиком.
 * 2. Свёрнутый вид текста: строки, совпавшие с шаблоном, с 10 строками контекста.
 * 3. Raw: строки с offset, не больше limit.
 *
 * Raw-чтение всегда засчитывается как наблюдение файла для последующей правки;
 * свёрнутые виды только в режиме partial-read.
 */
public class ReadFileTool implements McpTool {

    private final ObjectMapper mapper = new ObjectMapper();

    private final SexpEditor editor;

    public ReadFileTool(SexpEditor editor) {
        this.editor = editor;
    }

    @Override
    public String getName() {
        return "nts_read_file";
    }

    @Override
    public String getDescription() {
        return "Smart reader for Clojure files. Default is a collapsed view: definition signatures only; "
                + "forms matching 'name_pattern' (e.g. 'validate.*', 'area :circle') or 'content_pattern' (e.g. 'try|catch') "
                + "are expanded in full. For other text files 'content_pattern' shows matching lines with context. "
                + "Set collapsed=false for raw lines (offset/limit). A raw read is REQUIRED before editing.";
    }

    @Override
    public String getCategory() {
        return "fs";
    }

    @Override
    public JsonNode getInputSchema() {
        var schema = mapper.createObjectNode();
        schema.put("type", "object");
        var props = schema.putObject("properties");

        props.putObject("path").put("type", "string").put("description", "Absolute file path.");
        props.putObject("collapsed").put("type", "boolean").put("description", "Collapsed view (default true).");
        props.putObject("name_pattern").put("type", "string")
                .put("description", "Regex over definition names. defmethod names include the dispatch value: 'area :rectangle'.");
        props.putObject("content_pattern").put("type", "string")
                .put("description", "Regex over the full text of a form (or over lines of a non-Clojure file).");
        props.putObject("offset").put("type", "integer").put("minimum", 0)
                .put("description", "Raw mode only: first line, 0-based (default 0).");
        props.putObject("limit").put("type", "integer").put("minimum", 1)
                .put("description", "Raw mode only: maximum lines (default " + editor.getConfig().maxLines() + ").");

        schema.putArray("required").add("path");
        return schema;
    }

    @Override
    public JsonNode execute(JsonNode params) throws Exception {
        Path path = ToolParams.path(params);
        boolean collapsed = params.path("collapsed").asBoolean(true);
        String namePattern = ToolParams.optionalText(params, "name_pattern");
        String contentPattern = ToolParams.optionalText(params, "content_pattern");

        if (collapsed && FileKind.of(path) == FileKind.LISP_SOURCE) {
            CollapsedView view = editor.renderCollapsed(path, namePattern, contentPattern);
            return ToolParams.textResponse(mapper, formatCollapsed(path, view));
        }
        String textPattern = contentPattern != null ? contentPattern : namePattern;
        if (collapsed && textPattern != null) {
            TextCollapsedView.Result result = editor.renderTextCollapsed(path, textPattern);
            return ToolParams.textResponse(mapper, formatTextCollapsed(path, textPattern, result));
        }

        int offset = params.path("offset").asInt(0);
        Integer limit = params.hasNonNull("limit") ? params.get("limit").asInt() : null;
        FileRead read = editor.readFile(path, offset, limit);
        return ToolParams.textResponse(mapper, formatRaw(read));
    }

    private String formatCollapsed(Path path, CollapsedView view) {
        ViewStats stats = view.stats();
        StringBuilder sb = new StringBuilder();
        sb.append("# COLLAPSED VIEW ").append(path).append('\n');
        sb.append("Set `collapsed: false` to view the entire file\n");
        if (stats.hasPatterns()) {
            sb.append("Matching ").append(describePatterns(stats))
                    .append(" (").append(stats.matchCount()).append(" matched, ")
                    .append(stats.expandedForms()).append(" expanded, ")
                    .append(stats.collapsedForms()).append(" collapsed of ")
                    .append(stats.totalForms()).append(")\n");
        } else {
            sb.append("Forms: ").append(stats.totalForms()).append('\n');
        }
        sb.append("\n```clojure\n").append(view.text()).append("\n```");
        return sb.toString();
    }

    private static String describePatterns(ViewStats stats) {
        if (stats.namePattern() != null && stats.contentPattern() != null) {
            return "name_pattern: \"" + stats.namePattern() + "\" and content_pattern: \"" + stats.contentPattern() + "\"";
        }
        if (stats.namePattern() != null) {
            return "name_pattern: \"" + stats.namePattern() + "\"";
        }
        return "content_pattern: \"" + stats.contentPattern() + "\"";
    }

    private String formatTextCollapsed(Path path, String pattern, TextCollapsedView.Result result) {
        StringBuilder sb = new StringBuilder();
        sb.append("# COLLAPSED VIEW: ").append(path).append('\n');
        sb.append("Pattern: \"").append(pattern).append("\"\n");
        sb.append("Found ").append(result.matchCount()).append(" matches in ").append(result.totalLines()).append(" lines");
        if (result.blockCount() > 0) {
            sb.append(", showing ").append(result.blockCount()).append(" block(s)");
        }
        sb.append("\n\n```\n").append(result.text()).append("\n```");
        return sb.toString();
    }

    private String formatRaw(FileRead read) {
        StringBuilder sb = new StringBuilder();
        sb.append("### ").append(read.path()).append('\n');
        sb.append("[SIZE: ").append(read.size()).append(" bytes | LINES: ")
                .append(read.offset() + 1).append('-').append(read.offset() + read.lineCount())
                .append(" of ").append(read.totalLines()).append("]\n");
        if (read.truncated()) {
            sb.append("File truncated (showing ").append(read.lineCount()).append(" of ")
                    .append(read.totalLines()).append(" lines). Use offset to continue.\n");
        }
        if (read.linesTruncated()) {
            sb.append("Long lines truncated to ").append(editor.getConfig().maxLineLength()).append(" characters.\n");
        }
        String name = read.path().getFileName().toString();
        int dot = name.lastIndexOf('.');
        String lang = dot < 0 ? "" : name.substring(dot + 1);
        sb.append("\n```").append(lang).append('\n').append(read.content()).append("\n```");
        return sb.toString();
    }
}
