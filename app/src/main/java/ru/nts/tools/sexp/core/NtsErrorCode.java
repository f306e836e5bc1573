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

import java.util.Map;

/**
 * Structured error codes for the structural editor.
 * Each error has a human-readable message and a solution hint.
 *
 * <p>Example usage in tool output:
 * <pre>
 * [ERROR: FORM_AMBIGUOUS]
 * Message: Multiple forms match the selector
 * Solution: Add form_type or dispatch_value to pick one of: area :circle (line 4), area :square (line 9)
 * Context: path=/work/src/shapes.clj, stage=LOCATING
 * </pre>
 */
public enum NtsErrorCode {

    // ============ File Errors ============

    FILE_NOT_FOUND("File not found",
            "Check file path. The path must be absolute."),

    FILE_IS_BINARY("Binary file detected",
            "Cannot edit binary files as source text."),

    FILE_TOO_LARGE("File too large",
            "File has %size% bytes, the limit is %maxAllowed% bytes."),

    FILE_STALE("File modified since last read",
            "%reason% ACTION: nts_read_file(path='%path%') to observe the current content, then retry the edit."),

    // ============ Parameter Errors ============

    PARAM_MISSING("Required parameter missing",
            "Provide '%param%'. Check tool documentation."),

    PARAM_INVALID("Invalid parameter value",
            "Check '%param%': %reason%"),

    // ============ Syntax Errors ============

    SYNTAX_ERROR("Unparseable source text",
            "Fix the text near line %line%, column %column%: %detail%"),

    DELIMITER_ERROR("Unbalanced delimiters",
            "Check brackets near line %line%, column %column%: %detail%"),

    DELIMITER_UNREPAIRABLE("Unbalanced delimiters could not be repaired",
            "Auto-repair was attempted and declined: %reason%. " +
            "Original problem: %detail%. Balance the brackets manually and retry."),

    // ============ Locator Errors ============

    FORM_NOT_FOUND("No top-level form matches the selector",
            "Form '%selector%' not found in %path%. Available forms: %candidates%. " +
            "ACTION: nts_read_file(path='%path%') to see the collapsed view."),

    FORM_AMBIGUOUS("Multiple forms match the selector",
            "Add form_type, dispatch_value or platform to pick one of: %candidates%"),

    EXPRESSION_NOT_FOUND("Expression not found",
            "No expression structurally equal to match_form exists in %path%. " +
            "Whitespace is ignored, but every token and bracket type must match."),

    EXPRESSION_AMBIGUOUS("Multiple occurrences matched",
            "Found at %candidates%. Use replace_all=true or a larger match_form that is unique."),

    // ============ Edit Errors ============

    POST_EDIT_INCONSISTENCY("Edit produced invalid source",
            "Internal consistency check failed after the edit: %detail%. The file was NOT written."),

    // ============ System Errors ============

    IO_ERROR("I/O error occurred",
            "Check disk space and permissions. Try again."),

    INTERNAL_ERROR("Internal error",
            "Unexpected error. Check logs for details.");

    private final String message;
    private final String solution;

    NtsErrorCode(String message, String solution) {
        this.message = message;
        this.solution = solution;
    }

    public String getMessage() {
        return message;
    }

    public String getSolution() {
        return solution;
    }

    /**
     * Formats error message with optional context.
     *
     * @param context Optional context map (path, stage, candidates, etc.)
     * @return Formatted error string
     */
    public String format(Map<String, Object> context) {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("[ERROR: %s]\n", this.name()));
        sb.append(String.format("Message: %s\n", message));

        // Интерполяция %placeholder% в solution
        String resolvedSolution = solution;
        if (context != null) {
            for (Map.Entry<String, Object> entry : context.entrySet()) {
                resolvedSolution = resolvedSolution.replace(
                        "%" + entry.getKey() + "%", String.valueOf(entry.getValue()));
            }
        }
        // Очищаем неиспользованные плейсхолдеры
        resolvedSolution = resolvedSolution.replaceAll("%\\w+%", "...");
        sb.append(String.format("Solution: %s", resolvedSolution));

        if (context != null && !context.isEmpty()) {
            sb.append("\nContext: ");
            boolean first = true;
            for (Map.Entry<String, Object> entry : context.entrySet()) {
                if (!first) sb.append(", ");
                sb.append(entry.getKey()).append("=").append(entry.getValue());
                first = false;
            }
        }

        return sb.toString();
    }

    /**
     * Formats error message without context.
     *
     * @return Formatted error string
     */
    public String format() {
        return format(null);
    }
}
