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

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Map;

/**
 * Настройки редактора, которые ядро получает готовыми от вызывающего слоя.
 *
 * @param writeGuard    строгость защиты от записи в устаревшие файлы
 * @param formatting    прогонять ли результат правки через форматтер
 * @param maxLines      лимит строк для raw-чтения
 * @param maxLineLength длина строки, после которой raw-чтение обрезает её с "..."
 * @param maxFileSize   предохранитель от загрузки гигантских файлов (байты)
 * @param contextLines  строк контекста в unified diff
 */
public record EditorConfig(
        WriteGuardMode writeGuard,
        boolean formatting,
        int maxLines,
        int maxLineLength,
        long maxFileSize,
        int contextLines
) {

    public static final int DEFAULT_MAX_LINES = 2000;
    public static final int DEFAULT_MAX_LINE_LENGTH = 1000;
    public static final long DEFAULT_MAX_FILE_SIZE = 10 * 1024 * 1024;
    public static final int DEFAULT_CONTEXT_LINES = 3;

    public EditorConfig {
        if (writeGuard == null) {
            writeGuard = WriteGuardMode.FULL_READ;
        }
        if (maxLines <= 0) {
            throw NtsParamException.invalid("max-lines", maxLines, "must be positive");
        }
        if (maxLineLength <= 0) {
            throw NtsParamException.invalid("max-line-length", maxLineLength, "must be positive");
        }
        if (contextLines < 0) {
            throw NtsParamException.invalid("context-lines", contextLines, "must not be negative");
        }
    }

    public static EditorConfig defaults() {
        return new EditorConfig(WriteGuardMode.FULL_READ, true, DEFAULT_MAX_LINES, DEFAULT_MAX_LINE_LENGTH,
                DEFAULT_MAX_FILE_SIZE, DEFAULT_CONTEXT_LINES);
    }

    /**
     * Читает настройки из переменных окружения (NTS_SEXP_*). Неуказанные значения берутся по умолчанию.
     *
     * @param env обычно {@code System.getenv()}
     */
    public static EditorConfig fromEnvironment(Map<String, String> env) {
        EditorConfig base = defaults();
        WriteGuardMode guard = env.containsKey("NTS_SEXP_WRITE_GUARD")
                ? WriteGuardMode.fromConfigValue(env.get("NTS_SEXP_WRITE_GUARD"))
                : base.writeGuard();
        boolean formatting = env.containsKey("NTS_SEXP_FORMAT")
                ? Boolean.parseBoolean(env.get("NTS_SEXP_FORMAT").trim())
                : base.formatting();
        int maxLines = parseInt(env, "NTS_SEXP_MAX_LINES", base.maxLines());
        int maxLineLength = parseInt(env, "NTS_SEXP_MAX_LINE_LENGTH", base.maxLineLength());
        return new EditorConfig(guard, formatting, maxLines, maxLineLength, base.maxFileSize(), base.contextLines());
    }

    /**
     * Читает настройки из JSON-объекта. Ключи: write-file-guard ("full-read" | "partial-read" | false),
     * format, max-lines, max-line-length, context-lines.
     */
    public static EditorConfig fromJson(JsonNode node) {
        EditorConfig base = defaults();
        if (node == null || node.isNull() || node.isMissingNode()) {
            return base;
        }
        if (!node.isObject()) {
            throw NtsParamException.invalid("config", node.toString(), "must be a JSON object");
        }

        WriteGuardMode guard = base.writeGuard();
        JsonNode guardNode = node.get("write-file-guard");
        if (guardNode != null && !guardNode.isNull()) {
            if (guardNode.isBoolean()) {
                if (guardNode.asBoolean()) {
                    throw NtsParamException.invalid("write-file-guard", true,
                            "must be one of full-read, partial-read, false");
                }
                guard = WriteGuardMode.DISABLED;
            } else {
                guard = WriteGuardMode.fromConfigValue(guardNode.asText());
            }
        }

        return new EditorConfig(
                guard,
                node.path("format").asBoolean(base.formatting()),
                node.path("max-lines").asInt(base.maxLines()),
                node.path("max-line-length").asInt(base.maxLineLength()),
                node.path("max-file-size").asLong(base.maxFileSize()),
                node.path("context-lines").asInt(base.contextLines()));
    }

    public EditorConfig withWriteGuard(WriteGuardMode mode) {
        return new EditorConfig(mode, formatting, maxLines, maxLineLength, maxFileSize, contextLines);
    }

    public EditorConfig withFormatting(boolean enabled) {
        return new EditorConfig(writeGuard, enabled, maxLines, maxLineLength, maxFileSize, contextLines);
    }

    private static int parseInt(Map<String, String> env, String key, int fallback) {
        String raw = env.get(key);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw NtsParamException.invalid(key, raw, "must be an integer");
        }
    }
}
