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
package ru.nts.tools.sexp.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import ru.nts.tools.sexp.core.NtsParamException;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;

/**
 * Разбор аргументов инструментов и сборка текстовых ответов.
 */
public final class ToolParams {

    private ToolParams() {
    }

    /**
     * Абсолютный путь из параметра "path". Проверка доступа к пути выполняется выше.
     */
    public static Path path(JsonNode params) {
        String raw = requiredText(params, "path");
        Path path;
        try {
            path = Path.of(raw);
        } catch (InvalidPathException e) {
            throw NtsParamException.invalid("path", raw, e.getReason());
        }
        if (!path.isAbsolute()) {
            throw NtsParamException.invalid("path", raw, "absolute path required");
        }
        return path.normalize();
    }

    public static String requiredText(JsonNode params, String key) {
        JsonNode node = params.get(key);
        if (node == null || node.isNull() || node.asText().isBlank()) {
            throw NtsParamException.missing(key);
        }
        return node.asText();
    }

    /**
     * Значение строкового параметра; null, если параметра нет или он пустой.
     */
    public static String optionalText(JsonNode params, String key) {
        JsonNode node = params.get(key);
        if (node == null || node.isNull() || node.asText().isEmpty()) {
            return null;
        }
        return node.asText();
    }

    /**
     * Строковый параметр, где пустая строка имеет смысл (например, пустая замена удаляет код).
     */
    public static String textAllowingEmpty(JsonNode params, String key) {
        JsonNode node = params.get(key);
        if (node == null || node.isNull()) {
            throw NtsParamException.missing(key);
        }
        return node.asText();
    }

    public static JsonNode textResponse(ObjectMapper mapper, String text) {
        ObjectNode res = mapper.createObjectNode();
        res.putArray("content").addObject().put("type", "text").put("text", text);
        return res;
    }
}
