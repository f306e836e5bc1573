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
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;

/**
 * Контракт инструмента, вызываемого через tool-dispatch слой.
 * Транспорт (stdio/JSON-RPC) находится снаружи; инструмент получает аргументы как JsonNode
 * и возвращает MCP-ответ вида {"content":[{"type":"text","text":...}]}.
 */
public interface McpTool {

    String getName();

    String getDescription();

    String getCategory();

    JsonNode getInputSchema();

    JsonNode execute(JsonNode params) throws Exception;

    /**
     * Обертка над execute: любая ошибка превращается в ответ с isError=true, а не в частичный успех.
     */
    default JsonNode executeWithFeedback(JsonNode params) {
        try {
            return execute(params);
        } catch (NtsException e) {
            EditorLog.log("[%s] %s", getName(), e.toLogMessage());
            return createErrorResponse(e.getCode().name(), e.toUserMessage());
        } catch (IllegalArgumentException e) {
            EditorLog.log("[%s] invalid arguments: %s", getName(), e.getMessage());
            return createErrorResponse("INVALID_ARGUMENTS", "Invalid request parameters: " + e.getMessage());
        } catch (IOException e) {
            EditorLog.log("[%s] I/O failure: %s", getName(), e);
            return createErrorResponse(NtsErrorCode.IO_ERROR.name(), "System I/O error: " + e.getMessage());
        } catch (Exception e) {
            EditorLog.log("[%s] internal failure: %s", getName(), e);
            return createErrorResponse(NtsErrorCode.INTERNAL_ERROR.name(), "Internal error: " + e);
        }
    }

    private JsonNode createErrorResponse(String type, String message) {
        ObjectNode res = new ObjectMapper().createObjectNode();
        res.putArray("content").addObject().put("type", "text").put("text", "Error [" + type + "]: " + message);
        res.put("isError", true);
        return res;
    }
}
