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
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Реестр инструментов и маршрутизация вызовов по имени.
 */
public class McpRouter {

    /**
     * Зарегистрированные инструменты в порядке регистрации.
     */
    private final Map<String, McpTool> tools = new LinkedHashMap<>();

    private final ObjectMapper mapper;

    public McpRouter(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * Регистрирует инструмент. Повторная регистрация с тем же именем заменяет прежний.
     */
    public void registerTool(McpTool tool) {
        tools.put(tool.getName(), tool);
    }

    /**
     * Список инструментов в формате ответа на 'tools/list'.
     */
    public JsonNode listTools() {
        ArrayNode toolsArray = mapper.createArrayNode();
        for (McpTool tool : tools.values()) {
            ObjectNode toolNode = toolsArray.addObject();
            toolNode.put("name", tool.getName());
            toolNode.put("description", "[" + tool.getCategory().toUpperCase() + "] " + tool.getDescription());
            toolNode.put("category", tool.getCategory());
            toolNode.set("inputSchema", tool.getInputSchema());
        }
        ObjectNode result = mapper.createObjectNode();
        result.set("tools", toolsArray);
        return result;
    }

    /**
     * Вызывает инструмент по имени. Ошибки выполнения возвращаются как ответ с isError=true.
     *
     * @throws IllegalArgumentException если инструмент не зарегистрирован
     */
    public JsonNode callTool(String name, JsonNode params) {
        McpTool tool = getTool(name);
        if (tool == null) {
            throw new IllegalArgumentException("Tool not found: " + name);
        }
        EditorLog.log("[Router] call %s", name);
        return tool.executeWithFeedback(params);
    }

    /**
     * @return инструмент или null, если имя не зарегистрировано
     */
    public McpTool getTool(String name) {
        return tools.get(name);
    }

    public Collection<McpTool> getTools() {
        return Collections.unmodifiableCollection(tools.values());
    }
}
