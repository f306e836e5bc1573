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
package ru.nts.tools.sexp.core.forms;

import ru.nts.tools.sexp.core.NtsParamException;

import java.util.Locale;

/**
 * Что сделать с найденной целью.
 */
public enum EditOperation {
    REPLACE,
    INSERT_BEFORE,
    INSERT_AFTER;

    /**
     * Разбирает "replace", "insert_before", "insert-after"... Пустое значение означает REPLACE.
     */
    public static EditOperation parse(String value) {
        if (value == null || value.isBlank()) {
            return REPLACE;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        for (EditOperation op : values()) {
            if (op.name().equals(normalized)) {
                return op;
            }
        }
        throw NtsParamException.invalid("operation", value, "must be one of replace, insert_before, insert_after");
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
