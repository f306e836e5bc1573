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

/**
 * Строгость защиты от записи в устаревшие файлы.
 */
public enum WriteGuardMode {

    /** Только полное (raw) чтение считается наблюдением файла. */
    FULL_READ("full-read"),

    /** Полное чтение и свёрнутый просмотр считаются наблюдением. */
    PARTIAL_READ("partial-read"),

    /** Защита выключена: запись разрешена всегда. */
    DISABLED("false");

    private final String configValue;

    WriteGuardMode(String configValue) {
        this.configValue = configValue;
    }

    public String configValue() {
        return configValue;
    }

    /**
     * Разбирает значение из конфигурации: "full-read", "partial-read" или false.
     *
     * @throws NtsParamException если значение не распознано
     */
    public static WriteGuardMode fromConfigValue(String value) {
        if (value == null || value.isBlank()) {
            return FULL_READ;
        }
        String normalized = value.trim().toLowerCase().replace('_', '-');
        if (normalized.startsWith(":")) {
            normalized = normalized.substring(1);
        }
        for (WriteGuardMode mode : values()) {
            if (mode.configValue.equals(normalized)) {
                return mode;
            }
        }
        if ("disabled".equals(normalized) || "off".equals(normalized)) {
            return DISABLED;
        }
        throw NtsParamException.invalid("write-file-guard", value,
                "must be one of full-read, partial-read, false");
    }
}
