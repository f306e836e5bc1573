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

import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Вид определения. Закрытое перечисление: новый вид добавляется новой константой и правилом в {@link #classify(String)}.
 */
public enum DefinitionKind {

    VALUE_BINDING("value binding", Set.of("def", "defonce")),
    FUNCTION("function definition", Set.of("defn", "defn-", "defmacro", "definline")),
    DISPATCH_IMPLEMENTATION("multi-arity-dispatch implementation", Set.of("defmethod")),
    OTHER("other", Set.of());

    private final String label;
    private final Set<String> heads;

    DefinitionKind(String label, Set<String> heads) {
        this.label = label;
        this.heads = heads;
    }

    public String label() {
        return label;
    }

    /**
     * Вид по символу в голове формы. Пространство имён символа игнорируется: clojure.core/defn это defn.
     */
    public static DefinitionKind classify(String head) {
        if (head == null) {
            return OTHER;
        }
        String bare = bareName(head);
        for (DefinitionKind kind : values()) {
            if (kind.heads.contains(bare)) {
                return kind;
            }
        }
        return OTHER;
    }

    /**
     * Разбирает название вида: "function definition", "function", "VALUE_BINDING", "value-binding"...
     *
     * @return пусто, если строка не является названием вида (например, это символ "defn")
     */
    public static Optional<DefinitionKind> fromLabel(String text) {
        if (text == null) {
            return Optional.empty();
        }
        String normalized = text.trim().toLowerCase(Locale.ROOT).replace('_', ' ').replace('-', ' ');
        for (DefinitionKind kind : values()) {
            if (kind.label.replace('-', ' ').equals(normalized) || kind.name().toLowerCase(Locale.ROOT).replace('_', ' ').equals(normalized)) {
                return Optional.of(kind);
            }
        }
        return switch (normalized) {
            case "value", "binding", "var" -> Optional.of(VALUE_BINDING);
            case "function", "fn", "macro" -> Optional.of(FUNCTION);
            case "dispatch implementation", "dispatch", "method", "multimethod" -> Optional.of(DISPATCH_IMPLEMENTATION);
            default -> Optional.empty();
        };
    }

    /**
     * Имя без пространства имён: "clojure.core/defn" → "defn". Символ "/" остаётся как есть.
     */
    public static String bareName(String name) {
        int slash = name.indexOf('/');
        if (slash > 0 && slash < name.length() - 1) {
            return name.substring(slash + 1);
        }
        return name;
    }
}
