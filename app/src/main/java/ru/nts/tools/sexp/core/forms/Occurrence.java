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

import ru.nts.tools.sexp.core.reader.TextPosition;

/**
 * Вхождение фрагмента в дерево.
 *
 * @param target   ряд узлов, равный фрагменту
 * @param position строка и колонка начала
 * @param platform ключ ближайшего охватывающего reader conditional или null
 */
public record Occurrence(EditTarget target, TextPosition position, String platform) {

    public int start() {
        return target.start();
    }

    public int end() {
        return target.end();
    }

    public boolean overlaps(Occurrence other) {
        return target.overlaps(other.target);
    }

    /**
     * "line:column", с ключом платформы, если вхождение внутри reader conditional.
     */
    public String location() {
        return platform == null ? position.toString() : position + " [" + platform + "]";
    }
}
