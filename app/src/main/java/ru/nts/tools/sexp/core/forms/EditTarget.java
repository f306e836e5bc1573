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

import ru.nts.tools.sexp.core.reader.SexpNode;

/**
 * Непрерывный ряд соседних узлов {@code first..last} внутри {@code parent}. Узлы сравниваются по ссылке.
 */
public record EditTarget(SexpNode parent, SexpNode first, SexpNode last) {

    public int start() {
        return first.start();
    }

    public int end() {
        return last.end();
    }

    public boolean overlaps(EditTarget other) {
        return start() < other.end() && other.start() < end();
    }
}
