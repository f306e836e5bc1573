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
package ru.nts.tools.sexp.core.view;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Set;

/**
 * Как показывать файл в свёрнутом виде.
 */
public enum FileKind {

    /** Исходник на Lisp-диалекте: сигнатуры определений. */
    LISP_SOURCE,

    /** Любой другой текст: строки, совпавшие с шаблоном, с контекстом. */
    TEXT;

    // .edn это данные, а не код с определениями
    private static final Set<String> COLLAPSIBLE = Set.of("clj", "cljs", "cljc", "bb", "lpy");

    public static FileKind of(Path path) {
        Path fileName = path.getFileName();
        if (fileName == null) {
            return TEXT;
        }
        String name = fileName.toString();
        int dot = name.lastIndexOf('.');
        if (dot < 0) {
            return TEXT;
        }
        return COLLAPSIBLE.contains(name.substring(dot + 1).toLowerCase(Locale.ROOT)) ? LISP_SOURCE : TEXT;
    }
}
