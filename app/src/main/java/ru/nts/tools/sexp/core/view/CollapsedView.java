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

import java.util.List;

/**
 * Свёрнутый вид файла.
 *
 * @param text    отрисованный текст
 * @param entries отрисованные формы в порядке файла
 * @param stats   счётчики
 */
public record CollapsedView(String text, List<Entry> entries, ViewStats stats) {

    /**
     * Одна top-level форма в виде.
     *
     * @param text     сигнатура или полный исходный текст формы
     * @param expanded форма показана целиком
     * @param line     строка начала формы
     */
    public record Entry(String text, boolean expanded, int line) {
    }
}
