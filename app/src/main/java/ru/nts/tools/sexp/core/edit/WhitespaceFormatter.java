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
package ru.nts.tools.sexp.core.edit;

/**
 * Форматтер по умолчанию: убирает пробелы и табы в конце строк.
 * Содержимое строковых литералов не трогает, многострочная строка сохраняется как есть.
 */
public final class WhitespaceFormatter implements CodeFormatter {

    @Override
    public String format(String text) {
        StringBuilder out = new StringBuilder(text.length());
        StringBuilder pending = new StringBuilder();
        boolean inString = false;
        boolean inComment = false;
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (inString) {
                out.append(c);
                if (c == '\\' && i + 1 < text.length()) {
                    out.append(text.charAt(++i));
                } else if (c == '"') {
                    inString = false;
                }
                i++;
                continue;
            }
            if (c == ' ' || c == '\t') {
                pending.append(c);
                i++;
                continue;
            }
            if (c == '\n' || c == '\r') {
                // пробелы перед концом строки отбрасываются
                pending.setLength(0);
                inComment = false;
                out.append(c);
                i++;
                continue;
            }
            out.append(pending);
            pending.setLength(0);
            out.append(c);
            if (!inComment) {
                if (c == ';') {
                    inComment = true;
                } else if (c == '"') {
                    inString = true;
                } else if (c == '\\' && i + 1 < text.length()) {
                    // литерал символа: \" не открывает строку
                    out.append(text.charAt(++i));
                }
            }
            i++;
        }
        return out.toString();
    }
}
