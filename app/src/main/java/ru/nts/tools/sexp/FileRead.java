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
package ru.nts.tools.sexp;

import java.nio.file.Path;

/**
 * Результат raw-чтения файла.
 *
 * @param path           канонический путь
 * @param content        строки [offset, offset + lineCount) через "\n"
 * @param offset         первая строка (0-based)
 * @param lineCount      сколько строк вернулось
 * @param totalLines     строк в файле
 * @param truncated      файл обрезан по лимиту строк
 * @param linesTruncated хотя бы одна строка обрезана по длине
 * @param size           размер файла в байтах
 */
public record FileRead(
        Path path,
        String content,
        int offset,
        int lineCount,
        int totalLines,
        boolean truncated,
        boolean linesTruncated,
        long size
) {
}
