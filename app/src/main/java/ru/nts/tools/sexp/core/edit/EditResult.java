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

import java.nio.file.Path;
import java.util.List;

/**
 * Итог успешного прохода конвейера правки.
 *
 * @param path         отредактированный файл
 * @param newText      текст файла после правки (без BOM)
 * @param diff         unified diff относительно текста до правки; пустой, если текст не изменился
 * @param warnings     некритичные замечания: починка скобок, множественная замена
 * @param stages       пройденные стадии по порядку
 * @param appliedCount сколько мест изменено
 * @param written      файл записан на диск (false для dry run и для правки без изменений)
 * @param crc32c       CRC32C нового содержимого на диске, 0 если файл не записывался
 */
public record EditResult(
        Path path,
        String newText,
        String diff,
        List<String> warnings,
        List<EditStage> stages,
        int appliedCount,
        boolean written,
        long crc32c
) {

    public EditResult {
        warnings = List.copyOf(warnings);
        stages = List.copyOf(stages);
    }

    public boolean changed() {
        return !diff.isEmpty();
    }
}
