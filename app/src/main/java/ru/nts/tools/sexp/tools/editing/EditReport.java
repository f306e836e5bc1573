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
package ru.nts.tools.sexp.tools.editing;

import ru.nts.tools.sexp.core.edit.EditResult;

/**
 * Текстовый отчёт о правке для ответа инструмента.
 */
final class EditReport {

    private EditReport() {
    }

    static String format(String action, EditResult result, boolean dryRun) {
        StringBuilder sb = new StringBuilder();
        if (!result.changed()) {
            sb.append(action).append(": no changes, file left as is: ").append(result.path());
        } else if (dryRun) {
            sb.append("DRY RUN. ").append(action).append(" would change ").append(result.path())
                    .append(" (").append(result.appliedCount()).append(" location(s)). File NOT written.");
        } else {
            sb.append(action).append(" applied to ").append(result.path())
                    .append(" (").append(result.appliedCount()).append(" location(s))");
            sb.append("\nNew CRC32C: ").append(Long.toHexString(result.crc32c()).toUpperCase());
        }
        for (String warning : result.warnings()) {
            sb.append("\nWARNING: ").append(warning);
        }
        if (result.changed()) {
            sb.append("\n\n```diff\n").append(result.diff()).append("\n```");
        }
        return sb.toString();
    }
}
