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
 * Результат проверки линтером.
 *
 * @param ok             текст структурно корректен
 * @param report         описание проблемы, пустое при ok
 * @param delimiterError проблема только в балансе скобок
 */
public record LintReport(boolean ok, String report, boolean delimiterError) {

    private static final LintReport OK = new LintReport(true, "", false);

    public static LintReport passed() {
        return OK;
    }

    public static LintReport error(String report, boolean delimiterError) {
        return new LintReport(false, report, delimiterError);
    }
}
