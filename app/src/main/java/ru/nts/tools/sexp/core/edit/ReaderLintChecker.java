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

import ru.nts.tools.sexp.core.reader.DelimiterException;
import ru.nts.tools.sexp.core.reader.SexpReader;
import ru.nts.tools.sexp.core.reader.SexpSyntaxException;

/**
 * Линтер по умолчанию: текст корректен, если его читает {@link SexpReader}.
 */
public final class ReaderLintChecker implements LintChecker {

    @Override
    public LintReport lint(String text) {
        try {
            SexpReader.parse(text);
            return LintReport.passed();
        } catch (DelimiterException e) {
            return LintReport.error(describe(e), true);
        } catch (SexpSyntaxException e) {
            return LintReport.error(describe(e), false);
        }
    }

    private static String describe(SexpSyntaxException e) {
        return e.getPosition() + ": " + e.getDetail();
    }
}
