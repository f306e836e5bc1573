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
package ru.nts.tools.sexp.core.reader;

import ru.nts.tools.sexp.core.NtsErrorCode;

/**
 * Ошибка только в балансе скобок. Такой текст можно отдать балансировщику вместо немедленного отказа.
 */
public class DelimiterException extends SexpSyntaxException {

    public enum Problem {
        /** Открывающая скобка не закрыта до конца текста. */
        UNCLOSED,
        /** Закрывающая скобка без открывающей. */
        UNMATCHED_CLOSE,
        /** Закрывающая скобка другого типа, чем открытая. */
        MISMATCHED_CLOSE
    }

    private final Problem problem;

    public DelimiterException(Problem problem, String detail, int offset, TextPosition position) {
        super(NtsErrorCode.DELIMITER_ERROR, detail, offset, position);
        this.problem = problem;
        withContext("problem", problem.name());
    }

    public Problem getProblem() {
        return problem;
    }
}
