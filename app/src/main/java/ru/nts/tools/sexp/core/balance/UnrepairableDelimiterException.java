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
package ru.nts.tools.sexp.core.balance;

import ru.nts.tools.sexp.core.NtsErrorCode;
import ru.nts.tools.sexp.core.NtsException;
import ru.nts.tools.sexp.core.reader.DelimiterException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Балансировщик отказался чинить текст. Несёт исходную ошибку разбора и причину отказа.
 */
public class UnrepairableDelimiterException extends NtsException {

    private final DelimiterException original;
    private final String reason;

    public UnrepairableDelimiterException(DelimiterException original, String reason) {
        super(NtsErrorCode.DELIMITER_UNREPAIRABLE, context(original, reason), original);
        this.original = original;
        this.reason = reason;
    }

    public DelimiterException getOriginal() {
        return original;
    }

    public String getReason() {
        return reason;
    }

    private static Map<String, Object> context(DelimiterException original, String reason) {
        Map<String, Object> ctx = new LinkedHashMap<>();
        ctx.put("reason", reason);
        ctx.put("detail", original.getDetail());
        ctx.put("line", original.getPosition().line());
        ctx.put("column", original.getPosition().column());
        return ctx;
    }
}
