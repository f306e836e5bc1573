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
import ru.nts.tools.sexp.core.NtsException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Текст не читается как последовательность S-выражений.
 */
public class SexpSyntaxException extends NtsException {

    private final int offset;
    private final TextPosition position;
    private final String detail;

    public SexpSyntaxException(String detail, int offset, TextPosition position) {
        this(NtsErrorCode.SYNTAX_ERROR, detail, offset, position);
    }

    protected SexpSyntaxException(NtsErrorCode code, String detail, int offset, TextPosition position) {
        super(code, context(detail, offset, position));
        this.offset = offset;
        this.position = position;
        this.detail = detail;
    }

    public int getOffset() {
        return offset;
    }

    public TextPosition getPosition() {
        return position;
    }

    public String getDetail() {
        return detail;
    }

    private static Map<String, Object> context(String detail, int offset, TextPosition position) {
        Map<String, Object> ctx = new LinkedHashMap<>();
        ctx.put("line", position.line());
        ctx.put("column", position.column());
        ctx.put("offset", offset);
        ctx.put("detail", detail);
        return ctx;
    }
}
