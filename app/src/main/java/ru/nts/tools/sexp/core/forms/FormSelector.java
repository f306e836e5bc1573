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
package ru.nts.tools.sexp.core.forms;

import ru.nts.tools.sexp.core.NtsParamException;
import ru.nts.tools.sexp.core.reader.SexpNode;
import ru.nts.tools.sexp.core.reader.SexpReader;
import ru.nts.tools.sexp.core.reader.SexpSyntaxException;
import ru.nts.tools.sexp.core.reader.SourceTree;

import java.util.List;
import java.util.Optional;

/**
 * Селектор top-level формы.
 *
 * @param name          имя определения, голое или с пространством имён
 * @param kind          вид: название категории ("function definition") или символ головы ("defn"); null означает любой
 * @param dispatchValue литерал значения диспетчеризации (":circle", "[:a :b]"); null означает любое
 * @param platform      ключ платформы reader conditional ("clj", "cljs"); null означает любая
 */
public record FormSelector(String name, String kind, String dispatchValue, String platform) {

    public FormSelector {
        if (name == null || name.isBlank()) {
            throw NtsParamException.missing("form_name");
        }
        name = name.trim();
        kind = blankToNull(kind);
        dispatchValue = blankToNull(dispatchValue);
        platform = blankToNull(platform);
        if (platform != null && platform.startsWith(":")) {
            platform = platform.substring(1);
        }
    }

    public static FormSelector of(String name) {
        return new FormSelector(name, null, null, null);
    }

    public static FormSelector of(String name, String kind) {
        return new FormSelector(name, kind, null, null);
    }

    /**
     * Селектор из пользовательского ввода. Имя вида "area :rectangle" без явного dispatch value
     * делится на имя и значение диспетчеризации.
     */
    public static FormSelector parse(String name, String kind, String dispatchValue, String platform) {
        if (name != null && (dispatchValue == null || dispatchValue.isBlank())) {
            String trimmed = name.trim();
            int space = indexOfWhitespace(trimmed);
            if (space > 0) {
                return new FormSelector(trimmed.substring(0, space), kind, trimmed.substring(space + 1).trim(), platform);
            }
        }
        return new FormSelector(name, kind, dispatchValue, platform);
    }

    /**
     * Вид как категория, если {@link #kind()} является её названием.
     */
    public Optional<DefinitionKind> category() {
        return kind == null ? Optional.empty() : DefinitionKind.fromLabel(kind);
    }

    /**
     * Значение диспетчеризации, разобранное как выражение, для структурного сравнения.
     */
    public Optional<SexpNode> dispatchNode() {
        if (dispatchValue == null) {
            return Optional.empty();
        }
        SourceTree tree;
        try {
            tree = SexpReader.parseFragment(dispatchValue);
        } catch (SexpSyntaxException e) {
            throw NtsParamException.invalid("dispatch_value", dispatchValue, e.getDetail());
        }
        List<SexpNode> forms = tree.forms();
        if (forms.size() != 1) {
            throw NtsParamException.invalid("dispatch_value", dispatchValue, "must be a single literal or symbol");
        }
        return Optional.of(forms.get(0));
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        if (kind != null) {
            sb.append(kind).append(' ');
        }
        sb.append(name);
        if (dispatchValue != null) {
            sb.append(' ').append(dispatchValue);
        }
        if (platform != null) {
            sb.append(" [").append(platform).append(']');
        }
        return sb.toString();
    }

    private static int indexOfWhitespace(String s) {
        for (int i = 0; i < s.length(); i++) {
            if (Character.isWhitespace(s.charAt(i))) {
                return i;
            }
        }
        return -1;
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s.trim();
    }
}
