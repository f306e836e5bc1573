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

import ru.nts.tools.sexp.core.reader.SexpNode;

/**
 * Top-level форма файла с распознанными атрибутами определения.
 * Формы находятся заново при каждом чтении файла и не изменяются.
 *
 * @param node            узел формы
 * @param parent          корень файла; для форм внутри reader conditional сам conditional (или вектор #?@)
 * @param head            символ в голове списка, как записан, или null
 * @param kind            вид определения
 * @param name            имя, как записано (может быть с пространством имён или ключевым словом), или null
 * @param dispatchValue   значение диспетчеризации defmethod или null
 * @param privateForm     defn- или ^:private
 * @param platform        ключ платформы reader conditional без двоеточия или null
 * @param leadingComments комментарии непосредственно над формой (без пустой строки между ними) или ""
 * @param line            строка начала формы, с 1
 */
public record TopLevelForm(
        SexpNode node,
        SexpNode parent,
        String head,
        DefinitionKind kind,
        String name,
        SexpNode dispatchValue,
        boolean privateForm,
        String platform,
        String leadingComments,
        int line
) {

    public boolean isNamed() {
        return name != null;
    }

    /**
     * Имя вместе со значением диспетчеризации: "area :rectangle". По этой строке свёрнутый вид ищет формы.
     */
    public String displayName() {
        if (name == null) {
            return "";
        }
        return dispatchValue == null ? name : name + " " + dispatchText();
    }

    public String dispatchText() {
        return dispatchValue == null ? null : dispatchValue.toSource();
    }

    public EditTarget target() {
        return new EditTarget(parent, node, node);
    }

    /**
     * Описание для списков кандидатов: "defmethod area :rectangle [clj] (line 12)".
     */
    public String describe() {
        StringBuilder sb = new StringBuilder();
        if (head != null) {
            sb.append(head).append(' ');
        }
        sb.append(name != null ? displayName() : "<unnamed>");
        if (platform != null) {
            sb.append(" [").append(platform).append(']');
        }
        sb.append(" (line ").append(line).append(')');
        return sb.toString();
    }
}
