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

/**
 * Вид узла дерева исходника.
 */
public enum NodeKind {

    /** Корень файла: последовательность top-level узлов без собственных скобок. */
    ROOT(Shape.ROOT),

    // ---- trivia ----
    /** Пробелы, переводы строк и запятые. */
    WHITESPACE(Shape.TRIVIA),
    /** Комментарий до конца строки: ';' или '#!'. */
    COMMENT(Shape.TRIVIA),

    // ---- atoms ----
    SYMBOL(Shape.ATOM),
    KEYWORD(Shape.ATOM),
    NUMBER(Shape.ATOM),
    STRING(Shape.ATOM),
    CHARACTER(Shape.ATOM),
    /** Регулярное выражение #"...". */
    REGEX(Shape.ATOM),
    /** ##Inf, ##-Inf, ##NaN. */
    SYMBOLIC_VALUE(Shape.ATOM),

    // ---- collections ----
    LIST(Shape.COLLECTION),
    VECTOR(Shape.COLLECTION),
    MAP(Shape.COLLECTION),
    /** #{...} */
    SET(Shape.COLLECTION),
    /** #(...) */
    FN(Shape.COLLECTION),
    /** #?(...) */
    READER_CONDITIONAL(Shape.COLLECTION),
    /** #?@(...) */
    READER_CONDITIONAL_SPLICING(Shape.COLLECTION),
    /** #:ns{...} и #::{...} */
    NAMESPACED_MAP(Shape.COLLECTION),

    // ---- prefix forms ----
    QUOTE(Shape.PREFIX),
    SYNTAX_QUOTE(Shape.PREFIX),
    UNQUOTE(Shape.PREFIX),
    UNQUOTE_SPLICING(Shape.PREFIX),
    DEREF(Shape.PREFIX),
    /** #'sym */
    VAR_QUOTE(Shape.PREFIX),
    /** #_form: форма читается, но считается несуществующей. */
    DISCARD(Shape.PREFIX),
    /** ^meta target и #^meta target: два операнда. */
    METADATA(Shape.PREFIX),
    /** #tag value: тег-символ и значение. */
    TAGGED_LITERAL(Shape.PREFIX),
    /** #=form */
    EVAL(Shape.PREFIX);

    private enum Shape {ROOT, TRIVIA, ATOM, COLLECTION, PREFIX}

    private final Shape shape;

    NodeKind(Shape shape) {
        this.shape = shape;
    }

    /**
     * Узлы, не влияющие на смысл кода. {@link #DISCARD} тоже считается trivia:
     * закомментированная через #_ форма не участвует ни в поиске, ни в сравнении.
     */
    public boolean isTrivia() {
        return shape == Shape.TRIVIA || this == DISCARD;
    }

    public boolean isAtom() {
        return shape == Shape.ATOM;
    }

    /** Узел с парой скобок. */
    public boolean isCollection() {
        return shape == Shape.COLLECTION;
    }

    public boolean isPrefix() {
        return shape == Shape.PREFIX;
    }

    /** Узел, у которого есть дочерние узлы. */
    public boolean isComposite() {
        return shape == Shape.COLLECTION || shape == Shape.PREFIX || shape == Shape.ROOT;
    }

    public boolean isReaderConditional() {
        return this == READER_CONDITIONAL || this == READER_CONDITIONAL_SPLICING;
    }
}
