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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Читатель S-выражений без потерь (lossless reader).
 *
 * Рекурсивный спуск по тексту. Пробелы (включая запятые) и комментарии становятся узлами дерева,
 * поэтому сериализация корня возвращает исходный текст байт в байт.
 *
 * Ошибки делятся на два класса:
 * - {@link DelimiterException}: незакрытая, лишняя или чужая закрывающая скобка. Такой текст можно чинить.
 * - {@link SexpSyntaxException}: всё остальное (незакрытая строка, неизвестный dispatch, префикс без операнда).
 */
public final class SexpReader {

    private static final String TERMINATORS = "\";@^`~()[]{}\\";

    private final String text;
    private final int length;
    private int pos;

    /** Смещения открытых коллекций, от внутренней к внешней. */
    private final Deque<Integer> openStack = new ArrayDeque<>();

    private SexpReader(String text) {
        this.text = text;
        this.length = text.length();
    }

    /**
     * Разбирает текст целиком.
     *
     * @throws DelimiterException  если нарушен только баланс скобок
     * @throws SexpSyntaxException если текст не читается по другой причине
     */
    public static SourceTree parse(String text) {
        SexpReader reader = new SexpReader(text);
        try {
            return new SourceTree(text, reader.readRoot());
        } catch (StackOverflowError e) {
            throw new SexpSyntaxException("Nesting is too deep to read", reader.pos, TextPosition.of(text, reader.pos));
        }
    }

    /**
     * Разбирает фрагмент, который должен содержать хотя бы одно полное выражение.
     */
    public static SourceTree parseFragment(String fragment) {
        SourceTree tree = parse(fragment);
        if (tree.forms().isEmpty()) {
            throw new SexpSyntaxException("Fragment contains no expressions", 0, new TextPosition(1, 1));
        }
        return tree;
    }

    /**
     * Символ, на котором заканчивается токен (символ, число, ключевое слово).
     */
    public static boolean isTerminator(char c) {
        return isWhitespace(c) || TERMINATORS.indexOf(c) >= 0;
    }

    public static boolean isWhitespace(char c) {
        return Character.isWhitespace(c) || c == ',';
    }

    public static boolean isOpener(char c) {
        return c == '(' || c == '[' || c == '{';
    }

    public static boolean isCloser(char c) {
        return c == ')' || c == ']' || c == '}';
    }

    public static char closerFor(char opener) {
        return switch (opener) {
            case '(' -> ')';
            case '[' -> ']';
            case '{' -> '}';
            default -> throw new IllegalArgumentException("Not an opening delimiter: " + opener);
        };
    }

    // ---------------------------------------------------------------------

    private SexpNode readRoot() {
        List<SexpNode> children = new ArrayList<>();
        while (pos < length) {
            char c = text.charAt(pos);
            if (isCloser(c)) {
                throw new DelimiterException(DelimiterException.Problem.UNMATCHED_CLOSE,
                        "Unmatched closing '" + c + "'", pos, TextPosition.of(text, pos));
            }
            children.add(readNode());
        }
        return SexpNode.composite(NodeKind.ROOT, "", children, "", 0, length);
    }

    private SexpNode readNode() {
        char c = text.charAt(pos);
        if (isWhitespace(c)) {
            return readWhitespace();
        }
        switch (c) {
            case ';':
                return readComment();
            case '(':
                return readCollection(NodeKind.LIST, "(");
            case '[':
                return readCollection(NodeKind.VECTOR, "[");
            case '{':
                return readCollection(NodeKind.MAP, "{");
            case '"':
                return readString(NodeKind.STRING, 0);
            case '\\':
                return readCharacter();
            case '\'':
                return readPrefix(NodeKind.QUOTE, "'", 1);
            case '`':
                return readPrefix(NodeKind.SYNTAX_QUOTE, "`", 1);
            case '~':
                return startsWith("~@")
                        ? readPrefix(NodeKind.UNQUOTE_SPLICING, "~@", 1)
                        : readPrefix(NodeKind.UNQUOTE, "~", 1);
            case '@':
                return readPrefix(NodeKind.DEREF, "@", 1);
            case '^':
                return readPrefix(NodeKind.METADATA, "^", 2);
            case '#':
                return readDispatch();
            default:
                return readToken();
        }
    }

    private SexpNode readDispatch() {
        int start = pos;
        if (pos + 1 >= length) {
            throw syntax("Unexpected end of input after '#'", start);
        }
        char next = text.charAt(pos + 1);
        switch (next) {
            case '(':
                return readCollection(NodeKind.FN, "#(");
            case '{':
                return readCollection(NodeKind.SET, "#{");
            case '"':
                return readString(NodeKind.REGEX, 1);
            case '\'':
                return readPrefix(NodeKind.VAR_QUOTE, "#'", 1);
            case '_':
                return readPrefix(NodeKind.DISCARD, "#_", 1);
            case '=':
                return readPrefix(NodeKind.EVAL, "#=", 1);
            case '^':
                return readPrefix(NodeKind.METADATA, "#^", 2);
            case '!':
                return readComment();
            case '?':
                if (startsWith("#?@(")) {
                    return readCollection(NodeKind.READER_CONDITIONAL_SPLICING, "#?@(");
                }
                if (startsWith("#?(")) {
                    return readCollection(NodeKind.READER_CONDITIONAL, "#?(");
                }
                throw syntax("Reader conditional must start with '#?(' or '#?@('", start);
            case ':':
                return readNamespacedMap();
            case '#':
                return readSymbolicValue();
            default:
                if (Character.isLetter(next)) {
                    return readTaggedLiteral();
                }
                throw syntax("Unsupported dispatch macro '#" + next + "'", start);
        }
    }

    private SexpNode readWhitespace() {
        int start = pos;
        while (pos < length && isWhitespace(text.charAt(pos))) {
            pos++;
        }
        return SexpNode.leaf(NodeKind.WHITESPACE, text.substring(start, pos), start);
    }

    private SexpNode readComment() {
        int start = pos;
        while (pos < length && text.charAt(pos) != '\n') {
            pos++;
        }
        return SexpNode.leaf(NodeKind.COMMENT, text.substring(start, pos), start);
    }

    private SexpNode readCollection(NodeKind kind, String open) {
        int start = pos;
        char opener = open.charAt(open.length() - 1);
        char expected = closerFor(opener);
        pos += open.length();
        openStack.push(start);

        List<SexpNode> children = new ArrayList<>();
        while (true) {
            if (pos >= length) {
                throw unclosed(start, open);
            }
            char c = text.charAt(pos);
            if (isCloser(c)) {
                if (c != expected) {
                    TextPosition openedAt = TextPosition.of(text, start);
                    throw new DelimiterException(DelimiterException.Problem.MISMATCHED_CLOSE,
                            "Expected '" + expected + "' to close '" + open + "' opened at " + openedAt
                                    + " but found '" + c + "'",
                            pos, TextPosition.of(text, pos));
                }
                pos++;
                break;
            }
            children.add(readNode());
        }
        openStack.pop();
        return SexpNode.composite(kind, open, children, String.valueOf(expected), start, pos);
    }

    private SexpNode readNamespacedMap() {
        int start = pos;
        int p = pos + 2;
        if (p < length && text.charAt(p) == ':') {
            p++;
        }
        while (p < length && !isTerminator(text.charAt(p))) {
            p++;
        }
        if (p >= length || text.charAt(p) != '{') {
            throw syntax("Namespaced map prefix must be followed by '{'", start);
        }
        return readCollection(NodeKind.NAMESPACED_MAP, text.substring(start, p + 1));
    }

    /**
     * @param prefixLength 0 для строки, 1 для регулярного выражения #"..."
     */
    private SexpNode readString(NodeKind kind, int prefixLength) {
        int start = pos;
        pos += prefixLength + 1;
        while (pos < length) {
            char c = text.charAt(pos);
            if (c == '\\') {
                pos += 2;
                continue;
            }
            pos++;
            if (c == '"') {
                return SexpNode.leaf(kind, text.substring(start, pos), start);
            }
        }
        pos = length;
        throw syntax("Unterminated string literal", start);
    }

    private SexpNode readCharacter() {
        int start = pos;
        pos++;
        if (pos >= length) {
            throw syntax("Incomplete character literal", start);
        }
        pos++;
        while (pos < length && !isTerminator(text.charAt(pos))) {
            pos++;
        }
        return SexpNode.leaf(NodeKind.CHARACTER, text.substring(start, pos), start);
    }

    private SexpNode readSymbolicValue() {
        int start = pos;
        pos += 2;
        while (pos < length && !isTerminator(text.charAt(pos))) {
            pos++;
        }
        if (pos == start + 2) {
            throw syntax("Expected a symbolic value after '##'", start);
        }
        return SexpNode.leaf(NodeKind.SYMBOLIC_VALUE, text.substring(start, pos), start);
    }

    private SexpNode readToken() {
        int start = pos;
        while (pos < length && !isTerminator(text.charAt(pos))) {
            pos++;
        }
        if (pos == start) {
            throw syntax("Unexpected character '" + text.charAt(start) + "'", start);
        }
        String token = text.substring(start, pos);
        return SexpNode.leaf(classify(token), token, start);
    }

    private static NodeKind classify(String token) {
        char first = token.charAt(0);
        if (first == ':') {
            return NodeKind.KEYWORD;
        }
        if (Character.isDigit(first)) {
            return NodeKind.NUMBER;
        }
        if ((first == '+' || first == '-') && token.length() > 1 && Character.isDigit(token.charAt(1))) {
            return NodeKind.NUMBER;
        }
        return NodeKind.SYMBOL;
    }

    private SexpNode readTaggedLiteral() {
        int start = pos;
        pos++;
        List<SexpNode> children = new ArrayList<>();
        SexpNode tag = readToken();
        children.add(tag);
        readTrivia(children);
        children.add(readOperand("#" + tag.text(), start));
        return SexpNode.composite(NodeKind.TAGGED_LITERAL, "#", children, "", start, pos);
    }

    /**
     * Префиксная форма: префикс, затем {@code operands} значимых форм с trivia между ними.
     */
    private SexpNode readPrefix(NodeKind kind, String prefix, int operands) {
        int start = pos;
        pos += prefix.length();
        List<SexpNode> children = new ArrayList<>();
        for (int i = 0; i < operands; i++) {
            readTrivia(children);
            children.add(readOperand(prefix, start));
        }
        return SexpNode.composite(kind, prefix, children, "", start, pos);
    }

    private void readTrivia(List<SexpNode> into) {
        while (pos < length) {
            char c = text.charAt(pos);
            if (isWhitespace(c)) {
                into.add(readWhitespace());
            } else if (c == ';' || startsWith("#!")) {
                into.add(readComment());
            } else if (startsWith("#_")) {
                into.add(readPrefix(NodeKind.DISCARD, "#_", 1));
            } else {
                return;
            }
        }
    }

    private SexpNode readOperand(String prefix, int prefixStart) {
        if (pos >= length) {
            if (!openStack.isEmpty()) {
                int innermost = openStack.peek();
                throw unclosed(innermost, String.valueOf(text.charAt(innermost)));
            }
            throw syntax("Expected a form after '" + prefix + "' but reached end of input", prefixStart);
        }
        char c = text.charAt(pos);
        if (isCloser(c)) {
            throw syntax("Expected a form after '" + prefix + "' but found '" + c + "'", pos);
        }
        return readNode();
    }

    private boolean startsWith(String s) {
        return text.startsWith(s, pos);
    }

    private DelimiterException unclosed(int openOffset, String open) {
        TextPosition at = TextPosition.of(text, openOffset);
        return new DelimiterException(DelimiterException.Problem.UNCLOSED,
                "Unclosed '" + open + "' opened at " + at, openOffset, at);
    }

    private SexpSyntaxException syntax(String detail, int offset) {
        return new SexpSyntaxException(detail, offset, TextPosition.of(text, offset));
    }
}
