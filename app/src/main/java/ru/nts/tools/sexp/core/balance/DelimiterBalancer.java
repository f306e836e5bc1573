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

import ru.nts.tools.sexp.core.EditorLog;
import ru.nts.tools.sexp.core.reader.DelimiterException;
import ru.nts.tools.sexp.core.reader.SexpReader;
import ru.nts.tools.sexp.core.reader.SexpSyntaxException;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Балансировщик скобок по отступам.
 *
 * Отступ строки считается источником истины о вложенности. Закрывающие скобки в конце строки
 * (и в начале строки) удаляются и выводятся заново: перед строкой с отступом N закрываются все
 * открытые скобки с колонкой не меньше N, закрывающие символы дописываются после последнего
 * кода предыдущей строки (перед комментарием). В конце текста закрывается всё, что осталось.
 * Закрывающие скобки в середине строки сохраняются как явное намерение автора.
 *
 * Отказ ({@link UnrepairableDelimiterException}), если:
 * - в отступах есть табуляции (ширина колонки неоднозначна);
 * - закрывающая скобка в середине строки не совпадает по типу или не имеет пары;
 * - строковый литерал не закрыт;
 * - результат всё равно не читается.
 *
 * Чистая функция без состояния; текст, который уже читается, возвращается без изменений.
 */
public final class DelimiterBalancer {

    private static final byte WS = 0;
    private static final byte CODE = 1;
    private static final byte OPENER = 2;
    private static final byte CLOSER = 3;
    private static final byte STRING = 4;
    private static final byte STRING_END = 5;
    private static final byte COMMENT = 6;

    private DelimiterBalancer() {
    }

    /**
     * Чинит баланс скобок.
     *
     * @return исходный текст, если он уже читается; иначе исправленный текст
     * @throws UnrepairableDelimiterException если починка неоднозначна или не удалась
     * @throws SexpSyntaxException            если текст не читается по причине, не связанной со скобками
     */
    public static Repair repair(String text) {
        DelimiterException original;
        try {
            SexpReader.parse(text);
            return Repair.unchanged(text);
        } catch (DelimiterException e) {
            original = e;
        }

        Pass pass = new Pass(original);
        String repaired = pass.run(text);
        try {
            SexpReader.parse(repaired);
        } catch (SexpSyntaxException e) {
            throw new UnrepairableDelimiterException(original,
                    "indentation-based repair did not produce readable text (" + e.getDetail() + ")");
        }
        EditorLog.log("[Balancer] repaired: inserted=%d removed=%d", pass.inserted, pass.removed);
        // закрывающие скобки в конце строк удаляются и вставляются заново; в отчёт идёт разница
        int net = pass.inserted - pass.removed;
        return new Repair(repaired, !repaired.equals(text), Math.max(net, 0), Math.max(-net, 0));
    }

    private record Opener(char closer, int col) {
    }

    /**
     * Один проход по тексту. Состояние живёт только внутри вызова {@link #repair(String)}.
     */
    private static final class Pass {

        private final DelimiterException original;
        private final Deque<Opener> stack = new ArrayDeque<>();
        private final List<StringBuilder> out = new ArrayList<>();

        private boolean inString;
        private int insLine = -1;
        private int insCol = -1;
        private int inserted;
        private int removed;

        Pass(DelimiterException original) {
            this.original = original;
        }

        String run(String text) {
            String[] lines = text.split("\n", -1);
            for (int i = 0; i < lines.length; i++) {
                processLine(lines[i], i + 1);
            }
            if (inString) {
                throw new UnrepairableDelimiterException(original, "string literal is not terminated");
            }
            closeWhile(0);
            return String.join("\n", out);
        }

        private void processLine(String raw, int lineNo) {
            boolean cr = raw.endsWith("\r");
            String line = cr ? raw.substring(0, raw.length() - 1) : raw;
            int n = line.length();
            boolean startsInString = inString;

            byte[] cls = new byte[n];
            int commentStart = classify(line, cls);

            int firstNonCloser = -1;
            int lastNonCloser = -1;
            int indent = -1;
            int closerCount = 0;
            for (int j = 0; j < commentStart; j++) {
                if (cls[j] == WS) {
                    continue;
                }
                if (indent < 0) {
                    indent = j;
                }
                if (cls[j] == CLOSER) {
                    closerCount++;
                    continue;
                }
                if (firstNonCloser < 0) {
                    firstNonCloser = j;
                }
                lastNonCloser = j;
            }

            if (!startsInString && firstNonCloser < 0) {
                if (closerCount == 0) {
                    // пустая строка или только комментарий: на структуру не влияет
                    out.add(new StringBuilder(raw));
                    return;
                }
                // строка из одних закрывающих скобок: они будут выведены заново
                removed += closerCount;
                if (commentStart < n) {
                    StringBuilder kept = new StringBuilder(line.substring(0, indent)).append(line.substring(commentStart));
                    if (cr) {
                        kept.append('\r');
                    }
                    out.add(kept);
                }
                return;
            }

            if (!startsInString) {
                if (line.substring(0, indent).indexOf('\t') >= 0) {
                    throw new UnrepairableDelimiterException(original,
                            "line " + lineNo + " is indented with tabs, nesting cannot be inferred");
                }
                closeWhile(indent);
            }

            boolean trailHasCloser = false;
            for (int j = lastNonCloser + 1; j < commentStart; j++) {
                if (cls[j] == CLOSER) {
                    trailHasCloser = true;
                    break;
                }
            }
            int wsBeforeComment = commentStart;
            while (wsBeforeComment > lastNonCloser + 1 && cls[wsBeforeComment - 1] == WS) {
                wsBeforeComment--;
            }

            int lineIdx = out.size();
            StringBuilder sb = new StringBuilder(n);
            int newInsCol = -1;
            boolean sawLeadingCloser = false;

            for (int j = 0; j < n; j++) {
                byte k = cls[j];
                char c = line.charAt(j);

                if (!startsInString && j < firstNonCloser) {
                    if (k == CLOSER) {
                        removed++;
                        sawLeadingCloser = true;
                        continue;
                    }
                    if (k == WS && sawLeadingCloser) {
                        continue;
                    }
                    sb.append(c);
                    continue;
                }

                if (trailHasCloser && j > lastNonCloser && j < commentStart) {
                    if (k == CLOSER) {
                        removed++;
                    } else if (commentStart < n && j >= wsBeforeComment) {
                        sb.append(c);
                    }
                    continue;
                }

                sb.append(c);
                switch (k) {
                    case OPENER -> {
                        stack.push(new Opener(SexpReader.closerFor(c), sb.length() - 1));
                        newInsCol = sb.length();
                    }
                    case CLOSER -> {
                        Opener top = stack.poll();
                        if (top == null) {
                            throw new UnrepairableDelimiterException(original,
                                    "closing '" + c + "' in the middle of line " + lineNo + " has no opening delimiter");
                        }
                        if (top.closer() != c) {
                            throw new UnrepairableDelimiterException(original,
                                    "closing '" + c + "' in the middle of line " + lineNo
                                            + " conflicts with an open delimiter expecting '" + top.closer() + "'");
                        }
                        newInsCol = sb.length();
                    }
                    case CODE, STRING_END -> newInsCol = sb.length();
                    default -> {
                    }
                }
            }

            if (cr) {
                sb.append('\r');
            }
            out.add(sb);
            if (newInsCol >= 0) {
                insLine = lineIdx;
                insCol = newInsCol;
            }
        }

        /**
         * Размечает символы строки; возвращает начало комментария (или длину строки).
         */
        private int classify(String line, byte[] cls) {
            int n = line.length();
            int i = 0;
            while (i < n) {
                char c = line.charAt(i);
                if (inString) {
                    if (c == '\\') {
                        cls[i] = STRING;
                        if (i + 1 < n) {
                            cls[i + 1] = STRING;
                        }
                        i += 2;
                        continue;
                    }
                    if (c == '"') {
                        cls[i] = STRING_END;
                        inString = false;
                    } else {
                        cls[i] = STRING;
                    }
                    i++;
                    continue;
                }
                if (c == ';' || (c == '#' && i + 1 < n && line.charAt(i + 1) == '!')) {
                    for (int j = i; j < n; j++) {
                        cls[j] = COMMENT;
                    }
                    return i;
                }
                if (c == '\\') {
                    // литерал символа: следующий символ не может быть скобкой или кавычкой
                    cls[i] = CODE;
                    if (i + 1 < n) {
                        cls[i + 1] = CODE;
                    }
                    i += 2;
                    continue;
                }
                if (c == '"') {
                    cls[i] = STRING;
                    inString = true;
                } else if (SexpReader.isWhitespace(c)) {
                    cls[i] = WS;
                } else if (SexpReader.isOpener(c)) {
                    cls[i] = OPENER;
                } else if (SexpReader.isCloser(c)) {
                    cls[i] = CLOSER;
                } else {
                    cls[i] = CODE;
                }
                i++;
            }
            return n;
        }

        /**
         * Закрывает открытые скобки с колонкой не меньше {@code column}, начиная с внутренней.
         */
        private void closeWhile(int column) {
            StringBuilder closers = new StringBuilder();
            while (!stack.isEmpty() && stack.peek().col() >= column) {
                closers.append(stack.pop().closer());
            }
            if (closers.length() == 0) {
                return;
            }
            out.get(insLine).insert(insCol, closers);
            insCol += closers.length();
            inserted += closers.length();
        }
    }
}
