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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Разобранный текст: исходная строка и корневой узел.
 */
public final class SourceTree {

    private final String text;
    private final SexpNode root;
    private int[] lineStarts;

    public SourceTree(String text, SexpNode root) {
        this.text = text;
        this.root = root;
    }

    public String text() {
        return text;
    }

    public SexpNode root() {
        return root;
    }

    /**
     * Top-level формы без trivia.
     */
    public List<SexpNode> forms() {
        return root.expressions();
    }

    /**
     * Сериализация дерева. Без правок совпадает с {@link #text()}.
     */
    public String toSource() {
        return root.toSource();
    }

    public TextPosition positionOf(int offset) {
        int[] starts = lineStarts();
        int idx = Arrays.binarySearch(starts, offset);
        int line = idx >= 0 ? idx : -idx - 2;
        return new TextPosition(line + 1, offset - starts[line] + 1);
    }

    /**
     * Номер строки (с 1) для смещения.
     */
    public int lineOf(int offset) {
        return positionOf(offset).line();
    }

    public int lineCount() {
        return lineStarts().length;
    }

    private int[] lineStarts() {
        if (lineStarts == null) {
            List<Integer> starts = new ArrayList<>();
            starts.add(0);
            for (int i = 0; i < text.length(); i++) {
                if (text.charAt(i) == '\n') {
                    starts.add(i + 1);
                }
            }
            int[] arr = new int[starts.size()];
            for (int i = 0; i < arr.length; i++) {
                arr[i] = starts.get(i);
            }
            lineStarts = arr;
        }
        return lineStarts;
    }
}
