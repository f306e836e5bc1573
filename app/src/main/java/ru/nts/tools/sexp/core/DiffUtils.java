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
package ru.nts.tools.sexp.core;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Генератор Unified Diff для отчёта о правке.
 * Построчное LCS-сравнение, обратный проход без рекурсии (исходники в тысячи строк не переполняют стек).
 */
public final class DiffUtils {

    public static final int DEFAULT_CONTEXT = 3;

    private DiffUtils() {
    }

    public static String unifiedDiff(String fileName, String oldContent, String newContent) {
        return unifiedDiff(fileName, oldContent, newContent, DEFAULT_CONTEXT);
    }

    /**
     * Генерирует Unified Diff между старым и новым контентом.
     *
     * @param fileName     имя файла для заголовков a/ и b/
     * @param contextLines сколько неизменённых строк показывать вокруг изменений
     * @return diff без завершающего перевода строки; пустая строка, если тексты совпадают
     */
    public static String unifiedDiff(String fileName, String oldContent, String newContent, int contextLines) {
        if (oldContent.equals(newContent)) {
            return "";
        }
        List<String> oldLines = splitLines(oldContent);
        List<String> newLines = splitLines(newContent);
        List<DiffLine> lines = computeDiff(oldLines, newLines);

        StringBuilder diff = new StringBuilder();
        diff.append("--- a/").append(fileName).append('\n');
        diff.append("+++ b/").append(fileName).append('\n');

        for (Hunk hunk : clusterIntoHunks(lines, contextLines)) {
            diff.append(String.format("@@ -%d,%d +%d,%d @@\n", hunk.oldStart, hunk.oldLen, hunk.newStart, hunk.newLen));
            for (DiffLine line : hunk.lines) {
                switch (line.type) {
                    case INSERT -> diff.append('+').append(line.text).append('\n');
                    case DELETE -> diff.append('-').append(line.text).append('\n');
                    case EQUAL -> diff.append(' ').append(line.text).append('\n');
                }
            }
        }
        // изменение только в финальном переводе строки не видно построчно
        if (oldContent.endsWith("\n") != newContent.endsWith("\n") && diff.indexOf("@@") < 0) {
            diff.append("\\ No newline at end of file\n");
        }
        int end = diff.length();
        while (end > 0 && diff.charAt(end - 1) == '\n') {
            end--;
        }
        return diff.substring(0, end);
    }

    /**
     * Количество добавленных и удалённых строк.
     */
    public static DiffStats stats(String oldContent, String newContent) {
        int added = 0;
        int removed = 0;
        for (DiffLine line : computeDiff(splitLines(oldContent), splitLines(newContent))) {
            if (line.type == DiffType.INSERT) added++;
            if (line.type == DiffType.DELETE) removed++;
        }
        return new DiffStats(added, removed);
    }

    public record DiffStats(int added, int removed) {
    }

    static List<String> splitLines(String content) {
        if (content.isEmpty()) {
            return List.of();
        }
        String body = content.endsWith("\n") ? content.substring(0, content.length() - 1) : content;
        return Arrays.asList(body.split("\n", -1));
    }

    private static List<DiffLine> computeDiff(List<String> a, List<String> b) {
        // Общие префикс и суффикс не нужны матрице
        int prefix = 0;
        while (prefix < a.size() && prefix < b.size() && a.get(prefix).equals(b.get(prefix))) {
            prefix++;
        }
        int suffix = 0;
        while (suffix < a.size() - prefix && suffix < b.size() - prefix
                && a.get(a.size() - 1 - suffix).equals(b.get(b.size() - 1 - suffix))) {
            suffix++;
        }

        List<DiffLine> result = new ArrayList<>();
        for (int k = 0; k < prefix; k++) {
            result.add(new DiffLine(DiffType.EQUAL, a.get(k)));
        }

        List<String> midA = a.subList(prefix, a.size() - suffix);
        List<String> midB = b.subList(prefix, b.size() - suffix);
        int[][] matrix = computeLCSMatrix(midA, midB);

        List<DiffLine> middle = new ArrayList<>();
        int i = midA.size();
        int j = midB.size();
        while (i > 0 || j > 0) {
            if (i > 0 && j > 0 && midA.get(i - 1).equals(midB.get(j - 1))) {
                middle.add(new DiffLine(DiffType.EQUAL, midA.get(i - 1)));
                i--;
                j--;
            } else if (j > 0 && (i == 0 || matrix[i][j - 1] >= matrix[i - 1][j])) {
                middle.add(new DiffLine(DiffType.INSERT, midB.get(j - 1)));
                j--;
            } else {
                middle.add(new DiffLine(DiffType.DELETE, midA.get(i - 1)));
                i--;
            }
        }
        Collections.reverse(middle);
        result.addAll(middle);

        for (int k = a.size() - suffix; k < a.size(); k++) {
            result.add(new DiffLine(DiffType.EQUAL, a.get(k)));
        }
        return result;
    }

    private static int[][] computeLCSMatrix(List<String> a, List<String> b) {
        int[][] matrix = new int[a.size() + 1][b.size() + 1];
        for (int i = 1; i <= a.size(); i++) {
            for (int j = 1; j <= b.size(); j++) {
                if (a.get(i - 1).equals(b.get(j - 1))) {
                    matrix[i][j] = matrix[i - 1][j - 1] + 1;
                } else {
                    matrix[i][j] = Math.max(matrix[i - 1][j], matrix[i][j - 1]);
                }
            }
        }
        return matrix;
    }

    private static List<Hunk> clusterIntoHunks(List<DiffLine> lines, int context) {
        List<Hunk> hunks = new ArrayList<>();
        int index = 0;
        while (index < lines.size()) {
            if (lines.get(index).type == DiffType.EQUAL) {
                index++;
                continue;
            }
            int from = Math.max(0, index - context);
            int to = index;
            // расширяем, пока следующий блок изменений ближе 2*context строк
            int cursor = index;
            while (cursor < lines.size()) {
                if (lines.get(cursor).type != DiffType.EQUAL) {
                    to = cursor;
                    cursor++;
                    continue;
                }
                int gapEnd = cursor;
                while (gapEnd < lines.size() && lines.get(gapEnd).type == DiffType.EQUAL) {
                    gapEnd++;
                }
                if (gapEnd < lines.size() && gapEnd - cursor <= 2 * context) {
                    cursor = gapEnd;
                } else {
                    break;
                }
            }
            int until = Math.min(lines.size() - 1, to + context);
            hunks.add(buildHunk(lines, from, until));
            index = until + 1;
        }
        return hunks;
    }

    private static Hunk buildHunk(List<DiffLine> lines, int from, int until) {
        Hunk hunk = new Hunk();
        int oldPos = 1;
        int newPos = 1;
        for (int k = 0; k < from; k++) {
            if (lines.get(k).type != DiffType.INSERT) oldPos++;
            if (lines.get(k).type != DiffType.DELETE) newPos++;
        }
        for (int k = from; k <= until; k++) {
            DiffLine line = lines.get(k);
            hunk.lines.add(line);
            if (line.type != DiffType.INSERT) hunk.oldLen++;
            if (line.type != DiffType.DELETE) hunk.newLen++;
        }
        // Пустая сторона hunk'а ссылается на строку перед ним
        hunk.oldStart = hunk.oldLen == 0 ? oldPos - 1 : oldPos;
        hunk.newStart = hunk.newLen == 0 ? newPos - 1 : newPos;
        return hunk;
    }

    private enum DiffType {EQUAL, INSERT, DELETE}

    private record DiffLine(DiffType type, String text) {
    }

    private static class Hunk {
        int oldStart, oldLen, newStart, newLen;
        List<DiffLine> lines = new ArrayList<>();
    }
}
