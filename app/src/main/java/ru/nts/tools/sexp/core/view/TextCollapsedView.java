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
package ru.nts.tools.sexp.core.view;

import ru.nts.tools.sexp.core.NtsParamException;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Свёрнутый вид для файлов, которые не являются исходниками: строки, совпавшие с шаблоном,
 * с контекстом вокруг. Близкие блоки сливаются, между блоками ставится "...".
 *
 * <pre>
 *   12   context
 *   13 > matching line
 *   14   context
 * ...
 *   80 > another match
 * </pre>
 */
public final class TextCollapsedView {

    public static final int DEFAULT_CONTEXT = 10;

    /** Блоки, между которыми не больше стольких строк, сливаются. */
    static final int MERGE_THRESHOLD = 20;

    private TextCollapsedView() {
    }

    /**
     * @param text        отрисованный вид
     * @param matchCount  число совпавших строк
     * @param totalLines  число строк в файле
     * @param blockCount  число блоков после слияния
     */
    public record Result(String text, int matchCount, int totalLines, int blockCount) {
    }

    private static final class Block {
        final int start;
        int end;
        final List<Integer> matches = new ArrayList<>();

        Block(int start, int end, int match) {
            this.start = start;
            this.end = end;
            matches.add(match);
        }
    }

    public static Result render(String content, String pattern) {
        return render(content, pattern, DEFAULT_CONTEXT, DEFAULT_CONTEXT);
    }

    /**
     * @throws NtsParamException шаблон пустой или не компилируется
     */
    public static Result render(String content, String pattern, int contextBefore, int contextAfter) {
        if (pattern == null || pattern.isBlank()) {
            throw NtsParamException.invalid("content_pattern", String.valueOf(pattern),
                    "Pattern is required for collapsed view of non-Clojure files");
        }
        Pattern compiled;
        try {
            compiled = Pattern.compile(pattern);
        } catch (PatternSyntaxException e) {
            throw NtsParamException.invalid("content_pattern", pattern, "invalid regex: " + e.getDescription());
        }

        List<String> lines = content.lines().toList();
        List<Block> blocks = new ArrayList<>();
        int matchCount = 0;
        for (int i = 0; i < lines.size(); i++) {
            if (!compiled.matcher(lines.get(i)).find()) {
                continue;
            }
            matchCount++;
            int start = Math.max(0, i - contextBefore);
            int end = Math.min(lines.size() - 1, i + contextAfter);
            Block last = blocks.isEmpty() ? null : blocks.get(blocks.size() - 1);
            if (last != null && last.end + MERGE_THRESHOLD >= start) {
                last.end = Math.max(last.end, end);
                last.matches.add(i);
            } else {
                blocks.add(new Block(start, end, i));
            }
        }

        if (matchCount == 0) {
            return new Result("No matches found for pattern: " + pattern, 0, lines.size(), 0);
        }

        StringBuilder sb = new StringBuilder();
        for (Block block : blocks) {
            if (sb.length() > 0) {
                sb.append("\n...\n");
            }
            for (int n = block.start; n <= block.end; n++) {
                if (n > block.start) {
                    sb.append('\n');
                }
                sb.append(String.format("%4d%s %s", n + 1, block.matches.contains(n) ? " >" : "  ", lines.get(n)));
            }
        }
        return new Result(sb.toString(), matchCount, lines.size(), blocks.size());
    }
}
