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

import ru.nts.tools.sexp.core.reader.NodeKind;
import ru.nts.tools.sexp.core.reader.SexpNode;
import ru.nts.tools.sexp.core.reader.SexpReader;
import ru.nts.tools.sexp.core.reader.SourceTree;

import java.util.ArrayList;
import java.util.List;

/**
 * Поиск подвыражений по структурному равенству.
 *
 * Фрагмент из нескольких выражений совпадает только с непрерывным рядом соседних узлов в том же порядке.
 * Вхождения возвращаются в порядке обхода в глубину: внешние раньше вложенных, левые раньше правых.
 * Содержимое строк и #_ форм не просматривается.
 */
public final class ExpressionMatcher {

    private ExpressionMatcher() {
    }

    /**
     * @param fragmentText одно или несколько полных выражений
     * @throws ru.nts.tools.sexp.core.reader.SexpSyntaxException если фрагмент не читается или пуст
     */
    public static List<Occurrence> findAll(SourceTree tree, String fragmentText) {
        return findAll(tree, SexpReader.parseFragment(fragmentText));
    }

    public static List<Occurrence> findAll(SourceTree tree, SourceTree fragment) {
        List<SexpNode> pattern = fragment.forms();
        if (pattern.isEmpty()) {
            return List.of();
        }
        List<Occurrence> result = new ArrayList<>();
        walk(tree, tree.root(), pattern, null, result);
        return result;
    }

    /**
     * Есть ли среди вхождений пересекающиеся (вложенные или наложенные ряды).
     */
    public static boolean hasOverlaps(List<Occurrence> occurrences) {
        for (int i = 0; i < occurrences.size(); i++) {
            for (int j = i + 1; j < occurrences.size(); j++) {
                if (occurrences.get(i).overlaps(occurrences.get(j))) {
                    return true;
                }
            }
        }
        return false;
    }

    private static void walk(SourceTree tree, SexpNode node, List<SexpNode> pattern, String platform, List<Occurrence> out) {
        if (!node.kind().isComposite() || node.isTrivia()) {
            return;
        }
        List<SexpNode> exprs = node.expressions();
        boolean conditional = node.kind().isReaderConditional();
        for (int i = 0; i < exprs.size(); i++) {
            String childPlatform = platform;
            if (conditional && i % 2 == 1 && exprs.get(i - 1).kind() == NodeKind.KEYWORD) {
                childPlatform = exprs.get(i - 1).text().substring(1);
            }
            if (matchesAt(exprs, i, pattern)) {
                SexpNode first = exprs.get(i);
                SexpNode last = exprs.get(i + pattern.size() - 1);
                out.add(new Occurrence(new EditTarget(node, first, last), tree.positionOf(first.start()), childPlatform));
            }
            walk(tree, exprs.get(i), pattern, childPlatform, out);
        }
    }

    private static boolean matchesAt(List<SexpNode> exprs, int from, List<SexpNode> pattern) {
        if (from + pattern.size() > exprs.size()) {
            return false;
        }
        for (int k = 0; k < pattern.size(); k++) {
            if (!exprs.get(from + k).structurallyEquals(pattern.get(k))) {
                return false;
            }
        }
        return true;
    }
}
