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
import ru.nts.tools.sexp.core.reader.SourceTree;

import java.util.ArrayList;
import java.util.List;

/**
 * Построение нового дерева с заменёнными, вставленными или удалёнными узлами.
 *
 * Цели ищутся по ссылке на узел, поэтому работают только с деревом, из которого они получены.
 * Пересобираются лишь узлы на пути от корня к целям; пробелы и комментарии вокруг целей не трогаются.
 *
 * Разделитель при вставке: пустая строка между top-level формами; перевод строки с отступом цели,
 * если цель начинает свою строку; иначе пробел.
 *
 * Если фрагмент кончается комментарием, а цель последняя в списке, закрывающая скобка родителя
 * переносится на новую строку с отступом строки, где родитель открывается.
 */
public final class TreeEditor {

    /**
     * @param root    новый корень
     * @param applied сколько целей найдено и обработано
     */
    public record Result(SexpNode root, int applied) {
    }

    private final List<EditTarget> targets;
    private final EditOperation operation;
    private final List<SexpNode> content;
    private final String source;
    private int applied;

    private TreeEditor(List<EditTarget> targets, EditOperation operation, List<SexpNode> content, String source) {
        this.targets = targets;
        this.source = source;
        this.operation = operation;
        this.content = content;
    }

    /**
     * Применяет операцию ко всем целям.
     *
     * @param fragment разобранный новый текст; null или пустой фрагмент с REPLACE удаляет цели
     */
    public static Result apply(SexpNode root, List<EditTarget> targets, EditOperation operation, SourceTree fragment) {
        List<SexpNode> content = fragment == null ? List.of() : trim(fragment.root().children());
        if (content.isEmpty() && operation != EditOperation.REPLACE) {
            throw new IllegalArgumentException("Nothing to insert");
        }
        TreeEditor editor = new TreeEditor(targets, operation, content, root.toSource());
        SexpNode newRoot = editor.rebuild(root);
        return new Result(newRoot, editor.applied);
    }

    private SexpNode rebuild(SexpNode node) {
        if (!node.kind().isComposite()) {
            return node;
        }
        List<SexpNode> children = node.children();
        List<SexpNode> rebuilt = new ArrayList<>(children.size() + 4);
        boolean changed = false;

        int i = 0;
        while (i < children.size()) {
            SexpNode child = children.get(i);
            EditTarget target = targetStartingAt(node, child);
            if (target == null) {
                SexpNode updated = rebuild(child);
                changed |= updated != child;
                rebuilt.add(updated);
                i++;
                continue;
            }

            int lastIdx = indexOf(children, target.last(), i);
            if (lastIdx < 0) {
                throw new IllegalStateException("Edit target is not a contiguous run of siblings");
            }
            List<SexpNode> original = children.subList(i, lastIdx + 1);
            SexpNode next = lastIdx + 1 < children.size() ? children.get(lastIdx + 1) : null;
            String separator = separator(node, children, i);

            switch (operation) {
                case REPLACE -> {
                    if (content.isEmpty()) {
                        // удаление: убираем один из пробельных узлов вокруг цели
                        boolean prevWs = !rebuilt.isEmpty() && rebuilt.get(rebuilt.size() - 1).kind() == NodeKind.WHITESPACE;
                        boolean nextWs = next != null && next.kind() == NodeKind.WHITESPACE;
                        if (prevWs && (nextWs || next == null)) {
                            rebuilt.remove(rebuilt.size() - 1);
                        } else if (rebuilt.isEmpty() && nextWs) {
                            lastIdx++;
                        }
                    } else {
                        rebuilt.addAll(content);
                        if (endsWithComment() && !newlineFollows(node, next)) {
                            rebuilt.add(whitespace(lineBreakAfterComment(node, next)));
                        }
                    }
                }
                case INSERT_BEFORE -> {
                    rebuilt.addAll(content);
                    rebuilt.add(whitespace(endsWithComment() && separator.indexOf('\n') < 0 ? "\n" : separator));
                    rebuilt.addAll(original);
                }
                case INSERT_AFTER -> {
                    rebuilt.addAll(original);
                    rebuilt.add(whitespace(separator));
                    rebuilt.addAll(content);
                    if (endsWithComment() && !newlineFollows(node, next)) {
                        rebuilt.add(whitespace(lineBreakAfterComment(node, next)));
                    }
                }
            }
            applied++;
            changed = true;
            i = lastIdx + 1;
        }
        return changed ? node.withChildren(rebuilt) : node;
    }

    private EditTarget targetStartingAt(SexpNode parent, SexpNode child) {
        for (EditTarget target : targets) {
            if (target.parent() == parent && target.first() == child) {
                return target;
            }
        }
        return null;
    }

    private boolean endsWithComment() {
        return !content.isEmpty() && content.get(content.size() - 1).kind() == NodeKind.COMMENT;
    }

    /**
     * Следует ли за вставкой перевод строки; иначе комментарий в конце фрагмента поглотит следующий код.
     */
    private static boolean newlineFollows(SexpNode parent, SexpNode next) {
        if (next == null) {
            return parent.kind() == NodeKind.ROOT;
        }
        return next.kind() == NodeKind.WHITESPACE && next.text().indexOf('\n') >= 0;
    }

    /**
     * Перевод строки после комментария; перед закрывающей скобкой с отступом строки родителя.
     */
    private String lineBreakAfterComment(SexpNode parent, SexpNode next) {
        if (next != null || parent.start() < 0) {
            return "\n";
        }
        int lineStart = source.lastIndexOf('\n', parent.start() - 1) + 1;
        int end = lineStart;
        while (end < parent.start() && (source.charAt(end) == ' ' || source.charAt(end) == '\t')) {
            end++;
        }
        return "\n" + source.substring(lineStart, end);
    }

    private static String separator(SexpNode parent, List<SexpNode> children, int index) {
        if (parent.kind() == NodeKind.ROOT) {
            return "\n\n";
        }
        if (index > 0) {
            SexpNode prev = children.get(index - 1);
            int nl = prev.kind() == NodeKind.WHITESPACE ? prev.text().lastIndexOf('\n') : -1;
            if (nl >= 0) {
                return "\n" + prev.text().substring(nl + 1);
            }
        }
        return " ";
    }

    private static int indexOf(List<SexpNode> children, SexpNode node, int from) {
        for (int i = from; i < children.size(); i++) {
            if (children.get(i) == node) {
                return i;
            }
        }
        return -1;
    }

    private static List<SexpNode> trim(List<SexpNode> nodes) {
        int from = 0;
        int to = nodes.size();
        while (from < to && nodes.get(from).kind() == NodeKind.WHITESPACE) {
            from++;
        }
        while (to > from && nodes.get(to - 1).kind() == NodeKind.WHITESPACE) {
            to--;
        }
        return nodes.subList(from, to);
    }

    private static SexpNode whitespace(String text) {
        return SexpNode.leaf(NodeKind.WHITESPACE, text, -1);
    }
}
