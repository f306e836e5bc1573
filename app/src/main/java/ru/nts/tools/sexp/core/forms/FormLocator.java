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

import ru.nts.tools.sexp.core.NtsMatchException;
import ru.nts.tools.sexp.core.reader.NodeKind;
import ru.nts.tools.sexp.core.reader.SexpNode;
import ru.nts.tools.sexp.core.reader.SourceTree;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Поиск top-level определений.
 *
 * Правила в порядке приоритета; возвращается первый непустой уровень:
 * 1. точное имя и точный вид;
 * 2. точное имя, вид с учётом приватного варианта (defn ищет и defn-) и пространства имён головы;
 * 3. имя без пространства имён (foo/bar совпадает с bar и наоборот).
 * Значение диспетчеризации и платформа фильтруют кандидатов на всех уровнях;
 * значение диспетчеризации сравнивается структурно, не по тексту.
 *
 * Локатор никогда не выбирает одно из нескольких совпадений: решение принимает вызывающий.
 */
public final class FormLocator {

    private FormLocator() {
    }

    /**
     * Все top-level формы файла в порядке появления. Определения внутри reader conditional
     * перечисляются по одному на платформу.
     */
    public static List<TopLevelForm> definitions(SourceTree tree) {
        List<TopLevelForm> result = new ArrayList<>();
        for (List<TopLevelForm> group : byTopLevelNode(tree)) {
            result.addAll(group);
        }
        return result;
    }

    /**
     * Определения, сгруппированные по узлам корня: одна группа на каждую top-level форму.
     * Группа reader conditional содержит по определению на платформу.
     */
    public static List<List<TopLevelForm>> byTopLevelNode(SourceTree tree) {
        SexpNode root = tree.root();
        List<SexpNode> children = root.children();
        List<List<TopLevelForm>> groups = new ArrayList<>();
        for (int i = 0; i < children.size(); i++) {
            SexpNode child = children.get(i);
            if (child.isTrivia()) {
                continue;
            }
            String comments = leadingComments(children, i);
            List<TopLevelForm> result = new ArrayList<>();
            groups.add(result);
            if (child.kind().isReaderConditional()) {
                for (SexpNode.Branch branch : child.branches()) {
                    SexpNode form = branch.form();
                    if (child.kind() == NodeKind.READER_CONDITIONAL_SPLICING && form.kind() == NodeKind.VECTOR) {
                        for (SexpNode spliced : form.expressions()) {
                            if (spliced.kind() == NodeKind.LIST) {
                                result.add(analyze(spliced, form, branch.platform(), comments, tree.lineOf(spliced.start())));
                            }
                        }
                    } else if (form.kind() == NodeKind.LIST) {
                        result.add(analyze(form, child, branch.platform(), comments, tree.lineOf(form.start())));
                    }
                }
            }
            if (result.isEmpty()) {
                result.add(analyze(child, root, null, comments, tree.lineOf(child.start())));
            }
        }
        return groups;
    }

    /**
     * Все формы, подходящие под селектор (обычно ноль или одна).
     */
    public static List<TopLevelForm> find(SourceTree tree, FormSelector selector) {
        Optional<DefinitionKind> category = selector.category();
        Optional<SexpNode> dispatch = selector.dispatchNode();

        List<TopLevelForm> pool = new ArrayList<>();
        for (TopLevelForm form : definitions(tree)) {
            if (!form.isNamed()) {
                continue;
            }
            if (selector.platform() != null && !selector.platform().equals(form.platform())) {
                continue;
            }
            if (dispatch.isPresent()
                    && (form.dispatchValue() == null || !form.dispatchValue().structurallyEquals(dispatch.get()))) {
                continue;
            }
            pool.add(form);
        }

        String name = selector.name();
        String bare = DefinitionKind.bareName(name);
        List<Predicate<TopLevelForm>> tiers = List.of(
                f -> f.name().equals(name) && kindMatches(f, selector, category, true),
                f -> f.name().equals(name) && kindMatches(f, selector, category, false),
                f -> DefinitionKind.bareName(f.name()).equals(bare) && kindMatches(f, selector, category, false));

        for (Predicate<TopLevelForm> tier : tiers) {
            List<TopLevelForm> matches = pool.stream().filter(tier).toList();
            if (!matches.isEmpty()) {
                return matches;
            }
        }
        return List.of();
    }

    /**
     * Единственная форма под селектор.
     *
     * @throws NtsMatchException FORM_NOT_FOUND со списком всех определений файла или FORM_AMBIGUOUS со списком совпадений
     */
    public static TopLevelForm require(SourceTree tree, FormSelector selector, Path path) {
        List<TopLevelForm> matches = find(tree, selector);
        if (matches.isEmpty()) {
            List<String> available = definitions(tree).stream()
                    .filter(TopLevelForm::isNamed)
                    .map(TopLevelForm::describe)
                    .toList();
            throw NtsMatchException.formNotFound(path, selector.toString(), available);
        }
        if (matches.size() > 1) {
            throw NtsMatchException.formAmbiguous(path, selector.toString(),
                    matches.stream().map(TopLevelForm::describe).toList());
        }
        return matches.get(0);
    }

    private static boolean kindMatches(TopLevelForm form, FormSelector selector, Optional<DefinitionKind> category, boolean strict) {
        if (selector.kind() == null) {
            return true;
        }
        if (category.isPresent()) {
            return form.kind() == category.get();
        }
        String head = form.head();
        if (head == null) {
            return false;
        }
        if (strict) {
            return head.equals(selector.kind());
        }
        String bareHead = DefinitionKind.bareName(head);
        String bareKind = DefinitionKind.bareName(selector.kind());
        return bareHead.equals(bareKind) || bareHead.equals(bareKind + "-");
    }

    static TopLevelForm analyze(SexpNode node, SexpNode parent, String platform, String comments, int line) {
        String head = null;
        DefinitionKind kind = DefinitionKind.OTHER;
        String name = null;
        SexpNode dispatch = null;
        boolean privateForm = false;

        if (node.kind() == NodeKind.LIST) {
            List<SexpNode> exprs = node.expressions();
            if (!exprs.isEmpty() && exprs.get(0).kind() == NodeKind.SYMBOL) {
                head = exprs.get(0).text();
                kind = DefinitionKind.classify(head);
                String bareHead = DefinitionKind.bareName(head);
                boolean defining = bareHead.startsWith("def") || bareHead.equals("ns") || bareHead.startsWith("extend-");
                if (defining && exprs.size() > 1) {
                    SexpNode target = exprs.get(1);
                    boolean privateMeta = false;
                    while (target.kind() == NodeKind.METADATA) {
                        List<SexpNode> metaParts = target.expressions();
                        privateMeta |= isPrivateMeta(metaParts.get(0));
                        target = metaParts.get(metaParts.size() - 1);
                    }
                    if (target.kind() == NodeKind.SYMBOL || target.kind() == NodeKind.KEYWORD) {
                        name = target.text();
                    }
                    privateForm = bareHead.endsWith("-") || privateMeta;
                    if (kind == DefinitionKind.DISPATCH_IMPLEMENTATION && exprs.size() > 2) {
                        dispatch = exprs.get(2);
                    }
                }
            }
        }
        return new TopLevelForm(node, parent, head, kind, name, dispatch, privateForm, platform, comments, line);
    }

    private static boolean isPrivateMeta(SexpNode meta) {
        if (meta.kind() == NodeKind.KEYWORD) {
            return meta.text().equals(":private");
        }
        if (meta.kind() == NodeKind.MAP) {
            List<SexpNode> entries = meta.expressions();
            for (int i = 0; i + 1 < entries.size(); i += 2) {
                if (entries.get(i).text().equals(":private") && !entries.get(i + 1).text().equals("false")
                        && !entries.get(i + 1).text().equals("nil")) {
                    return true;
                }
            }
        }
        return false;
    }

    /**
     * Комментарии прямо над формой. Пустая строка разрывает блок; комментарий в конце строки
     * предыдущей формы принадлежит ей.
     */
    private static String leadingComments(List<SexpNode> children, int index) {
        List<String> comments = new ArrayList<>();
        for (int j = commentBlockStart(children, index); j < index; j++) {
            if (children.get(j).kind() == NodeKind.COMMENT) {
                comments.add(children.get(j).text());
            }
        }
        return String.join("\n", comments);
    }

    /**
     * Индекс первого комментария блока над формой; index, если блока нет.
     */
    private static int commentBlockStart(List<SexpNode> children, int index) {
        int start = index;
        int j = index - 1;
        while (j >= 0) {
            SexpNode node = children.get(j);
            if (node.kind() == NodeKind.WHITESPACE) {
                if (countNewlines(node.text()) > 1) {
                    break;
                }
                j--;
                continue;
            }
            if (node.kind() != NodeKind.COMMENT) {
                break;
            }
            if (j > 0) {
                SexpNode prev = children.get(j - 1);
                boolean sameLineAsForm = !prev.isTrivia()
                        || (prev.kind() == NodeKind.WHITESPACE && prev.text().indexOf('\n') < 0 && j > 1
                        && !children.get(j - 2).isTrivia());
                if (sameLineAsForm) {
                    break;
                }
            }
            start = j;
            j--;
        }
        return start;
    }

    /**
     * Форма вместе с блоком комментариев над ней; цель для вставки перед формой.
     * Для форм внутри reader conditional совпадает с {@link TopLevelForm#target()}.
     */
    public static EditTarget withLeadingComments(TopLevelForm form) {
        if (form.parent().kind() != NodeKind.ROOT) {
            return form.target();
        }
        List<SexpNode> children = form.parent().children();
        int index = -1;
        for (int i = 0; i < children.size(); i++) {
            if (children.get(i) == form.node()) {
                index = i;
                break;
            }
        }
        if (index < 0) {
            return form.target();
        }
        return new EditTarget(form.parent(), children.get(commentBlockStart(children, index)), form.node());
    }

    private static int countNewlines(String s) {
        int count = 0;
        for (int i = 0; i < s.length(); i++) {
            if (s.charAt(i) == '\n') {
                count++;
            }
        }
        return count;
    }
}
