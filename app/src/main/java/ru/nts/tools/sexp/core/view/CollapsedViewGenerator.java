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
import ru.nts.tools.sexp.core.forms.DefinitionKind;
import ru.nts.tools.sexp.core.forms.FormLocator;
import ru.nts.tools.sexp.core.forms.TopLevelForm;
import ru.nts.tools.sexp.core.reader.NodeKind;
import ru.nts.tools.sexp.core.reader.SexpNode;
import ru.nts.tools.sexp.core.reader.SourceTree;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Свёрнутый вид исходника: каждая top-level форма показана сигнатурой,
 * формы, совпавшие с шаблонами, показаны целиком (точный срез исходника).
 *
 * Сигнатуры:
 * <pre>
 * (defn name [params] ...)
 * (defn name ([x] ...) ([x y] ...))
 * (defmethod name dispatch [params] ...)
 * (def name ...)
 * (ns name ...)
 * #?(:clj (defn name [x] ...) :cljs (defn name [x] ...))
 * </pre>
 * Имя defmethod сопоставляется с name_pattern вместе со значением диспетчеризации: "area :rectangle".
 */
public final class CollapsedViewGenerator {

    static final String ELIDED = "...";

    private CollapsedViewGenerator() {
    }

    /**
     * @param namePattern    regex для имён определений (find, не полное совпадение) или null
     * @param contentPattern regex для полного текста формы или null
     * @throws NtsParamException если шаблон не компилируется
     */
    public static CollapsedView render(SourceTree tree, String namePattern, String contentPattern) {
        Pattern byName = compile("name_pattern", namePattern);
        Pattern byContent = compile("content_pattern", contentPattern);

        List<SexpNode> forms = tree.forms();
        List<List<TopLevelForm>> groups = FormLocator.byTopLevelNode(tree);

        List<CollapsedView.Entry> entries = new ArrayList<>(forms.size());
        int expanded = 0;
        int matched = 0;
        for (int i = 0; i < forms.size(); i++) {
            SexpNode node = forms.get(i);
            List<TopLevelForm> group = groups.get(i);
            int line = tree.lineOf(node.start());

            boolean nameHit = byName != null && group.stream()
                    .anyMatch(f -> f.isNamed() && byName.matcher(f.displayName()).find());
            boolean contentHit = byContent != null && byContent.matcher(node.toSource()).find();

            if (nameHit || contentHit) {
                matched++;
                expanded++;
                entries.add(new CollapsedView.Entry(node.toSource(), true, line));
            } else {
                entries.add(new CollapsedView.Entry(collapse(node, group), false, line));
            }
        }

        StringBuilder text = new StringBuilder();
        for (CollapsedView.Entry entry : entries) {
            if (text.length() > 0) {
                text.append("\n\n");
            }
            text.append(entry.text());
        }
        ViewStats stats = new ViewStats(forms.size(), expanded, forms.size() - expanded, matched,
                byName == null ? null : namePattern, byContent == null ? null : contentPattern);
        return new CollapsedView(text.toString(), entries, stats);
    }

    /**
     * Сигнатура одной top-level формы.
     */
    static String collapse(SexpNode node, List<TopLevelForm> group) {
        if (node.kind().isReaderConditional()) {
            return conditionalSignature(node, group);
        }
        return signature(group.get(0));
    }

    private static String conditionalSignature(SexpNode node, List<TopLevelForm> group) {
        StringBuilder sb = new StringBuilder(node.open());
        boolean first = true;
        for (SexpNode.Branch branch : node.branches()) {
            if (!first) {
                sb.append(' ');
            }
            first = false;
            sb.append(':').append(branch.platform()).append(' ');
            SexpNode form = branch.form();
            if (node.kind() == NodeKind.READER_CONDITIONAL_SPLICING && form.kind() == NodeKind.VECTOR) {
                sb.append('[');
                boolean firstSpliced = true;
                for (SexpNode spliced : form.expressions()) {
                    if (!firstSpliced) {
                        sb.append(' ');
                    }
                    firstSpliced = false;
                    sb.append(signatureOf(spliced, group));
                }
                sb.append(']');
            } else {
                sb.append(signatureOf(form, group));
            }
        }
        return sb.append(node.close()).toString();
    }

    private static String signatureOf(SexpNode node, List<TopLevelForm> group) {
        for (TopLevelForm form : group) {
            if (form.node() == node) {
                return signature(form);
            }
        }
        return summary(node);
    }

    static String signature(TopLevelForm form) {
        SexpNode node = form.node();
        if (node.kind() != NodeKind.LIST || form.head() == null) {
            return summary(node);
        }
        StringBuilder sb = new StringBuilder("(").append(form.head());
        if (form.name() == null) {
            return sb.append(' ').append(ELIDED).append(')').toString();
        }
        sb.append(' ').append(form.name());

        List<SexpNode> exprs = node.expressions();
        int idx = 2;
        if (form.dispatchValue() != null) {
            sb.append(' ').append(oneLine(form.dispatchText()));
            idx = 3;
        }

        boolean callable = form.kind() == DefinitionKind.FUNCTION || form.kind() == DefinitionKind.DISPATCH_IMPLEMENTATION;
        if (callable) {
            // docstring и attr-map
            while (idx < exprs.size() && (exprs.get(idx).kind() == NodeKind.STRING || exprs.get(idx).kind() == NodeKind.MAP)
                    && idx < exprs.size() - 1) {
                idx++;
            }
        }
        if (idx < exprs.size() && form.kind() != DefinitionKind.VALUE_BINDING) {
            SexpNode next = exprs.get(idx);
            if (isParams(next)) {
                sb.append(' ').append(oneLine(next.toSource()));
            } else if (callable && next.kind() == NodeKind.LIST && isArity(next)) {
                for (int k = idx; k < exprs.size(); k++) {
                    SexpNode arity = exprs.get(k);
                    if (arity.kind() == NodeKind.LIST && isArity(arity)) {
                        sb.append(" (").append(oneLine(arity.head().toSource())).append(' ').append(ELIDED).append(')');
                    }
                }
                return sb.append(')').toString();
            }
        }
        return sb.append(' ').append(ELIDED).append(')').toString();
    }

    private static boolean isArity(SexpNode list) {
        SexpNode head = list.head();
        return head != null && isParams(head);
    }

    private static boolean isParams(SexpNode node) {
        if (node.kind() == NodeKind.VECTOR) {
            return true;
        }
        if (node.kind() == NodeKind.METADATA) {
            List<SexpNode> parts = node.expressions();
            return parts.get(parts.size() - 1).kind() == NodeKind.VECTOR;
        }
        return false;
    }

    /**
     * Форма без распознанной головы: однострочная показывается как есть, многострочная обрезается.
     */
    private static String summary(SexpNode node) {
        String source = node.toSource();
        int nl = source.indexOf('\n');
        if (nl < 0) {
            return source;
        }
        if (node.kind() == NodeKind.LIST && node.head() != null && node.head().kind().isAtom()) {
            return "(" + node.head().toSource() + " " + ELIDED + ")";
        }
        return source.substring(0, nl).stripTrailing() + " " + ELIDED;
    }

    private static String oneLine(String source) {
        return source.replaceAll("\\s*\\R\\s*", " ");
    }

    private static Pattern compile(String param, String regex) {
        if (regex == null || regex.isEmpty()) {
            return null;
        }
        try {
            return Pattern.compile(regex);
        } catch (PatternSyntaxException e) {
            throw NtsParamException.invalid(param, regex, "invalid regex: " + e.getDescription());
        }
    }
}
