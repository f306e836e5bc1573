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
import java.util.List;

/**
 * Узел дерева исходника без потерь.
 *
 * Каждый символ исходного текста принадлежит ровно одному узлу: пробелы и комментарии хранятся
 * как обычные дочерние узлы, атомы хранят точный срез текста, составные узлы хранят открывающий
 * и закрывающий разделитель явно. Поэтому {@link #toSource()} корня воспроизводит файл байт в байт.
 *
 * Узлы неизменяемы. Правка строит новое дерево: узлы, собранные заново, получают смещения -1,
 * нетронутые поддеревья переиспользуются как есть.
 */
public final class SexpNode {

    /**
     * Ветка reader conditional: ключ платформы и выбранная для неё форма.
     */
    public record Branch(String platform, SexpNode form) {
    }

    private final NodeKind kind;
    private final String text;
    private final String open;
    private final String close;
    private final List<SexpNode> children;
    private final int start;
    private final int end;

    private String source;

    private SexpNode(NodeKind kind, String text, String open, String close, List<SexpNode> children, int start, int end) {
        this.kind = kind;
        this.text = text;
        this.open = open;
        this.close = close;
        this.children = children;
        this.start = start;
        this.end = end;
    }

    /**
     * Атом или trivia-узел с точным срезом исходника. {@code start < 0} создаёт узел без привязки к тексту.
     */
    public static SexpNode leaf(NodeKind kind, String text, int start) {
        if (kind.isComposite()) {
            throw new IllegalArgumentException("Not a leaf kind: " + kind);
        }
        return new SexpNode(kind, text, "", "", List.of(), start, start < 0 ? -1 : start + text.length());
    }

    /**
     * Составной узел. Для префиксных форм {@code close} пустой.
     */
    public static SexpNode composite(NodeKind kind, String open, List<SexpNode> children, String close, int start, int end) {
        if (!kind.isComposite()) {
            throw new IllegalArgumentException("Not a composite kind: " + kind);
        }
        return new SexpNode(kind, "", open, close, List.copyOf(children), start, end);
    }

    public NodeKind kind() {
        return kind;
    }

    /** Текст атома; пустая строка для составных узлов. */
    public String text() {
        return text;
    }

    /** Открывающий разделитель или префикс: "(", "#{", "#?(", "'", "^"... */
    public String open() {
        return open;
    }

    /** Закрывающий разделитель; пустой у префиксных форм и корня. */
    public String close() {
        return close;
    }

    /** Все дочерние узлы, включая trivia. */
    public List<SexpNode> children() {
        return children;
    }

    /** Смещение начала в исходном тексте или -1 для пересобранного узла. */
    public int start() {
        return start;
    }

    public int end() {
        return end;
    }

    public boolean isDetached() {
        return start < 0;
    }

    public boolean isTrivia() {
        return kind.isTrivia();
    }

    /**
     * Значимые дочерние узлы: без пробелов, комментариев и #_ форм.
     */
    public List<SexpNode> expressions() {
        if (children.isEmpty()) {
            return List.of();
        }
        List<SexpNode> result = new ArrayList<>(children.size());
        for (SexpNode child : children) {
            if (!child.isTrivia()) {
                result.add(child);
            }
        }
        return result;
    }

    /**
     * Первый значимый дочерний узел или null.
     */
    public SexpNode head() {
        for (SexpNode child : children) {
            if (!child.isTrivia()) {
                return child;
            }
        }
        return null;
    }

    /**
     * Текст узла в точности как в исходнике (или как после правки).
     */
    public String toSource() {
        if (source == null) {
            if (!kind.isComposite()) {
                source = text;
            } else {
                StringBuilder sb = new StringBuilder();
                appendSource(sb);
                source = sb.toString();
            }
        }
        return source;
    }

    private void appendSource(StringBuilder sb) {
        if (!kind.isComposite()) {
            sb.append(text);
            return;
        }
        sb.append(open);
        for (SexpNode child : children) {
            child.appendSource(sb);
        }
        sb.append(close);
    }

    /**
     * Тот же узел с другими дочерними узлами. Результат не привязан к исходным смещениям.
     */
    public SexpNode withChildren(List<SexpNode> newChildren) {
        if (!kind.isComposite()) {
            throw new IllegalStateException("Leaf node has no children: " + kind);
        }
        return new SexpNode(kind, "", open, close, List.copyOf(newChildren), -1, -1);
    }

    /**
     * Ветки reader conditional: пары (ключ платформы, форма). Для остальных узлов пусто.
     */
    public List<Branch> branches() {
        if (!kind.isReaderConditional()) {
            return List.of();
        }
        List<SexpNode> exprs = expressions();
        List<Branch> result = new ArrayList<>();
        for (int i = 0; i + 1 < exprs.size(); i += 2) {
            SexpNode key = exprs.get(i);
            if (key.kind() == NodeKind.KEYWORD) {
                result.add(new Branch(key.text().substring(1), exprs.get(i + 1)));
            }
        }
        return result;
    }

    /**
     * Ключи платформ reader conditional без двоеточия: "clj", "cljs", "default".
     */
    public List<String> platformKeys() {
        List<String> keys = new ArrayList<>();
        for (Branch branch : branches()) {
            keys.add(branch.platform());
        }
        return keys;
    }

    /**
     * Структурное равенство: вид узла, разделители и текст атомов совпадают,
     * значимые дочерние узлы рекурсивно равны. Пробелы, переводы строк и комментарии игнорируются.
     */
    public boolean structurallyEquals(SexpNode other) {
        if (this == other) {
            return true;
        }
        if (other == null || kind != other.kind) {
            return false;
        }
        if (!kind.isComposite()) {
            return text.equals(other.text);
        }
        if (!open.equals(other.open) || !close.equals(other.close)) {
            return false;
        }
        List<SexpNode> mine = expressions();
        List<SexpNode> theirs = other.expressions();
        if (mine.size() != theirs.size()) {
            return false;
        }
        for (int i = 0; i < mine.size(); i++) {
            if (!mine.get(i).structurallyEquals(theirs.get(i))) {
                return false;
            }
        }
        return true;
    }

    /**
     * Хеш, согласованный со {@link #structurallyEquals(SexpNode)}.
     */
    public int structuralHash() {
        int h = kind.hashCode();
        if (!kind.isComposite()) {
            return 31 * h + text.hashCode();
        }
        h = 31 * h + open.hashCode();
        for (SexpNode child : children) {
            if (!child.isTrivia()) {
                h = 31 * h + child.structuralHash();
            }
        }
        return h;
    }

    @Override
    public String toString() {
        String src = toSource();
        if (src.length() > 60) {
            src = src.substring(0, 57) + "...";
        }
        return kind + "[" + start + ".." + end + "] " + src;
    }
}
