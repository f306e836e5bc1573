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

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Тесты читателя без потерь: round trip, виды узлов, ошибки скобок и синтаксиса.
 */
class SexpReaderTest {

    // ==================== Round trip ====================

    @ParameterizedTest
    @ValueSource(strings = {
            "",
            "   \n\n",
            "(ns demo.core\n  (:require [clojure.string :as str]))\n",
            "(defn f [x] (+ x 1))",
            ";; header\n(def ^:private x 1) ; trailing\n\n\n(def y, 2)\n",
            "(defn ^{:doc \"d\"} g\n  \"docstring with ) and ( inside\"\n  [a & {:keys [b]}]\n  @(atom #{a b}))",
            "#?(:clj (defn now [] (System/currentTimeMillis))\n   :cljs (defn now [] (.now js/Date)))",
            "(let [re #\"\\d+\\\"\" c \\( s \"a\\\"b\"] [re c s])",
            "`(foo ~x ~@xs) '(1 2) #'var #_(ignored form) ##Inf",
            "#:user{:name \"n\"} #::{:a 1} #inst \"2024-01-01\" #uuid \"00000000-0000-0000-0000-000000000000\"",
            "#?@(:clj [1 2] :cljs [3])\r\n(f)\r\n",
            "#!/usr/bin/env bb\n(println (#(* % 2) 21))"
    })
    void testRoundTrip_SerializesBackByteForByte(String text) {
        SourceTree tree = SexpReader.parse(text);
        assertEquals(text, tree.toSource(), "Дерево должно сериализоваться в исходный текст без изменений");
    }

    // ==================== Виды узлов ====================

    @Nested
    class NodeKinds {

        @Test
        void testTopLevelFormsSkipTrivia() {
            SourceTree tree = SexpReader.parse(";; c\n(a) [b]\n{:c 1} #{d}");
            List<SexpNode> forms = tree.forms();
            assertEquals(4, forms.size());
            assertEquals(NodeKind.LIST, forms.get(0).kind());
            assertEquals(NodeKind.VECTOR, forms.get(1).kind());
            assertEquals(NodeKind.MAP, forms.get(2).kind());
            assertEquals(NodeKind.SET, forms.get(3).kind());
            assertEquals(NodeKind.COMMENT, tree.root().children().get(0).kind());
        }

        @Test
        void testAtomsAreClassified() {
            List<SexpNode> atoms = SexpReader.parse("(sym :kw 42 -7 \"s\" \\a #\"re\" ##NaN +)").forms().get(0).expressions();
            assertEquals(NodeKind.SYMBOL, atoms.get(0).kind());
            assertEquals(NodeKind.KEYWORD, atoms.get(1).kind());
            assertEquals(NodeKind.NUMBER, atoms.get(2).kind());
            assertEquals(NodeKind.NUMBER, atoms.get(3).kind());
            assertEquals(NodeKind.STRING, atoms.get(4).kind());
            assertEquals(NodeKind.CHARACTER, atoms.get(5).kind());
            assertEquals(NodeKind.REGEX, atoms.get(6).kind());
            assertEquals(NodeKind.SYMBOLIC_VALUE, atoms.get(7).kind());
            assertEquals(NodeKind.SYMBOL, atoms.get(8).kind(), "Одиночный плюс является символом");
        }

        @Test
        void testMetadataHoldsTwoOperands() {
            SexpNode meta = SexpReader.parse("^:private foo").forms().get(0);
            assertEquals(NodeKind.METADATA, meta.kind());
            List<SexpNode> parts = meta.expressions();
            assertEquals(2, parts.size());
            assertEquals(":private", parts.get(0).text());
            assertEquals("foo", parts.get(1).text());
        }

        @Test
        void testDiscardIsTrivia() {
            SourceTree tree = SexpReader.parse("(a #_b c)");
            List<SexpNode> exprs = tree.forms().get(0).expressions();
            assertEquals(2, exprs.size(), "#_ форма не участвует в структуре");
            assertEquals("c", exprs.get(1).text());
        }

        @Test
        void testReaderConditionalBranches() {
            SexpNode rc = SexpReader.parse("#?(:clj 1 :cljs 2)").forms().get(0);
            assertEquals(NodeKind.READER_CONDITIONAL, rc.kind());
            assertEquals(List.of("clj", "cljs"), rc.platformKeys());
            assertEquals("2", rc.branches().get(1).form().text());
        }

        @Test
        void testOffsetsAndPositions() {
            SourceTree tree = SexpReader.parse("(a)\n  (b c)");
            SexpNode second = tree.forms().get(1);
            assertEquals(6, second.start());
            assertEquals(11, second.end());
            assertEquals(new TextPosition(2, 3), tree.positionOf(second.start()));
            assertEquals(2, tree.lineOf(second.start()));
            assertEquals(2, tree.lineCount());
        }
    }

    // ==================== Структурное равенство ====================

    @Test
    void testStructuralEquality_IgnoresWhitespaceAndComments() {
        SexpNode a = SexpReader.parse("(+ x\n   ;; note\n   (* y 2))").forms().get(0);
        SexpNode b = SexpReader.parse("(+ x (* y 2))").forms().get(0);
        SexpNode c = SexpReader.parse("(+ x [* y 2])").forms().get(0);
        assertTrue(a.structurallyEquals(b));
        assertEquals(a.structuralHash(), b.structuralHash());
        assertFalse(a.structurallyEquals(c), "Тип скобок важен");
    }

    // ==================== Ошибки ====================

    @Nested
    class Errors {

        @Test
        void testUnclosedList() {
            DelimiterException e = assertThrows(DelimiterException.class, () -> SexpReader.parse("(defn f [x]\n  (+ x 1)"));
            assertEquals(DelimiterException.Problem.UNCLOSED, e.getProblem());
            assertEquals(0, e.getOffset(), "Указывается незакрытая скобка");
        }

        @Test
        void testUnmatchedClose() {
            DelimiterException e = assertThrows(DelimiterException.class, () -> SexpReader.parse("(a))"));
            assertEquals(DelimiterException.Problem.UNMATCHED_CLOSE, e.getProblem());
            assertEquals(3, e.getOffset());
        }

        @Test
        void testMismatchedClose() {
            DelimiterException e = assertThrows(DelimiterException.class, () -> SexpReader.parse("(let [x 1) x)"));
            assertEquals(DelimiterException.Problem.MISMATCHED_CLOSE, e.getProblem());
            assertEquals(new TextPosition(1, 10), e.getPosition());
            assertTrue(e.getDetail().contains("Expected ']'"), e.getDetail());
        }

        @Test
        void testUnterminatedStringIsNotADelimiterError() {
            SexpSyntaxException e = assertThrows(SexpSyntaxException.class, () -> SexpReader.parse("(str \"abc)"));
            assertFalse(e instanceof DelimiterException);
        }

        @Test
        void testPrefixWithoutOperandInsideCollectionIsUnclosed() {
            DelimiterException e = assertThrows(DelimiterException.class, () -> SexpReader.parse("(foo '"));
            assertEquals(DelimiterException.Problem.UNCLOSED, e.getProblem());
        }

        @Test
        void testPrefixBeforeCloserIsSyntaxError() {
            SexpSyntaxException e = assertThrows(SexpSyntaxException.class, () -> SexpReader.parse("(foo ')"));
            assertFalse(e instanceof DelimiterException);
        }

        @Test
        void testFragmentMustContainExpression() {
            assertThrows(SexpSyntaxException.class, () -> SexpReader.parseFragment("  ; only a comment\n"));
            assertEquals(1, SexpReader.parseFragment("(x)").forms().size());
        }
    }
}
