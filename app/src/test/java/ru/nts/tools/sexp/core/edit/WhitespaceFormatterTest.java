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
package ru.nts.tools.sexp.core.edit;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class WhitespaceFormatterTest {

    private final WhitespaceFormatter formatter = new WhitespaceFormatter();

    @Test
    void testTrailingSpacesAndTabsRemoved() {
        assertEquals("(defn f [x]\n  x)\n", formatter.format("(defn f [x]  \t\n  x)   \n"));
    }

    @Test
    void testCrLfLineEndingsKept() {
        assertEquals("(a)\r\n(b)\r\n", formatter.format("(a)  \r\n(b)\t\r\n"));
    }

    @Test
    void testMultiLineStringKeptVerbatim() {
        String text = "(def s \"line one   \n  line two\t\n\")\n";
        assertEquals(text, formatter.format(text));
    }

    @Test
    void testEscapedQuoteInsideString() {
        String text = "(def s \"say \\\"hi\\\"   \n\")  \n";
        assertEquals("(def s \"say \\\"hi\\\"   \n\")\n", formatter.format(text));
    }

    @Test
    void testCharacterLiteralQuoteDoesNotOpenString() {
        assertEquals("(= c \\\")\n(def y 1)\n", formatter.format("(= c \\\")   \n(def y 1)  \n"));
    }

    @Test
    void testQuoteInsideCommentDoesNotOpenString() {
        assertEquals("; don't \"quote\n(def y 1)\n", formatter.format("; don't \"quote   \n(def y 1) \n"));
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "(a)", "(a b)\n", "(a\n  b)\n", "(str \"  \")\n"})
    void testCleanTextIsUnchanged(String text) {
        assertEquals(text, formatter.format(text));
    }

    @Test
    void testNoneFormatterIsIdentity() {
        String text = "(a)   \n";
        assertSame(text, CodeFormatter.NONE.format(text));
    }
}
