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

import org.junit.jupiter.api.Test;

import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

class DiffUtilsTest {

    @Test
    void testIdenticalTextGivesEmptyDiff() {
        assertEquals("", DiffUtils.unifiedDiff("core.clj", "(def x 1)\n", "(def x 1)\n"));
    }

    @Test
    void testSingleLineChange() {
        String diff = DiffUtils.unifiedDiff("core.clj", "a\nb\nc\n", "a\nB\nc\n");
        assertEquals("--- a/core.clj\n+++ b/core.clj\n@@ -1,3 +1,3 @@\n a\n-b\n+B\n c", diff);
    }

    @Test
    void testDistantChangesMakeSeparateHunks() {
        String before = IntStream.rangeClosed(1, 10).mapToObj(i -> "l" + i).collect(Collectors.joining("\n"));
        String after = before.replace("l2\n", "X\n").replace("l9\n", "Y\n");

        String diff = DiffUtils.unifiedDiff("f.clj", before, after, 1);

        assertTrue(diff.contains("@@ -1,3 +1,3 @@\n l1\n-l2\n+X\n l3\n"), diff);
        assertTrue(diff.contains("@@ -8,3 +8,3 @@\n l8\n-l9\n+Y\n l10"), diff);
        assertFalse(diff.contains(" l5"), "Строки вне контекста не показываются");
    }

    @Test
    void testInsertionIntoEmptyFile() {
        assertEquals("--- a/f.clj\n+++ b/f.clj\n@@ -0,0 +1,1 @@\n+(ns a)", DiffUtils.unifiedDiff("f.clj", "", "(ns a)\n"));
    }

    @Test
    void testOnlyFinalNewlineChanged() {
        String diff = DiffUtils.unifiedDiff("f.clj", "(ns a)", "(ns a)\n");
        assertTrue(diff.endsWith("\\ No newline at end of file"), diff);
    }

    @Test
    void testStats() {
        DiffUtils.DiffStats stats = DiffUtils.stats("a\nb\nc\n", "a\nB\nc\nd\n");
        assertEquals(2, stats.added());
        assertEquals(1, stats.removed());
    }
}
