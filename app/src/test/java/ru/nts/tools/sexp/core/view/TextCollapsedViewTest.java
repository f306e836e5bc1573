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

import org.junit.jupiter.api.Test;
import ru.nts.tools.sexp.core.NtsErrorCode;
import ru.nts.tools.sexp.core.NtsParamException;

import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

class TextCollapsedViewTest {

    private static String lines(int count) {
        return IntStream.rangeClosed(1, count).mapToObj(i -> "line " + i).collect(Collectors.joining("\n")) + "\n";
    }

    private static String withMarkers(int count, int... marked) {
        StringBuilder sb = new StringBuilder();
        for (int i = 1; i <= count; i++) {
            boolean hit = false;
            for (int m : marked) {
                hit |= m == i;
            }
            sb.append(hit ? "MARK " + i : "line " + i).append('\n');
        }
        return sb.toString();
    }

    @Test
    void testSingleMatchWithContext() {
        TextCollapsedView.Result result = TextCollapsedView.render(lines(100), "^line 50$");
        assertEquals(1, result.matchCount());
        assertEquals(100, result.totalLines());
        assertEquals(1, result.blockCount());

        String[] shown = result.text().split("\n");
        assertEquals(21, shown.length);
        assertEquals("  40   line 40", shown[0]);
        assertEquals("  50 > line 50", shown[10]);
        assertEquals("  60   line 60", shown[20]);
    }

    @Test
    void testContextIsClippedAtFileEdges() {
        TextCollapsedView.Result result = TextCollapsedView.render(lines(5), "line 1$");
        assertEquals("   1 > line 1\n   2   line 2\n   3   line 3\n   4   line 4\n   5   line 5", result.text());
    }

    @Test
    void testCloseBlocksAreMerged() {
        TextCollapsedView.Result result = TextCollapsedView.render(withMarkers(100, 11, 46), "MARK");
        assertEquals(2, result.matchCount());
        assertEquals(1, result.blockCount());
        assertFalse(result.text().contains("..."));
        assertTrue(result.text().contains("  11 > MARK 11"));
        assertTrue(result.text().contains("  46 > MARK 46"));
    }

    @Test
    void testDistantBlocksAreSeparated() {
        TextCollapsedView.Result result = TextCollapsedView.render(withMarkers(100, 11, 81), "MARK");
        assertEquals(2, result.blockCount());
        String[] blocks = result.text().split("\n\\.\\.\\.\n");
        assertEquals(2, blocks.length);
        assertTrue(blocks[0].endsWith("  21   line 21"));
        assertTrue(blocks[1].startsWith("  71   line 71"));
    }

    @Test
    void testCustomContext() {
        TextCollapsedView.Result result = TextCollapsedView.render(lines(10), "line 5$", 1, 2);
        assertEquals("   4   line 4\n   5 > line 5\n   6   line 6\n   7   line 7", result.text());
    }

    @Test
    void testNoMatches() {
        TextCollapsedView.Result result = TextCollapsedView.render(lines(3), "zzz");
        assertEquals("No matches found for pattern: zzz", result.text());
        assertEquals(0, result.matchCount());
        assertEquals(0, result.blockCount());
        assertEquals(3, result.totalLines());
    }

    @Test
    void testPatternIsRequired() {
        NtsParamException e = assertThrows(NtsParamException.class, () -> TextCollapsedView.render(lines(3), " "));
        assertEquals(NtsErrorCode.PARAM_INVALID, e.getCode());
        assertTrue(e.toUserMessage().contains("Pattern is required"));
    }

    @Test
    void testInvalidRegex() {
        NtsParamException e = assertThrows(NtsParamException.class, () -> TextCollapsedView.render(lines(3), "[oops"));
        assertTrue(e.toUserMessage().contains("invalid regex"));
    }
}
