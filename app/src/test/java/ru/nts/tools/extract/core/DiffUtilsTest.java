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
package ru.nts.tools.extract.core;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DiffUtilsTest {

    @Test
    void identicalTextsGiveEmptyDiff() {
        assertEquals("", DiffUtils.getUnifiedDiff("a.js", "x\ny\n", "x\ny\n"));
    }

    @Test
    void insertionProducesSingleHunk() {
        String diff = DiffUtils.getUnifiedDiff("a.js", "a\nb\nc\n", "a\nb\nnew\nc\n");

        assertTrue(diff.startsWith("--- a.js (original)\n+++ a.js (modified)\n"), diff);
        assertTrue(diff.contains("@@ -1,4 +1,5 @@"), diff);
        assertTrue(diff.contains("\n+new\n"), diff);
        assertFalse(diff.contains("\n-"), diff);
    }

    @Test
    void distantChangesProduceSeparateHunks() {
        StringBuilder oldText = new StringBuilder();
        for (int i = 0; i < 20; i++) {
            oldText.append("line").append(i).append('\n');
        }
        String newText = oldText.toString().replace("line1\n", "first\n").replace("line18\n", "last\n");

        String diff = DiffUtils.getUnifiedDiff("a.js", oldText.toString(), newText);

        assertEquals(2, diff.split("\n@@ -", -1).length - 1, diff);
        assertTrue(diff.contains("-line1\n+first"), diff);
        assertTrue(diff.contains("-line18\n+last"), diff);
    }
}
