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
package ru.nts.tools.extract.refactoring.extract;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import ru.nts.tools.extract.core.treesitter.SourceFile;
import ru.nts.tools.extract.core.treesitter.TextSpan;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Тесты проверки выделения: покрывающие узлы, переходы и признаки диапазона.
 */
class RangeValidatorTest {

    private static Optional<RangeToExtract> range(String content, String selection) {
        SourceFile file = SourceFile.parse(content, "javascript");
        int start = content.indexOf(selection);
        assertTrue(start >= 0, "selection not found: " + selection);
        return RangeValidator.getRangeToExtract(file, TextSpan.fromBounds(start, start + selection.length()));
    }

    // ==================== Shape ====================

    @Nested
    class Shape {

        @Test
        void singleExpression() {
            RangeToExtract range = range("const s = a + b;\n", "a + b").orElseThrow();

            assertTrue(range.expression());
            assertEquals(1, range.nodes().size());
            assertEquals("binary_expression", range.firstNode().getType());
            assertEquals(RangeFacts.NONE, range.facts());
        }

        @Test
        void statementSequence() {
            String content = "function f() {\n    a();\n    b();\n    c();\n}\n";
            RangeToExtract range = range(content, "a();\n    b();").orElseThrow();

            assertFalse(range.expression());
            assertEquals(2, range.nodes().size());
            assertEquals("a();", range.firstNode().getText());
            assertEquals("b();", range.lastNode().getText());
        }

        @Test
        void surroundingWhitespaceIsIgnored() {
            String content = "function f() {\n    a();\n    b();\n}\n";
            int start = content.indexOf("    a();");
            int end = content.indexOf("b();") + "b();".length() + 1;
            SourceFile file = SourceFile.parse(content, "javascript");

            Optional<RangeToExtract> range = RangeValidator.getRangeToExtract(file, TextSpan.fromBounds(start, end));

            assertTrue(range.isPresent());
            assertEquals(2, range.get().nodes().size());
        }

        @Test
        void partialNodeIsRejected() {
            assertTrue(range("const s = a + b;\n", "a +").isEmpty());
        }

        @Test
        void selectionAcrossBlocksIsRejected() {
            String content = "if (x) {\n    a();\n}\nb();\n";
            assertTrue(range(content, "a();\n}\nb();").isEmpty());
        }

        @Test
        void emptySelectionIsRejected() {
            SourceFile file = SourceFile.parse("a();", "javascript");
            assertTrue(RangeValidator.getRangeToExtract(file, TextSpan.empty(1)).isEmpty());
        }

        @Test
        void enclosingTextRangeCoversAllNodes() {
            String content = "function f() {\n    a();\n    b();\n}\n";
            RangeToExtract range = range(content, "a();\n    b();").orElseThrow();

            TextSpan span = range.enclosingTextRange();
            assertEquals(content.indexOf("a();"), span.start());
            assertEquals(content.indexOf("b();") + 4, span.end());
        }
    }

    // ==================== Jumps ====================

    @Nested
    class Jumps {

        @Test
        void bareBreakInsideLoopFails() {
            assertTrue(range("for (;;) {\n    break;\n}\n", "break;").isEmpty());
        }

        @Test
        void wholeLoopWithBreakSucceeds() {
            RangeToExtract range = range("for (;;) {\n    break;\n}\n", "for (;;) {\n    break;\n}").orElseThrow();

            assertFalse(range.facts().hasReturn());
            assertFalse(range.expression());
        }

        @Test
        void continueInsideSelectedLoopSucceeds() {
            String content = "function f(xs) {\n    for (const x of xs) {\n        use(x);\n        continue;\n    }\n}\n";
            assertTrue(range(content, "for (const x of xs) {\n        use(x);\n        continue;\n    }").isPresent());
        }

        @Test
        void jumpInsideConditionalBranchFails() {
            String content = "function f(xs) {\n    for (const x of xs) {\n        if (x) continue;\n    }\n}\n";
            assertTrue(range(content, "for (const x of xs) {\n        if (x) continue;\n    }").isEmpty());
        }

        @Test
        void breakInsideSelectedSwitchSucceeds() {
            String content = "switch (k) {\n    case 1:\n        a();\n        break;\n    default:\n        break;\n}\n";
            assertTrue(range(content, content.trim()).isPresent());
        }

        @Test
        void continueInsideSwitchWithoutLoopFails() {
            String content = "function f(xs) {\n    for (const x of xs) {\n        switch (x) {\n            case 1:\n                continue;\n        }\n    }\n}\n";
            assertTrue(range(content, "switch (x) {\n            case 1:\n                continue;\n        }").isEmpty());
        }

        @Test
        void returnAtFunctionLevelSetsHasReturn() {
            RangeToExtract range = range("function f() {\n    return 1;\n}\n", "return 1;").orElseThrow();

            assertTrue(range.facts().hasReturn());
        }

        @Test
        void returnInsideTryBlockFails() {
            String content = "function f() {\n    try {\n        return 1;\n    } finally {\n        cleanup();\n    }\n}\n";
            assertTrue(range(content, "return 1;").isEmpty());
        }

        @Test
        void returnInsideFinallySucceeds() {
            String content = "function f() {\n    try {\n        a();\n    } finally {\n        return 2;\n    }\n}\n";
            RangeToExtract range = range(content, "return 2;").orElseThrow();

            assertTrue(range.facts().hasReturn());
        }

        @Test
        void returnInsideSelectedIfBranchFails() {
            // ветки if внутри выделения сбрасывают разрешенные переходы
            String content = "function f(c) {\n    if (c) {\n        return 1;\n    }\n    return 2;\n}\n";
            assertTrue(range(content, "if (c) {\n        return 1;\n    }").isEmpty());
        }

        @Test
        void returnSelectedInsideIfBranchFails() {
            // на границе действует то же правило, что и внутри: ближайшая ветка if запрещает return
            String content = "function f(c) {\n    if (c) {\n        return 1;\n    }\n}\n";
            assertTrue(range(content, "return 1;").isEmpty());
        }

        @Test
        void returnSelectedInsideCatchBodyFails() {
            String content = "function f() {\n    try {\n        a();\n    } catch (e) {\n        return 1;\n    }\n}\n";
            assertTrue(range(content, "return 1;").isEmpty());
        }

        @Test
        void returnInsideNestedFunctionIsIgnored() {
            String content = "function f() {\n    const g = () => {\n        return 1;\n    };\n}\n";
            RangeToExtract range = range(content, "const g = () => {\n        return 1;\n    };").orElseThrow();

            assertFalse(range.facts().hasReturn());
        }

        @Test
        void labeledJumpToOutsideLabelFails() {
            String content = "outer: for (;;) {\n    for (;;) {\n        break outer;\n    }\n}\n";
            assertTrue(range(content, "for (;;) {\n        break outer;\n    }").isEmpty());
        }

        @Test
        void labeledJumpInsideSelectionSucceeds() {
            String content = "outer: for (;;) {\n    for (;;) {\n        break outer;\n    }\n}\n";
            assertTrue(range(content, content.trim()).isPresent());
        }
    }

    // ==================== Facts ====================

    @Nested
    class Facts {

        @Test
        void awaitSetsAsync() {
            String content = "async function f() {\n    await g();\n}\n";
            RangeToExtract range = range(content, "await g();").orElseThrow();

            assertTrue(range.facts().isAsyncFunction());
            assertFalse(range.facts().isGenerator());
        }

        @Test
        void forAwaitSetsAsync() {
            String content = "async function f(xs) {\n    for await (const x of xs) {\n        use(x);\n    }\n}\n";
            RangeToExtract range = range(content, "for await (const x of xs) {\n        use(x);\n    }").orElseThrow();

            assertTrue(range.facts().isAsyncFunction());
        }

        @Test
        void yieldSetsGenerator() {
            String content = "function* f() {\n    yield 1;\n}\n";
            RangeToExtract range = range(content, "yield 1;").orElseThrow();

            assertTrue(range.facts().isGenerator());
        }

        @Test
        void awaitInsideNestedFunctionIsIgnored() {
            String content = "function f() {\n    const g = async () => { await h(); };\n}\n";
            RangeToExtract range = range(content, "const g = async () => { await h(); };").orElseThrow();

            assertFalse(range.facts().isAsyncFunction());
        }
    }
}
