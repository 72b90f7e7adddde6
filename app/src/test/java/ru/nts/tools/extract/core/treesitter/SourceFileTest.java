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
package ru.nts.tools.extract.core.treesitter;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Тесты разбора исходника и зеркала дерева tree-sitter.
 */
class SourceFileTest {

    // ==================== Tree ====================

    @Nested
    class TreeMirror {

        @Test
        void rootIsProgram() {
            SourceFile file = SourceFile.parse("let a = 1;\n", "javascript");

            assertEquals("program", file.getRoot().getType());
            assertFalse(file.hasSyntaxErrors());
            assertEquals(0, file.getRoot().getStart());
        }

        @Test
        void fieldNamesAreAssigned() {
            SourceFile file = SourceFile.parse("function f(a) { return a; }", "javascript");
            SyntaxNode function = file.getRoot().getChild(0);

            assertEquals("function_declaration", function.getType());
            assertEquals("f", function.getChildByField("name").getText());
            assertEquals("statement_block", function.getChildByField("body").getType());
            assertEquals("formal_parameters", function.getChildByField("parameters").getType());
        }

        @Test
        void parentLinksAreConsistent() {
            SourceFile file = SourceFile.parse("if (x) { y(); }", "javascript");
            SyntaxNode ifStatement = file.getRoot().getChild(0);

            for (SyntaxNode child : ifStatement.getChildren()) {
                assertSame(ifStatement, child.getParent());
                assertSame(child, ifStatement.getChild(child.getIndexInParent()));
            }
        }

        @Test
        void syntaxErrorsAreReported() {
            SourceFile file = SourceFile.parse("function (", "javascript");

            assertTrue(file.hasSyntaxErrors());
        }

        @Test
        void typescriptSyntaxIsAccepted() {
            SourceFile file = SourceFile.parse("let n: number = 1;\n", "typescript");

            assertFalse(file.hasSyntaxErrors());
        }
    }

    // ==================== Offsets ====================

    @Nested
    class Offsets {

        @Test
        void nonAsciiTextKeepsCharacterOffsets() {
            String content = "const s = \"привет\"; let x = 1;\n";
            SourceFile file = SourceFile.parse(content, "javascript");

            int expected = content.indexOf("x = 1");
            SyntaxNode token = file.getTokenAtPosition(expected);

            assertEquals("x", token.getText());
            assertEquals(expected, token.getStart());
        }

        @Test
        void surrogatePairsKeepCharacterOffsets() {
            String content = "const e = \"😀\"; foo();\n";
            SourceFile file = SourceFile.parse(content, "javascript");

            SyntaxNode token = file.getTokenAtPosition(content.indexOf("foo"));

            assertEquals("foo", token.getText());
        }

        @Test
        void lineAndColumnToOffset() {
            String content = "a();\n  b();\nc();";
            SourceFile file = SourceFile.parse(content, "javascript");

            assertEquals(content.indexOf("b"), file.getOffset(2, 3));
            assertEquals(content.indexOf("c"), file.getOffset(3, 1));
            // колонка за концом строки прижимается к ее концу
            assertEquals(content.indexOf("\nc"), file.getOffset(2, 100));
            assertEquals(6, file.getLineLength(2));
            assertThrows(IllegalArgumentException.class, () -> file.getOffset(10, 1));
        }

        @Test
        void lineHelpers() {
            String content = "a();\n    b();\n";
            SourceFile file = SourceFile.parse(content, "javascript");
            int b = content.indexOf("b");

            assertEquals(2, file.getLineNumber(b));
            assertEquals(5, file.getLineStart(b));
            assertEquals("    ", file.getIndentation(b));
        }
    }

    // ==================== Tokens ====================

    @Nested
    class Tokens {

        @Test
        void commentsAreNotTokens() {
            SourceFile file = SourceFile.parse("// note\nlet a;\n", "javascript");

            List<String> texts = file.getTokens().stream().map(SyntaxNode::getText).toList();

            assertEquals(List.of("let", "a", ";"), texts);
        }

        @Test
        void tokenLookups() {
            String content = "foo(bar);";
            SourceFile file = SourceFile.parse(content, "javascript");

            assertEquals("foo", file.getTokenAtPosition(0).getText());
            assertEquals("bar", file.getTokenAtPosition(4).getText());
            assertEquals("(", file.findTokenOnLeftOfPosition(4).getText());
            assertEquals("(", file.findPrecedingToken(4).getText());
            assertNull(file.findPrecedingToken(0));
            assertNull(file.getTokenAtPosition(content.length()));
        }
    }

    @Test
    void parseSourceKeepsPath() {
        Path path = Path.of("src", "app.ts");
        SourceFile file = TreeSitterManager.getInstance().parseSource(path, "let a = 1;", "typescript");

        assertEquals(path, file.getPath());
        assertEquals("typescript", file.getLangId());
    }
}
