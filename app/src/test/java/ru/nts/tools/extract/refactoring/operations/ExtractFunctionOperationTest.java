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
package ru.nts.tools.extract.refactoring.operations;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import ru.nts.tools.extract.core.PathSanitizer;
import ru.nts.tools.extract.refactoring.RefactoringContext;
import ru.nts.tools.extract.refactoring.RefactoringException;
import ru.nts.tools.extract.refactoring.RefactoringResult;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Тесты для ExtractFunctionOperation.
 * Проверяет разбор параметров, предпросмотр по всем областям и запись выбранного варианта.
 */
class ExtractFunctionOperationTest {

    private static final String SUM = "function f(a, b) {\n    return a + b;\n}\n";

    @TempDir
    Path tempDir;

    private ObjectMapper mapper;
    private ExtractFunctionOperation operation;

    @BeforeEach
    void setUp() {
        mapper = new ObjectMapper();
        operation = new ExtractFunctionOperation();
        PathSanitizer.setRoot(tempDir);
    }

    private ObjectNode offsets(String path, String content, String selection) {
        int start = content.indexOf(selection);
        ObjectNode params = mapper.createObjectNode();
        params.put("path", path);
        params.put("start", start);
        params.put("end", start + selection.length());
        return params;
    }

    // ==================== Validation ====================

    @Nested
    class Validation {

        @Test
        void requiresPath() {
            ObjectNode params = mapper.createObjectNode();
            params.put("start", 0);
            params.put("end", 5);

            assertThrows(IllegalArgumentException.class, () -> operation.validateParams(params));
        }

        @Test
        void requiresSelection() {
            ObjectNode params = mapper.createObjectNode();
            params.put("path", "a.js");
            params.put("startLine", 2);

            assertThrows(IllegalArgumentException.class, () -> operation.validateParams(params));
        }

        @Test
        void rejectsInvalidFunctionName() {
            ObjectNode params = offsets("a.js", SUM, "a + b");
            params.put("functionName", "1st");

            assertThrows(IllegalArgumentException.class, () -> operation.validateParams(params));
        }

        @Test
        void rejectsUnknownLineEnding() {
            ObjectNode params = offsets("a.js", SUM, "a + b");
            params.put("newLine", "cr");

            assertThrows(IllegalArgumentException.class, () -> operation.validateParams(params));
        }

        @Test
        void rejectsNegativeScopeIndex() {
            ObjectNode params = offsets("a.js", SUM, "a + b");
            params.put("scopeIndex", -1);

            assertThrows(IllegalArgumentException.class, () -> operation.validateParams(params));
        }

        @Test
        void acceptsLineSelection() {
            ObjectNode params = mapper.createObjectNode();
            params.put("path", "a.js");
            params.put("startLine", 2);
            params.put("endLine", 2);
            params.put("functionName", "sum");
            params.put("newLine", "crlf");

            assertDoesNotThrow(() -> operation.validateParams(params));
        }
    }

    // ==================== Preview ====================

    @Nested
    class Preview {

        @Test
        void previewListsEveryScopeWithoutWriting() throws IOException, RefactoringException {
            Path file = tempDir.resolve("sum.js");
            Files.writeString(file, SUM);

            RefactoringResult result = operation.preview(offsets("sum.js", SUM, "a + b"), new RefactoringContext());

            assertEquals(RefactoringResult.Status.PREVIEW, result.status());
            assertEquals("extract_function", result.action());
            assertEquals(2, result.changes().size());
            assertTrue(result.diff().contains("+    return newFunction(a, b);"), result.diff());

            JsonNode details = result.details();
            assertEquals("expression", details.get("kind").asText());
            assertFalse(details.get("facts").get("hasReturn").asBoolean());
            JsonNode scopes = details.get("scopes");
            assertEquals(2, scopes.size());
            assertEquals("function", scopes.get(0).get("kind").asText());
            assertEquals("function 'f'", scopes.get(0).get("description").asText());
            assertEquals("a", scopes.get(0).get("parameters").get(0).asText());
            assertEquals("file", scopes.get(1).get("kind").asText());

            RefactoringResult.ChangeDetail detail = result.changes().get(0).details().get(0);
            assertEquals(2, detail.line());
            assertEquals(12, detail.column());
            assertEquals("a + b", detail.before());
            assertEquals("newFunction(a, b)", detail.after());

            assertEquals(SUM, Files.readString(file));
        }

        @Test
        void lineAndColumnSelection() throws IOException, RefactoringException {
            Files.writeString(tempDir.resolve("sum.js"), SUM);
            ObjectNode params = mapper.createObjectNode();
            params.put("path", "sum.js");
            params.put("startLine", 2);
            params.put("startColumn", 12);
            params.put("endLine", 2);
            params.put("endColumn", 17);

            RefactoringResult result = operation.preview(params, new RefactoringContext());

            assertEquals("expression", result.details().get("kind").asText());
        }

        @Test
        void wholeLineSelection() throws IOException, RefactoringException {
            String content = "function f() {\n    let x = 1;\n    x = 2;\n    return x;\n}\n";
            Files.writeString(tempDir.resolve("w.js"), content);
            ObjectNode params = mapper.createObjectNode();
            params.put("path", "w.js");
            params.put("startLine", 3);
            params.put("endLine", 3);

            RefactoringResult result = operation.preview(params, new RefactoringContext());

            assertEquals("statements", result.details().get("kind").asText());
            assertEquals("x", result.details().get("scopes").get(0).get("writes").get(0).asText());
        }
    }

    // ==================== Execute ====================

    @Nested
    class Execute {

        @Test
        void executeWritesInnermostScopeByDefault() throws IOException, RefactoringException {
            Path file = tempDir.resolve("sum.js");
            Files.writeString(file, SUM);
            RefactoringContext context = new RefactoringContext();

            RefactoringResult result = operation.execute(offsets("sum.js", SUM, "a + b"), context);

            assertEquals(RefactoringResult.Status.SUCCESS, result.status());
            assertEquals("""
                    function f(a, b) {
                        return newFunction(a, b);

                        function newFunction(a, b) {
                            return a + b;
                        }
                    }
                    """, Files.readString(file));
            assertTrue(context.getWrittenFiles().contains(file.toAbsolutePath().normalize()));
        }

        @Test
        void executeSelectedScopeWithCustomName() throws IOException, RefactoringException {
            String content = "const a = 1, b = 2;\nfunction f() {\n    return a + b;\n}\n";
            Path file = tempDir.resolve("sum.ts");
            Files.writeString(file, content);
            ObjectNode params = offsets("sum.ts", content, "a + b");
            params.put("scopeIndex", 1);
            params.put("functionName", "add");

            operation.execute(params, new RefactoringContext());

            assertEquals("""
                    const a = 1, b = 2;
                    function f() {
                        return add(a, b);
                    }

                    function add(a, b) {
                        return a + b;
                    }
                    """, Files.readString(file));
        }

        @Test
        void nonAsciiContentSurvives() throws IOException, RefactoringException {
            String content = "function greet(name) {\n    return \"Привет, \" + name;\n}\n";
            Path file = tempDir.resolve("greet.js");
            Files.writeString(file, content, StandardCharsets.UTF_8);

            operation.execute(offsets("greet.js", content, "\"Привет, \" + name"), new RefactoringContext());

            String updated = Files.readString(file, StandardCharsets.UTF_8);
            assertTrue(updated.contains("return newFunction(name);"), updated);
            assertTrue(updated.contains("return \"Привет, \" + name;"), updated);
        }

        @Test
        void scopeIndexOutOfRangeFails() throws IOException {
            Files.writeString(tempDir.resolve("sum.js"), SUM);
            ObjectNode params = offsets("sum.js", SUM, "a + b");
            params.put("scopeIndex", 5);

            assertThrows(RefactoringException.class, () -> operation.execute(params, new RefactoringContext()));
            assertEquals(SUM, Files.readString(tempDir.resolve("sum.js")));
        }
    }

    // ==================== Errors ====================

    @Nested
    class Errors {

        @Test
        void missingFile() {
            RefactoringException e = assertThrows(RefactoringException.class,
                    () -> operation.preview(offsets("missing.js", SUM, "a + b"), new RefactoringContext()));
            assertTrue(e.getMessage().contains("File not found"));
        }

        @Test
        void unsupportedLanguage() throws IOException {
            Files.writeString(tempDir.resolve("sum.py"), SUM);

            assertThrows(RefactoringException.class,
                    () -> operation.preview(offsets("sum.py", SUM, "a + b"), new RefactoringContext()));
        }

        @Test
        void syntaxErrorsBlockExtraction() throws IOException {
            String content = "function f( {\n    return 1 + 2;\n";
            Files.writeString(tempDir.resolve("bad.js"), content);

            assertThrows(RefactoringException.class,
                    () -> operation.preview(offsets("bad.js", content, "1 + 2"), new RefactoringContext()));
        }

        @Test
        void illegalSelectionHasSuggestions() throws IOException {
            String content = "for (;;) {\n    break;\n}\n";
            Files.writeString(tempDir.resolve("loop.js"), content);

            RefactoringException e = assertThrows(RefactoringException.class,
                    () -> operation.preview(offsets("loop.js", content, "break;"), new RefactoringContext()));
            assertTrue(e.getMessage().startsWith("Cannot extract selection"));
            assertFalse(e.getSuggestions().isEmpty());
        }

        @Test
        void pathOutsideRootIsRejected() {
            assertThrows(RefactoringException.class,
                    () -> operation.preview(offsets("../outside.js", SUM, "a + b"), new RefactoringContext()));
        }

        @Test
        void selectionBeyondFileIsRejected() throws IOException {
            Files.writeString(tempDir.resolve("sum.js"), SUM);
            ObjectNode params = mapper.createObjectNode();
            params.put("path", "sum.js");
            params.put("start", 5);
            params.put("end", 10_000);

            assertThrows(RefactoringException.class, () -> operation.preview(params, new RefactoringContext()));
        }
    }
}
