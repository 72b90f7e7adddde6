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
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import ru.nts.tools.extract.core.DiffUtils;
import ru.nts.tools.extract.core.EncodingUtils;
import ru.nts.tools.extract.core.PathSanitizer;
import ru.nts.tools.extract.core.treesitter.LanguageDetector;
import ru.nts.tools.extract.core.treesitter.LexicalSymbolResolver;
import ru.nts.tools.extract.core.treesitter.SourceFile;
import ru.nts.tools.extract.core.treesitter.TextSpan;
import ru.nts.tools.extract.refactoring.RefactoringContext;
import ru.nts.tools.extract.refactoring.RefactoringException;
import ru.nts.tools.extract.refactoring.RefactoringOperation;
import ru.nts.tools.extract.refactoring.RefactoringResult;
import ru.nts.tools.extract.refactoring.extract.ExtractResultForScope;
import ru.nts.tools.extract.refactoring.extract.ExtractionContext;
import ru.nts.tools.extract.refactoring.extract.ExtractionOptions;
import ru.nts.tools.extract.refactoring.extract.FunctionExtractor;
import ru.nts.tools.extract.refactoring.extract.RangeFacts;
import ru.nts.tools.extract.refactoring.extract.RangeToExtract;
import ru.nts.tools.extract.refactoring.extract.TextChange;
import ru.nts.tools.extract.refactoring.extract.TextChanges;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Операция извлечения функции.
 * Выносит выделенное выражение или последовательность операторов в новую функцию
 * (или приватный метод) и заменяет выделение вызовом.
 * <p>
 * Параметры:
 * <ul>
 *   <li>{@code path} - путь к файлу (обязательный);</li>
 *   <li>{@code start}/{@code end} - выделение в символах, либо
 *       {@code startLine}[{@code startColumn}]/{@code endLine}[{@code endColumn}] с 1,
 *       конечная колонка не включается;</li>
 *   <li>{@code functionName} - имя функции (по умолчанию newFunction);</li>
 *   <li>{@code scopeIndex} - номер области для execute, 0 - самая внутренняя;</li>
 *   <li>{@code newLine} - lf или crlf (по умолчанию как в файле).</li>
 * </ul>
 */
public class ExtractFunctionOperation implements RefactoringOperation {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Override
    public String getName() {
        return "extract_function";
    }

    @Override
    public void validateParams(JsonNode params) throws IllegalArgumentException {
        if (!params.has("path")) {
            throw new IllegalArgumentException("Parameter 'path' is required");
        }
        boolean hasOffsets = params.has("start") && params.has("end");
        boolean hasLines = params.has("startLine") && params.has("endLine");
        if (!hasOffsets && !hasLines) {
            throw new IllegalArgumentException("Either 'start'/'end' or 'startLine'/'endLine' is required");
        }
        if (params.has("scopeIndex") && params.get("scopeIndex").asInt(-1) < 0) {
            throw new IllegalArgumentException("Parameter 'scopeIndex' must be a non-negative integer");
        }
        if (params.has("newLine")) {
            parseNewLine(params.get("newLine").asText());
        }
        if (params.has("functionName")) {
            ExtractionOptions.defaults().withFunctionName(params.get("functionName").asText());
        }
    }

    @Override
    public RefactoringResult preview(JsonNode params, RefactoringContext context) throws RefactoringException {
        Extraction extraction = prepare(params, context);

        List<RefactoringResult.FileChange> changes = new ArrayList<>();
        ArrayNode scopes = MAPPER.createArrayNode();
        StringBuilder combinedDiff = new StringBuilder();
        for (int i = 0; i < extraction.results().size(); i++) {
            ExtractResultForScope result = extraction.results().get(i);
            String newContent = TextChanges.apply(extraction.file().getContent(), result.changes());
            String diff = DiffUtils.getUnifiedDiff(extraction.path().getFileName().toString(),
                    extraction.file().getContent(), newContent);

            changes.add(new RefactoringResult.FileChange(extraction.path(), result.changes().size(),
                    List.of(describeChange(extraction, result)), diff));
            scopes.add(describeScope(i, result));

            combinedDiff.append("=== [").append(i).append("] ")
                    .append(result.scope().describe()).append(" ===\n")
                    .append(diff).append("\n\n");
        }

        ObjectNode details = describeRange(extraction.range());
        details.set("scopes", scopes);

        return RefactoringResult.builder()
                .status(RefactoringResult.Status.PREVIEW)
                .action(getName())
                .summary(String.format("Preview: %d scope(s) can host the extracted function",
                        extraction.results().size()))
                .changes(changes)
                .affectedFiles(1)
                .totalChanges(changes.size())
                .diff(combinedDiff.toString().trim())
                .details(details)
                .build();
    }

    @Override
    public RefactoringResult execute(JsonNode params, RefactoringContext context) throws RefactoringException {
        Extraction extraction = prepare(params, context);

        int scopeIndex = params.has("scopeIndex") ? params.get("scopeIndex").asInt() : 0;
        if (scopeIndex >= extraction.results().size()) {
            throw RefactoringException.invalidParameter("scopeIndex",
                    "only " + extraction.results().size() + " scope(s) available")
                    .addSuggestion("Run preview to list the scopes that can host the function");
        }
        ExtractResultForScope result = extraction.results().get(scopeIndex);

        String content = extraction.file().getContent();
        String newContent = TextChanges.apply(content, result.changes());
        context.getCancellationToken().throwIfCancellationRequested();
        context.writeFile(extraction.path(), newContent, extraction.charset());

        String diff = DiffUtils.getUnifiedDiff(extraction.path().getFileName().toString(), content, newContent);
        ObjectNode details = describeRange(extraction.range());
        details.set("scope", describeScope(scopeIndex, result));

        return RefactoringResult.builder()
                .status(RefactoringResult.Status.SUCCESS)
                .action(getName())
                .summary(String.format("Extracted function '%s' into %s with %d parameter(s)",
                        extraction.options().functionName(), result.scope().describe(),
                        result.parameters().size()))
                .addChange(new RefactoringResult.FileChange(extraction.path(), result.changes().size(),
                        List.of(describeChange(extraction, result)), diff))
                .affectedFiles(1)
                .totalChanges(result.changes().size())
                .diff(diff)
                .details(details)
                .build();
    }

    /**
     * Читает и разбирает файл, проверяет выделение и строит варианты по областям.
     */
    private Extraction prepare(JsonNode params, RefactoringContext context) throws RefactoringException {
        String requestedPath = params.get("path").asText();
        Path path = resolvePath(requestedPath);

        EncodingUtils.TextFileContent text;
        try {
            PathSanitizer.checkFileSize(path);
            text = EncodingUtils.readTextFile(path);
        } catch (IOException | SecurityException e) {
            throw new RefactoringException("Failed to read file: " + e.getMessage(), e);
        }

        String langId = LanguageDetector.detect(path, text.content())
                .orElseThrow(() -> RefactoringException.unsupportedLanguage(extensionOf(path)));

        SourceFile file = context.getTreeManager().parseSource(path, text.content(), langId);
        if (file.hasSyntaxErrors()) {
            throw RefactoringException.syntaxErrors(requestedPath);
        }

        TextSpan span = resolveSpan(params, file);
        ExtractionOptions options = resolveOptions(params, file);
        ExtractionContext extractionContext = new ExtractionContext(file, new LexicalSymbolResolver(file),
                context.getCancellationToken(), options);

        Optional<RangeToExtract> range = FunctionExtractor.getRangeToExtract(file, span);
        if (range.isEmpty()) {
            throw RefactoringException.cannotExtract("selection " + span.start() + ".." + span.end()
                    + " is not an extractable expression or statement sequence");
        }

        List<ExtractResultForScope> results = FunctionExtractor.extractRange(range.get(), extractionContext);
        if (results.isEmpty()) {
            throw RefactoringException.cannotExtract("no enclosing scope can host a new function");
        }
        return new Extraction(path, text.charset(), file, range.get(), options, results);
    }

    private Path resolvePath(String requestedPath) throws RefactoringException {
        Path path;
        try {
            path = PathSanitizer.sanitize(requestedPath);
        } catch (SecurityException e) {
            throw new RefactoringException(e.getMessage(), e);
        }
        if (!Files.isRegularFile(path)) {
            throw RefactoringException.fileNotFound(requestedPath);
        }
        return path;
    }

    private static String extensionOf(Path path) {
        String name = path.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot >= 0 ? name.substring(dot + 1) : name;
    }

    /**
     * Переводит параметры выделения в диапазон символов.
     */
    private TextSpan resolveSpan(JsonNode params, SourceFile file) throws RefactoringException {
        int length = file.getContent().length();
        int start;
        int end;
        try {
            if (params.has("start") && params.has("end")) {
                start = params.get("start").asInt();
                end = params.get("end").asInt();
            } else {
                int startLine = params.get("startLine").asInt();
                int endLine = params.get("endLine").asInt();
                int startColumn = params.has("startColumn") ? params.get("startColumn").asInt() : 1;
                int endColumn = params.has("endColumn")
                        ? params.get("endColumn").asInt()
                        : file.getLineLength(endLine) + 1;
                start = file.getOffset(startLine, startColumn);
                end = file.getOffset(endLine, endColumn);
            }
        } catch (IllegalArgumentException e) {
            throw RefactoringException.invalidParameter("selection", e.getMessage());
        }
        if (start < 0 || end > length || start >= end) {
            throw RefactoringException.invalidParameter("selection",
                    "empty or out of bounds: " + start + ".." + end + " (file length " + length + ")");
        }
        return TextSpan.fromBounds(start, end);
    }

    private ExtractionOptions resolveOptions(JsonNode params, SourceFile file) throws RefactoringException {
        try {
            ExtractionOptions options = ExtractionOptions.defaults()
                    .withNewLine(params.has("newLine")
                            ? parseNewLine(params.get("newLine").asText())
                            : ExtractionOptions.detectNewLine(file.getContent()));
            if (params.has("functionName")) {
                options = options.withFunctionName(params.get("functionName").asText());
            }
            return options;
        } catch (IllegalArgumentException e) {
            throw RefactoringException.invalidParameter("options", e.getMessage());
        }
    }

    private static String parseNewLine(String value) {
        return switch (value) {
            case "lf", "LF", "\n" -> "\n";
            case "crlf", "CRLF", "\r\n" -> "\r\n";
            default -> throw new IllegalArgumentException("Parameter 'newLine' must be 'lf' or 'crlf'");
        };
    }

    private RefactoringResult.ChangeDetail describeChange(Extraction extraction, ExtractResultForScope result) {
        SourceFile file = extraction.file();
        RangeToExtract range = extraction.range();
        int start = range.firstNode().getStart();
        int line = file.getLineNumber(start);
        int column = start - file.getLineStart(start) + 1;
        String before = file.getContent().substring(start, range.lastNode().getEnd());
        // последняя правка - вставка вызова на место диапазона
        TextChange replacement = result.changes().get(result.changes().size() - 1);
        return new RefactoringResult.ChangeDetail(line, column, before, replacement.newText().trim());
    }

    private ObjectNode describeRange(RangeToExtract range) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("start", range.enclosingTextRange().start());
        node.put("end", range.enclosingTextRange().end());
        node.put("kind", range.expression() ? "expression" : "statements");
        RangeFacts facts = range.facts();
        ObjectNode factsNode = node.putObject("facts");
        factsNode.put("hasReturn", facts.hasReturn());
        factsNode.put("isGenerator", facts.isGenerator());
        factsNode.put("isAsyncFunction", facts.isAsyncFunction());
        return node;
    }

    private ObjectNode describeScope(int index, ExtractResultForScope result) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("index", index);
        node.put("kind", result.scope().kind().name().toLowerCase());
        node.put("description", result.scope().describe());
        ArrayNode parameters = node.putArray("parameters");
        result.parameters().forEach(parameters::add);
        ArrayNode writes = node.putArray("writes");
        result.writes().forEach(writes::add);
        return node;
    }

    private record Extraction(Path path, Charset charset, SourceFile file, RangeToExtract range,
                              ExtractionOptions options, List<ExtractResultForScope> results) {
    }
}
