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

import org.junit.jupiter.api.Test;
import ru.nts.tools.extract.core.OperationCancelledException;
import ru.nts.tools.extract.core.treesitter.SourceFile;
import ru.nts.tools.extract.core.treesitter.TextSpan;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Тесты анализа захватов: чтение и запись, видимость по областям.
 */
class UsageAnalyzerTest {

    private record Analysis(List<Scope> scopes, UsageAnalysis usages) {
    }

    private static Analysis analyze(String content, String selection) {
        SourceFile file = SourceFile.parse(content, "javascript");
        int start = content.indexOf(selection);
        RangeToExtract range = RangeValidator.getRangeToExtract(file,
                TextSpan.fromBounds(start, start + selection.length())).orElseThrow();
        List<Scope> scopes = ScopeCollector.collectEnclosingScopes(range);
        return new Analysis(scopes, UsageAnalyzer.collectReadsAndWrites(range, scopes, ExtractionContext.of(file)));
    }

    private static Map<String, Usage> usages(Analysis analysis, int scope) {
        Map<String, Usage> result = new LinkedHashMap<>();
        analysis.usages().usagesFor(scope).forEach((name, entry) -> result.put(name, entry.usage()));
        return result;
    }

    @Test
    void parametersAreReadCaptures() {
        Analysis analysis = analyze("function f(a, b) {\n    return a + b;\n}\n", "a + b");

        assertEquals(2, analysis.usages().scopeCount());
        assertEquals(Map.of("a", Usage.READ, "b", Usage.READ), usages(analysis, 0));
        assertEquals(List.of("a", "b"), List.copyOf(analysis.usages().usagesFor(0).keySet()));
    }

    @Test
    void captureIsRecordedOnlyInScopesInsideTheDeclarationContainer() {
        String content = "function outer() {\n    let a = 1;\n    function inner() {\n        let b = 2;\n"
                + "        return a + b;\n    }\n}\n";
        Analysis analysis = analyze(content, "a + b");

        assertEquals(3, analysis.scopes().size());
        // b видна только в inner, a в inner и outer
        assertEquals(Map.of("a", Usage.READ, "b", Usage.READ), usages(analysis, 0));
        assertEquals(Map.of("a", Usage.READ), usages(analysis, 1));
        assertTrue(usages(analysis, 2).isEmpty());
    }

    @Test
    void fileLevelVariableIsCapturedByEveryScope() {
        String content = "let total = 0;\nfunction f() {\n    return total + 1;\n}\n";
        Analysis analysis = analyze(content, "total + 1");

        assertEquals(Map.of("total", Usage.READ), usages(analysis, 0));
        assertEquals(Map.of("total", Usage.READ), usages(analysis, 1));
    }

    @Test
    void writeDominatesRead() {
        String content = "function f() {\n    let n = 0;\n    log(n);\n    n++;\n    return n;\n}\n";
        Analysis analysis = analyze(content, "log(n);\n    n++;");

        assertEquals(Map.of("n", Usage.WRITE), usages(analysis, 0));
    }

    @Test
    void writeBeforeReadStaysWrite() {
        String content = "function f() {\n    let n = 0;\n    n = 5;\n    log(n);\n    return n;\n}\n";
        Analysis analysis = analyze(content, "n = 5;\n    log(n);");

        assertEquals(Map.of("n", Usage.WRITE), usages(analysis, 0));
    }

    @Test
    void memberAssignmentWritesTheObject() {
        String content = "function f(o, k) {\n    o.p = 1;\n    o[k] = 2;\n    return o;\n}\n";
        Analysis analysis = analyze(content, "o.p = 1;\n    o[k] = 2;");

        assertEquals(Map.of("o", Usage.WRITE, "k", Usage.READ), usages(analysis, 0));
    }

    @Test
    void nestedMemberChainWritesItsBase() {
        String content = "function f(o) {\n    o.a.b = 1;\n    return o;\n}\n";
        Analysis analysis = analyze(content, "o.a.b = 1;");

        assertEquals(Map.of("o", Usage.WRITE), usages(analysis, 0));
    }

    @Test
    void memberReadOutsideAssignmentStaysRead() {
        String content = "function f(o) {\n    return o.p + 1;\n}\n";
        Analysis analysis = analyze(content, "o.p + 1");

        assertEquals(Map.of("o", Usage.READ), usages(analysis, 0));
    }

    @Test
    void compoundAssignmentIsWrite() {
        String content = "function f(x) {\n    x += 2;\n    return x;\n}\n";
        Analysis analysis = analyze(content, "x += 2;");

        assertEquals(Map.of("x", Usage.WRITE), usages(analysis, 0));
    }

    @Test
    void destructuringAssignmentWritesTargets() {
        String content = "function f(p) {\n    let a, b;\n    [a, b] = p;\n    return a + b;\n}\n";
        Analysis analysis = analyze(content, "[a, b] = p;");

        assertEquals(Map.of("a", Usage.WRITE, "b", Usage.WRITE, "p", Usage.READ), usages(analysis, 0));
    }

    @Test
    void localsDeclaredInsideRangeAreNotCaptured() {
        String content = "function f(a) {\n    const t = a * 2;\n    log(t);\n}\n";
        Analysis analysis = analyze(content, "const t = a * 2;\n    log(t);");

        assertEquals(Map.of("a", Usage.READ), usages(analysis, 0));
    }

    @Test
    void unresolvedNamesAreIgnored() {
        Analysis analysis = analyze("function f() {\n    return Math.max(1, 2);\n}\n", "Math.max(1, 2)");

        assertTrue(usages(analysis, 0).isEmpty());
        assertTrue(usages(analysis, 1).isEmpty());
    }

    @Test
    void cancellationIsObservedBeforeTheWalk() {
        String content = "function f(a) {\n    return a + 1;\n}\n";
        SourceFile file = SourceFile.parse(content, "javascript");
        int start = content.indexOf("a + 1");
        RangeToExtract range = RangeValidator.getRangeToExtract(file, TextSpan.fromBounds(start, start + 5))
                .orElseThrow();
        List<Scope> scopes = ScopeCollector.collectEnclosingScopes(range);
        ExtractionContext context = ExtractionContext.of(file).withCancellationToken(() -> true);

        assertThrows(OperationCancelledException.class,
                () -> UsageAnalyzer.collectReadsAndWrites(range, scopes, context));
    }
}
