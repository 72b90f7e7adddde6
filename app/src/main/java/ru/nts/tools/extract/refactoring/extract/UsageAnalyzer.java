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

import ru.nts.tools.extract.core.treesitter.SourceFile;
import ru.nts.tools.extract.core.treesitter.Symbol;
import ru.nts.tools.extract.core.treesitter.SymbolResolver;
import ru.nts.tools.extract.core.treesitter.SyntaxKinds;
import ru.nts.tools.extract.core.treesitter.SyntaxNode;
import ru.nts.tools.extract.core.treesitter.TextSpan;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Анализ использований внешних переменных в диапазоне.
 * <p>
 * Один проход по диапазону классифицирует каждую ссылку как чтение или запись
 * (запись доминирует). Переменная попадает в отображение области, если область
 * лежит внутри блочного контейнера объявления (или совпадает с ним): только там
 * место вызова видит переменную и может передать ее в новую функцию.
 */
public final class UsageAnalyzer {

    private final SourceFile file;
    private final SymbolResolver resolver;
    private final List<Scope> scopes;
    private final TextSpan enclosingTextRange;
    private final List<Map<String, UsageEntry>> usagesPerScope = new ArrayList<>();
    private final Map<Symbol, Usage> seenUsages = new HashMap<>();

    private UsageAnalyzer(RangeToExtract range, List<Scope> scopes, ExtractionContext context) {
        this.file = context.file();
        this.resolver = context.resolver();
        this.scopes = scopes;
        this.enclosingTextRange = range.enclosingTextRange();
        for (int i = 0; i < scopes.size(); i++) {
            usagesPerScope.add(new LinkedHashMap<>());
        }
    }

    /**
     * Собирает захваты диапазона для каждой области.
     *
     * @throws ru.nts.tools.extract.core.OperationCancelledException если запрошена отмена
     */
    public static UsageAnalysis collectReadsAndWrites(RangeToExtract range, List<Scope> scopes,
                                                      ExtractionContext context) {
        context.cancellationToken().throwIfCancellationRequested();
        UsageAnalyzer analyzer = new UsageAnalyzer(range, scopes, context);
        for (SyntaxNode node : range.nodes()) {
            analyzer.collectUsages(node, Usage.READ);
        }
        return new UsageAnalysis(analyzer.usagesPerScope);
    }

    private void collectUsages(SyntaxNode node, Usage valueUsage) {
        if (SyntaxKinds.isTypeNode(node)) {
            return;
        }
        switch (node.getType()) {
            case "assignment_expression", "augmented_assignment_expression" -> {
                visitField(node, "left", Usage.WRITE);
                visitField(node, "right", valueUsage);
            }
            case "update_expression" -> visitField(node, "argument", Usage.WRITE);
            case "member_expression", "subscript_expression" -> {
                // основание цепочки наследует контекст, индекс только читается
                visitField(node, "object", valueUsage);
                visitField(node, "index", Usage.READ);
            }
            case "for_in_statement" -> {
                boolean declares = node.getChildByField("kind") != null;
                for (SyntaxNode child : node.getChildren()) {
                    collectUsages(child, !declares && child.isField("left") ? Usage.WRITE : valueUsage);
                }
            }
            case "identifier", "shorthand_property_identifier", "shorthand_property_identifier_pattern" ->
                    recordUsage(node, valueUsage);
            default -> {
                for (SyntaxNode child : node.getChildren()) {
                    collectUsages(child, valueUsage);
                }
            }
        }
    }

    private void visitField(SyntaxNode node, String field, Usage usage) {
        SyntaxNode child = node.getChildByField(field);
        if (child != null) {
            collectUsages(child, usage);
        }
    }

    private void recordUsage(SyntaxNode identifier, Usage usage) {
        Optional<Symbol> resolved = resolver.resolve(identifier);
        if (resolved.isEmpty()) {
            return;
        }
        Symbol symbol = resolved.get();
        String name = identifier.getText();

        Usage lastUsage = seenUsages.get(symbol);
        if (lastUsage != null && lastUsage.compareTo(usage) >= 0) {
            return;
        }
        seenUsages.put(symbol, usage);

        if (lastUsage != null) {
            for (Map<String, UsageEntry> perScope : usagesPerScope) {
                if (perScope.containsKey(name)) {
                    perScope.put(name, new UsageEntry(usage, symbol));
                }
            }
            return;
        }

        SyntaxNode declInFile = null;
        for (SyntaxNode declaration : resolver.declarations(symbol)) {
            if (declaration.getSourceFile() == file) {
                declInFile = declaration;
                break;
            }
        }
        if (declInFile == null) {
            return;
        }
        if (enclosingTextRange.contains(declInFile.getSpan())) {
            return;
        }

        TextSpan declContainer = SyntaxKinds.getEnclosingBlockScopeContainer(declInFile).getSpan();
        for (int i = 0; i < scopes.size(); i++) {
            if (declContainer.contains(scopes.get(i).node().getSpan())) {
                usagesPerScope.get(i).put(name, new UsageEntry(usage, symbol));
            }
        }
    }
}
