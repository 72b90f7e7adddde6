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

import ru.nts.tools.extract.core.CancellationToken;
import ru.nts.tools.extract.core.treesitter.SourceFile;
import ru.nts.tools.extract.core.treesitter.TextSpan;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Извлечение функции: проверка выделения, перечисление областей,
 * анализ захватов и синтез правок для каждой пригодной области.
 */
public final class FunctionExtractor {

    private FunctionExtractor() {}

    /**
     * Проверяет выделение.
     *
     * @return диапазон или empty, если выделение нельзя извлечь
     */
    public static Optional<RangeToExtract> getRangeToExtract(SourceFile file, TextSpan span) {
        return RangeValidator.getRangeToExtract(file, span);
    }

    /**
     * Строит варианты извлечения, от самой внутренней области к файлу.
     * Области без места для объявления пропускаются.
     *
     * @throws ru.nts.tools.extract.core.OperationCancelledException если запрошена отмена
     */
    public static List<ExtractResultForScope> extractRange(RangeToExtract range, ExtractionContext context) {
        CancellationToken token = context.cancellationToken();
        List<Scope> scopes = ScopeCollector.collectEnclosingScopes(range);

        UsageAnalysis usages = UsageAnalyzer.collectReadsAndWrites(range, scopes, context);
        token.throwIfCancellationRequested();

        List<ExtractResultForScope> results = new ArrayList<>();
        for (int i = 0; i < scopes.size(); i++) {
            token.throwIfCancellationRequested();
            FunctionSynthesizer.extractFunctionInScope(range, scopes.get(i), usages.usagesFor(i), context)
                    .ifPresent(results::add);
        }
        return results;
    }

    /**
     * Проверка выделения и построение вариантов за один вызов.
     *
     * @return варианты или пустой список, если выделение нельзя извлечь
     */
    public static List<ExtractResultForScope> extract(TextSpan span, ExtractionContext context) {
        return getRangeToExtract(context.file(), span)
                .map(range -> extractRange(range, context))
                .orElse(List.of());
    }
}
