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
import ru.nts.tools.extract.core.treesitter.LexicalSymbolResolver;
import ru.nts.tools.extract.core.treesitter.SourceFile;
import ru.nts.tools.extract.core.treesitter.SymbolResolver;

/**
 * Входные данные извлечения: файл, связывание имен, сигнал отмены и параметры генерации.
 */
public record ExtractionContext(SourceFile file, SymbolResolver resolver,
                                CancellationToken cancellationToken, ExtractionOptions options) {

    /**
     * Контекст с лексическим связыванием имен, без отмены и с параметрами по умолчанию.
     */
    public static ExtractionContext of(SourceFile file) {
        return new ExtractionContext(file, new LexicalSymbolResolver(file), CancellationToken.NONE,
                ExtractionOptions.defaults().withNewLine(ExtractionOptions.detectNewLine(file.getContent())));
    }

    public ExtractionContext withCancellationToken(CancellationToken token) {
        return new ExtractionContext(file, resolver, token, options);
    }

    public ExtractionContext withOptions(ExtractionOptions newOptions) {
        return new ExtractionContext(file, resolver, cancellationToken, newOptions);
    }
}
