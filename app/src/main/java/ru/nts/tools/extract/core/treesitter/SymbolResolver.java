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

import java.util.List;
import java.util.Optional;

/**
 * Связывание идентификаторов с объявлениями.
 * Доступ только на чтение: анализатор использований не создает и не изменяет символы.
 */
public interface SymbolResolver {

    /**
     * Находит символ, на который ссылается идентификатор.
     *
     * @param identifier узел идентификатора
     * @return символ или empty, если имя не объявлено в файле (глобальное, встроенное)
     */
    Optional<Symbol> resolve(SyntaxNode identifier);

    /**
     * Узлы объявлений символа.
     */
    List<SyntaxNode> declarations(Symbol symbol);
}
