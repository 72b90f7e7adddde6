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

import ru.nts.tools.extract.core.treesitter.SyntaxNode;

/**
 * Кандидат на место объявления извлеченной функции.
 *
 * @param kind вид области
 * @param node узел области: функция, класс, тело модуля или program
 */
public record Scope(ScopeKind kind, SyntaxNode node) {

    public boolean isClassLike() {
        return kind == ScopeKind.CLASS;
    }

    /**
     * Краткое описание для предпросмотра: вид области и имя, если оно есть.
     */
    public String describe() {
        SyntaxNode name = switch (kind) {
            case FUNCTION, CLASS -> node.getChildByField("name");
            case MODULE -> node.getParent() != null ? node.getParent().getChildByField("name") : null;
            case FILE -> null;
        };
        String label = kind.name().toLowerCase();
        if (name != null) {
            return label + " '" + name.getText() + "'";
        }
        return kind == ScopeKind.FUNCTION ? "anonymous " + label : label;
    }
}
