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

import ru.nts.tools.extract.core.treesitter.SyntaxKinds;
import ru.nts.tools.extract.core.treesitter.SyntaxNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Перечисляет области, в которых можно объявить извлеченную функцию,
 * от самой внутренней к файлу.
 */
public final class ScopeCollector {

    private ScopeCollector() {}

    /**
     * Собирает охватывающие области диапазона.
     * Класс становится кандидатом, только если диапазон лежит в нестатическом методе этого класса
     * (стрелочные функции между ними не меняют this).
     *
     * @return непустой список, последним элементом всегда идет файл
     */
    public static List<Scope> collectEnclosingScopes(RangeToExtract range) {
        SyntaxNode first = range.firstNode();
        SyntaxNode methodHost = findMethodHost(first);

        List<Scope> scopes = new ArrayList<>();
        for (SyntaxNode current = first.getParent(); current != null; current = current.getParent()) {
            if (SyntaxKinds.isFunctionLike(current)) {
                scopes.add(new Scope(ScopeKind.FUNCTION, current));
            } else if (current == methodHost) {
                scopes.add(new Scope(ScopeKind.CLASS, current));
            } else if (SyntaxKinds.isModuleBody(current)) {
                scopes.add(new Scope(ScopeKind.MODULE, current));
            } else if (SyntaxKinds.isProgram(current)) {
                scopes.add(new Scope(ScopeKind.FILE, current));
            }
        }
        return scopes;
    }

    /**
     * Класс, которому принадлежит ближайший нестатический метод вокруг узла, или null.
     */
    private static SyntaxNode findMethodHost(SyntaxNode node) {
        SyntaxNode function = node.findAncestor(n ->
                SyntaxKinds.isFunctionLike(n) && !"arrow_function".equals(n.getType()));
        if (function == null || !"method_definition".equals(function.getType())) {
            return null;
        }
        if (function.getChildByType("static") != null) {
            return null;
        }
        SyntaxNode body = function.getParent();
        if (body == null || !"class_body".equals(body.getType())) {
            return null;
        }
        SyntaxNode owner = body.getParent();
        return SyntaxKinds.isClassLike(owner) ? owner : null;
    }
}
