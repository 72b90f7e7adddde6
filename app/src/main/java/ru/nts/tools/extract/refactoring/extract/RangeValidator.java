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
import ru.nts.tools.extract.core.treesitter.SyntaxKinds;
import ru.nts.tools.extract.core.treesitter.SyntaxNode;
import ru.nts.tools.extract.core.treesitter.TextSpan;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Проверка выделения: находит покрывающие узлы и убеждается,
 * что их можно вынести в отдельную функцию без изменения потока управления.
 * <p>
 * Выделение допустимо, если оно покрывает одно выражение или последовательность
 * соседних операторов одного блока, и ни один переход (break, continue, return)
 * внутри него не ведет за пределы выделения туда, куда вызов функции не доберется.
 */
public final class RangeValidator {

    private RangeValidator() {}

    /**
     * Разрешенные безметочные переходы в текущей точке обхода.
     */
    enum Jump {
        BREAK, CONTINUE, RETURN
    }

    /**
     * Находит диапазон для извлечения.
     *
     * @param file разобранный файл
     * @param span выделение в символах
     * @return диапазон или empty, если выделение нельзя извлечь
     */
    public static Optional<RangeToExtract> getRangeToExtract(SourceFile file, TextSpan span) {
        if (span.isEmpty() || span.end() > file.getContent().length()) {
            return Optional.empty();
        }

        SyntaxNode start = getParentNodeInSpan(file.getTokenAtPosition(span.start()), span);
        SyntaxNode end = getParentNodeInSpan(file.findTokenOnLeftOfPosition(span.end()), span);
        if (start == null || end == null || start.getParent() != end.getParent()) {
            return Optional.empty();
        }
        if (!spanContainsNode(span, start) || !spanContainsNode(span, end)) {
            return Optional.empty();
        }

        LegalityCheck check = new LegalityCheck(initialJumps(start));

        if (start == end) {
            if (!check.accepts(start)) {
                return Optional.empty();
            }
            if (SyntaxKinds.isStatement(start)) {
                return Optional.of(new RangeToExtract(List.of(start), false, check.facts));
            }
            if (SyntaxKinds.isExpression(start)) {
                return Optional.of(new RangeToExtract(List.of(start), true, check.facts));
            }
            return Optional.empty();
        }

        SyntaxNode parent = start.getParent();
        if (!SyntaxKinds.isBlockLike(parent) && !SyntaxKinds.isModuleBody(parent)) {
            return Optional.empty();
        }

        List<SyntaxNode> statements = new ArrayList<>();
        for (int i = start.getIndexInParent(); i <= end.getIndexInParent(); i++) {
            SyntaxNode sibling = parent.getChild(i);
            if (SourceFile.isComment(sibling)) {
                continue;
            }
            if (!SyntaxKinds.isStatement(sibling) && !SyntaxKinds.isExpression(sibling)) {
                return Optional.empty();
            }
            if (!check.accepts(sibling)) {
                return Optional.empty();
            }
            statements.add(sibling);
        }
        return Optional.of(new RangeToExtract(statements, false, check.facts));
    }

    /**
     * Поднимается от узла, пока родитель целиком лежит внутри выделения.
     * Верхним пределом служит непосредственный потомок program.
     */
    static SyntaxNode getParentNodeInSpan(SyntaxNode node, TextSpan span) {
        SyntaxNode current = node;
        while (current != null) {
            SyntaxNode parent = current.getParent();
            if (parent == null) {
                return null;
            }
            if (SyntaxKinds.isProgram(parent) || !spanContainsNode(span, parent)) {
                return current;
            }
            current = parent;
        }
        return null;
    }

    static boolean spanContainsNode(TextSpan span, SyntaxNode node) {
        return span.contains(node.getStart()) && node.getEnd() <= span.end();
    }

    /**
     * Разрешенные переходы на границе выделения.
     * Определяются ближайшей охватывающей конструкцией (до границы функции):
     * ветка условия, блок try и тело catch запрещают return, блок finally разрешает.
     * Break и continue на границе запрещены всегда: их цель лежит вне выделения.
     */
    static Set<Jump> initialJumps(SyntaxNode node) {
        for (SyntaxNode current = node; current.getParent() != null; current = current.getParent()) {
            SyntaxNode parent = current.getParent();
            if (SyntaxKinds.isFunctionLike(parent) || SyntaxKinds.isClassLike(parent)) {
                break;
            }
            Set<Jump> restricted = restrictedBy(current, parent);
            if (restricted != null) {
                return restricted;
            }
        }
        return EnumSet.of(Jump.RETURN);
    }

    /**
     * Сброс разрешенных переходов при входе в узел, либо null, если конструкция их не сбрасывает.
     */
    private static Set<Jump> restrictedBy(SyntaxNode node, SyntaxNode parent) {
        return switch (parent.getType()) {
            case "if_statement" -> node.isField("consequence") || node.isField("alternative")
                    ? EnumSet.noneOf(Jump.class) : null;
            case "try_statement" -> {
                if (node.isField("body")) {
                    yield EnumSet.noneOf(Jump.class);
                }
                yield node.isField("finalizer") ? EnumSet.of(Jump.RETURN) : null;
            }
            case "catch_clause" -> node.isField("body") ? EnumSet.noneOf(Jump.class) : null;
            default -> null;
        };
    }

    /**
     * Обход выделенных узлов с явным стеком состояния:
     * набор разрешенных переходов сохраняется и восстанавливается вокруг каждого поддерева.
     */
    private static final class LegalityCheck {

        private final Set<Jump> initial;
        private final Deque<String> labels = new ArrayDeque<>();
        private Set<Jump> permitted;
        private boolean canExtract = true;
        private RangeFacts facts = RangeFacts.NONE;

        LegalityCheck(Set<Jump> initial) {
            this.initial = initial;
        }

        boolean accepts(SyntaxNode node) {
            permitted = EnumSet.copyOf(initial);
            labels.clear();
            visitRoot(node);
            return canExtract;
        }

        /**
         * Корень выделения: правила родителя уже учтены в начальном наборе.
         */
        private void visitRoot(SyntaxNode node) {
            if (SyntaxKinds.isFunctionLike(node) || SyntaxKinds.isClassLike(node)) {
                return;
            }
            visitNode(node);
        }

        private void visit(SyntaxNode node) {
            if (!canExtract) {
                return;
            }
            if (SyntaxKinds.isFunctionLike(node) || SyntaxKinds.isClassLike(node)) {
                return;
            }
            Set<Jump> saved = EnumSet.copyOf(permitted);
            SyntaxNode parent = node.getParent();
            Set<Jump> restricted = restrictedBy(node, parent);
            if (restricted != null) {
                permitted = EnumSet.copyOf(restricted);
            } else if ("switch_case".equals(parent.getType()) || "switch_default".equals(parent.getType())) {
                if (!node.isField("value")) {
                    permitted.add(Jump.BREAK);
                }
            } else if (SyntaxKinds.isIterationStatement(parent) && node.isField("body")) {
                permitted.add(Jump.BREAK);
                permitted.add(Jump.CONTINUE);
            }

            visitNode(node);
            permitted = saved;
        }

        private void visitNode(SyntaxNode node) {
            switch (node.getType()) {
                case "labeled_statement" -> {
                    SyntaxNode label = node.getChildByField("label");
                    labels.push(label != null ? label.getText() : "");
                    visitChildren(node);
                    labels.pop();
                }
                case "break_statement", "continue_statement" -> {
                    SyntaxNode label = node.getChildByField("label");
                    if (label != null) {
                        if (!labels.contains(label.getText())) {
                            canExtract = false;
                        }
                    } else {
                        Jump jump = "break_statement".equals(node.getType()) ? Jump.BREAK : Jump.CONTINUE;
                        if (!permitted.contains(jump)) {
                            canExtract = false;
                        }
                    }
                }
                case "return_statement" -> {
                    if (permitted.contains(Jump.RETURN)) {
                        facts = facts.withReturn();
                        visitChildren(node);
                    } else {
                        canExtract = false;
                    }
                }
                case "await_expression" -> {
                    facts = facts.withAsync();
                    visitChildren(node);
                }
                case "yield_expression" -> {
                    facts = facts.withGenerator();
                    visitChildren(node);
                }
                case "for_in_statement" -> {
                    if (node.getChildByType("await") != null) {
                        facts = facts.withAsync();
                    }
                    visitChildren(node);
                }
                default -> visitChildren(node);
            }
        }

        private void visitChildren(SyntaxNode node) {
            for (SyntaxNode child : node.getChildren()) {
                visit(child);
                if (!canExtract) {
                    return;
                }
            }
        }
    }
}
