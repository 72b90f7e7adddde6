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
import ru.nts.tools.extract.core.treesitter.SyntaxNode;
import ru.nts.tools.extract.core.treesitter.TextSpan;

import java.util.List;

/**
 * Диапазон, пригодный для извлечения: одно выражение
 * или непрерывная последовательность соседних операторов с общим родителем.
 *
 * @param nodes      выделенные узлы (для выражения ровно один)
 * @param expression true, если диапазон является одиночным выражением
 * @param facts      факты, собранные проверкой допустимости переходов
 */
public record RangeToExtract(List<SyntaxNode> nodes, boolean expression, RangeFacts facts) {

    public RangeToExtract {
        if (nodes.isEmpty()) {
            throw new IllegalArgumentException("Range must contain at least one node");
        }
        if (expression && nodes.size() != 1) {
            throw new IllegalArgumentException("Expression range must contain exactly one node");
        }
        nodes = List.copyOf(nodes);
    }

    public SyntaxNode firstNode() {
        return nodes.get(0);
    }

    public SyntaxNode lastNode() {
        return nodes.get(nodes.size() - 1);
    }

    public SourceFile sourceFile() {
        return firstNode().getSourceFile();
    }

    /**
     * Текстовый охват диапазона: от начала первого узла до конца последнего.
     */
    public TextSpan enclosingTextRange() {
        return TextSpan.fromBounds(firstNode().getStart(), lastNode().getEnd());
    }
}
