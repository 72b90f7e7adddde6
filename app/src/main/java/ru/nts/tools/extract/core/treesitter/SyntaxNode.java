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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Predicate;

/**
 * Неизменяемый узел синтаксического дерева.
 * Зеркалирует узел tree-sitter с позициями в символах (не в байтах UTF-8).
 * Дети принадлежат узлу, ссылка на родителя не владеющая.
 */
public final class SyntaxNode {

    private final SourceFile file;
    private final SyntaxNode parent;
    private final String type;
    private final boolean named;
    private final boolean missing;
    private final int start;
    private final int end;
    private final int indexInParent;
    private String fieldName;
    private List<SyntaxNode> children = List.of();

    SyntaxNode(SourceFile file, SyntaxNode parent, String type, boolean named, boolean missing,
               int start, int end, int indexInParent) {
        this.file = file;
        this.parent = parent;
        this.type = type;
        this.named = named;
        this.missing = missing;
        this.start = start;
        this.end = end;
        this.indexInParent = indexInParent;
    }

    void setChildren(List<SyntaxNode> children) {
        this.children = Collections.unmodifiableList(children);
    }

    void setFieldName(String fieldName) {
        this.fieldName = fieldName;
    }

    public SourceFile getSourceFile() {
        return file;
    }

    public SyntaxNode getParent() {
        return parent;
    }

    public String getType() {
        return type;
    }

    public boolean isNamed() {
        return named;
    }

    public boolean isMissing() {
        return missing;
    }

    /**
     * Имя поля, под которым узел числится у родителя (condition, body, left...), или null.
     */
    public String getFieldName() {
        return fieldName;
    }

    public boolean isField(String name) {
        return name.equals(fieldName);
    }

    public int getStart() {
        return start;
    }

    public int getEnd() {
        return end;
    }

    public TextSpan getSpan() {
        return new TextSpan(start, end);
    }

    public List<SyntaxNode> getChildren() {
        return children;
    }

    public int getChildCount() {
        return children.size();
    }

    public SyntaxNode getChild(int index) {
        return children.get(index);
    }

    public int getIndexInParent() {
        return indexInParent;
    }

    /**
     * Первый дочерний узел с указанным именем поля.
     *
     * @return узел или null, если поле отсутствует
     */
    public SyntaxNode getChildByField(String name) {
        for (SyntaxNode child : children) {
            if (name.equals(child.fieldName)) {
                return child;
            }
        }
        return null;
    }

    /**
     * Первый дочерний узел указанного типа или null.
     */
    public SyntaxNode getChildByType(String childType) {
        for (SyntaxNode child : children) {
            if (childType.equals(child.type)) {
                return child;
            }
        }
        return null;
    }

    public List<SyntaxNode> getNamedChildren() {
        List<SyntaxNode> result = new ArrayList<>();
        for (SyntaxNode child : children) {
            if (child.named) {
                result.add(child);
            }
        }
        return result;
    }

    /**
     * Ближайший предок (не включая сам узел), удовлетворяющий условию.
     */
    public SyntaxNode findAncestor(Predicate<SyntaxNode> predicate) {
        for (SyntaxNode current = parent; current != null; current = current.parent) {
            if (predicate.test(current)) {
                return current;
            }
        }
        return null;
    }

    public String getText() {
        return file.getContent().substring(start, end);
    }

    @Override
    public String toString() {
        return type + "[" + start + ".." + end + ")";
    }
}
