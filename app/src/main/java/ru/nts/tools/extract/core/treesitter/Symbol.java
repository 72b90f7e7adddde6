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

/**
 * Символ: сущность, к которой привязаны объявления и ссылки.
 * Сравнивается только по идентичности, одноименные символы разных областей различны.
 */
public final class Symbol {

    private final String name;
    private final List<SyntaxNode> declarations = new ArrayList<>();

    Symbol(String name) {
        this.name = name;
    }

    void addDeclaration(SyntaxNode declaration) {
        declarations.add(declaration);
    }

    public String getName() {
        return name;
    }

    /**
     * Узлы объявлений в порядке их появления в файле.
     */
    public List<SyntaxNode> getDeclarations() {
        return Collections.unmodifiableList(declarations);
    }

    @Override
    public String toString() {
        return "Symbol[" + name + ", declarations=" + declarations.size() + "]";
    }
}
