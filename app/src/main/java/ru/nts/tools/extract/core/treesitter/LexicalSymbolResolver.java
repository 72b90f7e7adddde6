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
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Лексическое связывание имен в пределах одного файла JavaScript/TypeScript.
 * <p>
 * Объявления собираются за один проход по дереву:
 * <ul>
 *   <li>{@code var} и параметры привязываются к ближайшей функции (или файлу);</li>
 *   <li>{@code let}/{@code const}, классы и функции - к ближайшему блочному контейнеру;</li>
 *   <li>деструктурирующие шаблоны раскрываются до отдельных идентификаторов.</li>
 * </ul>
 * Ссылка разрешается поиском имени в контейнерах от внутреннего к внешнему.
 * Глобальные и встроенные имена не разрешаются.
 */
public final class LexicalSymbolResolver implements SymbolResolver {

    private final Map<SyntaxNode, Map<String, Symbol>> scopes = new HashMap<>();
    private final Map<SyntaxNode, Symbol> bindings = new HashMap<>();

    public LexicalSymbolResolver(SourceFile file) {
        visit(file.getRoot());
    }

    @Override
    public Optional<Symbol> resolve(SyntaxNode identifier) {
        Symbol bound = bindings.get(identifier);
        if (bound != null) {
            return Optional.of(bound);
        }
        if (!isReferenceType(identifier.getType())) {
            return Optional.empty();
        }
        String name = identifier.getText();
        for (SyntaxNode current = identifier.getParent(); current != null; current = current.getParent()) {
            if (!SyntaxKinds.isBlockScopeContainer(current)) {
                continue;
            }
            Map<String, Symbol> names = scopes.get(current);
            if (names != null && names.containsKey(name)) {
                return Optional.of(names.get(name));
            }
        }
        return Optional.empty();
    }

    @Override
    public List<SyntaxNode> declarations(Symbol symbol) {
        return symbol.getDeclarations();
    }

    private static boolean isReferenceType(String type) {
        return switch (type) {
            case "identifier", "shorthand_property_identifier", "shorthand_property_identifier_pattern" -> true;
            default -> false;
        };
    }

    private void visit(SyntaxNode node) {
        switch (node.getType()) {
            case "variable_declarator" -> declareVariable(node);
            case "function_declaration", "generator_function_declaration",
                 "class_declaration", "abstract_class_declaration" -> declareHoisted(node);
            case "function", "function_expression", "generator_function" -> declareOwnName(node);
            case "formal_parameters" -> declareParameters(node);
            case "arrow_function" -> declareArrowParameter(node);
            case "catch_clause" -> declarePattern(node.getChildByField("parameter"), node);
            case "for_in_statement" -> declareLoopVariable(node);
            case "import_clause" -> declareImports(node);
            case "enum_declaration", "internal_module", "module" -> declareName(node);
            default -> {
            }
        }
        for (SyntaxNode child : node.getChildren()) {
            visit(child);
        }
    }

    private void declareVariable(SyntaxNode declarator) {
        SyntaxNode declaration = declarator.getParent();
        boolean hoisted = declaration != null && "variable_declaration".equals(declaration.getType());
        SyntaxNode pattern = declarator.getChildByField("name");
        for (SyntaxNode id : bindingIdentifiers(pattern)) {
            SyntaxNode container = hoisted ? hoistTarget(id) : SyntaxKinds.getEnclosingBlockScopeContainer(id);
            declare(container, id, id);
        }
    }

    /**
     * Объявления функций и классов: объявлением символа считается весь узел.
     */
    private void declareHoisted(SyntaxNode node) {
        SyntaxNode name = node.getChildByField("name");
        if (name == null) {
            return;
        }
        declare(SyntaxKinds.getEnclosingBlockScopeContainer(node), name, node);
    }

    /**
     * Имя функционального выражения видно только внутри него самого.
     */
    private void declareOwnName(SyntaxNode function) {
        SyntaxNode name = function.getChildByField("name");
        if (name != null && "identifier".equals(name.getType())) {
            declare(function, name, function);
        }
    }

    private void declareParameters(SyntaxNode parameters) {
        SyntaxNode function = parameters.getParent();
        if (function == null) {
            return;
        }
        for (SyntaxNode parameter : parameters.getNamedChildren()) {
            SyntaxNode pattern = switch (parameter.getType()) {
                case "required_parameter", "optional_parameter" -> parameter.getChildByField("pattern");
                default -> parameter;
            };
            declarePattern(pattern, function);
        }
    }

    private void declareArrowParameter(SyntaxNode arrow) {
        SyntaxNode parameter = arrow.getChildByField("parameter");
        if (parameter != null) {
            declarePattern(parameter, arrow);
        }
    }

    private void declareLoopVariable(SyntaxNode loop) {
        SyntaxNode kind = loop.getChildByField("kind");
        if (kind == null) {
            return;
        }
        boolean hoisted = "var".equals(kind.getType());
        for (SyntaxNode id : bindingIdentifiers(loop.getChildByField("left"))) {
            declare(hoisted ? hoistTarget(id) : loop, id, id);
        }
    }

    private void declareImports(SyntaxNode clause) {
        SyntaxNode program = clause.getSourceFile().getRoot();
        for (SyntaxNode child : clause.getNamedChildren()) {
            switch (child.getType()) {
                case "identifier" -> declare(program, child, child);
                case "namespace_import" -> {
                    SyntaxNode id = child.getChildByType("identifier");
                    if (id != null) {
                        declare(program, id, id);
                    }
                }
                case "named_imports" -> {
                    for (SyntaxNode specifier : child.getNamedChildren()) {
                        if (!"import_specifier".equals(specifier.getType())) {
                            continue;
                        }
                        SyntaxNode alias = specifier.getChildByField("alias");
                        SyntaxNode id = alias != null ? alias : specifier.getChildByField("name");
                        if (id != null && "identifier".equals(id.getType())) {
                            declare(program, id, id);
                        }
                    }
                }
                default -> {
                }
            }
        }
    }

    private void declareName(SyntaxNode node) {
        SyntaxNode name = node.getChildByField("name");
        if (name != null && "identifier".equals(name.getType())) {
            declare(SyntaxKinds.getEnclosingBlockScopeContainer(node), name, name);
        }
    }

    private void declarePattern(SyntaxNode pattern, SyntaxNode container) {
        for (SyntaxNode id : bindingIdentifiers(pattern)) {
            declare(container, id, id);
        }
    }

    private void declare(SyntaxNode container, SyntaxNode binding, SyntaxNode declaration) {
        Symbol symbol = scopes.computeIfAbsent(container, c -> new LinkedHashMap<>())
                .computeIfAbsent(binding.getText(), Symbol::new);
        symbol.addDeclaration(declaration);
        bindings.put(binding, symbol);
    }

    private static SyntaxNode hoistTarget(SyntaxNode node) {
        SyntaxNode target = node.findAncestor(n -> SyntaxKinds.isFunctionLike(n) || SyntaxKinds.isProgram(n));
        return target != null ? target : node.getSourceFile().getRoot();
    }

    /**
     * Раскрывает шаблон привязки до идентификаторов, которые он объявляет.
     */
    static List<SyntaxNode> bindingIdentifiers(SyntaxNode pattern) {
        List<SyntaxNode> result = new ArrayList<>();
        collectBindingIdentifiers(pattern, result);
        return result;
    }

    private static void collectBindingIdentifiers(SyntaxNode pattern, List<SyntaxNode> result) {
        if (pattern == null) {
            return;
        }
        switch (pattern.getType()) {
            case "identifier", "shorthand_property_identifier_pattern" -> result.add(pattern);
            case "pair_pattern" -> collectBindingIdentifiers(pattern.getChildByField("value"), result);
            case "object_assignment_pattern", "assignment_pattern" ->
                    collectBindingIdentifiers(pattern.getChildByField("left"), result);
            case "object_pattern", "array_pattern", "rest_pattern" -> {
                for (SyntaxNode child : pattern.getNamedChildren()) {
                    collectBindingIdentifiers(child, result);
                }
            }
            default -> {
            }
        }
    }
}
