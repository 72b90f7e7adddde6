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

import java.util.Set;

/**
 * Классификация типов узлов грамматик JavaScript/TypeScript (tree-sitter).
 */
public final class SyntaxKinds {

    private SyntaxKinds() {}

    public static final Set<String> STATEMENTS = Set.of(
            "expression_statement", "variable_declaration", "lexical_declaration",
            "if_statement", "for_statement", "for_in_statement", "while_statement", "do_statement",
            "try_statement", "with_statement", "break_statement", "continue_statement",
            "return_statement", "throw_statement", "empty_statement", "labeled_statement",
            "switch_statement", "statement_block", "debugger_statement",
            "function_declaration", "generator_function_declaration",
            "class_declaration", "abstract_class_declaration",
            "import_statement", "export_statement",
            "type_alias_declaration", "interface_declaration", "enum_declaration",
            "module", "internal_module", "ambient_declaration"
    );

    public static final Set<String> EXPRESSIONS = Set.of(
            "identifier", "this", "super", "number", "string", "template_string", "regex",
            "true", "false", "null", "undefined", "object", "array",
            "function", "function_expression", "arrow_function", "generator_function", "class",
            "call_expression", "new_expression", "member_expression", "subscript_expression",
            "assignment_expression", "augmented_assignment_expression", "await_expression",
            "unary_expression", "binary_expression", "ternary_expression", "update_expression",
            "yield_expression", "parenthesized_expression", "sequence_expression",
            "as_expression", "satisfies_expression", "non_null_expression", "type_assertion",
            "meta_property", "jsx_element", "jsx_self_closing_element"
    );

    public static final Set<String> FUNCTION_LIKE = Set.of(
            "function_declaration", "generator_function_declaration",
            "function", "function_expression", "generator_function",
            "arrow_function", "method_definition"
    );

    public static final Set<String> CLASS_LIKE = Set.of(
            "class_declaration", "abstract_class_declaration", "class"
    );

    public static final Set<String> ITERATION_STATEMENTS = Set.of(
            "for_statement", "for_in_statement", "while_statement", "do_statement"
    );

    private static final Set<String> TYPE_NODES = Set.of(
            "type_annotation", "opting_type_annotation", "omitting_type_annotation",
            "asserts_annotation", "type_predicate_annotation",
            "predefined_type", "type_identifier", "nested_type_identifier", "generic_type",
            "type_arguments", "type_parameters", "type_parameter", "type_query", "index_type_query",
            "lookup_type", "literal_type", "existential_type", "this_type", "constraint",
            "default_type", "implements_clause", "extends_type_clause"
    );

    /**
     * Поля, в которых идентификатор является именем объявления или ключом, а не выражением.
     */
    private static final Set<String> NON_EXPRESSION_FIELDS = Set.of(
            "name", "pattern", "parameter", "label", "property", "key", "alias"
    );

    public static boolean isStatement(SyntaxNode node) {
        return STATEMENTS.contains(node.getType());
    }

    /**
     * Узел является самостоятельным выражением, которое можно вынести.
     * Идентификаторы в позициях имен и левые части присваиваний выражениями не считаются.
     */
    public static boolean isExpression(SyntaxNode node) {
        if (!EXPRESSIONS.contains(node.getType())) {
            return false;
        }
        SyntaxNode parent = node.getParent();
        if (parent == null) {
            return true;
        }
        String field = node.getFieldName();
        if ("identifier".equals(node.getType()) && field != null && NON_EXPRESSION_FIELDS.contains(field)) {
            return false;
        }
        if (("assignment_expression".equals(parent.getType())
                || "augmented_assignment_expression".equals(parent.getType())) && "left".equals(field)) {
            return false;
        }
        if ("update_expression".equals(parent.getType()) && "argument".equals(field)) {
            return false;
        }
        return !isPartOfTypeNode(node);
    }

    public static boolean isFunctionLike(SyntaxNode node) {
        return node != null && FUNCTION_LIKE.contains(node.getType());
    }

    public static boolean isClassLike(SyntaxNode node) {
        return node != null && CLASS_LIKE.contains(node.getType());
    }

    public static boolean isProgram(SyntaxNode node) {
        return node != null && "program".equals(node.getType());
    }

    /**
     * Тело пространства имен / модуля: блок, родитель которого namespace или module.
     */
    public static boolean isModuleBody(SyntaxNode node) {
        if (node == null || !"statement_block".equals(node.getType()) || node.getParent() == null) {
            return false;
        }
        String parentType = node.getParent().getType();
        return "internal_module".equals(parentType) || "module".equals(parentType);
    }

    /**
     * Контейнер последовательности операторов: блок, файл, тело модуля, ветка switch.
     */
    public static boolean isBlockLike(SyntaxNode node) {
        if (node == null) {
            return false;
        }
        return switch (node.getType()) {
            case "statement_block", "program", "switch_case", "switch_default" -> true;
            default -> false;
        };
    }

    public static boolean isIterationStatement(SyntaxNode node) {
        return node != null && ITERATION_STATEMENTS.contains(node.getType());
    }

    public static boolean isTypeNode(SyntaxNode node) {
        String type = node.getType();
        return TYPE_NODES.contains(type) || type.endsWith("_type");
    }

    /**
     * Узел лежит внутри аннотации или выражения типа.
     */
    public static boolean isPartOfTypeNode(SyntaxNode node) {
        for (SyntaxNode current = node; current != null; current = current.getParent()) {
            if (isTypeNode(current)) {
                return true;
            }
            if (isStatement(current) || isFunctionLike(current)) {
                return false;
            }
        }
        return false;
    }

    /**
     * Узел открывает собственную область видимости для let/const/class.
     */
    public static boolean isBlockScopeContainer(SyntaxNode node) {
        return switch (node.getType()) {
            case "program", "for_statement", "for_in_statement", "catch_clause", "switch_body",
                 "internal_module", "module" -> true;
            case "statement_block" -> !isFunctionLike(node.getParent());
            default -> isFunctionLike(node);
        };
    }

    /**
     * Ближайший контейнер области видимости для объявления, начиная с его родителя.
     */
    public static SyntaxNode getEnclosingBlockScopeContainer(SyntaxNode declaration) {
        SyntaxNode container = declaration.findAncestor(SyntaxKinds::isBlockScopeContainer);
        return container != null ? container : declaration.getSourceFile().getRoot();
    }
}
