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

import ru.nts.tools.extract.core.treesitter.LanguageDetector;
import ru.nts.tools.extract.core.treesitter.SourceFile;
import ru.nts.tools.extract.core.treesitter.SyntaxKinds;
import ru.nts.tools.extract.core.treesitter.SyntaxNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Синтез функции для одной области.
 * <p>
 * Строит объявление (функцию или приватный метод), переписывает return для возврата
 * измененных переменных и формирует вызов на месте исходного диапазона.
 * Исходное дерево не изменяется: тело собирается из текста узлов.
 */
public final class FunctionSynthesizer {

    /**
     * Зарезервированное поле объекта-результата для значения исходного return.
     */
    public static final String RETURN_VALUE_PROPERTY = "__return";

    private FunctionSynthesizer() {}

    /**
     * Место вставки объявления.
     *
     * @param position   смещение вставки
     * @param prefix     текст перед объявлением
     * @param suffix     текст после объявления
     * @param declIndent отступ строки объявления
     */
    record InsertionPoint(int position, String prefix, String suffix, String declIndent) {
    }

    /**
     * Тело новой функции.
     *
     * @param text         текст с отступами, без обрамляющих скобок
     * @param returnsValue хотя бы один переписанный return возвращал значение
     */
    record Body(String text, boolean returnsValue) {
    }

    /**
     * Формирует правки для извлечения диапазона в указанную область.
     *
     * @return результат или empty, если в области некуда вставить объявление
     *         (стрелочная функция с телом-выражением, незакрытый блок)
     */
    public static Optional<ExtractResultForScope> extractFunctionInScope(RangeToExtract range, Scope scope,
                                                                         Map<String, UsageEntry> usages,
                                                                         ExtractionContext context) {
        SourceFile file = context.file();
        ExtractionOptions options = context.options();
        String nl = options.newLine();

        Optional<InsertionPoint> insertion = findInsertionPoint(scope, file, options);
        if (insertion.isEmpty()) {
            return Optional.empty();
        }
        InsertionPoint point = insertion.get();

        List<String> parameters = new ArrayList<>(usages.keySet());
        List<String> writes = new ArrayList<>();
        for (Map.Entry<String, UsageEntry> entry : usages.entrySet()) {
            if (entry.getValue().usage() == Usage.WRITE) {
                writes.add(entry.getKey());
            }
        }

        RangeFacts facts = range.facts();
        String bodyIndent = point.declIndent() + options.indentUnit();
        Body body = transformFunctionBody(range, writes, bodyIndent, nl);

        String declaration = point.declIndent() + buildHeader(scope, file, facts, options.functionName(), parameters)
                + nl + (body.text().isEmpty() ? "" : body.text() + nl)
                + point.declIndent() + "}";

        String call = buildCall(scope, facts, options.functionName(), parameters);
        List<String> replacement = buildReplacement(range, call, writes, body.returnsValue());

        SyntaxNode first = range.firstNode();
        SyntaxNode last = range.lastNode();
        SyntaxNode previousToken = file.findPrecedingToken(first.getStart());
        int anchor = previousToken != null ? previousToken.getEnd() : 0;
        String leadingTrivia = file.getContent().substring(anchor, first.getStart());
        String rangeIndent = file.getIndentation(first.getStart());

        List<TextChange> changes = List.of(
                TextChange.insert(point.position(), point.prefix() + declaration + point.suffix()),
                TextChange.delete(anchor, last.getEnd()),
                TextChange.insert(anchor, leadingTrivia + String.join(nl + rangeIndent, replacement)));

        return Optional.of(new ExtractResultForScope(scope, changes, parameters, writes));
    }

    static Optional<InsertionPoint> findInsertionPoint(Scope scope, SourceFile file, ExtractionOptions options) {
        String content = file.getContent();
        String nl = options.newLine();
        if (scope.kind() == ScopeKind.FILE) {
            String prefix = content.isEmpty() || content.endsWith("\n") ? nl : nl + nl;
            return Optional.of(new InsertionPoint(content.length(), prefix, nl, ""));
        }

        SyntaxNode body = switch (scope.kind()) {
            case FUNCTION, CLASS -> scope.node().getChildByField("body");
            default -> scope.node();
        };
        if (body == null || !("statement_block".equals(body.getType()) || "class_body".equals(body.getType()))) {
            return Optional.empty();
        }
        SyntaxNode close = body.getChild(body.getChildCount() - 1);
        if (!"}".equals(close.getType()) || close.isMissing()) {
            return Optional.empty();
        }

        int lineStart = file.getLineStart(close.getStart());
        String beforeBrace = content.substring(lineStart, close.getStart());
        if (beforeBrace.isBlank()) {
            return Optional.of(new InsertionPoint(lineStart, nl, nl, beforeBrace + options.indentUnit()));
        }
        String closeIndent = file.getIndentation(close.getStart());
        return Optional.of(new InsertionPoint(close.getStart(), nl, nl + closeIndent,
                closeIndent + options.indentUnit()));
    }

    private static String buildHeader(Scope scope, SourceFile file, RangeFacts facts,
                                      String name, List<String> parameters) {
        StringBuilder header = new StringBuilder();
        String parameterList = "(" + String.join(", ", parameters) + ") {";
        if (scope.isClassLike()) {
            if (LanguageDetector.supportsAccessModifiers(file.getLangId())) {
                header.append("private ");
            }
            if (facts.isAsyncFunction()) {
                header.append("async ");
            }
            if (facts.isGenerator()) {
                header.append('*');
            }
            return header.append(name).append(parameterList).toString();
        }
        if (facts.isAsyncFunction()) {
            header.append("async ");
        }
        header.append(facts.isGenerator() ? "function* " : "function ");
        return header.append(name).append(parameterList).toString();
    }

    private static String buildCall(Scope scope, RangeFacts facts, String name, List<String> parameters) {
        String call = (scope.isClassLike() ? "this." : "") + name + "(" + String.join(", ", parameters) + ")";
        if (facts.isGenerator()) {
            call = "yield* " + call;
        }
        if (facts.isAsyncFunction()) {
            call = facts.isGenerator() ? "await (" + call + ")" : "await " + call;
        }
        return call;
    }

    private static List<String> buildReplacement(RangeToExtract range, String call,
                                                 List<String> writes, boolean returnsValue) {
        RangeFacts facts = range.facts();
        if (!writes.isEmpty()) {
            String targets = String.join(", ", writes);
            if (range.expression()) {
                return List.of("({ " + targets + " } = " + call + ")." + RETURN_VALUE_PROPERTY);
            }
            if (returnsValue) {
                return List.of(
                        "let " + RETURN_VALUE_PROPERTY + ";",
                        "({ " + targets + ", " + RETURN_VALUE_PROPERTY + " } = " + call + ");",
                        "return " + RETURN_VALUE_PROPERTY + ";");
            }
            return List.of("({ " + targets + " } = " + call + ");");
        }
        if (facts.hasReturn()) {
            return List.of("return " + call + ";");
        }
        if (!range.expression()) {
            return List.of(call + ";");
        }
        return List.of(facts.isGenerator() && !facts.isAsyncFunction() ? "(" + call + ")" : call);
    }

    /**
     * Строит тело функции. Выражение превращается в {@code return <expr>;}.
     * При наличии записей каждый return (вне вложенных функций и классов) возвращает объект
     * с записанными переменными, а в конец добавляется такой же return,
     * если последний оператор не return и не throw.
     */
    static Body transformFunctionBody(RangeToExtract range, List<String> writes, String bodyIndent, String nl) {
        SourceFile file = range.sourceFile();
        String writesObject = "{ " + String.join(", ", writes) + " }";

        if (range.expression()) {
            SyntaxNode expression = range.firstNode();
            BodyWriter writer = new BodyWriter(file, expression, bodyIndent);
            writer.append(bodyIndent);
            if (writes.isEmpty()) {
                writer.append("return ");
                writer.copy(expression.getStart(), expression.getEnd());
                writer.append(";");
            } else {
                writer.append("return { " + RETURN_VALUE_PROPERTY + ": ");
                writer.copy(expression.getStart(), expression.getEnd());
                writer.append(", " + String.join(", ", writes) + " };");
            }
            return new Body(writer.toString(), true);
        }

        List<SyntaxNode> statements = statementsOf(range);
        if (statements.isEmpty()) {
            if (writes.isEmpty()) {
                return new Body("", false);
            }
            return new Body(bodyIndent + "return " + writesObject + ";", false);
        }

        int start = statements.get(0).getStart();
        int end = statements.get(statements.size() - 1).getEnd();
        BodyWriter writer = new BodyWriter(file, statements.get(0), bodyIndent);
        writer.append(bodyIndent);
        if (writes.isEmpty()) {
            writer.copy(start, end);
            return new Body(writer.toString(), false);
        }

        List<SyntaxNode> returns = new ArrayList<>();
        for (SyntaxNode statement : statements) {
            collectReturns(statement, returns);
        }

        boolean returnsValue = false;
        int position = start;
        for (SyntaxNode returnStatement : returns) {
            writer.copy(position, returnStatement.getStart());
            SyntaxNode value = returnValue(returnStatement);
            if (value != null) {
                returnsValue = true;
                writer.append("return { " + RETURN_VALUE_PROPERTY + ": ");
                writer.copy(value.getStart(), value.getEnd());
                writer.append(", " + String.join(", ", writes) + " };");
            } else {
                writer.append("return " + writesObject + ";");
            }
            position = returnStatement.getEnd();
        }
        writer.copy(position, end);

        SyntaxNode lastStatement = lastNonComment(statements);
        String lastType = lastStatement != null ? lastStatement.getType() : "";
        if (!"return_statement".equals(lastType) && !"throw_statement".equals(lastType)) {
            writer.append(nl + bodyIndent + "return " + writesObject + ";");
        }
        return new Body(writer.toString(), returnsValue);
    }

    /**
     * Операторы тела: содержимое блока, если выделен ровно один блок, иначе сами узлы диапазона.
     */
    private static List<SyntaxNode> statementsOf(RangeToExtract range) {
        if (range.nodes().size() == 1 && "statement_block".equals(range.firstNode().getType())) {
            List<SyntaxNode> inner = new ArrayList<>();
            for (SyntaxNode child : range.firstNode().getChildren()) {
                if (!"{".equals(child.getType()) && !"}".equals(child.getType())) {
                    inner.add(child);
                }
            }
            return inner;
        }
        return range.nodes();
    }

    private static SyntaxNode lastNonComment(List<SyntaxNode> statements) {
        for (int i = statements.size() - 1; i >= 0; i--) {
            if (!SourceFile.isComment(statements.get(i))) {
                return statements.get(i);
            }
        }
        return null;
    }

    private static void collectReturns(SyntaxNode node, List<SyntaxNode> result) {
        if (SyntaxKinds.isFunctionLike(node) || SyntaxKinds.isClassLike(node)) {
            return;
        }
        if ("return_statement".equals(node.getType())) {
            result.add(node);
            return;
        }
        for (SyntaxNode child : node.getChildren()) {
            collectReturns(child, result);
        }
    }

    private static SyntaxNode returnValue(SyntaxNode returnStatement) {
        for (SyntaxNode child : returnStatement.getChildren()) {
            if (child.isNamed() && !SourceFile.isComment(child)) {
                return child;
            }
        }
        return null;
    }

    /**
     * Копирует исходный текст с переносом отступа: базовый отступ первой строки
     * заменяется отступом тела. Строки внутри многострочных шаблонных строк не трогаются.
     */
    private static final class BodyWriter {

        private final String content;
        private final String baseIndent;
        private final String bodyIndent;
        private final List<SyntaxNode> templates = new ArrayList<>();
        private final StringBuilder out = new StringBuilder();

        BodyWriter(SourceFile file, SyntaxNode first, String bodyIndent) {
            this.content = file.getContent();
            this.baseIndent = file.getIndentation(first.getStart());
            this.bodyIndent = bodyIndent;
            SyntaxNode container = first.getParent() != null ? first.getParent() : first;
            collectTemplates(container);
        }

        private void collectTemplates(SyntaxNode node) {
            if ("template_string".equals(node.getType())) {
                templates.add(node);
                return;
            }
            for (SyntaxNode child : node.getChildren()) {
                collectTemplates(child);
            }
        }

        private boolean insideTemplate(int position) {
            for (SyntaxNode template : templates) {
                if (template.getStart() < position && position < template.getEnd()) {
                    return true;
                }
            }
            return false;
        }

        void append(String text) {
            out.append(text);
        }

        void copy(int from, int to) {
            int i = from;
            while (i < to) {
                char c = content.charAt(i);
                out.append(c);
                i++;
                if (c != '\n' || insideTemplate(i)) {
                    continue;
                }
                int k = 0;
                while (k < baseIndent.length() && i < to && content.charAt(i) == baseIndent.charAt(k)) {
                    i++;
                    k++;
                }
                // на i == to строку продолжает сгенерированный текст
                if (i == to || (content.charAt(i) != '\n' && content.charAt(i) != '\r')) {
                    out.append(bodyIndent);
                }
            }
        }

        @Override
        public String toString() {
            return out.toString();
        }
    }
}
