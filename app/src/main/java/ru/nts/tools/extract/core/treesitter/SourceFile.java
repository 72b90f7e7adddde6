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

import org.treesitter.TSNode;
import org.treesitter.TSTree;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Разобранный исходный файл: текст, язык и неизменяемое зеркало AST.
 * Дерево tree-sitter отображается один раз при создании, позиции переводятся из байтов UTF-8 в символы.
 */
public final class SourceFile {

    /**
     * Имена полей грамматик JavaScript/TypeScript, которые нужны анализу.
     * Поле дочернего узла определяется через getChildByFieldName.
     */
    private static final String[] FIELD_NAMES = {
            "body", "condition", "consequence", "alternative", "initializer", "increment",
            "left", "right", "value", "handler", "finalizer", "parameter", "parameters",
            "label", "name", "object", "property", "index", "argument", "operator",
            "function", "arguments", "pattern", "type", "return_type", "key", "kind",
            "declaration", "source", "constructor", "alias", "type_parameters", "type_arguments"
    };

    private final Path path;
    private final String content;
    private final String langId;
    private final int[] byteToChar;
    private final SyntaxNode root;
    private final List<SyntaxNode> tokens = new ArrayList<>();
    private boolean syntaxErrors;

    SourceFile(Path path, String content, String langId, TSTree tree) {
        this.path = path;
        this.content = content;
        this.langId = langId;
        this.byteToChar = buildByteToCharMap(content);
        this.root = mirror(tree.getRootNode(), null, 0);
        collectTokens(root);
    }

    /**
     * Разбирает текст через {@link TreeSitterManager}.
     *
     * @param content исходный код
     * @param langId  идентификатор языка (javascript, typescript, tsx)
     */
    public static SourceFile parse(String content, String langId) {
        return TreeSitterManager.getInstance().parseSource(content, langId);
    }

    /**
     * Строит таблицу соответствия байтового смещения UTF-8 символьному.
     */
    private static int[] buildByteToCharMap(String content) {
        int byteLength = 0;
        for (int i = 0; i < content.length(); ) {
            int cp = content.codePointAt(i);
            byteLength += utf8Length(cp);
            i += Character.charCount(cp);
        }

        int[] map = new int[byteLength + 1];
        int bytePos = 0;
        for (int i = 0; i < content.length(); ) {
            int cp = content.codePointAt(i);
            int len = utf8Length(cp);
            for (int k = 0; k < len; k++) {
                map[bytePos + k] = i;
            }
            bytePos += len;
            i += Character.charCount(cp);
        }
        map[byteLength] = content.length();
        return map;
    }

    private static int utf8Length(int cp) {
        if (cp < 0x80) return 1;
        if (cp < 0x800) return 2;
        // одиночный суррогат кодируется String.getBytes как '?'
        if (cp >= Character.MIN_SURROGATE && cp <= Character.MAX_SURROGATE) return 1;
        if (cp < 0x10000) return 3;
        return 4;
    }

    private int toChar(int bytePos) {
        if (bytePos <= 0) return 0;
        if (bytePos >= byteToChar.length) return content.length();
        return byteToChar[bytePos];
    }

    private SyntaxNode mirror(TSNode node, SyntaxNode parent, int index) {
        String type = node.getType();
        if ("ERROR".equals(type) || node.isMissing()) {
            syntaxErrors = true;
        }
        SyntaxNode result = new SyntaxNode(this, parent, type, node.isNamed(), node.isMissing(),
                toChar(node.getStartByte()), toChar(node.getEndByte()), index);

        int count = node.getChildCount();
        List<SyntaxNode> children = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            children.add(mirror(node.getChild(i), result, i));
        }
        assignFieldNames(node, children);
        result.setChildren(children);
        return result;
    }

    private void assignFieldNames(TSNode node, List<SyntaxNode> children) {
        if (children.isEmpty()) {
            return;
        }
        for (String field : FIELD_NAMES) {
            TSNode fieldNode = node.getChildByFieldName(field);
            if (fieldNode == null || fieldNode.isNull()) {
                continue;
            }
            int start = toChar(fieldNode.getStartByte());
            int end = toChar(fieldNode.getEndByte());
            String type = fieldNode.getType();
            for (SyntaxNode child : children) {
                if (child.getFieldName() == null && child.getStart() == start
                        && child.getEnd() == end && child.getType().equals(type)) {
                    child.setFieldName(field);
                    break;
                }
            }
        }
    }

    private void collectTokens(SyntaxNode node) {
        if (isComment(node)) {
            return;
        }
        if (node.getChildCount() == 0) {
            if (node.getEnd() > node.getStart()) {
                tokens.add(node);
            }
            return;
        }
        for (SyntaxNode child : node.getChildren()) {
            collectTokens(child);
        }
    }

    public static boolean isComment(SyntaxNode node) {
        return "comment".equals(node.getType()) || "html_comment".equals(node.getType());
    }

    public Path getPath() {
        return path;
    }

    public String getContent() {
        return content;
    }

    public String getLangId() {
        return langId;
    }

    public SyntaxNode getRoot() {
        return root;
    }

    /**
     * Есть ли в дереве узлы ERROR или вставленные парсером отсутствующие токены.
     */
    public boolean hasSyntaxErrors() {
        return syntaxErrors;
    }

    /**
     * Лексемы файла (листья без комментариев) в порядке следования.
     */
    public List<SyntaxNode> getTokens() {
        return tokens;
    }

    /**
     * Лексема, которой принадлежит позиция. Пробелы и комментарии перед лексемой относятся к ней.
     *
     * @return первая лексема с концом правее позиции или null, если таких нет
     */
    public SyntaxNode getTokenAtPosition(int position) {
        int lo = 0;
        int hi = tokens.size();
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (tokens.get(mid).getEnd() > position) {
                hi = mid;
            } else {
                lo = mid + 1;
            }
        }
        return lo < tokens.size() ? tokens.get(lo) : null;
    }

    /**
     * Последняя лексема, начинающаяся левее позиции.
     */
    public SyntaxNode findTokenOnLeftOfPosition(int position) {
        SyntaxNode result = null;
        int lo = 0;
        int hi = tokens.size() - 1;
        while (lo <= hi) {
            int mid = (lo + hi) >>> 1;
            if (tokens.get(mid).getStart() < position) {
                result = tokens.get(mid);
                lo = mid + 1;
            } else {
                hi = mid - 1;
            }
        }
        return result;
    }

    /**
     * Последняя лексема, целиком лежащая до позиции.
     *
     * @return лексема или null, если позиция находится до первой лексемы
     */
    public SyntaxNode findPrecedingToken(int position) {
        SyntaxNode result = null;
        int lo = 0;
        int hi = tokens.size() - 1;
        while (lo <= hi) {
            int mid = (lo + hi) >>> 1;
            if (tokens.get(mid).getEnd() <= position) {
                result = tokens.get(mid);
                lo = mid + 1;
            } else {
                hi = mid - 1;
            }
        }
        return result;
    }

    /**
     * Смещение начала строки, содержащей позицию.
     */
    public int getLineStart(int position) {
        int i = Math.min(position, content.length());
        while (i > 0 && content.charAt(i - 1) != '\n') {
            i--;
        }
        return i;
    }

    /**
     * Номер строки (с 1), содержащей позицию.
     */
    public int getLineNumber(int position) {
        int line = 1;
        int limit = Math.min(position, content.length());
        for (int i = 0; i < limit; i++) {
            if (content.charAt(i) == '\n') {
                line++;
            }
        }
        return line;
    }

    /**
     * Отступ (пробелы и табы в начале) строки, содержащей позицию.
     */
    public String getIndentation(int position) {
        int lineStart = getLineStart(position);
        int i = lineStart;
        while (i < content.length() && (content.charAt(i) == ' ' || content.charAt(i) == '\t')) {
            i++;
        }
        return content.substring(lineStart, i);
    }

    /**
     * Переводит позицию строка/колонка (обе с 1) в смещение символа.
     *
     * @throws IllegalArgumentException если строка за пределами файла
     */
    public int getOffset(int line, int column) {
        if (line < 1 || column < 1) {
            throw new IllegalArgumentException("Line and column are 1-based: " + line + ":" + column);
        }
        int offset = 0;
        for (int current = 1; current < line; current++) {
            int next = content.indexOf('\n', offset);
            if (next < 0) {
                throw new IllegalArgumentException("Line " + line + " is beyond end of file");
            }
            offset = next + 1;
        }
        int lineEnd = content.indexOf('\n', offset);
        if (lineEnd < 0) {
            lineEnd = content.length();
        }
        return Math.min(offset + column - 1, lineEnd);
    }

    /**
     * Длина строки (без перевода строки) с указанным номером (с 1).
     */
    public int getLineLength(int line) {
        int start = getOffset(line, 1);
        int end = content.indexOf('\n', start);
        if (end < 0) {
            end = content.length();
        }
        if (end > start && content.charAt(end - 1) == '\r') {
            end--;
        }
        return end - start;
    }
}
