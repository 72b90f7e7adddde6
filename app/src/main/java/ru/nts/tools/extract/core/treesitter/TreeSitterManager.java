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

import org.treesitter.TSLanguage;
import org.treesitter.TSParser;
import org.treesitter.TSTree;
import org.treesitter.TreeSitterTypescript;

import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Менеджер tree-sitter парсеров.
 * Управляет пулом парсеров для поддерживаемых языков.
 * Thread-safe через ThreadLocal парсеров.
 */
public final class TreeSitterManager {

    private static final TreeSitterManager INSTANCE = new TreeSitterManager();

    /**
     * Максимальный размер исходника для парсинга (5MB).
     * Файлы большего размера не парсятся для предотвращения OOM.
     */
    private static final long MAX_PARSE_SIZE_CHARS = 5 * 1024 * 1024;

    /**
     * Кэшированные TSLanguage объекты (потокобезопасные, можно переиспользовать).
     */
    private final Map<String, TSLanguage> languages = new ConcurrentHashMap<>();

    /**
     * ThreadLocal парсеры для каждого языка (TSParser не thread-safe).
     */
    private final Map<String, ThreadLocal<TSParser>> parsers = new ConcurrentHashMap<>();

    private TreeSitterManager() {}

    public static TreeSitterManager getInstance() {
        return INSTANCE;
    }

    /**
     * Получает TSLanguage объект для указанного языка.
     * Ленивая загрузка - язык загружается только при первом обращении.
     *
     * @param langId идентификатор языка (javascript, typescript, tsx)
     * @return TSLanguage объект
     * @throws IllegalArgumentException если язык не поддерживается
     */
    public TSLanguage getLanguage(String langId) {
        return languages.computeIfAbsent(langId, this::loadLanguage);
    }

    /**
     * Загружает TSLanguage из tree-sitter библиотеки.
     * JavaScript разбирается грамматикой TypeScript, которая является его надмножеством.
     */
    private TSLanguage loadLanguage(String langId) {
        return switch (langId) {
            case "javascript", "typescript", "tsx" -> new TreeSitterTypescript();
            default -> throw new IllegalArgumentException("Unsupported language: " + langId);
        };
    }

    /**
     * Получает или создает TSParser для текущего потока.
     */
    private TSParser getParser(String langId) {
        ThreadLocal<TSParser> parserHolder = parsers.computeIfAbsent(langId,
                k -> ThreadLocal.withInitial(() -> {
                    TSParser parser = new TSParser();
                    parser.setLanguage(getLanguage(k));
                    return parser;
                }));
        return parserHolder.get();
    }

    /**
     * Парсит строку содержимого и возвращает AST дерево.
     *
     * @param content исходный код
     * @param langId идентификатор языка
     * @return AST дерево
     * @throws IllegalArgumentException если язык не поддерживается или исходник слишком большой
     */
    public TSTree parse(String content, String langId) {
        if (content.length() > MAX_PARSE_SIZE_CHARS) {
            throw new IllegalArgumentException(String.format(
                    "Source too large for AST parsing: %d chars (max: %d chars)",
                    content.length(), MAX_PARSE_SIZE_CHARS));
        }
        TSParser parser = getParser(langId);
        TSTree tree = parser.parseString(null, content);
        if (tree == null) {
            throw new IllegalStateException("Failed to parse content for language: " + langId);
        }
        return tree;
    }

    /**
     * Парсит строку и строит неизменяемое зеркало дерева.
     *
     * @param content исходный код
     * @param langId идентификатор языка
     * @return разобранный файл
     */
    public SourceFile parseSource(String content, String langId) {
        return new SourceFile(null, content, langId, parse(content, langId));
    }

    /**
     * Строит зеркало дерева для уже прочитанного содержимого файла.
     *
     * @param path путь к файлу (используется только для идентификации)
     * @param content содержимое файла
     * @param langId идентификатор языка
     * @return разобранный файл
     */
    public SourceFile parseSource(Path path, String content, String langId) {
        return new SourceFile(path, content, langId, parse(content, langId));
    }
}
