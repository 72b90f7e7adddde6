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

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Определяет язык программирования по расширению файла или содержимому.
 * Поддерживаемые языки: javascript, typescript, tsx.
 */
public final class LanguageDetector {

    private LanguageDetector() {}

    /**
     * Отображение расширений файлов на идентификаторы языков.
     */
    private static final Map<String, String> EXTENSION_MAP = Map.ofEntries(
            // JavaScript
            Map.entry("js", "javascript"),
            Map.entry("mjs", "javascript"),
            Map.entry("cjs", "javascript"),
            Map.entry("jsx", "javascript"),

            // TypeScript
            Map.entry("ts", "typescript"),
            Map.entry("tsx", "tsx"),
            Map.entry("mts", "typescript"),
            Map.entry("cts", "typescript")
    );

    /**
     * Список поддерживаемых языков.
     */
    private static final List<String> SUPPORTED_LANGUAGES = List.of("javascript", "typescript", "tsx");

    /**
     * Определяет язык по пути к файлу.
     *
     * @param path путь к файлу
     * @return идентификатор языка или empty если язык не поддерживается
     */
    public static Optional<String> detect(Path path) {
        if (path == null || path.getFileName() == null) {
            return Optional.empty();
        }

        String fileName = path.getFileName().toString();
        int dotIndex = fileName.lastIndexOf('.');

        if (dotIndex < 0 || dotIndex == fileName.length() - 1) {
            return Optional.empty();
        }

        String extension = fileName.substring(dotIndex + 1).toLowerCase();
        return Optional.ofNullable(EXTENSION_MAP.get(extension));
    }

    /**
     * Определяет язык по пути к файлу и содержимому (для shebang).
     *
     * @param path путь к файлу
     * @param content содержимое файла (первые строки)
     * @return идентификатор языка или empty если язык не поддерживается
     */
    public static Optional<String> detect(Path path, String content) {
        Optional<String> byExtension = detect(path);
        if (byExtension.isPresent()) {
            return byExtension;
        }

        if (content != null && content.startsWith("#!")) {
            String firstLine = content.lines().findFirst().orElse("");
            if (firstLine.contains("ts-node") || firstLine.contains("tsx")) {
                return Optional.of("typescript");
            }
            if (firstLine.contains("node") || firstLine.contains("deno") || firstLine.contains("bun")) {
                return Optional.of("javascript");
            }
        }

        return Optional.empty();
    }

    /**
     * Возвращает список всех поддерживаемых языков.
     */
    public static List<String> getSupportedLanguages() {
        return SUPPORTED_LANGUAGES;
    }

    /**
     * Проверяет, допускает ли язык модификаторы доступа TypeScript (private, public...).
     */
    public static boolean supportsAccessModifiers(String langId) {
        return "typescript".equals(langId) || "tsx".equals(langId);
    }
}
