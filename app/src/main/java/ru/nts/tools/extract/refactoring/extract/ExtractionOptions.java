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

import java.util.regex.Pattern;

/**
 * Параметры генерации кода.
 *
 * @param functionName имя новой функции
 * @param newLine      перевод строки для сгенерированного текста
 * @param indentUnit   единица отступа тела функции
 */
public record ExtractionOptions(String functionName, String newLine, String indentUnit) {

    public static final String DEFAULT_FUNCTION_NAME = "newFunction";

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_$][A-Za-z0-9_$]*");

    public ExtractionOptions {
        if (functionName == null || !IDENTIFIER.matcher(functionName).matches()) {
            throw new IllegalArgumentException("Invalid function name: " + functionName);
        }
        if (newLine == null || !(newLine.equals("\n") || newLine.equals("\r\n"))) {
            throw new IllegalArgumentException("Line ending must be \\n or \\r\\n");
        }
        if (indentUnit == null || indentUnit.isEmpty() || !indentUnit.isBlank()) {
            throw new IllegalArgumentException("Indent unit must consist of spaces or tabs");
        }
    }

    public static ExtractionOptions defaults() {
        return new ExtractionOptions(DEFAULT_FUNCTION_NAME, "\n", "    ");
    }

    public ExtractionOptions withFunctionName(String name) {
        return new ExtractionOptions(name, newLine, indentUnit);
    }

    public ExtractionOptions withNewLine(String lineEnding) {
        return new ExtractionOptions(functionName, lineEnding, indentUnit);
    }

    /**
     * Определяет перевод строки по содержимому файла (CRLF, если он встречается первым).
     */
    public static String detectNewLine(String content) {
        int lf = content.indexOf('\n');
        return lf > 0 && content.charAt(lf - 1) == '\r' ? "\r\n" : "\n";
    }
}
