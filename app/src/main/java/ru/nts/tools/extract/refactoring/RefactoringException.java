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
package ru.nts.tools.extract.refactoring;

import ru.nts.tools.extract.core.treesitter.LanguageDetector;

import java.util.ArrayList;
import java.util.List;

/**
 * Исключение при выполнении операции рефакторинга.
 * Содержит подсказки, которые помогают скорректировать запрос.
 */
public class RefactoringException extends Exception {

    private final List<String> suggestions;

    public RefactoringException(String message) {
        super(message);
        this.suggestions = new ArrayList<>();
    }

    public RefactoringException(String message, Throwable cause) {
        super(message, cause);
        this.suggestions = new ArrayList<>();
    }

    public RefactoringException(String message, List<String> suggestions) {
        super(message);
        this.suggestions = suggestions != null ? new ArrayList<>(suggestions) : new ArrayList<>();
    }

    public List<String> getSuggestions() {
        return suggestions;
    }

    public RefactoringException addSuggestion(String suggestion) {
        this.suggestions.add(suggestion);
        return this;
    }

    // Фабричные методы для типичных ошибок
    public static RefactoringException fileNotFound(String path) {
        return new RefactoringException("File not found: " + path);
    }

    public static RefactoringException unsupportedLanguage(String language) {
        return new RefactoringException(
                "Language '" + language + "' is not supported for this operation",
                List.of("Supported languages: " + String.join(", ", LanguageDetector.getSupportedLanguages()))
        );
    }

    public static RefactoringException invalidParameter(String param, String reason) {
        return new RefactoringException("Invalid parameter '" + param + "': " + reason);
    }

    public static RefactoringException cannotExtract(String reason) {
        return new RefactoringException(
                "Cannot extract selection: " + reason,
                List.of(
                        "Select a single expression or a sequence of complete statements in one block",
                        "break, continue and labeled jumps must target statements inside the selection",
                        "return is not allowed inside an if branch, try block or catch block at the selection boundary"
                )
        );
    }

    public static RefactoringException syntaxErrors(String path) {
        return new RefactoringException(
                "File contains syntax errors: " + path,
                List.of("Fix the syntax errors before extracting a function")
        );
    }
}
