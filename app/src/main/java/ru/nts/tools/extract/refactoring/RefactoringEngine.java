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

import com.fasterxml.jackson.databind.JsonNode;
import ru.nts.tools.extract.core.CancellationToken;
import ru.nts.tools.extract.refactoring.operations.ExtractFunctionOperation;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.CancellationException;

/**
 * Движок рефакторинга.
 * Управляет регистрацией и выполнением операций.
 */
public final class RefactoringEngine {

    private static final RefactoringEngine INSTANCE = new RefactoringEngine();

    private final Map<String, RefactoringOperation> operations = new HashMap<>();

    private RefactoringEngine() {
        registerOperation(new ExtractFunctionOperation());
    }

    public static RefactoringEngine getInstance() {
        return INSTANCE;
    }

    /**
     * Регистрирует операцию рефакторинга.
     */
    public void registerOperation(RefactoringOperation operation) {
        operations.put(operation.getName(), operation);
    }

    /**
     * Получает операцию по имени.
     */
    public RefactoringOperation getOperation(String name) {
        return operations.get(name);
    }

    /**
     * Проверяет, зарегистрирована ли операция.
     */
    public boolean hasOperation(String name) {
        return operations.containsKey(name);
    }

    /**
     * Выполняет операцию рефакторинга без возможности отмены.
     */
    public RefactoringResult execute(String action, JsonNode params, boolean preview)
            throws RefactoringException {
        return execute(action, params, preview, CancellationToken.NONE);
    }

    /**
     * Выполняет операцию рефакторинга.
     * Отмена пробрасывается как {@link CancellationException}, а не как ошибка рефакторинга.
     *
     * @throws IllegalArgumentException если параметры некорректны
     */
    public RefactoringResult execute(String action, JsonNode params, boolean preview,
                                     CancellationToken cancellationToken) throws RefactoringException {

        RefactoringOperation operation = operations.get(action);
        if (operation == null) {
            throw new RefactoringException(
                    "Unknown refactoring action: " + action,
                    operations.keySet().stream()
                            .map(op -> "Available: " + op)
                            .toList()
            );
        }

        // Валидация параметров
        operation.validateParams(params);

        RefactoringContext context = new RefactoringContext(cancellationToken);

        try {
            if (preview) {
                return operation.preview(params, context);
            }
            return operation.execute(params, context);
        } catch (RefactoringException e) {
            System.err.println("[RefactoringEngine] " + action + " failed: " + e.getMessage());
            throw e;
        } catch (CancellationException e) {
            System.err.println("[RefactoringEngine] " + action + " cancelled");
            throw e;
        } catch (RuntimeException e) {
            System.err.println("[RefactoringEngine] " + action + " failed unexpectedly: " + e);
            throw new RefactoringException("Refactoring failed: " + e.getMessage(), e);
        }
    }
}
