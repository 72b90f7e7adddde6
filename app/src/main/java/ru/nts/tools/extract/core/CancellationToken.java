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
package ru.nts.tools.extract.core;

/**
 * Сигнал отмены длительной операции.
 * Опрашивается кооперативно между этапами анализа.
 */
@FunctionalInterface
public interface CancellationToken {

    /**
     * Токен, который никогда не запрашивает отмену.
     */
    CancellationToken NONE = () -> false;

    boolean isCancellationRequested();

    /**
     * Прерывает текущую операцию, если запрошена отмена.
     *
     * @throws OperationCancelledException если отмена запрошена
     */
    default void throwIfCancellationRequested() {
        if (isCancellationRequested()) {
            throw new OperationCancelledException();
        }
    }
}
