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

/**
 * Факты о выделенном диапазоне, определяющие форму синтезируемой функции.
 *
 * @param hasReturn       диапазон содержит return, который должен выйти из исходной функции
 * @param isGenerator     диапазон содержит yield
 * @param isAsyncFunction диапазон содержит await или for await
 */
public record RangeFacts(boolean hasReturn, boolean isGenerator, boolean isAsyncFunction) {

    public static final RangeFacts NONE = new RangeFacts(false, false, false);

    public RangeFacts withReturn() {
        return new RangeFacts(true, isGenerator, isAsyncFunction);
    }

    public RangeFacts withGenerator() {
        return new RangeFacts(hasReturn, true, isAsyncFunction);
    }

    public RangeFacts withAsync() {
        return new RangeFacts(hasReturn, isGenerator, true);
    }
}
