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

import java.util.List;

/**
 * Вариант извлечения для одной области.
 *
 * @param scope      область, в которой объявляется функция
 * @param changes    упорядоченные правки: объявление, удаление диапазона, вставка вызова
 * @param parameters параметры новой функции в порядке аргументов вызова
 * @param writes     параметры, значения которых возвращаются обратно
 */
public record ExtractResultForScope(Scope scope, List<TextChange> changes,
                                    List<String> parameters, List<String> writes) {

    public ExtractResultForScope {
        changes = List.copyOf(changes);
        parameters = List.copyOf(parameters);
        writes = List.copyOf(writes);
    }
}
