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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Результат анализа использований: для каждой области (в порядке списка областей)
 * отображение имени захваченной переменной на вид использования.
 * Порядок вставки в отображения определяет порядок параметров.
 */
public final class UsageAnalysis {

    private final List<Map<String, UsageEntry>> usagesPerScope;

    UsageAnalysis(List<Map<String, UsageEntry>> usagesPerScope) {
        this.usagesPerScope = usagesPerScope;
    }

    public int scopeCount() {
        return usagesPerScope.size();
    }

    /**
     * Захваты для области с указанным индексом (пустое отображение, если захватов нет).
     */
    public Map<String, UsageEntry> usagesFor(int scopeIndex) {
        return Collections.unmodifiableMap(new LinkedHashMap<>(usagesPerScope.get(scopeIndex)));
    }
}
