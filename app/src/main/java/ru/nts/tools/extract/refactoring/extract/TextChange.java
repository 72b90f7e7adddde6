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

import ru.nts.tools.extract.core.treesitter.TextSpan;

/**
 * Текстовая правка: замена диапазона новым текстом.
 * Вставка задается пустым диапазоном, удаление - пустым текстом.
 */
public record TextChange(TextSpan span, String newText) {

    public static TextChange insert(int position, String text) {
        return new TextChange(TextSpan.empty(position), text);
    }

    public static TextChange delete(int start, int end) {
        return new TextChange(TextSpan.fromBounds(start, end), "");
    }

    public boolean isInsertion() {
        return span.isEmpty();
    }
}
