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

/**
 * Полуоткрытый диапазон символов [start, end) в одном файле.
 *
 * @param start смещение первого символа
 * @param end   смещение за последним символом
 */
public record TextSpan(int start, int end) {

    public TextSpan {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid span: [" + start + ", " + end + ")");
        }
    }

    /**
     * Пустой диапазон (точка вставки) в указанной позиции.
     */
    public static TextSpan empty(int position) {
        return new TextSpan(position, position);
    }

    public static TextSpan fromBounds(int start, int end) {
        return new TextSpan(start, end);
    }

    public int length() {
        return end - start;
    }

    public boolean isEmpty() {
        return start == end;
    }

    /**
     * Позиция лежит внутри диапазона (конец не включается).
     */
    public boolean contains(int position) {
        return position >= start && position < end;
    }

    /**
     * Другой диапазон целиком лежит внутри этого (совпадение границ допускается).
     */
    public boolean contains(TextSpan other) {
        return other.start >= start && other.end <= end;
    }
}
