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

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Применение набора правок к исходному тексту.
 */
public final class TextChanges {

    private TextChanges() {}

    /**
     * Применяет правки, заданные относительно исходного текста.
     * Правки упорядочиваются по началу (устойчиво), вставка идет раньше удаления с той же позиции.
     *
     * @throws IllegalArgumentException если правки перекрываются или выходят за пределы текста
     */
    public static String apply(String content, List<TextChange> changes) {
        List<TextChange> sorted = new ArrayList<>(changes);
        sorted.sort(Comparator.comparingInt((TextChange c) -> c.span().start())
                .thenComparingInt(c -> c.isInsertion() ? 0 : 1));

        StringBuilder result = new StringBuilder(content.length() + 256);
        int position = 0;
        for (TextChange change : sorted) {
            int start = change.span().start();
            int end = change.span().end();
            if (start < position) {
                throw new IllegalArgumentException("Overlapping text changes at offset " + start);
            }
            if (end > content.length()) {
                throw new IllegalArgumentException("Text change beyond end of content: " + change.span());
            }
            result.append(content, position, start);
            result.append(change.newText());
            position = end;
        }
        result.append(content, position, content.length());
        return result.toString();
    }
}
