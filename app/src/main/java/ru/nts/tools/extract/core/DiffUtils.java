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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Утилиты для построения Unified Diff между исходным и преобразованным текстом.
 * Используется в режиме предпросмотра извлечения функции.
 */
public class DiffUtils {

    /**
     * Количество строк контекста вокруг изменения.
     */
    private static final int CONTEXT_SIZE = 3;

    /**
     * Генерирует Unified Diff между старым и новым контентом.
     *
     * @param fileName   Имя файла для заголовка diff.
     * @param oldContent Исходный текст.
     * @param newContent Измененный текст.
     *
     * @return Строка в формате Unified Diff или пустая строка, если тексты совпадают.
     */
    public static String getUnifiedDiff(String fileName, String oldContent, String newContent) {
        if (oldContent.equals(newContent)) {
            return "";
        }

        List<String> oldLines = oldContent.isEmpty() ? List.of() : Arrays.asList(oldContent.split("\n", -1));
        List<String> newLines = newContent.isEmpty() ? List.of() : Arrays.asList(newContent.split("\n", -1));

        StringBuilder diff = new StringBuilder();
        diff.append("--- ").append(fileName).append(" (original)\n");
        diff.append("+++ ").append(fileName).append(" (modified)\n");

        int[][] matrix = computeLCSMatrix(oldLines, newLines);
        List<DiffLine> diffLines = buildDiff(matrix, oldLines, newLines);

        for (Hunk hunk : clusterIntoHunks(diffLines)) {
            diff.append(String.format("@@ -%d,%d +%d,%d @@\n", hunk.oldStart, hunk.oldLen, hunk.newStart, hunk.newLen));
            for (DiffLine line : hunk.lines) {
                switch (line.type) {
                    case INSERT -> diff.append("+").append(line.text).append("\n");
                    case DELETE -> diff.append("-").append(line.text).append("\n");
                    case EQUAL -> diff.append(" ").append(line.text).append("\n");
                }
            }
        }

        return diff.toString().trim();
    }

    private static int[][] computeLCSMatrix(List<String> a, List<String> b) {
        int[][] matrix = new int[a.size() + 1][b.size() + 1];
        for (int i = 1; i <= a.size(); i++) {
            for (int j = 1; j <= b.size(); j++) {
                if (a.get(i - 1).equals(b.get(j - 1))) {
                    matrix[i][j] = matrix[i - 1][j - 1] + 1;
                } else {
                    matrix[i][j] = Math.max(matrix[i - 1][j], matrix[i][j - 1]);
                }
            }
        }
        return matrix;
    }

    /**
     * Восстанавливает последовательность строк diff по матрице LCS.
     * Обход итеративный: глубина рекурсии на длинных файлах переполняла бы стек.
     */
    private static List<DiffLine> buildDiff(int[][] matrix, List<String> a, List<String> b) {
        List<DiffLine> reversed = new ArrayList<>();
        int i = a.size();
        int j = b.size();
        while (i > 0 || j > 0) {
            if (i > 0 && j > 0 && a.get(i - 1).equals(b.get(j - 1))) {
                reversed.add(new DiffLine(DiffType.EQUAL, a.get(i - 1)));
                i--;
                j--;
            } else if (j > 0 && (i == 0 || matrix[i][j - 1] >= matrix[i - 1][j])) {
                reversed.add(new DiffLine(DiffType.INSERT, b.get(j - 1)));
                j--;
            } else {
                reversed.add(new DiffLine(DiffType.DELETE, a.get(i - 1)));
                i--;
            }
        }
        List<DiffLine> result = new ArrayList<>(reversed.size());
        for (int k = reversed.size() - 1; k >= 0; k--) {
            result.add(reversed.get(k));
        }
        return result;
    }

    private static List<Hunk> clusterIntoHunks(List<DiffLine> lines) {
        List<Hunk> hunks = new ArrayList<>();
        Hunk current = null;
        int oldPos = 1;
        int newPos = 1;

        for (int i = 0; i < lines.size(); i++) {
            DiffLine line = lines.get(i);
            boolean isChanged = line.type != DiffType.EQUAL;

            if (isChanged || isNearChange(lines, i)) {
                if (current == null) {
                    current = new Hunk();
                    current.oldStart = oldPos;
                    current.newStart = newPos;
                }
                current.lines.add(line);
                if (line.type != DiffType.INSERT) current.oldLen++;
                if (line.type != DiffType.DELETE) current.newLen++;
            } else if (current != null) {
                hunks.add(current);
                current = null;
            }

            if (line.type != DiffType.INSERT) oldPos++;
            if (line.type != DiffType.DELETE) newPos++;
        }
        if (current != null) hunks.add(current);
        return hunks;
    }

    private static boolean isNearChange(List<DiffLine> lines, int index) {
        for (int i = Math.max(0, index - CONTEXT_SIZE); i <= Math.min(lines.size() - 1, index + CONTEXT_SIZE); i++) {
            if (lines.get(i).type != DiffType.EQUAL) return true;
        }
        return false;
    }

    private enum DiffType {EQUAL, INSERT, DELETE}

    private record DiffLine(DiffType type, String text) {
    }

    private static class Hunk {
        int oldStart, oldLen, newStart, newLen;
        List<DiffLine> lines = new ArrayList<>();
    }
}
