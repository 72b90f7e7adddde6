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

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Set;

/**
 * Контроль путей, передаваемых в операции рефакторинга.
 * Все файлы должны находиться внутри корня рабочей директории.
 */
public class PathSanitizer {

    /**
     * Текущий корень рабочей директории. Все операции должны ограничиваться этим путем.
     */
    private static Path root = Paths.get(".").toAbsolutePath().normalize();

    /**
     * Максимально допустимый размер исходного файла (10 MB).
     */
    private static final long MAX_TEXT_FILE_SIZE = 10 * 1024 * 1024;

    /**
     * Имена служебных директорий, в которых рефакторинг запрещен.
     */
    private static final Set<String> PROTECTED_NAMES = Set.of(".git", "node_modules", ".nts");

    /**
     * Переопределяет корень проекта.
     * В основном используется в модульных тестах для изоляции во временных папках.
     *
     * @param newRoot Новый путь, который будет считаться корнем "песочницы".
     */
    public static void setRoot(Path newRoot) {
        root = newRoot.toAbsolutePath().normalize();
    }

    /**
     * Выполняет санитарную проверку и нормализацию пути.
     *
     * @param requestedPath Путь (абсолютный, относительный или содержащий '..').
     * @return Абсолютный нормализованный объект {@link Path}.
     * @throws SecurityException Если путь ведет за пределы корня или указывает на защищенный объект.
     */
    public static Path sanitize(String requestedPath) {
        String normalizedRequest = requestedPath.replace('\\', '/');
        Path requested = Paths.get(normalizedRequest);

        Path target = requested.isAbsolute()
                ? requested.toAbsolutePath().normalize()
                : root.resolve(normalizedRequest).toAbsolutePath().normalize();

        if (!target.startsWith(root)) {
            throw new SecurityException("Access denied: path is outside of working directory: "
                    + requestedPath + " (Root: " + root + ")");
        }
        if (isProtected(target)) {
            throw new SecurityException("Access denied: file or directory is protected: " + requestedPath);
        }
        return target;
    }

    /**
     * Проверяет файл на соответствие лимитам размера.
     *
     * @throws IOException       Если возникла ошибка при определении размера файла.
     * @throws SecurityException Если размер файла превышает {@link #MAX_TEXT_FILE_SIZE}.
     */
    public static void checkFileSize(Path path) throws IOException {
        if (Files.exists(path) && Files.isRegularFile(path)) {
            long size = Files.size(path);
            if (size > MAX_TEXT_FILE_SIZE) {
                throw new SecurityException(String.format("File is too large (%d bytes). Limit is %d bytes.",
                        size, MAX_TEXT_FILE_SIZE));
            }
        }
    }

    /**
     * Определяет, лежит ли путь внутри защищенной директории.
     */
    public static boolean isProtected(Path path) {
        for (Path part : path) {
            if (PROTECTED_NAMES.contains(part.toString())) {
                return true;
            }
        }
        return false;
    }
}
