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

import ru.nts.tools.extract.core.CancellationToken;
import ru.nts.tools.extract.core.FileUtils;
import ru.nts.tools.extract.core.treesitter.TreeSitterManager;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.Set;

/**
 * Контекст выполнения операции рефакторинга.
 * Предоставляет доступ к парсеру, сигналу отмены и записи файлов.
 */
public class RefactoringContext {

    private final TreeSitterManager treeManager;
    private final CancellationToken cancellationToken;

    // Файлы, записанные в рамках этой операции
    private final Set<Path> writtenFiles = new HashSet<>();

    public RefactoringContext() {
        this(CancellationToken.NONE);
    }

    public RefactoringContext(CancellationToken cancellationToken) {
        this.treeManager = TreeSitterManager.getInstance();
        this.cancellationToken = cancellationToken;
    }

    public TreeSitterManager getTreeManager() {
        return treeManager;
    }

    public CancellationToken getCancellationToken() {
        return cancellationToken;
    }

    /**
     * Записывает файл (Safe Swap) и регистрирует его как измененный.
     *
     * @param path путь к файлу
     * @param content новое содержимое
     * @param charset кодировка исходного файла
     */
    public void writeFile(Path path, String content, Charset charset) throws RefactoringException {
        try {
            FileUtils.safeWrite(path, content, charset);
            writtenFiles.add(path.toAbsolutePath().normalize());
        } catch (IOException e) {
            throw new RefactoringException("Failed to write file: " + path, e);
        }
    }

    /**
     * Возвращает набор записанных файлов.
     */
    public Set<Path> getWrittenFiles() {
        return new HashSet<>(writtenFiles);
    }
}
