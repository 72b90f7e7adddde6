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

import com.fasterxml.jackson.databind.JsonNode;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Результат операции рефакторинга.
 * Ошибки сюда не попадают: они выбрасываются как {@link RefactoringException}.
 */
public record RefactoringResult(
        Status status,
        String action,
        String summary,
        List<FileChange> changes,
        int affectedFiles,
        int totalChanges,
        String diff,
        JsonNode details
) {
    public enum Status {
        SUCCESS,
        PREVIEW
    }

    /**
     * Изменение в файле.
     */
    public record FileChange(
            Path path,
            int occurrences,
            List<ChangeDetail> details,
            String diff
    ) {}

    /**
     * Детали конкретного изменения.
     */
    public record ChangeDetail(
            int line,
            int column,
            String before,
            String after
    ) {}

    // Builder pattern для удобного создания результата
    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private Status status = Status.SUCCESS;
        private String action;
        private String summary;
        private List<FileChange> changes = new ArrayList<>();
        private int affectedFiles;
        private int totalChanges;
        private String diff;
        private JsonNode details;

        public Builder status(Status status) {
            this.status = status;
            return this;
        }

        public Builder action(String action) {
            this.action = action;
            return this;
        }

        public Builder summary(String summary) {
            this.summary = summary;
            return this;
        }

        public Builder changes(List<FileChange> changes) {
            this.changes = new ArrayList<>(changes);
            return this;
        }

        public Builder addChange(FileChange change) {
            this.changes.add(change);
            return this;
        }

        public Builder affectedFiles(int count) {
            this.affectedFiles = count;
            return this;
        }

        public Builder totalChanges(int count) {
            this.totalChanges = count;
            return this;
        }

        public Builder diff(String diff) {
            this.diff = diff;
            return this;
        }

        public Builder details(JsonNode details) {
            this.details = details;
            return this;
        }

        public RefactoringResult build() {
            return new RefactoringResult(
                    status, action, summary, List.copyOf(changes),
                    affectedFiles, totalChanges, diff, details
            );
        }
    }
}
