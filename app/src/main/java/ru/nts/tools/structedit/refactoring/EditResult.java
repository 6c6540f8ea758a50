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
package ru.nts.tools.structedit.refactoring;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import ru.nts.tools.structedit.core.EditErrorCode;
import ru.nts.tools.structedit.core.EditException;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Результат операции редактирования.
 */
public record EditResult(
        Status status,
        String operation,
        String summary,
        List<FileChange> changes,
        EditErrorCode errorCode,
        String error,
        String hint,
        List<String> suggestions,
        JsonNode details
) {
    public static final String SOURCE = "source";
    public static final String DESTINATION = "destination";

    public enum Status {
        SUCCESS,
        ERROR
    }

    /**
     * Новый текст буфера.
     *
     * @param role {@link #SOURCE} или {@link #DESTINATION}
     * @param text полный текст
     * @param lineCount число строк
     */
    public record FileChange(String role, String text, int lineCount) {

        public static FileChange of(String role, String text) {
            return new FileChange(role, text, countLines(text));
        }

        private static int countLines(String text) {
            if (text.isEmpty()) return 0;
            int lines = (int) text.chars().filter(c -> c == '\n').count();
            return text.endsWith("\n") ? lines : lines + 1;
        }
    }

    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }

    public Optional<FileChange> change(String role) {
        return changes.stream().filter(c -> c.role().equals(role)).findFirst();
    }

    /**
     * Текст буфера указанной роли.
     *
     * @throws IllegalStateException если операция этот буфер не меняла
     */
    public String text(String role) {
        return change(role)
                .map(FileChange::text)
                .orElseThrow(() -> new IllegalStateException("No '" + role + "' change in " + operation + " result"));
    }

    /**
     * Сопоставляет изменения файлам для {@link ru.nts.tools.structedit.core.ChangeSetWriter}.
     *
     * @param targets путь для каждой роли
     */
    public Map<Path, String> toWrites(Map<String, Path> targets) {
        Map<Path, String> writes = new LinkedHashMap<>();
        for (FileChange change : changes) {
            Path path = targets.get(change.role());
            if (path == null) {
                throw new IllegalArgumentException("No target path for role '" + change.role() + "'");
            }
            writes.put(path, change.text());
        }
        return writes;
    }

    /**
     * Копия результата с диагностикой в details.
     */
    public EditResult withDiagnostics(List<String> messages) {
        ObjectNode merged = details instanceof ObjectNode obj
                ? obj.deepCopy()
                : JsonNodeFactory.instance.objectNode();
        ArrayNode array = merged.putArray("diagnostics");
        messages.forEach(array::add);
        return new EditResult(status, operation, summary, changes, errorCode, error, hint, suggestions, merged);
    }

    // Builder pattern для удобного создания результата
    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private Status status = Status.SUCCESS;
        private String operation;
        private String summary;
        private List<FileChange> changes = new ArrayList<>();
        private JsonNode details;

        public Builder operation(OperationKind kind) {
            this.operation = kind.wireName();
            return this;
        }

        public Builder summary(String summary) {
            this.summary = summary;
            return this;
        }

        public Builder addChange(String role, String text) {
            this.changes.add(FileChange.of(role, text));
            return this;
        }

        public Builder details(JsonNode details) {
            this.details = details;
            return this;
        }

        public EditResult build() {
            return new EditResult(status, operation, summary, List.copyOf(changes),
                    null, null, null, List.of(), details);
        }
    }

    // Фабричные методы
    public static EditResult success(OperationKind kind, String summary, String sourceText) {
        return builder().operation(kind).summary(summary).addChange(SOURCE, sourceText).build();
    }

    public static EditResult error(String operation, EditException e) {
        return new EditResult(Status.ERROR, operation, null, List.of(),
                e.getCode(), e.getMessage(), e.toUserMessage(), e.getSuggestions(), null);
    }
}
