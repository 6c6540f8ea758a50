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

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Операции структурного редактора.
 */
public enum OperationKind {
    INSERT_DECLARATION("insert_declaration"),
    INSERT_IMPORT("insert_import"),
    INSERT_ROUTINE("insert_routine"),
    INSERT_PARAMETER("insert_parameter"),
    REPLACE_ROUTINE_BODY("replace_routine_body"),
    REPLACE_DECLARATION("replace_declaration"),
    DELETE_DECLARATION("delete_declaration"),
    RELOCATE_RANGE("relocate_range"),
    RELOCATE_ROUTINE("relocate_routine"),
    REFORMAT("reformat"),
    OUTLINE("outline");

    private final String wireName;

    OperationKind(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * Находит операцию по имени: {@code insert_import}, {@code INSERT_IMPORT} или {@code InsertImport}.
     *
     * @throws IllegalArgumentException если имя неизвестно
     */
    public static OperationKind fromName(String name) {
        String key = normalize(name);
        for (OperationKind kind : values()) {
            if (normalize(kind.wireName).equals(key)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown operation: '" + name + "'. Available: "
                + Arrays.stream(values()).map(OperationKind::wireName).collect(Collectors.joining(", ")));
    }

    private static String normalize(String name) {
        return name.replace("_", "").replace("-", "").toLowerCase(Locale.ROOT);
    }
}
