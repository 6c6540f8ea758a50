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
package ru.nts.tools.structedit.core.model;

/**
 * Вид узла дерева исходника.
 */
public enum NodeKind {
    /** Корень модуля, всегда id 0. */
    MODULE("module"),
    /** Объявление класса. */
    DECLARATION("class"),
    /** Функция или метод. */
    ROUTINE("function"),
    /** {@code import a, b as c}. */
    IMPORT("import"),
    /** {@code from m import a, b as c}. */
    IMPORT_FROM("import"),
    STATEMENT("statement"),
    EXPRESSION("expression"),
    /** Комментарий на отдельной строке. */
    COMMENT("comment"),
    /** Пустая строка между соседями. */
    PLACEHOLDER("placeholder");

    private final String label;

    NodeKind(String label) {
        this.label = label;
    }

    /**
     * Человекочитаемое название для сообщений об ошибках.
     */
    public String label() {
        return label;
    }

    /**
     * Может ли узел содержать тело.
     */
    public boolean isContainer() {
        return this == MODULE || this == DECLARATION || this == ROUTINE;
    }

    public boolean isImport() {
        return this == IMPORT || this == IMPORT_FROM;
    }

    public boolean isDefinition() {
        return this == DECLARATION || this == ROUTINE;
    }

    /**
     * Значимый узел: не пустая строка и не комментарий.
     */
    public boolean isSignificant() {
        return this != PLACEHOLDER && this != COMMENT;
    }
}
