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
 * Имя в import-инструкции.
 *
 * @param name импортируемое имя ({@code os.path} или {@code Path})
 * @param alias псевдоним после {@code as} или null
 */
public record ImportedName(String name, String alias) {

    /**
     * Имя, которое инструкция связывает в модуле.
     * {@code import a.b} связывает {@code a}.
     */
    public String boundName() {
        if (alias != null) return alias;
        int dot = name.indexOf('.');
        return dot < 0 ? name : name.substring(0, dot);
    }

    public String render() {
        return alias != null ? name + " as " + alias : name;
    }
}
