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
 * Параметр функции.
 *
 * @param kind вид параметра
 * @param name имя (null для разделителей)
 * @param type аннотация типа или null
 * @param defaultValue значение по умолчанию или null
 */
public record Parameter(Kind kind, String name, String type, String defaultValue) {

    public enum Kind {
        PLAIN,
        /** {@code *args} */
        VAR_POSITIONAL,
        /** {@code **kwargs} */
        VAR_KEYWORD,
        /** Голая {@code *}: дальше только именованные. */
        KEYWORD_SEPARATOR,
        /** {@code /}: до него только позиционные. */
        POSITIONAL_SEPARATOR
    }

    public static Parameter plain(String name, String type, String defaultValue) {
        return new Parameter(Kind.PLAIN, name, type, defaultValue);
    }

    public boolean hasDefault() {
        return defaultValue != null;
    }

    public Parameter withDefault(String value) {
        return new Parameter(kind, name, type, value);
    }

    /**
     * Рендерит параметр: {@code name: type = default}, {@code name=default}, {@code *args: T}.
     */
    public String render() {
        return switch (kind) {
            case KEYWORD_SEPARATOR -> "*";
            case POSITIONAL_SEPARATOR -> "/";
            case VAR_POSITIONAL -> "*" + name + annotation();
            case VAR_KEYWORD -> "**" + name + annotation();
            case PLAIN -> {
                if (defaultValue == null) {
                    yield name + annotation();
                }
                yield type != null
                        ? name + ": " + type + " = " + defaultValue
                        : name + "=" + defaultValue;
            }
        };
    }

    private String annotation() {
        return type != null ? ": " + type : "";
    }
}
