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
import ru.nts.tools.structedit.core.EditException;

import java.util.regex.Pattern;

/**
 * Чтение параметров операций из JSON.
 */
public final class OperationParams {

    public static final String SOURCE = "source";
    public static final String DESTINATION = "destination";
    public static final String CONTENT = "content";
    public static final String AFTER = "after";
    public static final String TARGET = "target";
    public static final String SCOPE = "scope";
    public static final String FIRST_MATCH = "firstMatch";

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private OperationParams() {}

    /**
     * Обязательный текстовый параметр. Пустая строка допустима (пустой буфер).
     */
    public static String requireText(JsonNode params, String name) throws EditException {
        JsonNode value = params.get(name);
        if (value == null || value.isNull()) {
            throw EditException.paramMissing(name);
        }
        if (!value.isTextual()) {
            throw EditException.paramInvalid(name, "expected a string");
        }
        return value.asText();
    }

    /**
     * Обязательное имя: непустой идентификатор.
     */
    public static String requireName(JsonNode params, String name) throws EditException {
        String value = requireText(params, name);
        if (value.isBlank()) {
            throw EditException.paramMissing(name);
        }
        if (!IDENTIFIER.matcher(value).matches()) {
            throw EditException.paramInvalid(name, "'" + value + "' is not an identifier");
        }
        return value;
    }

    public static String optionalText(JsonNode params, String name) throws EditException {
        JsonNode value = params.get(name);
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.isTextual()) {
            throw EditException.paramInvalid(name, "expected a string");
        }
        return value.asText();
    }

    /**
     * Необязательное имя; пустая строка считается отсутствующим значением.
     */
    public static String optionalName(JsonNode params, String name) throws EditException {
        String value = optionalText(params, name);
        if (value == null || value.isBlank()) {
            return null;
        }
        if (!IDENTIFIER.matcher(value).matches()) {
            throw EditException.paramInvalid(name, "'" + value + "' is not an identifier");
        }
        return value;
    }

    public static int requireInt(JsonNode params, String name) throws EditException {
        JsonNode value = params.get(name);
        if (value == null || value.isNull()) {
            throw EditException.paramMissing(name);
        }
        if (!value.canConvertToInt() || !value.isIntegralNumber()) {
            throw EditException.paramInvalid(name, "expected an integer");
        }
        return value.asInt();
    }

    public static int optionalInt(JsonNode params, String name, int defaultValue) throws EditException {
        JsonNode value = params.get(name);
        if (value == null || value.isNull()) {
            return defaultValue;
        }
        return requireInt(params, name);
    }

    public static boolean optionalBoolean(JsonNode params, String name, boolean defaultValue) throws EditException {
        JsonNode value = params.get(name);
        if (value == null || value.isNull()) {
            return defaultValue;
        }
        if (!value.isBoolean()) {
            throw EditException.paramInvalid(name, "expected true or false");
        }
        return value.asBoolean();
    }

    public static boolean isIdentifier(String value) {
        return value != null && IDENTIFIER.matcher(value).matches();
    }
}
