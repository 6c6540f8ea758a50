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
package ru.nts.tools.structedit.core;

import ru.nts.tools.structedit.core.treesitter.SyntaxChecker.SyntaxError;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Исключение структурного редактирования.
 * Несёт код ошибки, контекст для форматирования подсказки и список предложений.
 *
 * <p>Usage:
 * <pre>
 * throw EditException.notFound("class", "Config", List.of("Configuration"));
 * </pre>
 */
public class EditException extends Exception {

    private final EditErrorCode code;
    private final Map<String, Object> context;
    private final List<String> suggestions = new ArrayList<>();

    public EditException(EditErrorCode code, String message) {
        this(code, message, Collections.emptyMap());
    }

    public EditException(EditErrorCode code, String message, Map<String, Object> context) {
        super(message);
        this.code = code;
        this.context = context != null ? new LinkedHashMap<>(context) : new LinkedHashMap<>();
    }

    public EditException(EditErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.context = new LinkedHashMap<>();
    }

    public EditErrorCode getCode() {
        return code;
    }

    public Map<String, Object> getContext() {
        return Collections.unmodifiableMap(context);
    }

    public List<String> getSuggestions() {
        return Collections.unmodifiableList(suggestions);
    }

    public EditException addSuggestion(String suggestion) {
        this.suggestions.add(suggestion);
        return this;
    }

    /**
     * Returns a formatted user-friendly error message.
     */
    public String toUserMessage() {
        return code.format(context);
    }

    /**
     * Returns a compact single-line error message for logs.
     */
    public String toLogMessage() {
        return "[" + code.name() + "] " + getMessage();
    }

    // Фабричные методы для типичных ошибок

    public static EditException syntaxError(SyntaxError error) {
        Map<String, Object> ctx = new LinkedHashMap<>();
        ctx.put("line", error.line());
        ctx.put("context", error.context());
        return new EditException(EditErrorCode.SYNTAX_ERROR,
                error.message() + " at line " + error.line() + ", column " + error.column(), ctx);
    }

    public static EditException notFound(String kind, String name, List<String> available) {
        EditException e = new EditException(EditErrorCode.NOT_FOUND,
                capitalize(kind) + " '" + name + "' not found", Map.of("kind", capitalize(kind), "name", name));
        if (available != null && !available.isEmpty()) {
            e.addSuggestion("Available: " + String.join(", ", available));
        }
        return e;
    }

    public static EditException ambiguous(String kind, String name, List<Integer> lines) {
        EditException e = new EditException(EditErrorCode.AMBIGUOUS,
                capitalize(kind) + " '" + name + "' is ambiguous: " + lines.size() + " matches",
                Map.of("kind", capitalize(kind), "name", name));
        for (Integer line : lines) {
            e.addSuggestion("Found at line " + line);
        }
        e.addSuggestion("Pass 'scope' to narrow the search or firstMatch=true to take the first match");
        return e;
    }

    public static EditException structuralViolation(String detail) {
        return new EditException(EditErrorCode.STRUCTURAL_VIOLATION, detail);
    }

    public static EditException signatureMismatch(String expected, String actual) {
        return new EditException(EditErrorCode.SIGNATURE_MISMATCH,
                "Expected " + expected + ", got " + actual,
                Map.of("expected", expected, "actual", actual));
    }

    public static EditException paramMissing(String param) {
        return new EditException(EditErrorCode.PARAM_MISSING,
                "Parameter '" + param + "' is required", Map.of("param", param));
    }

    public static EditException paramInvalid(String param, String reason) {
        return new EditException(EditErrorCode.PARAM_INVALID,
                "Parameter '" + param + "' is invalid: " + reason, Map.of("param", param));
    }

    public static EditException outOfRange(String param, Object value, String range) {
        return new EditException(EditErrorCode.PARAM_OUT_OF_RANGE,
                "Parameter '" + param + "' = " + value + " is outside " + range,
                Map.of("param", param, "range", range));
    }

    private static String capitalize(String s) {
        if (s == null || s.isEmpty()) return s;
        return Character.toUpperCase(s.charAt(0)) + s.substring(1);
    }
}
