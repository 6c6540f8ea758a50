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

import java.util.Map;

/**
 * Structured error codes of the structural editor.
 * Each error has a human-readable message and a solution hint.
 *
 * <p>Example of a formatted error:
 * <pre>
 * [ERROR: NOT_FOUND]
 * Message: Target not found
 * Solution: Class 'Config' not found. Use action 'outline' to list declarations and routines.
 * Context: kind=class, name=Config
 * </pre>
 */
public enum EditErrorCode {

    // ============ Input Errors ============

    SYNTAX_ERROR("Source text does not parse",
            "Fix the syntax near line %line%: %context%"),

    // ============ Resolution Errors ============

    NOT_FOUND("Target not found",
            "%kind% '%name%' not found. Use action 'outline' to list declarations and routines."),

    AMBIGUOUS("Multiple targets match",
            "%kind% '%name%' matches several nodes. Pass 'scope' to narrow the search or firstMatch=true."),

    // ============ Structural Errors ============

    STRUCTURAL_VIOLATION("Edit would produce an invalid tree",
            "The result of the edit does not parse. Check the inserted code and its indentation."),

    SIGNATURE_MISMATCH("Replacement has the wrong node kind",
            "Expected %expected%, got %actual%. Provide a complete %expected% definition."),

    // ============ Parameter Errors ============

    PARAM_MISSING("Required parameter missing",
            "Provide parameter '%param%'."),

    PARAM_INVALID("Invalid parameter value",
            "Check parameter '%param%' type and format."),

    PARAM_OUT_OF_RANGE("Parameter out of range",
            "Parameter '%param%' must be within %range%."),

    // ============ System Errors ============

    INTERNAL_ERROR("Internal error",
            "Unexpected error. Check diagnostics for details.");

    private final String message;
    private final String solution;

    EditErrorCode(String message, String solution) {
        this.message = message;
        this.solution = solution;
    }

    public String getMessage() {
        return message;
    }

    public String getSolution() {
        return solution;
    }

    /**
     * Formats error message with optional context.
     *
     * @param context Optional context map (kind, name, line, etc.)
     * @return Formatted error string
     */
    public String format(Map<String, Object> context) {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("[ERROR: %s]\n", this.name()));
        sb.append(String.format("Message: %s\n", message));

        // Интерполяция %placeholder% в solution
        String resolvedSolution = solution;
        if (context != null) {
            for (Map.Entry<String, Object> entry : context.entrySet()) {
                resolvedSolution = resolvedSolution.replace(
                        "%" + entry.getKey() + "%", String.valueOf(entry.getValue()));
            }
        }
        resolvedSolution = resolvedSolution.replaceAll("%\\w+%", "...");
        sb.append(String.format("Solution: %s", resolvedSolution));

        if (context != null && !context.isEmpty()) {
            sb.append("\nContext: ");
            boolean first = true;
            for (Map.Entry<String, Object> entry : context.entrySet()) {
                if (!first) sb.append(", ");
                sb.append(entry.getKey()).append("=").append(entry.getValue());
                first = false;
            }
        }

        return sb.toString();
    }
}
