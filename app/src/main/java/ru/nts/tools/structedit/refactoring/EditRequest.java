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

/**
 * Декодированный запрос: операция и её параметры.
 */
public record EditRequest(OperationKind operation, JsonNode params) {

    /**
     * Строит запрос из JSON-объекта с полем {@code action}; остальные поля это параметры.
     *
     * @throws EditException PARAM_MISSING или PARAM_INVALID для поля action
     */
    public static EditRequest fromJson(JsonNode request) throws EditException {
        JsonNode action = request.get("action");
        if (action == null || action.isNull() || action.asText().isBlank()) {
            throw EditException.paramMissing("action");
        }
        try {
            return new EditRequest(OperationKind.fromName(action.asText()), request);
        } catch (IllegalArgumentException e) {
            throw EditException.paramInvalid("action", e.getMessage());
        }
    }
}
