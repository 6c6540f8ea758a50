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
package ru.nts.tools.structedit.refactoring.operations;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import ru.nts.tools.structedit.core.EditException;
import ru.nts.tools.structedit.core.format.ResilientFormatter.FormatOutcome;
import ru.nts.tools.structedit.core.model.FormatStyle;
import ru.nts.tools.structedit.refactoring.*;

import static ru.nts.tools.structedit.refactoring.OperationParams.*;

/**
 * Операция форматирования модуля.
 * Отказ канонического форматтера не является ошибкой операции: результат запасного
 * построчного пути помечается в details как {@code "formatter": "fallback"}.
 */
public class ReformatOperation implements EditOperation {

    static final String INDENT_WIDTH = "indentWidth";
    static final String LINE_WIDTH = "lineWidth";

    private static final int MAX_INDENT_WIDTH = 16;

    @Override
    public OperationKind getKind() {
        return OperationKind.REFORMAT;
    }

    @Override
    public void validateParams(JsonNode params) throws EditException {
        requireText(params, SOURCE);
        style(params);
    }

    @Override
    public EditResult execute(JsonNode params, EditContext context) throws EditException {
        FormatStyle style = style(params);
        FormatOutcome outcome = context.formatter().reformat(requireText(params, SOURCE), style);

        ObjectNode details = context.newDetails();
        details.put("formatter", outcome.strategy().wireName());
        if (outcome.usedFallback()) {
            details.put("failure", outcome.failure());
        }
        return EditResult.builder()
                .operation(getKind())
                .summary(outcome.usedFallback()
                        ? "Reformatted with line-based fallback; review the result"
                        : "Reformatted")
                .addChange(EditResult.SOURCE, outcome.text())
                .details(details)
                .build();
    }

    private static FormatStyle style(JsonNode params) throws EditException {
        int indentWidth = optionalInt(params, INDENT_WIDTH, FormatStyle.DEFAULT_INDENT_WIDTH);
        if (indentWidth < 1 || indentWidth > MAX_INDENT_WIDTH) {
            throw EditException.outOfRange(INDENT_WIDTH, indentWidth, "1.." + MAX_INDENT_WIDTH);
        }
        int lineWidth = optionalInt(params, LINE_WIDTH, FormatStyle.DEFAULT_LINE_WIDTH);
        if (lineWidth != 0 && lineWidth < FormatStyle.MIN_LINE_WIDTH) {
            throw EditException.outOfRange(LINE_WIDTH, lineWidth, "0 or at least " + FormatStyle.MIN_LINE_WIDTH);
        }
        return FormatStyle.formatting(indentWidth, lineWidth);
    }
}
