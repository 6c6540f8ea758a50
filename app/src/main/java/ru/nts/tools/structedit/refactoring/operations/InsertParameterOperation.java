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
import ru.nts.tools.structedit.core.model.Parameter;
import ru.nts.tools.structedit.core.model.SourceTree;
import ru.nts.tools.structedit.core.model.TreeNode;
import ru.nts.tools.structedit.refactoring.*;

import java.util.ArrayList;
import java.util.List;

import static ru.nts.tools.structedit.refactoring.OperationParams.*;

/**
 * Операция добавления параметра в сигнатуру функции.
 *
 * <p>Параметр встаёт после последнего обычного параметра, перед {@code *}, {@code *args}
 * и {@code **kwargs}. Если параметр без значения по умолчанию оказывается после
 * параметра со значением, ему подставляется {@code None}, чтобы сигнатура оставалась корректной.
 */
public class InsertParameterOperation implements EditOperation {

    static final String PARAMETER = "parameter";
    static final String BACKFILL_DEFAULT = "None";

    @Override
    public OperationKind getKind() {
        return OperationKind.INSERT_PARAMETER;
    }

    @Override
    public void validateParams(JsonNode params) throws EditException {
        requireText(params, SOURCE);
        requireName(params, TARGET);
        optionalName(params, SCOPE);
        parameter(params);
    }

    @Override
    public EditResult execute(JsonNode params, EditContext context) throws EditException {
        SourceTree tree = context.parse(requireText(params, SOURCE), SOURCE);
        String target = requireName(params, TARGET);
        TreeNode routine = tree.node(context.locator(tree, params).routine(target, optionalName(params, SCOPE)));

        Parameter parameter = parameter(params);
        List<Parameter> signature = new ArrayList<>(routine.parameters());
        for (Parameter existing : signature) {
            if (parameter.name().equals(existing.name())) {
                throw EditException.structuralViolation("Function '" + target
                        + "' already has a parameter named '" + parameter.name() + "'");
            }
        }

        int index = insertionIndex(signature);
        boolean backfilled = false;
        if (!parameter.hasDefault() && hasDefaultBefore(signature, index)) {
            parameter = parameter.withDefault(BACKFILL_DEFAULT);
            backfilled = true;
        }
        signature.add(index, parameter);
        routine.setParameters(signature);

        String text = context.serialize(tree, SOURCE);

        ObjectNode details = context.newDetails();
        details.put("signature", routine.signature());
        details.put("backfilledDefault", backfilled);
        return EditResult.builder()
                .operation(getKind())
                .summary("Added parameter '" + parameter.name() + "' to '" + target + "'")
                .addChange(EditResult.SOURCE, text)
                .details(details)
                .build();
    }

    /**
     * Позиция перед первым из {@code *}, {@code *args}, {@code **kwargs}, иначе конец.
     */
    private static int insertionIndex(List<Parameter> signature) {
        for (int i = 0; i < signature.size(); i++) {
            switch (signature.get(i).kind()) {
                case KEYWORD_SEPARATOR, VAR_POSITIONAL, VAR_KEYWORD -> {
                    return i;
                }
                default -> {
                }
            }
        }
        return signature.size();
    }

    private static boolean hasDefaultBefore(List<Parameter> signature, int index) {
        for (int i = 0; i < index; i++) {
            Parameter p = signature.get(i);
            if (p.kind() == Parameter.Kind.PLAIN && p.hasDefault()) {
                return true;
            }
        }
        return false;
    }

    private static Parameter parameter(JsonNode params) throws EditException {
        JsonNode definition = params.get(PARAMETER);
        if (definition == null || definition.isNull()) {
            throw EditException.paramMissing(PARAMETER);
        }
        if (!definition.isObject()) {
            throw EditException.paramInvalid(PARAMETER, "expected an object {name, type?, default?}");
        }
        JsonNode name = definition.get("name");
        if (name == null || !name.isTextual() || name.asText().isBlank()) {
            throw EditException.paramMissing(PARAMETER + ".name");
        }
        if (!isIdentifier(name.asText())) {
            throw EditException.paramInvalid(PARAMETER + ".name", "'" + name.asText() + "' is not an identifier");
        }
        return Parameter.plain(name.asText(), textOrNull(definition, "type"), textOrNull(definition, "default"));
    }

    private static String textOrNull(JsonNode definition, String field) {
        JsonNode value = definition.get(field);
        if (value == null || value.isNull()) return null;
        String text = value.isTextual() ? value.asText().strip() : value.toString();
        return text.isEmpty() ? null : text;
    }
}
