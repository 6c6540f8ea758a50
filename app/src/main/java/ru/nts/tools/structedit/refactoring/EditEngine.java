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
import ru.nts.tools.structedit.core.Diagnostics;
import ru.nts.tools.structedit.core.EditErrorCode;
import ru.nts.tools.structedit.core.EditException;
import ru.nts.tools.structedit.refactoring.operations.*;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;

/**
 * Движок редактирования.
 * Управляет регистрацией и выполнением операций. Любой отказ превращается
 * в результат со статусом ERROR, исключения наружу не выходят.
 */
public final class EditEngine {

    private final Map<OperationKind, EditOperation> operations = new EnumMap<>(OperationKind.class);
    private final Diagnostics diagnostics;

    public EditEngine() {
        this(Diagnostics.silent());
    }

    /**
     * @param diagnostics sink вызывающей стороны; сообщения также попадают в details результата
     */
    public EditEngine(Diagnostics diagnostics) {
        this.diagnostics = diagnostics;
        // Регистрация встроенных операций
        registerOperation(new InsertDeclarationOperation());
        registerOperation(new InsertImportOperation());
        registerOperation(new InsertRoutineOperation());
        registerOperation(new InsertParameterOperation());
        registerOperation(new ReplaceRoutineBodyOperation());
        registerOperation(new ReplaceDeclarationOperation());
        registerOperation(new DeleteDeclarationOperation());
        registerOperation(new RelocateRangeOperation());
        registerOperation(new RelocateRoutineOperation());
        registerOperation(new ReformatOperation());
        registerOperation(new OutlineOperation());
    }

    /**
     * Регистрирует операцию, заменяя прежнюю того же вида.
     */
    public void registerOperation(EditOperation operation) {
        operations.put(operation.getKind(), operation);
    }

    public EditOperation getOperation(OperationKind kind) {
        return operations.get(kind);
    }

    public Set<OperationKind> getAvailableOperations() {
        return Collections.unmodifiableSet(operations.keySet());
    }

    public EditResult execute(EditRequest request) {
        return execute(request.operation(), request.params());
    }

    /**
     * Выполняет операцию.
     */
    public EditResult execute(OperationKind kind, JsonNode params) {
        EditOperation operation = operations.get(kind);
        if (operation == null) {
            return EditResult.error(kind.wireName(), new EditException(EditErrorCode.PARAM_INVALID,
                    "Operation '" + kind.wireName() + "' is not registered"));
        }

        Diagnostics.Collector collector = new Diagnostics.Collector();
        EditContext context = new EditContext(collector.andThen(diagnostics));
        try {
            operation.validateParams(params);
            EditResult result = operation.execute(params, context);
            return collector.isEmpty() ? result : result.withDiagnostics(collector.messages());
        } catch (EditException e) {
            return EditResult.error(kind.wireName(), e);
        } catch (RuntimeException e) {
            context.diagnostics().report("engine", kind.wireName() + " failed: " + e);
            EditResult error = EditResult.error(kind.wireName(), new EditException(EditErrorCode.INTERNAL_ERROR,
                    "Edit failed: " + e.getMessage(), e));
            return error.withDiagnostics(collector.messages());
        }
    }
}
