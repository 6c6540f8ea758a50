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
import ru.nts.tools.structedit.core.EditException;
import ru.nts.tools.structedit.core.model.NodeKind;
import ru.nts.tools.structedit.core.model.NodeLocator;
import ru.nts.tools.structedit.core.model.SearchHorizon;
import ru.nts.tools.structedit.core.model.SourceTree;
import ru.nts.tools.structedit.refactoring.*;

import static ru.nts.tools.structedit.refactoring.OperationParams.*;

/**
 * Операция переноса метода из одного класса в другой.
 *
 * <p>Без {@code destination} перенос идёт внутри исходного буфера: узел просто меняет
 * родителя. С {@code destination} поддерево копируется в дерево назначения и удаляется
 * из исходного. Зависимости метода не анализируются.
 */
public class RelocateRoutineOperation implements EditOperation {

    static final String SOURCE_DECLARATION = "sourceDeclaration";
    static final String DESTINATION_DECLARATION = "destinationDeclaration";

    @Override
    public OperationKind getKind() {
        return OperationKind.RELOCATE_ROUTINE;
    }

    @Override
    public void validateParams(JsonNode params) throws EditException {
        requireText(params, SOURCE);
        optionalText(params, DESTINATION);
        requireName(params, TARGET);
        requireName(params, SOURCE_DECLARATION);
        requireName(params, DESTINATION_DECLARATION);
    }

    @Override
    public EditResult execute(JsonNode params, EditContext context) throws EditException {
        String target = requireName(params, TARGET);
        String fromName = requireName(params, SOURCE_DECLARATION);
        String toName = requireName(params, DESTINATION_DECLARATION);
        String destinationText = optionalText(params, DESTINATION);

        SourceTree source = context.parse(requireText(params, SOURCE), SOURCE);
        NodeLocator sourceLocator = context.locator(source, params);
        int fromDeclaration = sourceLocator.locate(NodeKind.DECLARATION, fromName,
                SourceTree.ROOT, SearchHorizon.WHOLE_TREE);
        int routine = sourceLocator.locate(NodeKind.ROUTINE, target, fromDeclaration, SearchHorizon.DIRECT_CHILDREN);

        String summary = "Moved method '" + target + "' from '" + fromName + "' to '" + toName + "'";

        if (destinationText == null) {
            int toDeclaration = sourceLocator.locate(NodeKind.DECLARATION, toName,
                    SourceTree.ROOT, SearchHorizon.WHOLE_TREE);
            if (toDeclaration == routine || source.isAncestor(routine, toDeclaration)) {
                throw EditException.structuralViolation("Class '" + toName
                        + "' is nested inside method '" + target + "'");
            }
            source.detach(routine);
            BodySplices.append(source, toDeclaration, routine);
            return EditResult.success(getKind(), summary, context.serialize(source, SOURCE));
        }

        SourceTree destination = context.parse(destinationText, DESTINATION);
        int toDeclaration = context.locator(destination, params).locate(NodeKind.DECLARATION, toName,
                SourceTree.ROOT, SearchHorizon.WHOLE_TREE);

        int copy = destination.graft(source, routine);
        source.detach(routine);
        BodySplices.append(destination, toDeclaration, copy);

        // Обе стороны сериализуются и проверяются до возврата
        String newSource = context.serialize(source, SOURCE);
        String newDestination = context.serialize(destination, DESTINATION);
        return EditResult.builder()
                .operation(getKind())
                .summary(summary)
                .addChange(EditResult.SOURCE, newSource)
                .addChange(EditResult.DESTINATION, newDestination)
                .build();
    }
}
