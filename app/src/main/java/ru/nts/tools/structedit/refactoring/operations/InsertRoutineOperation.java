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
 * Операция добавления метода в класс.
 * Класс ищется по всему модулю, якорь {@code after} только среди методов этого класса.
 */
public class InsertRoutineOperation implements EditOperation {

    @Override
    public OperationKind getKind() {
        return OperationKind.INSERT_ROUTINE;
    }

    @Override
    public void validateParams(JsonNode params) throws EditException {
        requireText(params, SOURCE);
        requireName(params, TARGET);
        requireText(params, CONTENT);
        optionalName(params, AFTER);
    }

    @Override
    public EditResult execute(JsonNode params, EditContext context) throws EditException {
        SourceTree tree = context.parse(requireText(params, SOURCE), SOURCE);
        String target = requireName(params, TARGET);
        String after = optionalName(params, AFTER);

        NodeLocator locator = context.locator(tree, params);
        int declaration = locator.locate(NodeKind.DECLARATION, target, SourceTree.ROOT, SearchHorizon.WHOLE_TREE);
        int anchor = after != null
                ? locator.locate(NodeKind.ROUTINE, after, declaration, SearchHorizon.DIRECT_CHILDREN)
                : -1;
        int routine = context.importDefinition(tree, requireText(params, CONTENT), NodeKind.ROUTINE);

        if (anchor >= 0) {
            tree.insertChild(declaration, tree.indexInParent(anchor) + 1, routine);
        } else {
            BodySplices.append(tree, declaration, routine);
        }

        return EditResult.success(getKind(),
                "Inserted method '" + tree.node(routine).name() + "' into class '" + target + "'",
                context.serialize(tree, SOURCE));
    }
}
