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
import ru.nts.tools.structedit.core.model.SourceTree;
import ru.nts.tools.structedit.refactoring.*;

import static ru.nts.tools.structedit.refactoring.OperationParams.*;

/**
 * Операция добавления класса в модуль.
 * С параметром {@code after} класс встаёт сразу за указанным классом верхнего уровня,
 * без него добавляется в конец модуля.
 */
public class InsertDeclarationOperation implements EditOperation {

    @Override
    public OperationKind getKind() {
        return OperationKind.INSERT_DECLARATION;
    }

    @Override
    public void validateParams(JsonNode params) throws EditException {
        requireText(params, SOURCE);
        requireText(params, CONTENT);
        optionalName(params, AFTER);
    }

    @Override
    public EditResult execute(JsonNode params, EditContext context) throws EditException {
        SourceTree tree = context.parse(requireText(params, SOURCE), SOURCE);
        String after = optionalName(params, AFTER);

        int anchor = after != null ? context.locator(tree, params).topLevelDeclaration(after) : -1;
        int declaration = context.importDefinition(tree, requireText(params, CONTENT), NodeKind.DECLARATION);

        if (anchor >= 0) {
            tree.insertChild(SourceTree.ROOT, tree.indexInParent(anchor) + 1, declaration);
        } else {
            if (tree.childCount(SourceTree.ROOT) > 0) {
                tree.appendChild(SourceTree.ROOT, tree.newPlaceholder());
            }
            tree.appendChild(SourceTree.ROOT, declaration);
        }

        String name = tree.node(declaration).name();
        return EditResult.success(getKind(),
                "Inserted class '" + name + "'" + (after != null ? " after '" + after + "'" : ""),
                context.serialize(tree, SOURCE));
    }
}
