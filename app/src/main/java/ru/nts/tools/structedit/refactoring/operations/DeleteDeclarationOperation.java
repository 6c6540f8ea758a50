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

import java.util.ArrayList;
import java.util.List;

import static ru.nts.tools.structedit.refactoring.OperationParams.*;

/**
 * Операция удаления класса верхнего уровня.
 * Вместе с классом удаляются прилегающие комментарии над ним и пустые строки
 * с обеих сторон, чтобы пустые строки не накапливались.
 */
public class DeleteDeclarationOperation implements EditOperation {

    @Override
    public OperationKind getKind() {
        return OperationKind.DELETE_DECLARATION;
    }

    @Override
    public void validateParams(JsonNode params) throws EditException {
        requireText(params, SOURCE);
        requireName(params, TARGET);
    }

    @Override
    public EditResult execute(JsonNode params, EditContext context) throws EditException {
        SourceTree tree = context.parse(requireText(params, SOURCE), SOURCE);
        String target = requireName(params, TARGET);
        int declaration = context.locator(tree, params).topLevelDeclaration(target);

        List<Integer> siblings = tree.children(SourceTree.ROOT);
        int index = siblings.indexOf(declaration);
        List<Integer> doomed = new ArrayList<>();
        doomed.add(declaration);

        int before = index - 1;
        while (before >= 0 && kindAt(tree, siblings, before) == NodeKind.COMMENT) {
            doomed.add(siblings.get(before--));
        }
        while (before >= 0 && kindAt(tree, siblings, before) == NodeKind.PLACEHOLDER) {
            doomed.add(siblings.get(before--));
        }
        int after = index + 1;
        while (after < siblings.size() && kindAt(tree, siblings, after) == NodeKind.PLACEHOLDER) {
            doomed.add(siblings.get(after++));
        }

        for (int id : doomed) {
            tree.detach(id);
        }
        return EditResult.success(getKind(), "Deleted class '" + target + "'", context.serialize(tree, SOURCE));
    }

    private static NodeKind kindAt(SourceTree tree, List<Integer> siblings, int index) {
        return tree.node(siblings.get(index)).kind();
    }
}
