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
import ru.nts.tools.structedit.core.model.TreeNode;
import ru.nts.tools.structedit.refactoring.*;

import static ru.nts.tools.structedit.refactoring.OperationParams.*;

/**
 * Операция замены класса верхнего уровня.
 * Новое определение встаёт на место старого и получает его имя,
 * так что ссылки на класс остаются действительными.
 */
public class ReplaceDeclarationOperation implements EditOperation {

    @Override
    public OperationKind getKind() {
        return OperationKind.REPLACE_DECLARATION;
    }

    @Override
    public void validateParams(JsonNode params) throws EditException {
        requireText(params, SOURCE);
        requireName(params, TARGET);
        requireText(params, CONTENT);
    }

    @Override
    public EditResult execute(JsonNode params, EditContext context) throws EditException {
        SourceTree tree = context.parse(requireText(params, SOURCE), SOURCE);
        String target = requireName(params, TARGET);

        int existing = context.locator(tree, params).topLevelDeclaration(target);
        int replacement = context.importDefinition(tree, requireText(params, CONTENT), NodeKind.DECLARATION);

        TreeNode node = tree.node(replacement);
        String suppliedName = node.name();
        node.setName(target);
        tree.replace(existing, replacement);

        String summary = "Replaced class '" + target + "'";
        if (!target.equals(suppliedName)) {
            context.diagnostics().report("replace", "Replacement class '" + suppliedName
                    + "' renamed to '" + target + "'");
            summary += " (definition name '" + suppliedName + "' kept as '" + target + "')";
        }
        return EditResult.success(getKind(), summary, context.serialize(tree, SOURCE));
    }
}
