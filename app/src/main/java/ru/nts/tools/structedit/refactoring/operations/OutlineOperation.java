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
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import ru.nts.tools.structedit.core.EditException;
import ru.nts.tools.structedit.core.model.ImportBinding;
import ru.nts.tools.structedit.core.model.NodeKind;
import ru.nts.tools.structedit.core.model.SourceTree;
import ru.nts.tools.structedit.core.model.TreeNode;
import ru.nts.tools.structedit.refactoring.*;

import static ru.nts.tools.structedit.refactoring.OperationParams.*;

/**
 * Операция обзора структуры модуля: классы, функции и методы с их строками.
 * Текст не меняет.
 */
public class OutlineOperation implements EditOperation {

    @Override
    public OperationKind getKind() {
        return OperationKind.OUTLINE;
    }

    @Override
    public void validateParams(JsonNode params) throws EditException {
        requireText(params, SOURCE);
    }

    @Override
    public EditResult execute(JsonNode params, EditContext context) throws EditException {
        SourceTree tree = context.parse(requireText(params, SOURCE), SOURCE);

        ObjectNode details = context.newDetails();
        ArrayNode blocks = details.putArray("blocks");
        for (int id : tree.walk(SourceTree.ROOT)) {
            TreeNode node = tree.node(id);
            if (!node.kind().isDefinition()) continue;

            TreeNode parent = tree.node(node.parentId());
            ObjectNode block = blocks.addObject();
            block.put("kind", kindOf(node, parent));
            block.put("name", node.name());
            if (parent.kind() == NodeKind.MODULE) {
                block.putNull("parent");
            } else {
                block.put("parent", parent.name());
            }
            block.put("startLine", node.startLine());
            block.put("endLine", node.endLine());
            block.put("depth", tree.depth(id));
            if (node.kind() == NodeKind.ROUTINE) {
                block.put("signature", node.signature());
            }
        }
        ArrayNode imports = details.putArray("imports");
        ImportBinding.collect(tree).keySet().forEach(imports::add);

        return EditResult.builder()
                .operation(getKind())
                .summary(blocks.size() + " block(s), " + imports.size() + " imported name(s)")
                .details(details)
                .build();
    }

    private static String kindOf(TreeNode node, TreeNode parent) {
        if (node.kind() == NodeKind.DECLARATION) {
            return "class";
        }
        return parent.kind() == NodeKind.DECLARATION ? "method" : "function";
    }
}
