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

import java.util.ArrayList;
import java.util.List;

import static ru.nts.tools.structedit.refactoring.OperationParams.*;

/**
 * Операция добавления импортов.
 * Импорты встают после последнего импорта модуля; если импортов нет, то после
 * заголовочных комментариев и строки документации модуля.
 */
public class InsertImportOperation implements EditOperation {

    static final String IMPORTS = "imports";

    @Override
    public OperationKind getKind() {
        return OperationKind.INSERT_IMPORT;
    }

    @Override
    public void validateParams(JsonNode params) throws EditException {
        requireText(params, SOURCE);
        imports(params);
    }

    @Override
    public EditResult execute(JsonNode params, EditContext context) throws EditException {
        SourceTree tree = context.parse(requireText(params, SOURCE), SOURCE);

        List<Integer> nodes = new ArrayList<>();
        for (String statement : imports(params)) {
            SourceTree parsed = context.parse(statement, IMPORTS);
            List<Integer> significant = parsed.significantChildren(SourceTree.ROOT);
            if (significant.isEmpty()) {
                throw EditException.signatureMismatch("import statement", "no code");
            }
            for (int id : significant) {
                TreeNode node = parsed.node(id);
                if (!node.kind().isImport()) {
                    throw EditException.signatureMismatch("import statement", node.kind().label());
                }
                nodes.add(tree.graft(parsed, id));
            }
        }

        int index = BodySplices.importInsertionIndex(tree);
        for (int id : nodes) {
            tree.insertChild(SourceTree.ROOT, index++, id);
        }
        // Отделяем блок импортов от следующего за ним кода
        if (index < tree.childCount(SourceTree.ROOT)) {
            NodeKind next = tree.node(tree.children(SourceTree.ROOT).get(index)).kind();
            if (next != NodeKind.PLACEHOLDER && !next.isImport()) {
                tree.insertChild(SourceTree.ROOT, index, tree.newPlaceholder());
            }
        }

        return EditResult.success(getKind(), "Inserted " + nodes.size() + " import(s)",
                context.serialize(tree, SOURCE));
    }

    private static List<String> imports(JsonNode params) throws EditException {
        JsonNode array = params.get(IMPORTS);
        if (array == null || array.isNull()) {
            throw EditException.paramMissing(IMPORTS);
        }
        if (!array.isArray()) {
            throw EditException.paramInvalid(IMPORTS, "expected an array of import statements");
        }
        if (array.isEmpty()) {
            throw EditException.paramMissing(IMPORTS);
        }
        List<String> result = new ArrayList<>();
        for (JsonNode item : array) {
            if (!item.isTextual() || item.asText().isBlank()) {
                throw EditException.paramInvalid(IMPORTS, "every item must be a non-empty statement");
            }
            result.add(item.asText());
        }
        return result;
    }
}
