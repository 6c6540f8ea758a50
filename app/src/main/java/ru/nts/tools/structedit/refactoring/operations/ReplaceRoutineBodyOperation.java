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
import ru.nts.tools.structedit.core.model.LineScanner;
import ru.nts.tools.structedit.core.model.NodeKind;
import ru.nts.tools.structedit.core.model.SourceTree;
import ru.nts.tools.structedit.refactoring.*;

import java.util.ArrayList;
import java.util.List;

import static ru.nts.tools.structedit.refactoring.OperationParams.*;

/**
 * Операция замены тела функции.
 *
 * <p>Тело с отступом разбирается внутри синтетической функции, тело без отступа
 * разбирается как модуль. Строки многострочных литералов в обоих случаях не сдвигаются.
 */
public class ReplaceRoutineBodyOperation implements EditOperation {

    private static final String SYNTHETIC_HEADER = "def __replacement_body__():\n";

    @Override
    public OperationKind getKind() {
        return OperationKind.REPLACE_ROUTINE_BODY;
    }

    @Override
    public void validateParams(JsonNode params) throws EditException {
        requireText(params, SOURCE);
        requireName(params, TARGET);
        optionalName(params, SCOPE);
        requireText(params, CONTENT);
    }

    @Override
    public EditResult execute(JsonNode params, EditContext context) throws EditException {
        SourceTree tree = context.parse(requireText(params, SOURCE), SOURCE);
        String target = requireName(params, TARGET);
        int routine = context.locator(tree, params).routine(target, optionalName(params, SCOPE));

        ParsedBody body = parseBody(requireText(params, CONTENT), context);

        for (int child : new ArrayList<>(tree.children(routine))) {
            tree.detach(child);
        }
        List<Integer> statements = body.tree().children(body.rootId());
        int start = 0;
        while (start < statements.size()
                && body.tree().node(statements.get(start)).kind() == NodeKind.PLACEHOLDER) {
            start++;
        }
        for (int i = start; i < statements.size(); i++) {
            tree.appendChild(routine, tree.graft(body.tree(), statements.get(i)));
        }

        return EditResult.success(getKind(), "Replaced body of '" + target + "'",
                context.serialize(tree, SOURCE));
    }

    /**
     * Разобранное тело: дерево и узел, дети которого становятся новым телом.
     */
    private record ParsedBody(SourceTree tree, int rootId) {}

    private ParsedBody parseBody(String content, EditContext context) throws EditException {
        String normalized = content.replace("\r\n", "\n");
        if (firstCodeIndent(normalized) == 0) {
            return new ParsedBody(context.parse(normalized, CONTENT), SourceTree.ROOT);
        }
        SourceTree wrapped = context.parse(SYNTHETIC_HEADER + normalized, CONTENT);
        List<Integer> top = wrapped.significantChildren(SourceTree.ROOT);
        if (top.size() != 1) {
            throw EditException.structuralViolation(
                    "Body content must keep one indentation level; a line dedents below the first line");
        }
        return new ParsedBody(wrapped, top.get(0));
    }

    private static int firstCodeIndent(String content) {
        for (String line : content.split("\n", -1)) {
            if (!line.isBlank()) {
                return LineScanner.leadingWidth(line);
            }
        }
        return 0;
    }
}
