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

import ru.nts.tools.structedit.core.model.NodeKind;
import ru.nts.tools.structedit.core.model.SourceTree;
import ru.nts.tools.structedit.core.model.TreeNode;

import java.util.List;

/**
 * Общие приёмы вставки узлов в тела контейнеров.
 */
final class BodySplices {

    private BodySplices() {}

    /**
     * Добавляет узел в конец тела. Тело из одного {@code pass} считается пустым,
     * перед узлом в непустом теле ставится пустая строка.
     */
    static void append(SourceTree tree, int containerId, int nodeId) {
        dropLonePass(tree, containerId);
        if (tree.childCount(containerId) > 0) {
            tree.appendChild(containerId, tree.newPlaceholder());
        }
        tree.appendChild(containerId, nodeId);
    }

    /**
     * Удаляет единственный {@code pass} из тела класса или функции.
     *
     * @return true, если pass был удалён
     */
    static boolean dropLonePass(SourceTree tree, int containerId) {
        if (containerId == SourceTree.ROOT) {
            return false;
        }
        List<Integer> significant = tree.significantChildren(containerId);
        if (significant.size() != 1) {
            return false;
        }
        TreeNode only = tree.node(significant.get(0));
        if (only.kind() != NodeKind.STATEMENT || !only.code().isSingleLine()
                || !only.code().firstLine().equals("pass")) {
            return false;
        }
        tree.detach(only.id());
        return true;
    }

    /**
     * Позиция вставки импортов: после последнего импорта модуля, иначе после
     * начальных комментариев и строки документации.
     */
    static int importInsertionIndex(SourceTree tree) {
        List<Integer> children = tree.children(SourceTree.ROOT);
        int lastImport = -1;
        for (int i = 0; i < children.size(); i++) {
            if (tree.node(children.get(i)).kind().isImport()) {
                lastImport = i;
            }
        }
        if (lastImport >= 0) {
            return lastImport + 1;
        }
        int index = 0;
        while (index < children.size()) {
            TreeNode node = tree.node(children.get(index));
            if (node.kind() == NodeKind.COMMENT || node.kind() == NodeKind.PLACEHOLDER) {
                index++;
            } else if (node.isDocstring() && firstSignificant(tree) == node.id()) {
                return index + 1;
            } else {
                break;
            }
        }
        // Заголовочные комментарии (shebang, кодировка) остаются первыми
        return lastLeadingComment(tree, index);
    }

    private static int lastLeadingComment(SourceTree tree, int limit) {
        List<Integer> children = tree.children(SourceTree.ROOT);
        int result = 0;
        for (int i = 0; i < limit; i++) {
            // Комментарий вплотную над кодом относится к коду
            if (tree.node(children.get(i)).kind() == NodeKind.COMMENT
                    && (i + 1 == children.size() || !tree.node(children.get(i + 1)).kind().isSignificant())) {
                result = i + 1;
            }
        }
        return result;
    }

    private static int firstSignificant(SourceTree tree) {
        List<Integer> significant = tree.significantChildren(SourceTree.ROOT);
        return significant.isEmpty() ? -1 : significant.get(0);
    }
}
