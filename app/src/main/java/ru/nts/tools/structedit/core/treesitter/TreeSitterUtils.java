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
package ru.nts.tools.structedit.core.treesitter;

import org.treesitter.TSNode;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Утилиты навигации по узлам tree-sitter.
 * Все смещения байтовые (UTF-8), строки и колонки в публичных методах 1-based.
 */
public final class TreeSitterUtils {

    private TreeSitterUtils() {}

    /**
     * Находит первого дочернего узла указанного типа.
     */
    public static TSNode findChildByType(TSNode parent, String type) {
        int count = parent.getChildCount();
        for (int i = 0; i < count; i++) {
            TSNode child = parent.getChild(i);
            if (child != null && !child.isNull() && type.equals(child.getType())) {
                return child;
            }
        }
        return null;
    }

    /**
     * Возвращает всех непустых детей узла.
     */
    public static List<TSNode> children(TSNode parent) {
        List<TSNode> result = new ArrayList<>();
        int count = parent.getChildCount();
        for (int i = 0; i < count; i++) {
            TSNode child = parent.getChild(i);
            if (child != null && !child.isNull()) {
                result.add(child);
            }
        }
        return result;
    }

    /**
     * Извлекает текст узла из байтового массива (корректно для UTF-8).
     */
    public static String getNodeText(TSNode node, byte[] contentBytes) {
        int start = node.getStartByte();
        int end = node.getEndByte();
        if (start >= 0 && end <= contentBytes.length && start < end) {
            return new String(contentBytes, start, end - start, StandardCharsets.UTF_8);
        }
        return "";
    }

    /**
     * Узлы одного дерева сравниваются по типу и байтовому диапазону.
     */
    public static boolean sameNode(TSNode a, TSNode b) {
        return a.getStartByte() == b.getStartByte()
                && a.getEndByte() == b.getEndByte()
                && a.getType().equals(b.getType());
    }

    /**
     * Индекс узла среди детей родителя или -1.
     */
    public static int indexInParent(TSNode node) {
        TSNode parent = node.getParent();
        if (parent == null || parent.isNull()) return -1;
        int count = parent.getChildCount();
        for (int i = 0; i < count; i++) {
            TSNode child = parent.getChild(i);
            if (child != null && !child.isNull() && sameNode(child, node)) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Отмечает строки (0-based) многострочных строковых литералов поддерева.
     * Строки после первой попадают в continuationRows: их текст принадлежит литералу
     * и при сдвиге кода не меняется. Первые строки попадают в openingRows, если он задан.
     */
    public static void collectStringRows(TSNode node, Set<Integer> continuationRows, Set<Integer> openingRows) {
        if (node.getType().equals("string")) {
            int start = node.getStartPoint().getRow();
            int end = node.getEndPoint().getRow();
            if (end > start) {
                if (openingRows != null) {
                    openingRows.add(start);
                }
                for (int row = start + 1; row <= end; row++) {
                    continuationRows.add(row);
                }
            }
            return;
        }
        for (TSNode child : children(node)) {
            collectStringRows(child, continuationRows, openingRows);
        }
    }

    public static int startLine(TSNode node) {
        return node.getStartPoint().getRow() + 1;
    }

    /**
     * Последняя строка узла. Узел, заканчивающийся переводом строки, к следующей строке не относится.
     */
    public static int endLine(TSNode node) {
        int row = node.getEndPoint().getRow();
        if (node.getEndPoint().getColumn() == 0 && row > node.getStartPoint().getRow()) {
            row--;
        }
        return row + 1;
    }
}
