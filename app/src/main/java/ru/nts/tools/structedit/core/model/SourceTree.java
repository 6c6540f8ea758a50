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
package ru.nts.tools.structedit.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Дерево исходника в виде арены узлов.
 *
 * <p>Узлы адресуются целочисленными id, корень модуля всегда {@link #ROOT}.
 * Отсоединённые узлы остаются в арене, но недостижимы из корня и не сериализуются.
 * Все изменения структуры идут через методы арены, поэтому каждый присоединённый
 * узел имеет ровно одного родителя.
 */
public final class SourceTree {

    public static final int ROOT = 0;

    private final List<TreeNode> arena = new ArrayList<>();

    public SourceTree() {
        arena.add(new TreeNode(ROOT, NodeKind.MODULE));
    }

    public TreeNode root() {
        return arena.get(ROOT);
    }

    public TreeNode node(int id) {
        if (id < 0 || id >= arena.size()) {
            throw new IllegalArgumentException("No node with id " + id);
        }
        return arena.get(id);
    }

    /**
     * Создаёт отсоединённый узел.
     */
    public TreeNode newNode(NodeKind kind) {
        if (kind == NodeKind.MODULE) {
            throw new IllegalArgumentException("Module node is created with the tree");
        }
        TreeNode node = new TreeNode(arena.size(), kind);
        arena.add(node);
        return node;
    }

    public int newPlaceholder() {
        return newNode(NodeKind.PLACEHOLDER).id();
    }

    public List<Integer> children(int id) {
        return Collections.unmodifiableList(node(id).children);
    }

    public int childCount(int id) {
        return node(id).children.size();
    }

    /**
     * Дети без пустых строк и комментариев.
     */
    public List<Integer> significantChildren(int id) {
        List<Integer> result = new ArrayList<>();
        for (int child : node(id).children) {
            if (node(child).kind().isSignificant()) {
                result.add(child);
            }
        }
        return result;
    }

    public int indexInParent(int id) {
        TreeNode n = node(id);
        if (n.parent == TreeNode.NO_PARENT) {
            return -1;
        }
        return node(n.parent).children.indexOf(id);
    }

    /**
     * Вставляет отсоединённый узел в тело контейнера.
     *
     * @param parentId контейнер (модуль, класс или функция)
     * @param index позиция среди детей, от 0 до childCount
     * @param childId отсоединённый узел
     */
    public void insertChild(int parentId, int index, int childId) {
        TreeNode parent = node(parentId);
        TreeNode child = node(childId);
        if (!parent.kind().isContainer()) {
            throw new IllegalArgumentException(parent + " cannot have children");
        }
        if (child.parent != TreeNode.NO_PARENT || childId == ROOT) {
            throw new IllegalArgumentException(child + " is already attached");
        }
        if (index < 0 || index > parent.children.size()) {
            throw new IndexOutOfBoundsException("Index " + index + " outside body of " + parent);
        }
        if (childId == parentId || isAncestor(childId, parentId)) {
            throw new IllegalArgumentException(child + " cannot become its own descendant");
        }
        parent.children.add(index, childId);
        child.parent = parentId;
    }

    public void appendChild(int parentId, int childId) {
        insertChild(parentId, childCount(parentId), childId);
    }

    /**
     * Отсоединяет узел вместе с поддеревом.
     *
     * @return прежняя позиция в теле родителя
     */
    public int detach(int id) {
        if (id == ROOT) {
            throw new IllegalArgumentException("Module root cannot be detached");
        }
        TreeNode n = node(id);
        if (n.parent == TreeNode.NO_PARENT) {
            throw new IllegalArgumentException(n + " is not attached");
        }
        List<Integer> siblings = node(n.parent).children;
        int index = siblings.indexOf(id);
        siblings.remove(index);
        n.parent = TreeNode.NO_PARENT;
        return index;
    }

    /**
     * Ставит отсоединённый узел на место присоединённого.
     */
    public void replace(int oldId, int newId) {
        int parentId = node(oldId).parent;
        int index = detach(oldId);
        insertChild(parentId, index, newId);
    }

    /**
     * Переносит присоединённый узел в другое место этого же дерева.
     */
    public void move(int id, int newParentId, int index) {
        if (id == newParentId || isAncestor(id, newParentId)) {
            throw new IllegalArgumentException(node(id) + " cannot be moved into itself");
        }
        int oldParent = node(id).parent;
        int oldIndex = detach(id);
        int target = index;
        if (oldParent == newParentId && oldIndex < index) {
            target--;
        }
        insertChild(newParentId, target, id);
    }

    /**
     * Копирует поддерево другого дерева в эту арену.
     *
     * @return id отсоединённой копии
     */
    public int graft(SourceTree source, int sourceId) {
        TreeNode original = source.node(sourceId);
        if (original.kind() == NodeKind.MODULE) {
            throw new IllegalArgumentException("Module root cannot be grafted");
        }
        TreeNode copy = newNode(original.kind());
        copy.copyPayloadFrom(original);
        for (int child : original.children) {
            int childCopy = graft(source, child);
            copy.children.add(childCopy);
            node(childCopy).parent = copy.id();
        }
        return copy.id();
    }

    /**
     * Проверяет, лежит ли descendant внутри поддерева ancestor.
     */
    public boolean isAncestor(int ancestor, int descendant) {
        int current = node(descendant).parent;
        while (current != TreeNode.NO_PARENT) {
            if (current == ancestor) return true;
            current = node(current).parent;
        }
        return false;
    }

    public boolean isAttached(int id) {
        return id == ROOT || isAncestor(ROOT, id);
    }

    /**
     * Глубина узла: дети корня имеют глубину 0.
     */
    public int depth(int id) {
        int depth = -1;
        int current = node(id).parent;
        while (current != TreeNode.NO_PARENT) {
            depth++;
            current = node(current).parent;
        }
        return depth;
    }

    /**
     * Все потомки в прямом порядке обхода.
     */
    public List<Integer> walk(int fromId) {
        List<Integer> result = new ArrayList<>();
        collect(fromId, result);
        return result;
    }

    private void collect(int id, List<Integer> out) {
        for (int child : node(id).children) {
            out.add(child);
            collect(child, out);
        }
    }
}
