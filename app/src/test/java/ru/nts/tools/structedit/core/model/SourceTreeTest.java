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

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SourceTreeTest {

    private SourceTree tree;
    private int declaration;
    private int routine;

    @BeforeEach
    void setUp() {
        tree = new SourceTree();
        declaration = named(NodeKind.DECLARATION, "A");
        routine = named(NodeKind.ROUTINE, "f");
        tree.appendChild(SourceTree.ROOT, declaration);
        tree.appendChild(declaration, routine);
    }

    private int named(NodeKind kind, String name) {
        TreeNode node = tree.newNode(kind);
        node.setName(name);
        return node.id();
    }

    @Test
    void depthCountsFromModuleChildren() {
        assertEquals(0, tree.depth(declaration));
        assertEquals(1, tree.depth(routine));
        assertEquals(List.of(declaration, routine), tree.walk(SourceTree.ROOT));
    }

    @Test
    void detachReturnsFormerIndex() {
        int second = named(NodeKind.ROUTINE, "g");
        tree.appendChild(declaration, second);

        assertEquals(1, tree.detach(second));
        assertFalse(tree.isAttached(second));
        assertEquals(-1, tree.indexInParent(second));
    }

    @Test
    void attachedNodeCannotBeInsertedAgain() {
        assertThrows(IllegalArgumentException.class, () -> tree.appendChild(SourceTree.ROOT, routine));
    }

    @Test
    void leafCannotHaveChildren() {
        TreeNode leaf = tree.newNode(NodeKind.STATEMENT);
        tree.appendChild(routine, leaf.id());

        assertThrows(IllegalArgumentException.class, () -> tree.appendChild(leaf.id(), tree.newPlaceholder()));
    }

    @Test
    void nodeCannotBecomeItsOwnDescendant() {
        int outer = named(NodeKind.DECLARATION, "Outer");
        int inner = named(NodeKind.DECLARATION, "Inner");
        tree.appendChild(outer, inner);

        assertThrows(IllegalArgumentException.class, () -> tree.appendChild(inner, outer));
        assertThrows(IllegalArgumentException.class, () -> tree.move(declaration, routine, 0));
    }

    @Test
    void moveWithinSameParentAdjustsIndex() {
        int g = named(NodeKind.ROUTINE, "g");
        int h = named(NodeKind.ROUTINE, "h");
        tree.appendChild(declaration, g);
        tree.appendChild(declaration, h);

        tree.move(routine, declaration, 3);

        assertEquals(List.of(g, h, routine), tree.children(declaration));
    }

    @Test
    void replaceKeepsPosition() {
        int g = named(NodeKind.ROUTINE, "g");
        tree.appendChild(declaration, g);
        int replacement = named(NodeKind.ROUTINE, "f2");

        tree.replace(routine, replacement);

        assertEquals(List.of(replacement, g), tree.children(declaration));
        assertFalse(tree.isAttached(routine));
    }

    @Test
    void graftCopiesSubtreeBetweenArenas() {
        TreeNode body = tree.newNode(NodeKind.STATEMENT);
        body.setCode(CodeFragment.of("return 1"));
        tree.appendChild(routine, body.id());

        SourceTree other = new SourceTree();
        int copy = other.graft(tree, declaration);
        other.appendChild(SourceTree.ROOT, copy);

        assertEquals("A", other.node(copy).name());
        int copiedRoutine = other.children(copy).get(0);
        assertEquals("f", other.node(copiedRoutine).name());
        assertEquals("return 1", other.node(other.children(copiedRoutine).get(0)).code().firstLine());
        assertTrue(tree.isAttached(declaration), "Source tree is not modified");
    }

    @Test
    void significantChildrenSkipSpacersAndComments() {
        TreeNode comment = tree.newNode(NodeKind.COMMENT);
        tree.appendChild(declaration, tree.newPlaceholder());
        tree.appendChild(declaration, comment.id());

        assertEquals(List.of(routine), tree.significantChildren(declaration));
    }

    @Test
    void moduleRootIsPermanent() {
        assertThrows(IllegalArgumentException.class, () -> tree.detach(SourceTree.ROOT));
        assertThrows(IllegalArgumentException.class, () -> tree.newNode(NodeKind.MODULE));
    }
}
