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
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import ru.nts.tools.structedit.core.EditErrorCode;
import ru.nts.tools.structedit.core.EditException;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Тесты поиска классов и функций по имени.
 */
class NodeLocatorTest {

    private static final String SOURCE = """
            class Reader:
                def close(self):
                    pass

                def read(self):
                    pass


            class Writer:
                def close(self):
                    pass

                class Buffer:
                    def flush(self):
                        pass


            def helper():
                pass
            """;

    private SourceTree tree;

    @BeforeEach
    void setUp() throws EditException {
        tree = new SourceParser().parse(SOURCE);
    }

    @Nested
    class Strict {

        @Test
        void duplicateRoutineIsAmbiguous() {
            NodeLocator strict = new NodeLocator(tree, false);

            EditException e = assertThrows(EditException.class, () -> strict.routine("close", null));

            assertEquals(EditErrorCode.AMBIGUOUS, e.getCode());
            assertEquals("Found at line 2", e.getSuggestions().get(0));
            assertEquals("Found at line 10", e.getSuggestions().get(1));
        }

        @Test
        void scopeResolvesAmbiguity() throws EditException {
            NodeLocator strict = new NodeLocator(tree, false);

            int close = strict.routine("close", "Writer");

            assertEquals("Writer", tree.node(tree.node(close).parentId()).name());
        }

        @Test
        void nestedClassIsFoundInWholeTree() throws EditException {
            NodeLocator strict = new NodeLocator(tree, false);

            int flush = strict.routine("flush", "Buffer");

            assertEquals("flush", tree.node(flush).name());
        }

        @Test
        void nestedClassIsNotTopLevel() {
            NodeLocator strict = new NodeLocator(tree, false);

            EditException e = assertThrows(EditException.class, () -> strict.topLevelDeclaration("Buffer"));

            assertEquals(EditErrorCode.NOT_FOUND, e.getCode());
            assertTrue(e.getSuggestions().get(0).contains("Reader"));
            assertTrue(e.getSuggestions().get(0).contains("Writer"));
        }

        @Test
        void missingRoutineListsAvailableNames() {
            NodeLocator strict = new NodeLocator(tree, false);

            EditException e = assertThrows(EditException.class, () -> strict.routine("write", null));

            assertEquals(EditErrorCode.NOT_FOUND, e.getCode());
            assertTrue(e.getSuggestions().get(0).contains("helper"));
        }

        @Test
        void directChildrenIgnoreNestedRoutines() {
            NodeLocator strict = new NodeLocator(tree, false);

            assertThrows(EditException.class,
                    () -> strict.locate(NodeKind.ROUTINE, "flush", SourceTree.ROOT, SearchHorizon.DIRECT_CHILDREN));
        }
    }

    @Nested
    class FirstMatch {

        @Test
        void firstMatchTakesEarliestInSourceOrder() throws EditException {
            NodeLocator lenient = new NodeLocator(tree, true);

            int close = lenient.routine("close", null);

            assertEquals("Reader", tree.node(tree.node(close).parentId()).name());
        }
    }
}
