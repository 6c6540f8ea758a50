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
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import ru.nts.tools.structedit.core.Diagnostics;
import ru.nts.tools.structedit.core.EditErrorCode;
import ru.nts.tools.structedit.core.EditException;
import ru.nts.tools.structedit.refactoring.EditContext;
import ru.nts.tools.structedit.refactoring.EditResult;

import static org.junit.jupiter.api.Assertions.*;

class OutlineOperationTest {

    private static final String SOURCE = """
            import os
            from x import y as z


            class A(Base):
                def m(self, a):
                    pass

                class Inner:
                    def n(self):
                        pass


            async def top():
                pass
            """;

    private ObjectMapper mapper;
    private OutlineOperation operation;
    private EditContext context;

    @BeforeEach
    void setUp() {
        mapper = new ObjectMapper();
        operation = new OutlineOperation();
        context = new EditContext(Diagnostics.silent());
    }

    @Test
    void listsBlocksInSourceOrder() throws EditException {
        EditResult result = operation.execute(mapper.createObjectNode().put("source", SOURCE), context);

        JsonNode blocks = result.details().get("blocks");
        assertEquals(5, blocks.size());
        assertBlock(blocks.get(0), "class", "A", null, 5, 11, 0);
        assertBlock(blocks.get(1), "method", "m", "A", 6, 7, 1);
        assertBlock(blocks.get(2), "class", "Inner", "A", 9, 11, 1);
        assertBlock(blocks.get(3), "method", "n", "Inner", 10, 11, 2);
        assertBlock(blocks.get(4), "function", "top", null, 14, 15, 0);
        assertEquals("m(self, a)", blocks.get(1).get("signature").asText());
        assertTrue(result.changes().isEmpty());
    }

    @Test
    void listsImportedNames() throws EditException {
        EditResult result = operation.execute(mapper.createObjectNode().put("source", SOURCE), context);

        JsonNode imports = result.details().get("imports");
        assertEquals(2, imports.size());
        assertEquals("os", imports.get(0).asText());
        assertEquals("z", imports.get(1).asText());
        assertEquals("5 block(s), 2 imported name(s)", result.summary());
    }

    @Test
    void brokenSourceIsSyntaxError() {
        EditException e = assertThrows(EditException.class,
                () -> operation.execute(mapper.createObjectNode().put("source", "class (:\n"), context));

        assertEquals(EditErrorCode.SYNTAX_ERROR, e.getCode());
    }

    private static void assertBlock(JsonNode block, String kind, String name, String parent,
                                    int startLine, int endLine, int depth) {
        assertEquals(kind, block.get("kind").asText());
        assertEquals(name, block.get("name").asText());
        if (parent == null) {
            assertTrue(block.get("parent").isNull());
        } else {
            assertEquals(parent, block.get("parent").asText());
        }
        assertEquals(startLine, block.get("startLine").asInt());
        assertEquals(endLine, block.get("endLine").asInt());
        assertEquals(depth, block.get("depth").asInt());
    }
}
