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

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import ru.nts.tools.structedit.core.Diagnostics;
import ru.nts.tools.structedit.core.EditErrorCode;
import ru.nts.tools.structedit.core.EditException;
import ru.nts.tools.structedit.refactoring.EditContext;
import ru.nts.tools.structedit.refactoring.EditResult;

import static org.junit.jupiter.api.Assertions.*;

class ReplaceDeclarationOperationTest {

    private static final String SOURCE = """
            class First:
                pass


            class Target:
                x = 1


            class Last:
                pass
            """;

    private ObjectMapper mapper;
    private ReplaceDeclarationOperation operation;
    private Diagnostics.Collector diagnostics;
    private EditContext context;

    @BeforeEach
    void setUp() {
        mapper = new ObjectMapper();
        operation = new ReplaceDeclarationOperation();
        diagnostics = new Diagnostics.Collector();
        context = new EditContext(diagnostics);
    }

    private ObjectNode params(String target, String content) {
        ObjectNode params = mapper.createObjectNode();
        params.put("source", SOURCE);
        params.put("target", target);
        params.put("content", content);
        return params;
    }

    @Test
    void replacementKeepsPosition() throws EditException {
        EditResult result = operation.execute(params("Target", "class Target(Base):\n    y = 2\n"), context);

        assertEquals("""
                class First:
                    pass


                class Target(Base):
                    y = 2


                class Last:
                    pass
                """, result.text(EditResult.SOURCE));
        assertTrue(diagnostics.isEmpty());
    }

    @Test
    void replacementTakesTargetName() throws EditException {
        EditResult result = operation.execute(params("Target", "class Renamed:\n    y = 2\n"), context);

        assertTrue(result.text(EditResult.SOURCE).contains("class Target:\n    y = 2\n"));
        assertFalse(result.text(EditResult.SOURCE).contains("Renamed"));
        assertTrue(result.summary().contains("Renamed"));
        assertEquals(1, diagnostics.messages().size());
    }

    @Test
    void functionReplacementIsMismatch() {
        EditException e = assertThrows(EditException.class,
                () -> operation.execute(params("Target", "def Target():\n    pass\n"), context));

        assertEquals(EditErrorCode.SIGNATURE_MISMATCH, e.getCode());
    }

    @Test
    void emptyReplacementIsMismatch() {
        EditException e = assertThrows(EditException.class,
                () -> operation.execute(params("Target", "# nothing here\n"), context));

        assertEquals(EditErrorCode.SIGNATURE_MISMATCH, e.getCode());
    }

    @Test
    void onlyTopLevelClassesAreReplaced() {
        ObjectNode params = mapper.createObjectNode()
                .put("source", "class Outer:\n    class Inner:\n        pass\n")
                .put("target", "Inner")
                .put("content", "class Inner:\n    pass\n");

        EditException e = assertThrows(EditException.class, () -> operation.execute(params, context));

        assertEquals(EditErrorCode.NOT_FOUND, e.getCode());
    }
}
