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

class ReplaceRoutineBodyOperationTest {

    private static final String SOURCE = """
            class Repo:
                def load(self, key):
                    return None

                def save(self, key, value):
                    pass
            """;

    private ObjectMapper mapper;
    private ReplaceRoutineBodyOperation operation;
    private EditContext context;

    @BeforeEach
    void setUp() {
        mapper = new ObjectMapper();
        operation = new ReplaceRoutineBodyOperation();
        context = new EditContext(Diagnostics.silent());
    }

    private ObjectNode params(String target, String content) {
        ObjectNode params = mapper.createObjectNode();
        params.put("source", SOURCE);
        params.put("target", target);
        params.put("content", content);
        return params;
    }

    @Test
    void unindentedBodyIsIndentedIntoRoutine() throws EditException {
        EditResult result = operation.execute(params("load", "value = self.cache.get(key)\nreturn value\n"), context);

        assertEquals("""
                class Repo:
                    def load(self, key):
                        value = self.cache.get(key)
                        return value

                    def save(self, key, value):
                        pass
                """, result.text(EditResult.SOURCE));
    }

    @Test
    void indentedBodyKeepsNesting() throws EditException {
        EditResult result = operation.execute(
                params("save", "  if value is None:\n    return\n  self.cache[key] = value\n"), context);

        assertTrue(result.text(EditResult.SOURCE).endsWith("""
                    def save(self, key, value):
                        if value is None:
                            return
                        self.cache[key] = value
                """));
    }

    @Test
    void docstringLinesAreNotShifted() throws EditException {
        EditResult result = operation.execute(
                params("save", "\"\"\"Stores value.\n\n  Indented note.\n\"\"\"\nself.cache[key] = value\n"), context);

        assertTrue(result.text(EditResult.SOURCE).contains("""
                        \"""Stores value.

                  Indented note.
                \"""
                        self.cache[key] = value
                """));
    }

    @Test
    void lineDedentedBelowBodyIsRejected() {
        EditException e = assertThrows(EditException.class,
                () -> operation.execute(params("save", "    x = 1\nreturn x\n"), context));

        assertEquals(EditErrorCode.STRUCTURAL_VIOLATION, e.getCode());
    }

    @Test
    void brokenBodyIsSyntaxError() {
        EditException e = assertThrows(EditException.class,
                () -> operation.execute(params("save", "return (\n"), context));

        assertEquals(EditErrorCode.SYNTAX_ERROR, e.getCode());
        assertTrue(e.getMessage().startsWith("'content'"));
    }

    @Test
    void unknownScopeIsNotFound() {
        ObjectNode params = params("save", "pass\n").put("scope", "Cache");

        EditException e = assertThrows(EditException.class, () -> operation.execute(params, context));

        assertEquals(EditErrorCode.NOT_FOUND, e.getCode());
    }
}
