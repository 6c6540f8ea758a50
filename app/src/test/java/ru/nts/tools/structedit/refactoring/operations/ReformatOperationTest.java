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

class ReformatOperationTest {

    private ObjectMapper mapper;
    private ReformatOperation operation;
    private EditContext context;

    @BeforeEach
    void setUp() {
        mapper = new ObjectMapper();
        operation = new ReformatOperation();
        context = new EditContext(Diagnostics.silent());
    }

    @Test
    void canonicalPathWithCustomIndent() throws EditException {
        ObjectNode params = mapper.createObjectNode()
                .put("source", "def f():\n    return 'x'\n")
                .put("indentWidth", 2);

        EditResult result = operation.execute(params, context);

        assertEquals("def f():\n  return \"x\"\n", result.text(EditResult.SOURCE));
        assertEquals("canonical", result.details().get("formatter").asText());
        assertNull(result.details().get("failure"));
    }

    @Test
    void reformatIsIdempotent() throws EditException {
        ObjectNode params = mapper.createObjectNode()
                .put("source", "import os\nclass A:\n  def f(self, first_value, second_value, third_value, fourth):\n    pass\n")
                .put("lineWidth", 40);

        String once = operation.execute(params, context).text(EditResult.SOURCE);
        params.put("source", once);
        String twice = operation.execute(params, context).text(EditResult.SOURCE);

        assertEquals(once, twice);
    }

    @Test
    void brokenSourceUsesFallback() throws EditException {
        ObjectNode params = mapper.createObjectNode().put("source", "def f(:\nreturn 1\n");

        EditResult result = operation.execute(params, context);

        assertTrue(result.isSuccess());
        assertEquals("fallback", result.details().get("formatter").asText());
        assertTrue(result.details().get("failure").asText().contains("SYNTAX_ERROR"));
        assertEquals("    def f(:\n    return 1\n", result.text(EditResult.SOURCE));
    }

    @Test
    void indentWidthIsBounded() {
        ObjectNode params = mapper.createObjectNode().put("source", "x = 1\n").put("indentWidth", 0);

        EditException e = assertThrows(EditException.class, () -> operation.validateParams(params));

        assertEquals(EditErrorCode.PARAM_OUT_OF_RANGE, e.getCode());
    }

    @Test
    void narrowLineWidthIsRejectedButZeroDisablesWrapping() throws EditException {
        ObjectNode narrow = mapper.createObjectNode().put("source", "x = 1\n").put("lineWidth", 10);
        assertThrows(EditException.class, () -> operation.validateParams(narrow));

        String longLine = "result = compute(first_argument, second_argument, third_argument, fourth_argument, fifth)\n";
        ObjectNode unlimited = mapper.createObjectNode().put("source", longLine).put("lineWidth", 0);
        assertEquals(longLine, operation.execute(unlimited, context).text(EditResult.SOURCE));
    }
}
