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
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import ru.nts.tools.structedit.core.Diagnostics;
import ru.nts.tools.structedit.core.EditErrorCode;
import ru.nts.tools.structedit.core.EditException;
import ru.nts.tools.structedit.refactoring.EditContext;
import ru.nts.tools.structedit.refactoring.EditResult;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Тесты добавления параметра в сигнатуру.
 */
class InsertParameterOperationTest {

    private ObjectMapper mapper;
    private InsertParameterOperation operation;
    private EditContext context;

    @BeforeEach
    void setUp() {
        mapper = new ObjectMapper();
        operation = new InsertParameterOperation();
        context = new EditContext(Diagnostics.silent());
    }

    private ObjectNode params(String source, String target) {
        ObjectNode params = mapper.createObjectNode();
        params.put("source", source);
        params.put("target", target);
        return params;
    }

    @Nested
    class Placement {

        @Test
        void defaultedParameterAfterDefaultedOne() throws EditException {
            ObjectNode params = params("def connect(host, retries=3):\n    pass\n", "connect");
            params.putObject("parameter").put("name", "timeout").put("default", 30);

            EditResult result = operation.execute(params, context);

            assertEquals("def connect(host, retries=3, timeout=30):\n    pass\n", result.text(EditResult.SOURCE));
            assertFalse(result.details().get("backfilledDefault").asBoolean());
        }

        @Test
        void requiredParameterAfterDefaultGetsNone() throws EditException {
            ObjectNode params = params("def connect(host, retries=3):\n    pass\n", "connect");
            params.putObject("parameter").put("name", "verbose");

            EditResult result = operation.execute(params, context);

            assertEquals("def connect(host, retries=3, verbose=None):\n    pass\n", result.text(EditResult.SOURCE));
            assertTrue(result.details().get("backfilledDefault").asBoolean());
            assertEquals("connect(host, retries=3, verbose=None)", result.details().get("signature").asText());
        }

        @Test
        void goesBeforeVariadicParameters() throws EditException {
            ObjectNode params = params("def f(a, *args, key=1, **kw):\n    pass\n", "f");
            params.putObject("parameter").put("name", "b");

            EditResult result = operation.execute(params, context);

            assertEquals("def f(a, b, *args, key=1, **kw):\n    pass\n", result.text(EditResult.SOURCE));
        }

        @Test
        void goesBeforeKeywordOnlyMarker() throws EditException {
            ObjectNode params = params("def f(a, *, key):\n    pass\n", "f");
            params.putObject("parameter").put("name", "b").put("type", "int");

            EditResult result = operation.execute(params, context);

            assertEquals("def f(a, b: int, *, key):\n    pass\n", result.text(EditResult.SOURCE));
        }

        @Test
        void typedDefaultUsesSpacesAroundEquals() throws EditException {
            ObjectNode params = params("class Client:\n    def send(self):\n        pass\n", "send")
                    .put("scope", "Client");
            params.putObject("parameter").put("name", "timeout").put("type", "float").put("default", "1.5");

            EditResult result = operation.execute(params, context);

            assertEquals("class Client:\n    def send(self, timeout: float = 1.5):\n        pass\n",
                    result.text(EditResult.SOURCE));
        }
    }

    @Nested
    class Errors {

        @Test
        void duplicateNameIsRejected() {
            ObjectNode params = params("def f(a):\n    pass\n", "f");
            params.putObject("parameter").put("name", "a");

            EditException e = assertThrows(EditException.class, () -> operation.execute(params, context));
            assertEquals(EditErrorCode.STRUCTURAL_VIOLATION, e.getCode());
        }

        @Test
        void parameterNameMustBeIdentifier() {
            ObjectNode params = params("def f(a):\n    pass\n", "f");
            params.putObject("parameter").put("name", "1st");

            EditException e = assertThrows(EditException.class, () -> operation.validateParams(params));
            assertEquals(EditErrorCode.PARAM_INVALID, e.getCode());
        }

        @Test
        void parameterMustBeObject() {
            ObjectNode params = params("def f(a):\n    pass\n", "f").put("parameter", "b");

            EditException e = assertThrows(EditException.class, () -> operation.validateParams(params));
            assertEquals(EditErrorCode.PARAM_INVALID, e.getCode());
        }

        @Test
        void ambiguousRoutineNeedsScope() {
            String source = "class A:\n    def run(self):\n        pass\n\n\nclass B:\n    def run(self):\n        pass\n";
            ObjectNode params = params(source, "run");
            params.putObject("parameter").put("name", "x");

            EditException e = assertThrows(EditException.class, () -> operation.execute(params, context));
            assertEquals(EditErrorCode.AMBIGUOUS, e.getCode());
        }
    }
}
