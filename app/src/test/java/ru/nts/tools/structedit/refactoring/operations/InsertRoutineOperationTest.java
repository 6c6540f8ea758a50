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

class InsertRoutineOperationTest {

    private static final String SOURCE = """
            class Service:
                def start(self):
                    pass

                def stop(self):
                    pass
            """;

    private ObjectMapper mapper;
    private InsertRoutineOperation operation;
    private EditContext context;

    @BeforeEach
    void setUp() {
        mapper = new ObjectMapper();
        operation = new InsertRoutineOperation();
        context = new EditContext(Diagnostics.silent());
    }

    private ObjectNode params(String source, String target, String content) {
        ObjectNode params = mapper.createObjectNode();
        params.put("source", source);
        params.put("target", target);
        params.put("content", content);
        return params;
    }

    @Test
    void insertsAfterAnchorMethod() throws EditException {
        ObjectNode params = params(SOURCE, "Service", "def restart(self):\n    self.stop()\n    self.start()\n")
                .put("after", "start");

        EditResult result = operation.execute(params, context);

        assertEquals("""
                class Service:
                    def start(self):
                        pass

                    def restart(self):
                        self.stop()
                        self.start()

                    def stop(self):
                        pass
                """, result.text(EditResult.SOURCE));
    }

    @Test
    void appendsToEnd() throws EditException {
        EditResult result = operation.execute(params(SOURCE, "Service", "async def wait(self):\n    pass\n"), context);

        assertTrue(result.text(EditResult.SOURCE).endsWith("""
                    def stop(self):
                        pass

                    async def wait(self):
                        pass
                """));
    }

    @Test
    void lonePassIsReplaced() throws EditException {
        EditResult result = operation.execute(
                params("class Empty:\n    pass\n", "Empty", "def run(self):\n    return 1\n"), context);

        assertEquals("class Empty:\n    def run(self):\n        return 1\n", result.text(EditResult.SOURCE));
    }

    @Test
    void nestedClassIsReachable() throws EditException {
        String source = "class Outer:\n    class Inner:\n        pass\n";

        EditResult result = operation.execute(params(source, "Inner", "def ping(self):\n    pass\n"), context);

        assertEquals("class Outer:\n    class Inner:\n        def ping(self):\n            pass\n",
                result.text(EditResult.SOURCE));
    }

    @Test
    void decoratorsAreKept() throws EditException {
        EditResult result = operation.execute(
                params("class A:\n    pass\n", "A", "@staticmethod\ndef build():\n    return A()\n"), context);

        assertEquals("class A:\n    @staticmethod\n    def build():\n        return A()\n",
                result.text(EditResult.SOURCE));
    }

    @Test
    void anchorIsSearchedOnlyInTargetClass() {
        String source = SOURCE + "\n\nclass Other:\n    def helper(self):\n        pass\n";
        ObjectNode params = params(source, "Service", "def x(self):\n    pass\n").put("after", "helper");

        EditException e = assertThrows(EditException.class, () -> operation.execute(params, context));

        assertEquals(EditErrorCode.NOT_FOUND, e.getCode());
        assertEquals("Available: start, stop", e.getSuggestions().get(0));
    }

    @Test
    void classContentIsRejected() {
        EditException e = assertThrows(EditException.class,
                () -> operation.execute(params(SOURCE, "Service", "class X:\n    pass\n"), context));

        assertEquals(EditErrorCode.SIGNATURE_MISMATCH, e.getCode());
    }
}
