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
package ru.nts.tools.structedit.refactoring;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import ru.nts.tools.structedit.core.ChangeSetWriter;
import ru.nts.tools.structedit.core.Diagnostics;
import ru.nts.tools.structedit.core.EditErrorCode;
import ru.nts.tools.structedit.core.EditException;
import ru.nts.tools.structedit.refactoring.operations.OutlineOperation;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Тесты диспетчеризации операций и преобразования ошибок в результаты.
 */
class EditEngineTest {

    private ObjectMapper mapper;
    private EditEngine engine;

    @BeforeEach
    void setUp() {
        mapper = new ObjectMapper();
        engine = new EditEngine();
    }

    @Test
    void allOperationsAreRegistered() {
        assertEquals(OperationKind.values().length, engine.getAvailableOperations().size());
        assertInstanceOf(OutlineOperation.class, engine.getOperation(OperationKind.OUTLINE));
    }

    @Nested
    class Dispatch {

        @Test
        void successfulEditReturnsSourceChange() {
            ObjectNode params = mapper.createObjectNode();
            params.put("source", "class A:\n    pass\n");
            params.put("target", "A");
            params.put("content", "def run(self):\n    return 1\n");

            EditResult result = engine.execute(OperationKind.INSERT_ROUTINE, params);

            assertTrue(result.isSuccess(), result.error());
            assertEquals("insert_routine", result.operation());
            assertEquals("class A:\n    def run(self):\n        return 1\n", result.text(EditResult.SOURCE));
            assertEquals(3, result.change(EditResult.SOURCE).orElseThrow().lineCount());
            assertTrue(result.change(EditResult.DESTINATION).isEmpty());
        }

        @Test
        void missingParameterBecomesErrorResult() {
            ObjectNode params = mapper.createObjectNode();
            params.put("source", "class A:\n    pass\n");

            EditResult result = engine.execute(OperationKind.DELETE_DECLARATION, params);

            assertFalse(result.isSuccess());
            assertEquals(EditErrorCode.PARAM_MISSING, result.errorCode());
            assertTrue(result.hint().contains("Solution: Provide parameter 'target'."));
            assertTrue(result.changes().isEmpty());
        }

        @Test
        void syntaxErrorNamesTheBuffer() {
            ObjectNode params = mapper.createObjectNode();
            params.put("source", "class A(:\n");
            params.put("target", "A");

            EditResult result = engine.execute(OperationKind.DELETE_DECLARATION, params);

            assertEquals(EditErrorCode.SYNTAX_ERROR, result.errorCode());
            assertTrue(result.error().startsWith("'source'"));
        }

        @Test
        void unexpectedFailureBecomesInternalError() {
            engine.registerOperation(new EditOperation() {
                @Override
                public OperationKind getKind() {
                    return OperationKind.OUTLINE;
                }

                @Override
                public void validateParams(JsonNode params) {
                }

                @Override
                public EditResult execute(JsonNode params, EditContext context) {
                    throw new IllegalStateException("boom");
                }
            });

            EditResult result = engine.execute(OperationKind.OUTLINE, mapper.createObjectNode());

            assertEquals(EditErrorCode.INTERNAL_ERROR, result.errorCode());
            assertTrue(result.error().contains("boom"));
            assertTrue(result.details().get("diagnostics").get(0).asText().startsWith("engine:"));
        }

        @Test
        void diagnosticsReachCallerAndResult() {
            List<String> seen = new ArrayList<>();
            EditEngine reporting = new EditEngine((stage, message) -> seen.add(stage));
            ObjectNode params = mapper.createObjectNode();
            params.put("source", "class A:\n    pass\n");
            params.put("target", "A");
            params.put("content", "class B:\n    x = 1\n");

            EditResult result = reporting.execute(OperationKind.REPLACE_DECLARATION, params);

            assertTrue(result.isSuccess());
            assertEquals("class A:\n    x = 1\n", result.text(EditResult.SOURCE));
            assertEquals(List.of("replace"), seen);
            assertEquals(1, result.details().get("diagnostics").size());
        }
    }

    @Nested
    class Requests {

        @Test
        void requestIsDecodedFromJson() throws Exception {
            JsonNode json = mapper.readTree("{\"action\": \"InsertImport\", \"source\": \"\", \"imports\": [\"import os\"]}");

            EditRequest request = EditRequest.fromJson(json);
            EditResult result = engine.execute(request);

            assertEquals(OperationKind.INSERT_IMPORT, request.operation());
            assertEquals("import os\n", result.text(EditResult.SOURCE));
        }

        @Test
        void missingActionIsRejected() {
            EditException e = assertThrows(EditException.class,
                    () -> EditRequest.fromJson(mapper.createObjectNode()));

            assertEquals(EditErrorCode.PARAM_MISSING, e.getCode());
        }

        @Test
        void unknownActionListsAvailableOperations() {
            ObjectNode json = mapper.createObjectNode().put("action", "rename");

            EditException e = assertThrows(EditException.class, () -> EditRequest.fromJson(json));

            assertEquals(EditErrorCode.PARAM_INVALID, e.getCode());
            assertTrue(e.getMessage().contains("relocate_range"));
        }

        @ParameterizedTest
        @ValueSource(strings = {"relocate_range", "RELOCATE_RANGE", "RelocateRange", "relocate-range"})
        void operationNamesAreForgiving(String name) {
            assertEquals(OperationKind.RELOCATE_RANGE, OperationKind.fromName(name));
        }
    }

    @Nested
    class Persisting {

        @TempDir
        Path tempDir;

        @Test
        void relocationWritesBothFiles() throws IOException {
            Path source = tempDir.resolve("a.py");
            Path destination = tempDir.resolve("b.py");
            Files.writeString(source, "x = 1\ny = 2\n");
            Files.writeString(destination, "z = 3\n");

            ObjectNode params = mapper.createObjectNode();
            params.put("source", Files.readString(source));
            params.put("destination", Files.readString(destination));
            params.put("startLine", 2);
            params.put("endLine", 2);
            params.put("targetLine", 2);
            EditResult result = new EditEngine(Diagnostics.silent()).execute(OperationKind.RELOCATE_RANGE, params);

            new ChangeSetWriter().writeAll(result.toWrites(Map.of(
                    EditResult.SOURCE, source, EditResult.DESTINATION, destination)));

            assertEquals("x = 1\n", Files.readString(source));
            assertEquals("z = 3\ny = 2\n", Files.readString(destination));
        }

        @Test
        void unmappedRoleIsRejected() {
            EditResult result = EditResult.success(OperationKind.REFORMAT, "done", "x = 1\n");

            assertThrows(IllegalArgumentException.class, () -> result.toWrites(Map.of()));
        }
    }
}
