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
import ru.nts.tools.structedit.core.Diagnostics;
import ru.nts.tools.structedit.core.EditException;
import ru.nts.tools.structedit.core.format.ResilientFormatter;
import ru.nts.tools.structedit.core.model.NodeKind;
import ru.nts.tools.structedit.core.model.NodeLocator;
import ru.nts.tools.structedit.core.model.SourceParser;
import ru.nts.tools.structedit.core.model.SourceSerializer;
import ru.nts.tools.structedit.core.model.SourceTree;
import ru.nts.tools.structedit.core.model.TreeNode;
import ru.nts.tools.structedit.core.treesitter.SyntaxChecker;

import java.util.List;

/**
 * Контекст выполнения операции редактирования.
 * Предоставляет разбор, сериализацию с проверкой и канал диагностики; живёт один запрос.
 */
public class EditContext {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final SourceParser parser;
    private final SourceSerializer serializer;
    private final Diagnostics diagnostics;
    private final ResilientFormatter formatter;

    public EditContext(Diagnostics diagnostics) {
        this(new SourceParser(), diagnostics);
    }

    public EditContext(SourceParser parser, Diagnostics diagnostics) {
        this.parser = parser;
        this.serializer = new SourceSerializer();
        this.diagnostics = diagnostics;
        this.formatter = new ResilientFormatter(diagnostics);
    }

    public Diagnostics diagnostics() {
        return diagnostics;
    }

    public ResilientFormatter formatter() {
        return formatter;
    }

    public ObjectMapper mapper() {
        return MAPPER;
    }

    public ObjectNode newDetails() {
        return MAPPER.createObjectNode();
    }

    /**
     * Разбирает буфер.
     *
     * @param text текст
     * @param role имя параметра, из которого пришёл текст (для сообщения об ошибке)
     * @throws EditException SYNTAX_ERROR
     */
    public SourceTree parse(String text, String role) throws EditException {
        try {
            return parser.parse(text);
        } catch (EditException e) {
            throw new EditException(e.getCode(), "'" + role + "': " + e.getMessage(), e.getContext());
        }
    }

    /**
     * Сериализует дерево и проверяет, что результат разбирается.
     *
     * @throws EditException STRUCTURAL_VIOLATION, если правка дала неразбираемый текст
     */
    public String serialize(SourceTree tree, String role) throws EditException {
        String text = serializer.serialize(tree);
        verify(text, role);
        return text;
    }

    /**
     * Проверяет, что итоговый текст разбирается.
     */
    public void verify(String text, String role) throws EditException {
        SyntaxChecker.SyntaxCheckResult check = SyntaxChecker.check(text);
        if (check.hasErrors()) {
            SyntaxChecker.SyntaxError error = check.firstError();
            diagnostics.report("verify", role + " does not parse after edit: " + error.message()
                    + " at line " + error.line());
            throw EditException.structuralViolation("Edited " + role + " does not parse at line "
                    + error.line() + ": " + error.context());
        }
    }

    /**
     * Разбирает текст ровно одного определения и переносит его в целевое дерево.
     *
     * @param target дерево, в которое будет вставлен узел
     * @param content текст определения
     * @param expected DECLARATION или ROUTINE
     * @return id отсоединённой копии в target
     * @throws EditException SYNTAX_ERROR, SIGNATURE_MISMATCH или STRUCTURAL_VIOLATION
     */
    public int importDefinition(SourceTree target, String content, NodeKind expected) throws EditException {
        SourceTree parsed = parse(content, OperationParams.CONTENT);
        List<Integer> significant = parsed.significantChildren(SourceTree.ROOT);
        if (significant.isEmpty()) {
            throw EditException.signatureMismatch(expected.label() + " definition", "no code");
        }
        if (significant.size() > 1) {
            throw EditException.structuralViolation("Expected a single " + expected.label()
                    + " definition, got " + significant.size() + " top-level statements");
        }
        TreeNode node = parsed.node(significant.get(0));
        if (node.kind() != expected) {
            throw EditException.signatureMismatch(expected.label() + " definition", node.kind().label());
        }
        return target.graft(parsed, node.id());
    }

    /**
     * Локатор с политикой неоднозначности из параметра {@code firstMatch}.
     */
    public NodeLocator locator(SourceTree tree, JsonNode params) throws EditException {
        return new NodeLocator(tree, OperationParams.optionalBoolean(params, OperationParams.FIRST_MATCH, false));
    }
}
