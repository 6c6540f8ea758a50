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
package ru.nts.tools.structedit.core.treesitter;

import org.treesitter.TSNode;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Поиск синтаксических ошибок в дереве tree-sitter.
 *
 * <p>Ошибкой считается ERROR-узел или MISSING-узел, вставленный парсером при восстановлении.
 * Грамматика tree-sitter-python терпима к отступам, поэтому структура блоков проверяется
 * отдельно: пустое тело составной инструкции, отступ первой инструкции модуля, тело
 * не глубже заголовка, инструкции одного блока с разными отступами и ветки
 * ({@code else}, {@code except}, ...) не на уровне своей инструкции.
 */
public final class SyntaxChecker {

    private static final int MAX_ERRORS = 5;
    private static final int MAX_CONTEXT = 80;

    /**
     * Узлы, у которых обязано быть тело-блок.
     */
    private static final Set<String> BLOCK_OWNERS = Set.of(
            "function_definition", "class_definition", "if_statement", "elif_clause", "else_clause",
            "for_statement", "while_statement", "try_statement", "except_clause", "except_group_clause",
            "finally_clause", "with_statement", "case_clause");

    /**
     * Ветки, которые пишутся на уровне своей составной инструкции.
     */
    private static final Set<String> CLAUSES = Set.of(
            "elif_clause", "else_clause", "except_clause", "except_group_clause", "finally_clause");

    private SyntaxChecker() {}

    /**
     * Ошибка с позицией (строка и колонка с 1) и текстом строки.
     */
    public record SyntaxError(int line, int column, String message, String context) {}

    public record SyntaxCheckResult(List<SyntaxError> errors) {
        public boolean hasErrors() { return !errors.isEmpty(); }
        public int errorCount() { return errors.size(); }

        public SyntaxError firstError() {
            return errors.isEmpty() ? null : errors.get(0);
        }
    }

    public static SyntaxCheckResult check(String content) {
        return check(TreeSitterManager.getInstance().parse(content).getRootNode(), content);
    }

    /**
     * Проверяет уже построенное дерево, не более {@value #MAX_ERRORS} ошибок.
     *
     * @param root корень дерева
     * @param content текст, по которому дерево построено
     */
    public static SyntaxCheckResult check(TSNode root, String content) {
        Scan scan = new Scan(content);
        scan.visit(root);
        return new SyntaxCheckResult(List.copyOf(scan.errors));
    }

    /**
     * Один проход по дереву в порядке текста.
     */
    private static final class Scan {

        private final String[] lines;
        private final byte[] bytes;
        private final List<SyntaxError> errors = new ArrayList<>();

        Scan(String content) {
            this.lines = content.split("\n", -1);
            this.bytes = content.getBytes(StandardCharsets.UTF_8);
        }

        void visit(TSNode node) {
            if (errors.size() >= MAX_ERRORS) return;
            String type = node.getType();
            if (node.isMissing() || type.equals("ERROR")) {
                report(node, describe(node));
                return;
            }
            if (BLOCK_OWNERS.contains(type) && TreeSitterUtils.findChildByType(node, "block") == null) {
                report(node, "Expected an indented block after '" + headerWord(node) + "'");
            }
            switch (type) {
                case "module" -> checkStatements(node, 0);
                case "block" -> checkBlock(node);
                default -> {
                    for (TSNode child : TreeSitterUtils.children(node)) {
                        if (CLAUSES.contains(child.getType())) {
                            checkClause(node, child);
                        }
                        visit(child);
                    }
                }
            }
        }

        /**
         * Тело составной инструкции: непустое, глубже заголовка, с общим отступом.
         * Тело на строке заголовка ({@code if x: pass}) отступа не имеет.
         */
        private void checkBlock(TSNode block) {
            List<TSNode> statements = statementsOf(block);
            TSNode owner = block.getParent();
            if (statements.isEmpty()) {
                TSNode at = owner != null && !owner.isNull() ? owner : block;
                report(at, "Expected an indented block after '" + headerWord(at) + "'");
                visitChildren(block);
                return;
            }
            TSNode first = statements.get(0);
            int headerRow = owner != null && !owner.isNull() ? owner.getStartPoint().getRow() : 0;
            if (first.getStartPoint().getRow() == colonRow(owner, block)) {
                visitChildren(block);
                return;
            }
            int column = first.getStartPoint().getColumn();
            if (column <= indentOf(headerRow)) {
                report(first, "Expected an indented block after '" + headerWord(owner) + "' on line "
                        + (headerRow + 1));
                visitChildren(block);
                return;
            }
            checkStatements(block, column);
        }

        /**
         * Каждая инструкция, начинающая строку, стоит ровно на колонке expected.
         */
        private void checkStatements(TSNode container, int expected) {
            int previousEndRow = -1;
            for (TSNode child : TreeSitterUtils.children(container)) {
                if (errors.size() >= MAX_ERRORS) return;
                if (isStatement(child)) {
                    int row = child.getStartPoint().getRow();
                    int column = child.getStartPoint().getColumn();
                    if (row > previousEndRow && column != expected) {
                        report(child, column > expected
                                ? "Unexpected indent"
                                : "Unindent does not match any outer indentation level");
                    }
                    previousEndRow = child.getEndPoint().getRow();
                }
                visit(child);
            }
        }

        private void checkClause(TSNode statement, TSNode clause) {
            int row = clause.getStartPoint().getRow();
            if (row == statement.getStartPoint().getRow()) return;
            if (clause.getStartPoint().getColumn() != indentOf(statement.getStartPoint().getRow())) {
                report(clause, "'" + headerWord(clause) + "' is not aligned with its '"
                        + headerWord(statement) + "'");
            }
        }

        private void visitChildren(TSNode node) {
            for (TSNode child : TreeSitterUtils.children(node)) {
                visit(child);
            }
        }

        private List<TSNode> statementsOf(TSNode block) {
            List<TSNode> statements = new ArrayList<>();
            for (TSNode child : TreeSitterUtils.children(block)) {
                if (isStatement(child)) {
                    statements.add(child);
                }
            }
            return statements;
        }

        private static boolean isStatement(TSNode node) {
            if (!node.isNamed() || node.isMissing()) return false;
            return switch (node.getType()) {
                case "comment", "line_continuation", "ERROR" -> false;
                default -> true;
            };
        }

        /**
         * Строка двоеточия, за которым идёт блок, или -1.
         */
        private static int colonRow(TSNode owner, TSNode block) {
            if (owner == null || owner.isNull()) return -1;
            int row = -1;
            for (TSNode child : TreeSitterUtils.children(owner)) {
                if (child.getStartByte() >= block.getStartByte()) break;
                if (child.getType().equals(":")) {
                    row = child.getStartPoint().getRow();
                }
            }
            return row;
        }

        /**
         * Отступ строки в байтах, как колонки tree-sitter.
         */
        private int indentOf(int row) {
            if (row >= lines.length) return 0;
            String line = lines[row];
            int width = 0;
            while (width < line.length() && (line.charAt(width) == ' ' || line.charAt(width) == '\t')) {
                width++;
            }
            return width;
        }

        private String headerWord(TSNode node) {
            String text = TreeSitterUtils.getNodeText(node, bytes).strip();
            int end = 0;
            while (end < text.length() && Character.isJavaIdentifierPart(text.charAt(end))) {
                end++;
            }
            return end == 0 ? node.getType() : text.substring(0, end);
        }

        private void report(TSNode node, String message) {
            if (errors.size() >= MAX_ERRORS) return;
            int row = node.getStartPoint().getRow();
            errors.add(new SyntaxError(row + 1, node.getStartPoint().getColumn() + 1, message, contextOf(row)));
        }

        private String describe(TSNode node) {
            if (node.isMissing()) {
                return "Missing '" + node.getType() + "'";
            }
            String token = TreeSitterUtils.getNodeText(node, bytes).strip();
            int newline = token.indexOf('\n');
            if (newline >= 0) {
                token = token.substring(0, newline).strip();
            }
            TSNode parent = node.getParent();
            String where = parent == null || parent.isNull() ? "module" : parent.getType();
            return token.isEmpty()
                    ? "Unexpected syntax in " + where
                    : "Unexpected '" + abbreviate(token, 20) + "' in " + where;
        }

        private String contextOf(int row) {
            return row < lines.length ? abbreviate(lines[row].strip(), MAX_CONTEXT) : "";
        }
    }

    private static String abbreviate(String text, int max) {
        return text.length() > max ? text.substring(0, max) + "..." : text;
    }
}
