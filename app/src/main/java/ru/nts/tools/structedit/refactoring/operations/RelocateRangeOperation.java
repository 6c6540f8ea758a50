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
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.treesitter.TSNode;
import ru.nts.tools.structedit.core.EditErrorCode;
import ru.nts.tools.structedit.core.EditException;
import ru.nts.tools.structedit.core.model.ImportBinding;
import ru.nts.tools.structedit.core.model.ImportedName;
import ru.nts.tools.structedit.core.model.LineScanner;
import ru.nts.tools.structedit.core.model.NodeKind;
import ru.nts.tools.structedit.core.model.SourceTree;
import ru.nts.tools.structedit.core.model.TreeNode;
import ru.nts.tools.structedit.core.treesitter.IdentifierCollector;
import ru.nts.tools.structedit.core.treesitter.SyntaxChecker;
import ru.nts.tools.structedit.core.treesitter.TreeSitterManager;
import ru.nts.tools.structedit.core.treesitter.TreeSitterUtils;
import ru.nts.tools.structedit.refactoring.*;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static ru.nts.tools.structedit.refactoring.OperationParams.*;

/**
 * Операция переноса диапазона строк.
 *
 * <p>Строки {@code startLine..endLine} вырезаются из исходного буфера и вставляются перед строкой
 * {@code targetLine} буфера назначения (нумерация до правки) с отступом строки, перед которой
 * встают; строки многострочных литералов не сдвигаются. При переносе в другой буфер импорты
 * исходного модуля, от которых зависят свободные имена фрагмента, переносятся вместе с ним и
 * встают после последнего импорта назначения. Исходные импорты не трогаются.
 *
 * <p>Переносится не весь исходный import, а только нужные фрагменту имена из него:
 * {@code from m import a, b} даёт {@code from m import a}, если фрагменту нужно одно {@code a}.
 */
public class RelocateRangeOperation implements EditOperation {

    static final String START_LINE = "startLine";
    static final String END_LINE = "endLine";
    static final String TARGET_LINE = "targetLine";
    static final String CARRY_IMPORTS = "carryImports";

    @Override
    public OperationKind getKind() {
        return OperationKind.RELOCATE_RANGE;
    }

    @Override
    public void validateParams(JsonNode params) throws EditException {
        requireText(params, SOURCE);
        optionalText(params, DESTINATION);
        int start = requireInt(params, START_LINE);
        int end = requireInt(params, END_LINE);
        requireInt(params, TARGET_LINE);
        optionalBoolean(params, CARRY_IMPORTS, true);
        if (start < 1) {
            throw EditException.outOfRange(START_LINE, start, "1..");
        }
        if (end < start) {
            throw EditException.outOfRange(END_LINE, end, start + "..");
        }
    }

    @Override
    public EditResult execute(JsonNode params, EditContext context) throws EditException {
        String sourceText = requireText(params, SOURCE);
        String destinationText = optionalText(params, DESTINATION);
        int start = requireInt(params, START_LINE);
        int end = requireInt(params, END_LINE);
        int targetLine = requireInt(params, TARGET_LINE);

        TextLines source = TextLines.of(sourceText);
        if (end > source.size()) {
            throw EditException.outOfRange(END_LINE, end, start + ".." + source.size());
        }
        SourceTree sourceTree = context.parse(sourceText, SOURCE);
        Set<Integer> sourceStrings = stringRows(sourceText);

        List<String> block = new ArrayList<>(source.lines().subList(start - 1, end));
        Set<Integer> blockStrings = new HashSet<>();
        for (int row : sourceStrings) {
            if (row >= start - 1 && row < end) {
                blockStrings.add(row - (start - 1));
            }
        }
        Set<String> free = freeNames(block, blockStrings, start, end);
        List<String> remaining = new ArrayList<>(source.lines());
        remaining.subList(start - 1, end).clear();

        ObjectNode details = context.newDetails();
        free.forEach(details.putArray("freeIdentifiers")::add);

        if (destinationText == null) {
            return relocateWithinSource(source, remaining, block, blockStrings, sourceStrings,
                    start, end, targetLine, details, context);
        }

        TextLines destination = TextLines.of(destinationText);
        if (targetLine < 1 || targetLine > destination.size() + 1) {
            throw EditException.outOfRange(TARGET_LINE, targetLine, "1.." + (destination.size() + 1));
        }
        SourceTree destinationTree = context.parse(destinationText, DESTINATION);
        Set<Integer> destinationStrings = stringRows(destinationText);
        rejectInsideString(destinationStrings, targetLine);

        List<String> importLines = optionalBoolean(params, CARRY_IMPORTS, true)
                ? carriedImports(sourceTree, destinationTree, free, details, context)
                : List.of();

        List<String> target = new ArrayList<>(destination.lines());
        int blockIndex = targetLine - 1;
        int importIndex = importLine(destinationTree);
        List<String> blockWithSpacer = new ArrayList<>(
                reindent(block, blockStrings, indentAt(target, blockIndex, destinationStrings)));
        if (blockIndex < destination.size()) {
            blockWithSpacer.add("");
        }

        if (!importLines.isEmpty()) {
            List<String> importsWithSpacer = new ArrayList<>(importLines);
            importsWithSpacer.add("");
            // Вставляем сначала в нижнюю позицию, чтобы верхняя осталась в исходной нумерации
            if (importIndex <= blockIndex) {
                target.addAll(blockIndex, blockWithSpacer);
                target.addAll(importIndex, importsWithSpacer);
                blockIndex += importsWithSpacer.size();
            } else {
                target.addAll(importIndex, importsWithSpacer);
                target.addAll(blockIndex, blockWithSpacer);
            }
            details.put("importsInsertedAt", importIndex + 1);
        } else {
            target.addAll(blockIndex, blockWithSpacer);
        }
        details.put("insertedAt", blockIndex + 1);

        String newSource = source.join(remaining);
        String newDestination = destination.join(target);
        context.verify(newSource, SOURCE);
        context.verify(newDestination, DESTINATION);

        return EditResult.builder()
                .operation(getKind())
                .summary("Moved lines " + start + "-" + end + " to destination line " + (blockIndex + 1)
                        + (importLines.isEmpty() ? "" : " with " + importLines.size() + " import(s)"))
                .addChange(EditResult.SOURCE, newSource)
                .addChange(EditResult.DESTINATION, newDestination)
                .details(details)
                .build();
    }

    private EditResult relocateWithinSource(TextLines source, List<String> remaining, List<String> block,
                                            Set<Integer> blockStrings, Set<Integer> sourceStrings,
                                            int start, int end, int targetLine, ObjectNode details,
                                            EditContext context) throws EditException {
        if (targetLine < 1 || targetLine > source.size() + 1) {
            throw EditException.outOfRange(TARGET_LINE, targetLine, "1.." + (source.size() + 1));
        }
        if (targetLine > start && targetLine <= end) {
            throw EditException.outOfRange(TARGET_LINE, targetLine, "outside " + start + ".." + end);
        }
        rejectInsideString(sourceStrings, targetLine);
        // Строки литералов после выреза блока
        Set<Integer> remainingStrings = new HashSet<>();
        for (int row : sourceStrings) {
            if (row < start - 1) {
                remainingStrings.add(row);
            } else if (row >= end) {
                remainingStrings.add(row - block.size());
            }
        }
        int index = targetLine > end ? targetLine - 1 - block.size() : targetLine - 1;
        List<String> result = new ArrayList<>(remaining);
        result.addAll(index, reindent(block, blockStrings, indentAt(remaining, index, remainingStrings)));

        String text = source.join(result);
        context.verify(text, SOURCE);
        details.put("insertedAt", index + 1);
        return EditResult.builder()
                .operation(getKind())
                .summary("Moved lines " + start + "-" + end + " to line " + (index + 1))
                .addChange(EditResult.SOURCE, text)
                .details(details)
                .build();
    }

    /**
     * Свободные имена фрагмента: используются, но не связаны внутри него.
     */
    private static Set<String> freeNames(List<String> block, Set<Integer> blockStrings, int start, int end)
            throws EditException {
        String fragment = String.join("\n", reindent(block, blockStrings, ""));
        TSNode root = TreeSitterManager.getInstance().parse(fragment).getRootNode();
        SyntaxChecker.SyntaxCheckResult check = SyntaxChecker.check(root, fragment);
        if (check.hasErrors()) {
            SyntaxChecker.SyntaxError error = check.firstError();
            throw new EditException(EditErrorCode.SYNTAX_ERROR,
                    "Lines " + start + "-" + end + " do not form complete statements: " + error.message(),
                    Map.of("line", start + error.line() - 1, "context", error.context()));
        }
        return IdentifierCollector.analyze(root, fragment).freeNames();
    }

    /**
     * Импорты исходного модуля, нужные фрагменту и ещё не связанные в назначении.
     * Имя, связанное в назначении иначе, не переносится: это изменило бы код назначения.
     */
    private static List<String> carriedImports(SourceTree sourceTree, SourceTree destinationTree, Set<String> free,
                                               ObjectNode details, EditContext context) {
        Map<String, ImportBinding> sourceBindings = ImportBinding.collect(sourceTree);
        Map<String, ImportBinding> destinationBindings = ImportBinding.collect(destinationTree);

        // import-узел -> нужные из него имена, в порядке исходного модуля
        Map<Integer, List<ImportedName>> selected = new LinkedHashMap<>();
        List<String> conflicts = new ArrayList<>();
        for (ImportBinding binding : sourceBindings.values()) {
            if (!free.contains(binding.boundName())) continue;
            ImportBinding existing = destinationBindings.get(binding.boundName());
            if (existing != null) {
                if (!existing.sameAs(binding)) {
                    conflicts.add(binding.boundName());
                    context.diagnostics().report("relocate", "Destination binds '" + binding.boundName()
                            + "' differently (" + existing.render() + "), not carrying " + binding.render());
                }
                continue;
            }
            selected.computeIfAbsent(binding.importNodeId(), k -> new ArrayList<>()).add(binding.importedName());
        }

        List<String> statements = new ArrayList<>();
        for (Map.Entry<Integer, List<ImportedName>> entry : selected.entrySet()) {
            TreeNode node = sourceTree.node(entry.getKey());
            List<String> rendered = entry.getValue().stream().map(ImportedName::render).toList();
            statements.add(node.kind() == NodeKind.IMPORT_FROM
                    ? "from " + node.module() + " import " + String.join(", ", rendered)
                    : "import " + String.join(", ", rendered));
        }
        statements.forEach(details.putArray("carriedImports")::add);
        if (!conflicts.isEmpty()) {
            conflicts.forEach(details.putArray("conflictingImports")::add);
        }
        return statements;
    }

    /**
     * Индекс строки (0-based), перед которой встают перенесённые импорты.
     */
    private static int importLine(SourceTree tree) {
        int index = BodySplices.importInsertionIndex(tree);
        int line = 0;
        List<Integer> children = tree.children(SourceTree.ROOT);
        for (int i = 0; i < index; i++) {
            TreeNode node = tree.node(children.get(i));
            if (node.kind() != NodeKind.PLACEHOLDER) {
                line = Math.max(line, node.endLine());
            }
        }
        return line;
    }

    /**
     * Строки-продолжения многострочных литералов (0-based).
     */
    private static Set<Integer> stringRows(String text) {
        Set<Integer> rows = new HashSet<>();
        TSNode root = TreeSitterManager.getInstance().parse(text.replace("\r\n", "\n")).getRootNode();
        TreeSitterUtils.collectStringRows(root, rows, null);
        return rows;
    }

    private static void rejectInsideString(Set<Integer> stringRows, int targetLine) throws EditException {
        if (stringRows.contains(targetLine - 1)) {
            throw EditException.outOfRange(TARGET_LINE, targetLine, "a line outside multi-line strings");
        }
    }

    /**
     * Сдвигает блок так, чтобы его наименьший отступ стал равен indent.
     * Строки внутри литералов (индексы в verbatim) копируются как есть и в расчёте не участвуют.
     */
    private static List<String> reindent(List<String> lines, Set<Integer> verbatim, String indent) {
        int current = Integer.MAX_VALUE;
        for (int i = 0; i < lines.size(); i++) {
            if (!verbatim.contains(i) && !lines.get(i).isBlank()) {
                current = Math.min(current, LineScanner.leadingWidth(lines.get(i)));
            }
        }
        if (current == Integer.MAX_VALUE) {
            return lines;
        }
        List<String> result = new ArrayList<>();
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            if (verbatim.contains(i)) {
                result.add(line);
            } else {
                result.add(line.isBlank() ? "" : indent + stripWidth(line, current));
            }
        }
        return result;
    }

    /**
     * Отступ первой непустой строки кода начиная с index; в конце буфера отступа нет.
     */
    private static String indentAt(List<String> lines, int index, Set<Integer> stringRows) {
        for (int i = index; i < lines.size(); i++) {
            String line = lines.get(i);
            if (!line.isBlank() && !stringRows.contains(i)) {
                return line.substring(0, line.length() - line.stripLeading().length());
            }
        }
        return "";
    }

    private static String stripWidth(String line, int width) {
        int i = 0;
        int consumed = 0;
        while (i < line.length() && consumed < width && (line.charAt(i) == ' ' || line.charAt(i) == '\t')) {
            consumed = line.charAt(i) == '\t' ? (consumed / 8 + 1) * 8 : consumed + 1;
            i++;
        }
        return line.substring(i);
    }

    /**
     * Буфер как список строк с признаком завершающего перевода строки.
     */
    record TextLines(List<String> lines, boolean trailingNewline) {

        static TextLines of(String text) {
            String normalized = text.replace("\r\n", "\n");
            if (normalized.isEmpty()) {
                return new TextLines(List.of(), true);
            }
            List<String> lines = new ArrayList<>(List.of(normalized.split("\n", -1)));
            boolean trailing = lines.get(lines.size() - 1).isEmpty();
            if (trailing) {
                lines.remove(lines.size() - 1);
            }
            return new TextLines(List.copyOf(lines), trailing);
        }

        int size() {
            return lines.size();
        }

        String join(List<String> content) {
            if (content.isEmpty()) return "";
            return String.join("\n", content) + (trailingNewline ? "\n" : "");
        }
    }
}
