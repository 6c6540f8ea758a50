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
package ru.nts.tools.structedit.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Выводит {@link SourceTree} в канонический текст.
 *
 * <p>Отступы пересчитываются по глубине, заголовки классов, функций и импортов
 * собираются заново. Тело без инструкций дополняется {@code pass}. Между соседями выводится
 * одна пустая строка на месте PLACEHOLDER, вокруг определений верхнего уровня две,
 * вокруг вложенных одна. Текст заканчивается ровно одним переводом строки.
 */
public final class SourceSerializer {

    private final FormatStyle style;

    public SourceSerializer() {
        this(FormatStyle.CANONICAL);
    }

    public SourceSerializer(FormatStyle style) {
        this.style = style;
    }

    public FormatStyle style() {
        return style;
    }

    public String serialize(SourceTree tree) {
        List<String> out = new ArrayList<>();
        emitBody(tree, SourceTree.ROOT, 0, out);
        if (out.isEmpty()) {
            return "";
        }
        return String.join("\n", out) + "\n";
    }

    private void emitBody(SourceTree tree, int parentId, int depth, List<String> out) {
        TreeNode previous = null;
        boolean sawPlaceholder = false;
        boolean hasStatements = false;
        List<Integer> children = tree.children(parentId);
        for (int i = 0; i < children.size(); i++) {
            TreeNode child = tree.node(children.get(i));
            if (child.kind() == NodeKind.PLACEHOLDER) {
                sawPlaceholder = previous != null;
                continue;
            }
            if (previous != null) {
                int blank = sawPlaceholder ? 1 : 0;
                if (separatesDefinitions(previous, leadsDefinition(tree, children, i), sawPlaceholder)) {
                    blank = Math.max(blank, depth == 0 ? style.topLevelBlankLines() : 1);
                }
                for (int k = 0; k < blank; k++) {
                    out.add("");
                }
            }
            emitNode(tree, child, depth, out);
            hasStatements |= child.kind().isSignificant();
            previous = child;
            sawPlaceholder = false;
        }
        if (!hasStatements && parentId != SourceTree.ROOT) {
            out.add(style.indent(depth) + "pass");
        }
    }

    /**
     * Комментарий вплотную над определением относится к нему и не отделяется.
     */
    private static boolean separatesDefinitions(TreeNode previous, boolean nextLeadsDefinition,
                                                boolean sawPlaceholder) {
        if (previous.kind().isDefinition()) {
            return true;
        }
        if (!nextLeadsDefinition) {
            return false;
        }
        return previous.kind() != NodeKind.COMMENT || sawPlaceholder;
    }

    /**
     * Узел является определением или началом комментариев, стоящих вплотную над определением.
     */
    private static boolean leadsDefinition(SourceTree tree, List<Integer> children, int index) {
        for (int i = index; i < children.size(); i++) {
            NodeKind kind = tree.node(children.get(i)).kind();
            if (kind != NodeKind.COMMENT) {
                return kind.isDefinition();
            }
        }
        return false;
    }

    private void emitNode(SourceTree tree, TreeNode node, int depth, List<String> out) {
        String indent = style.indent(depth);
        switch (node.kind()) {
            case DECLARATION -> {
                emitDecorators(node, indent, out);
                StringBuilder header = new StringBuilder(indent).append("class ").append(node.name());
                if (node.typeParameters() != null) header.append(node.typeParameters());
                if (node.bases() != null) header.append('(').append(node.bases()).append(')');
                out.add(header.append(':').toString());
                emitBody(tree, node.id(), depth + 1, out);
            }
            case ROUTINE -> {
                emitDecorators(node, indent, out);
                emitRoutineHeader(node, indent, out);
                emitBody(tree, node.id(), depth + 1, out);
            }
            case IMPORT -> out.add(indent + "import " + joinNames(node.importedNames()));
            case IMPORT_FROM -> emitImportFrom(node, indent, out);
            case STATEMENT, EXPRESSION, COMMENT -> emitLeaf(node.code(), indent, out);
            default -> throw new IllegalStateException("Unexpected node in body: " + node);
        }
    }

    private static void emitDecorators(TreeNode node, String indent, List<String> out) {
        for (String decorator : node.decorators()) {
            out.add(indent + "@" + decorator);
        }
    }

    private void emitRoutineHeader(TreeNode node, String indent, List<String> out) {
        String prefix = indent + (node.isAsync() ? "async def " : "def ") + node.name()
                + (node.typeParameters() != null ? node.typeParameters() : "") + "(";
        String suffix = ")" + (node.returnType() != null ? " -> " + node.returnType() : "") + ":";
        List<String> params = new ArrayList<>();
        for (Parameter p : node.parameters()) {
            params.add(p.render());
        }
        String oneLine = prefix + String.join(", ", params) + suffix;
        if (!tooLong(oneLine) || params.isEmpty()) {
            out.add(oneLine);
            return;
        }
        out.add(prefix);
        String itemIndent = indent + " ".repeat(style.indentWidth());
        for (String p : params) {
            out.add(itemIndent + p + ",");
        }
        out.add(indent + suffix);
    }

    private void emitImportFrom(TreeNode node, String indent, List<String> out) {
        String prefix = indent + "from " + node.module() + " import ";
        if (node.isWildcard()) {
            out.add(prefix + "*");
            return;
        }
        String oneLine = prefix + joinNames(node.importedNames());
        if (!tooLong(oneLine)) {
            out.add(oneLine);
            return;
        }
        out.add(prefix + "(");
        String itemIndent = indent + " ".repeat(style.indentWidth());
        for (ImportedName name : node.importedNames()) {
            out.add(itemIndent + name.render() + ",");
        }
        out.add(indent + ")");
    }

    private void emitLeaf(CodeFragment code, String indent, List<String> out) {
        if (code.isSingleLine() && tooLong(indent + code.firstLine())) {
            Optional<List<String>> wrapped = LineWrapper.explode(code.firstLine(), " ".repeat(style.indentWidth()));
            if (wrapped.isPresent()) {
                for (String line : wrapped.get()) {
                    out.add(indent + line);
                }
                return;
            }
        }
        code.render(indent, style.indentWidth(), out);
    }

    private boolean tooLong(String line) {
        return style.wrapsLines() && line.length() > style.lineWidth();
    }

    private static String joinNames(List<ImportedName> names) {
        List<String> rendered = new ArrayList<>();
        for (ImportedName name : names) {
            rendered.add(name.render());
        }
        return String.join(", ", rendered);
    }
}
