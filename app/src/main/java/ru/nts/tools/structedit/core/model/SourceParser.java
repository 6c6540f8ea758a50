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

import org.treesitter.TSNode;
import org.treesitter.TSTree;
import ru.nts.tools.structedit.core.EditException;
import ru.nts.tools.structedit.core.treesitter.SyntaxChecker;
import ru.nts.tools.structedit.core.treesitter.TreeSitterManager;
import ru.nts.tools.structedit.core.treesitter.TreeSitterUtils;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static ru.nts.tools.structedit.core.treesitter.TreeSitterUtils.children;
import static ru.nts.tools.structedit.core.treesitter.TreeSitterUtils.findChildByType;

/**
 * Строит {@link SourceTree} из Python-исходника через tree-sitter.
 *
 * <p>Классы, функции и импорты разбираются структурно, прочие инструкции
 * сохраняются как непрозрачные фрагменты. Пустые строки между соседями
 * превращаются в один PLACEHOLDER, комментарий в конце строки приклеивается к листу.
 */
public final class SourceParser {

    private final TreeSitterManager manager;

    public SourceParser() {
        this(TreeSitterManager.getInstance());
    }

    public SourceParser(TreeSitterManager manager) {
        this.manager = manager;
    }

    /**
     * Разбирает текст в дерево.
     *
     * @param text исходник (переводы строк нормализуются к LF)
     * @return дерево
     * @throws EditException SYNTAX_ERROR, если текст не разбирается
     */
    public SourceTree parse(String text) throws EditException {
        String content = normalize(text);
        TSTree tsTree = manager.parse(content);
        TSNode root = tsTree.getRootNode();
        SyntaxChecker.SyntaxCheckResult check = SyntaxChecker.check(root, content);
        if (check.hasErrors()) {
            throw EditException.syntaxError(check.firstError());
        }
        return new Conversion(content).build(root);
    }

    public static String normalize(String text) {
        return text.replace("\r\n", "\n").replace('\r', '\n');
    }

    /**
     * Однократное преобразование CST в арену.
     */
    private static final class Conversion {

        private final byte[] bytes;
        private final String[] lines;
        private final SourceTree tree = new SourceTree();

        Conversion(String content) {
            this.bytes = content.getBytes(StandardCharsets.UTF_8);
            this.lines = content.split("\n", -1);
        }

        SourceTree build(TSNode root) {
            buildBody(children(root), SourceTree.ROOT);
            return tree;
        }

        private void buildBody(List<TSNode> items, int parentId) {
            int prevEndRow = -1;
            int prevLeaf = -1;
            for (TSNode item : items) {
                String type = item.getType();
                if (type.equals(";")) continue;
                int startRow = item.getStartPoint().getRow();

                if (type.equals("comment") && startRow == prevEndRow) {
                    // Комментарий в конце строки
                    if (prevLeaf >= 0) {
                        TreeNode leaf = tree.node(prevLeaf);
                        leaf.setCode(leaf.code().withTrailingComment(text(item).strip()));
                    }
                    continue;
                }
                if (prevEndRow >= 0 && startRow > prevEndRow + 1) {
                    tree.appendChild(parentId, tree.newPlaceholder());
                }

                int id = convert(item);
                tree.appendChild(parentId, id);
                prevEndRow = TreeSitterUtils.endLine(item) - 1;
                prevLeaf = tree.node(id).code() != null ? id : -1;
            }
        }

        private int convert(TSNode item) {
            return switch (item.getType()) {
                case "decorated_definition" -> decorated(item);
                case "class_definition" -> declaration(item);
                case "function_definition" -> routine(item);
                case "import_statement" -> importStatement(item);
                case "import_from_statement", "future_import_statement" -> importFrom(item);
                case "expression_statement" -> leaf(item, NodeKind.EXPRESSION);
                case "comment" -> leaf(item, NodeKind.COMMENT);
                default -> leaf(item, NodeKind.STATEMENT);
            };
        }

        private int decorated(TSNode item) {
            List<String> decorators = new ArrayList<>();
            TSNode definition = null;
            for (TSNode child : children(item)) {
                switch (child.getType()) {
                    case "decorator" -> decorators.add(collapse(text(child)).substring(1).strip());
                    case "class_definition", "function_definition" -> definition = child;
                    default -> {
                    }
                }
            }
            if (definition == null) {
                return leaf(item, NodeKind.STATEMENT);
            }
            int id = convert(definition);
            TreeNode node = tree.node(id);
            node.setDecorators(decorators);
            setSpan(node, item);
            return id;
        }

        private int declaration(TSNode item) {
            TreeNode node = tree.newNode(NodeKind.DECLARATION);
            node.setName(text(findChildByType(item, "identifier")));
            TSNode typeParams = findChildByType(item, "type_parameter");
            if (typeParams != null) {
                node.setTypeParameters(collapse(text(typeParams)));
            }
            TSNode args = findChildByType(item, "argument_list");
            if (args != null) {
                String inner = collapse(text(args));
                inner = inner.substring(1, inner.length() - 1).strip();
                node.setBases(inner.isEmpty() ? null : inner);
            }
            setSpan(node, item);
            buildBody(bodyItems(item), node.id());
            return node.id();
        }

        private int routine(TSNode item) {
            TreeNode node = tree.newNode(NodeKind.ROUTINE);
            node.setAsync(findChildByType(item, "async") != null);
            node.setName(text(findChildByType(item, "identifier")));
            TSNode typeParams = findChildByType(item, "type_parameter");
            if (typeParams != null) {
                node.setTypeParameters(collapse(text(typeParams)));
            }
            TSNode params = findChildByType(item, "parameters");
            if (params != null) {
                node.setParameters(parameters(params));
            }
            TSNode returnType = findChildByType(item, "type");
            if (returnType != null) {
                node.setReturnType(collapse(text(returnType)));
            }
            setSpan(node, item);
            buildBody(bodyItems(item), node.id());
            return node.id();
        }

        /**
         * Комментарии между заголовком и телом плюс инструкции тела.
         * Комментарий на строке заголовка отбрасывается.
         */
        private List<TSNode> bodyItems(TSNode definition) {
            List<TSNode> items = new ArrayList<>();
            int colonRow = -1;
            for (TSNode child : children(definition)) {
                switch (child.getType()) {
                    case ":" -> colonRow = child.getStartPoint().getRow();
                    case "comment" -> {
                        if (colonRow >= 0 && child.getStartPoint().getRow() > colonRow) {
                            items.add(child);
                        }
                    }
                    case "block" -> items.addAll(children(child));
                    default -> {
                    }
                }
            }
            return items;
        }

        private List<Parameter> parameters(TSNode params) {
            List<Parameter> result = new ArrayList<>();
            for (TSNode p : children(params)) {
                switch (p.getType()) {
                    case "identifier" -> result.add(Parameter.plain(text(p), null, null));
                    case "typed_parameter" -> {
                        TSNode first = p.getChild(0);
                        String type = textOf(findChildByType(p, "type"));
                        switch (first.getType()) {
                            case "list_splat_pattern" -> result.add(new Parameter(
                                    Parameter.Kind.VAR_POSITIONAL, identifierIn(first), type, null));
                            case "dictionary_splat_pattern" -> result.add(new Parameter(
                                    Parameter.Kind.VAR_KEYWORD, identifierIn(first), type, null));
                            default -> result.add(Parameter.plain(text(first), type, null));
                        }
                    }
                    case "default_parameter" -> result.add(Parameter.plain(
                            text(p.getChild(0)), null, lastChildText(p)));
                    case "typed_default_parameter" -> result.add(Parameter.plain(
                            text(p.getChild(0)), textOf(findChildByType(p, "type")), lastChildText(p)));
                    case "list_splat_pattern" -> {
                        String name = identifierIn(p);
                        result.add(name != null
                                ? new Parameter(Parameter.Kind.VAR_POSITIONAL, name, null, null)
                                : new Parameter(Parameter.Kind.KEYWORD_SEPARATOR, null, null, null));
                    }
                    case "dictionary_splat_pattern" -> result.add(
                            new Parameter(Parameter.Kind.VAR_KEYWORD, identifierIn(p), null, null));
                    case "keyword_separator" -> result.add(
                            new Parameter(Parameter.Kind.KEYWORD_SEPARATOR, null, null, null));
                    case "positional_separator" -> result.add(
                            new Parameter(Parameter.Kind.POSITIONAL_SEPARATOR, null, null, null));
                    default -> {
                        // скобки, запятые, комментарии
                    }
                }
            }
            return result;
        }

        private int importStatement(TSNode item) {
            TreeNode node = tree.newNode(NodeKind.IMPORT);
            List<ImportedName> names = new ArrayList<>();
            for (TSNode child : children(item)) {
                ImportedName name = importedName(child);
                if (name != null) names.add(name);
            }
            node.setImportedNames(names);
            setSpan(node, item);
            return node.id();
        }

        private int importFrom(TSNode item) {
            TreeNode node = tree.newNode(NodeKind.IMPORT_FROM);
            List<ImportedName> names = new ArrayList<>();
            boolean afterFrom = false;
            boolean afterImport = false;
            for (TSNode child : children(item)) {
                String type = child.getType();
                if (type.equals("from")) {
                    afterFrom = true;
                } else if (type.equals("import")) {
                    afterImport = true;
                } else if (afterImport) {
                    if (type.equals("wildcard_import")) {
                        node.setWildcard(true);
                    }
                    ImportedName name = importedName(child);
                    if (name != null) names.add(name);
                } else if (afterFrom && node.module() == null) {
                    node.setModule(text(child));
                }
            }
            node.setImportedNames(names);
            setSpan(node, item);
            return node.id();
        }

        private ImportedName importedName(TSNode child) {
            return switch (child.getType()) {
                case "dotted_name" -> new ImportedName(collapse(text(child)), null);
                case "aliased_import" -> new ImportedName(
                        collapse(textOf(findChildByType(child, "dotted_name"))),
                        textOf(findChildByType(child, "identifier")));
                default -> null;
            };
        }

        private int leaf(TSNode item, NodeKind kind) {
            TreeNode node = tree.newNode(kind);
            node.setCode(fragment(item));
            setSpan(node, item);
            return node.id();
        }

        /**
         * Фрагмент листа: отступы строк считаются относительно строки начала узла,
         * строки внутри многострочных литералов сохраняются дословно.
         */
        private CodeFragment fragment(TSNode item) {
            int startRow = item.getStartPoint().getRow();
            Set<Integer> verbatimRows = new HashSet<>();
            Set<Integer> openingRows = new HashSet<>();
            TreeSitterUtils.collectStringRows(item, verbatimRows, openingRows);

            int base = LineScanner.leadingWidth(lines[startRow]);
            String[] parts = text(item).split("\n", -1);
            List<CodeFragment.Line> out = new ArrayList<>();
            for (int i = 0; i < parts.length; i++) {
                int row = startRow + i;
                String part = parts[i];
                boolean opensString = openingRows.contains(row);
                if (i == 0) {
                    out.add(CodeFragment.Line.code(0, opensString ? part.stripLeading() : part.strip()));
                } else if (verbatimRows.contains(row)) {
                    out.add(new CodeFragment.Line(0, part, true));
                } else if (part.isBlank()) {
                    out.add(CodeFragment.Line.code(0, ""));
                } else {
                    int indent = Math.max(0, LineScanner.leadingWidth(part) - base);
                    out.add(CodeFragment.Line.code(indent, opensString ? part.stripLeading() : part.strip()));
                }
            }
            while (out.size() > 1 && out.get(out.size() - 1).isBlank()) {
                out.remove(out.size() - 1);
            }
            return new CodeFragment(out);
        }

        private void setSpan(TreeNode node, TSNode item) {
            node.setSpan(TreeSitterUtils.startLine(item), TreeSitterUtils.endLine(item));
        }

        private String identifierIn(TSNode node) {
            return textOf(findChildByType(node, "identifier"));
        }

        private String lastChildText(TSNode node) {
            return collapse(text(node.getChild(node.getChildCount() - 1)));
        }

        private String textOf(TSNode node) {
            return node != null ? collapse(text(node)) : null;
        }

        private String text(TSNode node) {
            return TreeSitterUtils.getNodeText(node, bytes);
        }

        /**
         * Многострочный фрагмент заголовка в одну строку.
         */
        private static String collapse(String s) {
            return s.replaceAll("\\s*\\n\\s*", " ").strip();
        }
    }
}
