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
import ru.nts.tools.structedit.core.model.IdentifierReference;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Анализ идентификаторов фрагмента Python-кода.
 *
 * Разделяет имена на используемые и связываемые внутри фрагмента.
 * Свободные имена (используемые, но не связанные) нужны при переносе кода,
 * чтобы перенести вместе с ним нужные импорты.
 *
 * <p>Связывания учитываются по областям видимости: модуль фрагмента, функция, lambda,
 * класс и включение (comprehension). Использование разрешается по цепочке областей
 * от места использования вверх; область класса видна только своему телу.
 */
public final class IdentifierCollector {

    private static final Set<String> COMPREHENSIONS = Set.of(
            "list_comprehension", "set_comprehension", "dictionary_comprehension", "generator_expression");

    private enum ScopeKind { MODULE, FUNCTION, CLASS, COMPREHENSION }

    private static final class Scope {
        final Scope parent;
        final ScopeKind kind;
        final Set<String> bound = new LinkedHashSet<>();
        final Set<String> globals = new HashSet<>();
        final Set<String> nonlocals = new HashSet<>();

        Scope(Scope parent, ScopeKind kind) {
            this.parent = parent;
            this.kind = kind;
        }

        /**
         * Ближайшая область, не являющаяся включением: туда связывает {@code :=}.
         */
        Scope enclosingNonComprehension() {
            Scope scope = this;
            while (scope.kind == ScopeKind.COMPREHENSION && scope.parent != null) {
                scope = scope.parent;
            }
            return scope;
        }
    }

    private record Use(IdentifierReference reference, Scope scope) {}

    private final byte[] contentBytes;
    private final Scope module = new Scope(null, ScopeKind.MODULE);
    private final List<Use> uses = new ArrayList<>();
    private Scope current = module;

    private IdentifierCollector(byte[] contentBytes) {
        this.contentBytes = contentBytes;
    }

    /**
     * Результат анализа.
     *
     * @param references все использования имён в порядке появления
     * @param bound имена, связанные на верхнем уровне фрагмента
     * @param freeNames имена, которые фрагмент использует, но не определяет, в порядке первого появления
     */
    public record IdentifierAnalysis(List<IdentifierReference> references, Set<String> bound, Set<String> freeNames) {}

    /**
     * Анализирует дерево фрагмента.
     *
     * @param root корень дерева разбора
     * @param content текст, по которому построено дерево
     */
    public static IdentifierAnalysis analyze(TSNode root, String content) {
        IdentifierCollector collector = new IdentifierCollector(content.getBytes(StandardCharsets.UTF_8));
        collector.visit(root);

        List<IdentifierReference> references = new ArrayList<>();
        Set<String> free = new LinkedHashSet<>();
        for (Use use : collector.uses) {
            references.add(use.reference());
            if (!resolves(use.reference().name(), use.scope())) {
                free.add(use.reference().name());
            }
        }
        return new IdentifierAnalysis(List.copyOf(references), Set.copyOf(collector.module.bound),
                Collections.unmodifiableSet(free));
    }

    private static boolean resolves(String name, Scope from) {
        for (Scope scope = from; scope != null; scope = scope.parent) {
            // Тело класса не является областью для вложенных функций
            if (scope.kind == ScopeKind.CLASS && scope != from) continue;
            if (scope.globals.contains(name) || scope.nonlocals.contains(name)) continue;
            if (scope.bound.contains(name)) return true;
        }
        return false;
    }

    private void visit(TSNode node) {
        String type = node.getType();
        if (COMPREHENSIONS.contains(type)) {
            visitComprehension(node);
            return;
        }
        switch (type) {
            case "identifier" -> {
                if (isReference(node)) {
                    uses.add(new Use(new IdentifierReference(text(node),
                            node.getStartPoint().getRow() + 1, node.getStartPoint().getColumn() + 1), current));
                }
                return;
            }
            case "import_statement", "import_from_statement", "future_import_statement" -> {
                bindImport(node);
                return;
            }
            case "global_statement", "nonlocal_statement" -> {
                Set<String> declared = type.equals("global_statement") ? current.globals : current.nonlocals;
                for (TSNode child : TreeSitterUtils.children(node)) {
                    if (child.getType().equals("identifier")) {
                        declared.add(text(child));
                    }
                }
                return;
            }
            case "function_definition" -> {
                visitFunction(node);
                return;
            }
            case "class_definition" -> {
                visitClass(node);
                return;
            }
            case "lambda" -> {
                visitLambda(node);
                return;
            }
            case "assignment" -> {
                TSNode target = node.getChild(0);
                if (target != null && !target.isNull()) {
                    bindPattern(target, current);
                }
            }
            case "named_expression" -> {
                TSNode target = node.getChild(0);
                if (target != null && !target.isNull()) {
                    bindPattern(target, current.enclosingNonComprehension());
                }
            }
            case "for_statement" -> {
                TSNode target = childAfter(node, "for");
                if (target != null) {
                    bindPattern(target, current);
                }
            }
            case "except_clause" -> {
                TSNode alias = childAfter(node, "as");
                if (alias != null) {
                    bindPattern(alias, current);
                }
            }
            case "as_pattern_target" -> bindPattern(node, current);
            default -> {
            }
        }
        visitChildren(node);
    }

    private void visitChildren(TSNode node) {
        for (TSNode child : TreeSitterUtils.children(node)) {
            visit(child);
        }
    }

    private void visitIn(Scope scope, TSNode node) {
        Scope saved = current;
        current = scope;
        try {
            visit(node);
        } finally {
            current = saved;
        }
    }

    /**
     * Имя функции связывается снаружи, параметры и тело внутри.
     * Аннотации и значения по умолчанию вычисляются в объемлющей области.
     */
    private void visitFunction(TSNode node) {
        Scope outer = current;
        Scope inner = new Scope(outer, ScopeKind.FUNCTION);
        TSNode name = TreeSitterUtils.findChildByType(node, "identifier");
        if (name != null) {
            bind(outer, text(name));
        }
        for (TSNode child : TreeSitterUtils.children(node)) {
            switch (child.getType()) {
                case "identifier" -> {
                }
                case "parameters" -> bindParameters(child, inner);
                case "block" -> visitIn(inner, child);
                default -> visit(child);
            }
        }
    }

    private void visitLambda(TSNode node) {
        Scope inner = new Scope(current, ScopeKind.FUNCTION);
        for (TSNode child : TreeSitterUtils.children(node)) {
            if (child.getType().equals("lambda_parameters")) {
                bindParameters(child, inner);
            } else {
                visitIn(inner, child);
            }
        }
    }

    private void visitClass(TSNode node) {
        Scope outer = current;
        Scope inner = new Scope(outer, ScopeKind.CLASS);
        TSNode name = TreeSitterUtils.findChildByType(node, "identifier");
        if (name != null) {
            bind(outer, text(name));
        }
        for (TSNode child : TreeSitterUtils.children(node)) {
            switch (child.getType()) {
                case "identifier" -> {
                }
                case "block" -> visitIn(inner, child);
                default -> visit(child);
            }
        }
    }

    /**
     * Итерируемое первого {@code for} вычисляется снаружи, всё остальное внутри включения.
     */
    private void visitComprehension(TSNode node) {
        Scope outer = current;
        Scope inner = new Scope(outer, ScopeKind.COMPREHENSION);
        boolean firstClause = true;
        for (TSNode child : TreeSitterUtils.children(node)) {
            if (!child.getType().equals("for_in_clause")) {
                visitIn(inner, child);
                continue;
            }
            TSNode target = childAfter(child, "for");
            if (target != null) {
                bindPattern(target, inner);
            }
            boolean afterIn = false;
            for (TSNode part : TreeSitterUtils.children(child)) {
                if (part.getType().equals("in")) {
                    afterIn = true;
                    continue;
                }
                visitIn(afterIn && firstClause ? outer : inner, part);
            }
            firstClause = false;
        }
    }

    /**
     * Имя атрибута после точки и имя именованного аргумента ссылками не являются.
     */
    private boolean isReference(TSNode node) {
        TSNode parent = node.getParent();
        if (parent == null || parent.isNull()) return true;
        String parentType = parent.getType();
        if (parentType.equals("attribute") || parentType.equals("keyword_argument")) {
            int index = TreeSitterUtils.indexInParent(node);
            return parentType.equals("attribute") ? index == 0 : index != 0;
        }
        return true;
    }

    private static TSNode childAfter(TSNode node, String keyword) {
        List<TSNode> children = TreeSitterUtils.children(node);
        for (int i = 0; i + 1 < children.size(); i++) {
            if (children.get(i).getType().equals(keyword)) {
                return children.get(i + 1);
            }
        }
        return null;
    }

    private void bind(Scope scope, String name) {
        if (scope.globals.contains(name)) {
            module.bound.add(name);
        } else if (!scope.nonlocals.contains(name)) {
            scope.bound.add(name);
        }
    }

    private void bindFirstIdentifier(TSNode node, Scope scope) {
        TSNode name = TreeSitterUtils.findChildByType(node, "identifier");
        if (name != null) {
            bind(scope, text(name));
        }
    }

    private void bindPattern(TSNode pattern, Scope scope) {
        switch (pattern.getType()) {
            case "identifier" -> bind(scope, text(pattern));
            case "pattern_list", "tuple_pattern", "list_pattern", "list_splat_pattern",
                 "as_pattern_target", "parenthesized_expression", "tuple", "list",
                 "expression_list" -> {
                for (TSNode child : TreeSitterUtils.children(pattern)) {
                    bindPattern(child, scope);
                }
            }
            default -> {
                // attribute и subscript ничего не связывают
            }
        }
    }

    /**
     * Имена параметров связываются во внутренней области, аннотации и значения
     * по умолчанию обходятся в текущей.
     */
    private void bindParameters(TSNode parameters, Scope inner) {
        for (TSNode param : TreeSitterUtils.children(parameters)) {
            switch (param.getType()) {
                case "identifier" -> bind(inner, text(param));
                case "list_splat_pattern", "dictionary_splat_pattern" -> bindFirstIdentifier(param, inner);
                case "typed_parameter", "default_parameter", "typed_default_parameter" -> {
                    List<TSNode> parts = TreeSitterUtils.children(param);
                    for (int i = 0; i < parts.size(); i++) {
                        TSNode part = parts.get(i);
                        switch (part.getType()) {
                            case "identifier" -> {
                                if (i == 0) {
                                    bind(inner, text(part));
                                } else {
                                    visit(part);
                                }
                            }
                            case "list_splat_pattern", "dictionary_splat_pattern" -> {
                                if (i == 0) {
                                    bindFirstIdentifier(part, inner);
                                }
                            }
                            default -> visit(part);
                        }
                    }
                }
                default -> {
                }
            }
        }
    }

    private void bindImport(TSNode node) {
        boolean afterImportKeyword = !node.getType().equals("import_from_statement")
                && !node.getType().equals("future_import_statement");
        for (TSNode child : TreeSitterUtils.children(node)) {
            String type = child.getType();
            if (type.equals("import")) {
                afterImportKeyword = true;
                continue;
            }
            if (!afterImportKeyword) continue;
            switch (type) {
                case "dotted_name" -> {
                    String name = text(child);
                    int dot = name.indexOf('.');
                    bind(current, dot < 0 ? name : name.substring(0, dot));
                }
                case "aliased_import" -> {
                    TSNode alias = TreeSitterUtils.findChildByType(child, "identifier");
                    if (alias != null) {
                        bind(current, text(alias));
                    }
                }
                default -> {
                }
            }
        }
    }

    private String text(TSNode node) {
        return TreeSitterUtils.getNodeText(node, contentBytes);
    }
}
