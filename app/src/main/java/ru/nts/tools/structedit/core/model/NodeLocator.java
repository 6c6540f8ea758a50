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

import ru.nts.tools.structedit.core.EditException;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Поиск классов и функций по имени.
 *
 * <p>Ничего не найдено: NOT_FOUND со списком доступных имён того же вида.
 * Несколько совпадений: AMBIGUOUS, если вызывающий не разрешил брать первое.
 */
public final class NodeLocator {

    private static final int MAX_SUGGESTIONS = 10;

    private final SourceTree tree;
    private final boolean firstMatch;

    public NodeLocator(SourceTree tree, boolean firstMatch) {
        this.tree = tree;
        this.firstMatch = firstMatch;
    }

    /**
     * Находит узел.
     *
     * @param kind DECLARATION или ROUTINE
     * @param name имя
     * @param scopeId узел, в котором ищем
     * @param horizon глубина поиска
     * @return id найденного узла
     * @throws EditException NOT_FOUND или AMBIGUOUS
     */
    public int locate(NodeKind kind, String name, int scopeId, SearchHorizon horizon) throws EditException {
        List<Integer> candidates = candidates(scopeId, horizon);
        List<Integer> matches = new ArrayList<>();
        Set<String> available = new LinkedHashSet<>();
        for (int id : candidates) {
            TreeNode node = tree.node(id);
            if (node.kind() != kind) continue;
            if (name.equals(node.name())) {
                matches.add(id);
            } else {
                available.add(node.name());
            }
        }
        if (matches.isEmpty()) {
            throw EditException.notFound(kind.label(), name,
                    available.stream().limit(MAX_SUGGESTIONS).toList());
        }
        if (matches.size() > 1 && !firstMatch) {
            throw EditException.ambiguous(kind.label(), name,
                    matches.stream().map(id -> tree.node(id).startLine()).toList());
        }
        return matches.get(0);
    }

    /**
     * Класс верхнего уровня.
     */
    public int topLevelDeclaration(String name) throws EditException {
        return locate(NodeKind.DECLARATION, name, SourceTree.ROOT, SearchHorizon.DIRECT_CHILDREN);
    }

    /**
     * Функция по имени; с областью ищется среди методов класса-области.
     *
     * @param name имя функции
     * @param scope имя класса или null для поиска по всему модулю
     */
    public int routine(String name, String scope) throws EditException {
        if (scope == null) {
            return locate(NodeKind.ROUTINE, name, SourceTree.ROOT, SearchHorizon.WHOLE_TREE);
        }
        int scopeId = locate(NodeKind.DECLARATION, scope, SourceTree.ROOT, SearchHorizon.WHOLE_TREE);
        return locate(NodeKind.ROUTINE, name, scopeId, SearchHorizon.DIRECT_CHILDREN);
    }

    private List<Integer> candidates(int scopeId, SearchHorizon horizon) {
        if (horizon == SearchHorizon.DIRECT_CHILDREN) {
            return tree.children(scopeId);
        }
        List<Integer> result = new ArrayList<>();
        for (int id : tree.walk(scopeId)) {
            if (tree.node(id).kind().isDefinition()) {
                result.add(id);
            }
        }
        return result;
    }
}
