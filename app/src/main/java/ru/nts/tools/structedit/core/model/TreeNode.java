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
import java.util.Collections;
import java.util.List;

/**
 * Узел дерева исходника. Хранится в арене {@link SourceTree} и адресуется по id.
 * Связи родитель/дети меняет только арена.
 */
public final class TreeNode {

    static final int NO_PARENT = -1;

    private final int id;
    private final NodeKind kind;
    int parent = NO_PARENT;
    final List<Integer> children = new ArrayList<>();

    private String name;
    private int startLine;
    private int endLine;

    // Class / def
    private List<String> decorators = List.of();
    private String typeParameters;
    private String bases;
    private boolean async;
    private List<Parameter> parameters = List.of();
    private String returnType;

    // import / from-import
    private String module;
    private List<ImportedName> importedNames = List.of();
    private boolean wildcard;

    // Листья
    private CodeFragment code;

    TreeNode(int id, NodeKind kind) {
        this.id = id;
        this.kind = kind;
    }

    public int id() {
        return id;
    }

    public NodeKind kind() {
        return kind;
    }

    public int parentId() {
        return parent;
    }

    public String name() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    /**
     * Первая строка узла в разобранном тексте (1-based), 0 для созданных правкой узлов.
     */
    public int startLine() {
        return startLine;
    }

    public int endLine() {
        return endLine;
    }

    public void setSpan(int startLine, int endLine) {
        this.startLine = startLine;
        this.endLine = endLine;
    }

    public List<String> decorators() {
        return decorators;
    }

    public void setDecorators(List<String> decorators) {
        this.decorators = List.copyOf(decorators);
    }

    public String typeParameters() {
        return typeParameters;
    }

    public void setTypeParameters(String typeParameters) {
        this.typeParameters = typeParameters;
    }

    public String bases() {
        return bases;
    }

    public void setBases(String bases) {
        this.bases = bases;
    }

    public boolean isAsync() {
        return async;
    }

    public void setAsync(boolean async) {
        this.async = async;
    }

    public List<Parameter> parameters() {
        return Collections.unmodifiableList(parameters);
    }

    public void setParameters(List<Parameter> parameters) {
        this.parameters = new ArrayList<>(parameters);
    }

    public String returnType() {
        return returnType;
    }

    public void setReturnType(String returnType) {
        this.returnType = returnType;
    }

    public String module() {
        return module;
    }

    public void setModule(String module) {
        this.module = module;
    }

    public List<ImportedName> importedNames() {
        return importedNames;
    }

    public void setImportedNames(List<ImportedName> importedNames) {
        this.importedNames = List.copyOf(importedNames);
    }

    public boolean isWildcard() {
        return wildcard;
    }

    public void setWildcard(boolean wildcard) {
        this.wildcard = wildcard;
    }

    public CodeFragment code() {
        return code;
    }

    public void setCode(CodeFragment code) {
        this.code = code;
    }

    /**
     * Модульная или классовая строка документации.
     */
    public boolean isDocstring() {
        return kind == NodeKind.EXPRESSION && code != null && code.isStringLiteral();
    }

    /**
     * Сигнатура функции в одну строку: {@code name(a, b=1) -> int}.
     */
    public String signature() {
        StringBuilder sb = new StringBuilder(name).append('(');
        for (int i = 0; i < parameters.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(parameters.get(i).render());
        }
        sb.append(')');
        if (returnType != null) {
            sb.append(" -> ").append(returnType);
        }
        return sb.toString();
    }

    /**
     * Копирует содержимое узла (без связей) из другого узла того же вида.
     */
    void copyPayloadFrom(TreeNode other) {
        this.name = other.name;
        this.startLine = other.startLine;
        this.endLine = other.endLine;
        this.decorators = other.decorators;
        this.typeParameters = other.typeParameters;
        this.bases = other.bases;
        this.async = other.async;
        this.parameters = new ArrayList<>(other.parameters);
        this.returnType = other.returnType;
        this.module = other.module;
        this.importedNames = other.importedNames;
        this.wildcard = other.wildcard;
        this.code = other.code;
    }

    @Override
    public String toString() {
        return kind + (name != null ? " " + name : "") + "#" + id;
    }
}
