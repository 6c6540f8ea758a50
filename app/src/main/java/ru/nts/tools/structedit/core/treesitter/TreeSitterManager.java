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

import org.treesitter.TSLanguage;
import org.treesitter.TSParser;
import org.treesitter.TSTree;
import org.treesitter.TreeSitterPython;

/**
 * Доступ к tree-sitter парсеру Python.
 * Грамматика загружается один раз, парсер у каждого потока свой (TSParser не thread-safe).
 */
public final class TreeSitterManager {

    private static final TreeSitterManager INSTANCE = new TreeSitterManager();

    private final TSLanguage python = new TreeSitterPython();

    private final ThreadLocal<TSParser> parser = ThreadLocal.withInitial(() -> {
        TSParser created = new TSParser();
        created.setLanguage(python);
        return created;
    });

    private TreeSitterManager() {}

    public static TreeSitterManager getInstance() {
        return INSTANCE;
    }

    /**
     * Разбирает исходник. Синтаксические ошибки не бросаются, а остаются в дереве
     * ERROR/MISSING узлами, см. {@link SyntaxChecker}.
     *
     * @param content исходный код
     * @return дерево разбора
     */
    public TSTree parse(String content) {
        TSTree tree = parser.get().parseString(null, content);
        if (tree == null) {
            throw new IllegalStateException("tree-sitter returned no tree for " + content.length() + " chars");
        }
        return tree;
    }
}
