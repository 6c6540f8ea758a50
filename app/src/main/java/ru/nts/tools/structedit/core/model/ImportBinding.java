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

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Связь имени модуля с импортом, который его вводит.
 *
 * @param boundName связанное имя
 * @param importNodeId id import-узла
 * @param module модуль from-импорта или null для {@code import}
 * @param importedName импортируемое имя
 */
public record ImportBinding(String boundName, int importNodeId, String module, ImportedName importedName) {

    /**
     * Собирает связи импортов верхнего уровня. При повторном связывании имени побеждает последний импорт.
     */
    public static Map<String, ImportBinding> collect(SourceTree tree) {
        Map<String, ImportBinding> bindings = new LinkedHashMap<>();
        for (int id : tree.children(SourceTree.ROOT)) {
            TreeNode node = tree.node(id);
            if (!node.kind().isImport() || node.isWildcard()) continue;
            String module = node.kind() == NodeKind.IMPORT_FROM ? node.module() : null;
            for (ImportedName name : node.importedNames()) {
                bindings.remove(name.boundName());
                bindings.put(name.boundName(), new ImportBinding(name.boundName(), id, module, name));
            }
        }
        return bindings;
    }

    /**
     * Одинаково ли два импорта связывают имя.
     */
    public boolean sameAs(ImportBinding other) {
        return boundName.equals(other.boundName)
                && Objects.equals(module, other.module)
                && importedName.equals(other.importedName);
    }

    /**
     * Инструкция, вводящая только это имя.
     */
    public String render() {
        return module != null
                ? "from " + module + " import " + importedName.render()
                : "import " + importedName.render();
    }
}
