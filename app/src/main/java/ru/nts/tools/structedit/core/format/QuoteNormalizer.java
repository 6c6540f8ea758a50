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
package ru.nts.tools.structedit.core.format;

import org.treesitter.TSNode;
import org.treesitter.TSTree;
import ru.nts.tools.structedit.core.EditException;
import ru.nts.tools.structedit.core.treesitter.SyntaxChecker;
import ru.nts.tools.structedit.core.treesitter.TreeSitterManager;
import ru.nts.tools.structedit.core.treesitter.TreeSitterUtils;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Переводит строковые литералы в одинарных кавычках на двойные.
 *
 * <p>Литерал меняется, только если в его теле нет двойных кавычек, обратных слэшей
 * и интерполяций, поэтому значение строки не меняется.
 */
public final class QuoteNormalizer {

    private final TreeSitterManager manager;

    public QuoteNormalizer(TreeSitterManager manager) {
        this.manager = manager;
    }

    private record Replacement(int startByte, int endByte, String text) {}

    /**
     * @param content исходник
     * @return исходник с нормализованными кавычками
     * @throws EditException SYNTAX_ERROR, если исходник не разбирается
     */
    public String normalize(String content) throws EditException {
        TSTree tree = manager.parse(content);
        TSNode root = tree.getRootNode();
        SyntaxChecker.SyntaxCheckResult check = SyntaxChecker.check(root, content);
        if (check.hasErrors()) {
            throw EditException.syntaxError(check.firstError());
        }

        byte[] bytes = content.getBytes(StandardCharsets.UTF_8);
        List<Replacement> replacements = new ArrayList<>();
        collect(root, bytes, replacements);
        if (replacements.isEmpty()) {
            return content;
        }

        // Применяем с конца, чтобы байтовые смещения оставались верными
        replacements.sort(Comparator.comparingInt(Replacement::startByte).reversed());
        byte[] result = bytes;
        for (Replacement r : replacements) {
            ByteArrayOutputStream out = new ByteArrayOutputStream(result.length);
            out.write(result, 0, r.startByte());
            out.writeBytes(r.text().getBytes(StandardCharsets.UTF_8));
            out.write(result, r.endByte(), result.length - r.endByte());
            result = out.toByteArray();
        }
        return new String(result, StandardCharsets.UTF_8);
    }

    private void collect(TSNode node, byte[] bytes, List<Replacement> out) {
        if (node.getType().equals("string")) {
            if (TreeSitterUtils.findChildByType(node, "interpolation") == null) {
                requote(TreeSitterUtils.getNodeText(node, bytes))
                        .ifPresent(text -> out.add(new Replacement(node.getStartByte(), node.getEndByte(), text)));
            }
            return;
        }
        for (TSNode child : TreeSitterUtils.children(node)) {
            collect(child, bytes, out);
        }
    }

    /**
     * Литерал в двойных кавычках или empty, если менять нельзя или не нужно.
     */
    static Optional<String> requote(String literal) {
        int p = 0;
        while (p < literal.length() && Character.isLetter(literal.charAt(p))) {
            p++;
        }
        String prefix = literal.substring(0, p);
        String body = literal.substring(p);

        if (body.length() >= 6 && body.startsWith("'''") && body.endsWith("'''")) {
            String inner = body.substring(3, body.length() - 3);
            if (safe(inner)) {
                return Optional.of(prefix + "\"\"\"" + inner + "\"\"\"");
            }
        } else if (body.length() >= 2 && body.startsWith("'") && !body.startsWith("'''") && body.endsWith("'")) {
            String inner = body.substring(1, body.length() - 1);
            if (safe(inner)) {
                return Optional.of(prefix + "\"" + inner + "\"");
            }
        }
        return Optional.empty();
    }

    private static boolean safe(String inner) {
        return inner.indexOf('"') < 0 && inner.indexOf('\\') < 0;
    }
}
