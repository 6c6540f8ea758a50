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

import ru.nts.tools.structedit.core.model.LineScanner;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Построчное восстановление отступов без разбора.
 *
 * <p>Работает на любом входе, включая синтаксически неверный. Уровень задаётся эвристикой:
 * {@code class} на уровень 0, {@code def} на уровень 1, строка на {@code :} открывает уровень,
 * {@code return}/{@code else}/... закрывают. Строки внутри многострочных литералов не трогаются.
 * Количество строк сохраняется.
 */
public final class FallbackFormatter {

    private static final Pattern LEADING_WORD = Pattern.compile("^([A-Za-z_]+)\\b");
    private static final Pattern CLASS_LINE = Pattern.compile("^class\\b");
    private static final Pattern DEF_LINE = Pattern.compile("^(async\\s+)?def\\b");

    private static final Set<String> DEDENT_KEYWORDS = Set.of(
            "return", "break", "continue", "raise", "pass", "else", "elif", "except", "finally");

    /**
     * @param text исходник
     * @param indentWidth пробелов на уровень
     * @return текст с тем же числом строк
     */
    public String format(String text, int indentWidth) {
        if (text.isEmpty()) {
            return "";
        }
        String[] lines = text.replace("\r\n", "\n").split("\n", -1);
        int count = text.endsWith("\n") ? lines.length - 1 : lines.length;

        List<String> out = new ArrayList<>(count);
        int level = 0;
        String openDelimiter = null;
        for (int i = 0; i < count; i++) {
            String line = lines[i];
            if (openDelimiter != null) {
                out.add(line);
                if (LineScanner.count(line, openDelimiter) % 2 == 1) {
                    openDelimiter = null;
                }
                continue;
            }

            String stripped = line.strip();
            if (stripped.isEmpty()) {
                out.add("");
                continue;
            }
            if (stripped.startsWith("#")) {
                out.add(" ".repeat(level * indentWidth) + stripped);
                continue;
            }

            level = levelFor(stripped, lines, i, count, level);
            out.add(" ".repeat(level * indentWidth) + stripped);

            String opener = tripleQuoteOpener(stripped);
            if (opener != null && LineScanner.count(stripped, opener) % 2 == 1) {
                openDelimiter = opener;
            } else if (LineScanner.stripComment(stripped).endsWith(":")) {
                level++;
            }
        }
        return String.join("\n", out) + "\n";
    }

    private static int levelFor(String stripped, String[] lines, int index, int count, int current) {
        if (CLASS_LINE.matcher(stripped).find()) {
            return 0;
        }
        if (DEF_LINE.matcher(stripped).find()) {
            return 1;
        }
        if (stripped.startsWith("@")) {
            // Уровень декоратора определяет то, что он декорирует
            for (int j = index + 1; j < count; j++) {
                String next = lines[j].strip();
                if (next.isEmpty() || next.startsWith("@") || next.startsWith("#")) continue;
                if (CLASS_LINE.matcher(next).find()) return 0;
                if (DEF_LINE.matcher(next).find()) return 1;
                break;
            }
            return current;
        }
        Matcher word = LEADING_WORD.matcher(stripped);
        if (word.find() && DEDENT_KEYWORDS.contains(word.group(1))) {
            return Math.max(0, current - 1);
        }
        return current;
    }

    /**
     * Тройная кавычка, встречающаяся в строке первой, или null.
     */
    private static String tripleQuoteOpener(String line) {
        int doubles = line.indexOf("\"\"\"");
        int singles = line.indexOf("'''");
        if (doubles < 0 && singles < 0) return null;
        if (singles < 0 || doubles >= 0 && doubles < singles) return "\"\"\"";
        return "'''";
    }
}
