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
import java.util.regex.Pattern;

/**
 * Разбивает длинную строку по скобке, закрывающей строку: по элементу на строку с запятой в конце.
 *
 * <p>Переносятся только вызовы, списки, словари, множества и кортежи. Индексация,
 * лямбды и одиночные генераторы/включения остаются как есть.
 */
public final class LineWrapper {

    private static final Pattern LAMBDA = Pattern.compile("\\blambda\\b");
    private static final Pattern COMPREHENSION = Pattern.compile("\\bfor\\b");

    private LineWrapper() {}

    /**
     * Разбивает строку.
     *
     * @param line строка без отступа
     * @param indentUnit отступ элементов относительно первой строки
     * @return строки результата или empty, если строку нельзя безопасно разбить
     */
    public static Optional<List<String>> explode(String line, String indentUnit) {
        int open = closingPairStart(line);
        if (open < 0) {
            return Optional.empty();
        }
        int close = line.length() - 1;
        char bracket = line.charAt(open);
        char before = open > 0 ? line.charAt(open - 1) : ' ';
        boolean calleeLike = Character.isLetterOrDigit(before) || before == '_'
                || before == ')' || before == ']' || before == '"' || before == '\'';
        if (bracket == '[' && calleeLike) {
            return Optional.empty();
        }

        String inner = line.substring(open + 1, close).strip();
        boolean trailingComma = inner.endsWith(",");
        List<String> items = splitTopLevel(inner);
        if (items.isEmpty() || items.stream().anyMatch(String::isEmpty)) {
            return Optional.empty();
        }
        if (items.size() == 1 && COMPREHENSION.matcher(items.get(0)).find()) {
            return Optional.empty();
        }
        if (items.stream().anyMatch(item -> LAMBDA.matcher(item).find())) {
            return Optional.empty();
        }
        if (bracket == '(' && !calleeLike && items.size() == 1 && !trailingComma) {
            // (x) это не кортеж
            return Optional.empty();
        }

        List<String> result = new ArrayList<>();
        result.add(line.substring(0, open + 1));
        for (String item : items) {
            result.add(indentUnit + item + ",");
        }
        result.add(String.valueOf(line.charAt(close)));
        return Optional.of(result);
    }

    /**
     * Разбивает текст по запятым верхнего уровня. Завершающая запятая не даёт пустого элемента.
     */
    public static List<String> splitTopLevel(String text) {
        List<String> items = new ArrayList<>();
        int depth = 0;
        char quote = 0;
        int start = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (quote != 0) {
                if (c == '\\') {
                    i++;
                } else if (c == quote) {
                    quote = 0;
                }
            } else if (c == '"' || c == '\'') {
                quote = c;
            } else if (c == '(' || c == '[' || c == '{') {
                depth++;
            } else if (c == ')' || c == ']' || c == '}') {
                depth--;
            } else if (c == ',' && depth == 0) {
                items.add(text.substring(start, i).strip());
                start = i + 1;
            }
        }
        String last = text.substring(start).strip();
        if (!last.isEmpty() || !items.isEmpty() && !text.strip().endsWith(",")) {
            items.add(last);
        }
        return items;
    }

    /**
     * Позиция открывающей скобки верхнего уровня, парной к последнему символу строки, или -1.
     */
    private static int closingPairStart(String line) {
        if (line.isEmpty() || ")]}".indexOf(line.charAt(line.length() - 1)) < 0) {
            return -1;
        }
        int depth = 0;
        int open = -1;
        char quote = 0;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (quote != 0) {
                if (c == '\\') {
                    i++;
                } else if (c == quote) {
                    quote = 0;
                }
            } else if (c == '"' || c == '\'') {
                if (line.startsWith(String.valueOf(c).repeat(3), i)) {
                    return -1;
                }
                quote = c;
            } else if (c == '#') {
                return -1;
            } else if (c == '(' || c == '[' || c == '{') {
                if (depth == 0) open = i;
                depth++;
            } else if (c == ')' || c == ']' || c == '}') {
                depth--;
                if (depth < 0) return -1;
                if (depth == 0 && i == line.length() - 1 && matches(line.charAt(open), c)) {
                    return open;
                }
            }
        }
        return -1;
    }

    private static boolean matches(char open, char close) {
        return open == '(' && close == ')' || open == '[' && close == ']' || open == '{' && close == '}';
    }
}
