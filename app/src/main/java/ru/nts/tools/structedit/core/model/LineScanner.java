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

/**
 * Построчный лексический сканер Python: учитывает строковые литералы и комментарии.
 * Многострочные литералы не отслеживаются; строка рассматривается изолированно.
 */
public final class LineScanner {

    private LineScanner() {}

    /**
     * Возвращает код строки без завершающего комментария и хвостовых пробелов.
     */
    public static String stripComment(String line) {
        int hash = commentStart(line);
        String code = hash < 0 ? line : line.substring(0, hash);
        return code.stripTrailing();
    }

    /**
     * Позиция {@code #}, начинающего комментарий вне строковых литералов, или -1.
     */
    public static int commentStart(String line) {
        char quote = 0;
        boolean triple = false;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (quote != 0) {
                if (c == '\\') {
                    i++;
                } else if (c == quote) {
                    if (!triple) {
                        quote = 0;
                    } else if (line.startsWith(tripleOf(quote), i)) {
                        quote = 0;
                        triple = false;
                        i += 2;
                    }
                }
            } else if (c == '"' || c == '\'') {
                quote = c;
                triple = line.startsWith(tripleOf(c), i);
                if (triple) i += 2;
            } else if (c == '#') {
                return i;
            }
        }
        return -1;
    }

    /**
     * Количество вхождений подстроки.
     */
    public static int count(String line, String token) {
        int result = 0;
        int from = 0;
        while ((from = line.indexOf(token, from)) >= 0) {
            result++;
            from += token.length();
        }
        return result;
    }

    /**
     * Ширина ведущих пробелов; табуляция дополняет до кратного 8.
     */
    public static int leadingWidth(String line) {
        int width = 0;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (c == ' ') {
                width++;
            } else if (c == '\t') {
                width = (width / 8 + 1) * 8;
            } else {
                break;
            }
        }
        return width;
    }

    private static String tripleOf(char quote) {
        return String.valueOf(quote).repeat(3);
    }
}
