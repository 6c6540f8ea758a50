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
 * Параметры вывода дерева в текст.
 *
 * @param indentWidth пробелов на уровень вложенности
 * @param lineWidth предельная ширина строки; 0 отключает перенос
 * @param topLevelBlankLines пустых строк вокруг определений верхнего уровня
 */
public record FormatStyle(int indentWidth, int lineWidth, int topLevelBlankLines) {

    public static final int DEFAULT_INDENT_WIDTH = 4;
    public static final int DEFAULT_LINE_WIDTH = 88;
    public static final int MIN_LINE_WIDTH = 20;

    /**
     * Стиль сериализации после правок: отступ 4, без переноса строк.
     */
    public static final FormatStyle CANONICAL = new FormatStyle(DEFAULT_INDENT_WIDTH, 0, 2);

    public FormatStyle {
        if (indentWidth < 1) {
            throw new IllegalArgumentException("indentWidth must be positive: " + indentWidth);
        }
        if (lineWidth < 0) {
            throw new IllegalArgumentException("lineWidth must not be negative: " + lineWidth);
        }
    }

    public static FormatStyle formatting(int indentWidth, int lineWidth) {
        return new FormatStyle(indentWidth, lineWidth, 2);
    }

    public boolean wrapsLines() {
        return lineWidth > 0;
    }

    public FormatStyle withoutWrapping() {
        return new FormatStyle(indentWidth, 0, topLevelBlankLines);
    }

    public String indent(int depth) {
        return " ".repeat(depth * indentWidth);
    }
}
