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
import java.util.regex.Pattern;

/**
 * Непрозрачный фрагмент кода листового узла.
 *
 * Первая строка хранится без отступа, последующие с отступом относительно первой.
 * Строки внутри многострочных литералов помечены verbatim и выводятся как есть.
 */
public final class CodeFragment {

    private static final Pattern DOCSTRING_START = Pattern.compile("^[rRuUbB]{0,2}(\"|')");

    /**
     * Строка фрагмента.
     *
     * @param indent относительный отступ (для verbatim не используется)
     * @param text текст без ведущих пробелов, для verbatim исходная строка целиком
     * @param verbatim строка внутри многострочного литерала
     */
    public record Line(int indent, String text, boolean verbatim) {

        public static Line code(int indent, String text) {
            return new Line(indent, text, false);
        }

        public boolean isBlank() {
            return !verbatim && text.isEmpty();
        }
    }

    private final List<Line> lines;

    public CodeFragment(List<Line> lines) {
        if (lines.isEmpty()) {
            throw new IllegalArgumentException("Code fragment must have at least one line");
        }
        this.lines = List.copyOf(lines);
    }

    public static CodeFragment of(String singleLine) {
        return new CodeFragment(List.of(Line.code(0, singleLine.strip())));
    }

    public List<Line> lines() {
        return Collections.unmodifiableList(lines);
    }

    public boolean isSingleLine() {
        return lines.size() == 1;
    }

    public String firstLine() {
        return lines.get(0).text();
    }

    /**
     * Похоже ли выражение на строковый литерал (docstring).
     */
    public boolean isStringLiteral() {
        return DOCSTRING_START.matcher(firstLine()).find();
    }

    /**
     * Возвращает копию с комментарием в конце последней строки.
     */
    public CodeFragment withTrailingComment(String comment) {
        List<Line> copy = new ArrayList<>(lines);
        Line last = copy.get(copy.size() - 1);
        copy.set(copy.size() - 1, new Line(last.indent(), last.text() + "  " + comment, last.verbatim()));
        return new CodeFragment(copy);
    }

    /**
     * Шаг отступа внутри фрагмента: разница отступов строки, закрывающейся на {@code :},
     * и следующей за ней строки. 0, если вложенных блоков нет.
     */
    public int indentUnit() {
        for (int i = 0; i < lines.size(); i++) {
            Line line = lines.get(i);
            if (line.verbatim() || line.isBlank() || !LineScanner.stripComment(line.text()).endsWith(":")) {
                continue;
            }
            for (int j = i + 1; j < lines.size(); j++) {
                Line next = lines.get(j);
                if (next.verbatim() || next.isBlank()) continue;
                if (next.indent() > line.indent()) {
                    return next.indent() - line.indent();
                }
                break;
            }
        }
        return 0;
    }

    /**
     * Выводит фрагмент с базовым отступом, пересчитывая шаг вложенных блоков в indentWidth.
     * Продолжения строк, не кратные шагу, сохраняют остаток.
     */
    public void render(String baseIndent, int indentWidth, List<String> out) {
        int unit = indentUnit();
        for (Line line : lines) {
            if (line.verbatim()) {
                out.add(line.text());
            } else if (line.isBlank()) {
                out.add("");
            } else {
                out.add(baseIndent + " ".repeat(scale(line.indent(), unit, indentWidth)) + line.text());
            }
        }
    }

    /**
     * Текст фрагмента без базового отступа.
     */
    public String text() {
        List<String> out = new ArrayList<>();
        int unit = indentUnit();
        render("", unit > 0 ? unit : 1, out);
        return String.join("\n", out);
    }

    static int scale(int indent, int unit, int width) {
        if (unit <= 0 || unit == width) {
            return indent;
        }
        return (indent / unit) * width + indent % unit;
    }

    @Override
    public String toString() {
        return text();
    }
}
