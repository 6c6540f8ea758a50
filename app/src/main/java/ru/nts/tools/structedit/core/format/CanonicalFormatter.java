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

import ru.nts.tools.structedit.core.EditException;
import ru.nts.tools.structedit.core.model.FormatStyle;
import ru.nts.tools.structedit.core.model.SourceParser;
import ru.nts.tools.structedit.core.model.SourceSerializer;
import ru.nts.tools.structedit.core.model.SourceTree;
import ru.nts.tools.structedit.core.treesitter.SyntaxChecker;
import ru.nts.tools.structedit.core.treesitter.TreeSitterManager;

/**
 * Основной форматтер: кавычки, разбор в дерево и вывод в заданном стиле с переносом длинных строк.
 * Результат идемпотентен: повторное форматирование ничего не меняет.
 */
public final class CanonicalFormatter {

    private final SourceParser parser;
    private final QuoteNormalizer quotes;

    public CanonicalFormatter() {
        this(TreeSitterManager.getInstance());
    }

    public CanonicalFormatter(TreeSitterManager manager) {
        this.parser = new SourceParser(manager);
        this.quotes = new QuoteNormalizer(manager);
    }

    /**
     * @param text исходник
     * @param style отступ и ширина строки
     * @return отформатированный текст
     * @throws EditException SYNTAX_ERROR для неразбираемого входа,
     *                       STRUCTURAL_VIOLATION если результат не разбирается
     */
    public String format(String text, FormatStyle style) throws EditException {
        String content = SourceParser.normalize(text);
        if (content.isBlank()) {
            return "";
        }
        SourceTree tree = parser.parse(quotes.normalize(content));

        String formatted = new SourceSerializer(style).serialize(tree);
        if (!SyntaxChecker.check(formatted).hasErrors()) {
            return formatted;
        }
        if (style.wrapsLines()) {
            // Перенос строк сломал код, выводим без переноса
            String unwrapped = new SourceSerializer(style.withoutWrapping()).serialize(tree);
            if (!SyntaxChecker.check(unwrapped).hasErrors()) {
                return unwrapped;
            }
        }
        SyntaxChecker.SyntaxError error = SyntaxChecker.check(formatted).firstError();
        throw EditException.structuralViolation("Formatted text does not parse at line "
                + error.line() + ": " + error.context());
    }
}
