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

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import ru.nts.tools.structedit.core.EditErrorCode;
import ru.nts.tools.structedit.core.EditException;
import ru.nts.tools.structedit.core.model.FormatStyle;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class CanonicalFormatterTest {

    private final CanonicalFormatter formatter = new CanonicalFormatter();
    private final FormatStyle style = FormatStyle.formatting(4, 40);

    @Nested
    class Quotes {

        @Test
        void singleQuotedLiteralsBecomeDouble() throws EditException {
            assertEquals("x = \"a\"\ny = 'it\"s'\n", formatter.format("x = 'a'\ny = 'it\"s'\n", style));
        }

        @Test
        void interpolatedStringsAreKept() throws EditException {
            assertEquals("name = f'{user}'\n", formatter.format("name = f'{user}'\n", style));
        }

        @Test
        void requoteRules() {
            assertEquals(Optional.of("\"abc\""), QuoteNormalizer.requote("'abc'"));
            assertEquals(Optional.of("b\"x\""), QuoteNormalizer.requote("b'x'"));
            assertEquals(Optional.of("\"\"\"doc\"\"\""), QuoteNormalizer.requote("'''doc'''"));
            assertEquals(Optional.empty(), QuoteNormalizer.requote("'a\\nb'"));
            assertEquals(Optional.empty(), QuoteNormalizer.requote("\"already\""));
        }
    }

    @Nested
    class Layout {

        @Test
        void longCallIsWrapped() throws EditException {
            assertEquals("""
                    result = compute(
                        first_argument,
                        second_argument,
                    )
                    """, formatter.format("result = compute(first_argument, second_argument)\n", style));
        }

        @Test
        void indentWidthIsApplied() throws EditException {
            assertEquals("def f():\n  if x:\n    return 1\n",
                    formatter.format("def f():\n    if x:\n        return 1\n", FormatStyle.formatting(2, 88)));
        }

        @Test
        void formattingIsIdempotent() throws EditException {
            String messy = """
                    import os
                    class Config(object):
                      values = {'a': 1, 'b': 2, 'c': 3, 'd': 4}
                      def load(self, path, encoding='utf-8', strict=False, retries=3):
                        return open(path, encoding=encoding)
                    """;

            String once = formatter.format(messy, style);
            assertEquals(once, formatter.format(once, style));
        }

        @Test
        void blankInputGivesEmptyText() throws EditException {
            assertEquals("", formatter.format("  \n\n", style));
        }
    }

    @Test
    void unparsableInputIsSyntaxError() {
        EditException e = assertThrows(EditException.class, () -> formatter.format("def (:\n", style));

        assertEquals(EditErrorCode.SYNTAX_ERROR, e.getCode());
    }
}
