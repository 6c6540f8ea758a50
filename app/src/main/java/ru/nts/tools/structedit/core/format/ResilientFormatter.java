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

import ru.nts.tools.structedit.core.Diagnostics;
import ru.nts.tools.structedit.core.EditException;
import ru.nts.tools.structedit.core.model.FormatStyle;

/**
 * Двухуровневый форматтер: канонический путь, при его отказе построчный запасной.
 * Отказ основного пути не пробрасывается, а уходит в {@link Diagnostics}.
 */
public final class ResilientFormatter {

    public enum Strategy {
        CANONICAL("canonical"),
        FALLBACK("fallback");

        private final String wireName;

        Strategy(String wireName) {
            this.wireName = wireName;
        }

        public String wireName() {
            return wireName;
        }
    }

    /**
     * Результат форматирования.
     *
     * @param text итоговый текст
     * @param strategy сработавший путь
     * @param failure причина отказа основного пути или null
     */
    public record FormatOutcome(String text, Strategy strategy, String failure) {
        public boolean usedFallback() {
            return strategy == Strategy.FALLBACK;
        }
    }

    private final CanonicalFormatter primary;
    private final FallbackFormatter fallback;
    private final Diagnostics diagnostics;

    public ResilientFormatter(Diagnostics diagnostics) {
        this(new CanonicalFormatter(), new FallbackFormatter(), diagnostics);
    }

    public ResilientFormatter(CanonicalFormatter primary, FallbackFormatter fallback, Diagnostics diagnostics) {
        this.primary = primary;
        this.fallback = fallback;
        this.diagnostics = diagnostics;
    }

    /**
     * Форматирует текст. Никогда не бросает: в худшем случае возвращает результат запасного пути.
     */
    public FormatOutcome reformat(String text, FormatStyle style) {
        try {
            return new FormatOutcome(primary.format(text, style), Strategy.CANONICAL, null);
        } catch (EditException e) {
            return degrade(text, style, e.toLogMessage());
        } catch (RuntimeException e) {
            return degrade(text, style, "[" + e.getClass().getSimpleName() + "] " + e.getMessage());
        }
    }

    private FormatOutcome degrade(String text, FormatStyle style, String reason) {
        diagnostics.report("format", "Canonical formatter failed, using line-based fallback: " + reason);
        return new FormatOutcome(fallback.format(text, style.indentWidth()), Strategy.FALLBACK, reason);
    }
}
