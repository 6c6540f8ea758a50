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
package ru.nts.tools.structedit.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Канал диагностических сообщений ядра.
 * Ядро ничего не пишет в stderr само: вызывающая сторона выбирает sink
 * (молчаливый, stderr или накопительный) и может подавить вывод целиком.
 */
@FunctionalInterface
public interface Diagnostics {

    /**
     * Сообщает о событии.
     *
     * @param stage   этап обработки (format, parse, relocate ...)
     * @param message текст сообщения
     */
    void report(String stage, String message);

    /**
     * Sink, отбрасывающий все сообщения.
     */
    static Diagnostics silent() {
        return (stage, message) -> { };
    }

    /**
     * Sink в стиле "[STAGE] message" в System.err.
     */
    static Diagnostics stderr() {
        return (stage, message) -> System.err.println("[" + stage.toUpperCase() + "] " + message);
    }

    /**
     * Дублирует сообщения во второй sink.
     */
    default Diagnostics andThen(Diagnostics next) {
        return (stage, message) -> {
            report(stage, message);
            next.report(stage, message);
        };
    }

    /**
     * Накопительный sink: сохраняет сообщения для включения в результат операции.
     */
    final class Collector implements Diagnostics {

        private final List<String> messages = new ArrayList<>();

        @Override
        public void report(String stage, String message) {
            messages.add(stage + ": " + message);
        }

        public List<String> messages() {
            return Collections.unmodifiableList(messages);
        }

        public boolean isEmpty() {
            return messages.isEmpty();
        }
    }
}
