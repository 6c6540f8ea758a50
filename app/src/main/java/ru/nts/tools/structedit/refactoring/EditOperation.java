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
package ru.nts.tools.structedit.refactoring;

import com.fasterxml.jackson.databind.JsonNode;
import ru.nts.tools.structedit.core.EditException;

/**
 * Базовый интерфейс для операций редактирования.
 * Каждая операция получает текст, меняет дерево и возвращает новый текст целиком
 * или ошибку; частичный результат не возвращается никогда.
 */
public interface EditOperation {

    /**
     * Вид операции.
     */
    OperationKind getKind();

    /**
     * Валидирует параметры операции до разбора текста.
     *
     * @param params параметры для проверки
     * @throws EditException PARAM_MISSING, PARAM_INVALID или PARAM_OUT_OF_RANGE
     */
    void validateParams(JsonNode params) throws EditException;

    /**
     * Выполняет операцию.
     *
     * @param params параметры операции
     * @param context контекст выполнения
     * @return результат операции
     * @throws EditException если операция не может быть выполнена
     */
    EditResult execute(JsonNode params, EditContext context) throws EditException;
}
