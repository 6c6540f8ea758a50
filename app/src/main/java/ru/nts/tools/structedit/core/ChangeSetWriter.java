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

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Запись набора файлов по принципу "все или ничего".
 * Ядро редактора возвращает тексты, но не пишет их; этот класс закрывает
 * окно потери данных при переносе кода между двумя файлами.
 *
 * <p>Фаза 1: все тексты кодируются и пишутся во временные файлы (*.tmp).
 * Фаза 2: каждый файл заменяется с сохранением резервной копии (*.old).
 * Если замена любого файла падает, уже заменённые файлы восстанавливаются
 * из резервных копий.
 */
public final class ChangeSetWriter {

    private final Charset charset;

    public ChangeSetWriter() {
        this(StandardCharsets.UTF_8);
    }

    public ChangeSetWriter(Charset charset) {
        this.charset = charset;
    }

    /**
     * Записывает все файлы атомарно относительно друг друга.
     *
     * @param contents путь → новое содержимое
     * @throws IOException если хотя бы один файл не может быть записан; в этом случае
     *                     ни один файл не изменён
     */
    public void writeAll(Map<Path, String> contents) throws IOException {
        Map<Path, Path> temps = new LinkedHashMap<>();
        try {
            for (Map.Entry<Path, String> entry : contents.entrySet()) {
                Path path = entry.getKey().toAbsolutePath().normalize();
                Path parent = path.getParent();
                if (parent != null && !Files.exists(parent)) {
                    Files.createDirectories(parent);
                }
                Path temp = path.resolveSibling(path.getFileName() + ".tmp");
                Files.write(temp, encode(entry.getValue()),
                        StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
                temps.put(path, temp);
            }
        } catch (IOException e) {
            deleteQuietly(temps.values());
            throw e;
        }

        List<Path> replaced = new ArrayList<>();
        List<Path> created = new ArrayList<>();
        try {
            for (Map.Entry<Path, Path> entry : temps.entrySet()) {
                Path path = entry.getKey();
                if (Files.exists(path)) {
                    Files.move(path, backupOf(path), StandardCopyOption.REPLACE_EXISTING);
                    replaced.add(path);
                } else {
                    created.add(path);
                }
                Files.move(entry.getValue(), path, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            rollback(replaced, created, e);
            deleteQuietly(temps.values());
            throw e;
        }

        for (Path path : replaced) {
            Files.deleteIfExists(backupOf(path));
        }
    }

    private void rollback(List<Path> replaced, List<Path> created, IOException failure) {
        for (Path path : created) {
            try {
                Files.deleteIfExists(path);
            } catch (IOException e) {
                failure.addSuppressed(e);
            }
        }
        for (Path path : replaced) {
            try {
                Files.move(backupOf(path), path, StandardCopyOption.REPLACE_EXISTING);
            } catch (IOException e) {
                failure.addSuppressed(e);
            }
        }
    }

    private byte[] encode(String content) throws IOException {
        try {
            ByteBuffer buffer = charset.newEncoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .encode(CharBuffer.wrap(content));
            byte[] bytes = new byte[buffer.remaining()];
            buffer.get(bytes);
            return bytes;
        } catch (CharacterCodingException e) {
            throw new IOException("Cannot write file in " + charset.name() + " encoding: " +
                    "content contains unmappable characters", e);
        }
    }

    private static Path backupOf(Path path) {
        return path.resolveSibling(path.getFileName() + ".old");
    }

    private static void deleteQuietly(Iterable<Path> paths) {
        for (Path path : paths) {
            try {
                Files.deleteIfExists(path);
            } catch (IOException ignored) {
                // временный файл не мешает повторной попытке
            }
        }
    }
}
