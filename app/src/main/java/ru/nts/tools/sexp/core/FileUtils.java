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
package ru.nts.tools.sexp.core;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CharsetEncoder;
import java.nio.charset.CodingErrorAction;
import java.nio.file.FileSystemException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.concurrent.TimeUnit;
import java.util.zip.CRC32C;

/**
 * Утилиты для безопасной работы с файловой системой.
 * Запись идёт через временный файл и подмену (Safe Swap), так что на диске никогда не остаётся
 * наполовину записанный исходник. Транзиентные блокировки (Windows, антивирусы) переживаются повторами.
 */
public final class FileUtils {

    private static final int MAX_RETRIES = 5;
    private static final long INITIAL_BACKOFF = 50; // ms

    private FileUtils() {
    }

    /**
     * Выполняет IO-операцию с механизмом повторов и экспоненциальной задержкой.
     */
    public static <T> T executeWithRetry(IORunnable<T> action) throws IOException {
        FileSystemException lastException = null;
        for (int i = 0; i < MAX_RETRIES; i++) {
            try {
                return action.run();
            } catch (FileSystemException e) {
                lastException = e;
                EditorLog.log("[FileUtils] retry %d after %s", i + 1, e.getMessage());
                long backoff = INITIAL_BACKOFF * (1L << i);
                try {
                    TimeUnit.MILLISECONDS.sleep(backoff);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new IOException("Retry interrupted", ie);
                }
            }
        }
        throw lastException;
    }

    /**
     * Безопасная запись контента в файл. Кодировщик работает в режиме REPORT:
     * символ, непредставимый в кодировке файла, прерывает запись до того, как диск будет затронут.
     */
    public static void safeWrite(Path path, String content, Charset charset) throws IOException {
        Path parent = path.getParent();
        if (parent != null && !Files.exists(parent)) {
            Files.createDirectories(parent);
        }
        Path tempFile = path.resolveSibling(path.getFileName() + ".tmp");
        Path backupFile = path.resolveSibling(path.getFileName() + ".old");

        byte[] bytes = encode(content, charset);

        executeWithRetry(() -> {
            Files.write(tempFile, bytes, StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
            if (Files.exists(path)) {
                Files.move(path, backupFile, StandardCopyOption.REPLACE_EXISTING);
            }
            try {
                Files.move(tempFile, path, StandardCopyOption.REPLACE_EXISTING);
            } catch (IOException e) {
                if (Files.exists(backupFile)) {
                    Files.move(backupFile, path, StandardCopyOption.REPLACE_EXISTING);
                }
                throw e;
            }
            Files.deleteIfExists(backupFile);
            return null;
        });
    }

    /**
     * Безопасное чтение всех байтов файла.
     */
    public static byte[] safeReadAllBytes(Path path) throws IOException {
        return executeWithRetry(() -> Files.readAllBytes(path));
    }

    /**
     * Время последней модификации по данным файловой системы (epoch millis).
     */
    public static long lastModifiedMillis(Path path) throws IOException {
        return executeWithRetry(() -> Files.getLastModifiedTime(path).toMillis());
    }

    /**
     * Вычисляет CRC32C хеш-сумму файла.
     */
    public static long calculateCRC32(Path path) throws IOException {
        CRC32C crc = new CRC32C();
        try (InputStream in = new BufferedInputStream(Files.newInputStream(path))) {
            byte[] buffer = new byte[8192];
            int len;
            while ((len = in.read(buffer)) != -1) {
                crc.update(buffer, 0, len);
            }
        }
        return crc.getValue();
    }

    private static byte[] encode(String content, Charset charset) throws IOException {
        CharsetEncoder encoder = charset.newEncoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        ByteBuffer buffer;
        try {
            buffer = encoder.encode(CharBuffer.wrap(content));
        } catch (CharacterCodingException e) {
            throw new IOException("Cannot write file in " + charset.name() + " encoding: " +
                    "content contains characters not supported by this encoding.", e);
        }
        byte[] bytes = new byte[buffer.remaining()];
        buffer.get(bytes);
        return bytes;
    }

    @FunctionalInterface
    public interface IORunnable<T> {
        T run() throws IOException;
    }
}
