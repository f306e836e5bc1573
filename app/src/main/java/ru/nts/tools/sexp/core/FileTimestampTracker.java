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

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Защита от записи в устаревшие файлы (staleness guard).
 *
 * Хранит для каждого канонического пути момент, когда редактор последний раз видел файл
 * (mtime файловой системы на момент чтения или после собственной записи).
 * Перед записью текущий mtime сравнивается с сохранённым: более новый mtime означает,
 * что файл изменили снаружи, и правку нужно блокировать до повторного чтения.
 *
 * Экземпляр передаётся в конвейер правки явно; состояние живёт только в памяти процесса.
 * Правки разных файлов не блокируют друг друга. Окно check-then-write для одного файла
 * не сериализуется: это делает вызывающий слой, если ему нужно.
 */
public class FileTimestampTracker {

    /**
     * Вид чтения, после которого файл считается наблюдённым.
     */
    public enum ReadKind {
        /** Полный текст файла (raw read). */
        FULL,
        /** Свёрнутый просмотр: видны только сигнатуры. */
        PARTIAL
    }

    /**
     * Решение защиты для конкретного файла.
     *
     * @param observedAt последний наблюдённый mtime или -1, если файл не наблюдался
     * @param modifiedAt mtime на диске в момент проверки или -1, если файла нет
     */
    public record GuardDecision(boolean allowed, Path path, String reason, long observedAt, long modifiedAt) {

        static GuardDecision allow(Path path, long observedAt, long modifiedAt) {
            return new GuardDecision(true, path, null, observedAt, modifiedAt);
        }

        static GuardDecision block(Path path, String reason, long observedAt, long modifiedAt) {
            return new GuardDecision(false, path, reason, observedAt, modifiedAt);
        }

        public boolean blocked() {
            return !allowed;
        }
    }

    static final String REASON_NEVER_READ = "File has not been read in this session.";
    static final String REASON_MODIFIED = "File was modified externally after it was last read.";

    private final Map<Path, Long> observed = new ConcurrentHashMap<>();

    private final WriteGuardMode mode;

    public FileTimestampTracker(WriteGuardMode mode) {
        this.mode = mode == null ? WriteGuardMode.FULL_READ : mode;
    }

    public WriteGuardMode getMode() {
        return mode;
    }

    /**
     * Фиксирует текущий mtime файла как наблюдённый.
     */
    public void observe(Path path) throws IOException {
        Path canonical = canonical(path);
        observe(canonical, FileUtils.lastModifiedMillis(canonical));
    }

    /**
     * Фиксирует явно переданный момент наблюдения (обычно mtime после собственной записи).
     */
    public void observe(Path path, long timestamp) {
        Path canonical = canonical(path);
        observed.put(canonical, timestamp);
        EditorLog.log("[Guard] observed %s at %d", canonical, timestamp);
    }

    /**
     * Учитывает чтение с учётом режима: полное чтение наблюдает всегда,
     * свёрнутый просмотр только в режиме {@link WriteGuardMode#PARTIAL_READ}.
     *
     * @return true, если чтение было засчитано как наблюдение
     */
    public boolean observeRead(Path path, ReadKind kind) throws IOException {
        if (kind == ReadKind.PARTIAL && mode != WriteGuardMode.PARTIAL_READ) {
            return false;
        }
        observe(path);
        return true;
    }

    public OptionalLong observedAt(Path path) {
        Long ts = observed.get(canonical(path));
        return ts == null ? OptionalLong.empty() : OptionalLong.of(ts);
    }

    /**
     * Проверяет, можно ли писать в файл.
     */
    public GuardDecision check(Path path) throws IOException {
        Path canonical = canonical(path);
        Long seen = observed.get(canonical);
        long observedAt = seen == null ? -1 : seen;
        if (!Files.exists(canonical)) {
            return GuardDecision.allow(canonical, observedAt, -1);
        }
        long modifiedAt = FileUtils.lastModifiedMillis(canonical);
        if (mode == WriteGuardMode.DISABLED) {
            return GuardDecision.allow(canonical, observedAt, modifiedAt);
        }
        if (seen == null) {
            return GuardDecision.block(canonical, REASON_NEVER_READ, -1, modifiedAt);
        }
        if (modifiedAt > seen) {
            return GuardDecision.block(canonical, REASON_MODIFIED, seen, modifiedAt);
        }
        return GuardDecision.allow(canonical, seen, modifiedAt);
    }

    /**
     * Как {@link #check(Path)}, но блокировка превращается в исключение FILE_STALE.
     */
    public void requireWritable(Path path) throws IOException {
        GuardDecision decision = check(path);
        if (decision.blocked()) {
            EditorLog.log("[Guard] blocked %s: %s", decision.path(), decision.reason());
            throw NtsFileException.stale(decision.path(), decision.reason(), decision.observedAt(), decision.modifiedAt());
        }
    }

    /**
     * Все отслеживаемые канонические пути в лексикографическом порядке.
     */
    public List<Path> trackedFiles() {
        List<Path> paths = new ArrayList<>(observed.keySet());
        paths.sort(null);
        return paths;
    }

    /**
     * Отслеживаемые файлы, изменённые на диске после последнего наблюдения. Удалённые файлы не входят.
     */
    public List<Path> modifiedFiles() throws IOException {
        List<Path> result = new ArrayList<>();
        for (Path path : trackedFiles()) {
            Long seen = observed.get(path);
            if (seen != null && Files.exists(path) && FileUtils.lastModifiedMillis(path) > seen) {
                result.add(path);
            }
        }
        return result;
    }

    public void forget(Path path) {
        observed.remove(canonical(path));
    }

    public void reset() {
        observed.clear();
    }

    /**
     * Канонический путь: с разрешёнными симлинками, если файл существует.
     */
    public static Path canonical(Path path) {
        try {
            return path.toRealPath();
        } catch (IOException e) {
            return path.toAbsolutePath().normalize();
        }
    }
}
