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

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Exception for file-related errors (not found, too large, stale, etc.)
 */
public class NtsFileException extends NtsException {

    public NtsFileException(NtsErrorCode code, Path path) {
        super(code, Map.of("path", path.toString()));
    }

    public NtsFileException(NtsErrorCode code, Path path, Throwable cause) {
        super(code, Map.of("path", path.toString()), cause);
    }

    private NtsFileException(NtsErrorCode code, Map<String, Object> context) {
        super(code, context);
    }

    /**
     * Factory: File not found
     */
    public static NtsFileException notFound(Path path) {
        return new NtsFileException(NtsErrorCode.FILE_NOT_FOUND, path);
    }

    /**
     * Factory: File too large
     */
    public static NtsFileException tooLarge(Path path, long sizeBytes, long maxBytes) {
        Map<String, Object> ctx = new LinkedHashMap<>();
        ctx.put("path", path.toString());
        ctx.put("size", sizeBytes);
        ctx.put("maxAllowed", maxBytes);
        return new NtsFileException(NtsErrorCode.FILE_TOO_LARGE, ctx);
    }

    /**
     * Factory: the Staleness Guard blocked a write.
     *
     * @param path       canonical path of the file
     * @param reason     why the guard blocked (never read / modified externally)
     * @param observedAt last observed modification time, or -1 if the file was never observed
     * @param modifiedAt modification time currently reported by the filesystem
     */
    public static NtsFileException stale(Path path, String reason, long observedAt, long modifiedAt) {
        Map<String, Object> ctx = new LinkedHashMap<>();
        ctx.put("path", path.toString());
        ctx.put("reason", reason);
        if (observedAt >= 0) {
            ctx.put("observedAt", observedAt);
        }
        ctx.put("modifiedAt", modifiedAt);
        return new NtsFileException(NtsErrorCode.FILE_STALE, ctx);
    }
}
