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

import java.io.FileWriter;
import java.io.IOException;
import java.io.PrintWriter;
import java.time.LocalDateTime;

/**
 * Отладочный лог редактора.
 *
 * Хост инструментов общается с клиентом через stdio, и некоторые клиенты смешивают stderr со stdout,
 * поэтому по умолчанию лог молчит. Включается переменными окружения:
 * - NTS_SEXP_DEBUG=true: сообщения в stderr
 * - NTS_SEXP_LOG_FILE=/path/to/file: сообщения в файл (безопасно для любых клиентов)
 */
public final class EditorLog {

    private static final boolean DEBUG = "true".equalsIgnoreCase(System.getenv("NTS_SEXP_DEBUG"));

    private static final String LOG_FILE = System.getenv("NTS_SEXP_LOG_FILE");

    private static PrintWriter logWriter = null;

    static {
        if (LOG_FILE != null && !LOG_FILE.isBlank()) {
            try {
                logWriter = new PrintWriter(new FileWriter(LOG_FILE, true), true);
            } catch (IOException e) {
                if (DEBUG) {
                    System.err.println("Cannot open log file " + LOG_FILE + ": " + e.getMessage());
                }
            }
        }
    }

    private EditorLog() {
    }

    /**
     * Записывает сообщение в лог-файл и/или stderr (если настроено).
     */
    public static synchronized void log(String message) {
        if (logWriter != null) {
            logWriter.println("[" + LocalDateTime.now() + "] [" + Thread.currentThread().getName() + "] " + message);
        }
        if (DEBUG) {
            System.err.println(message);
        }
    }

    /**
     * Форматированный вариант {@link #log(String)}.
     */
    public static void log(String format, Object... args) {
        if (isEnabled()) {
            log(String.format(format, args));
        }
    }

    public static boolean isEnabled() {
        return DEBUG || logWriter != null;
    }
}
