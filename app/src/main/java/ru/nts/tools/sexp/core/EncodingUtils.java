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

import org.mozilla.universalchardet.UniversalDetector;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.StandardCharsets;
import java.nio.charset.UnsupportedCharsetException;
import java.nio.file.Path;

/**
 * Определение кодировки и чтение исходников.
 * Кодировка определяется через UniversalDetector (juniversalchardet); она же используется при обратной записи,
 * чтобы правка не перекодировала файл.
 */
public final class EncodingUtils {

    private static final Charset FALLBACK_SINGLE_BYTE = Charset.forName("windows-1251");

    private EncodingUtils() {
    }

    /**
     * Результат чтения текстового файла.
     *
     * @param content текст без BOM
     * @param charset кодировка, которой были декодированы байты
     * @param bom     байты BOM, снятые при чтении (пустой массив, если BOM не было)
     */
    public record TextFileContent(String content, Charset charset, byte[] bom) {
        public boolean hasBom() {
            return bom.length > 0;
        }
    }

    /**
     * Считывает файл целиком с автоопределением кодировки.
     *
     * @throws NtsFileException FILE_IS_BINARY, если в начале файла встречаются NULL-байты
     * @throws IOException      если файл недоступен
     */
    public static TextFileContent readTextFile(Path path) throws IOException {
        byte[] allBytes = FileUtils.safeReadAllBytes(path);
        Charset charset = detect(allBytes);

        int bomLength = bomLength(allBytes, charset);
        byte[] bom = new byte[bomLength];
        System.arraycopy(allBytes, 0, bom, 0, bomLength);

        // Бинарный файл: NULL-байты вне многобайтовых UTF
        if (!charset.name().startsWith("UTF-16") && !charset.name().startsWith("UTF-32")) {
            int checkLimit = Math.min(allBytes.length, 8192);
            for (int i = bomLength; i < checkLimit; i++) {
                if (allBytes[i] == 0) {
                    throw new NtsFileException(NtsErrorCode.FILE_IS_BINARY, path);
                }
            }
        }

        String text = new String(allBytes, bomLength, allBytes.length - bomLength, charset);
        return new TextFileContent(text, charset, bom);
    }

    /**
     * Текст для обратной записи в кодировке исходного файла: снятый при чтении BOM возвращается на место.
     * Кодировщик "UTF-16" пишет BOM сам.
     */
    public static String withOriginalBom(TextFileContent source, String text) {
        if (!source.hasBom() || source.charset().name().equals("UTF-16")) {
            return text;
        }
        return "\uFEFF" + text;
    }

    /**
     * Кодировка для набора байтов. UTF-8, если детектор молчит и байты валидны как UTF-8.
     */
    static Charset detect(byte[] bytes) {
        UniversalDetector detector = new UniversalDetector(null);
        detector.handleData(bytes, 0, bytes.length);
        detector.dataEnd();
        String encoding = detector.getDetectedCharset();

        Charset charset = StandardCharsets.UTF_8;
        if (encoding != null) {
            try {
                charset = Charset.forName(encoding);
            } catch (IllegalCharsetNameException | UnsupportedCharsetException e) {
                EditorLog.log("[EncodingUtils] unsupported charset %s, using UTF-8", encoding);
            }
        }
        // Кириллица в однобайтовой кодировке часто не распознаётся детектором
        if ((encoding == null || charset.equals(StandardCharsets.UTF_8)) && !isValidUtf8(bytes)) {
            charset = FALLBACK_SINGLE_BYTE;
        }
        return charset;
    }

    private static int bomLength(byte[] b, Charset charset) {
        String name = charset.name().toUpperCase();
        if (!name.startsWith("UTF-")) {
            return 0;
        }
        if (name.equals("UTF-8")) {
            return b.length >= 3 && (b[0] & 0xFF) == 0xEF && (b[1] & 0xFF) == 0xBB && (b[2] & 0xFF) == 0xBF ? 3 : 0;
        }
        if (name.startsWith("UTF-16") && b.length >= 2) {
            boolean be = (b[0] & 0xFF) == 0xFE && (b[1] & 0xFF) == 0xFF;
            boolean le = (b[0] & 0xFF) == 0xFF && (b[1] & 0xFF) == 0xFE;
            return be || le ? 2 : 0;
        }
        if (name.startsWith("UTF-32") && b.length >= 4) {
            boolean be = b[0] == 0 && b[1] == 0 && (b[2] & 0xFF) == 0xFE && (b[3] & 0xFF) == 0xFF;
            boolean le = (b[0] & 0xFF) == 0xFF && (b[1] & 0xFF) == 0xFE && b[2] == 0 && b[3] == 0;
            return be || le ? 4 : 0;
        }
        return 0;
    }

    /**
     * Проверяет, является ли массив байтов валидной последовательностью UTF-8.
     */
    static boolean isValidUtf8(byte[] bytes) {
        int i = 0;
        while (i < bytes.length) {
            int b = bytes[i++] & 0xFF;
            if (b <= 0x7F) continue;

            int count;
            if (b >= 0xC2 && b <= 0xDF) count = 1;
            else if (b >= 0xE0 && b <= 0xEF) count = 2;
            else if (b >= 0xF0 && b <= 0xF4) count = 3;
            else return false;

            if (i + count > bytes.length) return false;

            for (int j = 0; j < count; j++) {
                int next = bytes[i++] & 0xFF;
                if (next < 0x80 || next > 0xBF) return false;
            }
        }
        return true;
    }
}
