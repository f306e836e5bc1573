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
import java.util.List;
import java.util.Map;

/**
 * Exception for locator results that cannot be edited: nothing matched, or more than one thing matched.
 * Always carries the candidates found so the caller can refine the selector.
 */
public class NtsMatchException extends NtsException {

    private final List<String> candidates;

    private NtsMatchException(NtsErrorCode code, Map<String, Object> context, List<String> candidates) {
        super(code, context);
        this.candidates = List.copyOf(candidates);
    }

    public List<String> getCandidates() {
        return candidates;
    }

    /**
     * Factory: no top-level form matches; candidates are all forms of the file.
     */
    public static NtsMatchException formNotFound(Path path, String selector, List<String> available) {
        return new NtsMatchException(NtsErrorCode.FORM_NOT_FOUND, context(path, selector, available), available);
    }

    /**
     * Factory: several top-level forms match.
     */
    public static NtsMatchException formAmbiguous(Path path, String selector, List<String> matches) {
        return new NtsMatchException(NtsErrorCode.FORM_AMBIGUOUS, context(path, selector, matches), matches);
    }

    /**
     * Factory: the match fragment occurs nowhere.
     */
    public static NtsMatchException expressionNotFound(Path path, String fragment) {
        return new NtsMatchException(NtsErrorCode.EXPRESSION_NOT_FOUND, context(path, fragment, List.of()), List.of());
    }

    /**
     * Factory: the match fragment occurs more than once (or the occurrences overlap).
     *
     * @param locations "line:column" of every occurrence
     */
    public static NtsMatchException expressionAmbiguous(Path path, String fragment, List<String> locations, String reason) {
        Map<String, Object> ctx = context(path, fragment, locations);
        ctx.put("reason", reason);
        return new NtsMatchException(NtsErrorCode.EXPRESSION_AMBIGUOUS, ctx, locations);
    }

    private static Map<String, Object> context(Path path, String selector, List<String> candidates) {
        Map<String, Object> ctx = new LinkedHashMap<>();
        ctx.put("path", String.valueOf(path));
        ctx.put("selector", selector);
        ctx.put("candidates", candidates.isEmpty() ? "(none)" : String.join(", ", candidates));
        return ctx;
    }
}
