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

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Exception for parameter-related errors (missing or invalid values).
 */
public class NtsParamException extends NtsException {

    public NtsParamException(NtsErrorCode code, Map<String, Object> context) {
        super(code, context);
    }

    /**
     * Factory: Missing required parameter
     */
    public static NtsParamException missing(String paramName) {
        return new NtsParamException(NtsErrorCode.PARAM_MISSING, Map.of("param", paramName));
    }

    /**
     * Factory: Invalid parameter value
     */
    public static NtsParamException invalid(String paramName, Object value, String reason) {
        Map<String, Object> ctx = new LinkedHashMap<>();
        ctx.put("param", paramName);
        ctx.put("value", value);
        ctx.put("reason", reason);
        return new NtsParamException(NtsErrorCode.PARAM_INVALID, ctx);
    }
}
