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
package ru.nts.tools.sexp;

import com.fasterxml.jackson.databind.ObjectMapper;
import ru.nts.tools.sexp.core.EditorConfig;
import ru.nts.tools.sexp.core.EditorLog;
import ru.nts.tools.sexp.core.McpRouter;
import ru.nts.tools.sexp.tools.editing.ReplaceFormTool;
import ru.nts.tools.sexp.tools.editing.UpdateSexpTool;
import ru.nts.tools.sexp.tools.fs.ReadFileTool;
import ru.nts.tools.sexp.tools.navigation.FindFormTool;

/**
 * Сборка реестра инструментов поверх одного редактора. Транспорт подключается снаружи
 * и передаёт вызовы в {@link McpRouter#callTool}.
 */
public final class SexpToolkit {

    private SexpToolkit() {
    }

    /**
     * Редактор с настройками из переменных окружения NTS_SEXP_*.
     */
    public static McpRouter fromEnvironment() {
        return createRouter(new SexpEditor(EditorConfig.fromEnvironment(System.getenv())), new ObjectMapper());
    }

    public static McpRouter createRouter(SexpEditor editor, ObjectMapper mapper) {
        McpRouter router = new McpRouter(mapper);
        router.registerTool(new ReadFileTool(editor));
        router.registerTool(new FindFormTool(editor));
        router.registerTool(new ReplaceFormTool(editor));
        router.registerTool(new UpdateSexpTool(editor));
        EditorLog.log("[SexpToolkit] registered %d tools, write guard %s", router.getTools().size(),
                editor.getConfig().writeGuard().configValue());
        return router;
    }
}
