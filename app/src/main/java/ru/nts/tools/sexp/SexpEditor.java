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

import ru.nts.tools.sexp.core.EditorConfig;
import ru.nts.tools.sexp.core.EditorLog;
import ru.nts.tools.sexp.core.EncodingUtils;
import ru.nts.tools.sexp.core.FileTimestampTracker;
import ru.nts.tools.sexp.core.FileTimestampTracker.ReadKind;
import ru.nts.tools.sexp.core.NtsFileException;
import ru.nts.tools.sexp.core.NtsMatchException;
import ru.nts.tools.sexp.core.NtsParamException;
import ru.nts.tools.sexp.core.edit.CodeFormatter;
import ru.nts.tools.sexp.core.edit.EditPipeline;
import ru.nts.tools.sexp.core.edit.EditResult;
import ru.nts.tools.sexp.core.edit.LintChecker;
import ru.nts.tools.sexp.core.edit.ReaderLintChecker;
import ru.nts.tools.sexp.core.edit.WhitespaceFormatter;
import ru.nts.tools.sexp.core.forms.EditOperation;
import ru.nts.tools.sexp.core.forms.FormLocator;
import ru.nts.tools.sexp.core.forms.FormSelector;
import ru.nts.tools.sexp.core.forms.TopLevelForm;
import ru.nts.tools.sexp.core.reader.SexpReader;
import ru.nts.tools.sexp.core.reader.SourceTree;
import ru.nts.tools.sexp.core.view.CollapsedView;
import ru.nts.tools.sexp.core.view.CollapsedViewGenerator;
import ru.nts.tools.sexp.core.view.TextCollapsedView;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Точка входа в структурный редактор: чтение, свёрнутый вид, поиск и правка top-level форм и выражений.
 *
 * Все пути абсолютные; проверка доступа к путям выполняется выше.
 * Единственное изменяемое состояние (отметки о чтении) живёт в {@link FileTimestampTracker},
 * который можно передать снаружи, чтобы несколько редакторов разделяли одну сессию.
 */
public class SexpEditor {

    private final EditorConfig config;
    private final FileTimestampTracker guard;
    private final EditPipeline pipeline;

    public SexpEditor(EditorConfig config) {
        this(config, new FileTimestampTracker(config.writeGuard()), new ReaderLintChecker(),
                config.formatting() ? new WhitespaceFormatter() : CodeFormatter.NONE);
    }

    public SexpEditor(EditorConfig config, FileTimestampTracker guard, LintChecker linter, CodeFormatter formatter) {
        this.config = config;
        this.guard = guard;
        this.pipeline = new EditPipeline(config, guard, linter, formatter);
    }

    public EditorConfig getConfig() {
        return config;
    }

    public FileTimestampTracker getGuard() {
        return guard;
    }

    // ============ Чтение ============

    /**
     * Raw-чтение строк [offset, offset + limit). Успешное чтение считается полным наблюдением файла.
     *
     * @param limit null означает лимит из конфигурации
     */
    public FileRead readFile(Path path, int offset, Integer limit) throws IOException {
        if (offset < 0) {
            throw NtsParamException.invalid("offset", offset, "must not be negative");
        }
        int max = limit == null ? config.maxLines() : limit;
        if (max <= 0) {
            throw NtsParamException.invalid("limit", max, "must be positive");
        }
        EncodingUtils.TextFileContent source = readSource(path);
        List<String> lines = source.content().lines().toList();

        int from = Math.min(offset, lines.size());
        int to = (int) Math.min((long) from + max, lines.size());
        boolean linesTruncated = false;
        StringBuilder sb = new StringBuilder();
        for (int i = from; i < to; i++) {
            String line = lines.get(i);
            if (line.length() > config.maxLineLength()) {
                line = line.substring(0, config.maxLineLength()) + "...";
                linesTruncated = true;
            }
            if (i > from) {
                sb.append('\n');
            }
            sb.append(line);
        }
        guard.observeRead(path, ReadKind.FULL);
        return new FileRead(FileTimestampTracker.canonical(path), sb.toString(), from, to - from, lines.size(),
                to < lines.size(), linesTruncated, Files.size(path));
    }

    /**
     * Свёрнутый вид исходника. Засчитывается как наблюдение только в режиме partial-read.
     */
    public CollapsedView renderCollapsed(Path path, String namePattern, String contentPattern) throws IOException {
        SourceTree tree = parse(path);
        CollapsedView view = CollapsedViewGenerator.render(tree, namePattern, contentPattern);
        guard.observeRead(path, ReadKind.PARTIAL);
        EditorLog.log("[SexpEditor] collapsed %s: %s", path.getFileName(), view.stats());
        return view;
    }

    /**
     * Строки текстового файла, совпавшие с шаблоном, с контекстом.
     * Файл прочитан целиком, поэтому это полное наблюдение в любом режиме.
     */
    public TextCollapsedView.Result renderTextCollapsed(Path path, String pattern) throws IOException {
        EncodingUtils.TextFileContent source = readSource(path);
        TextCollapsedView.Result result = TextCollapsedView.render(source.content(), pattern);
        guard.observeRead(path, ReadKind.FULL);
        return result;
    }

    // ============ Формы ============

    /**
     * Единственная форма под селектор.
     *
     * @return пусто, если ни одна форма не подошла
     * @throws NtsMatchException FORM_AMBIGUOUS, если подошло несколько
     */
    public Optional<TopLevelForm> findForm(Path path, FormSelector selector) throws IOException {
        SourceTree tree = parse(path);
        List<TopLevelForm> matches = FormLocator.find(tree, selector);
        if (matches.size() > 1) {
            throw NtsMatchException.formAmbiguous(path, selector.toString(),
                    matches.stream().map(TopLevelForm::describe).toList());
        }
        return matches.stream().findFirst();
    }

    /**
     * Все top-level формы файла.
     */
    public List<TopLevelForm> listForms(Path path) throws IOException {
        return FormLocator.definitions(parse(path));
    }

    public EditResult replaceForm(Path path, FormSelector selector, String newContent) throws IOException {
        return editForm(path, selector, EditOperation.REPLACE, newContent, false);
    }

    public EditResult editForm(Path path, FormSelector selector, EditOperation operation, String newContent,
                               boolean dryRun) throws IOException {
        return pipeline.editForm(path, selector, operation, newContent, dryRun);
    }

    // ============ Выражения ============

    public EditResult replaceExpression(Path path, String matchForm, String newForm, EditOperation operation,
                                        boolean replaceAll, boolean dryRun) throws IOException {
        return pipeline.editExpression(path, matchForm, newForm, operation, replaceAll, dryRun);
    }

    private SourceTree parse(Path path) throws IOException {
        return SexpReader.parse(readSource(path).content());
    }

    private EncodingUtils.TextFileContent readSource(Path path) throws IOException {
        if (!path.isAbsolute()) {
            throw NtsParamException.invalid("path", path, "absolute path required");
        }
        if (!Files.isRegularFile(path)) {
            throw NtsFileException.notFound(path);
        }
        long size = Files.size(path);
        if (size > config.maxFileSize()) {
            throw NtsFileException.tooLarge(path, size, config.maxFileSize());
        }
        return EncodingUtils.readTextFile(path);
    }
}
