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
package ru.nts.tools.sexp.core.edit;

import ru.nts.tools.sexp.core.DiffUtils;
import ru.nts.tools.sexp.core.EditorConfig;
import ru.nts.tools.sexp.core.EditorLog;
import ru.nts.tools.sexp.core.EncodingUtils;
import ru.nts.tools.sexp.core.FileTimestampTracker;
import ru.nts.tools.sexp.core.FileUtils;
import ru.nts.tools.sexp.core.NtsErrorCode;
import ru.nts.tools.sexp.core.NtsException;
import ru.nts.tools.sexp.core.NtsFileException;
import ru.nts.tools.sexp.core.NtsMatchException;
import ru.nts.tools.sexp.core.NtsParamException;
import ru.nts.tools.sexp.core.balance.DelimiterBalancer;
import ru.nts.tools.sexp.core.balance.Repair;
import ru.nts.tools.sexp.core.forms.EditOperation;
import ru.nts.tools.sexp.core.forms.EditTarget;
import ru.nts.tools.sexp.core.forms.ExpressionMatcher;
import ru.nts.tools.sexp.core.forms.FormLocator;
import ru.nts.tools.sexp.core.forms.FormSelector;
import ru.nts.tools.sexp.core.forms.Occurrence;
import ru.nts.tools.sexp.core.forms.TopLevelForm;
import ru.nts.tools.sexp.core.forms.TreeEditor;
import ru.nts.tools.sexp.core.reader.DelimiterException;
import ru.nts.tools.sexp.core.reader.SexpReader;
import ru.nts.tools.sexp.core.reader.SexpSyntaxException;
import ru.nts.tools.sexp.core.reader.SourceTree;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Конвейер структурной правки одного файла.
 *
 * VALIDATING → REPAIRING (только если во фрагменте не сбалансированы скобки) → VALIDATING →
 * LOCATING → MUTATING → RESERIALIZING → REFORMATTING → DONE.
 *
 * Любая ошибка прерывает конвейер и выходит наружу как {@link NtsException} с ключом "stage" в контексте.
 * Файл записывается только на стадии DONE, и только там обновляется отметка о чтении в {@link FileTimestampTracker}.
 */
public final class EditPipeline {

    static final String MULTIPLE_APPLIED = "Multiple occurrences matched; applied to %d of them.";

    private final EditorConfig config;
    private final FileTimestampTracker guard;
    private final LintChecker linter;
    private final CodeFormatter formatter;

    public EditPipeline(EditorConfig config, FileTimestampTracker guard, LintChecker linter, CodeFormatter formatter) {
        this.config = config;
        this.guard = guard;
        this.linter = linter;
        this.formatter = formatter;
    }

    /**
     * Выбор мест правки в разобранном файле.
     */
    @FunctionalInterface
    interface Locator {
        List<EditTarget> locate(SourceTree tree, Run run);
    }

    /**
     * Состояние одного прохода: текущая стадия, пройденные стадии, предупреждения.
     */
    static final class Run {
        final Path path;
        final List<EditStage> stages = new ArrayList<>();
        final List<String> warnings = new ArrayList<>();
        EditStage stage;

        Run(Path path) {
            this.path = path;
        }

        void enter(EditStage next) {
            stage = next;
            stages.add(next);
            EditorLog.log("[EditPipeline] %s: %s", path.getFileName(), next);
        }

        void warn(String warning) {
            warnings.add(warning);
            EditorLog.log("[EditPipeline] %s: %s", path.getFileName(), warning);
        }
    }

    /**
     * Замена top-level формы целиком или вставка нового кода рядом с ней.
     *
     * @param content новый код; пустая строка с REPLACE удаляет форму
     */
    public EditResult editForm(Path path, FormSelector selector, EditOperation operation, String content,
                               boolean dryRun) throws IOException {
        return run(path, operation, content, dryRun, (tree, run) -> {
            TopLevelForm form = FormLocator.require(tree, selector, path);
            return List.of(operation == EditOperation.INSERT_BEFORE ? FormLocator.withLeadingComments(form) : form.target());
        });
    }

    /**
     * Замена всех структурно равных вхождений фрагмента или вставка рядом с ними.
     *
     * @param matchForm  искомый фрагмент: одно или несколько полных выражений
     * @param content    новый код; пустая строка с REPLACE удаляет найденное
     * @param replaceAll применить ко всем вхождениям, иначе вхождение должно быть единственным
     */
    public EditResult editExpression(Path path, String matchForm, String content, EditOperation operation,
                                     boolean replaceAll, boolean dryRun) throws IOException {
        if (matchForm == null || matchForm.isBlank()) {
            throw NtsParamException.missing("match_form");
        }
        return run(path, operation, content, dryRun, (tree, run) -> {
            SourceTree fragment = parseMatch(matchForm);
            List<Occurrence> occurrences = ExpressionMatcher.findAll(tree, fragment);
            if (occurrences.isEmpty()) {
                throw NtsMatchException.expressionNotFound(path, matchForm);
            }
            List<String> locations = occurrences.stream().map(Occurrence::location).toList();
            if (occurrences.size() > 1 && !replaceAll) {
                throw NtsMatchException.expressionAmbiguous(path, matchForm, locations,
                        occurrences.size() + " occurrences found");
            }
            if (ExpressionMatcher.hasOverlaps(occurrences)) {
                throw NtsMatchException.expressionAmbiguous(path, matchForm, locations,
                        "occurrences overlap (one contains another)");
            }
            if (occurrences.size() > 1) {
                run.warn(String.format(MULTIPLE_APPLIED, occurrences.size()));
            }
            return occurrences.stream().map(Occurrence::target).toList();
        });
    }

    private EditResult run(Path path, EditOperation operation, String content, boolean dryRun, Locator locator)
            throws IOException {
        if (!path.isAbsolute()) {
            throw NtsParamException.invalid("path", path, "absolute path required");
        }
        String newContent = content == null ? "" : content;
        if (newContent.isBlank() && operation != EditOperation.REPLACE) {
            throw NtsParamException.invalid("new_content", "", operation.wireName() + " needs a non-empty fragment");
        }

        Run run = new Run(path);
        try {
            // VALIDATING: файл, отметка о чтении, фрагмент
            run.enter(EditStage.VALIDATING);
            if (!Files.isRegularFile(path)) {
                throw NtsFileException.notFound(path);
            }
            guard.requireWritable(path);
            long size = Files.size(path);
            if (size > config.maxFileSize()) {
                throw NtsFileException.tooLarge(path, size, config.maxFileSize());
            }
            EncodingUtils.TextFileContent source = EncodingUtils.readTextFile(path);
            String original = source.content();
            SourceTree tree = SexpReader.parse(original);
            SourceTree fragment = parseNewContent(newContent, run);

            run.enter(EditStage.LOCATING);
            List<EditTarget> targets = locator.locate(tree, run);

            run.enter(EditStage.MUTATING);
            TreeEditor.Result mutated = TreeEditor.apply(tree.root(), targets, operation, fragment);
            if (mutated.applied() != targets.size()) {
                throw inconsistency("located " + targets.size() + " target(s) but changed " + mutated.applied());
            }

            run.enter(EditStage.RESERIALIZING);
            String text = mutated.root().toSource();
            try {
                SexpReader.parse(text);
            } catch (SexpSyntaxException e) {
                throw inconsistency("reserialized text does not read back: " + e.getPosition() + " " + e.getDetail());
            }

            run.enter(EditStage.REFORMATTING);
            if (config.formatting()) {
                text = formatter.format(text);
            }
            LintReport lint = linter.lint(text);
            if (!lint.ok()) {
                throw inconsistency("lint failed after formatting: " + lint.report());
            }

            run.enter(EditStage.DONE);
            String diff = DiffUtils.unifiedDiff(path.getFileName().toString(), original, text, config.contextLines());
            boolean write = !dryRun && !text.equals(original);
            long crc = 0;
            if (write) {
                FileUtils.safeWrite(path, EncodingUtils.withOriginalBom(source, text), source.charset());
                guard.observe(path);
                crc = FileUtils.calculateCRC32(path);
                EditorLog.log("[EditPipeline] wrote %s (%d change(s), CRC32C %X)", path, mutated.applied(), crc);
            }
            return new EditResult(path, text, diff, run.warnings, run.stages, mutated.applied(), write, crc);
        } catch (NtsException e) {
            e.withContext("stage", run.stage);
            EditorLog.log("[EditPipeline] failed at %s: %s", run.stage, e.toLogMessage());
            throw e;
        }
    }

    /**
     * Разбор нового кода. Несбалансированные скобки чинятся балансировщиком, после чего текст разбирается заново.
     */
    private SourceTree parseNewContent(String content, Run run) {
        try {
            return SexpReader.parse(content);
        } catch (DelimiterException e) {
            run.enter(EditStage.REPAIRING);
            Repair repair = DelimiterBalancer.repair(content);
            run.warn("Repaired unbalanced delimiters in new content: " + repair.summary() + ".");
            run.enter(EditStage.VALIDATING);
            return SexpReader.parse(repair.text());
        }
    }

    private static SourceTree parseMatch(String matchForm) {
        try {
            return SexpReader.parseFragment(matchForm);
        } catch (SexpSyntaxException e) {
            e.withContext("param", "match_form");
            throw e;
        }
    }

    private static NtsException inconsistency(String detail) {
        return new NtsException(NtsErrorCode.POST_EDIT_INCONSISTENCY, Map.of("detail", detail));
    }
}
