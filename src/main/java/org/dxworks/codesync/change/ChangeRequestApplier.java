package org.dxworks.codesync.change;

import org.dxworks.codesync.CodesyncConfig;
import org.dxworks.codesync.DiagnosticSink;
import org.dxworks.codesync.Language;
import org.dxworks.codesync.LanguageDetector;
import org.dxworks.codesync.analyzer.java.JavaStructureParser;
import org.dxworks.codesync.error.TargetNotFoundException;
import org.dxworks.codesync.mutation.EditResult;
import org.dxworks.codesync.mutation.JavaSourceEditor;
import org.dxworks.codesync.mutation.MarkdownDocumentEditor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Applies the edits of a {@link ChangeRequest} in order to in-memory file texts. Each edit sees the text left by
 * the previous edits of the same file. A failed edit leaves its file unchanged; with {@code failFast} the
 * remaining edits are not attempted.
 */
public class ChangeRequestApplier {
    private final JavaSourceEditor javaEditor;
    private final MarkdownDocumentEditor markdownEditor;
    private final boolean failFast;
    private final DiagnosticSink diagnostics;

    public ChangeRequestApplier(CodesyncConfig config, DiagnosticSink diagnostics) {
        this(new JavaSourceEditor(new JavaStructureParser(), diagnostics),
                new MarkdownDocumentEditor(config.getTableSeparatorCell(), diagnostics),
                config.isFailFast(),
                diagnostics);
    }

    public ChangeRequestApplier(JavaSourceEditor javaEditor, MarkdownDocumentEditor markdownEditor,
                                boolean failFast, DiagnosticSink diagnostics) {
        this.javaEditor = javaEditor;
        this.markdownEditor = markdownEditor;
        this.failFast = failFast;
        this.diagnostics = diagnostics;
    }

    /**
     * @param files file name to text; the names are the ones the edits refer to in {@code file}
     * @throws IllegalArgumentException when an edit is incomplete, e.g. it has no operation or a Markdown
     *                                  operation names a {@code .java} file
     */
    public ChangeOutcome apply(ChangeRequest request, Map<String, String> files) {
        Map<String, String> originals = new LinkedHashMap<>(files);
        Map<String, String> texts = new LinkedHashMap<>(files);
        List<ChangeOutcome.AppliedEdit> applied = new ArrayList<>();
        boolean stopped = false;

        diagnostics.report("Applying " + request.edits.size() + " edits for "
                + request.changeType.getValue() + " '" + request.featureName + "'");
        for (EditInstruction edit : request.edits) {
            validate(edit);
            String original = texts.get(edit.file);
            EditResult result;
            if (original == null) {
                result = EditResult.failed(null, new TargetNotFoundException("File", edit.file));
            } else {
                result = EditResult.attempt(original, () -> dispatch(edit, original));
                texts.put(edit.file, result.getText());
            }
            applied.add(new ChangeOutcome.AppliedEdit(edit, result));

            if (result.isApplied()) {
                diagnostics.report("  applied " + edit.describe());
            } else {
                diagnostics.report("  failed " + edit.describe() + ": "
                        + result.getFailure().map(Throwable::getMessage).orElse(""));
                if (failFast) {
                    stopped = applied.size() < request.edits.size();
                    break;
                }
            }
        }
        return new ChangeOutcome(originals, texts, applied, stopped);
    }

    private String dispatch(EditInstruction edit, String text) {
        switch (edit.operation) {
            case INSERT_MEMBER:
                return javaEditor.insertMember(text, edit.kind, edit.code, edit.target);
            case REPLACE_MEMBER:
                return javaEditor.replaceMember(text, edit.code, edit.target);
            case INSERT_IMPORT:
                return javaEditor.insertImport(text, edit.code);
            case INSERT_ANNOTATION:
                return javaEditor.insertAnnotation(text, edit.code, edit.target);
            case REPLACE_DOC_COMMENT:
                return javaEditor.replaceDocComment(text, edit.code, edit.target);
            case UPDATE_SECTION:
                return markdownEditor.updateSectionContent(text, edit.title, edit.content);
            case ADD_SECTION:
                return markdownEditor.addSection(text, edit.parent, edit.title, edit.content,
                        required(edit.level, "level", edit));
            case REPLACE_TABLE:
                return markdownEditor.replaceTable(text, edit.title,
                        required(edit.tableIndex, "table_index", edit), edit.rows);
            case APPEND_TABLE_ROWS:
                return markdownEditor.appendTableRows(text, edit.title,
                        required(edit.tableIndex, "table_index", edit), edit.rows);
            default:
                throw new IllegalArgumentException("Unsupported operation: " + edit.operation);
        }
    }

    private static void validate(EditInstruction edit) {
        if (edit == null || edit.operation == null) {
            throw new IllegalArgumentException("Edit without operation");
        }
        if (edit.file == null || edit.file.isBlank()) {
            throw new IllegalArgumentException("Edit without file: " + edit.describe());
        }
        Optional<Language> language = LanguageDetector.detectLanguage(edit.file);
        if (language.isPresent() && language.get() != edit.operation.getLanguage()) {
            throw new IllegalArgumentException("Operation " + edit.describe() + " cannot edit a "
                    + language.get().getName() + " file");
        }
    }

    private static int required(Integer value, String field, EditInstruction edit) {
        if (value == null) {
            throw new IllegalArgumentException("Missing " + field + " for " + edit.describe());
        }
        return value;
    }
}
