package org.dxworks.codesync.change;

import org.dxworks.codesync.CodesyncConfig;
import org.dxworks.codesync.DiagnosticSink;
import org.dxworks.codesync.TestUtils;
import org.dxworks.codesync.error.TargetNotFoundException;
import org.dxworks.codesync.mutation.MemberKind;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class ChangeRequestApplierTest {
    private static final String SERVICE = "src/OrderService.java";
    private static final String DESIGN = "docs/design.md";

    private Map<String, String> files() {
        Map<String, String> files = new LinkedHashMap<>();
        files.put(SERVICE, TestUtils.readSample("java/OrderService.java"));
        files.put(DESIGN, TestUtils.readSample("markdown/DesignDoc.md"));
        return files;
    }

    @Test
    void apply_edits_in_order_and_record_failures() throws IOException {
        ChangeRequest request = new ChangeRequestReader()
                .read(Paths.get("src/test/resources/samples/change/add_cancel_feature.yml"));
        List<String> messages = new ArrayList<>();
        ChangeRequestApplier applier = new ChangeRequestApplier(CodesyncConfig.defaults(), messages::add);

        ChangeOutcome outcome = applier.apply(request, files());

        assertEquals(4, outcome.getEdits().size());
        assertEquals(1, outcome.failureCount());
        assertFalse(outcome.isStopped());
        assertFalse(outcome.isSuccessful());
        assertTrue(outcome.getEdits().get(3).result.getFailure().orElseThrow() instanceof TargetNotFoundException);

        String service = outcome.getTexts().get(SERVICE);
        assertTrue(service.contains("import java.util.List;\nimport java.util.Optional;\n"));
        assertTrue(service.contains("\npublic boolean cancel(String order) {\n    return orders.remove(order);\n}\n\n}\n"));
        assertTrue(outcome.getTexts().get(DESIGN)
                .contains("| OrderRepository | Persists orders |\n| CancellationPolicy | Decides whether an order can be cancelled |\n"));
        assertEquals(2, outcome.getChangedTexts().size());
        assertTrue(messages.stream().anyMatch(m -> m.contains("failed update_section")));
    }

    @Test
    void failed_edit_leaves_the_file_unchanged() {
        ChangeRequest request = new ChangeRequest();
        request.edits.add(edit(EditOperation.REPLACE_MEMBER, SERVICE, "OrderService.missing", "void x() {}"));

        ChangeOutcome outcome = new ChangeRequestApplier(CodesyncConfig.defaults(), DiagnosticSink.NONE)
                .apply(request, files());

        assertEquals(files().get(SERVICE), outcome.getEdits().get(0).result.getText());
        assertTrue(outcome.getChangedTexts().isEmpty());
    }

    @Test
    void fail_fast_stops_at_first_failure() {
        ChangeRequest request = new ChangeRequest();
        request.edits.add(edit(EditOperation.INSERT_MEMBER, SERVICE, "Missing", "int x;"));
        request.edits.add(edit(EditOperation.INSERT_IMPORT, SERVICE, null, "java.util.Map"));

        ChangeOutcome outcome = new ChangeRequestApplier(CodesyncConfig.with(100, "---", true), DiagnosticSink.NONE)
                .apply(request, files());

        assertTrue(outcome.isStopped());
        assertEquals(1, outcome.getEdits().size());
        assertTrue(outcome.getChangedTexts().isEmpty());
    }

    @Test
    void later_edits_see_earlier_results() {
        ChangeRequest request = new ChangeRequest();
        request.edits.add(edit(EditOperation.INSERT_MEMBER, SERVICE, "OrderService", "    void reopen() {\n    }"));
        request.edits.add(edit(EditOperation.INSERT_ANNOTATION, SERVICE, "OrderService.reopen", "@Internal"));

        ChangeOutcome outcome = new ChangeRequestApplier(CodesyncConfig.defaults(), DiagnosticSink.NONE)
                .apply(request, files());

        assertTrue(outcome.isSuccessful());
        assertTrue(outcome.getTexts().get(SERVICE).contains("    @Internal\n    void reopen() {\n    }\n"));
    }

    @Test
    void edit_of_unknown_file_fails_with_target_not_found() {
        ChangeRequest request = new ChangeRequest();
        EditInstruction addSection = new EditInstruction();
        addSection.operation = EditOperation.ADD_SECTION;
        addSection.file = "docs/missing.md";
        addSection.title = "New";
        addSection.level = 1;
        request.edits.add(addSection);

        ChangeOutcome outcome = new ChangeRequestApplier(CodesyncConfig.defaults(), DiagnosticSink.NONE)
                .apply(request, files());

        assertTrue(outcome.getEdits().get(0).result.getFailure().orElseThrow() instanceof TargetNotFoundException);
        assertFalse(outcome.getTexts().containsKey("docs/missing.md"));
    }

    @Test
    void incomplete_edits_are_rejected() {
        ChangeRequestApplier applier = new ChangeRequestApplier(CodesyncConfig.defaults(), DiagnosticSink.NONE);

        ChangeRequest wrongFile = new ChangeRequest();
        wrongFile.edits.add(edit(EditOperation.UPDATE_SECTION, SERVICE, null, null));
        assertThrows(IllegalArgumentException.class, () -> applier.apply(wrongFile, files()));

        ChangeRequest missingIndex = new ChangeRequest();
        EditInstruction append = new EditInstruction();
        append.operation = EditOperation.APPEND_TABLE_ROWS;
        append.file = DESIGN;
        append.title = "Components";
        missingIndex.edits.add(append);
        assertThrows(IllegalArgumentException.class, () -> applier.apply(missingIndex, files()));
    }

    private static EditInstruction edit(EditOperation operation, String file, String target, String code) {
        EditInstruction edit = new EditInstruction();
        edit.operation = operation;
        edit.file = file;
        edit.target = target;
        edit.code = code;
        edit.kind = operation == EditOperation.INSERT_MEMBER ? MemberKind.METHOD : null;
        return edit;
    }
}
