package org.dxworks.codesync.change;

import org.dxworks.codesync.mutation.EditResult;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Result of applying a change request: the texts of all files after the applied edits and one entry per
 * attempted edit.
 */
public class ChangeOutcome {
    private final Map<String, String> originalTexts;
    private final Map<String, String> texts;
    private final List<AppliedEdit> edits;
    private final boolean stopped;

    ChangeOutcome(Map<String, String> originalTexts, Map<String, String> texts, List<AppliedEdit> edits,
                  boolean stopped) {
        this.originalTexts = originalTexts;
        this.texts = Collections.unmodifiableMap(new LinkedHashMap<>(texts));
        this.edits = Collections.unmodifiableList(new ArrayList<>(edits));
        this.stopped = stopped;
    }

    /** Every file of the input, with its text after the successful edits. */
    public Map<String, String> getTexts() {
        return texts;
    }

    /** Only the files whose text differs from the input. */
    public Map<String, String> getChangedTexts() {
        Map<String, String> changed = new LinkedHashMap<>();
        texts.forEach((file, text) -> {
            if (!Objects.equals(originalTexts.get(file), text)) {
                changed.put(file, text);
            }
        });
        return changed;
    }

    public List<AppliedEdit> getEdits() {
        return edits;
    }

    public long failureCount() {
        return edits.stream().filter(edit -> !edit.result.isApplied()).count();
    }

    public boolean isSuccessful() {
        return !stopped && failureCount() == 0;
    }

    /** True when a failure stopped processing before every edit was attempted. */
    public boolean isStopped() {
        return stopped;
    }

    public static class AppliedEdit {
        public final EditInstruction instruction;
        public final EditResult result;

        AppliedEdit(EditInstruction instruction, EditResult result) {
            this.instruction = instruction;
            this.result = result;
        }
    }
}
