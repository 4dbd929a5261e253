package org.dxworks.codesync.mutation;

import org.dxworks.codesync.error.StructureException;

import java.util.Optional;
import java.util.function.Supplier;

/**
 * Outcome of a single edit. A failed edit carries the text it was given, unchanged.
 */
public final class EditResult {
    private final String text;
    private final StructureException failure;

    private EditResult(String text, StructureException failure) {
        this.text = text;
        this.failure = failure;
    }

    public static EditResult applied(String text) {
        return new EditResult(text, null);
    }

    public static EditResult failed(String originalText, StructureException failure) {
        return new EditResult(originalText, failure);
    }

    /**
     * Runs an edit against {@code originalText}; a {@link StructureException} becomes a failed result carrying the
     * original text. Other exceptions propagate.
     */
    public static EditResult attempt(String originalText, Supplier<String> edit) {
        try {
            return applied(edit.get());
        } catch (StructureException e) {
            return failed(originalText, e);
        }
    }

    public String getText() {
        return text;
    }

    public boolean isApplied() {
        return failure == null;
    }

    public Optional<StructureException> getFailure() {
        return Optional.ofNullable(failure);
    }
}
