package org.dxworks.codesync.analyzer;

import java.util.List;
import java.util.OptionalInt;
import java.util.function.IntPredicate;

/**
 * Scans lines forward from a starting line until a structure closes. The same scan finds the closing brace of a
 * Java declaration, the terminating semicolon of a field and the last line of a Markdown section; only the
 * {@link ClosureRule} differs.
 */
public final class ClosureScanner {

    public enum Verdict {
        /** Structure still open after this line. */
        CONTINUE,
        /** This line is the last line of the structure. */
        CLOSES_HERE,
        /** This line belongs to the next structure; the previous line was the last one. */
        CLOSES_BEFORE
    }

    @FunctionalInterface
    public interface ClosureRule {
        Verdict inspect(int index, String line);
    }

    private ClosureScanner() {
    }

    /**
     * @param lines       lines without terminators
     * @param fromIndex   0-based index of the first line to inspect
     * @param rule        rule deciding where the structure closes; rules may be stateful, use a fresh one per scan
     * @param closesAtEnd whether running out of lines closes the structure on the last line
     * @return 0-based index of the closing line, or empty when the structure never closes
     */
    public static OptionalInt findClosingLine(List<String> lines, int fromIndex, ClosureRule rule, boolean closesAtEnd) {
        for (int i = Math.max(0, fromIndex); i < lines.size(); i++) {
            Verdict verdict = rule.inspect(i, lines.get(i));
            if (verdict == Verdict.CLOSES_HERE) {
                return OptionalInt.of(i);
            }
            if (verdict == Verdict.CLOSES_BEFORE) {
                return OptionalInt.of(i - 1);
            }
        }
        if (closesAtEnd && !lines.isEmpty()) {
            return OptionalInt.of(lines.size() - 1);
        }
        return OptionalInt.empty();
    }

    /**
     * Counts opening and closing braces from the first opening brace on, closing on the first line where the running
     * balance returns to zero. Braces inside string literals and comments are counted like any other brace.
     */
    public static ClosureRule braceBalance() {
        return new ClosureRule() {
            private boolean opened;
            private int balance;

            @Override
            public Verdict inspect(int index, String line) {
                int from = 0;
                if (!opened) {
                    from = line.indexOf('{');
                    if (from < 0) {
                        return Verdict.CONTINUE;
                    }
                    opened = true;
                }
                for (int i = from; i < line.length(); i++) {
                    char c = line.charAt(i);
                    if (c == '{') {
                        balance++;
                    } else if (c == '}') {
                        balance--;
                    }
                }
                return balance <= 0 ? Verdict.CLOSES_HERE : Verdict.CONTINUE;
            }
        };
    }

    public static ClosureRule firstLineContaining(char terminator) {
        return (index, line) -> line.indexOf(terminator) >= 0 ? Verdict.CLOSES_HERE : Verdict.CONTINUE;
    }

    /**
     * Closes before the first line accepted by {@code boundary}, e.g. the next heading of the same or higher rank.
     */
    public static ClosureRule nextBoundary(IntPredicate boundary) {
        return (index, line) -> boundary.test(index) ? Verdict.CLOSES_BEFORE : Verdict.CONTINUE;
    }
}
