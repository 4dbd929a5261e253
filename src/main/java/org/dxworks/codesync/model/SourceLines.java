package org.dxworks.codesync.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Immutable list of text lines that remembers each line's terminator, so that splicing a range and joining the
 * lines back reproduces every untouched byte. New lines get the first terminator seen in the text ({@code \n} when
 * the text has none).
 */
public final class SourceLines {
    private final List<String> lines;
    private final List<String> terminators;
    private final String newline;

    private SourceLines(List<String> lines, List<String> terminators, String newline) {
        this.lines = lines;
        this.terminators = terminators;
        this.newline = newline;
    }

    public static SourceLines of(String text) {
        List<String> lines = new ArrayList<>();
        List<String> terminators = new ArrayList<>();
        String newline = null;
        int start = 0;
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c == '\n' || (c == '\r' && i + 1 < text.length() && text.charAt(i + 1) == '\n')) {
                String terminator = c == '\n' ? "\n" : "\r\n";
                lines.add(text.substring(start, i));
                terminators.add(terminator);
                if (newline == null) {
                    newline = terminator;
                }
                i += terminator.length();
                start = i;
            } else {
                i++;
            }
        }
        if (start < text.length()) {
            lines.add(text.substring(start));
            terminators.add("");
        }
        return new SourceLines(lines, terminators, newline == null ? "\n" : newline);
    }

    public List<String> lines() {
        return Collections.unmodifiableList(lines);
    }

    public int size() {
        return lines.size();
    }

    /** Line by 0-based index, without terminator. */
    public String get(int index) {
        return lines.get(index);
    }

    public String newline() {
        return newline;
    }

    /**
     * Replaces the lines {@code [from, to)} (0-based) with {@code replacement}. With {@code from == to} this is a
     * pure insertion before line {@code from}.
     */
    public SourceLines splice(int from, int to, List<String> replacement) {
        if (from < 0 || to < from || to > lines.size()) {
            throw new IndexOutOfBoundsException("Invalid line range [" + from + ", " + to + ") of " + lines.size());
        }
        List<String> newLines = new ArrayList<>(lines.subList(0, from));
        List<String> newTerminators = new ArrayList<>(terminators.subList(0, from));
        newLines.addAll(replacement);
        for (int i = 0; i < replacement.size(); i++) {
            newTerminators.add(newline);
        }
        newLines.addAll(lines.subList(to, lines.size()));
        newTerminators.addAll(terminators.subList(to, terminators.size()));

        // the text's trailing terminator (or lack of one) stays with the last line
        if (to == lines.size() && !newLines.isEmpty()) {
            String originalLast = terminators.isEmpty() ? newline : terminators.get(terminators.size() - 1);
            for (int i = 0; i < newTerminators.size() - 1; i++) {
                if (newTerminators.get(i).isEmpty()) {
                    newTerminators.set(i, newline);
                }
            }
            newTerminators.set(newTerminators.size() - 1, originalLast);
        }
        return new SourceLines(newLines, newTerminators, newline);
    }

    public SourceLines insert(int before, List<String> inserted) {
        return splice(before, before, inserted);
    }

    public String text() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < lines.size(); i++) {
            sb.append(lines.get(i));
            String terminator = terminators.get(i);
            if (terminator.isEmpty() && i < lines.size() - 1) {
                terminator = newline;
            }
            sb.append(terminator);
        }
        return sb.toString();
    }
}
