package org.dxworks.codesync.analyzer.markdown;

import org.commonmark.ext.front.matter.YamlFrontMatterExtension;
import org.commonmark.ext.front.matter.YamlFrontMatterVisitor;
import org.commonmark.node.Node;
import org.commonmark.parser.Parser;
import org.dxworks.codesync.analyzer.ClosureScanner;
import org.dxworks.codesync.analyzer.StructureParser;
import org.dxworks.codesync.model.SourceLines;
import org.dxworks.codesync.model.StructureTree;
import org.dxworks.codesync.model.markdown.Section;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits a Markdown document into a section tree. Every line of the shape {@code #... title} is a heading, whatever
 * block it sits in, and its level is the number of {@code #}. Everything between two headings is the content of the
 * first one. commonmark only reads the YAML front matter into the root metadata.
 */
public class MarkdownStructureParser implements StructureParser<Section> {
    public static final String FRONT_MATTER_KEY = "frontMatter";

    private static final Pattern HEADING_LINE = Pattern.compile("^(#+)\\s+(.+)$");

    private final Parser parser;

    public MarkdownStructureParser() {
        this.parser = Parser.builder()
                .extensions(List.of(YamlFrontMatterExtension.create()))
                .build();
    }

    @Override
    public StructureTree<Section> parse(String text) {
        List<String> lines = SourceLines.of(text).lines();
        Map<Integer, Section> headings = collectHeadings(lines);

        Section root = Section.root();
        root.startLine = 1;
        root.endLine = Math.max(1, lines.size());
        readFrontMatter(parser.parse(text), root);
        StructureTree<Section> tree = new StructureTree<>(root);

        Deque<Section> open = new ArrayDeque<>();
        open.push(root);
        Map<Section, List<String>> contentLines = new IdentityHashMap<>();
        contentLines.put(root, new ArrayList<>());

        for (int i = 0; i < lines.size(); i++) {
            Section heading = headings.get(i);
            if (heading == null) {
                contentLines.get(open.peek()).add(lines.get(i));
                continue;
            }
            while (open.size() > 1 && open.peek().level >= heading.level) {
                open.pop();
            }
            tree.attach(open.peek(), heading);
            open.push(heading);
            contentLines.put(heading, new ArrayList<>());
            heading.startLine = i + 1;
            heading.endLine = sectionEnd(lines, i, heading.level, headings) + 1;
        }

        for (Map.Entry<Section, List<String>> entry : contentLines.entrySet()) {
            entry.getKey().content = joinTrimmed(entry.getValue());
        }
        return tree;
    }

    /**
     * Trims leading and trailing blank lines and joins the rest with {@code \n}.
     */
    public static String joinTrimmed(List<String> lines) {
        int from = 0;
        int to = lines.size();
        while (from < to && lines.get(from).isBlank()) from++;
        while (to > from && lines.get(to - 1).isBlank()) to--;
        return String.join("\n", lines.subList(from, to));
    }

    private Map<Integer, Section> collectHeadings(List<String> lines) {
        Map<Integer, Section> headings = new HashMap<>();
        for (int i = 0; i < lines.size(); i++) {
            Matcher matcher = HEADING_LINE.matcher(lines.get(i));
            if (matcher.matches() && !matcher.group(2).isBlank()) {
                headings.put(i, new Section(matcher.group(2).trim(), matcher.group(1).length(), ""));
            }
        }
        return headings;
    }

    private int sectionEnd(List<String> lines, int headingIndex, int level, Map<Integer, Section> headings) {
        ClosureScanner.ClosureRule nextPeer = ClosureScanner.nextBoundary(index -> {
            Section next = headings.get(index);
            return next != null && next.level <= level;
        });
        return ClosureScanner.findClosingLine(lines, headingIndex + 1, nextPeer, true).orElse(headingIndex);
    }

    private void readFrontMatter(Node document, Section root) {
        YamlFrontMatterVisitor visitor = new YamlFrontMatterVisitor();
        document.accept(visitor);
        Map<String, List<String>> data = visitor.getData();
        if (data != null && !data.isEmpty()) {
            root.metadata.put(FRONT_MATTER_KEY, new LinkedHashMap<>(data));
        }
    }
}
