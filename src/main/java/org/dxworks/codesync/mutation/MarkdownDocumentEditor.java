package org.dxworks.codesync.mutation;

import org.dxworks.codesync.DiagnosticSink;
import org.dxworks.codesync.analyzer.markdown.MarkdownStructureParser;
import org.dxworks.codesync.analyzer.markdown.TableExtractor;
import org.dxworks.codesync.error.TargetNotFoundException;
import org.dxworks.codesync.model.SourceLines;
import org.dxworks.codesync.model.StructureTree;
import org.dxworks.codesync.model.markdown.Section;
import org.dxworks.codesync.model.markdown.Table;
import org.dxworks.codesync.model.markdown.TableBlock;

import java.util.ArrayList;
import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Edits a Markdown document through its section tree: the tree is parsed, one field is changed and the whole tree
 * is written back with {@link MarkdownWriter}. Sections are found by title, first match in document order.
 */
public class MarkdownDocumentEditor {
    public static final String DEFAULT_SEPARATOR_CELL = "---";

    private final MarkdownStructureParser parser;
    private final TableExtractor tableExtractor;
    private final MarkdownWriter writer;
    private final String separatorCell;
    private final DiagnosticSink diagnostics;

    public MarkdownDocumentEditor() {
        this(DEFAULT_SEPARATOR_CELL, DiagnosticSink.NONE);
    }

    public MarkdownDocumentEditor(String separatorCell, DiagnosticSink diagnostics) {
        this(new MarkdownStructureParser(), new TableExtractor(), new MarkdownWriter(), separatorCell, diagnostics);
    }

    public MarkdownDocumentEditor(MarkdownStructureParser parser, TableExtractor tableExtractor,
                                  MarkdownWriter writer, String separatorCell, DiagnosticSink diagnostics) {
        this.parser = parser;
        this.tableExtractor = tableExtractor;
        this.writer = writer;
        this.separatorCell = separatorCell;
        this.diagnostics = diagnostics;
    }

    /**
     * Replaces the content of the section titled {@code title}. Its subsections are kept.
     */
    public String updateSectionContent(String text, String title, String newContent) {
        StructureTree<Section> tree = parser.parse(text);
        Section section = resolveSection(tree, title);
        section.content = normalizeContent(newContent);
        diagnostics.report("Updating content of section '" + title + "'");
        return writer.write(tree);
    }

    /**
     * Appends a new section as the last child of the section titled {@code parentTitle}, or of the document root
     * when {@code parentTitle} is null.
     */
    public String addSection(String text, String parentTitle, String title, String content, int level) {
        if (title == null || title.isBlank() || title.contains("\n") || title.contains("\r")) {
            throw new IllegalArgumentException("Section title must be a single non-blank line: " + title);
        }
        StructureTree<Section> tree = parser.parse(text);
        Section parent = parentTitle == null ? tree.root() : resolveSection(tree, parentTitle);
        if (level <= parent.level) {
            throw new IllegalArgumentException("Section level " + level + " must be greater than the level "
                    + parent.level + " of its parent");
        }
        tree.attach(parent, new Section(title.trim(), level, normalizeContent(content)));
        diagnostics.report("Adding section '" + title.trim() + "' under "
                + (parent.isRoot() ? "the document root" : "'" + parent.title + "'"));
        return writer.write(tree);
    }

    /**
     * Keeps the header of the {@code tableIndex}-th table of the section and replaces its body with {@code rows}.
     */
    public String replaceTable(String text, String sectionTitle, int tableIndex, List<List<String>> rows) {
        List<List<String>> body = copyRows(rows);
        return editTable(text, sectionTitle, tableIndex, table -> table.withBody(body));
    }

    public String appendTableRows(String text, String sectionTitle, int tableIndex, List<List<String>> rows) {
        List<List<String>> extra = copyRows(rows);
        return editTable(text, sectionTitle, tableIndex, table -> table.withAppendedRows(extra));
    }

    private String editTable(String text, String sectionTitle, int tableIndex, UnaryOperator<Table> change) {
        StructureTree<Section> tree = parser.parse(text);
        Section section = resolveSection(tree, sectionTitle);
        List<TableBlock> tables = tableExtractor.extract(section.content);
        if (tableIndex < 0 || tableIndex >= tables.size()) {
            throw new TargetNotFoundException("Table",
                    sectionTitle + "[" + tableIndex + "] (section has " + tables.size() + " tables)");
        }

        TableBlock block = tables.get(tableIndex);
        List<String> rendered = change.apply(block.table).render(separatorCell);
        SourceLines contentLines = SourceLines.of(section.content);
        section.content = String.join("\n",
                contentLines.splice(block.firstLine, block.lastLine + 1, rendered).lines());
        diagnostics.report("Rewriting table " + tableIndex + " of section '" + sectionTitle + "'");
        return writer.write(tree);
    }

    private Section resolveSection(StructureTree<Section> tree, String title) {
        return tree.firstMatch(section -> !section.isRoot() && section.title.equals(title))
                .orElseThrow(() -> new TargetNotFoundException("Section", title));
    }

    private static String normalizeContent(String content) {
        if (content == null) {
            return "";
        }
        return MarkdownStructureParser.joinTrimmed(SourceLines.of(content).lines());
    }

    private static List<List<String>> copyRows(List<List<String>> rows) {
        if (rows == null) {
            throw new IllegalArgumentException("Table rows must not be null");
        }
        List<List<String>> copy = new ArrayList<>();
        for (List<String> row : rows) {
            List<String> cells = new ArrayList<>();
            for (String cell : row) {
                cells.add(cell == null ? "" : cell.trim());
            }
            copy.add(cells);
        }
        return copy;
    }
}
