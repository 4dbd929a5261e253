package org.dxworks.codesync.change;

import org.dxworks.codesync.DiagnosticSink;
import org.dxworks.codesync.Language;
import org.dxworks.codesync.LanguageDetector;
import org.dxworks.codesync.analyzer.markdown.MarkdownStructureParser;
import org.dxworks.codesync.model.StructureTree;
import org.dxworks.codesync.model.markdown.Section;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Finds design documents and sections in them: Markdown files under a folder that contain a section with a given
 * title, and sections whose title matches a regular expression.
 */
public class DesignDocFinder {
    private final MarkdownStructureParser parser;
    private final DiagnosticSink diagnostics;

    public DesignDocFinder(DiagnosticSink diagnostics) {
        this(new MarkdownStructureParser(), diagnostics);
    }

    public DesignDocFinder(MarkdownStructureParser parser, DiagnosticSink diagnostics) {
        this.parser = parser;
        this.diagnostics = diagnostics;
    }

    /**
     * Paths, relative to {@code docRoot} and with {@code /} separators, of the Markdown files that contain a
     * section titled exactly {@code sectionTitle}. Sorted by path.
     */
    public List<String> findDocFiles(Path docRoot, String sectionTitle) throws IOException {
        if (!Files.isDirectory(docRoot)) {
            return List.of();
        }
        List<Path> markdownFiles;
        try (Stream<Path> paths = Files.walk(docRoot)) {
            markdownFiles = paths.filter(Files::isRegularFile)
                    .filter(path -> LanguageDetector.detectLanguage(path).orElse(null) == Language.MARKDOWN)
                    .sorted()
                    .collect(Collectors.toList());
        }

        List<String> result = new ArrayList<>();
        for (Path file : markdownFiles) {
            String text;
            try {
                text = Files.readString(file, StandardCharsets.UTF_8);
            } catch (IOException e) {
                diagnostics.report("Skipping unreadable document " + file + ": " + e.getMessage());
                continue;
            }
            StructureTree<Section> tree = parser.parse(text);
            if (tree.firstMatch(s -> !s.isRoot() && s.title.equals(sectionTitle)).isPresent()) {
                result.add(relativeName(docRoot, file));
            }
        }
        return result;
    }

    /**
     * Sections, in document order, whose title contains a match of {@code regex}.
     *
     * @throws java.util.regex.PatternSyntaxException if {@code regex} is not a valid expression
     */
    public static List<Section> findSectionsByPattern(StructureTree<Section> tree, String regex) {
        Pattern pattern = Pattern.compile(regex);
        return tree.findAll(s -> !s.isRoot() && pattern.matcher(s.title).find());
    }

    static String relativeName(Path root, Path file) {
        return root.relativize(file).toString().replace(file.getFileSystem().getSeparator(), "/");
    }
}
