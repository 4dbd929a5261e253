package org.dxworks.codesync.mutation;

import org.dxworks.codesync.DiagnosticSink;
import org.dxworks.codesync.analyzer.java.JavaStructureParser;
import org.dxworks.codesync.error.PositionUnresolvedException;
import org.dxworks.codesync.error.TargetNotFoundException;
import org.dxworks.codesync.model.Element;
import org.dxworks.codesync.model.ElementKind;
import org.dxworks.codesync.model.ElementSelector;
import org.dxworks.codesync.model.SourceLines;
import org.dxworks.codesync.model.StructureTree;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Line-splice edits on Java source. Each operation parses the text, resolves its target with
 * {@link ElementSelector} and replaces or inserts whole lines; every line outside the edited range is returned
 * byte for byte, including its line terminator.
 */
public class JavaSourceEditor {
    private static final Pattern PACKAGE_LINE = Pattern.compile("^\\s*package\\s+[\\w.]+\\s*;");
    private static final Pattern IMPORT_LINE = Pattern.compile("^\\s*import\\s+(static\\s+)?[\\w.]+(\\.\\*)?\\s*;");
    private static final Pattern ANNOTATION_LINE = Pattern.compile("^\\s*@");
    private static final String BOM = "\uFEFF";
    private static final Pattern LEADING_WHITESPACE = Pattern.compile("^\\s*");

    private final JavaStructureParser parser;
    private final DiagnosticSink diagnostics;

    public JavaSourceEditor() {
        this(new JavaStructureParser(), DiagnosticSink.NONE);
    }

    public JavaSourceEditor(JavaStructureParser parser, DiagnosticSink diagnostics) {
        this.parser = parser;
        this.diagnostics = diagnostics;
    }

    /**
     * Inserts {@code code} right before the closing brace line of the type at {@code typePath}, with exactly one
     * blank line above and below the inserted block.
     */
    public String insertMember(String text, MemberKind kind, String code, String typePath) {
        List<String> codeLines = fragmentLines(code, "member code");
        StructureTree<Element> tree = parser.parse(text);
        Element type = ElementSelector.resolve(tree, typePath)
                .filter(e -> e.kind.isType())
                .orElseThrow(() -> new TargetNotFoundException("Type", typePath));
        if (!type.hasResolvedEnd()) {
            throw new PositionUnresolvedException("Closing brace of " + typePath + " could not be located");
        }
        if (type.endLine == type.startLine) {
            throw new PositionUnresolvedException(
                    "Closing brace of " + typePath + " is on its declaration line " + type.startLine);
        }

        SourceLines lines = SourceLines.of(text);
        int closing = type.endLine - 1;
        int from = closing;
        while (from - 1 > type.startLine - 1 && lines.get(from - 1).isBlank()) {
            from--;
        }

        List<String> replacement = new ArrayList<>();
        replacement.add("");
        replacement.addAll(codeLines);
        replacement.add("");
        diagnostics.report("Inserting " + kindName(kind) + " into " + typePath + " before line " + type.endLine);
        return lines.splice(from, closing, replacement).text();
    }

    /**
     * Replaces the lines {@code [startLine, endLine]} of the method, constructor or field at {@code memberPath}.
     * Annotations and doc comment above the declaration line are kept.
     */
    public String replaceMember(String text, String code, String memberPath) {
        List<String> codeLines = fragmentLines(code, "member code");
        StructureTree<Element> tree = parser.parse(text);
        Element member = ElementSelector.resolve(tree, memberPath)
                .filter(JavaSourceEditor::isReplaceable)
                .orElseThrow(() -> new TargetNotFoundException("Member", memberPath));
        if (!member.hasResolvedEnd()) {
            throw new PositionUnresolvedException("End of " + memberPath + " could not be located");
        }

        diagnostics.report("Replacing " + memberPath + " at lines " + member.startLine + "-" + member.endLine);
        return SourceLines.of(text).splice(member.startLine - 1, member.endLine, codeLines).text();
    }

    /**
     * Adds an import after the last import line, else after the package line (separated by one blank line), else
     * as the first line. Accepts {@code import a.B;} as well as a bare {@code a.B}. Importing something already
     * imported returns the text unchanged.
     */
    public String insertImport(String text, String statement) {
        String importLine = normalizeImport(statement);
        String bom = text.startsWith(BOM) ? BOM : "";
        SourceLines lines = SourceLines.of(text.substring(bom.length()));

        int lastImport = -1;
        int packageLine = -1;
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            if (IMPORT_LINE.matcher(line).find()) {
                if (line.trim().equals(importLine)) {
                    diagnostics.report("Import already present: " + importLine);
                    return text;
                }
                lastImport = i;
            } else if (packageLine < 0 && PACKAGE_LINE.matcher(line).find()) {
                packageLine = i;
            }
        }

        if (lastImport >= 0) {
            return bom + lines.insert(lastImport + 1, List.of(importLine)).text();
        }
        if (packageLine >= 0) {
            return bom + lines.insert(packageLine + 1, List.of("", importLine)).text();
        }
        return bom + lines.insert(0, List.of(importLine)).text();
    }

    /**
     * Inserts {@code annotation} above the run of annotation lines and Javadoc block directly preceding the
     * declaration at {@code path}, or directly above the declaration when there is no such run. A plain block
     * comment ends the run.
     */
    public String insertAnnotation(String text, String annotation, String path) {
        List<String> annotationLines = fragmentLines(annotation, "annotation");
        StructureTree<Element> tree = parser.parse(text);
        Element element = resolveDeclaration(tree, path);
        SourceLines lines = SourceLines.of(text);

        int at = runStart(lines, element.startLine - 1, ANNOTATION_LINE);
        if (hasJavadoc(element) && element.docCommentEndLine == at) {
            at = runStart(lines, element.docCommentStartLine - 1, ANNOTATION_LINE);
        }
        String indent = indentationOf(lines.get(element.startLine - 1));
        diagnostics.report("Annotating " + path + " at line " + (at + 1));
        return lines.insert(at, indented(annotationLines, indent)).text();
    }

    /**
     * Replaces the Javadoc block attached to the declaration at {@code path}; when there is none the comment is
     * inserted above the declaration's annotations.
     */
    public String replaceDocComment(String text, String comment, String path) {
        List<String> commentLines = fragmentLines(comment, "doc comment");
        StructureTree<Element> tree = parser.parse(text);
        Element element = resolveDeclaration(tree, path);
        SourceLines lines = SourceLines.of(text);
        String indent = indentationOf(lines.get(element.startLine - 1));

        if (hasJavadoc(element)) {
            diagnostics.report("Replacing doc comment of " + path + " at lines "
                    + element.docCommentStartLine + "-" + element.docCommentEndLine);
            return lines.splice(element.docCommentStartLine - 1, element.docCommentEndLine,
                    indented(commentLines, indent)).text();
        }

        int at = runStart(lines, element.startLine - 1, ANNOTATION_LINE);
        diagnostics.report("Adding doc comment to " + path + " at line " + (at + 1));
        return lines.insert(at, indented(commentLines, indent)).text();
    }

    private static boolean isReplaceable(Element element) {
        return element.kind == ElementKind.METHOD
                || element.kind == ElementKind.CONSTRUCTOR
                || element.kind == ElementKind.FIELD;
    }

    private static boolean hasJavadoc(Element element) {
        return element.docComment != null && element.docComment.trim().startsWith("/**");
    }

    private Element resolveDeclaration(StructureTree<Element> tree, String path) {
        return ElementSelector.resolve(tree, path)
                .filter(e -> e.kind != ElementKind.PACKAGE)
                .orElseThrow(() -> new TargetNotFoundException("Declaration", path));
    }

    /**
     * Index of the first line of the contiguous run of lines matching {@code pattern} that ends right above
     * {@code declarationIndex}; the declaration index itself when the line above does not match.
     */
    private static int runStart(SourceLines lines, int declarationIndex, Pattern pattern) {
        int i = declarationIndex;
        while (i > 0 && pattern.matcher(lines.get(i - 1)).find()) {
            i--;
        }
        return i;
    }

    private static List<String> fragmentLines(String fragment, String what) {
        if (fragment == null || fragment.isBlank()) {
            throw new IllegalArgumentException("The " + what + " must not be blank");
        }
        List<String> all = SourceLines.of(fragment).lines();
        int from = 0;
        int to = all.size();
        while (from < to && all.get(from).isBlank()) from++;
        while (to > from && all.get(to - 1).isBlank()) to--;
        return new ArrayList<>(all.subList(from, to));
    }

    private static List<String> indented(List<String> fragment, String indent) {
        if (fragment.isEmpty() || indent.isEmpty() || !indentationOf(fragment.get(0)).isEmpty()) {
            return fragment;
        }
        List<String> result = new ArrayList<>();
        for (String line : fragment) {
            result.add(line.isEmpty() ? line : indent + line);
        }
        return result;
    }

    private static String indentationOf(String line) {
        Matcher matcher = LEADING_WHITESPACE.matcher(line);
        return matcher.find() ? matcher.group() : "";
    }

    private static String normalizeImport(String statement) {
        if (statement == null || statement.isBlank()) {
            throw new IllegalArgumentException("The import statement must not be blank");
        }
        String importLine = statement.trim();
        if (!importLine.startsWith("import ")) {
            importLine = "import " + importLine;
        }
        if (!importLine.endsWith(";")) {
            importLine = importLine + ";";
        }
        return importLine;
    }

    private static String kindName(MemberKind kind) {
        return kind == null ? "member" : kind.name().toLowerCase();
    }
}
