package org.dxworks.codesync.change;

import org.dxworks.codesync.CodesyncConfig;
import org.dxworks.codesync.DiagnosticSink;
import org.dxworks.codesync.analyzer.java.JavaStructureParser;
import org.dxworks.codesync.error.StructureException;
import org.dxworks.codesync.model.Element;
import org.dxworks.codesync.mutation.MarkdownWriter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Produces the test specification and the deployment guide of a change request. Affected components are looked
 * up as Java files under the source root and their methods, after the edits, feed the test cases. Design documents
 * that contain one of the named sections count as affected files.
 */
public class ChangeReportGenerator {
    public static final String TEST_SPEC_SUFFIX = "_test_spec.md";
    public static final String DEPLOYMENT_GUIDE_SUFFIX = "_deployment_guide.md";

    private final JavaStructureParser javaParser;
    private final DesignDocFinder docFinder;
    private final TestCaseGenerator testCaseGenerator;
    private final DeploymentGuideGenerator deploymentGuideGenerator;
    private final MarkdownWriter writer;
    private final String separatorCell;
    private final DiagnosticSink diagnostics;

    public ChangeReportGenerator(CodesyncConfig config, DiagnosticSink diagnostics) {
        this.javaParser = new JavaStructureParser();
        this.docFinder = new DesignDocFinder(diagnostics);
        this.testCaseGenerator = new TestCaseGenerator();
        this.writer = new MarkdownWriter();
        this.deploymentGuideGenerator = new DeploymentGuideGenerator(writer);
        this.separatorCell = config.getTableSeparatorCell();
        this.diagnostics = diagnostics;
    }

    /**
     * Report file names mapped to their Markdown text.
     *
     * @param changedTexts texts of the files the change request edited, keyed by their path relative to
     *                     {@code sourceRoot}; a component found among them is read from here instead of the disk
     */
    public Map<String, String> generate(ChangeRequest request, Path sourceRoot, Map<String, String> changedTexts,
                                        LocalDate date) throws IOException {
        Set<String> affectedFiles = new LinkedHashSet<>();
        List<Element> elements = new ArrayList<>();
        for (String component : request.affectedComponents) {
            if (component == null || component.isBlank()) {
                continue;
            }
            Optional<Path> source = locateComponent(sourceRoot, component.trim());
            if (source.isEmpty()) {
                diagnostics.report("Component not found: " + component);
                continue;
            }
            String name = DesignDocFinder.relativeName(sourceRoot, source.get());
            affectedFiles.add(name);
            String text = changedTexts.containsKey(name)
                    ? changedTexts.get(name)
                    : Files.readString(source.get(), StandardCharsets.UTF_8);
            try {
                elements.addAll(javaParser.parse(text).preOrder());
            } catch (StructureException e) {
                diagnostics.report("Cannot read the structure of " + component + ": " + e.getMessage());
            }
        }
        for (String section : request.designDocSections) {
            if (section != null && !section.isBlank()) {
                affectedFiles.addAll(docFinder.findDocFiles(sourceRoot, section.trim()));
            }
        }
        affectedFiles.addAll(changedTexts.keySet());

        TestSpecification spec = TestSpecification.forChange(request, date);
        for (TestCase testCase : testCaseGenerator.generate(request, elements)) {
            spec.addTestCase(testCase);
        }
        diagnostics.report("Generated " + spec.testCases.size() + " test cases for " + request.featureName);

        String baseName = reportBaseName(request.featureName);
        Map<String, String> reports = new LinkedHashMap<>();
        reports.put(baseName + TEST_SPEC_SUFFIX, spec.toMarkdown(writer, separatorCell));
        reports.put(baseName + DEPLOYMENT_GUIDE_SUFFIX,
                deploymentGuideGenerator.generate(request, new ArrayList<>(affectedFiles), date));
        return reports;
    }

    /**
     * A component is a path relative to the source root, with or without {@code .java}, a dotted class name, or a
     * simple class name searched for anywhere under the root.
     */
    Optional<Path> locateComponent(Path sourceRoot, String component) throws IOException {
        String withoutExtension = component.endsWith(".java")
                ? component.substring(0, component.length() - ".java".length())
                : component;
        for (String candidate : List.of(withoutExtension + ".java", withoutExtension.replace('.', '/') + ".java")) {
            Path path = sourceRoot.resolve(candidate).normalize();
            if (path.startsWith(sourceRoot.normalize()) && Files.isRegularFile(path)) {
                return Optional.of(path);
            }
        }

        String simpleName = withoutExtension.substring(
                Math.max(withoutExtension.lastIndexOf('/'), withoutExtension.lastIndexOf('.')) + 1) + ".java";
        try (Stream<Path> paths = Files.walk(sourceRoot)) {
            return paths.filter(Files::isRegularFile)
                    .filter(path -> path.getFileName().toString().equals(simpleName))
                    .sorted()
                    .findFirst();
        }
    }

    static String reportBaseName(String featureName) {
        String base = featureName == null ? "" : featureName.trim().toLowerCase();
        base = base.replaceAll("[^\\p{L}\\p{N}._-]+", "_").replaceAll("^_+|_+$", "");
        return base.isEmpty() ? "change" : base;
    }
}
