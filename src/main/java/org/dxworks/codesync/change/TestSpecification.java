package org.dxworks.codesync.change;

import org.dxworks.codesync.model.StructureTree;
import org.dxworks.codesync.model.markdown.Section;
import org.dxworks.codesync.model.markdown.Table;
import org.dxworks.codesync.mutation.MarkdownWriter;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Test specification of a change request. It is rendered as a section tree: the title section carries the
 * version lines, its subsections the overview, scope, prerequisites and the test case table.
 */
public class TestSpecification {
    public static final String TEST_CASES_TITLE = "Test Cases";
    public static final List<String> TABLE_HEADER = List.of("ID", "Category", "Subcategory", "Item",
            "Conditions", "Steps", "Expected results", "Actual result", "Status");

    private static final String DEFAULT_VERSION = "1.0";
    private static final String DEFAULT_AUTHOR = "codesync";

    public String title;
    public String version;
    public LocalDate createdDate;
    public LocalDate updatedDate;
    public String author;
    public String description;
    public String scope;
    public List<String> prerequisites = new ArrayList<>();
    public List<TestCase> testCases = new ArrayList<>();

    public TestSpecification(String title, String version, LocalDate createdDate, String author) {
        this.title = title;
        this.version = version;
        this.createdDate = createdDate;
        this.updatedDate = createdDate;
        this.author = author;
    }

    public static TestSpecification forChange(ChangeRequest request, LocalDate date) {
        TestSpecification spec = new TestSpecification(request.featureName + " Test Specification",
                DEFAULT_VERSION, date, DEFAULT_AUTHOR);
        spec.description = request.description;
        spec.scope = "Functional tests of " + request.featureName;
        spec.prerequisites.add("The test environment is up and running");
        return spec;
    }

    public void addTestCase(TestCase testCase) {
        testCases.add(testCase);
    }

    public StructureTree<Section> toSectionTree(String separatorCell) {
        Section root = Section.root();
        StructureTree<Section> tree = new StructureTree<>(root);
        Section titleSection = tree.attach(root, new Section(title, 1, String.join("\n",
                "- Version: " + version,
                "- Created: " + createdDate,
                "- Updated: " + updatedDate,
                "- Author: " + author)));

        if (description != null && !description.isBlank()) {
            tree.attach(titleSection, new Section("Overview", 2, description.trim()));
        }
        if (scope != null && !scope.isBlank()) {
            tree.attach(titleSection, new Section("Scope", 2, scope.trim()));
        }
        if (!prerequisites.isEmpty()) {
            tree.attach(titleSection, new Section("Prerequisites", 2, bulletList(prerequisites)));
        }
        tree.attach(titleSection, new Section(TEST_CASES_TITLE, 2,
                String.join("\n", testCaseTable().render(separatorCell))));
        return tree;
    }

    public String toMarkdown(MarkdownWriter writer, String separatorCell) {
        return writer.write(toSectionTree(separatorCell));
    }

    private Table testCaseTable() {
        List<List<String>> rows = new ArrayList<>();
        rows.add(TABLE_HEADER);
        for (TestCase tc : testCases) {
            rows.add(List.of(cell(tc.id), cell(tc.category), cell(tc.subCategory), cell(tc.item),
                    cell(tc.conditions), cell(tc.steps), cell(tc.expectedResults), cell(tc.actualResult),
                    cell(tc.status)));
        }
        return new Table(rows);
    }

    static String bulletList(List<String> items) {
        List<String> lines = new ArrayList<>();
        for (String item : items) {
            lines.add("- " + item);
        }
        return String.join("\n", lines);
    }

    private static String cell(List<String> values) {
        return cell(String.join("<br>", values));
    }

    // a cell must stay on one line and must not end the row early
    private static String cell(String value) {
        if (value == null) {
            return "";
        }
        return value.trim().replace("|", "\\|").replaceAll("\\R", "<br>");
    }
}
