package org.dxworks.codesync.change;

import org.dxworks.codesync.analyzer.markdown.MarkdownStructureParser;
import org.dxworks.codesync.model.markdown.Section;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class DeploymentGuideGeneratorTest {
    private static final LocalDate DATE = LocalDate.of(2026, 10, 18);
    private static final List<String> FILES = List.of("src/OrderService.java", "docs/design.md", "config/app.yml");

    private final DeploymentGuideGenerator generator = new DeploymentGuideGenerator();

    private static ChangeRequest request(ChangeType type) {
        ChangeRequest request = new ChangeRequest();
        request.changeType = type;
        request.featureName = "Order cancellation";
        request.description = "Desc";
        request.requirements.add("R1");
        return request;
    }

    @Test
    void add_feature_guide_groups_files_by_type() {
        String guide = generator.generate(request(ChangeType.ADD_FEATURE), FILES, DATE);

        assertEquals(String.join("\n",
                "# Deployment Guide: Order cancellation",
                "",
                "- Change type: add_feature",
                "- Created: 2026-10-18",
                "",
                "## Changes",
                "",
                "Desc",
                "",
                "## Affected Files",
                "",
                "- `src/OrderService.java`",
                "- `docs/design.md`",
                "- `config/app.yml`",
                "",
                "## Deployment Steps",
                "",
                "### Preparation",
                "",
                "1. Back up the affected files.",
                "2. Test the deployment in the test environment.",
                "",
                "### Deployment",
                "",
                "1. Put the application into maintenance mode if needed.",
                "2. Copy the following files to production:",
                "",
                "   **Java files:**",
                "   - `src/OrderService.java`",
                "",
                "   **Configuration files:**",
                "   - `config/app.yml`",
                "",
                "   **Other files:**",
                "   - `docs/design.md`",
                "",
                "3. Build the application.",
                "4. Restart the application.",
                "5. Leave maintenance mode if it was entered.",
                "",
                "## Rollback Plan",
                "",
                "If the deployment fails, roll back as follows:",
                "",
                "1. Restore the affected files from the backup of the previous version.",
                "2. Restart the application.",
                "3. Check that the rollback succeeded.",
                "",
                "## Verification",
                "",
                "After the deployment, check that the change is in effect:",
                "",
                "1. Check that requirement \"R1\" is met.",
                ""), guide);
    }

    @Test
    void fix_bug_guide_ends_with_a_bug_check() {
        String guide = generator.generate(request(ChangeType.FIX_BUG), FILES, DATE);

        assertTrue(guide.contains("3. Check that the fix has no side effects."));
        assertTrue(guide.contains("6. Check that the bug is fixed."));
    }

    @Test
    void refactor_guide_lists_files_without_groups() {
        String guide = generator.generate(request(ChangeType.REFACTOR), FILES, DATE);

        assertFalse(guide.contains("**Java files:**"));
        assertTrue(guide.contains("2. Copy the following files to production:\n\n   - `src/OrderService.java`\n"
                + "   - `docs/design.md`\n   - `config/app.yml`\n\n3. Build the application."));
        assertFalse(guide.contains("6. "));
    }

    @Test
    void guide_parses_back_into_its_section_outline() {
        String guide = generator.generate(request(ChangeType.MODIFY_FEATURE), FILES, DATE);

        List<Section> sections = new MarkdownStructureParser().parse(guide).preOrder();
        assertEquals(List.of("", "Deployment Guide: Order cancellation", "Changes", "Affected Files",
                        "Deployment Steps", "Preparation", "Deployment", "Rollback Plan", "Verification"),
                sections.stream().map(s -> s.title).collect(Collectors.toList()));
    }

    @Test
    void files_are_grouped_in_a_fixed_order() {
        Map<String, List<String>> groups = DeploymentGuideGenerator.groupByFileType(
                List.of("site/app.js", "README.md", "pom.xml", "A.java"));

        assertEquals(List.of("Java files", "Configuration files", "Static files", "Other files"),
                List.copyOf(groups.keySet()));
        assertEquals(List.of("pom.xml"), groups.get("Configuration files"));
    }
}
