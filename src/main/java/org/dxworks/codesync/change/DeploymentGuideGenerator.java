package org.dxworks.codesync.change;

import org.dxworks.codesync.model.StructureTree;
import org.dxworks.codesync.model.markdown.Section;
import org.dxworks.codesync.mutation.MarkdownWriter;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes the deployment guide of a change request: affected files, preparation and deployment steps that depend
 * on the change type, a rollback plan and one verification step per requirement.
 */
public class DeploymentGuideGenerator {
    public static final String TITLE_PREFIX = "Deployment Guide: ";

    private final MarkdownWriter writer;

    public DeploymentGuideGenerator() {
        this(new MarkdownWriter());
    }

    public DeploymentGuideGenerator(MarkdownWriter writer) {
        this.writer = writer;
    }

    public String generate(ChangeRequest request, List<String> affectedFiles, LocalDate date) {
        return writer.write(toSectionTree(request, affectedFiles, date));
    }

    public StructureTree<Section> toSectionTree(ChangeRequest request, List<String> affectedFiles, LocalDate date) {
        Section root = Section.root();
        StructureTree<Section> tree = new StructureTree<>(root);
        Section guide = tree.attach(root, new Section(TITLE_PREFIX + request.featureName, 1, String.join("\n",
                "- Change type: " + request.changeType.getValue(),
                "- Created: " + date)));

        tree.attach(guide, new Section("Changes", 2, request.description));
        List<String> fileItems = new ArrayList<>();
        for (String file : affectedFiles) {
            fileItems.add("`" + file + "`");
        }
        tree.attach(guide, new Section("Affected Files", 2, TestSpecification.bulletList(fileItems)));

        Section steps = tree.attach(guide, new Section("Deployment Steps", 2, ""));
        tree.attach(steps, new Section("Preparation", 3, numbered(preparationSteps(request.changeType))));
        tree.attach(steps, new Section("Deployment", 3, deploymentSteps(request.changeType, affectedFiles)));

        tree.attach(guide, new Section("Rollback Plan", 2, String.join("\n",
                "If the deployment fails, roll back as follows:",
                "",
                numbered(List.of(
                        "Restore the affected files from the backup of the previous version.",
                        "Restart the application.",
                        "Check that the rollback succeeded.")))));

        List<String> checks = new ArrayList<>();
        for (String requirement : request.requirements) {
            if (requirement != null && !requirement.isBlank()) {
                checks.add("Check that requirement \"" + requirement.trim() + "\" is met.");
            }
        }
        String verification = "After the deployment, check that the change is in effect:";
        if (!checks.isEmpty()) {
            verification = verification + "\n\n" + numbered(checks);
        }
        tree.attach(guide, new Section("Verification", 2, verification));
        return tree;
    }

    private static List<String> preparationSteps(ChangeType type) {
        List<String> steps = new ArrayList<>();
        steps.add("Back up the affected files.");
        switch (type) {
            case MODIFY_FEATURE:
                steps.add("Test the deployment in the test environment.");
                steps.add("Review the impact of the change and run the related tests.");
                break;
            case FIX_BUG:
                steps.add("Check in the test environment that the bug is fixed.");
                steps.add("Check that the fix has no side effects.");
                break;
            default:
                steps.add("Test the deployment in the test environment.");
        }
        return steps;
    }

    private static String deploymentSteps(ChangeType type, List<String> affectedFiles) {
        List<String> lines = new ArrayList<>();
        lines.add("1. Put the application into maintenance mode if needed.");
        lines.add("2. Copy the following files to production:");
        lines.add("");
        if (type == ChangeType.ADD_FEATURE || type == ChangeType.MODIFY_FEATURE || type == ChangeType.FIX_BUG) {
            for (Map.Entry<String, List<String>> group : groupByFileType(affectedFiles).entrySet()) {
                lines.add("   **" + group.getKey() + ":**");
                for (String file : group.getValue()) {
                    lines.add("   - `" + file + "`");
                }
                lines.add("");
            }
        } else {
            for (String file : affectedFiles) {
                lines.add("   - `" + file + "`");
            }
            lines.add("");
        }

        List<String> closing = new ArrayList<>(List.of(
                "Build the application.",
                "Restart the application.",
                "Leave maintenance mode if it was entered."));
        if (type == ChangeType.MODIFY_FEATURE) {
            closing.add("Check that the change is in effect.");
        } else if (type == ChangeType.FIX_BUG) {
            closing.add("Check that the bug is fixed.");
        }
        for (int i = 0; i < closing.size(); i++) {
            lines.add((i + 3) + ". " + closing.get(i));
        }
        return String.join("\n", lines);
    }

    static Map<String, List<String>> groupByFileType(List<String> files) {
        Map<String, List<String>> groups = new LinkedHashMap<>();
        for (String file : files) {
            groups.computeIfAbsent(fileType(file), key -> new ArrayList<>()).add(file);
        }
        Map<String, List<String>> ordered = new LinkedHashMap<>();
        for (String type : List.of("Java files", "Configuration files", "Static files", "Other files")) {
            if (groups.containsKey(type)) {
                ordered.put(type, groups.get(type));
            }
        }
        return ordered;
    }

    private static String fileType(String file) {
        if (file.endsWith(".java")) {
            return "Java files";
        }
        if (file.endsWith(".xml") || file.endsWith(".properties") || file.endsWith(".yml")) {
            return "Configuration files";
        }
        if (file.endsWith(".html") || file.endsWith(".css") || file.endsWith(".js")) {
            return "Static files";
        }
        return "Other files";
    }

    private static String numbered(List<String> steps) {
        List<String> lines = new ArrayList<>();
        for (int i = 0; i < steps.size(); i++) {
            lines.add((i + 1) + ". " + steps.get(i));
        }
        return String.join("\n", lines);
    }
}
