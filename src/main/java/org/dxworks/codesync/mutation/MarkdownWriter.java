package org.dxworks.codesync.mutation;

import org.dxworks.codesync.model.StructureTree;
import org.dxworks.codesync.model.markdown.Section;

import java.util.ArrayList;
import java.util.List;

/**
 * Serializes a section tree back to Markdown from its titles, levels and contents. Spacing between blocks is
 * normalized to one blank line; whitespace the tree does not model is not reproduced.
 */
public class MarkdownWriter {

    public String write(StructureTree<Section> tree) {
        List<String> out = new ArrayList<>();
        Section root = tree.root();
        if (!root.content.isEmpty()) {
            out.add(root.content);
            out.add("");
        }
        for (Section child : root.children) {
            writeSection(child, out);
        }

        int end = out.size();
        while (end > 0 && out.get(end - 1).isBlank()) {
            end--;
        }
        if (end == 0) {
            return "";
        }
        return String.join("\n", out.subList(0, end)) + "\n";
    }

    private void writeSection(Section section, List<String> out) {
        out.add("#".repeat(section.level) + " " + section.title);
        out.add("");
        if (!section.content.isEmpty()) {
            out.add(section.content);
            out.add("");
        }
        for (Section child : section.children) {
            writeSection(child, out);
        }
    }
}
