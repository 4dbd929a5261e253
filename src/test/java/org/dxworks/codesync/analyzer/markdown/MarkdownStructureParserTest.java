package org.dxworks.codesync.analyzer.markdown;

import org.dxworks.codesync.TestUtils;
import org.dxworks.codesync.model.StructureTree;
import org.dxworks.codesync.model.markdown.Section;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class MarkdownStructureParserTest {
    private final MarkdownStructureParser parser = new MarkdownStructureParser();

    @Test
    void parse_nested_headings() {
        StructureTree<Section> tree = parser.parse("# A\ncontent\n## B\nchild\n# C\nmore");

        Section root = tree.root();
        assertEquals(0, root.level);
        assertEquals("", root.content);
        assertEquals(2, root.children.size());

        Section a = root.children.get(0);
        assertEquals("A", a.title);
        assertEquals(1, a.level);
        assertEquals("content", a.content);
        assertEquals(1, a.children.size());

        Section b = a.children.get(0);
        assertEquals("B", b.title);
        assertEquals(2, b.level);
        assertEquals("child", b.content);
        assertTrue(b.children.isEmpty());

        Section c = root.children.get(1);
        assertEquals("C", c.title);
        assertEquals("more", c.content);
        assertSame(root, tree.parentOf(c).orElseThrow());
    }

    @Test
    void parse_section_spans() {
        StructureTree<Section> tree = parser.parse("# A\ncontent\n## B\nchild\n# C\nmore");

        Section a = tree.root().children.get(0);
        assertEquals(1, a.startLine);
        assertEquals(4, a.endLine);
        Section b = a.children.get(0);
        assertEquals(3, b.startLine);
        assertEquals(4, b.endLine);
        Section c = tree.root().children.get(1);
        assertEquals(5, c.startLine);
        assertEquals(6, c.endLine);
    }

    @Test
    void parse_design_document() {
        StructureTree<Section> tree = parser.parse(TestUtils.readSample("markdown/DesignDoc.md"));

        List<String> outline = tree.preOrder().stream()
                .filter(s -> !s.isRoot())
                .map(s -> s.level + ":" + s.title + ":" + s.startLine + "-" + s.endLine)
                .collect(Collectors.toList());
        assertEquals(List.of(
                "1:Overview:8-31",
                "2:Components:12-24",
                "2:Flow:25-31",
                "1:API:32-39",
                "2:Endpoints:34-39",
                "1:Changelog:40-40"), outline);

        Section overview = tree.root().children.get(0);
        assertEquals("The order service accepts and tracks orders.", overview.content);
        assertEquals("", tree.root().children.get(2).content);
    }

    @Test
    void shebang_inside_code_fence_is_content() {
        StructureTree<Section> tree = parser.parse(TestUtils.readSample("markdown/DesignDoc.md"));

        Section flow = tree.firstMatch(s -> "Flow".equals(s.title)).orElseThrow();
        assertEquals("```\n#!/bin/sh\nsubmit -> validate -> store\n```", flow.content);
        assertTrue(flow.children.isEmpty());
    }

    @Test
    void heading_lines_inside_code_fences_and_html_blocks_start_sections() {
        StructureTree<Section> fenced = parser.parse("# A\n```\n# B\n```\n");
        StructureTree<Section> html = parser.parse("# A\n<div>\n# B\n</div>\n");

        for (StructureTree<Section> tree : List.of(fenced, html)) {
            assertEquals(3, tree.size());
            Section b = tree.firstMatch(s -> "B".equals(s.title)).orElseThrow();
            assertEquals(1, b.level);
            assertEquals(3, b.startLine);
        }
        assertEquals("```", fenced.root().children.get(0).content);
        assertEquals("```", fenced.root().children.get(1).content);
    }

    @Test
    void seven_or_more_hashes_are_still_headings() {
        StructureTree<Section> tree = parser.parse("# A\ntext\n####### Deep\nbody\n########## Deeper\n");

        Section a = tree.root().children.get(0);
        assertEquals("text", a.content);
        Section deep = a.children.get(0);
        assertEquals("Deep", deep.title);
        assertEquals(7, deep.level);
        assertEquals("body", deep.content);
        assertEquals(10, deep.children.get(0).level);
    }

    @Test
    void front_matter_goes_to_root_metadata_and_stays_in_content() {
        StructureTree<Section> tree = parser.parse(TestUtils.readSample("markdown/DesignDoc.md"));

        Section root = tree.root();
        assertEquals(Map.of("title", List.of("Order Service Design"), "version", List.of("1.2")),
                root.metadata.get(MarkdownStructureParser.FRONT_MATTER_KEY));
        assertEquals("---\ntitle: Order Service Design\nversion: 1.2\n---\n\nIntro paragraph before any heading.",
                root.content);
    }

    @Test
    void deeper_heading_after_shallower_sibling_pops_the_stack() {
        StructureTree<Section> tree = parser.parse("### Deep\nx\n# Top\n## Sub\n### SubSub\n## Sub2\n");

        Section root = tree.root();
        assertEquals(List.of("Deep", "Top"),
                root.children.stream().map(s -> s.title).collect(Collectors.toList()));
        Section top = root.children.get(1);
        assertEquals(List.of("Sub", "Sub2"),
                top.children.stream().map(s -> s.title).collect(Collectors.toList()));
        assertEquals("SubSub", top.children.get(0).children.get(0).title);
    }

    @Test
    void lines_without_space_after_hash_are_content() {
        StructureTree<Section> tree = parser.parse("#hashtag\ntext\n# Real\n");

        assertEquals("#hashtag\ntext", tree.root().content);
        assertEquals(1, tree.root().children.size());
    }

    @Test
    void empty_document_has_only_the_root() {
        StructureTree<Section> tree = parser.parse("");

        assertEquals(1, tree.size());
        assertEquals("", tree.root().content);
    }
}
