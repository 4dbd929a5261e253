package org.dxworks.codesync.mutation;

import org.dxworks.codesync.TestUtils;
import org.dxworks.codesync.analyzer.java.JavaStructureParser;
import org.dxworks.codesync.error.PositionUnresolvedException;
import org.dxworks.codesync.error.TargetNotFoundException;
import org.dxworks.codesync.model.Element;
import org.dxworks.codesync.model.ElementSelector;
import org.dxworks.codesync.model.StructureTree;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class JavaSourceEditorTest {
    private static final String COUNTER = String.join("\n",
            "package demo;",
            "",
            "public class Counter {",
            "    private int value;",
            "",
            "    public int next() {",
            "        return ++value;",
            "    }",
            "",
            "",
            "}",
            "");

    private final JavaSourceEditor editor = new JavaSourceEditor();
    private final JavaStructureParser parser = new JavaStructureParser();

    @Test
    void insert_member_before_closing_brace() {
        String result = editor.insertMember(COUNTER, MemberKind.METHOD,
                "    public void reset() {\n        value = 0;\n    }\n", "Counter");

        assertEquals(String.join("\n",
                "package demo;",
                "",
                "public class Counter {",
                "    private int value;",
                "",
                "    public int next() {",
                "        return ++value;",
                "    }",
                "",
                "    public void reset() {",
                "        value = 0;",
                "    }",
                "",
                "}",
                ""), result);
    }

    @Test
    void inserted_member_is_the_last_child_and_others_are_unchanged() {
        String original = TestUtils.readSample("java/OrderService.java");
        String result = editor.insertMember(original, MemberKind.FIELD, "    private boolean closed;", "OrderService");

        Element before = ElementSelector.resolve(parser.parse(original), "OrderService").orElseThrow();
        StructureTree<Element> tree = parser.parse(result);
        Element after = ElementSelector.resolve(tree, "OrderService").orElseThrow();

        assertEquals(before.children.size() + 1, after.children.size());
        Element inserted = after.children.get(after.children.size() - 1);
        assertEquals("closed", inserted.name);
        assertTrue(inserted.endLine < after.endLine);
        for (int i = 0; i < before.children.size(); i++) {
            assertEquals(before.children.get(i).name, after.children.get(i).name);
            assertEquals(before.children.get(i).source, after.children.get(i).source);
        }
    }

    @Test
    void insert_member_into_empty_class() {
        String result = editor.insertMember("class Empty {\n}\n", MemberKind.FIELD, "    int x;", "Empty");

        assertEquals("class Empty {\n\n    int x;\n\n}\n", result);
    }

    @Test
    void insert_member_into_nested_type() {
        String original = TestUtils.readSample("java/OrderService.java");
        String result = editor.insertMember(original, MemberKind.METHOD,
                "        String sku() {\n            return sku;\n        }", "OrderService.Line");

        Element line = ElementSelector.resolve(parser.parse(result), "OrderService.Line").orElseThrow();
        assertEquals("sku", line.children.get(line.children.size() - 1).name);
        assertEquals(3, line.children.size());
    }

    @Test
    void insert_member_fails_on_single_line_class() {
        assertThrows(PositionUnresolvedException.class,
                () -> editor.insertMember("class Foo { void bar(){} }", MemberKind.METHOD, "void baz() {}", "Foo"));
    }

    @Test
    void insert_member_fails_when_closing_brace_is_unresolved() {
        String source = "class Foo {\n    String open() {\n        return \"{\";\n    }\n}\n";
        assertThrows(PositionUnresolvedException.class,
                () -> editor.insertMember(source, MemberKind.METHOD, "void baz() {}", "Foo"));
    }

    @Test
    void insert_member_fails_on_unknown_type() {
        TargetNotFoundException error = assertThrows(TargetNotFoundException.class,
                () -> editor.insertMember(COUNTER, MemberKind.METHOD, "void baz() {}", "Missing"));
        assertEquals("Missing", error.getSelector());
    }

    @Test
    void insert_member_rejects_blank_code() {
        assertThrows(IllegalArgumentException.class,
                () -> editor.insertMember(COUNTER, MemberKind.METHOD, "  \n ", "Counter"));
    }

    @Test
    void replace_member_splices_only_the_member_lines() {
        String result = editor.replaceMember(COUNTER,
                "    public int next() {\n        return value += 2;\n    }", "Counter.next");

        assertEquals(COUNTER.replace("return ++value;", "return value += 2;"), result);
    }

    @Test
    void replace_member_keeps_annotations_and_doc_comment() {
        String original = TestUtils.readSample("java/OrderService.java");
        String result = editor.replaceMember(original, "    public boolean submit(String order, int quantity) {\n"
                + "        return false;\n"
                + "    }", "OrderService.submit");

        List<String> before = original.lines().collect(Collectors.toList());
        List<String> after = result.lines().collect(Collectors.toList());
        assertEquals(before.subList(0, 23), after.subList(0, 23));
        assertEquals("        return false;", after.get(24));
        assertEquals(before.subList(29, before.size()), after.subList(26, after.size()));
    }

    @Test
    void replace_member_of_a_field() {
        String result = editor.replaceMember(COUNTER, "    private long value;", "Counter.value");

        assertEquals(COUNTER.replace("private int value;", "private long value;"), result);
    }

    @Test
    void replace_member_fails_for_types_and_unknown_members() {
        String original = TestUtils.readSample("java/OrderService.java");
        assertThrows(TargetNotFoundException.class,
                () -> editor.replaceMember(original, "class X {}", "OrderService.Line"));
        assertThrows(TargetNotFoundException.class,
                () -> editor.replaceMember(original, "void x() {}", "OrderService.missing"));
    }

    @Test
    void replace_member_is_byte_identical_elsewhere_with_crlf() {
        String crlf = COUNTER.replace("\n", "\r\n");
        String result = editor.replaceMember(crlf, "    private long value;", "Counter.value");

        assertEquals(crlf.replace("private int value;", "private long value;"), result);
    }

    @Test
    void insert_import_after_last_import() {
        String original = TestUtils.readSample("java/OrderService.java");
        String result = editor.insertImport(original, "java.util.Optional");

        assertTrue(result.startsWith("package com.acme.orders;\n\nimport java.util.ArrayList;\n"
                + "import java.util.List;\nimport java.util.Optional;\n\n/**"));
    }

    @Test
    void insert_import_after_package_line() {
        assertEquals("package demo;\n\nimport java.util.List;\n\nclass A {}\n",
                editor.insertImport("package demo;\n\nclass A {}\n", "import java.util.List;"));
        assertEquals("package demo;\n\nimport java.util.List;\nclass A {}\n",
                editor.insertImport("package demo;\nclass A {}\n", "java.util.List"));
    }

    @Test
    void insert_import_without_package_or_imports_is_the_first_line() {
        assertEquals("import java.util.List;\nclass A {}\n", editor.insertImport("class A {}\n", "java.util.List"));
    }

    @Test
    void insert_import_keeps_byte_order_mark_first() {
        String result = editor.insertImport("\uFEFFclass A {}\n", "java.util.List");

        assertEquals("\uFEFFimport java.util.List;\nclass A {}\n", result);
    }

    @Test
    void insert_import_finds_package_line_behind_byte_order_mark() {
        String result = editor.insertImport("\uFEFFpackage demo;\nclass A {}\n", "java.util.List");

        assertEquals("\uFEFFpackage demo;\n\nimport java.util.List;\nclass A {}\n", result);
    }

    @Test
    void insert_import_skips_existing_import() {
        String original = TestUtils.readSample("java/OrderService.java");
        assertSame(original, editor.insertImport(original, "import java.util.List;"));
    }

    @Test
    void insert_annotation_above_existing_annotations_and_doc_comment() {
        String original = TestUtils.readSample("java/OrderService.java");
        String result = editor.insertAnnotation(original, "@Transactional", "OrderService.submit");

        List<String> after = result.lines().collect(Collectors.toList());
        assertEquals("    @Transactional", after.get(19));
        assertEquals("    /**", after.get(20));
        assertEquals("    @Override", after.get(23));
    }

    @Test
    void insert_annotation_directly_above_declaration() {
        String result = editor.insertAnnotation(COUNTER, "@Nullable", "Counter.next");

        assertEquals(COUNTER.replace("    public int next()", "    @Nullable\n    public int next()"), result);
    }

    @Test
    void insert_annotation_stays_out_of_plain_block_comment() {
        String source = "class A {\n    /*\n     * plain\n     */\n    void f() {\n    }\n}\n";
        String result = editor.insertAnnotation(source, "@Deprecated", "A.f");

        assertEquals("class A {\n    /*\n     * plain\n     */\n    @Deprecated\n    void f() {\n    }\n}\n", result);
        Element f = ElementSelector.resolve(parser.parse(result), "A.f").orElseThrow();
        assertEquals(List.of("@Deprecated"), f.annotations);
    }

    @Test
    void insert_annotation_keeps_given_indentation() {
        String result = editor.insertAnnotation(COUNTER, "  @Nullable", "Counter.next");

        assertEquals(COUNTER.replace("    public int next()", "  @Nullable\n    public int next()"), result);
    }

    @Test
    void replace_existing_doc_comment() {
        String original = TestUtils.readSample("java/OrderService.java");
        String result = editor.replaceDocComment(original, "/** Submits one order. */", "OrderService.submit");

        List<String> before = original.lines().collect(Collectors.toList());
        List<String> after = result.lines().collect(Collectors.toList());
        assertEquals("    /** Submits one order. */", after.get(19));
        assertEquals("    @Override", after.get(20));
        assertEquals(before.size() - 2, after.size());

        Element submit = ElementSelector.resolve(parser.parse(result), "OrderService.submit").orElseThrow();
        assertEquals("    /** Submits one order. */", submit.docComment);
    }

    @Test
    void add_doc_comment_above_annotations() {
        String source = String.join("\n",
                "class A {",
                "    @Deprecated",
                "    void old() {",
                "    }",
                "}",
                "");
        String result = editor.replaceDocComment(source, "/**\n * Old.\n */", "A.old");

        assertEquals(String.join("\n",
                "class A {",
                "    /**",
                "     * Old.",
                "     */",
                "    @Deprecated",
                "    void old() {",
                "    }",
                "}",
                ""), result);
    }

    @Test
    void plain_block_comment_is_not_replaced() {
        String source = "class A {\n    /* note */\n    void f() {\n    }\n}\n";
        String result = editor.replaceDocComment(source, "/** Doc. */", "A.f");

        assertEquals("class A {\n    /* note */\n    /** Doc. */\n    void f() {\n    }\n}\n", result);
    }

    @Test
    void diagnostics_go_to_the_given_sink() {
        List<String> messages = new ArrayList<>();
        JavaSourceEditor reporting = new JavaSourceEditor(new JavaStructureParser(), messages::add);

        reporting.insertImport("class A {}\n", "java.util.List");
        reporting.insertImport("import java.util.List;\nclass A {}\n", "java.util.List");

        assertEquals(1, messages.size());
        assertTrue(messages.get(0).contains("already present"));
    }
}
