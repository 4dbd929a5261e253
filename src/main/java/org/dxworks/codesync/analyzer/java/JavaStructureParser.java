package org.dxworks.codesync.analyzer.java;

import org.dxworks.codesync.analyzer.ClosureScanner;
import org.dxworks.codesync.analyzer.StructureParser;
import org.dxworks.codesync.error.StructureParseException;
import org.dxworks.codesync.model.Element;
import org.dxworks.codesync.model.ElementKind;
import org.dxworks.codesync.model.EnumConstantElement;
import org.dxworks.codesync.model.FieldElement;
import org.dxworks.codesync.model.MethodElement;
import org.dxworks.codesync.model.PackageElement;
import org.dxworks.codesync.model.Parameter;
import org.dxworks.codesync.model.SourceLines;
import org.dxworks.codesync.model.StructureTree;
import org.dxworks.codesync.model.TypeElement;
import org.treesitter.TSLanguage;
import org.treesitter.TSNode;
import org.treesitter.TSParser;
import org.treesitter.TSTree;
import org.treesitter.TreeSitterJava;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;
import java.util.regex.Pattern;

import static org.dxworks.codesync.analyzer.TreeSitterHelper.*;

/**
 * Builds the declaration tree of a Java compilation unit. Tree-sitter supplies the declarations and their start
 * lines; end lines are found textually with {@link ClosureScanner} (brace balance for bodies, first {@code ;} for
 * bodiless members), so braces inside literals or comments can make an end line wrong or unresolved.
 */
public class JavaStructureParser implements StructureParser<Element> {
    // Node type constants
    private static final String NT_PACKAGE = "package_declaration";
    private static final String NT_CLASS = "class_declaration";
    private static final String NT_RECORD = "record_declaration";
    private static final String NT_INTERFACE = "interface_declaration";
    private static final String NT_ANNOTATION_TYPE = "annotation_type_declaration";
    private static final String NT_ENUM = "enum_declaration";
    private static final String NT_ENUM_CONSTANT = "enum_constant";
    private static final String NT_ENUM_BODY_DECLARATIONS = "enum_body_declarations";
    private static final String NT_METHOD = "method_declaration";
    private static final String NT_CONSTRUCTOR = "constructor_declaration";
    private static final String NT_COMPACT_CONSTRUCTOR = "compact_constructor_declaration";
    private static final String NT_FIELD = "field_declaration";
    private static final String NT_CONSTANT = "constant_declaration";
    private static final String NT_MODIFIERS = "modifiers";
    private static final String NT_VARIABLE_DECLARATOR = "variable_declarator";

    private static final String[] TYPE_DECLARATIONS = {NT_CLASS, NT_RECORD, NT_INTERFACE, NT_ANNOTATION_TYPE, NT_ENUM};
    private static final String[] BODY_TYPES = {"class_body", "interface_body", "enum_body", "annotation_type_body"};
    private static final String[] ANNOTATION_TYPES = {"annotation", "marker_annotation"};
    private static final String[] COMMENT_TYPES = {"line_comment", "block_comment"};

    private static final Pattern ANNOTATION_LINE = Pattern.compile("^\\s*@");

    private final TSLanguage language = new TreeSitterJava();

    @Override
    public StructureTree<Element> parse(String sourceCode) {
        String text = stripBom(sourceCode);
        TSParser parser = new TSParser();
        parser.setLanguage(language);
        TSTree tree = parser.parseString(null, text);
        TSNode rootNode = tree.getRootNode();

        if (rootNode.hasError()) {
            TSNode error = findFirstErrorNode(rootNode);
            if (error != null) {
                throw new StructureParseException("Java source could not be tokenized",
                        startLine(error), error.getStartPoint().getColumn() + 1);
            }
            throw new StructureParseException("Java source could not be tokenized", 1, 1);
        }

        Context ctx = new Context(text, SourceLines.of(text).lines());
        PackageElement root = new PackageElement(readPackageName(ctx, rootNode));
        root.startLine = 1;
        root.endLine = Math.max(1, ctx.lines.size());
        root.source = text;

        StructureTree<Element> result = new StructureTree<>(root);
        for (TSNode child : namedChildren(rootNode)) {
            if (isNodeTypeOneOf(child, TYPE_DECLARATIONS)) {
                analyzeType(ctx, child, root, result);
            }
        }
        return result;
    }

    private String readPackageName(Context ctx, TSNode rootNode) {
        TSNode packageDecl = findFirstChild(rootNode, NT_PACKAGE);
        if (packageDecl == null) {
            return null;
        }
        for (TSNode child : namedChildren(packageDecl)) {
            if (isNodeTypeOneOf(child, "scoped_identifier", "identifier")) {
                return ctx.text(child);
            }
        }
        return null;
    }

    private void analyzeType(Context ctx, TSNode typeDecl, Element parent, StructureTree<Element> tree) {
        TypeElement type = new TypeElement(typeKind(typeDecl), ctx.text(findFirstChild(typeDecl, "identifier")));
        readModifiersAndAnnotations(ctx, typeDecl, type);
        readSupertypes(ctx, typeDecl, type);
        locate(ctx, typeDecl, type, true);
        tree.attach(parent, type);

        TSNode body = firstChildOfTypes(typeDecl, BODY_TYPES);
        if (body != null) {
            analyzeBody(ctx, body, type, tree);
        }
    }

    private void analyzeBody(Context ctx, TSNode body, TypeElement owner, StructureTree<Element> tree) {
        for (TSNode member : namedChildren(body)) {
            String nodeType = member.getType();
            if (isTypeOneOf(nodeType, TYPE_DECLARATIONS)) {
                analyzeType(ctx, member, owner, tree);
            } else if (NT_METHOD.equals(nodeType)) {
                tree.attach(owner, analyzeMethod(ctx, member));
            } else if (isTypeOneOf(nodeType, NT_CONSTRUCTOR, NT_COMPACT_CONSTRUCTOR)) {
                tree.attach(owner, analyzeConstructor(ctx, member, owner.name));
            } else if (isTypeOneOf(nodeType, NT_FIELD, NT_CONSTANT)) {
                for (FieldElement field : analyzeField(ctx, member)) {
                    tree.attach(owner, field);
                }
            } else if (NT_ENUM_CONSTANT.equals(nodeType)) {
                tree.attach(owner, analyzeEnumConstant(ctx, member));
            } else if (NT_ENUM_BODY_DECLARATIONS.equals(nodeType)) {
                analyzeBody(ctx, member, owner, tree);
            }
            // initializer blocks and comments are not modelled
        }
    }

    private MethodElement analyzeMethod(Context ctx, TSNode methodDecl) {
        MethodElement method = new MethodElement(ElementKind.METHOD, ctx.text(findFirstChild(methodDecl, "identifier")));
        readModifiersAndAnnotations(ctx, methodDecl, method);
        method.returnType = readReturnType(ctx, methodDecl);
        readParameters(ctx, methodDecl, method);
        method.hasBody = findFirstChild(methodDecl, "block") != null;
        locate(ctx, methodDecl, method, method.hasBody);
        return method;
    }

    private MethodElement analyzeConstructor(Context ctx, TSNode constructorDecl, String className) {
        TSNode nameNode = findFirstChild(constructorDecl, "identifier");
        MethodElement constructor = new MethodElement(ElementKind.CONSTRUCTOR,
                nameNode != null ? ctx.text(nameNode) : className);
        readModifiersAndAnnotations(ctx, constructorDecl, constructor);
        readParameters(ctx, constructorDecl, constructor);
        constructor.hasBody = true;
        locate(ctx, constructorDecl, constructor, true);
        return constructor;
    }

    private List<FieldElement> analyzeField(Context ctx, TSNode fieldDecl) {
        String declaredType = ctx.text(getChildByFieldName(fieldDecl, "type"));
        List<FieldElement> fields = new ArrayList<>();
        for (TSNode declarator : findAllChildren(fieldDecl, NT_VARIABLE_DECLARATOR)) {
            TSNode nameNode = findFirstChild(declarator, "identifier");
            if (nameNode == null) continue;
            FieldElement field = new FieldElement(ctx.text(nameNode), declaredType);
            readModifiersAndAnnotations(ctx, fieldDecl, field);
            // declarators of one declaration share its span
            locate(ctx, fieldDecl, field, false);
            fields.add(field);
        }
        return fields;
    }

    private EnumConstantElement analyzeEnumConstant(Context ctx, TSNode constantNode) {
        EnumConstantElement constant = new EnumConstantElement(ctx.text(findFirstChild(constantNode, "identifier")));
        readModifiersAndAnnotations(ctx, constantNode, constant);
        constant.startLine = declarationLine(constantNode);
        constant.endLine = endLine(constantNode);
        constant.source = ctx.slice(constant.startLine, constant.endLine);
        attachDocComment(ctx, constant);
        return constant;
    }

    private ElementKind typeKind(TSNode typeDecl) {
        String nodeType = typeDecl.getType();
        if (NT_ENUM.equals(nodeType)) return ElementKind.ENUM;
        if (NT_INTERFACE.equals(nodeType) || NT_ANNOTATION_TYPE.equals(nodeType)) return ElementKind.INTERFACE;
        return ElementKind.CLASS;
    }

    private void readModifiersAndAnnotations(Context ctx, TSNode decl, Element element) {
        TSNode modifiersNode = findFirstChild(decl, NT_MODIFIERS);
        if (modifiersNode == null) {
            return;
        }
        // keywords are anonymous children of the modifiers node, so walk all children
        for (int i = 0; i < modifiersNode.getChildCount(); i++) {
            TSNode mod = modifiersNode.getChild(i);
            if (mod == null || mod.isNull() || isNodeTypeOneOf(mod, COMMENT_TYPES)) {
                continue;
            }
            if (isNodeTypeOneOf(mod, ANNOTATION_TYPES)) {
                element.annotations.add(normalizeInline(ctx.text(mod)));
            } else {
                String keyword = ctx.text(mod).trim();
                if (!keyword.isEmpty() && !element.modifiers.contains(keyword)) {
                    element.modifiers.add(keyword);
                }
            }
        }
    }

    private void readSupertypes(Context ctx, TSNode typeDecl, TypeElement type) {
        TSNode superclass = findFirstChild(typeDecl, "superclass");
        if (superclass != null && superclass.getNamedChildCount() > 0) {
            type.extendsType = ctx.text(superclass.getNamedChild(0));
        }
        TSNode interfaces = findFirstChild(typeDecl, "super_interfaces");
        if (interfaces == null) {
            interfaces = findFirstChild(typeDecl, "extends_interfaces");
        }
        TSNode typeList = findFirstChild(interfaces, "type_list");
        for (TSNode typeNode : namedChildren(typeList)) {
            type.implementsInterfaces.add(ctx.text(typeNode));
        }
    }

    private String readReturnType(Context ctx, TSNode methodDecl) {
        TSNode typeNode = getChildByFieldName(methodDecl, "type");
        return typeNode != null ? ctx.text(typeNode) : null;
    }

    private void readParameters(Context ctx, TSNode methodDecl, MethodElement method) {
        TSNode paramsNode = findFirstChild(methodDecl, "formal_parameters");
        for (TSNode param : namedChildren(paramsNode)) {
            if (!isNodeTypeOneOf(param, "formal_parameter", "spread_parameter")) continue;
            TSNode typeNode = getChildByFieldName(param, "type");
            if (typeNode == null) typeNode = firstChildOfTypes(param, "type_identifier", "generic_type",
                    "scoped_type_identifier", "array_type", "integral_type", "floating_point_type", "boolean_type");
            TSNode nameNode = getChildByFieldName(param, "name");
            if (nameNode == null) nameNode = findFirstDescendant(param, "identifier");
            String typeName = ctx.text(typeNode);
            if ("spread_parameter".equals(param.getType()) && typeName != null) {
                typeName = typeName + "...";
            }
            method.parameters.add(new Parameter(ctx.text(nameNode), typeName));
        }
    }

    private void locate(Context ctx, TSNode decl, Element element, boolean braceBodied) {
        element.startLine = declarationLine(decl);
        ClosureScanner.ClosureRule rule = braceBodied
                ? ClosureScanner.braceBalance()
                : ClosureScanner.firstLineContaining(';');
        OptionalInt closing = ClosureScanner.findClosingLine(ctx.lines, element.startLine - 1, rule, false);
        element.endLine = closing.isPresent() ? closing.getAsInt() + 1 : null;
        if (element.endLine != null) {
            element.source = ctx.slice(element.startLine, element.endLine);
        }
        attachDocComment(ctx, element);
    }

    /**
     * Line of the declaration keyword: the first token that is neither an annotation nor a comment.
     */
    private int declarationLine(TSNode decl) {
        for (int i = 0; i < decl.getChildCount(); i++) {
            TSNode child = decl.getChild(i);
            if (child == null || child.isNull() || isNodeTypeOneOf(child, COMMENT_TYPES)) continue;
            if (NT_MODIFIERS.equals(child.getType())) {
                for (int j = 0; j < child.getChildCount(); j++) {
                    TSNode mod = child.getChild(j);
                    if (mod != null && !mod.isNull() && !isNodeTypeOneOf(mod, ANNOTATION_TYPES)
                            && !isNodeTypeOneOf(mod, COMMENT_TYPES)) {
                        return startLine(mod);
                    }
                }
                continue;
            }
            if (isNodeTypeOneOf(child, ANNOTATION_TYPES)) continue;
            return startLine(child);
        }
        return startLine(decl);
    }

    /**
     * Walks up from the line above the declaration, over annotation lines, and attaches the block comment that
     * ends there. A blank line or any other code in between means there is no attached comment.
     */
    private void attachDocComment(Context ctx, Element element) {
        int i = element.startLine - 2;
        while (i >= 0 && ANNOTATION_LINE.matcher(ctx.lines.get(i)).find()) {
            i--;
        }
        if (i < 0 || !ctx.lines.get(i).trim().endsWith("*/")) {
            return;
        }
        int end = i;
        while (i >= 0 && !ctx.lines.get(i).contains("/*")) {
            i--;
        }
        if (i < 0 || !ctx.lines.get(i).trim().startsWith("/*")) {
            return;
        }
        element.docCommentStartLine = i + 1;
        element.docCommentEndLine = end + 1;
        element.docComment = ctx.slice(i + 1, end + 1);
    }

    private static TSNode firstChildOfTypes(TSNode parent, String... types) {
        for (TSNode child : namedChildren(parent)) {
            if (isNodeTypeOneOf(child, types)) {
                return child;
            }
        }
        return null;
    }

    private static String stripBom(String sourceCode) {
        if (sourceCode.startsWith("\uFEFF")) {
            return sourceCode.substring(1);
        }
        return sourceCode;
    }

    private static final class Context {
        private final byte[] bytes;
        private final List<String> lines;

        private Context(String text, List<String> lines) {
            this.bytes = text.getBytes(StandardCharsets.UTF_8);
            this.lines = lines;
        }

        private String text(TSNode node) {
            return getNodeText(bytes, node);
        }

        private String slice(int startLine, int endLine) {
            return String.join("\n", lines.subList(startLine - 1, Math.min(endLine, lines.size())));
        }
    }
}
