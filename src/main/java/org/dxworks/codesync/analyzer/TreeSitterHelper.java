package org.dxworks.codesync.analyzer;

import org.treesitter.TSNode;

import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

public class TreeSitterHelper {

    /**
     * Tree-sitter reports UTF-8 byte offsets, so slicing works on the encoded source rather than on the String.
     */
    public static String getNodeText(byte[] sourceBytes, TSNode node) {
        if (node == null || node.isNull()) return null;
        int startByte = Math.max(0, node.getStartByte());
        int endByte = Math.min(sourceBytes.length, node.getEndByte());
        if (startByte >= endByte) return "";

        String text = new String(sourceBytes, startByte, endByte - startByte, StandardCharsets.UTF_8);
        return text.replace("\r\n", "\n").replace("\r", "\n");
    }

    /**
     * Collapse all whitespace (including newlines and tabs) to single spaces and trim.
     * Useful for normalizing annotations and other inline metadata.
     */
    public static String normalizeInline(String s) {
        if (s == null) return null;
        return s.replaceAll("\\s+", " ").trim();
    }

    /** 1-based line on which the node starts. */
    public static int startLine(TSNode node) {
        return node.getStartPoint().getRow() + 1;
    }

    /** 1-based line on which the node ends. */
    public static int endLine(TSNode node) {
        return node.getEndPoint().getRow() + 1;
    }

    public static TSNode findFirstChild(TSNode parent, String nodeType) {
        if (parent == null || parent.isNull()) return null;
        int count = parent.getNamedChildCount();
        for (int i = 0; i < count; i++) {
            TSNode child = parent.getNamedChild(i);
            if (child != null && !child.isNull() && nodeType.equals(child.getType())) {
                return child;
            }
        }
        return null;
    }

    public static List<TSNode> namedChildren(TSNode parent) {
        List<TSNode> result = new ArrayList<>();
        if (parent == null || parent.isNull()) return result;
        int count = parent.getNamedChildCount();
        for (int i = 0; i < count; i++) {
            TSNode child = parent.getNamedChild(i);
            if (child != null && !child.isNull()) {
                result.add(child);
            }
        }
        return result;
    }

    public static List<TSNode> findAllChildren(TSNode parent, String nodeType) {
        List<TSNode> result = new ArrayList<>();
        for (TSNode child : namedChildren(parent)) {
            if (nodeType.equals(child.getType())) {
                result.add(child);
            }
        }
        return result;
    }

    public static TSNode findFirstDescendant(TSNode root, String nodeType) {
        if (root == null || root.isNull()) return null;
        Deque<TSNode> stack = new ArrayDeque<>();
        stack.push(root);

        while (!stack.isEmpty()) {
            TSNode node = stack.pop();
            if (node == null || node.isNull()) continue;

            if (nodeType.equals(node.getType())) {
                return node;
            }
            int count = node.getNamedChildCount();
            for (int i = count - 1; i >= 0; i--) {
                TSNode child = node.getNamedChild(i);
                if (child != null && !child.isNull()) {
                    stack.push(child);
                }
            }
        }
        return null;
    }

    /**
     * First node, in source order, that tree-sitter flagged as an error or inserted as a missing token.
     * Walks all children, not just the named ones, since missing tokens are usually anonymous.
     */
    public static TSNode findFirstErrorNode(TSNode root) {
        if (root == null || root.isNull()) return null;
        Deque<TSNode> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            TSNode node = stack.pop();
            if (node == null || node.isNull()) continue;
            if ("ERROR".equals(node.getType()) || node.isMissing()) {
                return node;
            }
            for (int i = node.getChildCount() - 1; i >= 0; i--) {
                TSNode child = node.getChild(i);
                if (child != null && !child.isNull() && (child.hasError() || child.isMissing())) {
                    stack.push(child);
                }
            }
        }
        return null;
    }

    public static TSNode getChildByFieldName(TSNode parent, String fieldName) {
        if (parent == null || parent.isNull()) return null;
        // getFieldNameForChild expects the index among all children (anonymous ones included),
        // so iterate with getChildCount()/getChild(i) rather than the named variants
        for (int i = 0; i < parent.getChildCount(); i++) {
            String fn = parent.getFieldNameForChild(i);
            if (fieldName.equals(fn)) return parent.getChild(i);
        }
        return null;
    }

    public static boolean isTypeOneOf(String type, String... types) {
        if (type == null) return false;
        for (String t : types) if (type.equals(t)) return true;
        return false;
    }

    public static boolean isNodeTypeOneOf(TSNode node, String... types) {
        if (node == null || node.isNull()) return false;
        return isTypeOneOf(node.getType(), types);
    }
}
