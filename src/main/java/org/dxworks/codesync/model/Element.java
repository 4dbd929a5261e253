package org.dxworks.codesync.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * A declaration of the Java structural model. Lines are 1-based and inclusive; {@code endLine} is null when the
 * end of the declaration could not be determined.
 */
public abstract class Element extends TreeNode<Element> {
    public final ElementKind kind;
    public String name;
    public List<String> modifiers = new ArrayList<>();
    public List<String> annotations = new ArrayList<>();
    public String docComment;
    public Integer docCommentStartLine;
    public Integer docCommentEndLine;
    public int startLine;
    public Integer endLine;
    public String source;

    protected Element(ElementKind kind, String name) {
        this.kind = kind;
        this.name = name;
    }

    @Override
    public String label() {
        return name;
    }

    @JsonIgnore
    public boolean hasResolvedEnd() {
        return endLine != null;
    }

    public Optional<Element> findChild(String childName) {
        for (Element child : children) {
            if (child.name != null && child.name.equals(childName)) {
                return Optional.of(child);
            }
        }
        return Optional.empty();
    }

    public List<Element> findChildren(ElementKind childKind) {
        List<Element> result = new ArrayList<>();
        for (Element child : children) {
            if (child.kind == childKind) {
                result.add(child);
            }
        }
        return result;
    }

    /**
     * Short human readable signature, e.g. {@code public static class Foo} or {@code private helper()}.
     */
    public String signature() {
        StringBuilder sb = new StringBuilder();
        for (String modifier : modifiers) {
            sb.append(modifier).append(' ');
        }
        switch (kind) {
            case METHOD:
            case CONSTRUCTOR:
                sb.append(name).append("()");
                break;
            case CLASS:
            case INTERFACE:
            case ENUM:
                sb.append(kind.getName()).append(' ').append(name);
                break;
            default:
                sb.append(name);
        }
        return sb.toString();
    }
}
