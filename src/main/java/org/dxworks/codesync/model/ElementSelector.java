package org.dxworks.codesync.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Resolves dotted selectors such as {@code Service}, {@code Outer.Inner} or {@code Service.process} against a
 * parsed Java tree.
 *
 * <p>Resolution is first-match: the first segment names the first top-level type with that name (falling back to
 * the first type with that name anywhere, in declaration order), and every further segment names the first child
 * with that name. Overloaded methods are therefore always resolved to the first declared overload.
 */
public final class ElementSelector {

    private ElementSelector() {
    }

    public static Optional<Element> resolve(StructureTree<Element> tree, String path) {
        List<String> segments = split(path);
        if (segments.isEmpty()) {
            return Optional.empty();
        }
        Optional<Element> current = resolveType(tree, segments.get(0));
        for (int i = 1; i < segments.size() && current.isPresent(); i++) {
            current = current.get().findChild(segments.get(i));
        }
        return current;
    }

    /**
     * Package qualified, dot separated name of the element, e.g. {@code com.acme.Outer.Inner.run}.
     */
    public static String fullName(StructureTree<Element> tree, Element element) {
        List<String> parts = new ArrayList<>();
        parts.add(element.name);
        for (Element ancestor : tree.ancestorsOf(element)) {
            if (ancestor instanceof PackageElement pkg) {
                if (!pkg.isDefaultPackage()) {
                    parts.add(pkg.name);
                }
            } else {
                parts.add(ancestor.name);
            }
        }
        Collections.reverse(parts);
        return String.join(".", parts);
    }

    private static Optional<Element> resolveType(StructureTree<Element> tree, String name) {
        for (Element topLevel : tree.root().children) {
            if (topLevel.kind.isType() && name.equals(topLevel.name)) {
                return Optional.of(topLevel);
            }
        }
        return tree.firstMatch(e -> e.kind.isType() && name.equals(e.name));
    }

    private static List<String> split(String path) {
        List<String> segments = new ArrayList<>();
        if (path == null) {
            return segments;
        }
        for (String segment : path.split("\\.")) {
            String trimmed = segment.trim();
            if (trimmed.isEmpty()) {
                return Collections.emptyList();
            }
            segments.add(trimmed);
        }
        return segments;
    }
}
