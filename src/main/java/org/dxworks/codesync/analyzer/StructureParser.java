package org.dxworks.codesync.analyzer;

import org.dxworks.codesync.model.StructureTree;
import org.dxworks.codesync.model.TreeNode;

/**
 * Turns flat text into a position-addressed tree. Implementations keep no state between calls.
 */
public interface StructureParser<N extends TreeNode<N>> {
    StructureTree<N> parse(String text);
}
