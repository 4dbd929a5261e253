package org.dxworks.codesync.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.ArrayList;
import java.util.List;

/**
 * Node of a {@link StructureTree}. Children are owned by value; the parent is only known by its arena index.
 */
public abstract class TreeNode<N extends TreeNode<N>> {
    public List<N> children = new ArrayList<>();

    @JsonIgnore
    int index = -1;
    @JsonIgnore
    int parentIndex = -1;

    /** Name or title used by selectors. */
    @JsonIgnore
    public abstract String label();

    @JsonIgnore
    public int getIndex() {
        return index;
    }

    @JsonIgnore
    public boolean isAttached() {
        return index >= 0;
    }
}
