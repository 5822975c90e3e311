package com.namekis.treewatcher;

/**
 * Where {@link StackForestBuilder} put one item. {@code parent} is null for a new root. When
 * {@code parentBecameFolder} is set, a live view showing the parent as a file should now show it as a folder.
 */
public record Placement(Node node, Node parent, boolean parentBecameFolder) {
    public boolean isRoot() {
        return parent == null;
    }
}
