package io.waypoint.core.trie;

import io.waypoint.core.model.RouteRecord;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A node of a {@link RouteTrie}. Literal edges are keyed by (possibly lower-cased) segment text; there is
 * at most one param child and one wildcard child per node.
 */
final class TrieNode {

    final TrieNode parent;
    final String edgeKey;
    final Map<String, TrieNode> literals = new LinkedHashMap<>();
    TrieNode paramChild;
    TrieNode wildcardChild;
    RouteRecord terminal;

    /** Cumulative specificity of the edges from the root to this node. */
    final int weight;

    TrieNode(TrieNode parent, String edgeKey, int weight) {
        this.parent = parent;
        this.edgeKey = edgeKey;
        this.weight = weight;
    }

    boolean isLeaf() {
        return literals.isEmpty() && paramChild == null && wildcardChild == null;
    }

    /** Detaches this node from its parent. */
    void unlink() {
        if (parent == null) {
            return;
        }
        if (parent.paramChild == this) {
            parent.paramChild = null;
        } else if (parent.wildcardChild == this) {
            parent.wildcardChild = null;
        } else {
            parent.literals.remove(edgeKey);
        }
    }
}
