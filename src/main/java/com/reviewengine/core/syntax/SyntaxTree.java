package com.reviewengine.core.syntax;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Parsed program. Immutable; a changed source text gets a new tree.
 */
public final class SyntaxTree {

    private final SyntaxNode root;
    private final int lineCount;

    public SyntaxTree(SyntaxNode root, int lineCount) {
        if (root == null || root.getKind() != NodeKind.MODULE) {
            throw new IllegalArgumentException("Tree root must be a MODULE node");
        }
        this.root = root;
        this.lineCount = lineCount;
    }

    public SyntaxNode getRoot() {
        return root;
    }

    public int getLineCount() {
        return lineCount;
    }

    /**
     * Every node, breadth-first from the root, children in field order.
     * Same visiting order as Python's ast.walk.
     */
    public List<SyntaxNode> walk() {
        List<SyntaxNode> visited = new ArrayList<>();
        Deque<SyntaxNode> queue = new ArrayDeque<>();
        queue.add(root);
        while (!queue.isEmpty()) {
            SyntaxNode node = queue.poll();
            visited.add(node);
            queue.addAll(node.children());
        }
        return visited;
    }

    /**
     * All nodes of the given kind in walk order.
     */
    public List<SyntaxNode> find(NodeKind kind) {
        List<SyntaxNode> matches = new ArrayList<>();
        for (SyntaxNode node : walk()) {
            if (node.getKind() == kind) {
                matches.add(node);
            }
        }
        return matches;
    }
}
