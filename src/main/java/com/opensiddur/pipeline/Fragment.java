package com.opensiddur.pipeline;

import com.opensiddur.models.Document;
import com.opensiddur.models.Node;

import java.util.List;

/**
 * The part of a source document a compile visits: document positions {@code [from, to)}
 * and the top-level nodes to splice. Nodes only partly inside the range are copied as shells
 * holding the parts that are inside.
 */
public class Fragment {

    public enum Coverage {
        FULL,
        PARTIAL,
        NONE
    }

    private final DocumentOrder order;
    private final int from;
    private final int to;
    private final List<Node> topLevel;
    private final boolean whole;

    Fragment(DocumentOrder order, int from, int to, List<Node> topLevel, boolean whole) {
        this.order = order;
        this.from = from;
        this.to = to;
        this.topLevel = List.copyOf(topLevel);
        this.whole = whole;
    }

    public static Fragment whole(DocumentOrder order) {
        return new Fragment(order, 0, order.size(), List.of(order.getDocument().getRoot()), true);
    }

    public Coverage coverage(Node node) {
        int start = order.position(node);
        int end = order.end(node);
        if (start >= from && end <= to) {
            return Coverage.FULL;
        }
        if (end <= from || start >= to) {
            return Coverage.NONE;
        }
        return Coverage.PARTIAL;
    }

    public DocumentOrder getOrder() {
        return order;
    }

    public Document getDocument() {
        return order.getDocument();
    }

    public int getFrom() {
        return from;
    }

    public int getTo() {
        return to;
    }

    public List<Node> getTopLevel() {
        return topLevel;
    }

    /**
     * True when the whole document is visited, so every scope end must match an open scope.
     */
    public boolean isWhole() {
        return whole;
    }
}
