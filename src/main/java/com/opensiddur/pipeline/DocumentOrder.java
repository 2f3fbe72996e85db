package com.opensiddur.pipeline;

import com.opensiddur.models.AnchorNode;
import com.opensiddur.models.Document;
import com.opensiddur.models.ElementNode;
import com.opensiddur.models.Node;
import com.opensiddur.models.NodePaths;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Document-order numbering of one source document. Every node gets its preorder position;
 * its subtree occupies the positions {@code [position, end)}.
 */
public class DocumentOrder {
    private final Document document;
    private final List<Node> nodes = new ArrayList<>();
    private final Map<Node, Integer> positions = new IdentityHashMap<>();
    private final Map<Node, Integer> ends = new IdentityHashMap<>();
    private final Map<Node, String> paths = new IdentityHashMap<>();
    private final Map<Node, ElementNode> parents = new IdentityHashMap<>();

    public DocumentOrder(Document document) {
        this.document = document;
        number(document.getRoot(), null, NodePaths.root(document.getRoot()));
    }

    private void number(Node node, ElementNode parent, String path) {
        positions.put(node, nodes.size());
        nodes.add(node);
        paths.put(node, path);
        if (parent != null) {
            parents.put(node, parent);
        }
        if (node instanceof ElementNode) {
            ElementNode element = (ElementNode) node;
            List<String> childPaths = NodePaths.children(element, path);
            for (int i = 0; i < element.getChildren().size(); i++) {
                number(element.getChildren().get(i), element, childPaths.get(i));
            }
        }
        ends.put(node, nodes.size());
    }

    public Document getDocument() {
        return document;
    }

    public int size() {
        return nodes.size();
    }

    public Node nodeAt(int position) {
        return nodes.get(position);
    }

    public boolean contains(Node node) {
        return positions.containsKey(node);
    }

    public int position(Node node) {
        Integer position = positions.get(node);
        if (position == null) {
            throw new IllegalArgumentException("Node is not part of " + document.getKey());
        }
        return position;
    }

    public int end(Node node) {
        Integer end = ends.get(node);
        if (end == null) {
            throw new IllegalArgumentException("Node is not part of " + document.getKey());
        }
        return end;
    }

    public String path(Node node) {
        return paths.get(node);
    }

    public ElementNode parent(Node node) {
        return parents.get(node);
    }

    /**
     * Ancestors from the root down to the parent of {@code node}.
     */
    public List<ElementNode> ancestors(Node node) {
        List<ElementNode> chain = new ArrayList<>();
        ElementNode current = parent(node);
        while (current != null) {
            chain.add(0, current);
            current = parent(current);
        }
        return chain;
    }

    /**
     * First node with the given xml:id or anchor id, or null.
     */
    public Node findById(String id) {
        for (Node node : nodes) {
            if (node instanceof ElementNode && id.equals(((ElementNode) node).attribute(ElementNode.ATTR_ID))) {
                return node;
            }
            if (node instanceof AnchorNode && id.equals(((AnchorNode) node).getId())) {
                return node;
            }
        }
        return null;
    }
}
