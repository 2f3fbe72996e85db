package com.opensiddur.index;

import com.opensiddur.models.ElementNode;
import com.opensiddur.models.Node;
import com.opensiddur.models.NodePaths;

import java.util.ArrayList;
import java.util.List;

/**
 * Finds nodes in a document tree by node path, URN or id.
 */
public final class NodeLocator {

    private NodeLocator() {}

    public static Node find(ElementNode root, String nodePath) {
        if (root == null || nodePath == null) {
            return null;
        }
        if (nodePath.equals(NodePaths.root(root))) {
            return root;
        }
        return findBelow(root, NodePaths.root(root), nodePath);
    }

    private static Node findBelow(ElementNode parent, String parentPath, String target) {
        List<String> childPaths = NodePaths.children(parent, parentPath);
        for (int i = 0; i < childPaths.size(); i++) {
            String childPath = childPaths.get(i);
            Node child = parent.getChildren().get(i);
            if (childPath.equals(target)) {
                return child;
            }
            if (child instanceof ElementNode && target.startsWith(childPath + "/")) {
                return findBelow((ElementNode) child, childPath, target);
            }
        }
        return null;
    }

    /**
     * Chain of nodes from {@code root} down to {@code target}, both included; empty if absent.
     */
    public static List<Node> ancestry(ElementNode root, Node target) {
        List<Node> chain = new ArrayList<>();
        if (collect(root, target, chain)) {
            return chain;
        }
        return List.of();
    }

    private static boolean collect(Node current, Node target, List<Node> chain) {
        chain.add(current);
        if (current == target) {
            return true;
        }
        if (current instanceof ElementNode) {
            for (Node child : ((ElementNode) current).getChildren()) {
                if (collect(child, target, chain)) {
                    return true;
                }
            }
        }
        chain.remove(chain.size() - 1);
        return false;
    }
}
