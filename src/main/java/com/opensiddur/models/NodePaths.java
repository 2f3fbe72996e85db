package com.opensiddur.models;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * XPath-like locations ("/text[1]/div[2]/p[1]") used in index entries and error reports.
 */
public final class NodePaths {

    private NodePaths() {}

    public static String root(Node root) {
        return "/" + root.pathName() + "[1]";
    }

    /**
     * Paths of each child of {@code parent}, in child order.
     */
    public static List<String> children(ElementNode parent, String parentPath) {
        return children(parent.getChildren(), parentPath);
    }

    public static List<String> children(List<Node> siblings, String parentPath) {
        Map<String, Integer> counts = new HashMap<>();
        List<String> paths = new ArrayList<>(siblings.size());
        for (Node child : siblings) {
            String name = child.pathName();
            int position = counts.merge(name, 1, Integer::sum);
            paths.add(parentPath + "/" + name + "[" + position + "]");
        }
        return paths;
    }
}
