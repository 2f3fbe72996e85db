package com.opensiddur.pipeline;

import com.opensiddur.errors.MalformedRangeException;
import com.opensiddur.models.ElementNode;
import com.opensiddur.models.MilestoneNode;
import com.opensiddur.models.Node;
import com.opensiddur.models.TransclusionRef;
import com.opensiddur.models.Urn;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Selects the part of a document between a start and an end node.
 *
 * Rules:
 *   - The range runs from the start node to the end node inclusive, in document order.
 *   - An end milestone extends the range to the next milestone of the same unit (or of a
 *     shallower URN) inside the milestone's container, or to the end of the container.
 *   - The top-level nodes are the children of the deepest common ancestor that overlap the
 *     range; the common ancestor itself is taken only when it is the start node.
 *   - Inline mode replaces top-level paragraph and line-group wrappers by their children.
 */
public class FragmentExtractor {

    private static final Set<String> INLINE_WRAPPERS = Set.of("p", "lg");

    public Fragment extract(DocumentOrder order, Node start, Node end, TransclusionRef.Mode mode) {
        int from = order.position(start);
        if (order.position(end) < from) {
            throw new MalformedRangeException("range end " + order.path(end) + " precedes its start "
                + order.path(start) + " in " + order.getDocument().getKey());
        }
        int to = end instanceof MilestoneNode ? milestoneEnd(order, (MilestoneNode) end) : order.end(end);

        List<Node> topLevel = new ArrayList<>();
        ElementNode ancestor = commonAncestor(order, start, end);
        if (ancestor == start) {
            to = Math.max(to, order.end(start));
            topLevel.add(start);
        } else {
            for (Node child : ancestor.getChildren()) {
                if (order.end(child) > from && order.position(child) < to) {
                    topLevel.add(child);
                }
            }
        }
        Fragment fragment = new Fragment(order, from, to, topLevel, false);
        if (mode == TransclusionRef.Mode.INLINE) {
            return unwrap(fragment);
        }
        return fragment;
    }

    private Fragment unwrap(Fragment fragment) {
        List<Node> unwrapped = new ArrayList<>();
        for (Node node : fragment.getTopLevel()) {
            if (node instanceof ElementNode && INLINE_WRAPPERS.contains(((ElementNode) node).localName())) {
                for (Node child : ((ElementNode) node).getChildren()) {
                    if (fragment.coverage(child) != Fragment.Coverage.NONE) {
                        unwrapped.add(child);
                    }
                }
            } else {
                unwrapped.add(node);
            }
        }
        return new Fragment(fragment.getOrder(), fragment.getFrom(), fragment.getTo(), unwrapped, false);
    }

    /**
     * Deepest element containing both nodes. A node counts as its own ancestor unless it is a milestone,
     * whose span lives in its container.
     */
    private ElementNode commonAncestor(DocumentOrder order, Node start, Node end) {
        List<ElementNode> startChain = chain(order, start);
        List<ElementNode> endChain = chain(order, end);
        ElementNode common = null;
        for (int i = 0; i < Math.min(startChain.size(), endChain.size()); i++) {
            if (startChain.get(i) != endChain.get(i)) {
                break;
            }
            common = startChain.get(i);
        }
        if (common == null) {
            return order.getDocument().getRoot();
        }
        return common;
    }

    private List<ElementNode> chain(DocumentOrder order, Node node) {
        List<ElementNode> chain = order.ancestors(node);
        if (node instanceof ElementNode) {
            chain.add((ElementNode) node);
        }
        return chain;
    }

    private int milestoneEnd(DocumentOrder order, MilestoneNode milestone) {
        ElementNode container = order.parent(milestone);
        int limit = container != null ? order.end(container) : order.size();
        int depth = urnDepth(milestone.getCorresp());
        for (int i = order.position(milestone) + 1; i < limit; i++) {
            Node node = order.nodeAt(i);
            if (!(node instanceof MilestoneNode)) {
                continue;
            }
            MilestoneNode next = (MilestoneNode) node;
            if (next.getUnit() != null && next.getUnit().equals(milestone.getUnit())) {
                return i;
            }
            int nextDepth = urnDepth(next.getCorresp());
            if (depth > 0 && nextDepth > 0 && nextDepth < depth) {
                return i;
            }
        }
        return limit;
    }

    private static int urnDepth(String corresp) {
        if (!Urn.isUrn(corresp)) {
            return -1;
        }
        try {
            return Urn.parse(corresp).depth();
        } catch (IllegalArgumentException | MalformedRangeException e) {
            return -1;
        }
    }
}
