package com.opensiddur.pipeline;

import com.opensiddur.AppLogger;
import com.opensiddur.errors.CompilationException;
import com.opensiddur.errors.CompileWarning;
import com.opensiddur.errors.ErrorCode;
import com.opensiddur.index.IndexEntry;
import com.opensiddur.index.NoteReference;
import com.opensiddur.index.ProjectIndex;
import com.opensiddur.models.AnchorNode;
import com.opensiddur.models.DocumentKey;
import com.opensiddur.models.ElementNode;
import com.opensiddur.models.Node;
import com.opensiddur.models.Settings;
import com.opensiddur.models.Urn;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Post-pass over the expanded tree.
 *
 * Instruction notes ({@code note type="instruction"} with a {@code corresp} URN) are replaced by
 * the variant of the first project in instruction priority that defines the same URN; with no
 * such project the native note stays.
 *
 * Standoff notes of every annotation project are inserted right after the anchor or element
 * their target names, unless expansion already copied that note from its own document. A note
 * whose target is not in the tree is dropped with a warning.
 */
public class AnnotationMerger {

    private static final String NOTE = "note";

    private final AppLogger logger = AppLogger.get();

    public void merge(ElementNode root, CompilationContext context) {
        Settings settings = context.getSettings();
        if (!settings.instructionsPriority().isEmpty()) {
            mergeInstructions(root, settings.instructionsPriority(), context.getIndex());
        }
        if (!settings.annotationProjects().isEmpty()) {
            mergeCommentary(root, settings.annotationProjects(), context);
        }
    }

    private void mergeInstructions(ElementNode parent, List<String> priority, ProjectIndex index) {
        List<Node> children = parent.getChildren();
        for (int i = 0; i < children.size(); i++) {
            Node child = children.get(i);
            if (!(child instanceof ElementNode)) {
                continue;
            }
            ElementNode element = (ElementNode) child;
            if (isInstruction(element)) {
                ElementNode variant = preferredInstruction(element, priority, index);
                if (variant != null) {
                    children.set(i, variant);
                }
            } else {
                mergeInstructions(element, priority, index);
            }
        }
    }

    private ElementNode preferredInstruction(ElementNode note, List<String> priority, ProjectIndex index) {
        String corresp = note.attribute(ElementNode.ATTR_CORRESP);
        if (!Urn.isUrn(corresp)) {
            return null;
        }
        String canonical;
        try {
            canonical = Urn.parse(corresp).canonical();
        } catch (IllegalArgumentException | CompilationException e) {
            logger.warn("Keeping instruction with unparseable corresp '" + corresp + "': " + e.getMessage());
            return null;
        }
        for (String project : priority) {
            IndexEntry entry = index.lookup(canonical, project);
            if (entry == null) {
                continue;
            }
            Node variant = index.node(entry);
            if (variant instanceof ElementNode && isInstruction((ElementNode) variant)) {
                return plainCopy((ElementNode) variant);
            }
        }
        return null;
    }

    private void mergeCommentary(ElementNode root, List<String> projects, CompilationContext context) {
        Map<Node, ElementNode> parents = new IdentityHashMap<>();
        Map<String, Node> targets = new HashMap<>();
        collectTargets(root, parents, targets);

        Map<Node, List<Node>> inserts = new IdentityHashMap<>();
        List<Node> order = new ArrayList<>();
        for (String project : projects) {
            for (NoteReference reference : context.getIndex().standoffNotes(project)) {
                if (context.isNoteCopied(new DocumentKey(project, reference.documentPath()), reference.nodePath())) {
                    continue;
                }
                String target = stripHash(reference.target());
                String targetEnd = stripHash(reference.targetEnd());
                Node anchor = targets.get(target);
                String missing = null;
                if (anchor == null) {
                    missing = target;
                } else if (targetEnd != null && !targets.containsKey(targetEnd)) {
                    missing = targetEnd;
                }
                if (missing != null) {
                    CompileWarning warning = new CompileWarning(ErrorCode.DANGLING_ANNOTATION_TARGET,
                        "note target '#" + missing + "' is not in the compiled document",
                        project, reference.documentPath(), reference.nodePath());
                    context.warn(warning);
                    logger.warn(warning.toString());
                    continue;
                }
                if (!inserts.containsKey(anchor)) {
                    order.add(anchor);
                }
                inserts.computeIfAbsent(anchor, k -> new ArrayList<>()).add(plainCopy(reference.note()));
            }
        }

        for (Node anchor : order) {
            ElementNode parent = parents.get(anchor);
            List<Node> notes = inserts.get(anchor);
            if (parent == null) {
                // the target is the root itself
                ((ElementNode) anchor).getChildren().addAll(notes);
                continue;
            }
            int position = indexOf(parent.getChildren(), anchor);
            parent.getChildren().addAll(position + 1, notes);
        }
    }

    private void collectTargets(ElementNode element, Map<Node, ElementNode> parents, Map<String, Node> targets) {
        String id = element.attribute(ElementNode.ATTR_ID);
        if (id != null) {
            targets.putIfAbsent(id, element);
        }
        for (Node child : element.getChildren()) {
            parents.put(child, element);
            if (child instanceof AnchorNode && ((AnchorNode) child).getId() != null) {
                targets.putIfAbsent(((AnchorNode) child).getId(), child);
            } else if (child instanceof ElementNode) {
                collectTargets((ElementNode) child, parents, targets);
            }
        }
    }

    private static int indexOf(List<Node> nodes, Node node) {
        for (int i = 0; i < nodes.size(); i++) {
            if (nodes.get(i) == node) {
                return i;
            }
        }
        return nodes.size() - 1;
    }

    private static boolean isInstruction(ElementNode element) {
        return NOTE.equals(element.localName())
            && ProjectIndex.INSTRUCTION_TYPE.equals(element.attribute(ElementNode.ATTR_TYPE));
    }

    private static String stripHash(String target) {
        if (target == null) {
            return null;
        }
        String trimmed = target.trim();
        return trimmed.startsWith("#") ? trimmed.substring(1) : trimmed;
    }

    private static ElementNode plainCopy(ElementNode element) {
        ElementNode copy = element.shallowCopy();
        for (Node child : element.getChildren()) {
            if (child instanceof ElementNode) {
                copy.add(plainCopy((ElementNode) child));
            } else if (!child.isScaffolding()) {
                copy.add(child.copy());
            }
        }
        return copy;
    }
}
