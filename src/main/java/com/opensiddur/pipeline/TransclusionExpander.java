package com.opensiddur.pipeline;

import com.opensiddur.AppLogger;
import com.opensiddur.conditions.Truth;
import com.opensiddur.errors.CompilationException;
import com.opensiddur.errors.UnbalancedScopeException;
import com.opensiddur.errors.UnmatchedConditionalException;
import com.opensiddur.errors.UnresolvedUrnException;
import com.opensiddur.index.ProjectIndex;
import com.opensiddur.index.ResolvedRange;
import com.opensiddur.index.UrnResolver;
import com.opensiddur.models.AnchorNode;
import com.opensiddur.models.ConditionalBlock;
import com.opensiddur.models.DeclareBlock;
import com.opensiddur.models.Document;
import com.opensiddur.models.ElementNode;
import com.opensiddur.models.EndConditional;
import com.opensiddur.models.EndDeclare;
import com.opensiddur.models.MilestoneNode;
import com.opensiddur.models.Node;
import com.opensiddur.models.ScopeOwner;
import com.opensiddur.models.Settings;
import com.opensiddur.models.TextNode;
import com.opensiddur.models.TransclusionRef;
import com.opensiddur.models.Urn;

import java.util.ArrayList;
import java.util.List;

/**
 * Walks a document depth-first, copying what survives into a new tree.
 *
 * Transclusions are replaced by the fragment they point at, expanded recursively. Declares and
 * conditionals are applied in document order during the same walk, so every conditional sees
 * the scope state established by everything before it, including transcluded content.
 *
 * Rules while a conditional region decided FALSE is open:
 *   - text, milestones, internal anchors and transclusions are dropped;
 *   - external anchors are kept;
 *   - an element is kept only if something inside it survives;
 *   - declares and conditionals are still tracked.
 */
public class TransclusionExpander {

    private static final String SEG = "seg";

    private final ScaffoldingValidator validator = new ScaffoldingValidator();
    private final FragmentExtractor extractor = new FragmentExtractor();
    private final AppLogger logger = AppLogger.get();

    public ElementNode expand(Document document, CompilationContext context) {
        DocumentOrder order = context.order(document, validator);
        ElementNode root = document.getRoot();
        String key = key(order, root, root);
        context.enter(key, rootLabel(document));
        try {
            context.addSource(document.getKey());
            Visit visit = new Visit(Fragment.whole(order), context.nextVisit(), document.effectiveLang(), null);
            List<Node> expanded = visitFragment(visit, context);
            if (expanded.size() == 1 && expanded.get(0) instanceof ElementNode) {
                return (ElementNode) expanded.get(0);
            }
            ElementNode shell = root.shallowCopy();
            expanded.forEach(shell::add);
            return shell;
        } finally {
            context.leave(key);
        }
    }

    private List<Node> visitFragment(Visit visit, CompilationContext context) {
        List<Node> out = new ArrayList<>();
        for (Node node : visit.fragment.getTopLevel()) {
            out.addAll(visitNode(node, visit, context));
        }
        // scopes whose end lies past the fragment close at its boundary
        context.getScopes().endVisit(visit.id);
        context.getConditionals().closeVisit(visit.id);
        return out;
    }

    private List<Node> visitNode(Node node, Visit visit, CompilationContext context) {
        if (visit.fragment.coverage(node) == Fragment.Coverage.NONE) {
            return List.of();
        }
        Document document = visit.fragment.getDocument();
        try {
            return dispatch(node, visit, context);
        } catch (CompilationException e) {
            throw e.at(document.getProject(), document.getPath(), visit.fragment.getOrder().path(node));
        }
    }

    private List<Node> dispatch(Node node, Visit visit, CompilationContext context) {
        boolean excluding = context.getConditionals().isExcluding();
        if (node instanceof ElementNode) {
            return visitElement((ElementNode) node, visit, context);
        }
        if (node instanceof TextNode) {
            return excluding ? List.of() : List.of(node.copy());
        }
        if (node instanceof MilestoneNode) {
            return excluding ? List.of() : List.of(node.copy());
        }
        if (node instanceof AnchorNode) {
            AnchorNode anchor = (AnchorNode) node;
            if (anchor.isExternal()) {
                return List.of(anchor.copy());
            }
            return excluding ? List.of() : List.of(new AnchorNode(visit.rewriteId(anchor.getId()), anchor.getType()));
        }
        if (node instanceof TransclusionRef) {
            return excluding ? List.of() : transclude((TransclusionRef) node, visit, context);
        }
        if (node instanceof DeclareBlock) {
            DeclareBlock declare = (DeclareBlock) node;
            context.getScopes().declare(new ScopeOwner(visit.id, declare.getId()), declare.getAssignments());
            return List.of();
        }
        if (node instanceof EndDeclare) {
            endDeclare((EndDeclare) node, visit, context);
            return List.of();
        }
        if (node instanceof ConditionalBlock) {
            return openConditional((ConditionalBlock) node, visit, context, excluding);
        }
        if (node instanceof EndConditional) {
            String target = ((EndConditional) node).getTarget();
            boolean closed = context.getConditionals().close(new ScopeOwner(visit.id, target));
            if (!closed && visit.fragment.isWhole()) {
                throw new UnmatchedConditionalException("no open conditional with id '" + target + "'");
            }
            return List.of();
        }
        throw new IllegalArgumentException("Unsupported node type: " + node.getClass().getSimpleName());
    }

    private List<Node> visitElement(ElementNode element, Visit visit, CompilationContext context) {
        boolean excludedAtStart = context.getConditionals().isExcluding();
        ElementNode copy = element.shallowCopy();
        String id = element.attribute(ElementNode.ATTR_ID);
        if (id != null) {
            copy.attribute(ElementNode.ATTR_ID, visit.rewriteId(id));
        }
        for (Node child : element.getChildren()) {
            copy.getChildren().addAll(visitNode(child, visit, context));
        }
        if (excludedAtStart && copy.getChildren().isEmpty()) {
            return List.of();
        }
        if (ProjectIndex.isStandoffNote(element)) {
            DocumentOrder order = visit.fragment.getOrder();
            context.noteCopied(order.getDocument().getKey(), order.path(element));
        }
        return List.of(copy);
    }

    private void endDeclare(EndDeclare end, Visit visit, CompilationContext context) {
        ScopeOwner owner = new ScopeOwner(visit.id, end.getTarget());
        if (context.getScopes().isOpen(owner)) {
            context.getScopes().endDeclare(owner);
        } else if (visit.fragment.isWhole()) {
            throw new UnbalancedScopeException("no open declare with id '" + end.getTarget() + "'");
        }
    }

    private List<Node> openConditional(ConditionalBlock conditional, Visit visit, CompilationContext context,
                                       boolean excluding) {
        Truth decision = context.getEvaluator().evaluate(conditional.getCondition(), context.getScopes());
        context.getConditionals().open(new ScopeOwner(visit.id, conditional.getId()), decision);
        if (excluding || decision != Truth.UNDEFINED || conditional.getInstruction() == null) {
            return List.of();
        }
        return List.of(plainCopy(conditional.getInstruction(), visit));
    }

    private List<Node> transclude(TransclusionRef ref, Visit visit, CompilationContext context) {
        context.checkCancelled();
        Target target = resolve(ref, visit, context);
        DocumentOrder order = context.order(target.document, validator);
        Fragment fragment = extractor.extract(order, target.start, target.end, ref.getMode());
        String key = key(order, target.start, target.end);
        context.enter(key, target.label);
        try {
            context.addSource(target.document.getKey());
            String lang = target.document.effectiveLang() != null ? target.document.effectiveLang() : visit.lang;
            long visitId = context.nextVisit();
            Visit child = new Visit(fragment, visitId, lang, context.idSuffix(visitId));
            List<Node> expanded = visitFragment(child, context);
            return markLanguage(expanded, child.lang, visit.lang);
        } finally {
            context.leave(key);
        }
    }

    private Target resolve(TransclusionRef ref, Visit visit, CompilationContext context) {
        String text = ref.getTarget();
        if (text == null || text.isBlank()) {
            throw new UnresolvedUrnException("transclusion without a target");
        }
        if (text.startsWith("#")) {
            DocumentOrder order = visit.fragment.getOrder();
            Node start = byId(order, text);
            Node end = ref.getTargetEnd() != null ? byId(order, ref.getTargetEnd()) : start;
            return new Target(order.getDocument(), start, end, order.getDocument().getKey() + text);
        }

        Urn urn;
        try {
            urn = Urn.parse(text.trim());
            if (ref.getTargetEnd() != null) {
                urn = Urn.range(urn, Urn.parse(ref.getTargetEnd().trim()));
            }
        } catch (IllegalArgumentException e) {
            throw new UnresolvedUrnException("cannot parse transclusion target: " + e.getMessage());
        }

        List<ResolvedRange> candidates = context.getResolver().resolveRange(urn);
        ResolvedRange chosen = choose(urn, candidates, visit.fragment.getDocument().getProject(), context.getSettings());
        Document document = context.getIndex().document(chosen.documentKey());
        Node start = context.getIndex().node(chosen.start());
        Node end = context.getIndex().node(chosen.end());
        if (document == null || start == null || end == null) {
            throw new UnresolvedUrnException("index entry for " + urn + " points at a missing node in "
                + chosen.documentKey());
        }
        return new Target(document, start, end, urn.withProject(chosen.project()).toString());
    }

    /**
     * Qualified references take their only match; otherwise the first project in transclusion
     * priority wins, falling back to the project of the document being processed. Only the chosen
     * candidate has to keep its range inside one document.
     */
    static ResolvedRange choose(Urn urn, List<ResolvedRange> candidates, String currentProject, Settings settings) {
        if (urn.isQualified() && !candidates.isEmpty()) {
            return UrnResolver.requireWhole(urn, candidates.get(0));
        }
        List<ResolvedRange> ordered = UrnResolver.prioritize(candidates, settings.transclusionPriority());
        if (!ordered.isEmpty()) {
            return UrnResolver.requireWhole(urn, ordered.get(0));
        }
        for (ResolvedRange candidate : candidates) {
            if (candidate.project().equals(currentProject)) {
                return UrnResolver.requireWhole(urn, candidate);
            }
        }
        throw new UnresolvedUrnException("no project in " + settings.transclusionPriority()
            + " or the current project '" + currentProject + "' defines " + urn);
    }

    private Node byId(DocumentOrder order, String reference) {
        String id = reference.startsWith("#") ? reference.substring(1) : reference;
        Node node = order.findById(id);
        if (node == null) {
            throw new UnresolvedUrnException("no element or anchor with id '" + id + "' in "
                + order.getDocument().getKey());
        }
        return node;
    }

    private List<Node> markLanguage(List<Node> nodes, String lang, String enclosingLang) {
        if (lang == null || lang.equals(enclosingLang)) {
            return nodes;
        }
        List<Node> marked = new ArrayList<>();
        for (Node node : nodes) {
            if (node instanceof ElementNode) {
                ElementNode element = (ElementNode) node;
                if (element.attribute(ElementNode.ATTR_LANG) == null) {
                    element.attribute(ElementNode.ATTR_LANG, lang);
                }
                marked.add(element);
            } else if (node instanceof TextNode && !isBlank(((TextNode) node).getText())) {
                marked.add(new ElementNode(SEG).attribute(ElementNode.ATTR_LANG, lang).add(node));
            } else {
                marked.add(node);
            }
        }
        return marked;
    }

    /**
     * Copy of a note or other plain content, without scaffolding.
     */
    private Node plainCopy(ElementNode element, Visit visit) {
        ElementNode copy = element.shallowCopy();
        String id = element.attribute(ElementNode.ATTR_ID);
        if (id != null) {
            copy.attribute(ElementNode.ATTR_ID, visit.rewriteId(id));
        }
        for (Node child : element.getChildren()) {
            if (child instanceof ElementNode) {
                copy.add(plainCopy((ElementNode) child, visit));
            } else if (!child.isScaffolding()) {
                copy.add(child.copy());
            } else {
                logger.warn("Dropping " + child.pathName() + " inside instruction of conditional in "
                    + visit.fragment.getDocument().getKey());
            }
        }
        return copy;
    }

    private static boolean isBlank(String text) {
        return text == null || text.isBlank();
    }

    private static String key(DocumentOrder order, Node start, Node end) {
        return order.getDocument().getKey() + order.path(start) + ".." + order.path(end);
    }

    private static String rootLabel(Document document) {
        String corresp = document.getRoot().attribute(ElementNode.ATTR_CORRESP);
        return Urn.isUrn(corresp) ? corresp + "@" + document.getProject() : document.getKey().toString();
    }

    private static class Target {
        final Document document;
        final Node start;
        final Node end;
        final String label;

        Target(Document document, Node start, Node end, String label) {
            this.document = document;
            this.start = start;
            this.end = end;
            this.label = label;
        }
    }

    /**
     * One pass over one fragment. Scope ids are only meaningful within a visit.
     */
    private static class Visit {
        final Fragment fragment;
        final long id;
        final String lang;
        final String idSuffix;

        Visit(Fragment fragment, long id, String lang, String idSuffix) {
            this.fragment = fragment;
            this.id = id;
            this.lang = lang;
            this.idSuffix = idSuffix;
        }

        String rewriteId(String original) {
            if (original == null || idSuffix == null) {
                return original;
            }
            return original + "_" + idSuffix;
        }
    }
}
