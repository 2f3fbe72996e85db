package com.opensiddur.pipeline;

import com.opensiddur.conditions.ConditionEvaluator;
import com.opensiddur.conditions.ConditionalScopes;
import com.opensiddur.errors.CompilationCancelledException;
import com.opensiddur.errors.CompileWarning;
import com.opensiddur.errors.CyclicTransclusionException;
import com.opensiddur.index.ProjectIndex;
import com.opensiddur.index.UrnResolver;
import com.opensiddur.models.Document;
import com.opensiddur.models.DocumentKey;
import com.opensiddur.models.Settings;
import com.opensiddur.settings.ScopeTracker;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * State of one compile: the index generation it captured, its settings, scope and conditional
 * state, the transclusion stack, and what it has collected so far. Never shared between compiles.
 */
public class CompilationContext {

    private final String compileId;
    private final ProjectIndex index;
    private final UrnResolver resolver;
    private final Settings settings;
    private final ScopeTracker scopes = new ScopeTracker();
    private final ConditionalScopes conditionals = new ConditionalScopes();
    private final ConditionEvaluator evaluator = new ConditionEvaluator();
    private final AtomicBoolean cancelled;

    private final Map<DocumentKey, DocumentOrder> orders = new HashMap<>();
    private final List<String> activeKeys = new ArrayList<>();
    private final List<String> activeLabels = new ArrayList<>();
    private final Set<DocumentKey> sources = new LinkedHashSet<>();
    private final List<CompileWarning> warnings = new ArrayList<>();
    private final Set<String> copiedNotes = new HashSet<>();
    private long visits;

    public CompilationContext(String compileId, ProjectIndex index, Settings settings, AtomicBoolean cancelled) {
        this.compileId = compileId;
        this.index = index;
        this.resolver = new UrnResolver(index);
        this.settings = settings;
        this.cancelled = cancelled != null ? cancelled : new AtomicBoolean(false);
    }

    public String getCompileId() { return compileId; }
    public ProjectIndex getIndex() { return index; }
    public UrnResolver getResolver() { return resolver; }
    public Settings getSettings() { return settings; }
    public ScopeTracker getScopes() { return scopes; }
    public ConditionalScopes getConditionals() { return conditionals; }
    public ConditionEvaluator getEvaluator() { return evaluator; }

    /**
     * Document order for a source document, validating its scaffolding the first time it is seen.
     */
    public DocumentOrder order(Document document, ScaffoldingValidator validator) {
        DocumentOrder order = orders.get(document.getKey());
        if (order == null) {
            order = new DocumentOrder(document);
            validator.validate(order);
            orders.put(document.getKey(), order);
        }
        return order;
    }

    public long nextVisit() {
        return ++visits;
    }

    public void checkCancelled() {
        if (cancelled.get()) {
            throw new CompilationCancelledException(compileId);
        }
    }

    /**
     * Put a fragment on the transclusion stack.
     *
     * @throws CyclicTransclusionException if it is already being expanded
     */
    public void enter(String key, String label) {
        int existing = activeKeys.indexOf(key);
        if (existing >= 0) {
            List<String> cycle = new ArrayList<>(activeLabels.subList(existing, activeLabels.size()));
            cycle.add(activeLabels.get(existing));
            throw new CyclicTransclusionException(cycle);
        }
        activeKeys.add(key);
        activeLabels.add(label);
    }

    public void leave(String key) {
        int last = activeKeys.lastIndexOf(key);
        if (last >= 0) {
            activeKeys.remove(last);
            activeLabels.remove(last);
        }
    }

    /**
     * Suffix for identifiers copied during the given visit at the current transclusion depth,
     * or null at the top level. The visit number keeps repeated transclusions of one fragment apart.
     */
    public String idSuffix(long visit) {
        if (activeKeys.size() <= 1) {
            return null;
        }
        return sha256(String.join(">", activeKeys) + "#" + visit).substring(0, 8);
    }

    /**
     * Record that a standoff note was copied into the tree where its own document has it.
     */
    public void noteCopied(DocumentKey document, String nodePath) {
        copiedNotes.add(document + nodePath);
    }

    public boolean isNoteCopied(DocumentKey document, String nodePath) {
        return copiedNotes.contains(document + nodePath);
    }

    public void addSource(DocumentKey key) {
        sources.add(key);
    }

    public List<DocumentKey> getSources() {
        return new ArrayList<>(sources);
    }

    public void warn(CompileWarning warning) {
        warnings.add(warning);
    }

    public List<CompileWarning> getWarnings() {
        return new ArrayList<>(warnings);
    }

    private static String sha256(String content) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(content.getBytes(StandardCharsets.UTF_8));
            StringBuilder hex = new StringBuilder();
            for (byte b : hash) {
                hex.append(String.format("%02x", b));
            }
            return hex.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
