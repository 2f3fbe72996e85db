package com.opensiddur.pipeline;

import com.opensiddur.AppLogger;
import com.opensiddur.index.ProjectIndex;
import com.opensiddur.index.ResolvedRange;
import com.opensiddur.index.UrnResolver;
import com.opensiddur.models.CompiledDocument;
import com.opensiddur.models.Document;
import com.opensiddur.models.DocumentKey;
import com.opensiddur.models.ElementNode;
import com.opensiddur.models.Settings;
import com.opensiddur.models.TransclusionRef;
import com.opensiddur.models.Urn;

import java.util.List;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs one compile: expansion with scope and conditional tracking, annotation merge, and a
 * final check that no scaffolding is left. Holds no state of its own; every call gets a fresh
 * {@link CompilationContext}, so one instance may serve concurrent compiles.
 */
public class DocumentCompiler {

    private static final String URN_ROOT = "div";

    private final TransclusionExpander expander = new TransclusionExpander();
    private final AnnotationMerger merger = new AnnotationMerger();
    private final AppLogger logger = AppLogger.get();

    public CompiledDocument compile(ProjectIndex index, Document document, Settings settings) {
        return compile(index, document, settings, UUID.randomUUID().toString(), null);
    }

    public CompiledDocument compile(ProjectIndex index, Document document, Settings settings,
                                    String compileId, AtomicBoolean cancelled) {
        Settings effective = (settings != null ? settings : Settings.empty()).withDefaults(document.getProject());
        CompilationContext context = new CompilationContext(compileId, index, effective, cancelled);
        long started = System.currentTimeMillis();
        logger.info("Compile " + compileId + " started for " + document.getKey() + " (generation "
            + index.getGeneration() + ")");

        ElementNode root = expander.expand(document, context);
        merger.merge(root, context);
        CompiledDocumentEmitter.verify(root);

        CompiledDocument compiled = new CompiledDocument(document.getProject(), document.getPath(),
            index.getGeneration(), root, context.getSources(), context.getWarnings());
        logger.info("Compile " + compileId + " finished in " + (System.currentTimeMillis() - started) + " ms, "
            + compiled.getSources().size() + " sources, " + compiled.getWarnings().size() + " warnings");
        return compiled;
    }

    /**
     * Compile starting from a URN: the passage chosen by transclusion priority (or the
     * qualifier) is expanded inside a {@code div} as if a document transcluded it.
     */
    public CompiledDocument compileUrn(ProjectIndex index, String urnText, Settings settings,
                                       String compileId, AtomicBoolean cancelled) {
        Urn urn = Urn.parse(urnText);
        Settings effective = settings != null ? settings : Settings.empty();
        List<ResolvedRange> candidates = new UrnResolver(index).resolveRange(urn);
        String fallback = effective.transclusionPriority().isEmpty() && !candidates.isEmpty()
            ? candidates.get(0).project() : null;
        ResolvedRange chosen = TransclusionExpander.choose(urn, candidates, fallback, effective);

        Urn qualified = urn.withProject(chosen.project());
        String targetEnd = urn.isRange() ? qualified.end().toString() : null;
        ElementNode wrapper = new ElementNode(URN_ROOT)
            .add(new TransclusionRef(qualified.start().toString(), targetEnd, TransclusionRef.Mode.EXTERNAL));
        Document start = new Document(chosen.project(), urn.toString(), null, wrapper);
        CompiledDocument compiled = compile(index, start, effective, compileId, cancelled);

        List<DocumentKey> sources = compiled.getSources();
        sources.remove(start.getKey());
        compiled.setSources(sources);
        return compiled;
    }
}
