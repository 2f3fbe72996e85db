package com.opensiddur.index;

import com.opensiddur.AppLogger;
import com.opensiddur.errors.CompilationException;
import com.opensiddur.models.Document;
import com.opensiddur.models.DocumentKey;
import com.opensiddur.models.ElementNode;
import com.opensiddur.models.MilestoneNode;
import com.opensiddur.models.Node;
import com.opensiddur.models.NodePaths;
import com.opensiddur.models.Urn;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Read-only index of every loaded project: documents by (project, path), URN definitions,
 * and standoff notes. Built once per generation and never modified afterwards, so any
 * number of compiles may read it concurrently.
 */
public final class ProjectIndex {
    public static final String INSTRUCTION_TYPE = "instruction";

    private final long generation;
    private final List<String> projects;
    private final Map<DocumentKey, Document> documents;
    private final Map<String, Map<String, IndexEntry>> urns;
    private final Map<String, List<NoteReference>> notes;

    private ProjectIndex(long generation, List<String> projects, Map<DocumentKey, Document> documents,
                         Map<String, Map<String, IndexEntry>> urns, Map<String, List<NoteReference>> notes) {
        this.generation = generation;
        this.projects = Collections.unmodifiableList(new ArrayList<>(projects));
        this.documents = Collections.unmodifiableMap(documents);
        Map<String, Map<String, IndexEntry>> frozen = new LinkedHashMap<>();
        urns.forEach((urn, byProject) -> frozen.put(urn, Collections.unmodifiableMap(byProject)));
        this.urns = Collections.unmodifiableMap(frozen);
        Map<String, List<NoteReference>> frozenNotes = new LinkedHashMap<>();
        notes.forEach((project, list) -> frozenNotes.put(project, List.copyOf(list)));
        this.notes = Collections.unmodifiableMap(frozenNotes);
    }

    /**
     * A {@code note} with a {@code target} that is not an instruction.
     */
    public static boolean isStandoffNote(ElementNode element) {
        return "note".equals(element.localName())
            && element.attribute(ElementNode.ATTR_TARGET) != null
            && !INSTRUCTION_TYPE.equals(element.attribute(ElementNode.ATTR_TYPE));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static ProjectIndex empty() {
        return builder().build();
    }

    public long getGeneration() {
        return generation;
    }

    public List<String> getProjects() {
        return projects;
    }

    public boolean hasProject(String project) {
        return project != null && projects.contains(project);
    }

    public Document document(DocumentKey key) {
        return documents.get(key);
    }

    public Document document(String project, String path) {
        return documents.get(new DocumentKey(project, path));
    }

    public List<Document> documentsOf(String project) {
        List<Document> result = new ArrayList<>();
        for (Document doc : documents.values()) {
            if (doc.getProject().equals(project)) {
                result.add(doc);
            }
        }
        return result;
    }

    /**
     * Every project's definition of the canonical URN, in project load order.
     */
    public List<IndexEntry> lookup(String canonicalUrn) {
        Map<String, IndexEntry> byProject = urns.get(canonicalUrn);
        return byProject != null ? List.copyOf(byProject.values()) : List.of();
    }

    public IndexEntry lookup(String canonicalUrn, String project) {
        Map<String, IndexEntry> byProject = urns.get(canonicalUrn);
        return byProject != null ? byProject.get(project) : null;
    }

    /**
     * The node an entry points at.
     */
    public Node node(IndexEntry entry) {
        Document doc = document(entry.documentKey());
        return doc != null ? NodeLocator.find(doc.getRoot(), entry.nodePath()) : null;
    }

    public List<NoteReference> standoffNotes(String project) {
        return notes.getOrDefault(project, List.of());
    }

    public int urnCount() {
        return urns.size();
    }

    public static class Builder {
        private long generation;
        private final Set<String> projects = new LinkedHashSet<>();
        private final Map<DocumentKey, Document> documents = new LinkedHashMap<>();
        private final Map<String, Map<String, IndexEntry>> urns = new LinkedHashMap<>();
        private final Map<String, List<NoteReference>> notes = new LinkedHashMap<>();
        private final AppLogger logger = AppLogger.get();

        public Builder generation(long generation) {
            this.generation = generation;
            return this;
        }

        /**
         * Declare a project even if it has no documents.
         */
        public Builder project(String project) {
            projects.add(project);
            return this;
        }

        public Builder add(Document document) {
            if (document == null || document.getProject() == null || document.getPath() == null) {
                throw new IllegalArgumentException("Document needs project and path");
            }
            if (document.getRoot() == null) {
                throw new IllegalArgumentException("Document " + document.getKey() + " has no root element");
            }
            projects.add(document.getProject());
            documents.put(document.getKey(), document);
            ElementNode root = document.getRoot();
            visit(document, root, NodePaths.root(root));
            return this;
        }

        private void visit(Document document, Node node, String path) {
            if (node instanceof MilestoneNode) {
                register(document, ((MilestoneNode) node).getCorresp(), path);
                return;
            }
            if (!(node instanceof ElementNode)) {
                return;
            }
            ElementNode element = (ElementNode) node;
            register(document, element.attribute(ElementNode.ATTR_CORRESP), path);
            if (isStandoffNote(element)) {
                notes.computeIfAbsent(document.getProject(), k -> new ArrayList<>())
                    .add(new NoteReference(document.getProject(), document.getPath(), path, element));
            }
            List<String> childPaths = NodePaths.children(element, path);
            for (int i = 0; i < element.getChildren().size(); i++) {
                visit(document, element.getChildren().get(i), childPaths.get(i));
            }
        }

        private void register(Document document, String corresp, String path) {
            if (!Urn.isUrn(corresp)) {
                return;
            }
            Urn urn;
            try {
                urn = Urn.parse(corresp);
            } catch (IllegalArgumentException | CompilationException e) {
                logger.warn("Skipping unparseable corresp '" + corresp + "' in " + document.getKey() + " at " + path);
                return;
            }
            if (urn.isRange() || urn.isQualified()) {
                logger.warn("Skipping corresp '" + corresp + "' in " + document.getKey() + " at " + path
                    + ": a definition names one unqualified passage");
                return;
            }
            String canonical = urn.canonical();
            Map<String, IndexEntry> byProject = urns.computeIfAbsent(canonical, k -> new LinkedHashMap<>());
            IndexEntry previous = byProject.put(document.getProject(),
                new IndexEntry(canonical, document.getProject(), document.getPath(), path));
            if (previous != null) {
                logger.warn("URN " + canonical + " defined twice in project " + document.getProject()
                    + " (" + previous.documentPath() + previous.nodePath() + ", " + document.getPath() + path
                    + "); using the last");
            }
        }

        public ProjectIndex build() {
            return new ProjectIndex(generation, new ArrayList<>(projects), new LinkedHashMap<>(documents), urns, notes);
        }
    }
}
