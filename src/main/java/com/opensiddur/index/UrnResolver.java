package com.opensiddur.index;

import com.opensiddur.errors.MalformedRangeException;
import com.opensiddur.errors.UnresolvedUrnException;
import com.opensiddur.models.Urn;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Maps URNs to the project documents that define them.
 *
 * Rules:
 *   - Qualified ("...@project"): at most one match; missing definition throws UnresolvedUrnException.
 *   - Unqualified: every defining project, in index order. Choosing among them is the caller's job.
 *   - Ranges: start and end must be defined by the same project. A project that puts them in two
 *     documents is returned as a split candidate; it only fails once chosen (see requireWhole).
 *
 * Stateless over an immutable index; safe to share between threads.
 */
public class UrnResolver {

    private final ProjectIndex index;

    public UrnResolver(ProjectIndex index) {
        this.index = index;
    }

    public ProjectIndex getIndex() {
        return index;
    }

    /**
     * Resolve a single passage (the start of a range is used if a range is given).
     */
    public List<IndexEntry> resolve(Urn urn) {
        String canonical = urn.canonical();
        if (urn.isQualified()) {
            IndexEntry entry = index.lookup(canonical, urn.getProject());
            if (entry == null) {
                String reason = index.hasProject(urn.getProject()) ? "does not define" : "is not loaded, cannot resolve";
                throw new UnresolvedUrnException("project '" + urn.getProject() + "' " + reason + " " + canonical);
            }
            return List.of(entry);
        }
        return index.lookup(canonical);
    }

    public List<ResolvedRange> resolveRange(Urn urn) {
        if (!urn.isRange()) {
            List<ResolvedRange> single = new ArrayList<>();
            for (IndexEntry entry : resolve(urn)) {
                single.add(new ResolvedRange(entry, entry));
            }
            return single;
        }
        List<IndexEntry> starts = resolve(urn.start());
        List<IndexEntry> ends = resolve(urn.end());
        Map<String, IndexEntry> endsByProject = new HashMap<>();
        for (IndexEntry end : ends) {
            endsByProject.put(end.project(), end);
        }
        List<ResolvedRange> ranges = new ArrayList<>();
        for (IndexEntry start : starts) {
            IndexEntry end = endsByProject.get(start.project());
            if (end == null) {
                continue;
            }
            ResolvedRange range = new ResolvedRange(start, end);
            if (urn.isQualified()) {
                requireWhole(urn, range);
            }
            ranges.add(range);
        }
        if (urn.isQualified() && ranges.isEmpty()) {
            throw new UnresolvedUrnException("project '" + urn.getProject() + "' does not define range " + urn);
        }
        return ranges;
    }

    /**
     * @throws MalformedRangeException if the chosen range starts and ends in different documents
     */
    public static ResolvedRange requireWhole(Urn urn, ResolvedRange range) {
        if (range.isSplit()) {
            throw new MalformedRangeException("range " + urn + " starts in " + range.start().documentKey()
                + " but ends in " + range.end().documentKey());
        }
        return range;
    }

    /**
     * The candidates ordered by {@code priority}; candidates from projects outside the list are dropped.
     */
    public static List<ResolvedRange> prioritize(List<ResolvedRange> candidates, List<String> priority) {
        List<ResolvedRange> ordered = new ArrayList<>();
        for (String project : priority) {
            for (ResolvedRange candidate : candidates) {
                if (candidate.project().equals(project)) {
                    ordered.add(candidate);
                }
            }
        }
        return ordered;
    }
}
