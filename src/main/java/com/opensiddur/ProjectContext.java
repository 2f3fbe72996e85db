package com.opensiddur;

import com.opensiddur.index.ProjectIndex;
import com.opensiddur.storage.ProjectLoader;

import java.io.IOException;
import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runtime holder for the current project index generation.
 *
 * A reload builds a complete new index next to the current one and swaps it in; a compile
 * captures {@link #current()} once and keeps using that generation to the end, so no compile
 * ever sees a half-built index.
 */
public class ProjectContext {
    private final ProjectLoader loader;
    private final AtomicReference<ProjectIndex> current = new AtomicReference<>(ProjectIndex.empty());
    private final AtomicLong generations = new AtomicLong();
    private final AppLogger logger = AppLogger.get();

    public ProjectContext(Path projectsRoot) throws IOException {
        this.loader = new ProjectLoader(projectsRoot);
        reload();
    }

    /**
     * Context over an index built elsewhere; {@link #reload()} is not available.
     */
    public ProjectContext(ProjectIndex index) {
        this.loader = null;
        this.current.set(index);
        this.generations.set(index.getGeneration());
    }

    public synchronized ProjectIndex reload() throws IOException {
        if (loader == null) {
            throw new IllegalStateException("No projects directory to reload from");
        }
        ProjectIndex next = loader.load(generations.incrementAndGet());
        ProjectIndex previous = current.getAndSet(next);
        logger.info("Project index generation " + previous.getGeneration() + " replaced by " + next.getGeneration()
            + " (" + next.getProjects().size() + " projects)");
        return next;
    }

    public ProjectIndex current() {
        return current.get();
    }

    public Path projectsRoot() {
        return loader != null ? loader.getProjectsRoot() : null;
    }
}
