package com.opensiddur.storage;

import com.opensiddur.AppLogger;
import com.opensiddur.index.ProjectIndex;
import com.opensiddur.models.Document;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Builds a project index from a projects directory laid out as
 * {@code <root>/<project>/<any/sub/dirs>/<document>.json}.
 *
 * The project and path of each document come from its location; values stored in the
 * file are overwritten. Projects and documents are loaded in name order.
 */
public class ProjectLoader {

    private static final String EXTENSION = ".json";

    private final Path projectsRoot;
    private final AppLogger logger = AppLogger.get();

    public ProjectLoader(Path projectsRoot) {
        this.projectsRoot = projectsRoot;
    }

    public Path getProjectsRoot() {
        return projectsRoot;
    }

    public ProjectIndex load(long generation) throws IOException {
        if (!Files.isDirectory(projectsRoot)) {
            throw new IOException("Projects directory not found: " + projectsRoot);
        }
        ProjectIndex.Builder builder = ProjectIndex.builder().generation(generation);
        int documents = 0;
        for (Path projectDir : listProjects()) {
            String project = projectDir.getFileName().toString();
            builder.project(project);
            for (Path file : listDocuments(projectDir)) {
                Document document = JsonStorage.readDocument(file);
                document.setProject(project);
                document.setPath(documentPath(projectDir, file));
                try {
                    builder.add(document);
                } catch (IllegalArgumentException e) {
                    throw new IOException("Cannot index " + file + ": " + e.getMessage(), e);
                }
                documents++;
            }
        }
        ProjectIndex index = builder.build();
        logger.info("Loaded " + documents + " documents from " + index.getProjects().size() + " projects in "
            + projectsRoot + " (generation " + generation + ", " + index.urnCount() + " URNs)");
        return index;
    }

    private List<Path> listProjects() throws IOException {
        try (Stream<Path> entries = Files.list(projectsRoot)) {
            return entries.filter(Files::isDirectory)
                .filter(p -> !p.getFileName().toString().startsWith("."))
                .sorted()
                .collect(Collectors.toList());
        }
    }

    private List<Path> listDocuments(Path projectDir) throws IOException {
        try (Stream<Path> entries = Files.walk(projectDir)) {
            return new ArrayList<>(entries.filter(Files::isRegularFile)
                .filter(p -> p.getFileName().toString().endsWith(EXTENSION))
                .sorted()
                .collect(Collectors.toList()));
        }
    }

    /**
     * Project-relative path with forward slashes and without the extension, e.g. "bible/genesis".
     */
    static String documentPath(Path projectDir, Path file) {
        String relative = projectDir.relativize(file).toString().replace('\\', '/');
        return relative.substring(0, relative.length() - EXTENSION.length());
    }
}
