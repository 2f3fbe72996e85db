package com.opensiddur;

import com.opensiddur.errors.CompilationCancelledException;
import com.opensiddur.errors.CompilationException;
import com.opensiddur.index.ProjectIndex;
import com.opensiddur.models.CompiledDocument;
import com.opensiddur.models.Document;
import com.opensiddur.models.Settings;
import com.opensiddur.pipeline.DocumentCompiler;
import com.opensiddur.settings.SettingsLoader;

import java.io.IOException;
import java.nio.file.Path;
import java.util.NoSuchElementException;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Entry point for compiles. Each compile captures the current index generation once, runs on
 * the calling thread, and can be cancelled by id from any other thread; the request is
 * honoured at the next transclusion.
 */
public class CompilerService {

    private final ProjectContext projects;
    private final DocumentCompiler compiler = new DocumentCompiler();
    private final SettingsLoader settingsLoader = new SettingsLoader();
    private final AppLogger logger = AppLogger.get();

    /** Tracks cancellation requests by compile id */
    private final ConcurrentHashMap<String, AtomicBoolean> cancelFlags = new ConcurrentHashMap<>();

    public CompilerService(ProjectContext projects) {
        this.projects = projects;
    }

    public static String newCompileId() {
        return "compile-" + UUID.randomUUID().toString().substring(0, 8);
    }

    public CompiledDocument compileDocument(String project, String path, Settings settings) {
        return compileDocument(newCompileId(), project, path, settings);
    }

    /**
     * @throws NoSuchElementException    if the project or document is not loaded
     * @throws IllegalArgumentException  if the settings name a project that is not loaded
     * @throws CompilationException      if the document is structurally defective
     */
    public CompiledDocument compileDocument(String compileId, String project, String path, Settings settings) {
        ProjectIndex index = projects.current();
        if (!index.hasProject(project)) {
            throw new NoSuchElementException("Unknown project: " + project);
        }
        Document document = index.document(project, path);
        if (document == null) {
            throw new NoSuchElementException("Unknown document: " + project + ":" + path);
        }
        Settings effective = settings != null ? settings : Settings.empty();
        SettingsLoader.validate(effective, index);
        return run(compileId, () -> compiler.compile(index, document, effective, compileId, cancelFlags.get(compileId)));
    }

    public CompiledDocument compileUrn(String compileId, String urn, Settings settings) {
        ProjectIndex index = projects.current();
        Settings effective = settings != null ? settings : Settings.empty();
        SettingsLoader.validate(effective, index);
        return run(compileId, () -> compiler.compileUrn(index, urn, effective, compileId, cancelFlags.get(compileId)));
    }

    private CompiledDocument run(String compileId, Supplier<CompiledDocument> compile) {
        if (cancelFlags.putIfAbsent(compileId, new AtomicBoolean(false)) != null) {
            throw new IllegalArgumentException("Compile id already in use: " + compileId);
        }
        try {
            return compile.get();
        } catch (CompilationException e) {
            logger.error("Compile " + compileId + " aborted: " + e.getMessage());
            throw e;
        } catch (CompilationCancelledException e) {
            logger.warn("Compile " + compileId + " cancelled");
            throw e;
        } finally {
            cancelFlags.remove(compileId);
        }
    }

    /**
     * Request cancellation of a running compile.
     */
    public boolean cancel(String compileId) {
        AtomicBoolean flag = cancelFlags.get(compileId);
        if (flag != null) {
            flag.set(true);
            return true;
        }
        return false;
    }

    public boolean isRunning(String compileId) {
        return cancelFlags.containsKey(compileId);
    }

    public Settings loadSettings(Path file) throws IOException {
        return settingsLoader.load(file, projects.current());
    }

    public Settings parseSettings(String text) throws IOException {
        Settings settings = settingsLoader.read(text);
        SettingsLoader.validate(settings, projects.current());
        return settings;
    }

    public ProjectContext projects() {
        return projects;
    }
}
