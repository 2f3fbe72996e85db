package com.opensiddur.controllers;

import com.opensiddur.AppLogger;
import com.opensiddur.ProjectContext;
import com.opensiddur.index.ProjectIndex;
import com.opensiddur.models.Document;
import io.javalin.Javalin;
import io.javalin.http.Context;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * REST controller for the project index.
 *
 * Endpoints:
 *   GET  /api/projects      Loaded projects with their document paths
 *   POST /api/index/reload  Rebuild the index from disk and swap it in
 */
public class ProjectController implements Controller {

    private final ProjectContext projects;
    private final AppLogger logger = AppLogger.get();

    public ProjectController(ProjectContext projects) {
        this.projects = projects;
    }

    @Override
    public void registerRoutes(Javalin app) {
        app.get("/api/projects", this::listProjects);
        app.post("/api/index/reload", this::reload);
    }

    private void listProjects(Context ctx) {
        ProjectIndex index = projects.current();
        List<Map<String, Object>> result = new ArrayList<>();
        for (String project : index.getProjects()) {
            List<String> documents = new ArrayList<>();
            for (Document document : index.documentsOf(project)) {
                documents.add(document.getPath());
            }
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("project", project);
            entry.put("documents", documents);
            result.add(entry);
        }
        ctx.json(Map.of("generation", index.getGeneration(), "projects", result));
    }

    private void reload(Context ctx) {
        try {
            ProjectIndex index = projects.reload();
            ctx.json(Map.of("generation", index.getGeneration(), "projects", index.getProjects(),
                "urns", index.urnCount()));
        } catch (IllegalStateException e) {
            ctx.status(409).json(Controller.errorBody(e));
        } catch (Exception e) {
            logger.warn("Failed to reload project index: " + e.getMessage());
            ctx.status(500).json(Controller.errorBody(e));
        }
    }
}
