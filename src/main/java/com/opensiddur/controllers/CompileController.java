package com.opensiddur.controllers;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.opensiddur.AppLogger;
import com.opensiddur.CompilerService;
import com.opensiddur.errors.CompilationCancelledException;
import com.opensiddur.errors.CompilationException;
import com.opensiddur.models.CompiledDocument;
import com.opensiddur.models.Settings;
import io.javalin.Javalin;
import io.javalin.http.Context;

import java.util.Map;
import java.util.NoSuchElementException;

/**
 * REST controller for compiles.
 *
 * Endpoints:
 *   POST /api/compile              Compile a document or URN; returns the compiled document
 *   POST /api/compile/{id}/cancel  Cancel a running compile
 */
public class CompileController implements Controller {

    private final CompilerService compilerService;
    private final ObjectMapper objectMapper;
    private final AppLogger logger = AppLogger.get();

    public CompileController(CompilerService compilerService, ObjectMapper objectMapper) {
        this.compilerService = compilerService;
        this.objectMapper = objectMapper;
    }

    @Override
    public void registerRoutes(Javalin app) {
        app.post("/api/compile", this::compile);
        app.post("/api/compile/{id}/cancel", this::cancel);
    }

    /**
     * POST /api/compile
     * Body: { "project": "...", "document": "..." } or { "urn": "..." },
     * plus optional "settings" ({ priority: {...}, annotations: [...] }) and "id".
     */
    private void compile(Context ctx) {
        try {
            JsonNode body = objectMapper.readTree(ctx.body());
            String project = body.path("project").asText(null);
            String document = body.path("document").asText(null);
            String urn = body.path("urn").asText(null);
            String compileId = body.path("id").asText(CompilerService.newCompileId());
            Settings settings = body.path("settings").isObject()
                ? objectMapper.convertValue(body.get("settings"), Settings.class)
                : Settings.empty();

            CompiledDocument compiled;
            if (urn != null && !urn.isBlank()) {
                compiled = compilerService.compileUrn(compileId, urn, settings);
            } else if (project != null && document != null) {
                compiled = compilerService.compileDocument(compileId, project, document, settings);
            } else {
                ctx.status(400).json(Map.of("error", "project and document, or urn, are required"));
                return;
            }
            ctx.json(compiled);
        } catch (CompilationException e) {
            ctx.status(422).json(Controller.errorBody(e));
        } catch (CompilationCancelledException e) {
            ctx.status(409).json(Controller.errorBody(e));
        } catch (NoSuchElementException e) {
            ctx.status(404).json(Controller.errorBody(e));
        } catch (IllegalArgumentException e) {
            ctx.status(400).json(Controller.errorBody(e));
        } catch (Exception e) {
            logger.warn("Failed to compile: " + e.getMessage());
            ctx.status(500).json(Controller.errorBody(e));
        }
    }

    /**
     * POST /api/compile/{id}/cancel
     */
    private void cancel(Context ctx) {
        String compileId = ctx.pathParam("id");
        if (compilerService.cancel(compileId)) {
            logger.info("Cancellation requested for " + compileId);
            ctx.json(Map.of("id", compileId, "status", "cancelling"));
        } else {
            ctx.status(404).json(Map.of("error", "No running compile: " + compileId));
        }
    }
}
