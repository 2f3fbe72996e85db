package com.opensiddur.controllers;

import com.opensiddur.errors.CompilationException;
import io.javalin.Javalin;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Interface for API controllers.
 * Each controller registers its routes with the Javalin app.
 */
public interface Controller {

    /**
     * Register this controller's routes with the Javalin app.
     */
    void registerRoutes(Javalin app);

    /**
     * Error body that never carries a null message. Compile errors also report their code and location.
     */
    static Map<String, Object> errorBody(Exception e) {
        String m = e.getMessage();
        if (m == null || m.isBlank()) {
            m = e.getClass().getSimpleName();
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", m);
        if (e instanceof CompilationException) {
            CompilationException ce = (CompilationException) e;
            body.put("code", ce.getCode().getLabel());
            body.put("project", ce.getProject());
            body.put("document", ce.getDocument());
            body.put("path", ce.getNodePath());
        }
        return body;
    }
}
