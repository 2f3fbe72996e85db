package com.opensiddur;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.opensiddur.controllers.CompileController;
import com.opensiddur.controllers.Controller;
import com.opensiddur.controllers.ProjectController;
import com.opensiddur.models.CompiledDocument;
import com.opensiddur.models.Settings;
import com.opensiddur.pipeline.CompiledDocumentEmitter;
import io.javalin.Javalin;
import io.javalin.json.JavalinJackson;

import java.util.List;

/**
 * Command line:
 * <pre>
 *   --projects DIR --project P --document PATH [--settings FILE] [--output FILE]
 *   --projects DIR --urn URN [--settings FILE] [--output FILE]
 *   --projects DIR --serve [--port N]
 * </pre>
 * Without {@code --output} the compiled document is written to standard output.
 */
public class Main {

    private static final String VERSION = "1.0.0";
    private static final ObjectMapper objectMapper = new ObjectMapper();
    private static AppLogger logger;

    public static void main(String[] args) {
        AppConfig config;
        try {
            config = new AppConfig.Builder()
                    .parseArgs(args)
                    .build();

            // console output would mix with a compiled document on stdout
            boolean console = config.isServe() || config.isDevMode() || config.getOutputPath() != null;
            AppLogger.initialize(config.getLogPath(), console);
            logger = AppLogger.get();
        } catch (Exception e) {
            System.err.println("Failed to start Siddur Compiler: " + e.getMessage());
            System.exit(2);
            return;
        }

        try {
            ProjectContext projects = new ProjectContext(config.getProjectsPath());
            CompilerService compilerService = new CompilerService(projects);
            if (config.isServe()) {
                serve(config, projects, compilerService);
            } else {
                compile(config, compilerService);
                logger.close();
            }
        } catch (Exception e) {
            logger.error("Failed: " + e.getMessage());
            System.err.println(e.getMessage());
            logger.close();
            System.exit(1);
        }
    }

    private static void compile(AppConfig config, CompilerService compilerService) throws Exception {
        Settings settings = config.getSettingsPath() != null
            ? compilerService.loadSettings(config.getSettingsPath())
            : Settings.empty();

        CompiledDocument compiled;
        String compileId = CompilerService.newCompileId();
        if (config.getUrn() != null) {
            compiled = compilerService.compileUrn(compileId, config.getUrn(), settings);
        } else if (config.getProject() != null && config.getDocument() != null) {
            compiled = compilerService.compileDocument(compileId, config.getProject(), config.getDocument(), settings);
        } else {
            throw new IllegalArgumentException("Give --project and --document, or --urn, or --serve");
        }

        CompiledDocumentEmitter emitter = new CompiledDocumentEmitter(objectMapper);
        if (config.getOutputPath() != null) {
            emitter.write(compiled, config.getOutputPath());
            logger.info("Compiled document written to " + config.getOutputPath());
        } else {
            System.out.println(emitter.toJson(compiled));
        }
        for (var warning : compiled.getWarnings()) {
            System.err.println("warning: " + warning);
        }
    }

    private static void serve(AppConfig config, ProjectContext projects, CompilerService compilerService) {
        printBanner(config);

        Javalin app = Javalin.create(cfg -> {
            cfg.jsonMapper(new JavalinJackson(objectMapper, false));
            cfg.http.defaultContentType = "application/json";
        });

        List<Controller> controllers = List.of(
            new CompileController(compilerService, objectMapper),
            new ProjectController(projects)
        );
        for (Controller controller : controllers) {
            controller.registerRoutes(app);
        }

        app.exception(Exception.class, (e, ctx) -> {
            logger.error("Unhandled exception: " + e.getMessage(), e);
            ctx.status(500).json(Controller.errorBody(e));
        });

        app.start(config.getPort());

        String url = "http://localhost:" + config.getPort() + "/";
        logger.info("Server started on " + url);
        logger.console("");
        logger.console("  Listening on " + url);
        logger.console("  Projects: " + config.getProjectsPath());
        logger.console("  Log file: " + config.getLogPath());
        logger.console("");
        logger.console("========================================");
        logger.console("  Press Ctrl+C to stop");
        logger.console("========================================");

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            logger.info("Shutting down...");
            app.stop();
            logger.close();
        }));
    }

    private static void printBanner(AppConfig config) {
        logger.console("");
        logger.console("========================================");
        logger.console("  Siddur Compiler v" + VERSION);
        logger.console("========================================");
        logger.console("  Starting server...");
        if (config.isDevMode()) {
            logger.console("  Mode: Development");
        }
    }
}
