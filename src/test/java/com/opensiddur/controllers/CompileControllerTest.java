package com.opensiddur.controllers;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.opensiddur.CompilerService;
import com.opensiddur.ProjectContext;
import com.opensiddur.index.ProjectIndex;
import com.opensiddur.models.Document;
import com.opensiddur.models.ElementNode;
import com.opensiddur.models.TextNode;
import com.opensiddur.models.TransclusionRef;
import io.javalin.Javalin;
import io.javalin.json.JavalinJackson;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;

import static org.junit.jupiter.api.Assertions.*;

class CompileControllerTest {

    private static final String PSALM = "urn:x-opensiddur:text:bible:psalms/23/1";

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final HttpClient client = HttpClient.newHttpClient();
    private Javalin app;

    @BeforeEach
    void startServer() {
        Document psalm = new Document("jps1917", "bible/psalm23", "en",
            new ElementNode("p").attribute(ElementNode.ATTR_CORRESP, PSALM).add(new TextNode("The Lord is my shepherd")));
        Document service = new Document("siddur", "services/mourning", "en",
            new ElementNode("div").add(new TransclusionRef(PSALM, TransclusionRef.Mode.EXTERNAL)));
        Document broken = new Document("siddur", "services/broken", "en",
            new ElementNode("div").add(new TransclusionRef(PSALM + "@wlc", TransclusionRef.Mode.EXTERNAL)));
        ProjectContext projects = new ProjectContext(ProjectIndex.builder().add(psalm).add(service).add(broken).build());

        app = Javalin.create(cfg -> {
            cfg.jsonMapper(new JavalinJackson(objectMapper, false));
            cfg.http.defaultContentType = "application/json";
        });
        new CompileController(new CompilerService(projects), objectMapper).registerRoutes(app);
        new ProjectController(projects).registerRoutes(app);
        app.start(0);
    }

    @AfterEach
    void stopServer() {
        app.stop();
    }

    private HttpResponse<String> post(String path, String body) throws IOException, InterruptedException {
        HttpRequest request = HttpRequest.newBuilder(URI.create("http://localhost:" + app.port() + path))
            .POST(HttpRequest.BodyPublishers.ofString(body))
            .header("Content-Type", "application/json")
            .build();
        return client.send(request, HttpResponse.BodyHandlers.ofString());
    }

    @Test
    void compilesDocument() throws Exception {
        HttpResponse<String> response = post("/api/compile",
            "{\"project\":\"siddur\",\"document\":\"services/mourning\",\"settings\":{\"priority\":{\"transclusion\":[\"jps1917\"]}}}");
        assertEquals(200, response.statusCode());
        JsonNode compiled = objectMapper.readTree(response.body());
        assertEquals("services/mourning", compiled.get("document").asText());
        assertEquals("The Lord is my shepherd",
            compiled.get("root").get("children").get(0).get("children").get(0).get("text").asText());
    }

    @Test
    void compilesUrn() throws Exception {
        HttpResponse<String> response = post("/api/compile", "{\"urn\":\"" + PSALM + "\"}");
        assertEquals(200, response.statusCode());
        assertEquals("jps1917", objectMapper.readTree(response.body()).get("project").asText());
    }

    @Test
    void statusCodes() throws Exception {
        assertEquals(400, post("/api/compile", "{}").statusCode());
        assertEquals(404, post("/api/compile", "{\"project\":\"siddur\",\"document\":\"nope\"}").statusCode());
        assertEquals(400, post("/api/compile",
            "{\"project\":\"siddur\",\"document\":\"services/mourning\",\"settings\":{\"annotations\":[\"x\"]}}").statusCode());

        HttpResponse<String> broken = post("/api/compile", "{\"project\":\"siddur\",\"document\":\"services/broken\"}");
        assertEquals(422, broken.statusCode());
        JsonNode error = objectMapper.readTree(broken.body());
        assertEquals("UnresolvedURN", error.get("code").asText());
        assertEquals("/div[1]/transclude[1]", error.get("path").asText());
    }

    @Test
    void cancelUnknownCompile() throws Exception {
        assertEquals(404, post("/api/compile/compile-none/cancel", "").statusCode());
    }

    @Test
    void listsProjects() throws Exception {
        HttpRequest request = HttpRequest.newBuilder(URI.create("http://localhost:" + app.port() + "/api/projects")).GET().build();
        JsonNode body = objectMapper.readTree(client.send(request, HttpResponse.BodyHandlers.ofString()).body());
        assertEquals("jps1917", body.get("projects").get(0).get("project").asText());
        assertEquals("services/mourning", body.get("projects").get(1).get("documents").get(0).asText());
        assertEquals(409, post("/api/index/reload", "").statusCode());
    }
}
