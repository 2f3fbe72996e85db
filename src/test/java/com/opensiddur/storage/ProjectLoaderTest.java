package com.opensiddur.storage;

import com.opensiddur.index.ProjectIndex;
import com.opensiddur.models.Document;
import com.opensiddur.models.ElementNode;
import com.opensiddur.models.TextNode;
import com.opensiddur.models.TransclusionRef;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ProjectLoaderTest {

    private static final String GENESIS = "urn:x-opensiddur:text:bible:genesis";

    @TempDir
    Path projectsRoot;

    private void writeVerse(String project, String relativePath, String text) throws IOException {
        ElementNode root = new ElementNode("div").attribute(ElementNode.ATTR_CORRESP, GENESIS + "/1/1")
            .add(new TextNode(text));
        JsonStorage.writeJson(projectsRoot.resolve(project).resolve(relativePath),
            new Document("ignored", "ignored", "en", root));
    }

    @Test
    void loadsProjectsFromDirectories() throws IOException {
        writeVerse("wlc", "bible/genesis.json", "בְּרֵאשִׁית");
        writeVerse("jps1917", "bible/genesis.json", "In the beginning");
        Files.createDirectories(projectsRoot.resolve("commentary"));
        Files.writeString(projectsRoot.resolve("wlc").resolve("README.txt"), "not a document");

        ProjectIndex index = new ProjectLoader(projectsRoot).load(4);
        assertEquals(4, index.getGeneration());
        assertEquals(List.of("commentary", "jps1917", "wlc"), index.getProjects());

        Document genesis = index.document("wlc", "bible/genesis");
        assertNotNull(genesis);
        assertEquals("wlc", genesis.getProject());
        assertEquals(2, index.lookup(GENESIS + "/1/1").size());
        assertTrue(index.documentsOf("commentary").isEmpty());
    }

    @Test
    void readsHandWrittenDocument() throws IOException {
        Path file = projectsRoot.resolve("siddur").resolve("morning.json");
        Files.createDirectories(file.getParent());
        Files.writeString(file, String.join("\n",
            "{",
            "  \"lang\": \"en\",",
            "  \"extra\": true,",
            "  \"root\": {",
            "    \"kind\": \"element\", \"tag\": \"div\",",
            "    \"children\": [",
            "      {\"kind\": \"transclude\", \"target\": \"" + GENESIS + "/1/1\", \"mode\": \"inline\"},",
            "      {\"kind\": \"text\", \"text\": \"Amen\"}",
            "    ]",
            "  }",
            "}"));

        Document morning = new ProjectLoader(projectsRoot).load(1).document("siddur", "morning");
        TransclusionRef ref = (TransclusionRef) morning.getRoot().getChildren().get(0);
        assertEquals(TransclusionRef.Mode.INLINE, ref.getMode());
        assertEquals("Amen", ((TextNode) morning.getRoot().getChildren().get(1)).getText());
    }

    @Test
    void documentWithoutRootIsRejected() throws IOException {
        Path file = projectsRoot.resolve("broken").resolve("empty.json");
        Files.createDirectories(file.getParent());
        Files.writeString(file, "{\"lang\": \"en\"}");
        IOException e = assertThrows(IOException.class, () -> new ProjectLoader(projectsRoot).load(1));
        assertTrue(e.getMessage().contains("empty.json"));
    }

    @Test
    void missingDirectoryIsAnError() {
        assertThrows(IOException.class, () -> new ProjectLoader(projectsRoot.resolve("nope")).load(1));
    }

    @Test
    void documentPathIsProjectRelative() {
        Path project = projectsRoot.resolve("wlc");
        assertEquals("bible/genesis", ProjectLoader.documentPath(project, project.resolve("bible").resolve("genesis.json")));
    }
}
