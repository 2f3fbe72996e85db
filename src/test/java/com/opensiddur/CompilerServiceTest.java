package com.opensiddur;

import com.opensiddur.errors.UnresolvedUrnException;
import com.opensiddur.index.ProjectIndex;
import com.opensiddur.models.CompiledDocument;
import com.opensiddur.models.Document;
import com.opensiddur.models.ElementNode;
import com.opensiddur.models.Settings;
import com.opensiddur.models.TextNode;
import com.opensiddur.models.TransclusionRef;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;
import java.util.NoSuchElementException;

import static org.junit.jupiter.api.Assertions.*;

class CompilerServiceTest {

    private static final String KADDISH = "urn:x-opensiddur:text:liturgy:kaddish";

    private CompilerService buildService() {
        Document kaddish = new Document("siddur", "prayers/kaddish", "en",
            new ElementNode("p").attribute(ElementNode.ATTR_CORRESP, KADDISH).add(new TextNode("Magnified")));
        Document morning = new Document("siddur", "services/morning", "en",
            new ElementNode("div").add(new TransclusionRef(KADDISH, TransclusionRef.Mode.EXTERNAL)));
        Document broken = new Document("siddur", "services/broken", "en",
            new ElementNode("div").add(new TransclusionRef(KADDISH + "/9", TransclusionRef.Mode.EXTERNAL)));
        ProjectIndex index = ProjectIndex.builder().generation(2).add(kaddish).add(morning).add(broken).build();
        return new CompilerService(new ProjectContext(index));
    }

    @Test
    void compilesDocument() {
        CompiledDocument compiled = buildService().compileDocument("siddur", "services/morning", null);
        assertEquals(2, compiled.getGeneration());
        assertEquals("services/morning", compiled.getDocument());
        assertEquals(2, compiled.getSources().size());
    }

    @Test
    void compilesUrn() {
        CompiledDocument compiled = buildService().compileUrn("u1", KADDISH, Settings.empty());
        assertEquals("siddur", compiled.getProject());
    }

    @Test
    void unknownProjectOrDocument() {
        CompilerService service = buildService();
        assertThrows(NoSuchElementException.class, () -> service.compileDocument("nope", "services/morning", null));
        assertThrows(NoSuchElementException.class, () -> service.compileDocument("siddur", "services/none", null));
    }

    @Test
    void settingsMustNameLoadedProjects() {
        Settings settings = new Settings(List.of("wlc"), List.of(), List.of());
        assertThrows(IllegalArgumentException.class,
            () -> buildService().compileDocument("siddur", "services/morning", settings));
    }

    @Test
    void failedCompileReleasesItsId() {
        CompilerService service = buildService();
        assertThrows(UnresolvedUrnException.class,
            () -> service.compileDocument("c1", "siddur", "services/broken", null));
        assertFalse(service.isRunning("c1"));
        assertFalse(service.cancel("c1"));
        assertNotNull(service.compileDocument("c1", "siddur", "services/morning", null));
    }

    @Test
    void parsesAndValidatesSettings() throws IOException {
        CompilerService service = buildService();
        assertEquals(List.of("siddur"), service.parseSettings("priority:\n  transclusion: [siddur]\n").transclusionPriority());
        assertThrows(IllegalArgumentException.class, () -> service.parseSettings("annotations: [missing]"));
    }

    @Test
    void compileIdsAreDistinct() {
        assertTrue(CompilerService.newCompileId().startsWith("compile-"));
        assertNotEquals(CompilerService.newCompileId(), CompilerService.newCompileId());
    }
}
