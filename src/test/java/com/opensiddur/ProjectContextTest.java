package com.opensiddur;

import com.opensiddur.index.ProjectIndex;
import com.opensiddur.models.Document;
import com.opensiddur.models.ElementNode;
import com.opensiddur.storage.JsonStorage;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class ProjectContextTest {

    @TempDir
    Path projectsRoot;

    private void write(String project, String name) throws IOException {
        JsonStorage.writeJson(projectsRoot.resolve(project).resolve(name + ".json"),
            new Document(null, null, null, new ElementNode("div")));
    }

    @Test
    void reloadSwapsInANewGeneration() throws IOException {
        write("siddur", "morning");
        ProjectContext context = new ProjectContext(projectsRoot);
        ProjectIndex first = context.current();
        assertEquals(1, first.getGeneration());

        write("siddur", "evening");
        ProjectIndex second = context.reload();
        assertEquals(2, second.getGeneration());
        assertSame(second, context.current());
        assertNull(first.document("siddur", "evening"));
        assertNotNull(second.document("siddur", "evening"));
    }

    @Test
    void fixedIndexCannotReload() {
        ProjectContext context = new ProjectContext(ProjectIndex.empty());
        assertThrows(IllegalStateException.class, context::reload);
        assertNull(context.projectsRoot());
    }
}
