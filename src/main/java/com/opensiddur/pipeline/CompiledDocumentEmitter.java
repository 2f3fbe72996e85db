package com.opensiddur.pipeline;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.opensiddur.models.CompiledDocument;
import com.opensiddur.models.ElementNode;
import com.opensiddur.models.Node;
import com.opensiddur.models.NodePaths;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Writes compiled documents as JSON, using the same node vocabulary as source documents.
 */
public class CompiledDocumentEmitter {

    private final ObjectMapper objectMapper;

    public CompiledDocumentEmitter() {
        this(new ObjectMapper());
    }

    public CompiledDocumentEmitter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * @throws IllegalStateException if any transclusion, declare or conditional marker is left
     */
    public static void verify(ElementNode root) {
        verify(root, NodePaths.root(root));
    }

    private static void verify(ElementNode element, String path) {
        List<String> childPaths = NodePaths.children(element, path);
        for (int i = 0; i < element.getChildren().size(); i++) {
            Node child = element.getChildren().get(i);
            if (child.isScaffolding()) {
                throw new IllegalStateException("Compiled tree still holds " + child.pathName() + " at " + childPaths.get(i));
            }
            if (child instanceof ElementNode) {
                verify((ElementNode) child, childPaths.get(i));
            }
        }
    }

    public String toJson(CompiledDocument document) throws IOException {
        verify(document.getRoot());
        return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(document);
    }

    public void write(CompiledDocument document, Path file) throws IOException {
        verify(document.getRoot());
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        objectMapper.writerWithDefaultPrettyPrinter().writeValue(file.toFile(), document);
    }
}
