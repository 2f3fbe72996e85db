package com.opensiddur.storage;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.opensiddur.models.Document;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

public class JsonStorage {

    private static final ObjectMapper mapper = new ObjectMapper()
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    public static ObjectMapper mapper() {
        return mapper;
    }

    public static Document readDocument(Path path) throws IOException {
        if (!Files.exists(path)) {
            throw new IOException("Document not found: " + path);
        }
        return mapper.readValue(path.toFile(), Document.class);
    }

    public static <T> T readJson(Path path, Class<T> type) throws IOException {
        return mapper.readValue(path.toFile(), type);
    }

    public static void writeJson(Path path, Object data) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        mapper.writerWithDefaultPrettyPrinter().writeValue(path.toFile(), data);
    }
}
