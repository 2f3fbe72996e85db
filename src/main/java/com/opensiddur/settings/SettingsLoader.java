package com.opensiddur.settings;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.opensiddur.index.ProjectIndex;
import com.opensiddur.models.Settings;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Reads compile settings from YAML (or JSON, which YAML accepts) and checks that every
 * project they name is loaded.
 */
public class SettingsLoader {

    private final ObjectMapper yamlMapper;

    public SettingsLoader() {
        this.yamlMapper = new ObjectMapper(new YAMLFactory())
            .configure(DeserializationFeature.ACCEPT_SINGLE_VALUE_AS_ARRAY, true);
    }

    public Settings read(String text) throws IOException {
        if (text == null || text.isBlank()) {
            return Settings.empty();
        }
        Settings settings = yamlMapper.readValue(text, Settings.class);
        return settings != null ? settings : Settings.empty();
    }

    public Settings read(Path file) throws IOException {
        if (file == null || !Files.exists(file)) {
            throw new IOException("Settings file not found: " + file);
        }
        return read(Files.readString(file));
    }

    /**
     * Read and validate against the loaded projects.
     */
    public Settings load(Path file, ProjectIndex index) throws IOException {
        Settings settings = read(file);
        validate(settings, index);
        return settings;
    }

    /**
     * @throws IllegalArgumentException naming every project that is not loaded
     */
    public static void validate(Settings settings, ProjectIndex index) {
        Set<String> named = new LinkedHashSet<>();
        named.addAll(settings.transclusionPriority());
        named.addAll(settings.instructionsPriority());
        named.addAll(settings.annotationProjects());
        List<String> missing = new ArrayList<>();
        for (String project : named) {
            if (!index.hasProject(project)) {
                missing.add(project);
            }
        }
        if (!missing.isEmpty()) {
            throw new IllegalArgumentException("Settings name projects that are not loaded: "
                + String.join(", ", missing));
        }
    }
}
