package com.costsheet.core.service;

import com.costsheet.core.model.Project;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads and writes project JSON files.
 *
 * <p>The JSON mirrors the model records: {@code info}, then {@code levels} of
 * {@code areas} of {@code items}. Dates are ISO strings, option and shared-cost maps
 * are keyed by equipment kind name. Unknown properties are ignored.
 */
public final class ProjectFiles {

    private static final ObjectMapper JSON_MAPPER = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
        .enable(SerializationFeature.INDENT_OUTPUT);

    private ProjectFiles() {
    }

    public static Project read(Path file) throws IOException {
        Project project = JSON_MAPPER.readValue(file.toFile(), Project.class);
        if (project == null) {
            throw new IOException("Project file is empty: " + file);
        }
        return project;
    }

    public static Project parse(String json) throws IOException {
        return JSON_MAPPER.readValue(json, Project.class);
    }

    public static void write(Path file, Project project) throws IOException {
        Files.writeString(file, JSON_MAPPER.writeValueAsString(project));
    }
}
