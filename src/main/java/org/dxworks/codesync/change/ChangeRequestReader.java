package org.dxworks.codesync.change;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;

/**
 * Reads change requests from YAML or JSON. Missing lists and strings default to empty, a missing or unknown
 * {@code change_type} to {@link ChangeType#OTHER}.
 */
public class ChangeRequestReader {
    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
    private final ObjectMapper jsonMapper = new ObjectMapper();

    public ChangeRequest fromYaml(String yaml) {
        return read(yamlMapper, yaml, "YAML");
    }

    public ChangeRequest fromJson(String json) {
        return read(jsonMapper, json, "JSON");
    }

    /**
     * Reads a {@code .json} file as JSON and anything else as YAML.
     */
    public ChangeRequest read(Path path) throws IOException {
        String text = Files.readString(path, StandardCharsets.UTF_8);
        if (path.getFileName().toString().toLowerCase().endsWith(".json")) {
            return fromJson(text);
        }
        return fromYaml(text);
    }

    private ChangeRequest read(ObjectMapper mapper, String text, String format) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Empty " + format + " change request");
        }
        ChangeRequest request;
        try {
            request = mapper.readValue(text, ChangeRequest.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed " + format + " change request: "
                    + e.getOriginalMessage(), e);
        }
        if (request == null) {
            throw new IllegalArgumentException("Empty " + format + " change request");
        }
        // explicit nulls in the document bypass the field defaults
        if (request.changeType == null) request.changeType = ChangeType.OTHER;
        if (request.featureName == null) request.featureName = "";
        if (request.description == null) request.description = "";
        if (request.affectedComponents == null) request.affectedComponents = new ArrayList<>();
        if (request.designDocSections == null) request.designDocSections = new ArrayList<>();
        if (request.requirements == null) request.requirements = new ArrayList<>();
        if (request.additionalInfo == null) request.additionalInfo = new LinkedHashMap<>();
        if (request.edits == null) request.edits = new ArrayList<>();
        for (EditInstruction edit : request.edits) {
            if (edit != null && edit.rows == null) edit.rows = new ArrayList<>();
        }
        return request;
    }
}
