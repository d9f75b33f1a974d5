package com.designlens.core.design;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads a design tree from JSON. Accepts either a full file payload ({@code {name, document}})
 * or a bare root node.
 */
public final class DesignTreeReader {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private DesignTreeReader() {}

    public static DesignFile read(Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            return read(MAPPER.readTree(in), fileStem(path));
        }
    }

    public static DesignFile read(InputStream in, String fallbackName) throws IOException {
        return read(MAPPER.readTree(in), fallbackName);
    }

    static DesignFile read(JsonNode json, String fallbackName) throws IOException {
        if (json == null || !json.isObject()) {
            throw new IOException("Design tree must be a JSON object");
        }
        if (json.has("document")) {
            DesignFile file = MAPPER.treeToValue(json, DesignFile.class);
            return file.name() == null || file.name().isBlank()
                    ? new DesignFile(fallbackName, file.lastModified(), file.thumbnailUrl(), file.document())
                    : file;
        }
        DesignNode root = MAPPER.treeToValue(json, DesignNode.class);
        return DesignFile.of(root.name() != null ? root.name() : fallbackName, root);
    }

    private static String fileStem(Path path) {
        String name = path.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }
}
