package com.designlens.figma;

import com.designlens.core.design.DesignFile;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * HTTP client for the design-tool REST API (files and image exports).
 * <p>
 * Authenticates every request with the {@code X-Figma-Token} header from
 * {@link FigmaProperties#getApiToken()}.
 */
@Component
public class FigmaClient {

    private static final Logger log = LoggerFactory.getLogger(FigmaClient.class);

    private final FigmaProperties properties;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    public FigmaClient(FigmaProperties properties) {
        this(properties, HttpClient.newBuilder()
                .connectTimeout(properties.getTimeout())
                .build());
    }

    FigmaClient(FigmaProperties properties, HttpClient httpClient) {
        this.properties = properties;
        this.httpClient = httpClient;
        this.objectMapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    /**
     * Fetches a file's document tree.
     *
     * @param fileKey key as returned by {@link FigmaFileKeys#extract(String)}
     */
    public DesignFile getFile(String fileKey) {
        JsonNode json = get("/files/" + encode(fileKey));
        try {
            DesignFile file = objectMapper.treeToValue(json, DesignFile.class);
            log.info("Fetched design file '{}' ({})", file.displayName(), fileKey);
            return file;
        } catch (IOException e) {
            throw new FigmaApiException("Unreadable file payload for " + fileKey, e);
        }
    }

    /**
     * Requests rendered exports of the given nodes.
     *
     * @return node id to image URL; nodes the API could not render map to {@code null} and are omitted
     */
    public Map<String, String> getImages(String fileKey, List<String> nodeIds, String format, double scale) {
        if (nodeIds == null || nodeIds.isEmpty()) {
            return Map.of();
        }
        String query = "?ids=" + encode(String.join(",", nodeIds))
                + "&format=" + encode(format == null || format.isBlank() ? "png" : format)
                + "&scale=" + (scale > 0 ? scale : 2.0);
        JsonNode json = get("/images/" + encode(fileKey) + query);
        JsonNode images = json.get("images");
        if (images == null || images.isNull()) {
            return Map.of();
        }
        Map<String, String> raw = objectMapper.convertValue(images, new TypeReference<Map<String, String>>() {});
        var result = new LinkedHashMap<String, String>();
        raw.forEach((id, url) -> {
            if (url != null) {
                result.put(id, url);
            }
        });
        log.info("Resolved {} of {} image export(s) for {}", result.size(), nodeIds.size(), fileKey);
        return result;
    }

    public Map<String, String> getImages(String fileKey, List<String> nodeIds) {
        return getImages(fileKey, nodeIds, properties.getImageFormat(), properties.getImageScale());
    }

    private JsonNode get(String path) {
        if (!properties.hasToken()) {
            throw new FigmaApiException(401,
                    "Design-tool API token not configured. Set designlens.figma.api-token (FIGMA_TOKEN).");
        }
        var request = HttpRequest.newBuilder()
                .uri(URI.create(properties.getBaseUrl() + path))
                .header("X-Figma-Token", properties.getApiToken())
                .header("Accept", "application/json")
                .timeout(properties.getTimeout())
                .GET()
                .build();
        log.debug("GET {}{}", properties.getBaseUrl(), path);
        try {
            var response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() < 200 || response.statusCode() >= 300) {
                throw new FigmaApiException(response.statusCode(), "Design-tool API error (HTTP %d): %s"
                        .formatted(response.statusCode(), response.body()));
            }
            return objectMapper.readTree(response.body());
        } catch (IOException e) {
            throw new FigmaApiException("Design-tool API request failed: " + path, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FigmaApiException("Interrupted calling design-tool API: " + path, e);
        }
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
