package com.assetloom.manifest;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Reads asset manifests.
 *
 * A manifest is a JSON object with an {@code assets} array. Each entry needs
 * a non-negative integer {@code id} and a {@code path}; {@code dependsOn} is
 * an optional array of ids. Invalid entries are logged and skipped, while a
 * file that cannot be read or lacks the {@code assets} array fails the whole read.
 */
public class ManifestReader {

    private static final Logger LOGGER = LoggerFactory.getLogger(ManifestReader.class);

    private final ObjectMapper objectMapper = new ObjectMapper();

    /**
     * Reads a manifest file.
     *
     * @param manifestFile path to the manifest
     * @return the parsed manifest
     * @throws ManifestLoadException if the file is unreadable or malformed
     */
    public AssetManifest read(Path manifestFile) throws ManifestLoadException {
        LOGGER.info("Reading asset manifest: {}", manifestFile.toAbsolutePath());

        JsonNode root;
        try {
            root = objectMapper.readTree(Files.readString(manifestFile));
        } catch (IOException e) {
            throw new ManifestLoadException("Failed to read asset manifest " + manifestFile, e);
        }

        if (root == null || !root.isObject() || !root.has("assets") || !root.get("assets").isArray()) {
            throw new ManifestLoadException(
                "Asset manifest " + manifestFile + " must be an object with an 'assets' array");
        }

        List<AssetManifest.Entry> entries = new ArrayList<>();
        Set<Long> seenIds = new HashSet<>();
        int index = 0;
        for (JsonNode node : root.get("assets")) {
            AssetManifest.Entry entry = parseEntry(node, index++);
            if (entry == null) {
                continue;
            }
            if (!seenIds.add(entry.id())) {
                LOGGER.error("Manifest entry for asset {} skipped: duplicate id", entry.id());
                continue;
            }
            entries.add(entry);
        }

        LOGGER.info("Read {} asset entries from {}", entries.size(), manifestFile);
        return new AssetManifest(manifestFile, entries);
    }

    /**
     * Parses one manifest entry.
     *
     * @return the entry, or null if invalid
     */
    private AssetManifest.Entry parseEntry(JsonNode node, int index) {
        if (!node.isObject()) {
            LOGGER.error("Manifest entry #{} skipped: not an object", index);
            return null;
        }

        JsonNode idNode = node.get("id");
        if (idNode == null || !idNode.isIntegralNumber() || !idNode.canConvertToLong() || idNode.asLong() < 0) {
            LOGGER.error("Manifest entry #{} skipped: 'id' must be a non-negative integer", index);
            return null;
        }
        long id = idNode.asLong();

        JsonNode pathNode = node.get("path");
        if (pathNode == null || !pathNode.isTextual() || pathNode.asText().isBlank()) {
            LOGGER.error("Manifest entry for asset {} skipped: missing required field 'path'", id);
            return null;
        }

        List<Long> dependsOn = new ArrayList<>();
        JsonNode depsNode = node.get("dependsOn");
        if (depsNode != null) {
            if (!depsNode.isArray()) {
                LOGGER.warn("Manifest entry for asset {}: 'dependsOn' must be an array, ignoring", id);
            } else {
                for (JsonNode dep : depsNode) {
                    if (dep.isIntegralNumber() && dep.canConvertToLong()) {
                        dependsOn.add(dep.asLong());
                    } else {
                        LOGGER.warn("Manifest entry for asset {}: ignoring invalid dependency '{}'", id, dep);
                    }
                }
            }
        }

        LOGGER.debug("Manifest entry: asset {} at {} (dependencies: {})", id, pathNode.asText(), dependsOn);
        return new AssetManifest.Entry(id, pathNode.asText(), dependsOn);
    }
}
