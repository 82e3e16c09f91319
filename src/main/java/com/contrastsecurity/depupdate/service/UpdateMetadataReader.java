package com.contrastsecurity.depupdate.service;

import com.contrastsecurity.depupdate.model.PackageManifestSnapshot;
import com.contrastsecurity.depupdate.model.UpdateMetadata;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads the upgrade metadata block of a published package.json.
 *
 * Each field is validated on its own; a malformed field is reported and replaced
 * by its default without affecting the others.
 */
public class UpdateMetadataReader {
    private static final Logger logger = LoggerFactory.getLogger(UpdateMetadataReader.class);

    /**
     * @param manifest The package version to read, may be null
     * @return the metadata, {@link UpdateMetadata#empty()} if there is none
     */
    public UpdateMetadata read(PackageManifestSnapshot manifest) {
        if (manifest == null || !manifest.hasUpdateMetadata() || !manifest.getUpdateMetadata().isJsonObject()) {
            return UpdateMetadata.empty();
        }
        JsonObject metadata = manifest.getUpdateMetadata().getAsJsonObject();
        String name = manifest.getName();

        return new UpdateMetadata(
                readPackageGroup(name, metadata.get("packageGroup")),
                readRequirements(name, metadata.get("requirements")),
                readMigrations(name, metadata.get("migrations")));
    }

    /**
     * Read a package group.
     *
     * @return the group, null if absent or malformed
     */
    List<String> readPackageGroup(String name, JsonElement element) {
        if (isUnset(element)) {
            return null;
        }
        List<String> group = toStringList(element);
        if (group == null) {
            logger.warn("packageGroup metadata of package {} is malformed. Ignoring.", name);
        }
        return group;
    }

    private Map<String, String> readRequirements(String name, JsonElement element) {
        if (isUnset(element)) {
            return null;
        }
        if (!element.isJsonObject()) {
            logger.warn("requirements metadata of package {} is malformed. Ignoring.", name);
            return null;
        }
        Map<String, String> requirements = new LinkedHashMap<>();
        for (Map.Entry<String, JsonElement> entry : element.getAsJsonObject().entrySet()) {
            if (!isString(entry.getValue())) {
                logger.warn("requirements metadata of package {} is malformed. Ignoring.", name);
                return null;
            }
            requirements.put(entry.getKey(), entry.getValue().getAsString());
        }
        return requirements;
    }

    private String readMigrations(String name, JsonElement element) {
        if (isUnset(element)) {
            return null;
        }
        if (!isString(element)) {
            logger.warn("migrations metadata of package {} is malformed. Ignoring.", name);
            return null;
        }
        return element.getAsString();
    }

    /**
     * @return the elements as strings, or null if the element is not an array of strings
     */
    static List<String> toStringList(JsonElement element) {
        if (element == null || !element.isJsonArray()) {
            return null;
        }
        JsonArray array = element.getAsJsonArray();
        List<String> result = new ArrayList<>(array.size());
        for (JsonElement item : array) {
            if (!isString(item)) {
                return null;
            }
            result.add(item.getAsString());
        }
        return result;
    }

    private static boolean isUnset(JsonElement element) {
        if (element == null || element.isJsonNull()) {
            return true;
        }
        // empty strings and false count as "not given", like an absent key
        if (element.isJsonPrimitive()) {
            if (element.getAsJsonPrimitive().isBoolean()) {
                return !element.getAsBoolean();
            }
            if (element.getAsJsonPrimitive().isString()) {
                return element.getAsString().isEmpty();
            }
        }
        return false;
    }

    private static boolean isString(JsonElement element) {
        return element != null && element.isJsonPrimitive() && element.getAsJsonPrimitive().isString();
    }
}
