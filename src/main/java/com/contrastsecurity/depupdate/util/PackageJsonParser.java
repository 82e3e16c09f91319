package com.contrastsecurity.depupdate.util;

import com.contrastsecurity.depupdate.constants.DependencySection;
import com.contrastsecurity.depupdate.model.PackageManifestSnapshot;
import com.contrastsecurity.depupdate.model.RegistrySnapshot;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Turns package.json documents and registry metadata documents into snapshots.
 */
public class PackageJsonParser {
    private static final Logger logger = LoggerFactory.getLogger(PackageJsonParser.class);

    /** Key of the upgrade metadata block inside a published package.json. */
    public static final String UPDATE_METADATA_KEY = "ng-update";

    private PackageJsonParser() {
        // Utility class - prevent instantiation
    }

    /**
     * Parse one package.json.
     *
     * @param json The package.json object
     * @return the manifest snapshot
     */
    public static PackageManifestSnapshot parseManifest(JsonObject json) {
        return new PackageManifestSnapshot(
                getString(json, "name"),
                getString(json, "version"),
                getStringMap(json, DependencySection.DEPENDENCIES.getKey()),
                getStringMap(json, DependencySection.DEV_DEPENDENCIES.getKey()),
                getStringMap(json, DependencySection.PEER_DEPENDENCIES.getKey()),
                json.get(UPDATE_METADATA_KEY));
    }

    /**
     * Parse a registry metadata document ({@code name}, {@code dist-tags}, {@code versions}).
     *
     * @param requestedName Name the document was fetched for, used when the document has no name
     * @param body Raw response body
     * @return the registry snapshot
     * @throws JsonParseException if the body is not a JSON object
     */
    public static RegistrySnapshot parseRegistryDocument(String requestedName, String body) {
        JsonElement root = JsonParser.parseString(body);
        if (!root.isJsonObject()) {
            throw new JsonParseException("Registry document for " + requestedName + " is not a JSON object");
        }
        JsonObject document = root.getAsJsonObject();
        String name = getString(document, "name");
        if (name == null) {
            name = requestedName;
        }

        Map<String, PackageManifestSnapshot> versions = new LinkedHashMap<>();
        JsonElement versionsElement = document.get("versions");
        if (versionsElement != null && versionsElement.isJsonObject()) {
            for (Map.Entry<String, JsonElement> entry : versionsElement.getAsJsonObject().entrySet()) {
                if (!entry.getValue().isJsonObject()) {
                    logger.debug("Skipping malformed version {} of {}", entry.getKey(), name);
                    continue;
                }
                versions.put(entry.getKey(), parseManifest(entry.getValue().getAsJsonObject()));
            }
        }

        return new RegistrySnapshot(name, getStringMap(document, "dist-tags"), versions);
    }

    /**
     * Read a name-to-string map, skipping entries whose value is not a string.
     *
     * @return the map, empty if the key is absent or not an object
     */
    public static Map<String, String> getStringMap(JsonObject json, String key) {
        Map<String, String> result = new LinkedHashMap<>();
        JsonElement element = json.get(key);
        if (element == null || !element.isJsonObject()) {
            return result;
        }
        for (Map.Entry<String, JsonElement> entry : element.getAsJsonObject().entrySet()) {
            JsonElement value = entry.getValue();
            if (value.isJsonPrimitive() && value.getAsJsonPrimitive().isString()) {
                result.put(entry.getKey(), value.getAsString());
            } else {
                logger.debug("Ignoring non-string value for {} in {}", entry.getKey(), key);
            }
        }
        return result;
    }

    private static String getString(JsonObject json, String key) {
        JsonElement element = json.get(key);
        if (element != null && element.isJsonPrimitive() && element.getAsJsonPrimitive().isString()) {
            return element.getAsString();
        }
        return null;
    }
}
