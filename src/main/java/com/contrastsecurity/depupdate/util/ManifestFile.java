package com.contrastsecurity.depupdate.util;

import com.contrastsecurity.depupdate.exception.ManifestException;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads and writes the project's package.json.
 *
 * Serialization always uses two-space indentation with HTML escaping disabled,
 * so ranges like {@code >=1.0.0} are written as typed.
 */
public class ManifestFile {
    private static final Logger logger = LoggerFactory.getLogger(ManifestFile.class);
    private static final Gson GSON = new GsonBuilder()
            .setPrettyPrinting()
            .disableHtmlEscaping()
            .create();

    public static final String FILE_NAME = "package.json";

    private ManifestFile() {
        // Utility class - prevent instantiation
    }

    /**
     * Read package.json from a project directory.
     *
     * @param projectDir The project root
     * @return the parsed manifest
     * @throws ManifestException if the file is missing, unreadable or not a JSON object
     */
    public static JsonObject read(Path projectDir) throws ManifestException {
        Path path = projectDir.resolve(FILE_NAME);
        if (!Files.exists(path)) {
            throw new ManifestException("Could not find a package.json. Are you in a Node project?");
        }
        String content;
        try {
            content = Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ManifestException("package.json could not be read: " + e.getMessage(), e);
        }
        logger.debug("Read {} ({} bytes)", path, content.length());
        return parse(content);
    }

    /**
     * Parse package.json content.
     *
     * @throws ManifestException if the content is not a JSON object
     */
    public static JsonObject parse(String content) throws ManifestException {
        try {
            JsonElement root = JsonParser.parseString(content);
            if (!root.isJsonObject()) {
                throw new ManifestException("package.json could not be parsed: not a JSON object");
            }
            return root.getAsJsonObject();
        } catch (JsonParseException e) {
            throw new ManifestException("package.json could not be parsed: " + e.getMessage(), e);
        }
    }

    /**
     * Serialize a manifest the way it is written back to disk.
     */
    public static String serialize(JsonObject manifest) {
        return GSON.toJson(manifest);
    }

    /**
     * Write new package.json content to a project directory.
     *
     * @throws ManifestException if the file cannot be written
     */
    public static void write(Path projectDir, String content) throws ManifestException {
        Path path = projectDir.resolve(FILE_NAME);
        try {
            Files.writeString(path, content + System.lineSeparator(), StandardCharsets.UTF_8);
            logger.info("Updated {}", path);
        } catch (IOException e) {
            throw new ManifestException("package.json could not be written: " + e.getMessage(), e);
        }
    }
}
