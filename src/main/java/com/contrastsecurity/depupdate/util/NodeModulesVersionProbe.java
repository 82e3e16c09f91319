package com.contrastsecurity.depupdate.util;

import com.contrastsecurity.depupdate.model.PackageManifestSnapshot;
import com.contrastsecurity.depupdate.service.InstalledVersionProbe;
import com.google.gson.JsonElement;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads {@code node_modules/<name>/package.json} below the project root.
 */
public class NodeModulesVersionProbe implements InstalledVersionProbe {
    private static final Logger logger = LoggerFactory.getLogger(NodeModulesVersionProbe.class);

    private final Path nodeModules;

    public NodeModulesVersionProbe(Path projectDir) {
        this.nodeModules = projectDir.resolve("node_modules");
    }

    @Override
    public PackageManifestSnapshot probe(String packageName) {
        Path packageJson = nodeModules.resolve(packageName).resolve("package.json");
        if (!Files.isRegularFile(packageJson)) {
            return null;
        }
        try {
            JsonElement root = JsonParser.parseString(Files.readString(packageJson, StandardCharsets.UTF_8));
            if (!root.isJsonObject()) {
                logger.warn("Ignoring {}: not a JSON object", packageJson);
                return null;
            }
            PackageManifestSnapshot manifest = PackageJsonParser.parseManifest(root.getAsJsonObject());
            if (manifest.getVersion() == null) {
                logger.warn("Ignoring {}: no version", packageJson);
                return null;
            }
            logger.debug("Found installed {}@{}", packageName, manifest.getVersion());
            return manifest;
        } catch (IOException | JsonParseException e) {
            logger.warn("Could not read {}: {}", packageJson, e.getMessage());
            return null;
        }
    }
}
