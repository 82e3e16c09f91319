package com.contrastsecurity.depupdate.model;

import com.google.gson.JsonElement;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One version of a package's package.json, as published to the registry or
 * found in node_modules.
 *
 * The upgrade metadata block is kept raw so that malformed content can be
 * reported field by field when it is read.
 */
public class PackageManifestSnapshot {
    private final String name;
    private final String version;
    private final Map<String, String> dependencies;
    private final Map<String, String> devDependencies;
    private final Map<String, String> peerDependencies;
    private final JsonElement updateMetadata;  // raw "ng-update" block, may be null

    public PackageManifestSnapshot(String name, String version,
                                   Map<String, String> dependencies,
                                   Map<String, String> devDependencies,
                                   Map<String, String> peerDependencies,
                                   JsonElement updateMetadata) {
        this.name = name;
        this.version = version;
        this.dependencies = copyOf(dependencies);
        this.devDependencies = copyOf(devDependencies);
        this.peerDependencies = copyOf(peerDependencies);
        this.updateMetadata = updateMetadata;
    }

    private static Map<String, String> copyOf(Map<String, String> source) {
        if (source == null || source.isEmpty()) {
            return Collections.emptyMap();
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }

    public String getName() {
        return name;
    }

    public String getVersion() {
        return version;
    }

    public Map<String, String> getDependencies() {
        return dependencies;
    }

    public Map<String, String> getDevDependencies() {
        return devDependencies;
    }

    public Map<String, String> getPeerDependencies() {
        return peerDependencies;
    }

    /**
     * @return the raw upgrade metadata element, or null if the manifest has none
     */
    public JsonElement getUpdateMetadata() {
        return updateMetadata;
    }

    public boolean hasUpdateMetadata() {
        return updateMetadata != null && !updateMetadata.isJsonNull();
    }

    @Override
    public String toString() {
        return name + "@" + version;
    }
}
