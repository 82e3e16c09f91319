package com.contrastsecurity.depupdate.service;

import com.contrastsecurity.depupdate.constants.DependencySection;
import com.contrastsecurity.depupdate.util.PackageJsonParser;
import com.google.gson.JsonObject;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Every package declared by the project, with the range it is declared at.
 *
 * Sections are merged peer first, then dev, then regular dependencies, so the
 * range of the strongest relationship wins while names keep the position where
 * they were first seen.
 */
public class ManifestCatalog {
    private final Map<String, String> declaredRanges;

    public ManifestCatalog(Map<String, String> declaredRanges) {
        this.declaredRanges = Collections.unmodifiableMap(new LinkedHashMap<>(declaredRanges));
    }

    /**
     * Build the catalog from a parsed package.json.
     */
    public static ManifestCatalog fromManifest(JsonObject manifest) {
        Map<String, String> ranges = new LinkedHashMap<>();
        ranges.putAll(PackageJsonParser.getStringMap(manifest, DependencySection.PEER_DEPENDENCIES.getKey()));
        ranges.putAll(PackageJsonParser.getStringMap(manifest, DependencySection.DEV_DEPENDENCIES.getKey()));
        ranges.putAll(PackageJsonParser.getStringMap(manifest, DependencySection.DEPENDENCIES.getKey()));
        return new ManifestCatalog(ranges);
    }

    /**
     * @return the declared range, or null if the project does not declare the package
     */
    public String getRange(String name) {
        return declaredRanges.get(name);
    }

    public boolean contains(String name) {
        return declaredRanges.containsKey(name);
    }

    public Set<String> names() {
        return declaredRanges.keySet();
    }

    public Map<String, String> asMap() {
        return declaredRanges;
    }

    public int size() {
        return declaredRanges.size();
    }
}
