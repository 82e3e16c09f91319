package com.contrastsecurity.depupdate.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Registry metadata for one package: its dist-tags and every published version.
 */
public class RegistrySnapshot {
    private final String name;
    private final Map<String, String> distTags;
    private final Map<String, PackageManifestSnapshot> versions;

    public RegistrySnapshot(String name, Map<String, String> distTags,
                            Map<String, PackageManifestSnapshot> versions) {
        this.name = name;
        this.distTags = distTags != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(distTags))
                : Collections.emptyMap();
        this.versions = versions != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(versions))
                : Collections.emptyMap();
    }

    public String getName() {
        return name;
    }

    public Map<String, String> getDistTags() {
        return distTags;
    }

    public Map<String, PackageManifestSnapshot> getVersions() {
        return versions;
    }

    /**
     * @return the version a dist-tag points to, or null if the tag is unknown
     */
    public String getTaggedVersion(String tag) {
        return distTags.get(tag);
    }

    /**
     * @return the published manifest of a version, or null if it was never published
     */
    public PackageManifestSnapshot getVersion(String version) {
        return version != null ? versions.get(version) : null;
    }

    /**
     * Resolve the version chosen by a request token without range matching:
     * a tag goes through the dist-tags, anything else is taken literally.
     *
     * @return the manifest of the chosen version, or null if the registry has no such version
     */
    public PackageManifestSnapshot resolveLiteral(VersionToken token) {
        String version = token.isTag() ? distTags.get(token.getValue()) : null;
        if (version == null) {
            version = token.getValue();
        }
        return versions.get(version);
    }

    @Override
    public String toString() {
        return "RegistrySnapshot{" + name + ", distTags=" + distTags + ", versions=" + versions.size() + '}';
    }
}
