package com.contrastsecurity.depupdate.model;

/**
 * A package at one concrete version: either what is installed now or what an
 * update would move it to.
 */
public class PackageState {
    private final String version;
    private final PackageManifestSnapshot manifest;
    private final UpdateMetadata updateMetadata;

    public PackageState(String version, PackageManifestSnapshot manifest, UpdateMetadata updateMetadata) {
        this.version = version;
        this.manifest = manifest;
        this.updateMetadata = updateMetadata != null ? updateMetadata : UpdateMetadata.empty();
    }

    public String getVersion() {
        return version;
    }

    public PackageManifestSnapshot getManifest() {
        return manifest;
    }

    public UpdateMetadata getUpdateMetadata() {
        return updateMetadata;
    }

    @Override
    public String toString() {
        return version;
    }
}
