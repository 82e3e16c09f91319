package com.contrastsecurity.depupdate.model;

/**
 * Everything the validator and the planner know about one package of the project.
 *
 * A target is only present when an update is planned, and its version is then
 * strictly greater than the installed one.
 */
public class PackageInfo {
    private final String name;
    private final PackageState installed;
    private final PackageState target;  // null when no change is planned
    private final String declaredRange;
    private final RegistrySnapshot registrySnapshot;

    public PackageInfo(String name, PackageState installed, PackageState target,
                       String declaredRange, RegistrySnapshot registrySnapshot) {
        this.name = name;
        this.installed = installed;
        this.target = target;
        this.declaredRange = declaredRange;
        this.registrySnapshot = registrySnapshot;
    }

    public String getName() {
        return name;
    }

    public PackageState getInstalled() {
        return installed;
    }

    /**
     * @return the planned target state, or null if the package stays as it is
     */
    public PackageState getTarget() {
        return target;
    }

    public boolean hasTarget() {
        return target != null;
    }

    public String getDeclaredRange() {
        return declaredRange;
    }

    public RegistrySnapshot getRegistrySnapshot() {
        return registrySnapshot;
    }

    /**
     * @return the version this package will have after the update
     */
    public String getEffectiveVersion() {
        return target != null ? target.getVersion() : installed.getVersion();
    }

    /**
     * @return the manifest this package will have after the update
     */
    public PackageManifestSnapshot getEffectiveManifest() {
        return target != null ? target.getManifest() : installed.getManifest();
    }

    @Override
    public String toString() {
        return name + "@" + installed.getVersion() + (target != null ? " -> " + target.getVersion() : "");
    }
}
