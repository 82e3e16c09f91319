package com.contrastsecurity.depupdate.constants;

/**
 * Dependency sections of a package.json, in priority order.
 */
public enum DependencySection {
    DEPENDENCIES("dependencies"),
    DEV_DEPENDENCIES("devDependencies"),
    PEER_DEPENDENCIES("peerDependencies");

    private final String key;

    DependencySection(String key) {
        this.key = key;
    }

    /**
     * @return the JSON key of this section in package.json
     */
    public String getKey() {
        return key;
    }

    @Override
    public String toString() {
        return key;
    }
}
