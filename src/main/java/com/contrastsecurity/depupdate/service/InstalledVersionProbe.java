package com.contrastsecurity.depupdate.service;

import com.contrastsecurity.depupdate.model.PackageManifestSnapshot;

/**
 * Looks up the package actually present in the local install.
 */
public interface InstalledVersionProbe {

    /**
     * @param packageName Package name, possibly scoped
     * @return the installed package's manifest, or null if it is not installed or unreadable
     */
    PackageManifestSnapshot probe(String packageName);

    /**
     * A probe that never finds anything; installed versions then come from the declared ranges.
     */
    InstalledVersionProbe NONE = packageName -> null;
}
