package com.contrastsecurity.depupdate.service;

import com.contrastsecurity.depupdate.exception.UnresolvableRangeException;
import com.contrastsecurity.depupdate.model.PackageInfo;
import com.contrastsecurity.depupdate.model.PackageManifestSnapshot;
import com.contrastsecurity.depupdate.model.PackageState;
import com.contrastsecurity.depupdate.model.RegistrySnapshot;
import com.contrastsecurity.depupdate.model.RequestSet;
import com.contrastsecurity.depupdate.model.VersionToken;
import com.contrastsecurity.depupdate.version.VersionOracle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Works out, for every fetched package, what is installed and what it would be updated to.
 */
public class PackageInfoResolver {
    private static final Logger logger = LoggerFactory.getLogger(PackageInfoResolver.class);

    private final ManifestCatalog catalog;
    private final VersionOracle versionOracle;
    private final InstalledVersionProbe installedProbe;
    private final UpdateMetadataReader metadataReader;

    public PackageInfoResolver(ManifestCatalog catalog, VersionOracle versionOracle,
                               InstalledVersionProbe installedProbe, UpdateMetadataReader metadataReader) {
        this.catalog = catalog;
        this.versionOracle = versionOracle;
        this.installedProbe = installedProbe != null ? installedProbe : InstalledVersionProbe.NONE;
        this.metadataReader = metadataReader;
    }

    /**
     * Resolve every fetched package.
     *
     * @param requests The expanded request set
     * @param snapshots Fetched registry metadata
     * @return unmodifiable map of package name to info, in the order of {@code snapshots}
     * @throws UnresolvableRangeException if an installed version cannot be determined
     */
    public Map<String, PackageInfo> resolveAll(RequestSet requests, Map<String, RegistrySnapshot> snapshots)
            throws UnresolvableRangeException {
        Map<String, PackageInfo> infoMap = new LinkedHashMap<>();
        for (RegistrySnapshot snapshot : snapshots.values()) {
            infoMap.put(snapshot.getName(), resolve(snapshot, requests.get(snapshot.getName())));
        }
        return Collections.unmodifiableMap(infoMap);
    }

    /**
     * Resolve one package.
     *
     * @param snapshot Registry metadata of the package
     * @param token Requested token, or null if the package is not requested
     * @return the package info; its target is null when no newer version is requested
     * @throws UnresolvableRangeException if an installed version cannot be determined
     */
    public PackageInfo resolve(RegistrySnapshot snapshot, VersionToken token) throws UnresolvableRangeException {
        String name = snapshot.getName();
        String declaredRange = catalog.getRange(name);
        if (declaredRange == null) {
            throw new UnresolvableRangeException(name, null,
                    "Package \"" + name + "\" was not found in package.json.");
        }

        PackageState installed = resolveInstalled(snapshot, declaredRange);

        String targetVersion = resolveTargetVersion(snapshot, token);
        if (targetVersion != null && snapshot.getVersion(targetVersion) == null) {
            logger.warn("Package {} has no published version {}. Not updating it.", name, targetVersion);
            targetVersion = null;
        }
        if (targetVersion != null && !versionOracle.isGreaterThan(targetVersion, installed.getVersion())) {
            logger.debug("Package {} already satisfied by package.json ({}).", name, declaredRange);
            targetVersion = null;
        }

        PackageState target = null;
        if (targetVersion != null) {
            PackageManifestSnapshot targetManifest = snapshot.getVersion(targetVersion);
            target = new PackageState(targetVersion, targetManifest, metadataReader.read(targetManifest));
            logger.debug("Package {} resolved {} -> {}", name, installed.getVersion(), targetVersion);
        }

        return new PackageInfo(name, installed, target, declaredRange, snapshot);
    }

    /**
     * Determine the installed version: whatever node_modules holds, otherwise the
     * highest published version the declared range allows.
     *
     * @throws UnresolvableRangeException if neither source yields a version with a manifest
     */
    public PackageState resolveInstalled(RegistrySnapshot snapshot, String declaredRange)
            throws UnresolvableRangeException {
        String name = snapshot.getName();
        PackageManifestSnapshot probed = installedProbe.probe(name);

        String installedVersion = probed != null ? probed.getVersion() : null;
        if (installedVersion == null) {
            installedVersion = versionOracle.maxSatisfying(snapshot.getVersions().keySet(), declaredRange);
        }
        if (installedVersion == null) {
            throw new UnresolvableRangeException(name, declaredRange,
                    "Package \"" + name + "\" has no published version satisfying \"" + declaredRange + "\".");
        }

        PackageManifestSnapshot installedManifest = snapshot.getVersion(installedVersion);
        if (installedManifest == null) {
            installedManifest = probed;
        }
        if (installedManifest == null) {
            throw new UnresolvableRangeException(name, declaredRange,
                    "An unexpected error happened; package " + name + " has no version " + installedVersion + ".");
        }

        return new PackageState(installedVersion, installedManifest, metadataReader.read(installedManifest));
    }

    private String resolveTargetVersion(RegistrySnapshot snapshot, VersionToken token) {
        if (token == null) {
            return null;
        }
        if (token.isTag()) {
            String tagged = snapshot.getTaggedVersion(token.getValue());
            if (tagged != null) {
                return tagged;
            }
        }
        return versionOracle.maxSatisfying(snapshot.getVersions().keySet(), token.getValue());
    }
}
