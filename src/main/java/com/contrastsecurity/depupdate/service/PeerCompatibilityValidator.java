package com.contrastsecurity.depupdate.service;

import com.contrastsecurity.depupdate.exception.IncompatiblePeerDependenciesException;
import com.contrastsecurity.depupdate.model.PackageInfo;
import com.contrastsecurity.depupdate.model.PackageManifestSnapshot;
import com.contrastsecurity.depupdate.model.PeerViolation;
import com.contrastsecurity.depupdate.version.VersionOracle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Checks that the planned versions keep every peer dependency satisfiable.
 *
 * Forward: each updated package's new peers must be present and satisfied by
 * their post-update versions. Reverse: every other package that peers on an
 * updated package must accept its new version.
 *
 * Each check stops at the first violation for the package being checked, but
 * every package is checked, so one run reports all packages with problems.
 */
public class PeerCompatibilityValidator {
    private static final Logger logger = LoggerFactory.getLogger(PeerCompatibilityValidator.class);

    private final VersionOracle versionOracle;

    public PeerCompatibilityValidator(VersionOracle versionOracle) {
        this.versionOracle = versionOracle;
    }

    /**
     * Validate and abort on violations unless forced.
     *
     * @param infoMap Resolved packages
     * @param force Log violations instead of failing
     * @return every violation found, empty if the update is consistent
     * @throws IncompatiblePeerDependenciesException if violations were found and force is not set
     */
    public List<PeerViolation> validate(Map<String, PackageInfo> infoMap, boolean force)
            throws IncompatiblePeerDependenciesException {
        logger.debug("Updating the following packages:");
        for (PackageInfo info : infoMap.values()) {
            if (info.hasTarget()) {
                logger.debug("  {} => {}", info.getName(), info.getTarget().getVersion());
            }
        }

        List<PeerViolation> violations = new ArrayList<>();
        boolean peerErrors = false;
        for (PackageInfo info : infoMap.values()) {
            if (!info.hasTarget()) {
                continue;
            }
            logger.debug("{}...", info.getName());
            peerErrors = checkForwardPeers(info, infoMap, violations) | peerErrors;
            peerErrors = checkReversePeers(info, infoMap, violations) | peerErrors;
        }

        for (PeerViolation violation : violations) {
            if (force) {
                logger.warn(violation.describe());
            } else {
                logger.error(violation.describe());
            }
        }

        if (peerErrors && !force) {
            throw new IncompatiblePeerDependenciesException(violations);
        }
        return Collections.unmodifiableList(violations);
    }

    /**
     * Check the peers declared by the target version of one package.
     *
     * @return true if a violation was recorded
     */
    boolean checkForwardPeers(PackageInfo info, Map<String, PackageInfo> infoMap, List<PeerViolation> violations) {
        Map<String, String> peers = info.getTarget().getManifest().getPeerDependencies();
        for (Map.Entry<String, String> peer : peers.entrySet()) {
            String peerName = peer.getKey();
            String range = peer.getValue();
            logger.debug("Checking forward peer {}...", peerName);

            PackageInfo peerInfo = infoMap.get(peerName);
            if (peerInfo == null) {
                violations.add(PeerViolation.missing(info.getName(), peerName, range));
                return true;
            }

            String peerVersion = peerInfo.getEffectiveVersion();
            logger.debug("  Range satisfies({}, {})...", range, peerVersion);
            if (!versionOracle.satisfies(peerVersion, range)) {
                violations.add(PeerViolation.incompatible(info.getName(), peerName, range, peerVersion));
                return true;
            }
        }
        return false;
    }

    /**
     * Check that every other package peering on this one accepts its target version.
     *
     * @return true if a violation was recorded
     */
    boolean checkReversePeers(PackageInfo info, Map<String, PackageInfo> infoMap, List<PeerViolation> violations) {
        String name = info.getName();
        String version = info.getTarget().getVersion();
        for (PackageInfo other : infoMap.values()) {
            if (other.getName().equals(name)) {
                continue;
            }
            PackageManifestSnapshot manifest = other.getEffectiveManifest();
            String range = manifest.getPeerDependencies().get(name);
            // Only peers on the package being updated matter here
            if (range == null) {
                continue;
            }
            if (!versionOracle.satisfies(version, range)) {
                violations.add(PeerViolation.incompatible(other.getName(), name, range, version));
                return true;
            }
        }
        return false;
    }
}
