package com.contrastsecurity.depupdate.service;

import com.contrastsecurity.depupdate.model.PackageManifestSnapshot;
import com.contrastsecurity.depupdate.model.RegistrySnapshot;
import com.contrastsecurity.depupdate.model.RequestSet;
import com.contrastsecurity.depupdate.model.VersionToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Adds the peer dependencies of a requested package's chosen version.
 *
 * Versions are not checked here; the peer compatibility validation does that later
 * and can be overridden with --force.
 */
public class PeerInjector {
    private static final Logger logger = LoggerFactory.getLogger(PeerInjector.class);

    /**
     * Add every peer of the chosen version that is not requested yet, with its
     * declared range as token.
     *
     * @param requests Request set being grown
     * @param snapshot Registry metadata of the package whose peers are added
     * @return the names added
     */
    public List<String> inject(RequestSet.Builder requests, RegistrySnapshot snapshot) {
        VersionToken token = requests.get(snapshot.getName());
        if (token == null) {
            return Collections.emptyList();
        }
        PackageManifestSnapshot chosen = snapshot.resolveLiteral(token);
        if (chosen == null) {
            return Collections.emptyList();
        }

        List<String> added = new ArrayList<>();
        for (Map.Entry<String, String> peer : chosen.getPeerDependencies().entrySet()) {
            if (requests.addIfAbsent(peer.getKey(), VersionToken.range(peer.getValue()))) {
                added.add(peer.getKey());
            }
        }
        if (!added.isEmpty()) {
            logger.debug("Peer dependencies of {} added {}", snapshot.getName(), added);
        }
        return added;
    }
}
