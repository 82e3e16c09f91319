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

/**
 * Adds the other members of a requested package's package group, with the same token.
 */
public class GroupExpander {
    private static final Logger logger = LoggerFactory.getLogger(GroupExpander.class);

    private final ManifestCatalog catalog;
    private final UpdateMetadataReader metadataReader;

    public GroupExpander(ManifestCatalog catalog, UpdateMetadataReader metadataReader) {
        this.catalog = catalog;
        this.metadataReader = metadataReader;
    }

    /**
     * Expand the package group of one fetched package.
     *
     * Nothing happens unless the package is requested and the version its token
     * names literally (through a dist-tag, or as an exact version) is published with
     * a package group. Names already requested and names the project does not
     * declare are left out.
     *
     * @param requests Request set being grown
     * @param snapshot Registry metadata of the package to expand
     * @return the names added, in group order
     */
    public List<String> expand(RequestSet.Builder requests, RegistrySnapshot snapshot) {
        VersionToken token = requests.get(snapshot.getName());
        if (token == null) {
            return Collections.emptyList();
        }
        PackageManifestSnapshot chosen = snapshot.resolveLiteral(token);
        if (chosen == null || !chosen.hasUpdateMetadata() || !chosen.getUpdateMetadata().isJsonObject()) {
            return Collections.emptyList();
        }
        List<String> group = metadataReader.readPackageGroup(
                snapshot.getName(), chosen.getUpdateMetadata().getAsJsonObject().get("packageGroup"));
        if (group == null) {
            return Collections.emptyList();
        }

        List<String> added = new ArrayList<>();
        for (String member : group) {
            if (!catalog.contains(member)) {
                continue;
            }
            if (requests.addIfAbsent(member, token)) {
                added.add(member);
            }
        }
        if (!added.isEmpty()) {
            logger.debug("Package group of {} added {}", snapshot.getName(), added);
        }
        return added;
    }
}
