package com.contrastsecurity.depupdate.service;

import com.contrastsecurity.depupdate.model.RegistrySnapshot;
import com.contrastsecurity.depupdate.model.RequestSet;

import java.util.Map;

/**
 * Grows the request set with package groups and peer dependencies.
 *
 * This is a single pass over the fetched packages in catalog order. A package
 * added during the pass has its own group and peers expanded only if its
 * snapshot comes later in that order; the expansion is not repeated until it
 * reaches a fixed point.
 */
public class RequestSetExpander {
    private final GroupExpander groupExpander;
    private final PeerInjector peerInjector;

    public RequestSetExpander(GroupExpander groupExpander, PeerInjector peerInjector) {
        this.groupExpander = groupExpander;
        this.peerInjector = peerInjector;
    }

    /**
     * @param requested The request set built from the selectors
     * @param snapshots Fetched registry metadata, iterated in map order
     * @return the expanded request set
     */
    public RequestSet expand(RequestSet requested, Map<String, RegistrySnapshot> snapshots) {
        RequestSet.Builder builder = requested.toBuilder();
        for (RegistrySnapshot snapshot : snapshots.values()) {
            groupExpander.expand(builder, snapshot);
            peerInjector.inject(builder, snapshot);
        }
        return builder.build();
    }
}
