package com.contrastsecurity.depupdate.service;

import com.contrastsecurity.depupdate.api.RegistryClient;
import com.contrastsecurity.depupdate.exception.RegistryException;
import com.contrastsecurity.depupdate.model.RegistrySnapshot;
import com.contrastsecurity.depupdate.model.RequestSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Fetches registry metadata for many packages at once.
 *
 * All requests are issued before any is awaited; the result is only returned once
 * every request has completed, so callers never see a partially filled map.
 */
public class RegistrySnapshotFetcher {
    private static final Logger logger = LoggerFactory.getLogger(RegistrySnapshotFetcher.class);

    private final RegistryClient registryClient;

    public RegistrySnapshotFetcher(RegistryClient registryClient) {
        this.registryClient = registryClient;
    }

    /**
     * Fetch the metadata of every named package.
     *
     * A package unknown to the registry is dropped silently unless it was requested:
     * then it is fatal, or only a warning when the request came from bulk mode.
     *
     * @param names Packages to fetch, in the order the result should have
     * @param requested The packages requested for update
     * @param bulk Whether the request set was produced by bulk ("all") selection
     * @return unmodifiable map of package name to snapshot, in the order of {@code names}
     * @throws RegistryException if a fetch failed, or a requested package does not exist
     */
    public Map<String, RegistrySnapshot> fetchAll(Collection<String> names, RequestSet requested, boolean bulk)
            throws RegistryException {
        logger.info("Fetching registry metadata for {} packages", names.size());

        Map<String, CompletableFuture<RegistrySnapshot>> pending = new LinkedHashMap<>();
        for (String name : names) {
            pending.putIfAbsent(name, registryClient.fetchAsync(name));
        }

        try {
            CompletableFuture.allOf(pending.values().toArray(new CompletableFuture[0])).join();
        } catch (CompletionException | CancellationException e) {
            // Reported per package below, with the package name attached
            logger.debug("At least one registry request failed: {}", e.getMessage());
        }

        Map<String, RegistrySnapshot> snapshots = new LinkedHashMap<>();
        for (Map.Entry<String, CompletableFuture<RegistrySnapshot>> entry : pending.entrySet()) {
            String name = entry.getKey();
            RegistrySnapshot snapshot = await(name, entry.getValue());
            if (snapshot == null) {
                if (requested.contains(name)) {
                    if (bulk) {
                        logger.warn("Package \"{}\" was not found on the registry. Skipping.", name);
                    } else {
                        throw new RegistryException("Package \"" + name + "\" was not found on the registry. "
                                + "Cannot continue as this may be an error.");
                    }
                } else {
                    logger.debug("Package {} was not found on the registry, ignoring it", name);
                }
                continue;
            }
            snapshots.put(name, snapshot);
        }

        logger.info("Fetched registry metadata for {} of {} packages", snapshots.size(), pending.size());
        return Collections.unmodifiableMap(snapshots);
    }

    private static RegistrySnapshot await(String name, CompletableFuture<RegistrySnapshot> future)
            throws RegistryException {
        try {
            return future.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RegistryException) {
                throw (RegistryException) cause;
            }
            throw new RegistryException("Failed to fetch registry metadata for " + name + ": "
                    + (cause != null ? cause.getMessage() : e.getMessage()), cause != null ? cause : e);
        } catch (CancellationException e) {
            throw new RegistryException("Registry request for " + name + " was cancelled", e);
        }
    }
}
