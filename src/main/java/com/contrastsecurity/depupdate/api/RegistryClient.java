package com.contrastsecurity.depupdate.api;

import com.contrastsecurity.depupdate.model.RegistrySnapshot;

import java.util.concurrent.CompletableFuture;

/**
 * Fetches package metadata from a registry.
 */
public interface RegistryClient extends AutoCloseable {

    /**
     * Start fetching the metadata of one package.
     *
     * The returned future completes with null when the registry does not know the
     * package, and exceptionally with a
     * {@link com.contrastsecurity.depupdate.exception.RegistryException} on any other failure.
     *
     * @param packageName Package name, possibly scoped
     * @return future registry snapshot
     */
    CompletableFuture<RegistrySnapshot> fetchAsync(String packageName);

    @Override
    void close();
}
