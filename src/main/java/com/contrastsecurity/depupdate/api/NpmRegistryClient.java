package com.contrastsecurity.depupdate.api;

import com.contrastsecurity.depupdate.exception.RegistryException;
import com.contrastsecurity.depupdate.model.RegistrySnapshot;
import com.contrastsecurity.depupdate.util.HttpClientFactory;
import com.contrastsecurity.depupdate.util.PackageJsonParser;
import com.google.gson.JsonParseException;
import okhttp3.Call;
import okhttp3.Callback;
import okhttp3.Dispatcher;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Client for the npm registry metadata API.
 */
public class NpmRegistryClient implements RegistryClient {
    private static final Logger logger = LoggerFactory.getLogger(NpmRegistryClient.class);
    private static final int MAX_REQUESTS_PER_HOST = 16;

    private final HttpUrl registryUrl;
    private final OkHttpClient client;
    private final ExecutorService executorService;

    public NpmRegistryClient(String registry) {
        this(registry, false);
    }

    public NpmRegistryClient(String registry, boolean trustAllCertificates) {
        this.registryUrl = HttpUrl.get(registry);

        OkHttpClient.Builder clientBuilder = HttpClientFactory.createHttpClientBuilder(trustAllCertificates);

        // Create a dispatcher with an executor service that we can shut down later
        Dispatcher dispatcher = new Dispatcher();
        dispatcher.setMaxRequestsPerHost(MAX_REQUESTS_PER_HOST);
        this.executorService = dispatcher.executorService();
        clientBuilder.dispatcher(dispatcher);

        this.client = clientBuilder.build();
    }

    /**
     * Build the metadata URL of a package. Scoped names keep their "@" and have
     * the "/" encoded, as the registry expects.
     */
    HttpUrl packageUrl(String packageName) {
        return registryUrl.newBuilder().addPathSegment(packageName).build();
    }

    @Override
    public CompletableFuture<RegistrySnapshot> fetchAsync(String packageName) {
        CompletableFuture<RegistrySnapshot> future = new CompletableFuture<>();
        HttpUrl url = packageUrl(packageName);
        logger.debug("Fetching registry metadata for {} from {}", packageName, url);

        Request request = new Request.Builder()
                .url(url)
                .header("Accept", "application/json")
                .get()
                .build();

        client.newCall(request).enqueue(new Callback() {
            @Override
            public void onFailure(Call call, IOException e) {
                future.completeExceptionally(new RegistryException(
                        "Failed to fetch registry metadata for " + packageName + ": " + e.getMessage(), e));
            }

            @Override
            public void onResponse(Call call, Response response) {
                try (ResponseBody body = response.body()) {
                    if (response.code() == 404) {
                        logger.debug("Package {} not found on the registry", packageName);
                        future.complete(null);
                        return;
                    }
                    if (!response.isSuccessful() || body == null) {
                        future.completeExceptionally(new RegistryException(
                                "Failed to fetch registry metadata for " + packageName + ": HTTP " + response.code()));
                        return;
                    }
                    future.complete(PackageJsonParser.parseRegistryDocument(packageName, body.string()));
                } catch (IOException | JsonParseException | IllegalStateException e) {
                    future.completeExceptionally(new RegistryException(
                            "Invalid registry metadata for " + packageName + ": " + e.getMessage(), e));
                }
            }
        });
        return future;
    }

    /**
     * Closes the client and releases resources
     */
    @Override
    public void close() {
        // Cancel all ongoing requests first
        client.dispatcher().cancelAll();

        // Close connection pool
        client.connectionPool().evictAll();

        client.dispatcher().executorService().shutdown();

        try {
            if (!executorService.awaitTermination(15, TimeUnit.SECONDS)) {
                executorService.shutdownNow();
                if (!executorService.awaitTermination(5, TimeUnit.SECONDS)) {
                    logger.warn("Failed to terminate OkHttp threads cleanly");
                }
            }
        } catch (InterruptedException e) {
            logger.warn("Thread shutdown interrupted", e);
            executorService.shutdownNow();
            Thread.currentThread().interrupt(); // Preserve interrupt status
        }
    }
}
