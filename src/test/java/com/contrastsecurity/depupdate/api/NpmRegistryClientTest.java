package com.contrastsecurity.depupdate.api;

import com.contrastsecurity.depupdate.exception.RegistryException;
import com.contrastsecurity.depupdate.model.RegistrySnapshot;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for NpmRegistryClient against a local mock registry
 */
public class NpmRegistryClientTest {

    private static final String LEFT_PAD = "{"
            + "\"name\": \"left-pad\","
            + "\"dist-tags\": {\"latest\": \"1.3.0\"},"
            + "\"versions\": {"
            + "  \"1.2.0\": {\"name\": \"left-pad\", \"version\": \"1.2.0\"},"
            + "  \"1.3.0\": {\"name\": \"left-pad\", \"version\": \"1.3.0\","
            + "            \"peerDependencies\": {\"right-pad\": \"^1.0.0\"},"
            + "            \"ng-update\": {\"migrations\": \"./migrations.json\"}}"
            + "}}";

    private MockWebServer server;
    private NpmRegistryClient client;

    @BeforeEach
    public void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        client = new NpmRegistryClient(server.url("/").toString());
    }

    @AfterEach
    public void tearDown() throws IOException {
        client.close();
        server.shutdown();
    }

    @Test
    public void testFetchParsesRegistryDocument() throws Exception {
        server.enqueue(new MockResponse().setBody(LEFT_PAD).setHeader("Content-Type", "application/json"));

        RegistrySnapshot snapshot = client.fetchAsync("left-pad").get(10, TimeUnit.SECONDS);

        assertEquals("left-pad", snapshot.getName());
        assertEquals("1.3.0", snapshot.getTaggedVersion("latest"));
        assertEquals(2, snapshot.getVersions().size());
        assertEquals("^1.0.0", snapshot.getVersion("1.3.0").getPeerDependencies().get("right-pad"));
        assertTrue(snapshot.getVersion("1.3.0").hasUpdateMetadata());
        assertFalse(snapshot.getVersion("1.2.0").hasUpdateMetadata());

        RecordedRequest request = server.takeRequest(5, TimeUnit.SECONDS);
        assertEquals("/left-pad", request.getPath());
        assertEquals("application/json", request.getHeader("Accept"));
    }

    @Test
    public void testScopedNamesAreEncoded() throws Exception {
        server.enqueue(new MockResponse().setBody("{\"name\": \"@scope/pkg\", \"versions\": {}}"));

        client.fetchAsync("@scope/pkg").get(10, TimeUnit.SECONDS);

        assertEquals("/@scope%2Fpkg", server.takeRequest(5, TimeUnit.SECONDS).getPath());
        try (NpmRegistryClient mirror = new NpmRegistryClient("https://registry.example.com/npm/")) {
            assertEquals("/npm/@scope%2Fpkg", mirror.packageUrl("@scope/pkg").encodedPath());
        }
    }

    @Test
    public void testNotFoundCompletesWithNull() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(404).setBody("{\"error\": \"Not found\"}"));

        assertNull(client.fetchAsync("does-not-exist").get(10, TimeUnit.SECONDS));
    }

    @Test
    public void testServerErrorFailsTheFuture() {
        server.enqueue(new MockResponse().setResponseCode(500));

        ExecutionException e = assertThrows(ExecutionException.class,
                () -> client.fetchAsync("left-pad").get(10, TimeUnit.SECONDS));
        assertTrue(e.getCause() instanceof RegistryException);
        assertTrue(e.getCause().getMessage().contains("HTTP 500"));
    }

    @Test
    public void testInvalidDocumentFailsTheFuture() {
        server.enqueue(new MockResponse().setBody("[1, 2, 3]"));

        ExecutionException e = assertThrows(ExecutionException.class,
                () -> client.fetchAsync("left-pad").get(10, TimeUnit.SECONDS));
        assertTrue(e.getCause() instanceof RegistryException);
    }
}
