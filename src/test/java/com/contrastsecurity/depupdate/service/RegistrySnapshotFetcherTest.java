package com.contrastsecurity.depupdate.service;

import com.contrastsecurity.depupdate.RegistryFixtures;
import com.contrastsecurity.depupdate.exception.RegistryException;
import com.contrastsecurity.depupdate.model.RegistrySnapshot;
import com.contrastsecurity.depupdate.model.RequestSet;
import com.contrastsecurity.depupdate.model.VersionToken;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class RegistrySnapshotFetcherTest {

    private RegistryFixtures.InMemoryRegistryClient client;
    private RegistrySnapshotFetcher fetcher;

    @BeforeEach
    public void setUp() {
        client = new RegistryFixtures.InMemoryRegistryClient()
                .add(RegistryFixtures.snapshot("a").versions("1.0.0").tag("latest", "1.0.0").build())
                .add(RegistryFixtures.snapshot("@scope/b").versions("1.0.0").tag("latest", "1.0.0").build())
                .add(RegistryFixtures.snapshot("c").versions("1.0.0").tag("latest", "1.0.0").build());
        fetcher = new RegistrySnapshotFetcher(client);
    }

    private static RequestSet requested(String... names) {
        RequestSet.Builder builder = RequestSet.builder();
        for (String name : names) {
            builder.put(name, VersionToken.tag("latest"));
        }
        return builder.build();
    }

    @Test
    public void testResultFollowsNameOrder() throws RegistryException {
        List<String> names = Arrays.asList("c", "a", "@scope/b");

        Map<String, RegistrySnapshot> snapshots = fetcher.fetchAll(names, requested("a"), false);

        assertEquals(names, new ArrayList<>(snapshots.keySet()));
        assertEquals(3, client.getFetched().size());
    }

    @Test
    public void testUnrequestedUnknownPackageIsDropped() throws RegistryException {
        Map<String, RegistrySnapshot> snapshots = fetcher.fetchAll(
                Arrays.asList("a", "private-pkg"), requested("a"), false);

        assertEquals(List.of("a"), new ArrayList<>(snapshots.keySet()));
    }

    @Test
    public void testRequestedUnknownPackageIsFatal() {
        RegistryException e = assertThrows(RegistryException.class,
                () -> fetcher.fetchAll(Arrays.asList("a", "private-pkg"), requested("private-pkg"), false));

        assertTrue(e.getMessage().contains("\"private-pkg\" was not found"));
    }

    @Test
    public void testRequestedUnknownPackageInBulkModeIsDropped() throws RegistryException {
        Map<String, RegistrySnapshot> snapshots = fetcher.fetchAll(
                Arrays.asList("a", "private-pkg"), requested("a", "private-pkg"), true);

        assertEquals(List.of("a"), new ArrayList<>(snapshots.keySet()));
    }

    @Test
    public void testFailedFetchIsFatal() {
        client.failOn("c");

        RegistryException e = assertThrows(RegistryException.class,
                () -> fetcher.fetchAll(Arrays.asList("a", "c"), requested("a"), true));

        assertTrue(e.getMessage().contains("connection reset fetching c"));
    }
}
