package com.contrastsecurity.depupdate.model;

import com.contrastsecurity.depupdate.RegistryFixtures;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class RegistrySnapshotTest {

    private final RegistrySnapshot snapshot = RegistryFixtures.snapshot("a")
            .versions("1.0.0", "2.0.0")
            .tag("latest", "2.0.0")
            .tag("broken", "9.9.9")
            .build();

    @Test
    public void testResolveLiteral() {
        assertEquals("2.0.0", snapshot.resolveLiteral(VersionToken.tag("latest")).getVersion());
        assertEquals("1.0.0", snapshot.resolveLiteral(VersionToken.exact("1.0.0")).getVersion());
        assertNull(snapshot.resolveLiteral(VersionToken.tag("broken")));
        assertNull(snapshot.resolveLiteral(VersionToken.range("^1.0.0")));
    }

    @Test
    public void testLookups() {
        assertEquals("2.0.0", snapshot.getTaggedVersion("latest"));
        assertNull(snapshot.getTaggedVersion("next"));
        assertNull(snapshot.getVersion(null));
        assertNull(snapshot.getVersion("3.0.0"));
    }
}
