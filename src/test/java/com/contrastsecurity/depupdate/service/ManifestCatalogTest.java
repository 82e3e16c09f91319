package com.contrastsecurity.depupdate.service;

import com.contrastsecurity.depupdate.exception.ManifestException;
import com.contrastsecurity.depupdate.util.ManifestFile;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.ArrayList;

import static org.junit.jupiter.api.Assertions.*;

public class ManifestCatalogTest {

    @Test
    public void testStrongestSectionWins() throws ManifestException {
        ManifestCatalog catalog = ManifestCatalog.fromManifest(ManifestFile.parse("{"
                + "\"peerDependencies\": {\"a\": \"^1.0.0\", \"b\": \"^1.0.0\"},"
                + "\"devDependencies\": {\"b\": \"~1.2.0\", \"c\": \"^3.0.0\"},"
                + "\"dependencies\": {\"a\": \"1.4.0\", \"d\": \"latest\"}"
                + "}"));

        assertEquals(4, catalog.size());
        assertEquals("1.4.0", catalog.getRange("a"));
        assertEquals("~1.2.0", catalog.getRange("b"));
        assertEquals("^3.0.0", catalog.getRange("c"));
        assertEquals("latest", catalog.getRange("d"));
        assertEquals(Arrays.asList("a", "b", "c", "d"), new ArrayList<>(catalog.names()));
    }

    @Test
    public void testMissingSectionsAndNonStringValues() throws ManifestException {
        ManifestCatalog catalog = ManifestCatalog.fromManifest(ManifestFile.parse("{"
                + "\"name\": \"app\","
                + "\"dependencies\": {\"a\": \"^1.0.0\", \"broken\": {\"version\": \"1\"}}"
                + "}"));

        assertEquals(1, catalog.size());
        assertTrue(catalog.contains("a"));
        assertFalse(catalog.contains("broken"));
        assertNull(catalog.getRange("unknown"));
    }
}
