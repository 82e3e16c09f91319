package com.contrastsecurity.depupdate.version;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the semver4j backed version oracle
 */
public class SemverVersionOracleTest {

    private final SemverVersionOracle oracle = new SemverVersionOracle();

    @Test
    public void testSatisfiesCaretRange() {
        assertTrue(oracle.satisfies("2.1.0", "^2.0.0"));
        assertFalse(oracle.satisfies("1.5.0", "^2.0.0"));
        assertFalse(oracle.satisfies("3.0.0", "^2.0.0"));
    }

    @Test
    public void testSatisfiesComparatorSet() {
        assertTrue(oracle.satisfies("1.4.0", ">=1.0.0 <2.0.0"));
        assertFalse(oracle.satisfies("2.0.0", ">=1.0.0 <2.0.0"));
    }

    @Test
    public void testSatisfiesRejectsNonRanges() {
        assertFalse(oracle.satisfies("1.0.0", "latest"));
        assertFalse(oracle.satisfies("not-a-version", "^1.0.0"));
        assertFalse(oracle.satisfies(null, "^1.0.0"));
        assertFalse(oracle.satisfies("1.0.0", null));
    }

    @Test
    public void testMaxSatisfying() {
        List<String> versions = Arrays.asList("1.0.0", "1.2.0", "1.10.0", "2.0.0", "2.1.0");

        assertEquals("1.10.0", oracle.maxSatisfying(versions, "^1.0.0"));
        assertEquals("2.1.0", oracle.maxSatisfying(versions, "*"));
        assertEquals("2.0.0", oracle.maxSatisfying(versions, "2.0.0"));
        assertNull(oracle.maxSatisfying(versions, "^3.0.0"));
        assertNull(oracle.maxSatisfying(versions, "next"));
    }

    @Test
    public void testMaxSatisfyingSkipsPreReleasesUnlessNamed() {
        List<String> versions = Arrays.asList("2.0.0", "2.1.0-beta.1");

        assertEquals("2.0.0", oracle.maxSatisfying(versions, "^2.0.0"));
        assertEquals("2.1.0-beta.1", oracle.maxSatisfying(versions, "2.1.0-beta.1"));
    }

    @Test
    public void testCompare() {
        assertTrue(oracle.compare("1.0.0", "2.0.0") < 0);
        assertTrue(oracle.compare("1.10.0", "1.9.0") > 0);
        assertEquals(0, oracle.compare("1.2.3", "1.2.3"));
        assertTrue(oracle.isGreaterThan("2.0.0", "2.0.0-rc.1"));
        assertFalse(oracle.isGreaterThan("1.0.0", "1.0.0"));
    }

    @Test
    public void testCompareRejectsInvalidVersions() {
        assertThrows(IllegalArgumentException.class, () -> oracle.compare("latest", "1.0.0"));
    }

    @Test
    public void testIsValid() {
        assertTrue(oracle.isValid("1.2.3"));
        assertTrue(oracle.isValid("v1.2.3"));
        assertTrue(oracle.isValid("1.2.3-rc.1"));
        assertFalse(oracle.isValid("1.2"));
        assertFalse(oracle.isValid("abc"));
        assertFalse(oracle.isValid(""));
        assertFalse(oracle.isValid(null));
    }
}
