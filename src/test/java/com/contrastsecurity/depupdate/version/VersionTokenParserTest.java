package com.contrastsecurity.depupdate.version;

import com.contrastsecurity.depupdate.model.VersionToken;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the VersionTokenParser class
 */
public class VersionTokenParserTest {

    @Test
    public void testParseTags() {
        assertEquals(VersionToken.tag("latest"), VersionTokenParser.parse("latest"));
        assertEquals(VersionToken.tag("next"), VersionTokenParser.parse("next"));
        assertEquals(VersionToken.tag("rc-1"), VersionTokenParser.parse("rc-1"));
    }

    @Test
    public void testParseExactVersions() {
        assertEquals(VersionToken.exact("2.1.0"), VersionTokenParser.parse("2.1.0"));
        assertEquals(VersionToken.exact("v2.1.0"), VersionTokenParser.parse("v2.1.0"));
        assertEquals(VersionToken.exact("9.0.0-rc.2"), VersionTokenParser.parse("9.0.0-rc.2"));
        assertEquals(VersionToken.exact("1.0.0+build.5"), VersionTokenParser.parse("1.0.0+build.5"));
    }

    @Test
    public void testParseRanges() {
        assertEquals(VersionToken.Kind.RANGE, VersionTokenParser.parse("^2.0.0").getKind());
        assertEquals(VersionToken.Kind.RANGE, VersionTokenParser.parse("~1.2").getKind());
        assertEquals(VersionToken.Kind.RANGE, VersionTokenParser.parse("2.x").getKind());
        assertEquals(VersionToken.Kind.RANGE, VersionTokenParser.parse("x").getKind());
        assertEquals(VersionToken.Kind.RANGE, VersionTokenParser.parse("8").getKind());
        assertEquals(VersionToken.Kind.RANGE, VersionTokenParser.parse(">=1.0.0 <2.0.0").getKind());
        assertEquals(VersionToken.Kind.RANGE, VersionTokenParser.parse("01.2.3").getKind());
    }

    @Test
    public void testParseRejectsNull() {
        assertThrows(IllegalArgumentException.class, () -> VersionTokenParser.parse(null));
    }

    @Test
    public void testNonSemanticLocators() {
        assertTrue(VersionTokenParser.isNonSemanticLocator("http://example.com/pkg.tgz"));
        assertTrue(VersionTokenParser.isNonSemanticLocator("https://example.com/pkg.tgz"));
        assertTrue(VersionTokenParser.isNonSemanticLocator("file:../lib"));
        assertTrue(VersionTokenParser.isNonSemanticLocator("git://github.com/user/repo.git"));
        assertTrue(VersionTokenParser.isNonSemanticLocator("git+ssh://git@github.com/user/repo.git"));
        assertTrue(VersionTokenParser.isNonSemanticLocator("user/repo"));
        assertTrue(VersionTokenParser.isNonSemanticLocator("./local-lib"));
        assertTrue(VersionTokenParser.isNonSemanticLocator("../local-lib"));
        assertTrue(VersionTokenParser.isNonSemanticLocator("/opt/lib"));
    }

    @Test
    public void testSemanticRangesAreNotLocators() {
        assertFalse(VersionTokenParser.isNonSemanticLocator("^1.0.0"));
        assertFalse(VersionTokenParser.isNonSemanticLocator("~1.2.3"));
        assertFalse(VersionTokenParser.isNonSemanticLocator("1.2.3"));
        assertFalse(VersionTokenParser.isNonSemanticLocator("latest"));
        assertFalse(VersionTokenParser.isNonSemanticLocator(">=1.0.0 <2.0.0"));
        assertFalse(VersionTokenParser.isNonSemanticLocator(null));
    }
}
