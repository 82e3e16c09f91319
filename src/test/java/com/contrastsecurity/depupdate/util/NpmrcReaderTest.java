package com.contrastsecurity.depupdate.util;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class NpmrcReaderTest {

    @TempDir
    Path projectDir;

    private void writeNpmrc(String content) throws IOException {
        Files.writeString(projectDir.resolve(".npmrc"), content, StandardCharsets.UTF_8);
    }

    @Test
    public void testDefaultRegistry() {
        assertEquals("https://registry.npmjs.org", NpmrcReader.resolveRegistry(null, null, projectDir));
    }

    @Test
    public void testNpmrcRegistry() throws IOException {
        writeNpmrc("# company mirror\nregistry=https://npm.example.com/repository/npm/\nsave-exact=true\n");

        assertEquals("https://npm.example.com/repository/npm",
                NpmrcReader.resolveRegistry(null, null, projectDir));
    }

    @Test
    public void testPrecedence() throws IOException {
        writeNpmrc("registry=https://from-npmrc.example.com\n");

        assertEquals("https://from-env.example.com",
                NpmrcReader.resolveRegistry(null, "https://from-env.example.com/", projectDir));
        assertEquals("https://explicit.example.com",
                NpmrcReader.resolveRegistry("https://explicit.example.com", "https://from-env.example.com", projectDir));
        assertEquals("https://from-npmrc.example.com",
                NpmrcReader.resolveRegistry("  ", "", projectDir));
    }

    @Test
    public void testNpmrcWithoutRegistry() throws IOException {
        writeNpmrc("save-exact=true\n");

        assertNull(NpmrcReader.readRegistry(projectDir.resolve(".npmrc")));
        assertNull(NpmrcReader.readRegistry(projectDir.resolve("missing")));
    }
}
