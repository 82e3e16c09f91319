package com.contrastsecurity.depupdate.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;

/**
 * Decides which registry to talk to.
 *
 * Precedence: explicit option, then the NPM_CONFIG_REGISTRY environment
 * variable, then {@code registry=} in the project's .npmrc, then the public registry.
 */
public class NpmrcReader {
    private static final Logger logger = LoggerFactory.getLogger(NpmrcReader.class);

    public static final String DEFAULT_REGISTRY = "https://registry.npmjs.org";
    public static final String REGISTRY_ENV = "NPM_CONFIG_REGISTRY";

    private NpmrcReader() {
        // Utility class - prevent instantiation
    }

    /**
     * @param explicitRegistry Registry given on the command line, may be null
     * @param environmentRegistry Value of NPM_CONFIG_REGISTRY, may be null
     * @param projectDir Project root holding an optional .npmrc
     * @return the registry base URL without trailing slash
     */
    public static String resolveRegistry(String explicitRegistry, String environmentRegistry, Path projectDir) {
        String registry = explicitRegistry;
        if (isBlank(registry)) {
            registry = environmentRegistry;
        }
        if (isBlank(registry) && projectDir != null) {
            registry = readRegistry(projectDir.resolve(".npmrc"));
        }
        if (isBlank(registry)) {
            registry = DEFAULT_REGISTRY;
        }
        registry = registry.trim();
        while (registry.endsWith("/")) {
            registry = registry.substring(0, registry.length() - 1);
        }
        logger.debug("Using registry {}", registry);
        return registry;
    }

    /**
     * Read the {@code registry} key of an .npmrc file.
     *
     * @return the configured registry, or null if the file or the key is absent
     */
    static String readRegistry(Path npmrc) {
        if (!Files.isRegularFile(npmrc)) {
            return null;
        }
        Properties props = new Properties();
        try (Reader reader = Files.newBufferedReader(npmrc, StandardCharsets.UTF_8)) {
            props.load(reader);
        } catch (IOException e) {
            logger.warn("Could not read {}: {}", npmrc, e.getMessage());
            return null;
        }
        return props.getProperty("registry");
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }
}
