package com.contrastsecurity.depupdate.version;

import com.contrastsecurity.depupdate.exception.ConfigurationException;

import java.util.regex.Pattern;

/**
 * Normalizes the --from / --to versions of a migrate-only run.
 * Missing minor and patch parts are filled with zeros: {@code 8} becomes {@code 8.0.0}.
 */
public class MigrationVersionFormatter {

    private static final Pattern FULL_VERSION_PREFIX = Pattern.compile("^\\d{1,30}\\.\\d{1,30}\\.\\d{1,30}");

    private final VersionOracle versionOracle;

    public MigrationVersionFormatter(VersionOracle versionOracle) {
        this.versionOracle = versionOracle;
    }

    /**
     * @param version The version given by the user, may be null
     * @return the completed version, or null if none was given
     * @throws ConfigurationException if the completed version is not a valid semantic version
     */
    public String format(String version) throws ConfigurationException {
        if (version == null) {
            return null;
        }
        String formatted = version;
        for (int i = 0; i < 2 && !FULL_VERSION_PREFIX.matcher(formatted).find(); i++) {
            formatted += ".0";
        }
        if (!versionOracle.isValid(formatted)) {
            throw new ConfigurationException("Invalid migration version: \"" + version + "\"");
        }
        return formatted;
    }
}
