package com.contrastsecurity.depupdate.version;

import java.util.Collection;

/**
 * Semantic-version queries used by resolution and validation.
 */
public interface VersionOracle {

    /**
     * @return true if the version satisfies the range; false for unparseable input
     */
    boolean satisfies(String version, String range);

    /**
     * Compare two versions by semantic-version precedence.
     *
     * @throws IllegalArgumentException if either version cannot be parsed
     */
    int compare(String left, String right);

    /**
     * @return the highest version satisfying the range, or null if none does
     */
    String maxSatisfying(Collection<String> versions, String range);

    /**
     * @return true if the string is a valid semantic version
     */
    boolean isValid(String version);

    default boolean isGreaterThan(String left, String right) {
        return compare(left, right) > 0;
    }
}
