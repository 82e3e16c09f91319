package com.contrastsecurity.depupdate.version;

import com.contrastsecurity.depupdate.model.VersionToken;

import java.util.regex.Pattern;

/**
 * Classifies the version strings found on the command line and in package.json.
 *
 * Handles:
 * - request tokens: {@code latest}, {@code 2.1.0}, {@code ^2.0.0}
 * - declared ranges that are not versions at all, e.g. {@code git://...},
 *   {@code file:../lib} or GitHub's {@code user/repo} shorthand
 */
public class VersionTokenParser {

    /**
     * Full semantic version, optionally prefixed with "v".
     * Examples: 1.2.3, v1.2.3, 2.0.0-rc.1, 1.0.0+build.5
     */
    private static final Pattern EXACT_PATTERN = Pattern.compile(
        "^v?(0|[1-9][0-9]*)\\.(0|[1-9][0-9]*)\\.(0|[1-9][0-9]*)" +
        "(?:-[0-9A-Za-z-]+(?:\\.[0-9A-Za-z-]+)*)?" +   // pre-release
        "(?:\\+[0-9A-Za-z-]+(?:\\.[0-9A-Za-z-]+)*)?$"   // build metadata
    );

    /**
     * Dist-tag names: an identifier starting with a letter.
     * Examples: latest, next, beta, rc-1
     */
    private static final Pattern TAG_PATTERN = Pattern.compile("^[A-Za-z][A-Za-z0-9._-]*$");

    /** GitHub's "user/repo" shorthand. */
    private static final Pattern REPO_SHORTHAND_PATTERN = Pattern.compile("^\\w{1,100}/\\w{1,100}");

    /** Local folder, maybe relative. */
    private static final Pattern LOCAL_PATH_PATTERN = Pattern.compile("^(?:\\.{0,2}/)\\w{1,100}");

    private VersionTokenParser() {
        // Utility class - prevent instantiation
    }

    /**
     * Parse a raw token into a tag, an exact version or a range.
     *
     * @param raw The token as given, e.g. on the command line
     * @return VersionToken of the matching kind
     */
    public static VersionToken parse(String raw) {
        if (raw == null) {
            throw new IllegalArgumentException("version token must not be null");
        }
        String token = raw.trim();
        if (EXACT_PATTERN.matcher(token).matches()) {
            return VersionToken.exact(token);
        }
        // "x" and "X" are wildcards, not tags
        if (TAG_PATTERN.matcher(token).matches() && !token.equalsIgnoreCase("x")) {
            return VersionToken.tag(token);
        }
        return VersionToken.range(token);
    }

    /**
     * Check whether a declared range points somewhere other than the registry
     * (URL, local folder, git reference or GitHub shorthand).
     *
     * @param declaredRange The range from package.json
     * @return true if the value is a locator rather than a semantic-version range
     */
    public static boolean isNonSemanticLocator(String declaredRange) {
        if (declaredRange == null) {
            return false;
        }
        return declaredRange.startsWith("http:")
                || declaredRange.startsWith("https:")
                || declaredRange.startsWith("file:")
                || declaredRange.startsWith("git:")
                || declaredRange.startsWith("git+")
                || REPO_SHORTHAND_PATTERN.matcher(declaredRange).find()
                || LOCAL_PATH_PATTERN.matcher(declaredRange).find();
    }
}
