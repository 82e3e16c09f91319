package com.contrastsecurity.depupdate.version;

import com.vdurmont.semver4j.Semver;
import com.vdurmont.semver4j.SemverException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;

/**
 * {@link VersionOracle} backed by semver4j in npm mode.
 *
 * Pre-release versions only match a range that names a pre-release of the same
 * major.minor.patch, as npm does.
 */
public class SemverVersionOracle implements VersionOracle {
    private static final Logger logger = LoggerFactory.getLogger(SemverVersionOracle.class);

    @Override
    public boolean satisfies(String version, String range) {
        Semver semver = parse(version);
        if (semver == null || range == null) {
            return false;
        }
        return satisfies(semver, range);
    }

    @Override
    public int compare(String left, String right) {
        Semver leftVersion = parse(left);
        Semver rightVersion = parse(right);
        if (leftVersion == null || rightVersion == null) {
            throw new IllegalArgumentException("Cannot compare versions " + left + " and " + right);
        }
        return leftVersion.compareTo(rightVersion);
    }

    @Override
    public String maxSatisfying(Collection<String> versions, String range) {
        if (versions == null || range == null) {
            return null;
        }
        String best = null;
        Semver bestVersion = null;
        for (String candidate : versions) {
            Semver semver = parse(candidate);
            if (semver == null || !allowsPreRelease(semver, range) || !satisfies(semver, range)) {
                continue;
            }
            if (bestVersion == null || semver.isGreaterThan(bestVersion)) {
                best = candidate;
                bestVersion = semver;
            }
        }
        return best;
    }

    @Override
    public boolean isValid(String version) {
        if (version == null || version.isEmpty()) {
            return false;
        }
        String stripped = version.startsWith("v") ? version.substring(1) : version;
        try {
            new Semver(stripped, Semver.SemverType.STRICT);
            return true;
        } catch (SemverException e) {
            return false;
        }
    }

    private boolean satisfies(Semver semver, String range) {
        try {
            return semver.satisfies(range);
        } catch (RuntimeException e) {
            // semver4j rejects tags, URLs and other non-range strings by throwing
            logger.debug("Range {} is not a semantic-version range: {}", range, e.getMessage());
            return false;
        }
    }

    private static boolean allowsPreRelease(Semver semver, String range) {
        if (semver.getSuffixTokens().length == 0) {
            return true;
        }
        String tuple = semver.getMajor() + "." + semver.getMinor() + "." + semver.getPatch() + "-";
        return range.contains(tuple);
    }

    private static Semver parse(String version) {
        if (version == null || version.isEmpty()) {
            return null;
        }
        try {
            return new Semver(version, Semver.SemverType.NPM);
        } catch (SemverException e) {
            logger.debug("Invalid version {}: {}", version, e.getMessage());
            return null;
        }
    }
}
