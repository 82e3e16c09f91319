package com.contrastsecurity.depupdate.model;

import java.util.Objects;

/**
 * One peer dependency constraint that the planned update would break.
 */
public class PeerViolation {

    public enum Kind {
        MISSING,
        INCOMPATIBLE
    }

    private final Kind kind;
    private final String packageName;
    private final String peerName;
    private final String requiredRange;
    private final String actualVersion;  // null for MISSING

    public PeerViolation(Kind kind, String packageName, String peerName, String requiredRange, String actualVersion) {
        this.kind = kind;
        this.packageName = packageName;
        this.peerName = peerName;
        this.requiredRange = requiredRange;
        this.actualVersion = actualVersion;
    }

    public static PeerViolation missing(String packageName, String peerName, String requiredRange) {
        return new PeerViolation(Kind.MISSING, packageName, peerName, requiredRange, null);
    }

    public static PeerViolation incompatible(String packageName, String peerName, String requiredRange,
                                             String actualVersion) {
        return new PeerViolation(Kind.INCOMPATIBLE, packageName, peerName, requiredRange, actualVersion);
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * @return the package declaring the peer dependency
     */
    public String getPackageName() {
        return packageName;
    }

    public String getPeerName() {
        return peerName;
    }

    public String getRequiredRange() {
        return requiredRange;
    }

    public String getActualVersion() {
        return actualVersion;
    }

    /**
     * @return human readable description, the same text that gets logged
     */
    public String describe() {
        if (kind == Kind.MISSING) {
            return String.format("Package \"%s\" has a missing peer dependency of \"%s\" @ \"%s\".",
                    packageName, peerName, requiredRange);
        }
        return String.format("Package \"%s\" has an incompatible peer dependency to \"%s\" (requires \"%s\", would install \"%s\").",
                packageName, peerName, requiredRange, actualVersion);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PeerViolation that = (PeerViolation) o;
        return kind == that.kind &&
                Objects.equals(packageName, that.packageName) &&
                Objects.equals(peerName, that.peerName) &&
                Objects.equals(requiredRange, that.requiredRange) &&
                Objects.equals(actualVersion, that.actualVersion);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, packageName, peerName, requiredRange, actualVersion);
    }

    @Override
    public String toString() {
        return describe();
    }
}
