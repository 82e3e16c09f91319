package com.contrastsecurity.depupdate.model;

import java.util.Objects;

/**
 * A requested version: a dist-tag name, an exact version or a semantic-version range.
 *
 * The kind is decided once when the token is created (see
 * {@link com.contrastsecurity.depupdate.version.VersionTokenParser}) so later stages
 * never have to guess what a bare string means.
 */
public final class VersionToken {

    public enum Kind {
        TAG,
        EXACT,
        RANGE
    }

    private final Kind kind;
    private final String value;

    private VersionToken(Kind kind, String value) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.value = Objects.requireNonNull(value, "value");
    }

    public static VersionToken tag(String name) {
        return new VersionToken(Kind.TAG, name);
    }

    public static VersionToken exact(String version) {
        return new VersionToken(Kind.EXACT, version);
    }

    public static VersionToken range(String range) {
        return new VersionToken(Kind.RANGE, range);
    }

    public Kind getKind() {
        return kind;
    }

    public String getValue() {
        return value;
    }

    public boolean isTag() {
        return kind == Kind.TAG;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        VersionToken that = (VersionToken) o;
        return kind == that.kind && value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, value);
    }

    @Override
    public String toString() {
        return kind.name().toLowerCase() + ":" + value;
    }
}
