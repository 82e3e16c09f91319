package com.contrastsecurity.depupdate.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Packages requested for update, each with the version token it should move to.
 *
 * Instances are immutable. Growth happens on a {@link Builder}, which only ever
 * adds names that are not present yet, so a token chosen earlier (for instance
 * on the command line) can never be overridden by expansion.
 */
public class RequestSet {
    private static final RequestSet EMPTY = new RequestSet(Collections.emptyMap());

    private final Map<String, VersionToken> tokens;

    private RequestSet(Map<String, VersionToken> tokens) {
        this.tokens = Collections.unmodifiableMap(new LinkedHashMap<>(tokens));
    }

    public static RequestSet empty() {
        return EMPTY;
    }

    public VersionToken get(String name) {
        return tokens.get(name);
    }

    public boolean contains(String name) {
        return tokens.containsKey(name);
    }

    public Set<String> names() {
        return tokens.keySet();
    }

    public Map<String, VersionToken> asMap() {
        return tokens;
    }

    public int size() {
        return tokens.size();
    }

    public boolean isEmpty() {
        return tokens.isEmpty();
    }

    public Builder toBuilder() {
        return new Builder(tokens);
    }

    public static Builder builder() {
        return new Builder(Collections.emptyMap());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return tokens.equals(((RequestSet) o).tokens);
    }

    @Override
    public int hashCode() {
        return tokens.hashCode();
    }

    @Override
    public String toString() {
        return "RequestSet" + tokens;
    }

    /**
     * Additive, insertion ordered builder.
     */
    public static class Builder {
        private final Map<String, VersionToken> tokens;

        private Builder(Map<String, VersionToken> initial) {
            this.tokens = new LinkedHashMap<>(initial);
        }

        /**
         * Set the token of a name, replacing a previous one. Used while parsing
         * selectors, where a later selector for the same name wins.
         */
        public Builder put(String name, VersionToken token) {
            tokens.put(name, token);
            return this;
        }

        /**
         * Add a name unless it is already requested.
         *
         * @return true if the name was added
         */
        public boolean addIfAbsent(String name, VersionToken token) {
            return tokens.putIfAbsent(name, token) == null;
        }

        public boolean contains(String name) {
            return tokens.containsKey(name);
        }

        public VersionToken get(String name) {
            return tokens.get(name);
        }

        public RequestSet build() {
            return tokens.isEmpty() ? EMPTY : new RequestSet(tokens);
        }
    }
}
