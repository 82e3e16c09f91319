package com.contrastsecurity.depupdate.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Normalized upgrade metadata of one package version.
 */
public class UpdateMetadata {
    private static final UpdateMetadata EMPTY = new UpdateMetadata(null, null, null);

    private final List<String> packageGroup;
    private final Map<String, String> requirements;
    private final String migrations;

    public UpdateMetadata(List<String> packageGroup, Map<String, String> requirements, String migrations) {
        this.packageGroup = packageGroup != null ? List.copyOf(packageGroup) : Collections.emptyList();
        this.requirements = requirements != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(requirements))
                : Collections.emptyMap();
        this.migrations = migrations;
    }

    public static UpdateMetadata empty() {
        return EMPTY;
    }

    public List<String> getPackageGroup() {
        return packageGroup;
    }

    public Map<String, String> getRequirements() {
        return requirements;
    }

    /**
     * @return path of the migration collection, or null if the package ships none
     */
    public String getMigrations() {
        return migrations;
    }

    public boolean hasMigrations() {
        return migrations != null && !migrations.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        UpdateMetadata that = (UpdateMetadata) o;
        return packageGroup.equals(that.packageGroup) &&
                requirements.equals(that.requirements) &&
                Objects.equals(migrations, that.migrations);
    }

    @Override
    public int hashCode() {
        return Objects.hash(packageGroup, requirements, migrations);
    }

    @Override
    public String toString() {
        return "UpdateMetadata{" +
                "packageGroup=" + packageGroup +
                ", requirements=" + requirements +
                ", migrations='" + migrations + '\'' +
                '}';
    }
}
