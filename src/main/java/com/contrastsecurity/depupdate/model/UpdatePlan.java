package com.contrastsecurity.depupdate.model;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Result of planning: the new package.json content (if it changed) and the
 * migration tasks to run after installing it.
 */
public class UpdatePlan {
    private static final UpdatePlan EMPTY = new UpdatePlan(null, false, Collections.emptyList());

    private final String manifestContent;  // null means "no change"
    private final boolean installRequired;
    private final List<MigrationTask> tasks;

    public UpdatePlan(String manifestContent, boolean installRequired, List<MigrationTask> tasks) {
        this.manifestContent = manifestContent;
        this.installRequired = installRequired;
        this.tasks = tasks != null ? List.copyOf(tasks) : Collections.emptyList();
    }

    public static UpdatePlan empty() {
        return EMPTY;
    }

    /**
     * @return the serialized new package.json, or null if the manifest does not change
     */
    public String getManifestContent() {
        return manifestContent;
    }

    public boolean isManifestChanged() {
        return manifestContent != null;
    }

    public boolean isInstallRequired() {
        return installRequired;
    }

    public List<MigrationTask> getTasks() {
        return tasks;
    }

    public boolean isEmpty() {
        return manifestContent == null && tasks.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        UpdatePlan that = (UpdatePlan) o;
        return installRequired == that.installRequired &&
                Objects.equals(manifestContent, that.manifestContent) &&
                tasks.equals(that.tasks);
    }

    @Override
    public int hashCode() {
        return Objects.hash(manifestContent, installRequired, tasks);
    }

    @Override
    public String toString() {
        return "UpdatePlan{manifestChanged=" + isManifestChanged() +
                ", installRequired=" + installRequired +
                ", tasks=" + tasks + '}';
    }
}
