package com.contrastsecurity.depupdate.model;

import java.util.Objects;

/**
 * A migration collection to run for one package between two versions.
 * Scheduled only; nothing in this project executes it.
 */
public class MigrationTask {
    private final String packageName;
    private final String collection;
    private final String from;
    private final String to;
    private final boolean dependsOnInstall;

    public MigrationTask(String packageName, String collection, String from, String to, boolean dependsOnInstall) {
        this.packageName = packageName;
        this.collection = collection;
        this.from = from;
        this.to = to;
        this.dependsOnInstall = dependsOnInstall;
    }

    public String getPackageName() {
        return packageName;
    }

    public String getCollection() {
        return collection;
    }

    public String getFrom() {
        return from;
    }

    public String getTo() {
        return to;
    }

    /**
     * @return true if the task must wait for the package install triggered by the manifest change
     */
    public boolean isDependsOnInstall() {
        return dependsOnInstall;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        MigrationTask that = (MigrationTask) o;
        return dependsOnInstall == that.dependsOnInstall &&
                Objects.equals(packageName, that.packageName) &&
                Objects.equals(collection, that.collection) &&
                Objects.equals(from, that.from) &&
                Objects.equals(to, that.to);
    }

    @Override
    public int hashCode() {
        return Objects.hash(packageName, collection, from, to, dependsOnInstall);
    }

    @Override
    public String toString() {
        return "MigrationTask{" +
                "package='" + packageName + '\'' +
                ", collection='" + collection + '\'' +
                ", from='" + from + '\'' +
                ", to='" + to + '\'' +
                ", dependsOnInstall=" + dependsOnInstall +
                '}';
    }
}
