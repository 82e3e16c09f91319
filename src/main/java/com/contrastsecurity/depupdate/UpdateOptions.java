package com.contrastsecurity.depupdate;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Options of one depupdate run.
 */
public class UpdateOptions {
    private final List<String> packages;
    private final boolean all;
    private final boolean next;
    private final boolean force;
    private final boolean migrateOnly;
    private final String from;
    private final String to;
    private final String registry;
    private final boolean insecure;
    private final Path projectDir;
    private final String planOutput;
    private final boolean dryRun;

    private UpdateOptions(Builder builder) {
        this.packages = Collections.unmodifiableList(new ArrayList<>(builder.packages));
        this.all = builder.all;
        this.next = builder.next;
        this.force = builder.force;
        this.migrateOnly = builder.migrateOnly;
        this.from = builder.from;
        this.to = builder.to;
        this.registry = builder.registry;
        this.insecure = builder.insecure;
        this.projectDir = builder.projectDir;
        this.planOutput = builder.planOutput;
        this.dryRun = builder.dryRun;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return package selectors ({@code name} or {@code name@token})
     */
    public List<String> getPackages() {
        return packages;
    }

    public boolean isAll() {
        return all;
    }

    public boolean isNext() {
        return next;
    }

    public boolean isForce() {
        return force;
    }

    public boolean isMigrateOnly() {
        return migrateOnly;
    }

    public String getFrom() {
        return from;
    }

    public String getTo() {
        return to;
    }

    /**
     * @return registry given on the command line, or null
     */
    public String getRegistry() {
        return registry;
    }

    public boolean isInsecure() {
        return insecure;
    }

    public Path getProjectDir() {
        return projectDir;
    }

    /**
     * @return file the plan is written to, or null for stdout
     */
    public String getPlanOutput() {
        return planOutput;
    }

    public boolean isDryRun() {
        return dryRun;
    }

    /**
     * @return true for the single-package migrate-only mode
     */
    public boolean isSinglePackageMigration() {
        return migrateOnly && from != null;
    }

    @Override
    public String toString() {
        return "UpdateOptions{" +
                "packages=" + packages +
                ", all=" + all +
                ", next=" + next +
                ", force=" + force +
                ", migrateOnly=" + migrateOnly +
                ", from='" + from + '\'' +
                ", to='" + to + '\'' +
                ", registry='" + registry + '\'' +
                ", projectDir=" + projectDir +
                ", dryRun=" + dryRun +
                '}';
    }

    public static class Builder {
        private final List<String> packages = new ArrayList<>();
        private boolean all;
        private boolean next;
        private boolean force;
        private boolean migrateOnly;
        private String from;
        private String to;
        private String registry;
        private boolean insecure;
        private Path projectDir = Paths.get(".");
        private String planOutput;
        private boolean dryRun;

        /**
         * Add package selectors; a comma separated value adds each part.
         */
        public Builder addPackages(String selectors) {
            for (String selector : selectors.split(",")) {
                String trimmed = selector.trim();
                if (!trimmed.isEmpty()) {
                    packages.add(trimmed);
                }
            }
            return this;
        }

        public Builder all(boolean all) {
            this.all = all;
            return this;
        }

        public Builder next(boolean next) {
            this.next = next;
            return this;
        }

        public Builder force(boolean force) {
            this.force = force;
            return this;
        }

        public Builder migrateOnly(boolean migrateOnly) {
            this.migrateOnly = migrateOnly;
            return this;
        }

        public Builder from(String from) {
            this.from = from;
            return this;
        }

        public Builder to(String to) {
            this.to = to;
            return this;
        }

        public Builder registry(String registry) {
            this.registry = registry;
            return this;
        }

        public Builder insecure(boolean insecure) {
            this.insecure = insecure;
            return this;
        }

        public Builder projectDir(Path projectDir) {
            this.projectDir = projectDir;
            return this;
        }

        public Builder planOutput(String planOutput) {
            this.planOutput = planOutput;
            return this;
        }

        public Builder dryRun(boolean dryRun) {
            this.dryRun = dryRun;
            return this;
        }

        public UpdateOptions build() {
            return new UpdateOptions(this);
        }
    }
}
