package com.contrastsecurity.depupdate.service;

import com.contrastsecurity.depupdate.constants.DependencySection;
import com.contrastsecurity.depupdate.model.MigrationTask;
import com.contrastsecurity.depupdate.model.PackageInfo;
import com.contrastsecurity.depupdate.model.UpdatePlan;
import com.contrastsecurity.depupdate.util.ManifestFile;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Computes the new package.json and the migration tasks for the resolved packages.
 */
public class UpdatePlanBuilder {
    private static final Logger logger = LoggerFactory.getLogger(UpdatePlanBuilder.class);

    /**
     * Where a package is updated, by the first section that declares it, and
     * which weaker sections lose their entry for it.
     */
    enum SectionRule {
        IN_DEPENDENCIES(DependencySection.DEPENDENCIES,
                EnumSet.of(DependencySection.DEV_DEPENDENCIES, DependencySection.PEER_DEPENDENCIES)),
        IN_DEV_DEPENDENCIES(DependencySection.DEV_DEPENDENCIES,
                EnumSet.of(DependencySection.PEER_DEPENDENCIES)),
        IN_PEER_DEPENDENCIES(DependencySection.PEER_DEPENDENCIES,
                EnumSet.noneOf(DependencySection.class));

        private final DependencySection section;
        private final Set<DependencySection> removeFrom;

        SectionRule(DependencySection section, Set<DependencySection> removeFrom) {
            this.section = section;
            this.removeFrom = removeFrom;
        }

        DependencySection getSection() {
            return section;
        }

        Set<DependencySection> getRemoveFrom() {
            return removeFrom;
        }
    }

    /**
     * Build the plan.
     *
     * @param infoMap Resolved and validated packages
     * @param manifest The project's package.json; not modified
     * @param migrateOnly Schedule migrations without changing package.json
     * @return the plan; empty if nothing changes and migrate-only is off
     */
    public UpdatePlan build(Map<String, PackageInfo> infoMap, JsonObject manifest, boolean migrateOnly) {
        JsonObject updated = manifest.deepCopy();

        List<PackageInfo> toInstall = new ArrayList<>();
        for (PackageInfo info : infoMap.values()) {
            if (info.hasTarget()) {
                toInstall.add(info);
            }
        }

        for (PackageInfo info : toInstall) {
            logger.info("Updating package.json with dependency {} @ \"{}\" (was \"{}\")...",
                    info.getName(), info.getTarget().getVersion(), info.getInstalled().getVersion());
            applyUpdate(updated, info.getName(), info.getTarget().getVersion());
        }

        String originalContent = ManifestFile.serialize(manifest);
        String newContent = ManifestFile.serialize(updated);
        if (originalContent.equals(newContent) && !migrateOnly) {
            logger.info("package.json is unchanged, nothing to schedule");
            return UpdatePlan.empty();
        }

        boolean install = !migrateOnly;
        List<MigrationTask> tasks = new ArrayList<>();
        for (PackageInfo info : toInstall) {
            String migrations = info.getTarget().getUpdateMetadata().getMigrations();
            if (migrations == null || migrations.isEmpty()) {
                continue;
            }
            tasks.add(new MigrationTask(info.getName(), collectionPath(info.getName(), migrations),
                    info.getInstalled().getVersion(), info.getTarget().getVersion(), install));
        }

        return new UpdatePlan(install ? newContent : null, install, tasks);
    }

    /**
     * Set the version of a package in the first section declaring it.
     *
     * @return the rule that applied, or null if no section declares the package
     */
    SectionRule applyUpdate(JsonObject manifest, String name, String version) {
        for (SectionRule rule : SectionRule.values()) {
            JsonObject section = section(manifest, rule.getSection());
            if (section == null || !isDeclared(section, name)) {
                continue;
            }
            section.addProperty(name, version);
            for (DependencySection weaker : rule.getRemoveFrom()) {
                JsonObject other = section(manifest, weaker);
                if (other != null && isDeclared(other, name)) {
                    other.remove(name);
                }
            }
            return rule;
        }
        logger.warn("Package {} was not found in dependencies.", name);
        return null;
    }

    /**
     * Resolve the migration collection of a package. Paths starting with "." or "/"
     * are used as given; anything else is taken relative to the package.
     */
    static String collectionPath(String packageName, String migrations) {
        if (migrations.startsWith(".") || migrations.startsWith("/")) {
            return migrations;
        }
        return packageName + "/" + migrations;
    }

    private static JsonObject section(JsonObject manifest, DependencySection section) {
        JsonElement element = manifest.get(section.getKey());
        return element != null && element.isJsonObject() ? element.getAsJsonObject() : null;
    }

    private static boolean isDeclared(JsonObject section, String name) {
        JsonElement value = section.get(name);
        return value != null && value.isJsonPrimitive() && !value.getAsString().isEmpty();
    }
}
