package com.contrastsecurity.depupdate.service;

import com.contrastsecurity.depupdate.model.MigrationTask;
import com.contrastsecurity.depupdate.model.PackageState;
import com.contrastsecurity.depupdate.model.UpdatePlan;
import com.contrastsecurity.depupdate.model.UpdateMetadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;

/**
 * Schedules the migrations of a single installed package between two explicit versions,
 * without touching package.json.
 */
public class MigrateOnlyPlanner {
    private static final Logger logger = LoggerFactory.getLogger(MigrateOnlyPlanner.class);

    /**
     * @param packageName The package to migrate
     * @param installed Its installed state, whose metadata names the migrations
     * @param from Version to migrate from
     * @param to Version to migrate to, or null for the installed version
     * @return a plan with exactly one task, or an empty plan if the package ships no migrations
     */
    public UpdatePlan plan(String packageName, PackageState installed, String from, String to) {
        UpdateMetadata metadata = installed.getUpdateMetadata();
        if (!metadata.hasMigrations()) {
            logger.info("Package {} does not provide migrations, nothing to run", packageName);
            return UpdatePlan.empty();
        }

        String targetVersion = to != null ? to : installed.getVersion();
        MigrationTask task = new MigrationTask(packageName,
                UpdatePlanBuilder.collectionPath(packageName, metadata.getMigrations()),
                from, targetVersion, false);
        logger.info("Scheduling migrations of {} from {} to {}", packageName, from, targetVersion);
        return new UpdatePlan(null, false, Collections.singletonList(task));
    }
}
