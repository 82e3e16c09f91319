package com.contrastsecurity.depupdate.service;

import com.contrastsecurity.depupdate.UpdateOptions;
import com.contrastsecurity.depupdate.api.RegistryClient;
import com.contrastsecurity.depupdate.exception.ConfigurationException;
import com.contrastsecurity.depupdate.exception.UpdateException;
import com.contrastsecurity.depupdate.model.PackageInfo;
import com.contrastsecurity.depupdate.model.PackageState;
import com.contrastsecurity.depupdate.model.PeerViolation;
import com.contrastsecurity.depupdate.model.RegistrySnapshot;
import com.contrastsecurity.depupdate.model.RequestSet;
import com.contrastsecurity.depupdate.model.UpdatePlan;
import com.contrastsecurity.depupdate.model.UpdateReport;
import com.contrastsecurity.depupdate.model.UpdateResult;
import com.contrastsecurity.depupdate.model.VersionToken;
import com.contrastsecurity.depupdate.version.MigrationVersionFormatter;
import com.contrastsecurity.depupdate.version.VersionOracle;
import com.google.gson.JsonObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Runs one update: catalog, requests, registry fetch, expansion, resolution,
 * validation and planning.
 *
 * Algorithm:
 * 1. Read the declared packages from package.json
 * 2. Build the request set from the selectors
 * 3. Fetch registry metadata of every declared package in parallel
 * 4. Expand the request set with package groups and peer dependencies
 * 5. Resolve installed and target versions
 * 6. Nothing requested: report. Otherwise validate peers and build the plan
 *
 * Each stage hands an immutable result to the next one.
 */
public class UpdatePipeline implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(UpdatePipeline.class);

    private final UpdateOptions options;
    private final RegistryClient registryClient;
    private final VersionOracle versionOracle;
    private final InstalledVersionProbe installedProbe;
    private final UpdateMetadataReader metadataReader;

    public UpdatePipeline(UpdateOptions options, RegistryClient registryClient, VersionOracle versionOracle,
                          InstalledVersionProbe installedProbe) {
        this.options = options;
        this.registryClient = registryClient;
        this.versionOracle = versionOracle;
        this.installedProbe = installedProbe;
        this.metadataReader = new UpdateMetadataReader();
    }

    /**
     * Run the update against a parsed package.json.
     *
     * @param manifest The project's package.json; not modified
     * @return the plan, or a report when nothing was requested
     * @throws UpdateException on the first fatal error; nothing has been written at that point
     */
    public UpdateResult run(JsonObject manifest) throws UpdateException {
        MigrationVersionFormatter versionFormatter = new MigrationVersionFormatter(versionOracle);
        String from = versionFormatter.format(options.getFrom());
        String to = versionFormatter.format(options.getTo());

        ManifestCatalog catalog = ManifestCatalog.fromManifest(manifest);
        logger.info("package.json declares {} packages", catalog.size());

        if (options.isSinglePackageMigration()) {
            return migrateSinglePackage(catalog, from, to);
        }

        RequestSet requested = new RequestSetBuilder(catalog)
                .build(options.getPackages(), options.isAll(), options.isNext());

        RegistrySnapshotFetcher fetcher = new RegistrySnapshotFetcher(registryClient);
        Map<String, RegistrySnapshot> snapshots = fetcher.fetchAll(catalog.names(), requested, options.isAll());

        RequestSetExpander expander = new RequestSetExpander(
                new GroupExpander(catalog, metadataReader), new PeerInjector());
        RequestSet requests = expander.expand(requested, snapshots);
        logger.debug("Request set: {}", requests);

        PackageInfoResolver resolver = new PackageInfoResolver(catalog, versionOracle, installedProbe, metadataReader);
        Map<String, PackageInfo> infoMap = resolver.resolveAll(requests, snapshots);

        if (requests.isEmpty()) {
            UpdateReport report = new UpdateReporter(versionOracle, metadataReader).report(infoMap, options.isNext());
            return UpdateResult.ofReport(report, infoMap);
        }

        List<PeerViolation> violations = new PeerCompatibilityValidator(versionOracle)
                .validate(infoMap, options.isForce());
        UpdatePlan plan = new UpdatePlanBuilder().build(infoMap, manifest, options.isMigrateOnly());
        logger.info("Planned {} package update(s) and {} migration task(s)",
                infoMap.values().stream().filter(PackageInfo::hasTarget).count(), plan.getTasks().size());
        return UpdateResult.ofPlan(plan, infoMap, violations);
    }

    private UpdateResult migrateSinglePackage(ManifestCatalog catalog, String from, String to)
            throws UpdateException {
        if (options.getPackages().size() != 1) {
            throw new ConfigurationException("--from requires that only a single package be passed.");
        }
        String name = options.getPackages().get(0);
        String declaredRange = catalog.getRange(name);
        if (declaredRange == null) {
            throw new ConfigurationException("Package \"" + name + "\" was not found in package.json.");
        }

        RequestSet requested = RequestSet.builder()
                .put(name, VersionToken.tag(RequestSetBuilder.LATEST_TAG))
                .build();
        Map<String, RegistrySnapshot> snapshots = new RegistrySnapshotFetcher(registryClient)
                .fetchAll(Collections.singletonList(name), requested, false);

        PackageInfoResolver resolver = new PackageInfoResolver(catalog, versionOracle, installedProbe, metadataReader);
        PackageState installed = resolver.resolveInstalled(snapshots.get(name), declaredRange);
        UpdatePlan plan = new MigrateOnlyPlanner().plan(name, installed, from, to);
        return UpdateResult.ofPlan(plan, Collections.emptyMap(), Collections.emptyList());
    }

    @Override
    public void close() {
        registryClient.close();
    }
}
