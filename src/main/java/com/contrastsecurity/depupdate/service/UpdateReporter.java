package com.contrastsecurity.depupdate.service;

import com.contrastsecurity.depupdate.model.PackageInfo;
import com.contrastsecurity.depupdate.model.PackageManifestSnapshot;
import com.contrastsecurity.depupdate.model.UpdateMetadata;
import com.contrastsecurity.depupdate.model.UpdateReport;
import com.contrastsecurity.depupdate.version.VersionOracle;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Lists the packages with a newer release that ships upgrade metadata, when no
 * package was requested.
 */
public class UpdateReporter {
    private final VersionOracle versionOracle;
    private final UpdateMetadataReader metadataReader;

    public UpdateReporter(VersionOracle versionOracle, UpdateMetadataReader metadataReader) {
        this.versionOracle = versionOracle;
        this.metadataReader = metadataReader;
    }

    /**
     * @param infoMap Resolved packages
     * @param next Compare against the "next" dist-tag instead of "latest"
     * @return the report, sorted by package name
     */
    public UpdateReport report(Map<String, PackageInfo> infoMap, boolean next) {
        String tag = next ? RequestSetBuilder.NEXT_TAG : RequestSetBuilder.LATEST_TAG;
        List<UpdateReport.Entry> entries = new ArrayList<>();

        for (PackageInfo info : infoMap.values()) {
            String available = info.getRegistrySnapshot().getTaggedVersion(tag);
            PackageManifestSnapshot availableManifest = info.getRegistrySnapshot().getVersion(available);
            if (availableManifest == null || !availableManifest.hasUpdateMetadata()) {
                continue;
            }
            if (!versionOracle.isValid(available) || !versionOracle.isValid(info.getInstalled().getVersion())) {
                continue;
            }
            if (versionOracle.compare(info.getInstalled().getVersion(), available) >= 0) {
                continue;
            }

            UpdateMetadata metadata = metadataReader.read(availableManifest);
            String command = metadata.hasMigrations()
                    ? "depupdate " + info.getName()
                    : "npm install " + info.getName() + "@" + available;
            entries.add(new UpdateReport.Entry(info.getName(), info.getInstalled().getVersion(), available,
                    metadata.hasMigrations(), command));
        }

        entries.sort(Comparator.comparing(UpdateReport.Entry::getName));
        return new UpdateReport(tag, entries);
    }
}
