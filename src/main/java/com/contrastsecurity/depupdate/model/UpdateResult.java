package com.contrastsecurity.depupdate.model;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one run: an update plan, or a report when nothing was requested.
 */
public class UpdateResult {
    private final UpdatePlan plan;
    private final UpdateReport report;
    private final Map<String, PackageInfo> packages;
    private final List<PeerViolation> violations;

    private UpdateResult(UpdatePlan plan, UpdateReport report, Map<String, PackageInfo> packages,
                         List<PeerViolation> violations) {
        this.plan = plan;
        this.report = report;
        this.packages = packages != null ? packages : Collections.emptyMap();
        this.violations = violations != null ? violations : Collections.emptyList();
    }

    public static UpdateResult ofPlan(UpdatePlan plan, Map<String, PackageInfo> packages,
                                      List<PeerViolation> violations) {
        return new UpdateResult(plan, null, packages, violations);
    }

    public static UpdateResult ofReport(UpdateReport report, Map<String, PackageInfo> packages) {
        return new UpdateResult(UpdatePlan.empty(), report, packages, null);
    }

    /**
     * @return the plan; empty in report mode
     */
    public UpdatePlan getPlan() {
        return plan;
    }

    /**
     * @return the report, or null if packages were requested
     */
    public UpdateReport getReport() {
        return report;
    }

    public boolean isReport() {
        return report != null;
    }

    public Map<String, PackageInfo> getPackages() {
        return packages;
    }

    /**
     * @return violations that were tolerated because the update was forced
     */
    public List<PeerViolation> getViolations() {
        return violations;
    }
}
