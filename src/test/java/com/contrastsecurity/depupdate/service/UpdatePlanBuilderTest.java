package com.contrastsecurity.depupdate.service;

import com.contrastsecurity.depupdate.RegistryFixtures;
import com.contrastsecurity.depupdate.exception.ManifestException;
import com.contrastsecurity.depupdate.model.MigrationTask;
import com.contrastsecurity.depupdate.model.PackageInfo;
import com.contrastsecurity.depupdate.model.PackageManifestSnapshot;
import com.contrastsecurity.depupdate.model.PackageState;
import com.contrastsecurity.depupdate.model.UpdatePlan;
import com.contrastsecurity.depupdate.util.ManifestFile;
import com.google.gson.JsonObject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class UpdatePlanBuilderTest {

    private final UpdatePlanBuilder builder = new UpdatePlanBuilder();
    private final UpdateMetadataReader metadataReader = new UpdateMetadataReader();
    private JsonObject manifest;

    @BeforeEach
    public void setUp() throws ManifestException {
        manifest = ManifestFile.parse("{"
                + "\"name\": \"app\","
                + "\"dependencies\": {\"a\": \"^1.0.0\"},"
                + "\"devDependencies\": {\"a\": \"^1.0.0\", \"b\": \"~1.0.0\"},"
                + "\"peerDependencies\": {\"a\": \"^1.0.0\", \"b\": \"^1.0.0\", \"c\": \">=1.0.0\"}"
                + "}");
    }

    private PackageInfo info(String name, String installedVersion, RegistryFixtures.ManifestBuilder target) {
        PackageManifestSnapshot installedManifest = RegistryFixtures.manifest(name, installedVersion).build();
        PackageState targetState = null;
        if (target != null) {
            PackageManifestSnapshot targetManifest = target.build();
            targetState = new PackageState(targetManifest.getVersion(), targetManifest,
                    metadataReader.read(targetManifest));
        }
        return new PackageInfo(name, new PackageState(installedVersion, installedManifest, null),
                targetState, "^" + installedVersion, null);
    }

    @Test
    public void testDependenciesEntryWins() {
        assertEquals(UpdatePlanBuilder.SectionRule.IN_DEPENDENCIES, builder.applyUpdate(manifest, "a", "2.0.0"));

        assertEquals("2.0.0", manifest.getAsJsonObject("dependencies").get("a").getAsString());
        assertFalse(manifest.getAsJsonObject("devDependencies").has("a"));
        assertFalse(manifest.getAsJsonObject("peerDependencies").has("a"));
    }

    @Test
    public void testDevDependenciesEntryRemovesPeerEntry() {
        assertEquals(UpdatePlanBuilder.SectionRule.IN_DEV_DEPENDENCIES, builder.applyUpdate(manifest, "b", "2.0.0"));

        assertEquals("2.0.0", manifest.getAsJsonObject("devDependencies").get("b").getAsString());
        assertFalse(manifest.getAsJsonObject("peerDependencies").has("b"));
    }

    @Test
    public void testPeerOnlyEntryIsUpdatedInPlace() {
        assertEquals(UpdatePlanBuilder.SectionRule.IN_PEER_DEPENDENCIES, builder.applyUpdate(manifest, "c", "2.0.0"));

        assertEquals("2.0.0", manifest.getAsJsonObject("peerDependencies").get("c").getAsString());
    }

    @Test
    public void testUndeclaredPackageIsNotAdded() {
        assertNull(builder.applyUpdate(manifest, "d", "2.0.0"));
        assertFalse(manifest.getAsJsonObject("dependencies").has("d"));
    }

    @Test
    public void testBuildWritesManifestAndSchedulesMigrations() throws ManifestException {
        Map<String, PackageInfo> infoMap = new LinkedHashMap<>();
        infoMap.put("a", info("a", "1.0.0", RegistryFixtures.manifest("a", "2.0.0").migrations("./migrations.json")));
        infoMap.put("b", info("b", "1.0.0", RegistryFixtures.manifest("b", "2.0.0")));
        infoMap.put("c", info("c", "1.0.0", null));
        String original = ManifestFile.serialize(manifest);

        UpdatePlan plan = builder.build(infoMap, manifest, false);

        assertTrue(plan.isManifestChanged());
        assertTrue(plan.isInstallRequired());
        assertEquals(Collections.singletonList(
                new MigrationTask("a", "./migrations.json", "1.0.0", "2.0.0", true)), plan.getTasks());

        JsonObject written = ManifestFile.parse(plan.getManifestContent());
        assertEquals("2.0.0", written.getAsJsonObject("dependencies").get("a").getAsString());
        assertEquals("2.0.0", written.getAsJsonObject("devDependencies").get("b").getAsString());
        assertEquals(">=1.0.0", written.getAsJsonObject("peerDependencies").get("c").getAsString());
        assertTrue(plan.getManifestContent().contains("\">=1.0.0\""));

        // the input manifest is left alone
        assertEquals(original, ManifestFile.serialize(manifest));
    }

    @Test
    public void testUnchangedManifestGivesEmptyPlan() {
        Map<String, PackageInfo> infoMap = Collections.singletonMap("a", info("a", "1.0.0", null));

        assertEquals(UpdatePlan.empty(), builder.build(infoMap, manifest, false));
    }

    @Test
    public void testMigrateOnlyLeavesManifestAlone() {
        Map<String, PackageInfo> infoMap = Collections.singletonMap("a",
                info("a", "1.0.0", RegistryFixtures.manifest("a", "2.0.0").migrations("migrations/collection.json")));

        UpdatePlan plan = builder.build(infoMap, manifest, true);

        assertFalse(plan.isManifestChanged());
        assertFalse(plan.isInstallRequired());
        assertEquals(Collections.singletonList(
                new MigrationTask("a", "a/migrations/collection.json", "1.0.0", "2.0.0", false)), plan.getTasks());
    }

    @Test
    public void testCollectionPath() {
        assertEquals("./migrations.json", UpdatePlanBuilder.collectionPath("a", "./migrations.json"));
        assertEquals("/opt/migrations.json", UpdatePlanBuilder.collectionPath("a", "/opt/migrations.json"));
        assertEquals("@scope/a/migrations.json", UpdatePlanBuilder.collectionPath("@scope/a", "migrations.json"));
    }
}
