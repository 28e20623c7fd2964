package org.tanzu.fleetinventory.reconcile;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.tanzu.fleetinventory.identity.DeviceIdentity;
import org.tanzu.fleetinventory.identity.DeviceIdentityNormalizer;
import org.tanzu.fleetinventory.model.DeviceRecord;
import org.tanzu.fleetinventory.model.DirectoryGroup;
import org.tanzu.fleetinventory.model.InventoryWarning;
import org.tanzu.fleetinventory.model.OrchestrationGroup;
import org.tanzu.fleetinventory.model.PartialRecord;
import org.tanzu.fleetinventory.model.ProvisioningGroup;
import org.tanzu.fleetinventory.model.SourceKind;
import org.tanzu.fleetinventory.model.TelemetryGroup;
import org.tanzu.fleetinventory.model.VirtualizationGroup;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class CrossSourceReconcilerTest {

    private final CrossSourceReconciler reconciler = new CrossSourceReconciler();

    private static final OrphanInclusionPolicy PVS_ONLY = OrphanInclusionPolicy.matchingProvisioningTypes(Set.of("PVS"));

    private static PartialRecord provisioned(String name, String disk) {
        return PartialRecord.builder(DeviceIdentityNormalizer.normalize(name))
                .provisioning(ProvisioningGroup.builder().diskName(disk).build())
                .build();
    }

    private static PartialRecord brokered(String name, String catalog, String provisioningType) {
        return PartialRecord.builder(DeviceIdentityNormalizer.normalize(name))
                .orchestration(OrchestrationGroup.builder().catalogName(catalog).provisioningType(provisioningType).build())
                .build();
    }

    private static PartialRecord vm(String name, String host, Integer cpus) {
        return PartialRecord.builder(DeviceIdentityNormalizer.normalize(name, null, '_'))
                .virtualization(VirtualizationGroup.builder().host(host).cpuCount(cpus).build())
                .build();
    }

    private static PartialRecord directory(String name, String description) {
        return PartialRecord.builder(DeviceIdentityNormalizer.normalize(name))
                .directory(DirectoryGroup.builder().description(description).created(Instant.parse("2024-01-01T00:00:00Z")).build())
                .build();
    }

    private static SourceSnapshot pvs(PartialRecord... records) {
        return SourceSnapshot.of("pvs", SourceKind.PROVISIONING, List.of(records));
    }

    private static SourceSnapshot broker(String name, PartialRecord... records) {
        return SourceSnapshot.orphanCapable(name, SourceKind.ORCHESTRATION, List.of(records));
    }

    private static SourceSnapshot abcPrimary() {
        return pvs(provisioned("VDA-A", "GOLD"), provisioned("VDA-B", "GOLD"), provisioned("VDA-C", "GOLD"));
    }

    private static SourceSnapshot abcdBroker() {
        return broker("broker",
                brokered("VDA-A", "Pool", "PVS"),
                brokered("VDA-B", "Pool", "PVS"),
                brokered("VDA-C", "Pool", "PVS"),
                brokered("VDA-D", "Pool", "PVS"));
    }

    @Test
    void everyPrimaryDeviceYieldsOneRecord() {
        ReconciliationResult result = reconciler.reconcile(abcPrimary(), List.of(), PVS_ONLY);

        assertEquals(3, result.getRecords().size());
        for (String name : List.of("VDA-A", "VDA-B", "VDA-C")) {
            DeviceRecord record = result.get(DeviceIdentity.of(name, null));
            assertNotNull(record, name);
            assertFalse(record.isOrphan());
            assertEquals("GOLD", record.getProvisioning().getDiskName());
            assertEquals(List.of("pvs"), record.getContributingSources());
        }
    }

    @Test
    void brokerOnlyPvsMachineIsOrphanWhenPolicyMatches() {
        ReconciliationResult result = reconciler.reconcile(abcPrimary(), List.of(abcdBroker()), PVS_ONLY);

        assertEquals(4, result.getRecords().size());
        DeviceRecord orphan = result.get(DeviceIdentity.of("VDA-D", null));
        assertTrue(orphan.isOrphan());
        assertEquals("broker", orphan.getProvenance());
        assertNull(orphan.getProvisioning());
        assertEquals(Map.of("broker", 1), result.getOrphanCounts());
    }

    @Test
    void brokerOnlyPvsMachineIsExcludedWhenPolicyAsksForMcs() {
        OrphanInclusionPolicy mcsOnly = OrphanInclusionPolicy.matchingProvisioningTypes(List.of("mcs"));
        ReconciliationResult result = reconciler.reconcile(abcPrimary(), List.of(abcdBroker()), mcsOnly);

        assertEquals(3, result.getRecords().size());
        assertNull(result.get(DeviceIdentity.of("VDA-D", null)));
        assertEquals(Map.of("broker", 0), result.getOrphanCounts());
    }

    @Test
    void includeAllAndMissingClassifierAdmitOrphans() {
        SourceSnapshot brokerWithUnknownCatalog = broker("broker",
                brokered("VDA-E", "Static", "Manual"),
                PartialRecord.builder(DeviceIdentity.of("VDA-F", null)).build());

        ReconciliationResult all = reconciler.reconcile(abcPrimary(), List.of(brokerWithUnknownCatalog),
                OrphanInclusionPolicy.includeAll());
        assertEquals(5, all.getRecords().size());

        ReconciliationResult pvsOnly = reconciler.reconcile(abcPrimary(), List.of(brokerWithUnknownCatalog), PVS_ONLY);
        assertNull(pvsOnly.get(DeviceIdentity.of("VDA-E", null)));
        assertTrue(pvsOnly.get(DeviceIdentity.of("VDA-F", null)).isOrphan());
    }

    @Test
    void enrichmentOnlySourceNeverIntroducesDevices() {
        SourceSnapshot vcenter = SourceSnapshot.of("vcenter", SourceKind.VIRTUALIZATION,
                List.of(vm("VDA-A_pool", "esx01", 2), vm("STRAY01", "esx02", 4)));

        ReconciliationResult result = reconciler.reconcile(abcPrimary(), List.of(vcenter), OrphanInclusionPolicy.includeAll());

        assertEquals(3, result.getRecords().size());
        assertEquals("esx01", result.get(DeviceIdentity.of("VDA-A", null)).getVirtualization().getHost());
        assertNull(result.get(DeviceIdentity.of("STRAY01", null)));
    }

    @Test
    void strongerSourceWinsRegardlessOfListOrder() {
        SourceSnapshot vcenter = SourceSnapshot.of("vcenter", SourceKind.VIRTUALIZATION,
                List.of(vm("VDA-A", "esx-from-vcenter", null)));
        SourceSnapshot telemetry = SourceSnapshot.of("telemetry", SourceKind.TELEMETRY,
                List.of(vm("VDA-A", "esx-from-telemetry", 8)));

        ReconciliationResult result = reconciler.reconcile(abcPrimary(), List.of(telemetry, vcenter), PVS_ONLY);

        VirtualizationGroup merged = result.get(DeviceIdentity.of("VDA-A", null)).getVirtualization();
        assertEquals("esx-from-vcenter", merged.getHost());
        assertEquals(8, merged.getCpuCount(), "weaker source fills gaps");
        assertEquals(List.of("pvs", "vcenter", "telemetry"),
                result.get(DeviceIdentity.of("VDA-A", null)).getContributingSources());
    }

    @Test
    void configuredOrderDecidesBetweenSourcesOfSameKind() {
        SourceSnapshot first = broker("broker-1", brokered("VDA-A", "Catalog-One", "PVS"));
        SourceSnapshot second = broker("broker-2", brokered("VDA-A", "Catalog-Two", "PVS"));

        ReconciliationResult result = reconciler.reconcile(abcPrimary(), List.of(first, second), PVS_ONLY);
        assertEquals("Catalog-One", result.get(DeviceIdentity.of("VDA-A", null)).getOrchestration().getCatalogName());

        ReconciliationResult swapped = reconciler.reconcile(abcPrimary(), List.of(second, first), PVS_ONLY);
        assertEquals("Catalog-Two", swapped.get(DeviceIdentity.of("VDA-A", null)).getOrchestration().getCatalogName());
    }

    @Test
    void reconcilingTheSameSnapshotsTwiceGivesEqualResults() throws Exception {
        List<SourceSnapshot> secondaries = List.of(
                abcdBroker(),
                SourceSnapshot.of("vcenter", SourceKind.VIRTUALIZATION, List.of(vm("VDA-B_x", "esx01", 2))),
                SourceSnapshot.of("ad", SourceKind.DIRECTORY, List.of(directory("vda-d.corp.local", "orphan desk"))),
                SourceSnapshot.of("telemetry", SourceKind.TELEMETRY, List.of(
                        PartialRecord.builder(DeviceIdentity.of("VDA-C", null)).telemetry(TelemetryGroup.timedOut()).build())));

        ReconciliationResult first = reconciler.reconcile(abcPrimary(), secondaries, PVS_ONLY);
        List<SourceSnapshot> reversed = new ArrayList<>(secondaries);
        java.util.Collections.reverse(reversed);
        ReconciliationResult second = reconciler.reconcile(abcPrimary(), reversed, PVS_ONLY);

        assertEquals(first.getRecords(), second.getRecords());
        assertEquals(new ArrayList<>(first.getRecords().values()), new ArrayList<>(second.getRecords().values()));

        ObjectMapper mapper = new ObjectMapper().findAndRegisterModules();
        assertEquals(mapper.writeValueAsString(first.getRecords().values()),
                mapper.writeValueAsString(second.getRecords().values()));
    }

    @Test
    void orphanIsEnrichedByLaterSources() {
        SourceSnapshot ad = SourceSnapshot.of("ad", SourceKind.DIRECTORY, List.of(directory("VDA-D", "orphan desk")));

        ReconciliationResult result = reconciler.reconcile(abcPrimary(), List.of(ad, abcdBroker()), PVS_ONLY);

        DeviceRecord orphan = result.get(DeviceIdentity.of("VDA-D", null));
        assertTrue(orphan.isOrphan());
        assertEquals("orphan desk", orphan.getDirectory().getDescription());
        assertEquals(List.of("broker", "ad"), orphan.getContributingSources());
    }

    @Test
    void netbiosAndFqdnNamesMergeIntoOneRecord() {
        SourceSnapshot primary = pvs(provisioned("CORP\\SRV01", "GOLD"));
        SourceSnapshot ad = SourceSnapshot.of("ad", SourceKind.DIRECTORY, List.of(directory("srv01.corp.local", "file server")));

        ReconciliationResult result = reconciler.reconcile(primary, List.of(ad), PVS_ONLY);

        assertEquals(1, result.getRecords().size());
        DeviceRecord record = result.getRecords().values().iterator().next();
        assertEquals("CORP", record.getDomain());
        assertEquals("GOLD", record.getProvisioning().getDiskName());
        assertEquals("file server", record.getDirectory().getDescription());
    }

    @Test
    void duplicateWithinSourceKeepsFirstEntry() {
        SourceSnapshot dupes = broker("broker",
                brokered("VDA-A", "First", "PVS"),
                brokered("vda-a", "Second", "PVS"));

        ReconciliationResult result = reconciler.reconcile(abcPrimary(), List.of(dupes), PVS_ONLY);

        assertEquals(3, result.getRecords().size());
        assertEquals("First", result.get(DeviceIdentity.of("VDA-A", null)).getOrchestration().getCatalogName());
        List<InventoryWarning> warnings = result.getWarnings();
        assertEquals(1, warnings.size());
        assertEquals(InventoryWarning.Type.DUPLICATE_IDENTITY, warnings.get(0).getType());
        assertEquals("broker", warnings.get(0).getSourceName());
    }

    @Test
    void domainDisagreementIsAConflictNotAnOrphan() {
        SourceSnapshot primary = pvs(provisioned("CORP\\SRV01", "GOLD"));
        SourceSnapshot lab = broker("broker", brokered("LAB\\SRV01", "Pool", "PVS"));

        ReconciliationResult result = reconciler.reconcile(primary, List.of(lab), OrphanInclusionPolicy.includeAll());

        assertEquals(1, result.getRecords().size());
        DeviceRecord record = result.getRecords().values().iterator().next();
        assertFalse(record.isOrphan());
        assertNull(record.getOrchestration());
        assertEquals(1, result.getWarnings().size());
        assertEquals(InventoryWarning.Type.MERGE_CONFLICT, result.getWarnings().get(0).getType());
        assertEquals(Map.of("broker", 0), result.getOrphanCounts());
    }

    @Test
    void sameShortNameInTwoDomainsFromOneBrokerGivesTwoOrphans() {
        SourceSnapshot twoDomains = broker("broker",
                brokered("VDA-A", "Pool", "PVS"),
                brokered("CORP\\VDA-D", "Pool", "PVS"),
                brokered("LAB\\VDA-D", "Pool", "PVS"));

        ReconciliationResult result = reconciler.reconcile(abcPrimary(), List.of(twoDomains), PVS_ONLY);

        assertEquals(5, result.getRecords().size());
        assertTrue(result.get(DeviceIdentity.of("VDA-D", "CORP")).isOrphan());
        assertTrue(result.get(DeviceIdentity.of("VDA-D", "LAB")).isOrphan());
        assertEquals(Map.of("broker", 2), result.getOrphanCounts());
        assertTrue(result.getWarnings().isEmpty());
    }

    @Test
    void bareNameAdoptsDomainResolvedByPrimary() {
        SourceSnapshot primary = pvs(provisioned("SRV01", "GOLD"));
        SourceSnapshot corp = broker("broker-corp", brokered("CORP\\SRV01", "Pool", "PVS"));
        SourceSnapshot lab = broker("broker-lab", brokered("LAB\\SRV01", "Other", "PVS"));

        ReconciliationResult result = reconciler.reconcile(primary, List.of(corp, lab), PVS_ONLY);

        DeviceRecord record = result.getRecords().values().iterator().next();
        assertEquals("CORP", record.getDomain());
        assertEquals("Pool", record.getOrchestration().getCatalogName());
        assertEquals(1, result.getWarnings().size());
        assertEquals(InventoryWarning.Type.MERGE_CONFLICT, result.getWarnings().get(0).getType());
    }

    @Test
    void recordsAreOrderedByShortName() {
        SourceSnapshot primary = pvs(provisioned("ZULU", "G"), provisioned("ALPHA", "G"), provisioned("MIKE", "G"));

        ReconciliationResult result = reconciler.reconcile(primary, List.of(), PVS_ONLY);

        List<String> names = new ArrayList<>();
        result.getRecords().keySet().forEach(identity -> names.add(identity.getShortName()));
        assertEquals(List.of("ALPHA", "MIKE", "ZULU"), names);
    }
}
