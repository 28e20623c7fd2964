package org.tanzu.fleetinventory.inventory;

import org.junit.jupiter.api.Test;
import org.tanzu.fleetinventory.model.ProvisioningGroup;
import org.tanzu.fleetinventory.source.DiskVersion;
import org.tanzu.fleetinventory.source.StoreInfo;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ProvisioningReferenceDataTest {

    private final ProvisioningReferenceData reference = ProvisioningReferenceData.from(
            List.of(new DiskVersion("Win10-Gold", 7, "Production"),
                    new DiskVersion("Win10-Gold", 9, "Test"),
                    new DiskVersion("win10-gold", 8, "production"),
                    new DiskVersion("Server-2019", 1, "Maintenance")),
            List.of(new StoreInfo("Store1", "E:\\Store1"), new StoreInfo("STORE1", "F:\\ignored")));

    @Test
    void latestProductionVersionIgnoresOtherAccessModes() {
        assertEquals(Integer.valueOf(8), reference.latestProductionVersion("WIN10-GOLD"));
        assertNull(reference.latestProductionVersion("Server-2019"));
        assertNull(reference.latestProductionVersion(null));
    }

    @Test
    void firstStoreEntryWins() {
        assertEquals("E:\\Store1", reference.storePath("store1"));
    }

    @Test
    void completeFillsOnlyMissingFields() {
        ProvisioningGroup device = ProvisioningGroup.builder()
                .diskName("Win10-Gold").storeName("Store1").bootedVersion(7).build();
        ProvisioningGroup completed = reference.complete(device);

        assertEquals(Integer.valueOf(8), completed.getLatestProductionVersion());
        assertEquals("E:\\Store1", completed.getStorePath());
        assertEquals(Boolean.FALSE, completed.getRunningLatestVersion());

        ProvisioningGroup explicit = device.toBuilder().storePath("X:\\Local").build();
        assertEquals("X:\\Local", reference.complete(explicit).getStorePath());
        assertNull(reference.complete(null));
    }

    @Test
    void emptyReferenceDataResolvesNothing() {
        ProvisioningGroup device = ProvisioningGroup.builder().diskName("Win10-Gold").bootedVersion(3).build();
        assertNull(ProvisioningReferenceData.empty().complete(device).getRunningLatestVersion());
    }
}
