package org.tanzu.fleetinventory;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.TestPropertySource;
import org.tanzu.fleetinventory.config.InventoryConfig;
import org.tanzu.fleetinventory.config.VCenterConfig;
import org.tanzu.fleetinventory.inventory.FleetInventoryService;
import org.tanzu.fleetinventory.inventory.InventoryRunException;
import org.tanzu.fleetinventory.inventory.InventoryTools;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.NONE)
@TestPropertySource(properties = {
    "vcenter.host=test-vcenter.example.com",
    "vcenter.port=443",
    "vcenter.username=test-user",
    "vcenter.password=test-password",
    "vcenter.insecure=true",
    "inventory.max-concurrency=7",
    "inventory.per-task-timeout=15s",
    "inventory.broker-admin-addresses=ddc1.example.com,ddc2.example.com"
})
class FleetInventoryApplicationTests {

    @Autowired
    private InventoryConfig inventoryConfig;

    @Autowired
    private VCenterConfig vCenterConfig;

    @Autowired
    private FleetInventoryService inventoryService;

    @Autowired
    private InventoryTools inventoryTools;

    @Test
    void contextLoads() {
        assertNotNull(inventoryService);
        assertNotNull(inventoryTools);
    }

    @Test
    void propertiesAreBound() {
        assertEquals(7, inventoryConfig.getMaxConcurrency());
        assertEquals(Duration.ofSeconds(15), inventoryConfig.getPerTaskTimeout());
        assertEquals(List.of("ddc1.example.com", "ddc2.example.com"), inventoryConfig.getBrokerAdminAddresses());
        assertEquals("test-vcenter.example.com", vCenterConfig.getHost());
        assertTrue(vCenterConfig.isConfigured());
    }

    @Test
    void runWithoutProvisioningSourceFails() {
        assertThrows(InventoryRunException.class, () -> inventoryService.run());
        assertNull(inventoryService.getLatest());
    }

    @Test
    void readToolsRequireACompletedRun() {
        RuntimeException e = assertThrows(RuntimeException.class, () -> inventoryTools.listOrphanDevices());
        assertTrue(e.getMessage().contains("runFleetInventory"));
    }
}
