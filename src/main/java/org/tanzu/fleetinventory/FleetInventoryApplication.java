package org.tanzu.fleetinventory;

import org.springframework.ai.support.ToolCallbacks;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;
import org.tanzu.fleetinventory.inventory.InventoryTools;

import java.util.List;

/**
 * MCP server that reconciles a VDI fleet inventory across provisioning, broker, vCenter,
 * directory and telemetry sources.
 */
@SpringBootApplication
public class FleetInventoryApplication {

    public static void main(String[] args) {
        SpringApplication.run(FleetInventoryApplication.class, args);
    }

    /**
     * Registers the inventory tools with the MCP server.
     *
     * @param inventoryTools The service carrying the @Tool methods
     * @return Tool callbacks picked up by the Spring AI MCP server auto-configuration
     */
    @Bean
    public List<ToolCallback> registerTools(InventoryTools inventoryTools) {
        return List.of(ToolCallbacks.from(inventoryTools));
    }
}
