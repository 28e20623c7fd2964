package org.tanzu.fleetinventory.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Fills configuration gaps from Cloud Foundry service bindings.
 *
 * Reads VCAP_SERVICES once the properties are bound and looks for two kinds of bound
 * service by name:
 * - a service whose name contains "vcenter" supplies host, username, password, port and
 *   the insecure flag for {@link VCenterConfig};
 * - a service whose name contains "inventory" supplies run tuning for {@link InventoryConfig}
 *   (max-concurrency, per-task-timeout, orphan-provisioning-types, broker-admin-addresses).
 *
 * Values that are already set (from properties or environment variables) are kept; only
 * missing or placeholder values are replaced.
 */
@Component
public class ServiceBindingProcessor {

    private static final Logger logger = LoggerFactory.getLogger(ServiceBindingProcessor.class);

    private final VCenterConfig vCenterConfig;
    private final InventoryConfig inventoryConfig;
    private final Environment environment;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public ServiceBindingProcessor(VCenterConfig vCenterConfig, InventoryConfig inventoryConfig,
                                   Environment environment) {
        this.vCenterConfig = vCenterConfig;
        this.inventoryConfig = inventoryConfig;
        this.environment = environment;
    }

    /**
     * Applies service binding credentials, if any are present.
     */
    @PostConstruct
    public void processServiceBindings() {
        String vcapServices = environment.getProperty("VCAP_SERVICES");
        if (vcapServices == null || vcapServices.trim().isEmpty()) {
            logger.debug("VCAP_SERVICES not available, using bound properties only");
            logger.info("vCenter configuration: {}", vCenterConfig);
            logger.info("Inventory configuration: {}", inventoryConfig);
            return;
        }

        try {
            JsonNode services = objectMapper.readTree(vcapServices);

            JsonNode vcenter = findCredentials(services, "vcenter");
            if (vcenter != null && !isVCenterComplete()) {
                applyVCenter(vcenter);
            } else if (vcenter == null && !isVCenterComplete()) {
                logger.warn("vCenter configuration incomplete and no vCenter service bound");
            }

            JsonNode inventory = findCredentials(services, "inventory");
            if (inventory != null) {
                applyInventory(inventory);
            }
        } catch (Exception e) {
            logger.error("Error processing VCAP_SERVICES: {}", e.getMessage(), e);
        }

        logger.info("vCenter configuration: {}", vCenterConfig);
        logger.info("Inventory configuration: {}", inventoryConfig);
    }

    private boolean isVCenterComplete() {
        return VCenterConfig.isSet(vCenterConfig.getHost())
                && VCenterConfig.isSet(vCenterConfig.getUsername())
                && VCenterConfig.isSet(vCenterConfig.getPassword());
    }

    private JsonNode findCredentials(JsonNode services, String nameFragment) {
        for (JsonNode serviceType : services) {
            for (JsonNode service : serviceType) {
                String name = service.path("name").asText();
                if (name.toLowerCase(Locale.ROOT).contains(nameFragment)) {
                    logger.info("Found bound service '{}' for {}", name, nameFragment);
                    return service.path("credentials");
                }
            }
        }
        return null;
    }

    private void applyVCenter(JsonNode credentials) {
        if (!VCenterConfig.isSet(vCenterConfig.getHost()) && credentials.hasNonNull("host")) {
            vCenterConfig.setHost(credentials.get("host").asText());
            logger.info("Set vCenter host from service binding: {}", vCenterConfig.getHost());
        }
        if (!VCenterConfig.isSet(vCenterConfig.getUsername()) && credentials.hasNonNull("username")) {
            vCenterConfig.setUsername(credentials.get("username").asText());
            logger.info("Set vCenter username from service binding: {}", vCenterConfig.getUsername());
        }
        if (!VCenterConfig.isSet(vCenterConfig.getPassword()) && credentials.hasNonNull("password")) {
            vCenterConfig.setPassword(credentials.get("password").asText());
            logger.info("Set vCenter password from service binding: ***");
        }
        if (vCenterConfig.getPort() == 443 && credentials.has("port")) {
            vCenterConfig.setPort(credentials.path("port").asInt(443));
        }
        if (credentials.has("insecure")) {
            vCenterConfig.setInsecure(credentials.path("insecure").asBoolean(true));
        }
    }

    private void applyInventory(JsonNode credentials) {
        if (credentials.has("max-concurrency")) {
            inventoryConfig.setMaxConcurrency(credentials.get("max-concurrency").asText());
        }
        if (credentials.has("per-task-timeout")) {
            inventoryConfig.setPerTaskTimeout(Duration.ofSeconds(credentials.get("per-task-timeout").asLong()));
        }
        if (credentials.has("orphan-provisioning-types")) {
            inventoryConfig.setOrphanProvisioningTypes(textList(credentials.get("orphan-provisioning-types")));
        }
        if (inventoryConfig.getBrokerAdminAddresses().isEmpty() && credentials.has("broker-admin-addresses")) {
            inventoryConfig.setBrokerAdminAddresses(textList(credentials.get("broker-admin-addresses")));
        }
        logger.info("Applied inventory tuning from service binding");
    }

    /**
     * Accepts either a JSON array or a comma separated string.
     */
    private static List<String> textList(JsonNode node) {
        List<String> values = new ArrayList<>();
        if (node.isArray()) {
            node.forEach(item -> values.add(item.asText().trim()));
        } else {
            for (String part : node.asText().split(",")) {
                if (!part.trim().isEmpty()) {
                    values.add(part.trim());
                }
            }
        }
        return values;
    }
}
