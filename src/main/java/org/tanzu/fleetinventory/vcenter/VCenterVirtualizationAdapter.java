package org.tanzu.fleetinventory.vcenter;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.AntPathMatcher;
import org.tanzu.fleetinventory.config.VCenterConfig;
import org.tanzu.fleetinventory.model.VirtualizationGroup;
import org.tanzu.fleetinventory.source.SourceUnavailableException;
import org.tanzu.fleetinventory.source.VirtualizationAdapter;
import org.tanzu.fleetinventory.source.VmListing;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Virtualization source backed by vCenter.
 *
 * {@link #listVms(String)} runs once per inventory run: it builds the VM to host map by
 * listing the VMs of every host, then lists all VMs and keeps those whose display name
 * matches the glob. {@link #describeVm(VmListing)} is the per-device detail call that the
 * collector fans out; it adds disk and NIC information to the listing's summary.
 */
@Component
public class VCenterVirtualizationAdapter implements VirtualizationAdapter {

    private static final Logger logger = LoggerFactory.getLogger(VCenterVirtualizationAdapter.class);

    private static final AntPathMatcher NAME_MATCHER = nameMatcher();

    public static final String SOURCE_NAME = "vcenter";

    private final VapiClient vapiClient;
    private final VCenterConfig vCenterConfig;

    public VCenterVirtualizationAdapter(VapiClient vapiClient, VCenterConfig vCenterConfig) {
        this.vapiClient = vapiClient;
        this.vCenterConfig = vCenterConfig;
    }

    @Override
    public String getName() {
        return SOURCE_NAME;
    }

    /**
     * Lists the VMs whose display name matches a glob.
     *
     * @param namePattern Glob with {@code *} and {@code ?}, matched case-insensitively; null means all
     * @return One listing per matching VM, carrying ID, vCPU count, memory, power state and host
     * @throws SourceUnavailableException if vCenter is not configured or cannot be queried
     */
    @Override
    public List<VmListing> listVms(String namePattern) {
        if (!vCenterConfig.isConfigured()) {
            throw new SourceUnavailableException(SOURCE_NAME, "vCenter host is not configured");
        }
        try {
            Map<String, String> hostByVm = buildHostMap();

            List<VmListing> listings = new ArrayList<>();
            int skipped = 0;
            for (JsonNode vm : vapiClient.listVms()) {
                String name = vm.path("name").asText(null);
                String vmId = vm.path("vm").asText(null);
                if (name == null || vmId == null) {
                    logger.warn("Skipping VM summary without name or id: {}", vm);
                    continue;
                }
                if (!matchesGlob(namePattern, name)) {
                    skipped++;
                    continue;
                }
                VirtualizationGroup group = VirtualizationGroup.builder()
                        .vmId(vmId)
                        .cpuCount(vm.has("cpu_count") ? vm.get("cpu_count").asInt() : null)
                        .memoryMiB(vm.has("memory_size_MiB") ? vm.get("memory_size_MiB").asLong() : null)
                        .powerState(vm.path("power_state").asText(null))
                        .host(hostByVm.get(vmId))
                        .build();
                listings.add(new VmListing(name, group));
            }
            logger.info("vCenter listed {} VMs matching '{}' ({} skipped)", listings.size(), namePattern, skipped);
            return listings;
        } catch (RuntimeException e) {
            logger.warn("vCenter listing failed: {}", e.getMessage());
            throw new SourceUnavailableException(SOURCE_NAME, "Failed to list VMs from vCenter: " + e.getMessage(), e);
        }
    }

    /**
     * Fetches disk and NIC detail for a listed VM.
     *
     * @param listing A listing returned by {@link #listVms(String)}
     * @return The listing's group with disk count, total disk capacity and NIC count filled in
     */
    @Override
    public VirtualizationGroup describeVm(VmListing listing) {
        VirtualizationGroup summary = listing.getGroup();
        JsonNode vm = vapiClient.getVm(summary.getVmId());

        List<JsonNode> disks = entries(vm.path("disks"));
        long capacity = 0;
        for (JsonNode disk : disks) {
            capacity += disk.path("capacity").asLong(0);
        }
        int nics = entries(vm.path("nics")).size();

        VirtualizationGroup.Builder builder = summary.toBuilder()
                .diskCount(disks.size())
                .diskCapacityBytes(capacity)
                .nicCount(nics);
        if (summary.getCpuCount() == null && vm.path("cpu").has("count")) {
            builder.cpuCount(vm.path("cpu").get("count").asInt());
        }
        if (summary.getMemoryMiB() == null && vm.path("memory").has("size_MiB")) {
            builder.memoryMiB(vm.path("memory").get("size_MiB").asLong());
        }
        logger.debug("Described VM {}: {} disks, {} NICs", listing.getName(), disks.size(), nics);
        return builder.build();
    }

    private Map<String, String> buildHostMap() {
        Map<String, String> hostByVm = new HashMap<>();
        for (JsonNode host : vapiClient.listHosts()) {
            String hostId = host.path("host").asText(null);
            if (hostId == null) {
                continue;
            }
            String hostName = host.path("name").asText(hostId);
            for (JsonNode vm : vapiClient.listVmsOnHost(hostId)) {
                hostByVm.put(vm.path("vm").asText(), hostName);
            }
        }
        logger.debug("Mapped {} VMs to hosts", hostByVm.size());
        return Collections.unmodifiableMap(hostByVm);
    }

    /**
     * The /api endpoints return disks and NICs as an object keyed by device key; older
     * /rest endpoints return an array of {key, value} pairs.
     */
    private static List<JsonNode> entries(JsonNode node) {
        List<JsonNode> result = new ArrayList<>();
        if (node.isArray()) {
            node.forEach(item -> result.add(item.has("value") ? item.get("value") : item));
        } else if (node.isObject()) {
            node.elements().forEachRemaining(result::add);
        }
        return result;
    }

    /**
     * Matches a VM name against a {@code *}/{@code ?} glob, ignoring case. A null or empty glob
     * matches every name.
     */
    static boolean matchesGlob(String glob, String name) {
        return glob == null || glob.isEmpty() || NAME_MATCHER.match(glob, name);
    }

    private static AntPathMatcher nameMatcher() {
        // VM names are flat; a newline never occurs in them, so nothing splits a name into segments.
        AntPathMatcher matcher = new AntPathMatcher("\n");
        matcher.setCaseSensitive(false);
        matcher.setTrimTokens(false);
        return matcher;
    }
}
