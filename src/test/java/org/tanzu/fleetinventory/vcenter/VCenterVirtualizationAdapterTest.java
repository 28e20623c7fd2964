package org.tanzu.fleetinventory.vcenter;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.tanzu.fleetinventory.config.VCenterConfig;
import org.tanzu.fleetinventory.model.VirtualizationGroup;
import org.tanzu.fleetinventory.source.SourceUnavailableException;
import org.tanzu.fleetinventory.source.VmListing;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.*;

class VCenterVirtualizationAdapterTest {

    private static final String HOSTS = "[{\"host\":\"host-1\",\"name\":\"esx01.lab.local\",\"connection_state\":\"CONNECTED\"}]";
    private static final String VMS_ON_HOST = "[{\"vm\":\"vm-1\",\"name\":\"VDA01_pool\"}]";
    private static final String ALL_VMS = "["
            + "{\"vm\":\"vm-1\",\"name\":\"VDA01_pool\",\"power_state\":\"POWERED_ON\",\"cpu_count\":2,\"memory_size_MiB\":4096},"
            + "{\"vm\":\"vm-2\",\"name\":\"SQL01\",\"power_state\":\"POWERED_OFF\",\"cpu_count\":4,\"memory_size_MiB\":8192}"
            + "]";
    private static final String VM_DETAIL = "{\"name\":\"VDA01_pool\",\"cpu\":{\"count\":2},\"memory\":{\"size_MiB\":4096},"
            + "\"disks\":{\"2000\":{\"capacity\":42949672960},\"2001\":{\"capacity\":10737418240}},"
            + "\"nics\":{\"4000\":{\"mac_address\":\"00:50:56:aa:bb:cc\"}}}";

    private final List<ClientRequest> requests = new CopyOnWriteArrayList<>();
    private VCenterConfig config;

    @BeforeEach
    void setUp() {
        config = new VCenterConfig();
        config.setHost("vcenter.lab.local");
        config.setUsername("inventory@vsphere.local");
        config.setPassword("secret");
    }

    private static Mono<ClientResponse> json(HttpStatus status, String body) {
        return Mono.just(ClientResponse.create(status)
                .header("Content-Type", "application/json")
                .body(body)
                .build());
    }

    private VCenterVirtualizationAdapter adapter(Function<ClientRequest, Mono<ClientResponse>> api) {
        WebClient.Builder builder = WebClient.builder().exchangeFunction(request -> {
            requests.add(request);
            if ("/api/session".equals(request.url().getPath())) {
                return json(HttpStatus.CREATED, "\"token-1\"");
            }
            return api.apply(request);
        });
        return new VCenterVirtualizationAdapter(new VapiClient(config, builder), config);
    }

    private static Mono<ClientResponse> inventory(ClientRequest request) {
        String path = request.url().getPath();
        String query = request.url().getQuery();
        if ("/api/vcenter/host".equals(path)) {
            return json(HttpStatus.OK, HOSTS);
        }
        if ("/api/vcenter/vm".equals(path)) {
            return json(HttpStatus.OK, query != null && query.contains("hosts=host-1") ? VMS_ON_HOST : ALL_VMS);
        }
        if ("/api/vcenter/vm/vm-1".equals(path)) {
            return json(HttpStatus.OK, VM_DETAIL);
        }
        return json(HttpStatus.NOT_FOUND, "{\"error_type\":\"NOT_FOUND\"}");
    }

    @Test
    void listsMatchingVmsWithTheirHost() {
        List<VmListing> listings = adapter(VCenterVirtualizationAdapterTest::inventory).listVms("vda*");

        assertEquals(1, listings.size());
        VmListing listing = listings.get(0);
        assertEquals("VDA01_pool", listing.getName());
        VirtualizationGroup group = listing.getGroup();
        assertEquals("vm-1", group.getVmId());
        assertEquals("esx01.lab.local", group.getHost());
        assertEquals(Integer.valueOf(2), group.getCpuCount());
        assertEquals(Long.valueOf(4096), group.getMemoryMiB());
        assertEquals("POWERED_ON", group.getPowerState());
    }

    @Test
    void describeAddsDisksAndNics() {
        VCenterVirtualizationAdapter adapter = adapter(VCenterVirtualizationAdapterTest::inventory);
        VmListing listing = adapter.listVms("*").get(0);

        VirtualizationGroup described = adapter.describeVm(listing);

        assertEquals(Integer.valueOf(2), described.getDiskCount());
        assertEquals(Long.valueOf(53687091200L), described.getDiskCapacityBytes());
        assertEquals(Integer.valueOf(1), described.getNicCount());
        assertEquals("esx01.lab.local", described.getHost());
    }

    @Test
    void sendsSessionTokenOnEveryCall() {
        adapter(VCenterVirtualizationAdapterTest::inventory).listVms("*");

        long sessions = requests.stream().filter(r -> "/api/session".equals(r.url().getPath())).count();
        assertEquals(1, sessions);
        requests.stream()
                .filter(r -> !"/api/session".equals(r.url().getPath()))
                .forEach(r -> assertEquals("token-1", r.headers().getFirst(VapiClient.SESSION_HEADER)));
    }

    @Test
    void reauthenticatesOnceAfterUnauthorized() {
        AtomicInteger detailCalls = new AtomicInteger();
        VCenterVirtualizationAdapter adapter = adapter(request -> {
            if ("/api/vcenter/vm/vm-1".equals(request.url().getPath()) && detailCalls.getAndIncrement() == 0) {
                return json(HttpStatus.UNAUTHORIZED, "{\"error_type\":\"UNAUTHENTICATED\"}");
            }
            return inventory(request);
        });
        VmListing listing = new VmListing("VDA01_pool", VirtualizationGroup.builder().vmId("vm-1").build());

        VirtualizationGroup described = adapter.describeVm(listing);

        assertEquals(Integer.valueOf(2), described.getDiskCount());
        assertEquals(Integer.valueOf(2), described.getCpuCount());
        assertEquals(2, requests.stream().filter(r -> "/api/session".equals(r.url().getPath())).count());
    }

    @Test
    void unconfiguredHostMakesSourceUnavailable() {
        config.setHost(null);
        VCenterVirtualizationAdapter adapter = adapter(VCenterVirtualizationAdapterTest::inventory);

        SourceUnavailableException e = assertThrows(SourceUnavailableException.class, () -> adapter.listVms("*"));
        assertEquals(VCenterVirtualizationAdapter.SOURCE_NAME, e.getSourceName());
        assertTrue(requests.isEmpty());
    }

    @Test
    void serverErrorMakesSourceUnavailable() {
        VCenterVirtualizationAdapter adapter = adapter(request ->
                json(HttpStatus.INTERNAL_SERVER_ERROR, "{\"error_type\":\"ERROR\"}"));

        assertThrows(SourceUnavailableException.class, () -> adapter.listVms("*"));
    }

    @Test
    void globMatchesCaseInsensitively() {
        assertTrue(VCenterVirtualizationAdapter.matchesGlob("vda??_*", "VDA01_pool"));
        assertFalse(VCenterVirtualizationAdapter.matchesGlob("vda??_*", "VDA1_pool"));
        assertTrue(VCenterVirtualizationAdapter.matchesGlob("web.(prod)*", "WEB.(PROD)01"));
        assertTrue(VCenterVirtualizationAdapter.matchesGlob("*", "Tenant/VDA05"));
        assertTrue(VCenterVirtualizationAdapter.matchesGlob(null, "anything"));
    }
}
