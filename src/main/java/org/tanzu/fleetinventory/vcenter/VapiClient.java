package org.tanzu.fleetinventory.vcenter;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.DependsOn;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import org.tanzu.fleetinventory.config.VCenterConfig;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Read-only client for the vCenter REST (vAPI) endpoints the virtualization source needs.
 *
 * Handles session authentication (vmware-api-session-id) and re-authenticates once when a
 * call is rejected with 401. All calls are blocking; callers run them on collector worker
 * threads or during the single-threaded listing phase of a run.
 *
 * Endpoints used:
 * - GET /api/vcenter/host: hosts, used to build the VM to host map
 * - GET /api/vcenter/vm: VM summaries, optionally filtered by host
 * - GET /api/vcenter/vm/{vm}: VM detail with disks and NICs
 *
 * Created after service bindings are applied, since the base URL is fixed at construction.
 */
@Component
@DependsOn("serviceBindingProcessor")
public class VapiClient {

    private static final Logger logger = LoggerFactory.getLogger(VapiClient.class);

    static final String SESSION_HEADER = "vmware-api-session-id";

    private final VCenterConfig vCenterConfig;
    private final WebClient webClient;
    private final ObjectMapper objectMapper = new ObjectMapper();

    /** Cached session token; null until the first call authenticates */
    private final AtomicReference<String> sessionToken = new AtomicReference<>();

    /**
     * @param vCenterConfig Connection settings
     * @param webClientBuilder Builder with SSL and timeout settings applied
     */
    public VapiClient(VCenterConfig vCenterConfig,
                      @Qualifier("vCenterWebClientBuilder") WebClient.Builder webClientBuilder) {
        this.vCenterConfig = vCenterConfig;
        WebClient.Builder builder = webClientBuilder.clone();
        if (vCenterConfig.isConfigured()) {
            String baseUrl = "https://" + vCenterConfig.getHost() + ":" + vCenterConfig.getPort();
            logger.info("Initializing VapiClient for vCenter {} (insecure={})", baseUrl, vCenterConfig.isInsecure());
            builder.baseUrl(baseUrl);
        } else {
            logger.warn("vCenter host not configured; the virtualization source will report unavailable");
        }
        this.webClient = builder.build();
    }

    /**
     * Lists the ESXi hosts.
     * @return JSON array of host summaries ({@code host}, {@code name}, ...)
     */
    public JsonNode listHosts() {
        return get("/api/vcenter/host");
    }

    /**
     * Lists every VM visible to the session.
     * @return JSON array of VM summaries ({@code vm}, {@code name}, {@code power_state}, {@code cpu_count}, {@code memory_size_MiB})
     */
    public JsonNode listVms() {
        return get("/api/vcenter/vm");
    }

    /**
     * Lists the VMs registered on one host.
     * @param hostId The host identifier, e.g. {@code host-42}
     * @return JSON array of VM summaries
     */
    public JsonNode listVmsOnHost(String hostId) {
        return get("/api/vcenter/vm?hosts=" + hostId);
    }

    /**
     * Gets the full VM configuration.
     * @param vmId The VM identifier, e.g. {@code vm-1001}
     * @return JSON object with {@code cpu}, {@code memory}, {@code disks} and {@code nics}
     */
    public JsonNode getVm(String vmId) {
        return get("/api/vcenter/vm/" + vmId);
    }

    private JsonNode get(String endpoint) {
        try {
            return readBody(endpoint, execute(endpoint, currentSession()));
        } catch (WebClientResponseException.Unauthorized e) {
            logger.warn("vAPI call {} rejected with 401, re-authenticating once", endpoint);
            sessionToken.set(null);
            try {
                return readBody(endpoint, execute(endpoint, currentSession()));
            } catch (Exception retry) {
                throw new RuntimeException("vAPI call " + endpoint + " failed after re-authentication: " + retry.getMessage(), retry);
            }
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new RuntimeException("vAPI call " + endpoint + " failed: " + e.getMessage(), e);
        }
    }

    private String execute(String endpoint, String session) {
        logger.debug("vAPI GET {}", endpoint);
        return webClient.get()
                .uri(endpoint)
                .header(SESSION_HEADER, session)
                .retrieve()
                .bodyToMono(String.class)
                .block();
    }

    private JsonNode readBody(String endpoint, String body) throws Exception {
        if (body == null || body.trim().isEmpty()) {
            logger.warn("Empty response from vAPI endpoint {}", endpoint);
            return objectMapper.createArrayNode();
        }
        JsonNode node = objectMapper.readTree(body);
        if (node.has("error_type") || node.has("error")) {
            String message = node.path("messages").path(0).path("default_message")
                    .asText(node.path("error").path("message").asText("Unknown vAPI error"));
            throw new RuntimeException("vAPI error from " + endpoint + ": " + message);
        }
        return node.has("value") ? node.get("value") : node;
    }

    private String currentSession() {
        String token = sessionToken.get();
        if (token == null) {
            token = createSession();
            sessionToken.set(token);
        }
        return token;
    }

    /**
     * Creates a session, first with a JSON credentials body, then with Basic authentication
     * for vCenters that reject the former.
     *
     * @return The session token
     * @throws RuntimeException if both methods fail
     */
    private String createSession() {
        try {
            ObjectNode request = objectMapper.createObjectNode();
            request.put("username", vCenterConfig.getUsername());
            request.put("password", vCenterConfig.getPassword());
            String response = webClient.post()
                    .uri("/api/session")
                    .bodyValue(objectMapper.writeValueAsString(request))
                    .retrieve()
                    .bodyToMono(String.class)
                    .block();
            logger.info("Obtained vAPI session token");
            return parseToken(response);
        } catch (Exception e) {
            logger.warn("Session request with JSON body failed: {}", e.getMessage());
        }

        try {
            String credentials = vCenterConfig.getUsername() + ":" + vCenterConfig.getPassword();
            String encoded = Base64.getEncoder().encodeToString(credentials.getBytes(StandardCharsets.UTF_8));
            String response = webClient.post()
                    .uri("/api/session")
                    .header("Authorization", "Basic " + encoded)
                    .retrieve()
                    .bodyToMono(String.class)
                    .block();
            logger.info("Obtained vAPI session token via Basic authentication");
            return parseToken(response);
        } catch (Exception e) {
            logger.error("All vCenter authentication methods failed: {}", e.getMessage());
            throw new RuntimeException("Failed to authenticate with vCenter vAPI: " + e.getMessage(), e);
        }
    }

    /**
     * The session endpoint answers either {@code {"value":"token"}} or a bare JSON string.
     */
    private String parseToken(String response) throws Exception {
        if (response == null || response.trim().isEmpty()) {
            throw new IllegalStateException("Empty session response");
        }
        String trimmed = response.trim();
        if (trimmed.startsWith("{")) {
            return objectMapper.readTree(trimmed).get("value").asText();
        }
        return trimmed.replaceAll("^\"|\"$", "");
    }
}
