package org.tanzu.fleetinventory.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Connection settings of the vCenter server that backs the virtualization source.
 *
 * Bound from the "vcenter" prefix (application.properties, environment variables such as
 * VCENTER_HOST). Missing credentials are filled from a bound Cloud Foundry service by
 * {@link ServiceBindingProcessor}. When no host is configured at all the virtualization
 * source is reported unavailable for the run instead of failing startup.
 */
@Component
@ConfigurationProperties(prefix = "vcenter")
public class VCenterConfig {

    /** vCenter server hostname or IP address */
    private String host;

    /** vCenter server port (default: 443 for HTTPS) */
    private int port = 443;

    /** Username for vCenter authentication */
    private String username;

    /** Password for vCenter authentication */
    private String password;

    /** Whether to skip SSL certificate validation */
    private boolean insecure = true;

    /** TCP connect timeout towards vCenter */
    private Duration connectTimeout = Duration.ofSeconds(10);

    /** Time allowed for a single vAPI response */
    private Duration responseTimeout = Duration.ofSeconds(30);

    public String getHost() { return host; }
    public void setHost(String host) { this.host = host; }

    public int getPort() { return port; }
    public void setPort(int port) { this.port = port; }

    public String getUsername() { return username; }
    public void setUsername(String username) { this.username = username; }

    public String getPassword() { return password; }
    public void setPassword(String password) { this.password = password; }

    public boolean isInsecure() { return insecure; }
    public void setInsecure(boolean insecure) { this.insecure = insecure; }

    /**
     * Sets the insecure flag from a string value, as environment variables are always strings.
     * @param insecure "true" or "false"
     */
    public void setInsecure(String insecure) {
        this.insecure = Boolean.parseBoolean(insecure);
    }

    public Duration getConnectTimeout() { return connectTimeout; }
    public void setConnectTimeout(Duration connectTimeout) { this.connectTimeout = connectTimeout; }

    public Duration getResponseTimeout() { return responseTimeout; }
    public void setResponseTimeout(Duration responseTimeout) { this.responseTimeout = responseTimeout; }

    /**
     * Checks whether a host is configured, ignoring unresolved placeholders.
     * @return true if vCenter can be contacted at all
     */
    public boolean isConfigured() {
        return isSet(host);
    }

    static boolean isSet(String value) {
        return value != null && !value.trim().isEmpty() && !value.contains("${");
    }

    /**
     * The password is hidden so the configuration can be logged.
     */
    @Override
    public String toString() {
        return "VCenterConfig{" +
                "host='" + host + '\'' +
                ", port=" + port +
                ", username='" + username + '\'' +
                ", password='[HIDDEN]'" +
                ", insecure=" + insecure +
                ", connectTimeout=" + connectTimeout +
                ", responseTimeout=" + responseTimeout +
                '}';
    }
}
