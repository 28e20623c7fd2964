package org.tanzu.fleetinventory.config;

import io.netty.channel.ChannelOption;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;
import io.netty.handler.ssl.util.InsecureTrustManagerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import javax.net.ssl.SSLException;

/**
 * WebClient used for vCenter vAPI calls.
 *
 * Applies the connect and response timeouts from {@link VCenterConfig} so a hung vCenter
 * call fails on its own instead of only being abandoned by the collector deadline.
 * With insecure=true the client trusts every certificate (self-signed lab vCenters).
 */
@Configuration
public class WebClientConfig {

    private static final Logger logger = LoggerFactory.getLogger(WebClientConfig.class);

    /**
     * Creates the WebClient.Builder for vCenter communication.
     *
     * @param vCenterConfig The vCenter configuration containing SSL and timeout settings
     * @return Builder with JSON headers and a configured Reactor Netty connector
     * @throws RuntimeException if the SSL context cannot be built
     */
    @Bean
    public WebClient.Builder vCenterWebClientBuilder(VCenterConfig vCenterConfig) {
        logger.info("Configuring WebClient.Builder for vCenter {}:{} (insecure={}, connectTimeout={}, responseTimeout={})",
                vCenterConfig.getHost(), vCenterConfig.getPort(), vCenterConfig.isInsecure(),
                vCenterConfig.getConnectTimeout(), vCenterConfig.getResponseTimeout());

        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) vCenterConfig.getConnectTimeout().toMillis())
                .responseTimeout(vCenterConfig.getResponseTimeout());

        if (vCenterConfig.isInsecure()) {
            try {
                logger.warn("SSL validation is DISABLED for the vCenter connection (insecure=true)");
                SslContext sslContext = SslContextBuilder.forClient()
                        .trustManager(InsecureTrustManagerFactory.INSTANCE)
                        .build();
                httpClient = httpClient.secure(spec -> spec.sslContext(sslContext));
            } catch (SSLException e) {
                logger.error("Failed to configure insecure SSL context: {}", e.getMessage(), e);
                throw new RuntimeException("Failed to configure insecure SSL context", e);
            }
        }

        return WebClient.builder()
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .defaultHeader("Content-Type", "application/json")
                .defaultHeader("Accept", "application/json");
    }
}
