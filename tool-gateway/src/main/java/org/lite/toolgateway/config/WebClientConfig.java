package org.lite.toolgateway.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import io.netty.handler.timeout.WriteTimeoutHandler;
import lombok.extern.slf4j.Slf4j;
import org.lite.toolgateway.validation.GuardedAddressResolverGroup;
import org.lite.toolgateway.validation.HostResolver;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.http.codec.json.Jackson2JsonDecoder;
import org.springframework.http.codec.json.Jackson2JsonEncoder;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;
import reactor.netty.resources.ConnectionProvider;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Outbound client used by connectors. Every call is bounded by the connector
 * timeout, TLS uses the JVM trust store, redirects are never followed and the
 * resolved address of every connection must lie outside the restricted ranges.
 */
@Configuration
@Slf4j
public class WebClientConfig {

    @Bean
    public WebClient.Builder connectorWebClientBuilder(ToolGatewayProperties properties) {
        ToolGatewayProperties.Connector connector = properties.getConnector();
        long timeoutMillis = connector.getTimeout().toMillis();

        ObjectMapper mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule());

        ExchangeStrategies strategies = ExchangeStrategies
                .builder()
                .codecs(clientCodecConfigurer -> {
                    clientCodecConfigurer.defaultCodecs().jackson2JsonDecoder(
                            new Jackson2JsonDecoder(mapper, MediaType.APPLICATION_JSON));
                    clientCodecConfigurer.defaultCodecs().jackson2JsonEncoder(
                            new Jackson2JsonEncoder(mapper, MediaType.APPLICATION_JSON));
                    clientCodecConfigurer.defaultCodecs().maxInMemorySize(connector.getMaxResponseBytes());
                })
                .build();

        ConnectionProvider provider = ConnectionProvider
                .builder("tool-connectors")
                .maxConnections(50)
                .maxIdleTime(Duration.ofSeconds(20))
                .maxLifeTime(Duration.ofSeconds(60))
                .pendingAcquireTimeout(Duration.ofSeconds(5))
                .evictInBackground(Duration.ofSeconds(30))
                .build();

        HttpClient httpClient = HttpClient.create(provider)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) connector.getConnectTimeout().toMillis())
                .responseTimeout(connector.getTimeout())
                .followRedirect(false)
                // Connect-time address check
                .resolver(new GuardedAddressResolverGroup(HostResolver.system()))
                .doOnConnected(conn -> conn
                        .addHandlerLast(new ReadTimeoutHandler(timeoutMillis, TimeUnit.MILLISECONDS))
                        .addHandlerLast(new WriteTimeoutHandler(timeoutMillis, TimeUnit.MILLISECONDS)))
                .option(ChannelOption.SO_KEEPALIVE, true)
                .option(ChannelOption.TCP_NODELAY, true);

        log.info("Connector WebClient configured: timeout={}, maxResponseBytes={}",
                connector.getTimeout(), connector.getMaxResponseBytes());

        return WebClient.builder()
                .exchangeStrategies(strategies)
                .clientConnector(new ReactorClientHttpConnector(httpClient));
    }
}
