package com.example.litigationhold.config;

import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import io.netty.handler.timeout.WriteTimeoutHandler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * WebClient configuration for external service calls.
 * <p>
 * Configures separate WebClient instances for the directory and mailbox services
 * with bearer authentication, timeouts and request logging.
 */
@Configuration
@Slf4j
public class WebClientConfig {

    /**
     * Directory pages with 999 users and their licenses exceed the 256KB default
     */
    private static final int MAX_IN_MEMORY_SIZE = 16 * 1024 * 1024;

    /**
     * WebClient for the directory service
     */
    @Bean(name = "directoryServiceWebClient")
    public WebClient directoryServiceWebClient(WebClient.Builder builder, DirectoryServiceProperties properties) {
        return createWebClient(builder, properties.getBaseUrl(), properties.getAccessToken(), properties.getTimeoutSeconds(), "DirectoryService");
    }

    /**
     * WebClient for the mailbox status service
     */
    @Bean(name = "mailboxServiceWebClient")
    public WebClient mailboxServiceWebClient(WebClient.Builder builder, MailboxServiceProperties properties) {
        return createWebClient(builder, properties.getBaseUrl(), properties.getAccessToken(), properties.getTimeoutSeconds(), "MailboxService");
    }

    private WebClient createWebClient(WebClient.Builder builder, String baseUrl, String accessToken, int timeoutSeconds, String serviceName) {
        var httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, timeoutSeconds * 1000)
                .responseTimeout(Duration.ofSeconds(timeoutSeconds))
                .doOnConnected(conn -> conn
                        .addHandlerLast(new ReadTimeoutHandler(timeoutSeconds, TimeUnit.SECONDS))
                        .addHandlerLast(new WriteTimeoutHandler(timeoutSeconds, TimeUnit.SECONDS)));

        var strategies = ExchangeStrategies.builder()
                .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(MAX_IN_MEMORY_SIZE))
                .build();

        var clientBuilder = builder.clone()
                .baseUrl(baseUrl)
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .exchangeStrategies(strategies)
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .defaultHeader("X-Client-Name", "litigation-hold-enforcer")
                .filter(logRequest(serviceName))
                .filter(logResponse(serviceName));

        if (accessToken != null && !accessToken.isBlank()) {
            clientBuilder.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + accessToken);
        } else {
            log.warn("[{}] No access token configured", serviceName);
        }

        return clientBuilder.build();
    }

    /**
     * Log outgoing requests
     */
    private ExchangeFilterFunction logRequest(String serviceName) {
        return ExchangeFilterFunction.ofRequestProcessor(clientRequest -> {
            log.debug("[{}] Request: {} {}", serviceName, clientRequest.method(), clientRequest.url());
            return Mono.just(clientRequest);
        });
    }

    /**
     * Log incoming responses, errors at WARN
     */
    private ExchangeFilterFunction logResponse(String serviceName) {
        return ExchangeFilterFunction.ofResponseProcessor(clientResponse -> {
            if (clientResponse.statusCode().isError()) {
                log.warn("[{}] Error response: {}", serviceName, clientResponse.statusCode());
            } else {
                log.debug("[{}] Response status: {}", serviceName, clientResponse.statusCode());
            }
            return Mono.just(clientResponse);
        });
    }
}
