package com.example.litigationhold.client;

import com.example.litigationhold.client.ClientModels.DirectoryUserPage;
import com.example.litigationhold.client.ClientModels.SubscribedSku;
import com.example.litigationhold.client.ClientModels.SubscribedSkuPage;
import com.example.litigationhold.config.DirectoryServiceProperties;
import com.example.litigationhold.exception.ExternalServiceException;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.time.Duration;
import java.util.List;

/**
 * Client for the directory service (Graph-style users and subscribed SKUs).
 * <p>
 * Uses:
 * - Resilience4j Circuit Breaker for fault tolerance
 * - Retry with exponential backoff
 * - WebClient for HTTP calls, blocking at the call site
 */
@Slf4j
@Component
public class DirectoryServiceClient {

    private static final String SERVICE_NAME = "Directory Service";
    private static final String USER_FIELDS = "id,displayName,userPrincipalName,accountEnabled,assignedLicenses";

    private final WebClient webClient;
    private final DirectoryServiceProperties properties;

    public DirectoryServiceClient(@Qualifier("directoryServiceWebClient") WebClient webClient, DirectoryServiceProperties properties) {
        this.webClient = webClient;
        this.properties = properties;
    }

    /**
     * Fetch one page of users.
     *
     * @param identityPrefix Only users whose principal name starts with this prefix, all users when null
     * @param nextLink       Continuation link from the previous page, null for the first page
     * @return The page, with a next link when more users remain
     * @throws ExternalServiceException if the API call fails
     */
    @CircuitBreaker(name = "directoryService", fallbackMethod = "listUsersPageFallback")
    @Retry(name = "directoryService")
    public DirectoryUserPage listUsersPage(String identityPrefix, String nextLink) {
        log.debug("Fetching directory user page (prefix: {}, continuation: {})", identityPrefix, nextLink != null);

        try {
            WebClient.RequestHeadersSpec<?> request = nextLink != null
                    ? webClient.get().uri(URI.create(nextLink))
                    : webClient.get().uri(uriBuilder -> {
                        uriBuilder.path("/users")
                                .queryParam("$select", USER_FIELDS)
                                .queryParam("$top", properties.getPageSize());
                        if (identityPrefix != null && !identityPrefix.isBlank()) {
                            uriBuilder.queryParam("$filter", "startswith(userPrincipalName,'" + escapeODataLiteral(identityPrefix) + "')");
                        }
                        return uriBuilder.build();
                    });

            return request
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, response ->
                            response.bodyToMono(String.class)
                                    .defaultIfEmpty("")
                                    .flatMap(body -> Mono.error(
                                            new ExternalServiceException(SERVICE_NAME, response.statusCode().value(), body))))
                    .bodyToMono(DirectoryUserPage.class)
                    .timeout(Duration.ofSeconds(properties.getTimeoutSeconds()))
                    .blockOptional()
                    .orElseGet(DirectoryUserPage::new);
        } catch (ExternalServiceException e) {
            throw e;
        } catch (Exception e) {
            log.error("Failed to fetch directory user page: {}", e.getMessage());
            throw new ExternalServiceException(SERVICE_NAME, e);
        }
    }

    /**
     * Fallback method when circuit breaker is open
     */
    @SuppressWarnings("unused")
    private DirectoryUserPage listUsersPageFallback(String identityPrefix, String nextLink, CallNotPermittedException e) {
        log.warn("Circuit breaker open for Directory Service, user listing: {}", e.getMessage());
        throw new ExternalServiceException(SERVICE_NAME, "Service temporarily unavailable (circuit breaker open)", e);
    }

    /**
     * List the license SKUs subscribed by the tenant
     *
     * @return The SKU catalog entries
     * @throws ExternalServiceException if the API call fails
     */
    @CircuitBreaker(name = "directoryService")
    @Retry(name = "directoryService")
    public List<SubscribedSku> listSubscribedSkus() {
        log.debug("Fetching subscribed SKUs");

        try {
            return webClient.get()
                    .uri("/subscribedSkus")
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, response ->
                            response.bodyToMono(String.class)
                                    .defaultIfEmpty("")
                                    .flatMap(body -> Mono.error(
                                            new ExternalServiceException(SERVICE_NAME, response.statusCode().value(), body))))
                    .bodyToMono(SubscribedSkuPage.class)
                    .timeout(Duration.ofSeconds(properties.getTimeoutSeconds()))
                    .blockOptional()
                    .map(SubscribedSkuPage::getValue)
                    .orElseGet(List::of);
        } catch (ExternalServiceException e) {
            throw e;
        } catch (Exception e) {
            log.error("Failed to fetch subscribed SKUs: {}", e.getMessage());
            throw new ExternalServiceException(SERVICE_NAME, e);
        }
    }

    private static String escapeODataLiteral(String value) {
        return value.replace("'", "''");
    }
}
