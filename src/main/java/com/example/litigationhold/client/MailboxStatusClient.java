package com.example.litigationhold.client;

import com.example.litigationhold.client.ClientModels.LitigationHoldRequest;
import com.example.litigationhold.client.ClientModels.LitigationHoldResponse;
import com.example.litigationhold.client.ClientModels.MailboxHoldStatus;
import com.example.litigationhold.client.ClientModels.MailboxStatusQuery;
import com.example.litigationhold.client.ClientModels.MailboxStatusQueryResponse;
import com.example.litigationhold.client.ClientModels.SessionInfo;
import com.example.litigationhold.config.MailboxServiceProperties;
import com.example.litigationhold.exception.ExternalServiceException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Client for the mailbox status service.
 * <p>
 * Read calls are retried with exponential backoff on transient failures. Only the
 * batch status query has a circuit breaker; when it is open the caller falls back
 * to single lookups. The hold update is neither retried nor short-circuited, so
 * every subject gets exactly one update call and run errors are bounded by the
 * error threshold alone.
 */
@Slf4j
@Component
public class MailboxStatusClient {

    private static final String SERVICE_NAME = "Mailbox Service";

    private final WebClient webClient;
    private final MailboxServiceProperties properties;

    public MailboxStatusClient(@Qualifier("mailboxServiceWebClient") WebClient webClient, MailboxServiceProperties properties) {
        this.webClient = webClient;
        this.properties = properties;
    }

    /**
     * Check that the service is reachable and accepts our credentials
     *
     * @return The session the service resolved for our token
     * @throws ExternalServiceException if the API call fails
     */
    @Retry(name = "mailboxService")
    public SessionInfo verifySession() {
        log.debug("Verifying mailbox service session");

        try {
            return webClient.get()
                    .uri("/api/v1/session")
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, response ->
                            response.bodyToMono(String.class)
                                    .defaultIfEmpty("")
                                    .flatMap(body -> Mono.error(
                                            new ExternalServiceException(SERVICE_NAME, response.statusCode().value(), body))))
                    .bodyToMono(SessionInfo.class)
                    .timeout(Duration.ofSeconds(properties.getTimeoutSeconds()))
                    .blockOptional()
                    .orElseGet(SessionInfo::new);
        } catch (ExternalServiceException e) {
            throw e;
        } catch (Exception e) {
            log.error("Failed to verify mailbox service session: {}", e.getMessage());
            throw new ExternalServiceException(SERVICE_NAME, e);
        }
    }

    /**
     * Query the hold status of several mailboxes at once.
     * Identities without a mailbox are absent from the result.
     *
     * @param identities Principal names to look up
     * @return Status of each mailbox found
     * @throws ExternalServiceException if the API call fails
     */
    @CircuitBreaker(name = "mailboxStatusQuery")
    @Retry(name = "mailboxService")
    public List<MailboxHoldStatus> queryStatuses(List<String> identities) {
        log.debug("Querying litigation hold status for {} mailboxes", identities.size());

        try {
            return webClient.post()
                    .uri("/api/v1/mailboxes/litigation-hold/query")
                    .bodyValue(MailboxStatusQuery.builder().identities(identities).build())
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, response ->
                            response.bodyToMono(String.class)
                                    .defaultIfEmpty("")
                                    .flatMap(body -> Mono.error(
                                            new ExternalServiceException(SERVICE_NAME, response.statusCode().value(), body))))
                    .bodyToMono(MailboxStatusQueryResponse.class)
                    .timeout(Duration.ofSeconds(properties.getTimeoutSeconds()))
                    .blockOptional()
                    .map(MailboxStatusQueryResponse::getMailboxes)
                    .orElseGet(List::of);
        } catch (ExternalServiceException e) {
            throw e;
        } catch (Exception e) {
            log.error("Failed to query status of {} mailboxes: {}", identities.size(), e.getMessage());
            throw new ExternalServiceException(SERVICE_NAME, e);
        }
    }

    /**
     * Get the hold status of one mailbox
     *
     * @param identity Principal name
     * @return The status, empty when the subject has no mailbox
     * @throws ExternalServiceException if the API call fails
     */
    @Retry(name = "mailboxService")
    public Optional<MailboxHoldStatus> getStatus(String identity) {
        log.debug("Getting litigation hold status for: {}", identity);

        try {
            return webClient.get()
                    .uri("/api/v1/mailboxes/{identity}/litigation-hold", identity)
                    .exchangeToMono(response -> {
                        if (response.statusCode().value() == HttpStatus.NOT_FOUND.value()) {
                            return response.releaseBody().then(Mono.<MailboxHoldStatus>empty());
                        }
                        if (response.statusCode().isError()) {
                            return response.bodyToMono(String.class)
                                    .defaultIfEmpty("")
                                    .<MailboxHoldStatus>flatMap(body -> Mono.error(
                                            new ExternalServiceException(SERVICE_NAME, response.statusCode().value(), body)));
                        }
                        return response.bodyToMono(MailboxHoldStatus.class);
                    })
                    .timeout(Duration.ofSeconds(properties.getTimeoutSeconds()))
                    .blockOptional();
        } catch (ExternalServiceException e) {
            throw e;
        } catch (Exception e) {
            log.error("Failed to get litigation hold status for {}: {}", identity, e.getMessage());
            throw new ExternalServiceException(SERVICE_NAME, e);
        }
    }

    /**
     * Enable litigation hold on one mailbox
     *
     * @param identity Principal name
     * @param request  Hold settings
     * @return The service response
     * @throws ExternalServiceException if the API call fails
     */
    public LitigationHoldResponse enableLitigationHold(String identity, LitigationHoldRequest request) {
        log.info("Calling Mailbox Service to enable litigation hold: {}", identity);

        try {
            return webClient.put()
                    .uri("/api/v1/mailboxes/{identity}/litigation-hold", identity)
                    .bodyValue(request)
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, response ->
                            response.bodyToMono(String.class)
                                    .defaultIfEmpty("")
                                    .flatMap(body -> Mono.error(
                                            new ExternalServiceException(SERVICE_NAME, response.statusCode().value(), body))))
                    .bodyToMono(LitigationHoldResponse.class)
                    .timeout(Duration.ofSeconds(properties.getTimeoutSeconds()))
                    .block();
        } catch (ExternalServiceException e) {
            throw e;
        } catch (Exception e) {
            log.error("Failed to enable litigation hold for {}: {}", identity, e.getMessage());
            throw new ExternalServiceException(SERVICE_NAME, e);
        }
    }
}
