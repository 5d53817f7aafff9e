package com.example.litigationhold.client;

import com.example.litigationhold.config.DirectoryServiceProperties;
import com.example.litigationhold.exception.ExternalServiceException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("DirectoryServiceClient Tests")
class DirectoryServiceClientTest {

    private final List<ClientRequest> requests = new ArrayList<>();

    private DirectoryServiceProperties properties;

    @BeforeEach
    void setUp() {
        properties = new DirectoryServiceProperties();
        properties.setBaseUrl("https://directory.test/v1.0");
        properties.setPageSize(500);
        properties.setTimeoutSeconds(5);
    }

    @Nested
    @DisplayName("listUsersPage Tests")
    class ListUsersPageTests {

        @Test
        @DisplayName("Should request the first page with selection, size and prefix filter")
        void shouldRequestFirstPage() {
            // Given
            var client = client(HttpStatus.OK, """
                    {"value": [{"id": "1", "userPrincipalName": "alice@contoso.com", "accountEnabled": true,
                                "assignedLicenses": [{"skuId": "sku-1"}]}],
                     "@odata.nextLink": "https://directory.test/v1.0/users?$skiptoken=xyz"}
                    """);

            // When
            var page = client.listUsersPage("ali", null);

            // Then
            assertThat(page.getValue()).hasSize(1);
            assertThat(page.getValue().get(0).getAssignedLicenses().get(0).getSkuId()).isEqualTo("sku-1");
            assertThat(page.getNextLink()).isEqualTo("https://directory.test/v1.0/users?$skiptoken=xyz");

            var uri = URLDecoder.decode(requests.get(0).url().toString(), StandardCharsets.UTF_8);
            assertThat(uri).startsWith("https://directory.test/v1.0/users?");
            assertThat(uri).contains("$top=500", "startswith(userPrincipalName,'ali')");
        }

        @Test
        @DisplayName("Should follow the continuation link as is")
        void shouldFollowNextLink() {
            // Given
            var client = client(HttpStatus.OK, "{\"value\": []}");

            // When
            var page = client.listUsersPage("ignored", "https://directory.test/v1.0/users?$skiptoken=xyz");

            // Then
            assertThat(page.getValue()).isEmpty();
            assertThat(page.getNextLink()).isNull();
            assertThat(requests.get(0).url().toString()).isEqualTo("https://directory.test/v1.0/users?$skiptoken=xyz");
        }

        @Test
        @DisplayName("Should translate an error status")
        void shouldTranslateErrorStatus() {
            // Given
            var client = client(HttpStatus.UNAUTHORIZED, "{\"error\": \"invalid token\"}");

            // Then
            assertThatThrownBy(() -> client.listUsersPage(null, null))
                    .isInstanceOfSatisfying(ExternalServiceException.class, e -> {
                        assertThat(e.getHttpStatusCode()).isEqualTo(401);
                        assertThat(e.isAuthenticationFailure()).isTrue();
                        assertThat(e.getResponseBody()).contains("invalid token");
                    });
        }
    }

    @Test
    @DisplayName("Should list subscribed SKUs")
    void shouldListSubscribedSkus() {
        // Given
        var client = client(HttpStatus.OK, """
                {"value": [{"skuId": "sku-1", "skuPartNumber": "ENTERPRISEPACK", "capabilityStatus": "Enabled"}]}
                """);

        // When
        var skus = client.listSubscribedSkus();

        // Then
        assertThat(skus).singleElement().satisfies(sku -> assertThat(sku.getSkuPartNumber()).isEqualTo("ENTERPRISEPACK"));
        assertThat(requests.get(0).url().getPath()).isEqualTo("/v1.0/subscribedSkus");
    }

    private DirectoryServiceClient client(HttpStatus status, String body) {
        var webClient = WebClient.builder()
                .baseUrl(properties.getBaseUrl())
                .exchangeFunction(request -> {
                    requests.add(request);
                    return Mono.just(ClientResponse.create(status)
                            .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                            .body(body)
                            .build());
                })
                .build();
        return new DirectoryServiceClient(webClient, properties);
    }
}
