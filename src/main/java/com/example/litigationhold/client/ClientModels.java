package com.example.litigationhold.client;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Request/Response DTOs for external service clients
 */
public class ClientModels {
    private ClientModels() {
    }

    // === Directory Service Models ===

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class DirectoryUser {
        private String id;
        private String displayName;
        private String userPrincipalName;
        private Boolean accountEnabled;
        @Builder.Default
        private List<AssignedLicense> assignedLicenses = new ArrayList<>();
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class AssignedLicense {
        private String skuId;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class DirectoryUserPage {
        @Builder.Default
        private List<DirectoryUser> value = new ArrayList<>();
        @JsonProperty("@odata.nextLink")
        private String nextLink;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class SubscribedSku {
        private String skuId;
        private String skuPartNumber;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class SubscribedSkuPage {
        @Builder.Default
        private List<SubscribedSku> value = new ArrayList<>();
    }

    // === Mailbox Status Service Models ===

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class MailboxStatusQuery {
        private List<String> identities;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class MailboxHoldStatus {
        private String identity;
        private boolean litigationHoldEnabled;
        private Instant litigationHoldDate;
        private String litigationHoldOwner;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class MailboxStatusQueryResponse {
        @Builder.Default
        private List<MailboxHoldStatus> mailboxes = new ArrayList<>();
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class LitigationHoldRequest {
        private boolean enabled;
        private Integer durationDays;
        private String owner;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class LitigationHoldResponse {
        private String identity;
        private boolean litigationHoldEnabled;
        private String message;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class SessionInfo {
        private String tenant;
        private String principal;
    }
}
