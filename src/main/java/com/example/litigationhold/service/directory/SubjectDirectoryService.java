package com.example.litigationhold.service.directory;

import com.example.litigationhold.client.ClientModels.AssignedLicense;
import com.example.litigationhold.client.ClientModels.DirectoryUser;
import com.example.litigationhold.client.ClientModels.SubscribedSku;
import com.example.litigationhold.client.DirectoryServiceClient;
import com.example.litigationhold.config.LitigationHoldProperties;
import com.example.litigationhold.domain.model.Subject;
import com.example.litigationhold.dto.DiscoveryResult;
import com.example.litigationhold.service.license.LicenseEligibilityTable;
import com.example.litigationhold.service.run.RunContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Enumerates directory accounts and selects those that enter the run.
 * <p>
 * A subject enters the run when its account is enabled (unless disabled accounts are
 * included), it holds at least one license carrying litigation hold, and, when a
 * license filter is set, it holds one of the filtered licenses.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SubjectDirectoryService {

    private final DirectoryServiceClient directoryServiceClient;
    private final LitigationHoldProperties properties;

    /**
     * Map SKU ids to part numbers for the tenant
     *
     * @return skuId to skuPartNumber
     * @throws com.example.litigationhold.exception.ExternalServiceException if the directory call fails
     */
    public Map<String, String> loadLicenseCatalog() {
        var catalog = new HashMap<String, String>();
        for (SubscribedSku sku : directoryServiceClient.listSubscribedSkus()) {
            if (sku.getSkuId() != null && sku.getSkuPartNumber() != null) {
                catalog.put(sku.getSkuId().toLowerCase(Locale.ROOT), sku.getSkuPartNumber());
            }
        }
        log.info("License catalog has {} SKUs", catalog.size());
        return catalog;
    }

    /**
     * Enumerate every directory account matching the identity filter, following page links
     *
     * @param catalog skuId to skuPartNumber
     * @return Subjects in directory order, one per identity
     * @throws com.example.litigationhold.exception.ExternalServiceException if a directory call fails
     */
    public List<Subject> listSubjects(Map<String, String> catalog) {
        var byIdentity = new LinkedHashMap<String, Subject>();
        String nextLink = null;
        var pages = 0;

        do {
            var page = directoryServiceClient.listUsersPage(properties.getIdentityFilter(), nextLink);
            pages++;

            for (var user : page.getValue()) {
                if (user.getUserPrincipalName() == null || user.getUserPrincipalName().isBlank()) {
                    log.debug("Skipping directory object {} without principal name", user.getId());
                    continue;
                }
                var subject = toSubject(user, catalog);
                if (byIdentity.putIfAbsent(RunContext.key(subject.getIdentity()), subject) != null) {
                    log.warn("Duplicate identity {} in directory listing, keeping the first entry", subject.getIdentity());
                }
            }

            nextLink = page.getNextLink();
            log.debug("Directory page {} read, {} accounts so far", pages, byIdentity.size());
        } while (nextLink != null && !nextLink.isBlank());

        log.info("Found {} accounts in {} directory pages", byIdentity.size(), pages);
        return new ArrayList<>(byIdentity.values());
    }

    /**
     * Enumerate the directory and keep the subjects entering the run
     *
     * @param table License eligibility table
     * @return Discovered counts and the eligible subjects
     */
    public DiscoveryResult discover(LicenseEligibilityTable table) {
        var catalog = loadLicenseCatalog();
        var subjects = listSubjects(catalog);
        return select(subjects, table);
    }

    DiscoveryResult select(List<Subject> subjects, LicenseEligibilityTable table) {
        var licenseFilter = normalizedLicenseFilter();
        var eligible = new ArrayList<Subject>();
        long disabled = 0;
        long unlicensed = 0;
        long filteredOut = 0;

        for (var subject : subjects) {
            if (!subject.isEnabled() && !properties.isIncludeDisabledAccounts()) {
                disabled++;
            } else if (!table.isEligible(subject)) {
                unlicensed++;
            } else if (!licenseFilter.isEmpty() && subject.getLicenses().stream()
                    .noneMatch(sku -> licenseFilter.contains(sku.toUpperCase(Locale.ROOT)))) {
                filteredOut++;
            } else {
                eligible.add(subject);
            }
        }

        log.info("{} of {} accounts eligible for litigation hold (skipped: {} disabled, {} without eligible license, {} by license filter)",
                eligible.size(), subjects.size(), disabled, unlicensed, filteredOut);

        return DiscoveryResult.builder()
                .totalDiscovered(subjects.size())
                .eligibleSubjects(eligible)
                .skippedDisabled(disabled)
                .skippedNoEligibleLicense(unlicensed)
                .skippedByLicenseFilter(filteredOut)
                .build();
    }

    private Subject toSubject(DirectoryUser user, Map<String, String> catalog) {
        var builder = Subject.builder()
                .identity(user.getUserPrincipalName())
                .directoryId(user.getId())
                .displayName(user.getDisplayName())
                .enabled(Boolean.TRUE.equals(user.getAccountEnabled()));

        if (user.getAssignedLicenses() != null) {
            for (AssignedLicense license : user.getAssignedLicenses()) {
                if (license.getSkuId() == null) {
                    continue;
                }
                var partNumber = catalog.get(license.getSkuId().toLowerCase(Locale.ROOT));
                if (partNumber != null) {
                    builder.license(partNumber);
                } else {
                    log.debug("Unknown SKU {} assigned to {}", license.getSkuId(), user.getUserPrincipalName());
                }
            }
        }
        return builder.build();
    }

    private Set<String> normalizedLicenseFilter() {
        if (properties.getLicenseFilter() == null) {
            return Set.of();
        }
        return properties.getLicenseFilter().stream()
                .filter(Objects::nonNull)
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .map(s -> s.toUpperCase(Locale.ROOT))
                .collect(Collectors.toSet());
    }
}
