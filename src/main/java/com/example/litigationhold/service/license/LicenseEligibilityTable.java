package com.example.litigationhold.service.license;

import com.example.litigationhold.domain.model.EligibleLicense;
import com.example.litigationhold.domain.model.Subject;
import lombok.Getter;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only lookup of license SKUs by part number, deciding which plans carry litigation hold.
 */
public class LicenseEligibilityTable {

    private final Map<String, EligibleLicense> licenses;

    /**
     * Where the table came from, for logging and the report
     */
    @Getter
    private final String source;

    public LicenseEligibilityTable(Collection<EligibleLicense> licenses, String source) {
        var bySku = new LinkedHashMap<String, EligibleLicense>();
        for (var license : licenses) {
            bySku.put(normalize(license.getSkuPartNumber()), license);
        }
        this.licenses = Collections.unmodifiableMap(bySku);
        this.source = source;
    }

    public Optional<EligibleLicense> find(String skuPartNumber) {
        return Optional.ofNullable(licenses.get(normalize(skuPartNumber)));
    }

    /**
     * Whether the SKU is known and carries litigation hold
     */
    public boolean supportsLitigationHold(String skuPartNumber) {
        return find(skuPartNumber).map(EligibleLicense::isLitigationHoldSupported).orElse(false);
    }

    public boolean isEligible(Subject subject) {
        return subject.getLicenses().stream().anyMatch(this::supportsLitigationHold);
    }

    public int size() {
        return licenses.size();
    }

    private static String normalize(String skuPartNumber) {
        return skuPartNumber.trim().toUpperCase(Locale.ROOT);
    }
}
