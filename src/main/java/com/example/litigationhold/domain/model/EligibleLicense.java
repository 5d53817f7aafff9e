package com.example.litigationhold.domain.model;

import lombok.Builder;
import lombok.Value;

/**
 * Entry of the license eligibility table.
 */
@Value
@Builder
public class EligibleLicense {

    String skuPartNumber;
    String displayName;
    String category;
    boolean litigationHoldSupported;
}
