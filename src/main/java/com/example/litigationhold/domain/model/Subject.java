package com.example.litigationhold.domain.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.util.Set;

/**
 * A directory account considered for litigation hold.
 * <p>
 * Built once by directory enumeration and never modified during a run.
 * License entries are SKU part numbers (e.g. ENTERPRISEPACK), already
 * resolved through the tenant's license catalog.
 */
@Value
@Builder
public class Subject {

    /**
     * Unique principal key (user principal name)
     */
    @NonNull
    String identity;

    /**
     * Directory object id
     */
    String directoryId;

    String displayName;

    boolean enabled;

    @Singular
    Set<String> licenses;
}
