package com.example.litigationhold.service.license;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * On-disk shape of the license eligibility table: SKU entries grouped by category.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LicenseTableDocument {

    @NotEmpty
    @Builder.Default
    private Map<@NotBlank String, @NotEmpty List<@Valid @NotNull Entry>> categories = new LinkedHashMap<>();

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Entry {

        @NotBlank
        private String skuPartNumber;

        @NotBlank
        private String displayName;

        @NotNull
        private Boolean litigationHoldSupported;
    }
}
