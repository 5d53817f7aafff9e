package com.example.litigationhold.service.license;

import com.example.litigationhold.domain.model.EligibleLicense;
import com.example.litigationhold.exception.ConfigurationInvalidException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.validation.Validator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Loads the license eligibility table.
 * <p>
 * A configured JSON file is parsed strictly and validated. When no file is configured,
 * or the file cannot be used, the built-in table shipped with the application is used
 * instead and a warning is logged.
 */
@Slf4j
@Component
public class LicenseTableLoader {

    static final String DEFAULT_TABLE_RESOURCE = "default-license-table.json";

    private final ObjectMapper objectMapper;
    private final Validator validator;

    public LicenseTableLoader(ObjectMapper objectMapper, Validator validator) {
        this.objectMapper = objectMapper.copy().enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        this.validator = validator;
    }

    /**
     * Load the table from the given path, or the built-in table
     *
     * @param path JSON file, may be null or blank
     * @return The table; never null
     */
    public LicenseEligibilityTable load(String path) {
        if (path == null || path.isBlank()) {
            log.info("No license table configured, using the built-in table");
            return loadDefault();
        }

        try {
            var table = loadFile(path);
            log.info("Loaded license table from {} ({} SKUs)", path, table.size());
            return table;
        } catch (ConfigurationInvalidException e) {
            log.warn("{}. Falling back to the built-in license table", e.getMessage());
            return loadDefault();
        }
    }

    /**
     * Load and validate a table file given as a configured path string
     *
     * @throws ConfigurationInvalidException if the path is not usable on this system, or as {@link #loadFile(Path)}
     */
    public LicenseEligibilityTable loadFile(String path) {
        Path resolved;
        try {
            resolved = Path.of(path);
        } catch (InvalidPathException e) {
            throw new ConfigurationInvalidException(path, "invalid path: " + e.getMessage(), e);
        }
        return loadFile(resolved);
    }

    /**
     * Load and validate a table file
     *
     * @throws ConfigurationInvalidException if the file is missing, unreadable or malformed
     */
    public LicenseEligibilityTable loadFile(Path path) {
        var source = path.toString();
        if (!Files.isRegularFile(path)) {
            throw new ConfigurationInvalidException(source, "file not found");
        }

        try (var in = Files.newInputStream(path)) {
            return parse(in, source);
        } catch (IOException e) {
            throw new ConfigurationInvalidException(source, "cannot be read: " + e.getMessage(), e);
        }
    }

    LicenseEligibilityTable loadDefault() {
        var resource = new ClassPathResource(DEFAULT_TABLE_RESOURCE);
        try (var in = resource.getInputStream()) {
            return parse(in, "built-in");
        } catch (IOException | ConfigurationInvalidException e) {
            throw new IllegalStateException("Built-in license table is unusable", e);
        }
    }

    private LicenseEligibilityTable parse(InputStream in, String source) throws IOException {
        LicenseTableDocument document;
        try {
            document = objectMapper.readValue(in, LicenseTableDocument.class);
        } catch (JsonProcessingException e) {
            throw new ConfigurationInvalidException(source, "malformed JSON: " + e.getOriginalMessage(), e);
        }

        if (document == null) {
            throw new ConfigurationInvalidException(source, "document is empty");
        }

        var violations = validator.validate(document);
        if (!violations.isEmpty()) {
            var details = violations.stream()
                    .map(v -> v.getPropertyPath() + " " + v.getMessage())
                    .sorted()
                    .collect(Collectors.joining("; "));
            throw new ConfigurationInvalidException(source, details);
        }

        var seen = new HashSet<String>();
        var licenses = new ArrayList<EligibleLicense>();
        for (var category : document.getCategories().entrySet()) {
            for (var entry : category.getValue()) {
                var sku = entry.getSkuPartNumber().trim();
                if (!seen.add(sku.toUpperCase(Locale.ROOT))) {
                    throw new ConfigurationInvalidException(source, "duplicate SKU " + sku);
                }
                licenses.add(EligibleLicense.builder()
                        .skuPartNumber(sku)
                        .displayName(entry.getDisplayName())
                        .category(category.getKey())
                        .litigationHoldSupported(entry.getLitigationHoldSupported())
                        .build());
            }
        }

        return new LicenseEligibilityTable(licenses, source);
    }
}
