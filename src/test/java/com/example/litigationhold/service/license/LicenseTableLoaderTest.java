package com.example.litigationhold.service.license;

import com.example.litigationhold.exception.ConfigurationInvalidException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.validation.Validation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("LicenseTableLoader Tests")
class LicenseTableLoaderTest {

    @TempDir
    Path tempDir;

    private LicenseTableLoader loader;

    @BeforeEach
    void setUp() {
        loader = new LicenseTableLoader(new ObjectMapper(), Validation.buildDefaultValidatorFactory().getValidator());
    }

    @Nested
    @DisplayName("Built-in table Tests")
    class BuiltInTableTests {

        @Test
        @DisplayName("Should use the built-in table when no path is set")
        void shouldLoadDefault() {
            // When
            var table = loader.load(null);

            // Then
            assertThat(table.getSource()).isEqualTo("built-in");
            assertThat(table.supportsLitigationHold("ENTERPRISEPACK")).isTrue();
            assertThat(table.supportsLitigationHold("spe_e5")).isTrue();
            assertThat(table.supportsLitigationHold("STANDARDPACK")).isFalse();
            assertThat(table.supportsLitigationHold("UNKNOWN_SKU")).isFalse();
            assertThat(table.find("SPB")).hasValueSatisfying(l -> assertThat(l.getCategory()).isEqualTo("business"));
        }
    }

    @Nested
    @DisplayName("File table Tests")
    class FileTableTests {

        @Test
        @DisplayName("Should load a valid file")
        void shouldLoadValidFile() throws IOException {
            // Given
            var file = write("""
                    {"categories": {"custom": [
                      {"skuPartNumber": "CUSTOM_PLAN", "displayName": "Custom plan", "litigationHoldSupported": true},
                      {"skuPartNumber": "BASIC_PLAN", "displayName": "Basic plan", "litigationHoldSupported": false}
                    ]}}
                    """);

            // When
            var table = loader.load(file.toString());

            // Then
            assertThat(table.size()).isEqualTo(2);
            assertThat(table.supportsLitigationHold("CUSTOM_PLAN")).isTrue();
            assertThat(table.supportsLitigationHold("ENTERPRISEPACK")).isFalse();
        }

        @Test
        @DisplayName("Should fall back to the built-in table when the file is missing")
        void shouldFallBackWhenMissing() {
            // When
            var table = loader.load(tempDir.resolve("missing.json").toString());

            // Then
            assertThat(table.getSource()).isEqualTo("built-in");
        }

        @Test
        @DisplayName("Should fall back to the built-in table when the path is not a valid path")
        void shouldFallBackWhenPathInvalid() {
            // When
            var table = loader.load("licenses\u0000.json");

            // Then
            assertThat(table.getSource()).isEqualTo("built-in");
        }

        @Test
        @DisplayName("Should reject a path that is not a valid path")
        void shouldRejectInvalidPath() {
            assertThatThrownBy(() -> loader.loadFile("licenses\u0000.json"))
                    .isInstanceOf(ConfigurationInvalidException.class)
                    .hasMessageContaining("invalid path");
        }

        @Test
        @DisplayName("Should fall back to the built-in table when the file is malformed")
        void shouldFallBackWhenMalformed() throws IOException {
            // Given
            var file = write("{\"categories\": [");

            // When
            var table = loader.load(file.toString());

            // Then
            assertThat(table.getSource()).isEqualTo("built-in");
        }

        @Test
        @DisplayName("Should reject an entry without a support flag")
        void shouldRejectInvalidEntry() throws IOException {
            // Given
            var file = write("""
                    {"categories": {"custom": [{"skuPartNumber": "CUSTOM_PLAN", "displayName": "Custom plan"}]}}
                    """);

            // Then
            assertThatThrownBy(() -> loader.loadFile(file))
                    .isInstanceOf(ConfigurationInvalidException.class)
                    .hasMessageContaining("litigationHoldSupported");
        }

        @Test
        @DisplayName("Should reject unknown fields")
        void shouldRejectUnknownFields() throws IOException {
            // Given
            var file = write("""
                    {"categories": {"custom": [
                      {"skuPartNumber": "A", "displayName": "A", "litigationHoldSupported": true, "price": 3}
                    ]}}
                    """);

            // Then
            assertThatThrownBy(() -> loader.loadFile(file)).isInstanceOf(ConfigurationInvalidException.class);
        }

        @Test
        @DisplayName("Should reject a SKU listed twice")
        void shouldRejectDuplicateSku() throws IOException {
            // Given
            var file = write("""
                    {"categories": {
                      "a": [{"skuPartNumber": "DUP", "displayName": "One", "litigationHoldSupported": true}],
                      "b": [{"skuPartNumber": "dup", "displayName": "Two", "litigationHoldSupported": false}]
                    }}
                    """);

            // Then
            assertThatThrownBy(() -> loader.loadFile(file))
                    .isInstanceOf(ConfigurationInvalidException.class)
                    .hasMessageContaining("duplicate SKU");
        }
    }

    private Path write(String content) throws IOException {
        var file = tempDir.resolve("licenses.json");
        Files.writeString(file, content);
        return file;
    }
}
