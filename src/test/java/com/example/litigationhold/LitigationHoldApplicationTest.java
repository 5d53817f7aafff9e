package com.example.litigationhold;

import com.example.litigationhold.client.DirectoryServiceClient;
import com.example.litigationhold.client.MailboxStatusClient;
import com.example.litigationhold.config.LitigationHoldProperties;
import com.example.litigationhold.runner.LitigationHoldRunner;
import com.example.litigationhold.service.LitigationHoldRunService;
import com.example.litigationhold.service.license.LicenseTableLoader;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.ApplicationContext;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(properties = {
        "litigation-hold.runner.enabled=false",
        "litigation-hold.max-errors=7",
        "slack.enabled=false"
})
@DisplayName("Application Context Tests")
class LitigationHoldApplicationTest {

    @MockBean
    private DirectoryServiceClient directoryServiceClient;

    @MockBean
    private MailboxStatusClient mailboxStatusClient;

    @Autowired
    private ApplicationContext context;

    @Autowired
    private LitigationHoldProperties properties;

    @Autowired
    private LicenseTableLoader licenseTableLoader;

    @Test
    @DisplayName("Should wire the run service without starting a run")
    void shouldLoadContext() {
        assertThat(context.getBean(LitigationHoldRunService.class)).isNotNull();
        assertThat(context.getBeansOfType(LitigationHoldRunner.class)).isEmpty();
        assertThat(properties.getMaxErrors()).isEqualTo(7);
        assertThat(properties.isPreview()).isTrue();
    }

    @Test
    @DisplayName("Should load the built-in license table with the application ObjectMapper")
    void shouldLoadBuiltInLicenseTable() {
        var table = licenseTableLoader.load(null);

        assertThat(table.size()).isGreaterThan(10);
        assertThat(table.supportsLitigationHold("SPE_E5")).isTrue();
    }
}
