package com.example.litigationhold.service.mutation;

import com.example.litigationhold.TestFixtures;
import com.example.litigationhold.client.ClientModels.LitigationHoldRequest;
import com.example.litigationhold.client.ClientModels.LitigationHoldResponse;
import com.example.litigationhold.client.MailboxStatusClient;
import com.example.litigationhold.config.LitigationHoldProperties;
import com.example.litigationhold.config.MetricsConfig;
import com.example.litigationhold.domain.enums.RunPhase;
import com.example.litigationhold.exception.ExternalServiceException;
import com.example.litigationhold.exception.ThresholdExceededException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("BulkMutator Tests")
class BulkMutatorTest {

    @Mock
    private MailboxStatusClient mailboxStatusClient;

    private LitigationHoldProperties properties;

    private ExecutorService executor;

    private BulkMutator bulkMutator;

    @BeforeEach
    void setUp() {
        properties = new LitigationHoldProperties();
        executor = Executors.newFixedThreadPool(8);
        bulkMutator = new BulkMutator(mailboxStatusClient, new MetricsConfig(new SimpleMeterRegistry()), properties, executor);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Nested
    @DisplayName("Preview Tests")
    class PreviewTests {

        @Test
        @DisplayName("Should record a simulated success without calling the service")
        void shouldNotCallServiceInPreview() {
            // Given
            var targets = TestFixtures.subjects(5);
            var context = TestFixtures.context(true, TestFixtures.plan(2, 2));

            // When
            bulkMutator.mutate(targets, context);

            // Then
            verify(mailboxStatusClient, never()).enableLitigationHold(anyString(), any());
            assertThat(context.getCounters().getNewlyCompliant()).isEqualTo(5);
            targets.forEach(subject -> assertThat(context.getOutcome(subject.getIdentity()))
                    .hasValueSatisfying(outcome -> {
                        assertThat(outcome.isPreview()).isTrue();
                        assertThat(outcome.isSuccess()).isTrue();
                    }));
        }
    }

    @Nested
    @DisplayName("Live Tests")
    class LiveTests {

        @Test
        @DisplayName("Should call the service exactly once per subject across sub-batches")
        void shouldCallOncePerSubject() {
            // Given
            var targets = TestFixtures.subjects(250);
            var context = TestFixtures.context(false, TestFixtures.plan(500, 10));
            when(mailboxStatusClient.enableLitigationHold(anyString(), any())).thenAnswer(invocation ->
                    LitigationHoldResponse.builder()
                            .identity(invocation.getArgument(0))
                            .litigationHoldEnabled(true)
                            .build());

            // When
            bulkMutator.mutate(targets, context);

            // Then
            verify(mailboxStatusClient, times(250)).enableLitigationHold(anyString(), any());
            targets.forEach(subject -> verify(mailboxStatusClient).enableLitigationHold(eq(subject.getIdentity()), any()));
            assertThat(context.getCounters().getNewlyCompliant()).isEqualTo(250);
            assertThat(context.getOutcomes()).hasSize(250);
        }

        @Test
        @DisplayName("Should never run more calls at once than the concurrency limit")
        void shouldRespectConcurrencyLimit() {
            // Given
            var targets = TestFixtures.subjects(40);
            var context = TestFixtures.context(false, TestFixtures.plan(100, 3));
            var inFlight = new AtomicInteger();
            var peak = new AtomicInteger();
            when(mailboxStatusClient.enableLitigationHold(anyString(), any())).thenAnswer(invocation -> {
                var now = inFlight.incrementAndGet();
                peak.accumulateAndGet(now, Math::max);
                Thread.sleep(5);
                inFlight.decrementAndGet();
                return LitigationHoldResponse.builder().litigationHoldEnabled(true).build();
            });

            // When
            bulkMutator.mutate(targets, context);

            // Then
            assertThat(peak.get()).isBetween(1, 3);
            assertThat(context.getCounters().getNewlyCompliant()).isEqualTo(40);
        }

        @Test
        @DisplayName("Should record failures and keep processing the batch")
        void shouldRecordFailures() {
            // Given
            var targets = TestFixtures.subjects(3);
            var context = TestFixtures.context(false, TestFixtures.plan(10, 2));
            when(mailboxStatusClient.enableLitigationHold(eq("user1@contoso.com"), any()))
                    .thenReturn(LitigationHoldResponse.builder().litigationHoldEnabled(true).build());
            when(mailboxStatusClient.enableLitigationHold(eq("user2@contoso.com"), any()))
                    .thenThrow(new ExternalServiceException("Mailbox Service", 500, "mailbox locked"));
            when(mailboxStatusClient.enableLitigationHold(eq("user3@contoso.com"), any()))
                    .thenReturn(LitigationHoldResponse.builder().litigationHoldEnabled(false).message("quota").build());

            // When
            bulkMutator.mutate(targets, context);

            // Then
            assertThat(context.getOutcome("user1@contoso.com")).hasValueSatisfying(o -> assertThat(o.isSuccess()).isTrue());
            assertThat(context.getOutcome("user2@contoso.com")).hasValueSatisfying(o -> {
                assertThat(o.isSuccess()).isFalse();
                assertThat(o.getErrorMessage()).contains("mailbox locked");
            });
            assertThat(context.getOutcome("user3@contoso.com")).hasValueSatisfying(o -> {
                assertThat(o.isSuccess()).isFalse();
                assertThat(o.getErrorMessage()).contains("quota");
            });
            assertThat(context.getCounters().getErrors()).isEqualTo(2);
            assertThat(context.getCounters().getNewlyCompliant()).isEqualTo(1);
        }

        @Test
        @DisplayName("Should send the configured hold settings")
        void shouldSendHoldSettings() {
            // Given
            properties.setHoldDurationDays(365);
            properties.setHoldOwner("legal@contoso.com");
            var context = TestFixtures.context(false, TestFixtures.plan(10, 2));
            var captor = ArgumentCaptor.forClass(LitigationHoldRequest.class);
            when(mailboxStatusClient.enableLitigationHold(anyString(), captor.capture()))
                    .thenReturn(LitigationHoldResponse.builder().litigationHoldEnabled(true).build());

            // When
            bulkMutator.mutate(TestFixtures.subjects(1), context);

            // Then
            assertThat(captor.getValue().isEnabled()).isTrue();
            assertThat(captor.getValue().getDurationDays()).isEqualTo(365);
            assertThat(captor.getValue().getOwner()).isEqualTo("legal@contoso.com");
        }

        @Test
        @DisplayName("Should halt after the sub-batch in which errors exceed the limit")
        void shouldHaltBetweenSubBatches() {
            // Given
            var targets = TestFixtures.subjects(6);
            var context = TestFixtures.context(false, TestFixtures.plan(2, 2), 1, false);
            when(mailboxStatusClient.enableLitigationHold(anyString(), any()))
                    .thenThrow(new ExternalServiceException("Mailbox Service", 500, "boom"));

            // When / Then
            assertThatThrownBy(() -> bulkMutator.mutate(targets, context))
                    .isInstanceOfSatisfying(ThresholdExceededException.class,
                            e -> assertThat(e.getPhase()).isEqualTo(RunPhase.MUTATION));

            verify(mailboxStatusClient, times(2)).enableLitigationHold(anyString(), any());
            assertThat(context.getOutcomes()).hasSize(2);
            assertThat(context.getOutcome("user3@contoso.com")).isEmpty();
        }

        @Test
        @DisplayName("Should do nothing for an empty target list")
        void shouldHandleEmptyTargets() {
            // Given
            var context = TestFixtures.context(false, TestFixtures.plan(10, 2));

            // When
            bulkMutator.mutate(List.of(), context);

            // Then
            verify(mailboxStatusClient, never()).enableLitigationHold(anyString(), any());
        }
    }
}
