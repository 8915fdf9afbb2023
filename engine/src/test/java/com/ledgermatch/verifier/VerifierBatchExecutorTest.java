package com.ledgermatch.verifier;

import com.ledgermatch.domain.VerifierConfidence;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class VerifierBatchExecutorTest {

    private static final Instant NOW = Instant.parse("2025-01-20T12:00:00Z");

    @Mock
    SemanticVerifier verifier;

    @Test
    @DisplayName("pairs are split into batches of the verifier's size, in order")
    void batchesInOrder() {
        when(verifier.maxPairsPerRequest()).thenReturn(2);
        when(verifier.verify(anyList())).thenAnswer(inv -> rejectAll(inv.getArgument(0)));
        List<VerificationPair> pairs = pairs(5);

        List<BatchOutcome> outcomes = new VerifierBatchExecutor(verifier).execute(pairs, null);

        assertThat(outcomes).extracting(BatchOutcome::getBatchIndex).containsExactly(0, 1, 2);
        assertThat(outcomes).allMatch(BatchOutcome::isSucceeded);
        assertThat(outcomes.get(0).getPairs()).containsExactly(pairs.get(0), pairs.get(1));
        assertThat(outcomes.get(2).getPairs()).containsExactly(pairs.get(4));
        verify(verifier, times(3)).verify(anyList());
    }

    @Test
    @DisplayName("a failing batch is recorded and the next batch still runs")
    void failureIsolated() {
        List<VerificationPair> pairs = pairs(3);
        when(verifier.maxPairsPerRequest()).thenReturn(1);
        when(verifier.verify(List.of(pairs.get(0)))).thenReturn(List.of(accepted()));
        when(verifier.verify(List.of(pairs.get(1)))).thenThrow(new VerifierException("HTTP 503"));
        when(verifier.verify(List.of(pairs.get(2)))).thenReturn(List.of(accepted()));

        List<BatchOutcome> outcomes = new VerifierBatchExecutor(verifier).execute(pairs, null);

        assertThat(outcomes).extracting(BatchOutcome::getStatus).containsExactly(
                BatchOutcome.Status.SUCCEEDED, BatchOutcome.Status.FAILED, BatchOutcome.Status.SUCCEEDED);
        assertThat(outcomes.get(1).getError()).hasValueSatisfying(e -> assertThat(e).hasMessage("HTTP 503"));
        assertThat(outcomes.get(1).getVerdicts()).isEmpty();
    }

    @Test
    @DisplayName("wrong number of verdicts fails the batch")
    void verdictCountMismatch() {
        when(verifier.maxPairsPerRequest()).thenReturn(10);
        when(verifier.verify(anyList())).thenReturn(List.of(accepted()));

        List<BatchOutcome> outcomes = new VerifierBatchExecutor(verifier).execute(pairs(2), null);

        assertThat(outcomes).singleElement().satisfies(o -> {
            assertThat(o.getStatus()).isEqualTo(BatchOutcome.Status.FAILED);
            assertThat(o.getError()).hasValueSatisfying(e -> assertThat(e).isInstanceOf(VerifierException.class));
        });
    }

    @Test
    @DisplayName("no batch starts once the deadline has passed")
    void deadlinePassed() {
        when(verifier.maxPairsPerRequest()).thenReturn(2);
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);

        List<BatchOutcome> outcomes = new VerifierBatchExecutor(verifier, clock).execute(pairs(3), NOW);

        assertThat(outcomes).extracting(BatchOutcome::getStatus)
                .containsExactly(BatchOutcome.Status.SKIPPED, BatchOutcome.Status.SKIPPED);
        verify(verifier, never()).verify(any());
    }

    @Test
    @DisplayName("deadline is checked between batches, not during one")
    void deadlineBetweenBatches() {
        MutableClock clock = new MutableClock(NOW);
        when(verifier.maxPairsPerRequest()).thenReturn(1);
        when(verifier.verify(anyList())).thenAnswer(inv -> {
            clock.advanceSeconds(30);
            return rejectAll(inv.getArgument(0));
        });

        List<BatchOutcome> outcomes = new VerifierBatchExecutor(verifier, clock)
                .execute(pairs(3), NOW.plusSeconds(10));

        assertThat(outcomes).extracting(BatchOutcome::getStatus).containsExactly(
                BatchOutcome.Status.SUCCEEDED, BatchOutcome.Status.SKIPPED, BatchOutcome.Status.SKIPPED);
    }

    @Test
    @DisplayName("nothing to verify means no calls")
    void emptyInput() {
        assertThat(new VerifierBatchExecutor(verifier).execute(List.of(), null)).isEmpty();
        verify(verifier, never()).verify(any());
    }

    private static List<VerificationPair> pairs(int n) {
        List<VerificationPair> out = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            out.add(new VerificationPair("INCOMING " + i, "KNOWN " + i, new BigDecimal("1.00"),
                    LocalDate.of(2025, 1, 20)));
        }
        return out;
    }

    private static List<VerificationVerdict> rejectAll(List<VerificationPair> batch) {
        return batch.stream().map(p -> VerificationVerdict.rejected()).toList();
    }

    private static VerificationVerdict accepted() {
        return new VerificationVerdict(true, VerifierConfidence.HIGH);
    }

    private static final class MutableClock extends Clock {

        private Instant now;

        MutableClock(Instant now) {
            this.now = now;
        }

        void advanceSeconds(long seconds) {
            now = now.plusSeconds(seconds);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
