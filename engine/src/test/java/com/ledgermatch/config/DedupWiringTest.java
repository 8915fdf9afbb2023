package com.ledgermatch.config;

import com.ledgermatch.LedgerMatchApplication;
import com.ledgermatch.dedup.DedupOrchestrator;
import com.ledgermatch.dedup.DedupOptions;
import com.ledgermatch.dedup.config.DedupProperties;
import com.ledgermatch.domain.DedupResult;
import com.ledgermatch.domain.TransactionRecord;
import com.ledgermatch.verifier.DisabledSemanticVerifier;
import com.ledgermatch.verifier.SemanticVerifier;
import com.ledgermatch.verifier.config.VerifierProperties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(classes = LedgerMatchApplication.class, webEnvironment = SpringBootTest.WebEnvironment.NONE, properties = {
        "ledgermatch.verifier.api-key=",
        "ledgermatch.dedup.max-candidates-per-record=3"
})
class DedupWiringTest {

    @Autowired
    DedupOrchestrator orchestrator;

    @Autowired
    DedupProperties dedupProperties;

    @Autowired
    VerifierProperties verifierProperties;

    @Autowired
    SemanticVerifier semanticVerifier;

    @Autowired
    @Qualifier(AsyncConfig.DEDUP_EXECUTOR)
    Executor dedupExecutor;

    @Test
    @DisplayName("properties bind with documented defaults and overrides")
    void propertiesBound() {
        assertThat(dedupProperties.getTier1Threshold()).isEqualTo(0.88);
        assertThat(dedupProperties.getTokenOverlapMinSimilarity()).isEqualTo(0.75);
        assertThat(dedupProperties.getDateWindowDays()).isEqualTo(2);
        assertThat(dedupProperties.getMaxCandidatesPerRecord()).isEqualTo(3);
        assertThat(verifierProperties.getMaxPairsPerRequest()).isEqualTo(100);
        assertThat(verifierProperties.isConfigured()).isFalse();
    }

    @Test
    @DisplayName("without an API key the verifier is the disabled stand-in")
    void verifierDisabledWithoutKey() {
        assertThat(semanticVerifier).isInstanceOf(DisabledSemanticVerifier.class);
        assertThat(semanticVerifier.isAvailable()).isFalse();
    }

    @Test
    @DisplayName("dedup executor is a named thread pool")
    void executorCreated() {
        assertThat(dedupExecutor).isInstanceOf(ThreadPoolTaskExecutor.class);
        assertThat(((ThreadPoolTaskExecutor) dedupExecutor).getThreadNamePrefix()).isEqualTo("dedup-");
    }

    @Test
    @DisplayName("async run completes on the dedup executor and degrades without a verifier")
    void asyncRunCompletes() throws Exception {
        TransactionRecord known = TransactionRecord.builder()
                .id("k-1").description("Starbucks").amount(new BigDecimal("-5.75")).date(LocalDate.of(2025, 1, 20))
                .build();
        TransactionRecord incoming = TransactionRecord.builder()
                .description("DUNKIN DONUTS").amount(new BigDecimal("-5.75")).date(LocalDate.of(2025, 1, 20))
                .build();

        DedupResult result = orchestrator.findDuplicates(List.of(incoming), List.of(known), DedupOptions.defaults())
                .get(10, TimeUnit.SECONDS);

        assertThat(result.unique()).containsExactly(incoming);
        assertThat(result.statistics().isDegraded()).isTrue();
    }
}
