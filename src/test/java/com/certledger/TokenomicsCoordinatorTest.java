package com.certledger;

import com.certledger.errors.ConflictingOnChainRefException;
import com.certledger.errors.InvalidMetricRangeException;
import com.certledger.errors.NotRegisteredException;
import com.certledger.models.AdvanceCause;
import com.certledger.models.CertificationResult;
import com.certledger.models.CertificationStatus;
import com.certledger.models.EpochStatus;
import com.certledger.models.MetricVector;
import com.certledger.models.SubmissionRequest;
import com.certledger.models.Tier;
import com.certledger.models.TokenomicsStats;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class TokenomicsCoordinatorTest {

    private static final MetricVector STRONG = new MetricVector(0.9, 0.8, 0.7, 0.1);

    @TempDir
    Path dataDir;

    @Test
    void certifiesAgainstTheActiveEpoch() {
        TokenomicsCoordinator coordinator = TokenomicsCoordinator.open(dataDir, new TokenomicsPolicy());

        CertificationResult founder = coordinator.submitForCertification("c-1", "alice", STRONG);
        assertEquals(CertificationStatus.CERTIFIED, founder.getStatus());
        assertEquals(Tier.FOUNDER, founder.getTier());
        assertEquals(10_000L, founder.getAmount());
        assertEquals(0, (int) founder.getEpochIndex());

        coordinator.advanceEpoch("operator-1");
        CertificationResult gold = coordinator.submitForCertification("c-2", "alice", STRONG);

        assertEquals(CertificationStatus.CERTIFIED, gold.getStatus());
        assertEquals(Tier.GOLD, gold.getTier());
        assertEquals(1_000L, gold.getAmount());
        assertEquals(1, (int) gold.getEpochIndex());
        assertEquals(0.78, gold.getScore(), 1e-9);
        assertEquals(2, coordinator.getTotalCertified());
        assertEquals(11_000L, coordinator.getBalance("alice"));
    }

    @Test
    void zeroMetricsLeaveNoTrace() {
        TokenomicsCoordinator coordinator = TokenomicsCoordinator.open(dataDir, new TokenomicsPolicy());

        CertificationResult result = coordinator.submitForCertification("c-0", "bob", new MetricVector(0, 0, 0, 0));

        assertEquals(CertificationStatus.NOT_CERTIFIED, result.getStatus());
        assertEquals(Tier.REJECTED, result.getTier());
        assertNull(result.getCertificate());
        assertEquals(0, coordinator.getTotalCertified());
        assertEquals(0L, coordinator.getStatistics().getTotalReserved());
        assertTrue(coordinator.getCertificate("c-0").isEmpty());
        assertEquals(1, coordinator.getEvaluations("c-0").size());
    }

    @Test
    void replayReturnsTheExistingCertificate() {
        TokenomicsCoordinator coordinator = TokenomicsCoordinator.open(dataDir, new TokenomicsPolicy());
        CertificationResult first = coordinator.submitForCertification("c-1", "alice", STRONG);

        CertificationResult replay = coordinator.submitForCertification("c-1", "alice", STRONG);

        assertEquals(CertificationStatus.ALREADY_CERTIFIED, replay.getStatus());
        assertEquals(first.getAmount(), replay.getAmount());
        assertEquals(first.getCertificate().getRegisteredAt(), replay.getCertificate().getRegisteredAt());
        assertEquals(first.getAmount(), coordinator.getStatistics().getTotalReserved());
        assertEquals(1, coordinator.getTotalCertified());
    }

    @Test
    void invalidMetricsRecordNothing() {
        TokenomicsCoordinator coordinator = TokenomicsCoordinator.open(dataDir, new TokenomicsPolicy());

        assertThrows(InvalidMetricRangeException.class,
            () -> coordinator.submitForCertification("c-bad", "alice", new MetricVector(1.5, 0, 0, 0)));
        assertThrows(IllegalArgumentException.class,
            () -> coordinator.submitForCertification(" ", "alice", STRONG));

        assertTrue(coordinator.getEvaluations("c-bad").isEmpty());
        assertEquals(0L, coordinator.getStatistics().getTotalReserved());
    }

    @Test
    void submissionWithMissingMetricsIsRejected() throws Exception {
        TokenomicsCoordinator coordinator = TokenomicsCoordinator.open(dataDir, new TokenomicsPolicy());
        SubmissionRequest request = new ObjectMapper().readValue(
            "{\"contributionId\":\"c-1\",\"contributorId\":\"alice\",\"metrics\":{\"coherence\":1.0,\"density\":null}}",
            SubmissionRequest.class);

        assertThrows(InvalidMetricRangeException.class, () -> coordinator.submitForCertification(
            request.getContributionId(), request.getContributorId(), request.getMetrics()));

        assertEquals(0, coordinator.getTotalCertified());
        assertTrue(coordinator.getEvaluations("c-1").isEmpty());
        assertEquals(0L, coordinator.getStatistics().getTotalReserved());
    }

    @Test
    void resumesReservationLeftByInterruptedRun() {
        TokenomicsPolicy policy = new TokenomicsPolicy();
        EpochLedger crashed = new EpochLedger(dataDir.resolve("ledger").resolve("epochs.json"), policy);
        MintAuthority authority = crashed.claimMintAuthority();
        crashed.reserve(authority, 0, "c-crash", Tier.SILVER, 500);
        crashed.advance(authority, 0, AdvanceCause.OPERATOR_REQUEST);

        TokenomicsCoordinator coordinator = TokenomicsCoordinator.open(dataDir, policy);
        CertificationResult result = coordinator.submitForCertification("c-crash", "carol", STRONG);

        assertEquals(CertificationStatus.CERTIFIED, result.getStatus());
        assertEquals(Tier.SILVER, result.getTier());
        assertEquals(500L, result.getAmount());
        assertEquals(0, (int) result.getEpochIndex());
        assertEquals(500L, coordinator.getStatistics().getTotalReserved());
        assertEquals(0, coordinator.getEvaluations("c-crash").get(0).getEpochIndex());
    }

    @Test
    void onChainRefRoundTrip() {
        TokenomicsCoordinator coordinator = TokenomicsCoordinator.open(dataDir, new TokenomicsPolicy());
        coordinator.submitForCertification("c-1", "alice", STRONG);

        assertTrue(coordinator.onChainRefFor("c-1").isEmpty());
        coordinator.attachOnChainRef("c-1", "0xabc");
        coordinator.attachOnChainRef("c-1", "0xabc");
        assertThrows(ConflictingOnChainRefException.class, () -> coordinator.attachOnChainRef("c-1", "0xdef"));
        assertThrows(NotRegisteredException.class, () -> coordinator.attachOnChainRef("c-unknown", "0xabc"));

        assertEquals("0xabc", coordinator.onChainRefFor("c-1").orElseThrow());
    }

    @Test
    void stateSurvivesRestart() {
        TokenomicsPolicy policy = new TokenomicsPolicy();
        TokenomicsCoordinator coordinator = TokenomicsCoordinator.open(dataDir, policy);
        coordinator.submitForCertification("c-1", "alice", STRONG);
        coordinator.advanceEpoch("operator-1");
        coordinator.attachOnChainRef("c-1", "0xabc");

        TokenomicsCoordinator reopened = TokenomicsCoordinator.open(dataDir, policy);

        EpochStatus status = reopened.getEpochStatus();
        assertEquals(1, status.getIndex());
        assertEquals("pioneer", status.getName());
        assertEquals(1, reopened.getTotalCertified());
        assertEquals("0xabc", reopened.onChainRefFor("c-1").orElseThrow());
        assertEquals(CertificationStatus.ALREADY_CERTIFIED,
            reopened.submitForCertification("c-1", "alice", STRONG).getStatus());
        assertEquals(1, reopened.getTransitions().size());
        assertEquals(AdvanceCause.OPERATOR_REQUEST, reopened.getTransitions().get(0).getCause());
    }

    @Test
    void statisticsSummarizeTheLedger() {
        TokenomicsCoordinator coordinator = TokenomicsCoordinator.open(dataDir, new TokenomicsPolicy());
        coordinator.submitForCertification("c-1", "alice", STRONG);
        coordinator.submitForCertification("c-2", "bob", new MetricVector(0.2, 0.1, 0.1, 0.0));
        coordinator.submitForCertification("c-3", "bob", new MetricVector(0, 0, 0, 0));

        TokenomicsStats stats = coordinator.getStatistics();

        assertEquals(0, stats.getCurrentEpochIndex());
        assertEquals("founder", stats.getCurrentEpochName());
        assertEquals(2, stats.getTotalCertified());
        assertEquals(2, stats.getHolderCount());
        assertEquals(stats.getTotalReserved(), stats.getTotalDistributed());
        assertEquals(1_000_000L - stats.getTotalReserved(), stats.getCurrentEmissionBudget());
    }

    @Test
    void advanceRequiresAnOperator() {
        TokenomicsCoordinator coordinator = TokenomicsCoordinator.open(dataDir, new TokenomicsPolicy());
        assertThrows(IllegalArgumentException.class, () -> coordinator.advanceEpoch(""));
        assertEquals(0, coordinator.getEpochStatus().getIndex());
    }

    @Test
    void concurrentSubmissionsOfOneContributionCertifyOnce() throws Exception {
        TokenomicsCoordinator coordinator = TokenomicsCoordinator.open(dataDir, new TokenomicsPolicy());
        int callers = 12;
        ExecutorService pool = Executors.newFixedThreadPool(callers);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<CertificationResult>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < callers; i++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    return coordinator.submitForCertification("c-race", "alice", STRONG);
                }));
            }
            start.countDown();

            int certified = 0;
            for (Future<CertificationResult> future : futures) {
                CertificationResult result = future.get(10, TimeUnit.SECONDS);
                assertNotEquals(CertificationStatus.NOT_CERTIFIED, result.getStatus());
                assertEquals(10_000L, result.getAmount());
                if (result.getStatus() == CertificationStatus.CERTIFIED) {
                    certified++;
                }
            }
            assertEquals(1, certified);
            assertEquals(1, coordinator.getTotalCertified());
            assertEquals(10_000L, coordinator.getStatistics().getTotalReserved());
            assertEquals(10_000L, coordinator.getBalance("alice"));
        } finally {
            pool.shutdownNow();
        }
    }
}
