package com.certledger.pipeline;

import com.certledger.AppLogger;
import com.certledger.TokenomicsCoordinator;
import com.certledger.errors.ConflictingOnChainRefException;
import com.certledger.errors.NotRegisteredException;
import com.certledger.errors.ScoringUnavailableException;
import com.certledger.models.AnchorReceipt;
import com.certledger.models.AnchorRequest;
import com.certledger.models.Certificate;
import com.certledger.models.CertificationResult;
import com.certledger.models.CertificationStatus;
import com.certledger.models.MetricVector;
import com.certledger.models.ScoringRequest;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Asynchronous edge around the coordinator: waits on the external scorer,
 * runs certification on a worker, then hands new certificates to the anchoring
 * client without waiting for the chain.
 */
public class SubmissionPipeline {

    private final TokenomicsCoordinator coordinator;
    private final MetricScorer scorer;
    private final AnchoringClient anchoringClient;
    private final long scoringTimeoutMs;
    private final ExecutorService executor;
    private final AppLogger logger = AppLogger.get();

    public SubmissionPipeline(TokenomicsCoordinator coordinator, MetricScorer scorer,
                              AnchoringClient anchoringClient, long scoringTimeoutMs, int workers) {
        this.coordinator = Objects.requireNonNull(coordinator, "coordinator");
        this.scorer = Objects.requireNonNull(scorer, "scorer");
        this.anchoringClient = anchoringClient;
        this.scoringTimeoutMs = scoringTimeoutMs > 0 ? scoringTimeoutMs : TimeUnit.SECONDS.toMillis(30);
        this.executor = Executors.newFixedThreadPool(Math.max(1, workers), workerThreadFactory());
    }

    /**
     * Scores and certifies one contribution. The returned future fails with
     * {@link ScoringUnavailableException} when the scorer fails or times out;
     * nothing is recorded in that case.
     */
    public CompletableFuture<CertificationResult> submit(String contributionId, String contributorId) {
        if (contributionId == null || contributionId.isBlank()) {
            throw new IllegalArgumentException("contributionId is required");
        }
        if (contributorId == null || contributorId.isBlank()) {
            throw new IllegalArgumentException("contributorId is required");
        }
        ScoringRequest request = new ScoringRequest(contributionId, contributorId, System.currentTimeMillis());

        return requestScore(request)
            .orTimeout(scoringTimeoutMs, TimeUnit.MILLISECONDS)
            .handle((metrics, error) -> {
                if (error != null) {
                    throw scoringFailure(contributionId, error);
                }
                if (metrics == null) {
                    throw new ScoringUnavailableException(contributionId, "Scorer returned no metrics for " + contributionId);
                }
                return metrics;
            })
            .thenApplyAsync(metrics -> certify(contributionId, contributorId, metrics), executor);
    }

    /**
     * Asks the anchoring client to anchor an already registered certificate.
     * Returns false when there is nothing to do.
     */
    public boolean requestAnchoring(String contributionId) {
        Certificate certificate = coordinator.getCertificate(contributionId)
            .orElseThrow(() -> new NotRegisteredException(contributionId));
        if (anchoringClient == null) {
            logWarning("No anchoring client configured; " + contributionId + " stays unanchored");
            return false;
        }
        if (certificate.getOnChainRef() != null) {
            return false;
        }
        anchoringClient.anchor(new AnchorRequest(certificate, System.currentTimeMillis()), this::onReceipt);
        log("Anchoring requested for " + contributionId);
        return true;
    }

    public void shutdown() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private CompletableFuture<MetricVector> requestScore(ScoringRequest request) {
        try {
            CompletableFuture<MetricVector> future = scorer.score(request);
            if (future == null) {
                return CompletableFuture.failedFuture(new IllegalStateException("Scorer returned no future"));
            }
            return future;
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private CertificationResult certify(String contributionId, String contributorId, MetricVector metrics) {
        CertificationResult result = coordinator.submitForCertification(contributionId, contributorId, metrics);
        if (result.getStatus() == CertificationStatus.CERTIFIED && anchoringClient != null) {
            try {
                requestAnchoring(contributionId);
            } catch (RuntimeException e) {
                logWarning("Anchoring request for " + contributionId + " failed: " + e.getMessage());
            }
        }
        return result;
    }

    private void onReceipt(AnchorReceipt receipt) {
        if (receipt == null) {
            return;
        }
        if (!receipt.isConfirmed()) {
            logWarning("Anchoring failed for " + receipt.getContributionId() + ": " + receipt.getError());
            return;
        }
        try {
            coordinator.attachOnChainRef(receipt.getContributionId(), receipt.getOnChainRef());
        } catch (ConflictingOnChainRefException | NotRegisteredException e) {
            logWarning("Rejected anchor receipt for " + receipt.getContributionId() + ": " + e.getMessage());
        }
    }

    private ScoringUnavailableException scoringFailure(String contributionId, Throwable error) {
        Throwable cause = unwrap(error);
        if (cause instanceof ScoringUnavailableException) {
            return (ScoringUnavailableException) cause;
        }
        if (cause instanceof TimeoutException) {
            logWarning("Scorer timed out after " + scoringTimeoutMs + " ms for " + contributionId);
            return new ScoringUnavailableException(contributionId,
                "Scorer timed out after " + scoringTimeoutMs + " ms", cause);
        }
        logWarning("Scorer failed for " + contributionId + ": " + cause.getMessage());
        return new ScoringUnavailableException(contributionId, "Scorer failed: " + cause.getMessage(), cause);
    }

    private Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
            && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private ThreadFactory workerThreadFactory() {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, "certification-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    private void log(String message) {
        if (logger != null) {
            logger.info("[SubmissionPipeline] " + message);
        }
    }

    private void logWarning(String message) {
        if (logger != null) {
            logger.warn("[SubmissionPipeline] " + message);
        }
    }
}
