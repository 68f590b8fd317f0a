package com.certledger;

import com.certledger.models.AdvanceCause;
import com.certledger.models.Certificate;
import com.certledger.models.CertificationResult;
import com.certledger.models.CertificationStatus;
import com.certledger.models.Epoch;
import com.certledger.models.EpochStatus;
import com.certledger.models.EpochTransition;
import com.certledger.models.Evaluation;
import com.certledger.models.MetricVector;
import com.certledger.models.RegistrationResult;
import com.certledger.models.TokenAllocation;
import com.certledger.models.TokenomicsStats;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Drives one submission through classification, allocation and registration.
 *
 * <p>Every step after classification is idempotent per contribution, so a
 * caller may replay a submission from the start after any failure. Once
 * budget has been reserved the run always ends in a registered certificate.</p>
 */
public class TokenomicsCoordinator {

    private final TierClassifier classifier;
    private final EpochLedger ledger;
    private final AllocationEngine allocationEngine;
    private final CertificateRegistry registry;
    private final EvaluationLog evaluationLog;
    private final MintAuthority ledgerAuthority;
    private final MintAuthority registryAuthority;

    public TokenomicsCoordinator(TokenomicsPolicy policy, EpochLedger ledger, CertificateRegistry registry,
                                 EvaluationLog evaluationLog, Path allocationStoragePath) {
        Objects.requireNonNull(policy, "policy");
        this.ledger = Objects.requireNonNull(ledger, "ledger");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.evaluationLog = Objects.requireNonNull(evaluationLog, "evaluationLog");
        this.classifier = new TierClassifier(policy);
        this.ledgerAuthority = ledger.claimMintAuthority();
        this.registryAuthority = registry.claimMintAuthority();
        this.allocationEngine = new AllocationEngine(ledger, ledgerAuthority, policy, allocationStoragePath);
    }

    /**
     * Wires a coordinator over the standard file layout under {@code dataDir}.
     */
    public static TokenomicsCoordinator open(Path dataDir, TokenomicsPolicy policy) {
        EpochLedger ledger = new EpochLedger(dataDir.resolve("ledger").resolve("epochs.json"), policy);
        CertificateRegistry registry = new CertificateRegistry(dataDir.resolve("registry").resolve("certificates.json"));
        EvaluationLog evaluations = new EvaluationLog(dataDir.resolve("evaluations").resolve("evaluations.json"));
        return new TokenomicsCoordinator(policy, ledger, registry, evaluations,
            dataDir.resolve("ledger").resolve("allocations.json"));
    }

    public CertificationResult submitForCertification(String contributionId, String contributorId, MetricVector metrics) {
        if (contributionId == null || contributionId.isBlank()) {
            throw new IllegalArgumentException("contributionId is required");
        }
        if (contributorId == null || contributorId.isBlank()) {
            throw new IllegalArgumentException("contributorId is required");
        }
        classifier.validate(metrics);

        Optional<Certificate> existing = registry.lookup(contributionId);
        if (existing.isPresent()) {
            log("Replay for already certified " + contributionId);
            return CertificationResult.certified(CertificationStatus.ALREADY_CERTIFIED, existing.get(),
                justificationFor(contributionId));
        }

        // A reservation left by an interrupted run pins the epoch the contribution was judged in.
        TokenAllocation pending = allocationEngine.find(contributionId);
        if (pending != null) {
            Epoch judgedIn = ledger.getEpoch(pending.getEpochIndex());
            Evaluation evaluation = evaluationLog.record(classifier.classify(contributionId, metrics, judgedIn));
            log("Resuming " + contributionId + " from its existing allocation in epoch " + pending.getEpochIndex());
            return register(contributionId, contributorId, pending, evaluation);
        }

        Evaluation evaluation = evaluationLog.record(classifier.classify(contributionId, metrics, ledger.currentEpoch()));
        if (!evaluation.getTier().isRewarded()) {
            log("Not certified: " + contributionId + " (" + evaluation.getJustification() + ")");
            return CertificationResult.notCertified(evaluation);
        }

        TokenAllocation allocation = allocationEngine.allocate(contributionId, evaluation.getTier());
        return register(contributionId, contributorId, allocation, evaluation);
    }

    private CertificationResult register(String contributionId, String contributorId,
                                         TokenAllocation allocation, Evaluation evaluation) {
        RegistrationResult registration = registry.register(registryAuthority, contributionId, contributorId,
            allocation, evaluation.getScore());
        CertificationStatus status = registration.isCreated()
            ? CertificationStatus.CERTIFIED
            : CertificationStatus.ALREADY_CERTIFIED;
        return CertificationResult.certified(status, registration.getCertificate(), evaluation.getJustification());
    }

    public Certificate attachOnChainRef(String contributionId, String onChainRef) {
        return registry.attachOnChainRef(contributionId, onChainRef);
    }

    public Optional<String> onChainRefFor(String contributionId) {
        return registry.lookup(contributionId).map(Certificate::getOnChainRef);
    }

    public Optional<Certificate> getCertificate(String contributionId) {
        return registry.lookup(contributionId);
    }

    public long getTotalCertified() {
        return registry.count();
    }

    public EpochStatus getEpochStatus() {
        return new EpochStatus(ledger.currentEpoch());
    }

    public List<Epoch> listEpochs() {
        return ledger.listEpochs();
    }

    public List<EpochTransition> getTransitions() {
        return ledger.transitions();
    }

    /**
     * Operator-triggered advance of the currently active epoch.
     */
    public EpochStatus advanceEpoch(String operatorId) {
        if (operatorId == null || operatorId.isBlank()) {
            throw new IllegalArgumentException("operatorId is required");
        }
        Epoch current = ledger.currentEpoch();
        log("Operator " + operatorId + " requested advance of epoch " + current.getIndex());
        return new EpochStatus(ledger.advance(ledgerAuthority, current.getIndex(), AdvanceCause.OPERATOR_REQUEST));
    }

    public long getBalance(String contributorId) {
        return registry.balanceOf(contributorId);
    }

    public List<Certificate> getCertificatesFor(String contributorId) {
        return registry.listByContributor(contributorId);
    }

    public List<Evaluation> getEvaluations(String contributionId) {
        return evaluationLog.history(contributionId);
    }

    public TokenomicsStats getStatistics() {
        Epoch current = ledger.currentEpoch();
        TokenomicsStats stats = new TokenomicsStats();
        stats.setCurrentEpochIndex(current.getIndex());
        stats.setCurrentEpochName(current.getName());
        stats.setCurrentEmissionBudget(current.getEmissionBudget());
        stats.setEpochCount(current.getIndex() + 1);
        stats.setTransitionCount(ledger.transitions().size());
        stats.setTotalReserved(ledger.totalReserved());
        stats.setTotalDistributed(registry.totalDistributed());
        stats.setTotalCertified(registry.count());
        stats.setHolderCount(registry.holderCount());
        return stats;
    }

    private String justificationFor(String contributionId) {
        Evaluation latest = evaluationLog.latest(contributionId);
        return latest != null ? latest.getJustification() : null;
    }

    private void log(String message) {
        AppLogger logger = AppLogger.get();
        if (logger != null) {
            logger.info("[TokenomicsCoordinator] " + message);
        }
    }
}
