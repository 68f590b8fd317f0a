package com.certledger;

import com.certledger.errors.ConflictingOnChainRefException;
import com.certledger.errors.LedgerPersistenceException;
import com.certledger.errors.NotRegisteredException;
import com.certledger.models.Certificate;
import com.certledger.models.RegistrationResult;
import com.certledger.models.TokenAllocation;
import com.certledger.storage.JsonStorage;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * At most one certificate per contribution, ever. A change is only kept once
 * it is on disk; a failed write is undone and rethrown. Registration is an atomic
 * insert-if-absent on the contribution key, so racing callers on one key see a
 * single winner while different keys never contend.
 */
public class CertificateRegistry {

    private final Map<String, Certificate> certificates = new ConcurrentHashMap<>();
    private final MintAuthority authority = new MintAuthority("certificate-registry");
    private final AtomicBoolean authorityClaimed = new AtomicBoolean(false);
    private final Path storagePath;

    public CertificateRegistry(Path storagePath) {
        this.storagePath = storagePath;
        loadFromDisk();
    }

    public MintAuthority claimMintAuthority() {
        if (!authorityClaimed.compareAndSet(false, true)) {
            throw new SecurityException("Certificate registry mint authority was already claimed");
        }
        return authority;
    }

    public RegistrationResult register(MintAuthority caller, String contributionId, String contributorId,
                                       TokenAllocation allocation, double score) {
        if (caller != authority) {
            throw new SecurityException("Caller does not hold the certificate registry mint authority");
        }
        if (contributionId == null || contributionId.isBlank()) {
            throw new IllegalArgumentException("contributionId is required");
        }
        if (contributorId == null || contributorId.isBlank()) {
            throw new IllegalArgumentException("contributorId is required");
        }
        if (allocation == null) {
            throw new IllegalArgumentException("allocation is required");
        }
        if (!contributionId.equals(allocation.getContributionId())) {
            throw new IllegalArgumentException("Allocation belongs to " + allocation.getContributionId()
                + ", not " + contributionId);
        }

        Certificate existing = certificates.get(contributionId);
        if (existing != null) {
            return RegistrationResult.alreadyRegistered(existing.copy());
        }

        Certificate candidate = new Certificate();
        candidate.setContributionId(contributionId);
        candidate.setContributorId(contributorId);
        candidate.setTier(allocation.getTier());
        candidate.setAmount(allocation.getAmount());
        candidate.setEpochIndex(allocation.getEpochIndex());
        candidate.setScore(score);
        candidate.setRegisteredAt(System.currentTimeMillis());

        Certificate winner = certificates.putIfAbsent(contributionId, candidate);
        if (winner != null) {
            return RegistrationResult.alreadyRegistered(winner.copy());
        }
        try {
            saveAll();
        } catch (LedgerPersistenceException e) {
            certificates.remove(contributionId, candidate);
            throw e;
        }
        log("Certificate registered: " + contributionId + " -> " + contributorId
            + " (" + candidate.getTier() + ", " + candidate.getAmount() + ")");
        return RegistrationResult.created(candidate.copy());
    }

    /**
     * Records where the certificate was anchored. Attaching the same reference
     * again is a no-op; a different reference is refused.
     */
    public Certificate attachOnChainRef(String contributionId, String onChainRef) {
        if (contributionId == null || contributionId.isBlank()) {
            throw new IllegalArgumentException("contributionId is required");
        }
        if (onChainRef == null || onChainRef.isBlank()) {
            throw new IllegalArgumentException("onChainRef is required");
        }
        AtomicReference<Certificate> unanchored = new AtomicReference<>();
        Certificate updated = certificates.computeIfPresent(contributionId, (key, current) -> {
            if (current.getOnChainRef() == null) {
                Certificate enriched = current.copy();
                enriched.setOnChainRef(onChainRef);
                unanchored.set(current);
                return enriched;
            }
            if (current.getOnChainRef().equals(onChainRef)) {
                return current;
            }
            throw new ConflictingOnChainRefException(contributionId, current.getOnChainRef(), onChainRef);
        });
        if (updated == null) {
            throw new NotRegisteredException(contributionId);
        }
        if (unanchored.get() != null) {
            try {
                saveAll();
            } catch (LedgerPersistenceException e) {
                certificates.replace(contributionId, updated, unanchored.get());
                throw e;
            }
            log("Certificate anchored: " + contributionId + " at " + onChainRef);
        }
        return updated.copy();
    }

    public Optional<Certificate> lookup(String contributionId) {
        if (contributionId == null) {
            return Optional.empty();
        }
        Certificate certificate = certificates.get(contributionId);
        return certificate != null ? Optional.of(certificate.copy()) : Optional.empty();
    }

    public long count() {
        return certificates.size();
    }

    public List<Certificate> listAll() {
        List<Certificate> results = new ArrayList<>();
        for (Certificate certificate : certificates.values()) {
            results.add(certificate.copy());
        }
        results.sort(Comparator.comparingLong(Certificate::getRegisteredAt)
            .thenComparing(Certificate::getContributionId));
        return results;
    }

    public List<Certificate> listByContributor(String contributorId) {
        List<Certificate> results = new ArrayList<>();
        if (contributorId == null || contributorId.isBlank()) {
            return results;
        }
        for (Certificate certificate : certificates.values()) {
            if (contributorId.equals(certificate.getContributorId())) {
                results.add(certificate.copy());
            }
        }
        results.sort(Comparator.comparingLong(Certificate::getRegisteredAt));
        return results;
    }

    /**
     * Tokens certified to one contributor across all epochs.
     */
    public long balanceOf(String contributorId) {
        long balance = 0;
        for (Certificate certificate : listByContributor(contributorId)) {
            balance += certificate.getAmount();
        }
        return balance;
    }

    public long totalDistributed() {
        long total = 0;
        for (Certificate certificate : certificates.values()) {
            total += certificate.getAmount();
        }
        return total;
    }

    public int holderCount() {
        Set<String> holders = new HashSet<>();
        for (Certificate certificate : certificates.values()) {
            holders.add(certificate.getContributorId());
        }
        return holders.size();
    }

    private void loadFromDisk() {
        if (storagePath == null) {
            logWarning("No certificate storage path resolved; starting empty.");
            return;
        }
        try {
            List<Certificate> stored = JsonStorage.readJsonList(storagePath, Certificate[].class);
            for (Certificate certificate : stored) {
                if (certificate != null && certificate.getContributionId() != null) {
                    certificates.putIfAbsent(certificate.getContributionId(), certificate);
                }
            }
            log("Loaded " + stored.size() + " certificate(s) from disk.");
        } catch (Exception e) {
            throw new IllegalStateException("Unreadable certificate registry at " + storagePath + ": " + e.getMessage(), e);
        }
    }

    private synchronized void saveAll() {
        if (storagePath == null) {
            return;
        }
        try {
            JsonStorage.writeJsonList(storagePath, listAll());
        } catch (IOException e) {
            logWarning("Failed to save certificates to " + storagePath + ": " + e.getMessage());
            throw new LedgerPersistenceException("Failed to persist certificates to " + storagePath, e);
        }
    }

    private void log(String message) {
        AppLogger logger = AppLogger.get();
        if (logger != null) {
            logger.info("[CertificateRegistry] " + message);
        }
    }

    private void logWarning(String message) {
        AppLogger logger = AppLogger.get();
        if (logger != null) {
            logger.warn("[CertificateRegistry] " + message);
        }
    }
}
