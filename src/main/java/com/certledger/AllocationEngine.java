package com.certledger;

import com.certledger.errors.AdvanceRefusedException;
import com.certledger.errors.AllocationFailedException;
import com.certledger.errors.EpochClosedException;
import com.certledger.models.AdvanceCause;
import com.certledger.models.Epoch;
import com.certledger.models.Reservation;
import com.certledger.models.ReservationResult;
import com.certledger.models.Tier;
import com.certledger.models.TokenAllocation;
import com.certledger.storage.JsonStorage;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Turns a tier into a token amount and reserves it from the active epoch.
 * At most one allocation exists per contribution; repeated calls return it.
 */
public class AllocationEngine {

    private final EpochLedger ledger;
    private final MintAuthority authority;
    private final TokenomicsPolicy policy;
    private final Path storagePath;
    private final Map<String, TokenAllocation> allocations = new ConcurrentHashMap<>();
    private final Map<String, Object> contributionLocks = new ConcurrentHashMap<>();

    public AllocationEngine(EpochLedger ledger, MintAuthority authority, TokenomicsPolicy policy, Path storagePath) {
        this.ledger = Objects.requireNonNull(ledger, "ledger");
        this.authority = Objects.requireNonNull(authority, "authority");
        this.policy = Objects.requireNonNull(policy, "policy").copy();
        this.storagePath = storagePath;
        loadFromDisk();
    }

    public TokenAllocation allocate(String contributionId, Tier tier) {
        if (contributionId == null || contributionId.isBlank()) {
            throw new IllegalArgumentException("contributionId is required");
        }
        if (tier == null || !tier.isRewarded()) {
            throw new IllegalArgumentException("Tier " + tier + " is not eligible for allocation");
        }

        TokenAllocation existing = allocations.get(contributionId);
        if (existing != null) {
            return existing.copy();
        }

        // A late caller may lock a fresh object after removal; the ledger journal keeps that reserve idempotent.
        Object lock = contributionLocks.computeIfAbsent(contributionId, key -> new Object());
        try {
            synchronized (lock) {
                return allocateLocked(contributionId, tier);
            }
        } finally {
            contributionLocks.remove(contributionId, lock);
        }
    }

    private TokenAllocation allocateLocked(String contributionId, Tier tier) {
        TokenAllocation existing = allocations.get(contributionId);
        if (existing != null) {
            return existing.copy();
        }

        Reservation journaled = ledger.findReservation(contributionId);
        if (journaled != null) {
            log("Recovered allocation for " + contributionId + " from ledger journal (epoch "
                + journaled.getEpochIndex() + ", " + journaled.getAmount() + ")");
            return store(TokenAllocation.fromReservation(journaled));
        }

        Epoch epoch = ledger.currentEpoch();
        long amount = amountFor(tier, epoch);
        ReservationResult result = ledger.reserve(authority, epoch.getIndex(), contributionId, tier, amount);

        if (!result.isReserved()) {
            if (result.getOutcome() == ReservationResult.Outcome.INSUFFICIENT_BUDGET) {
                advanceFrom(contributionId, epoch, amount);
            }
            Epoch retryEpoch = ledger.currentEpoch();
            long retryAmount = amountFor(tier, retryEpoch);
            result = ledger.reserve(authority, retryEpoch.getIndex(), contributionId, tier, retryAmount);
            if (!result.isReserved()) {
                logWarning("Allocation for " + contributionId + " failed after advance: " + result.describe());
                throw new AllocationFailedException(contributionId, retryEpoch.getIndex(), result.describe());
            }
        }
        return store(TokenAllocation.fromReservation(result.getReservation()));
    }

    public TokenAllocation find(String contributionId) {
        if (contributionId == null) {
            return null;
        }
        TokenAllocation allocation = allocations.get(contributionId);
        if (allocation != null) {
            return allocation.copy();
        }
        Reservation journaled = ledger.findReservation(contributionId);
        return journaled != null ? TokenAllocation.fromReservation(journaled) : null;
    }

    public List<TokenAllocation> listAll() {
        List<TokenAllocation> results = new ArrayList<>();
        for (TokenAllocation allocation : allocations.values()) {
            results.add(allocation.copy());
        }
        results.sort(Comparator.comparingLong(TokenAllocation::getAllocatedAt));
        return results;
    }

    int pendingLockCount() {
        return contributionLocks.size();
    }

    /**
     * Reward for {@code tier} scaled by the epoch's decay-adjusted unit value.
     */
    public long amountFor(Tier tier, Epoch epoch) {
        long reward = policy.rewardFor(tier);
        if (reward <= 0) {
            throw new IllegalStateException("No reward configured for tier " + tier);
        }
        double unitValue = (double) epoch.getInitialBudget() / (double) policy.getBaseBudget();
        return Math.max(1L, (long) Math.floor(reward * unitValue));
    }

    private void advanceFrom(String contributionId, Epoch exhausted, long pendingAmount) {
        try {
            ledger.advance(authority, exhausted.getIndex(), AdvanceCause.BUDGET_EXHAUSTED, pendingAmount);
        } catch (EpochClosedException e) {
            log("Epoch " + exhausted.getIndex() + " was already advanced; retrying " + contributionId + " on the new epoch");
        } catch (AdvanceRefusedException e) {
            throw new AllocationFailedException(contributionId, exhausted.getIndex(), e.getMessage());
        }
    }

    private TokenAllocation store(TokenAllocation allocation) {
        allocations.put(allocation.getContributionId(), allocation);
        saveAll();
        return allocation.copy();
    }

    private void loadFromDisk() {
        if (storagePath == null) {
            logWarning("No allocation storage path resolved; starting empty.");
            return;
        }
        try {
            List<TokenAllocation> stored = JsonStorage.readJsonList(storagePath, TokenAllocation[].class);
            for (TokenAllocation allocation : stored) {
                if (allocation != null && allocation.getContributionId() != null) {
                    allocations.put(allocation.getContributionId(), allocation);
                }
            }
            log("Loaded " + stored.size() + " allocation(s) from disk.");
        } catch (Exception e) {
            logWarning("Failed to load allocations from " + storagePath + ": " + e.getMessage());
        }
    }

    // The ledger journal is authoritative, so a failed save is recoverable via find().
    private synchronized void saveAll() {
        if (storagePath == null) {
            return;
        }
        try {
            JsonStorage.writeJsonList(storagePath, listAll());
        } catch (Exception e) {
            logWarning("Failed to save allocations to " + storagePath + ": " + e.getMessage());
        }
    }

    private void log(String message) {
        AppLogger logger = AppLogger.get();
        if (logger != null) {
            logger.info("[AllocationEngine] " + message);
        }
    }

    private void logWarning(String message) {
        AppLogger logger = AppLogger.get();
        if (logger != null) {
            logger.warn("[AllocationEngine] " + message);
        }
    }
}
