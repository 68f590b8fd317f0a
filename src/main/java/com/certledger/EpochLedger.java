package com.certledger;

import com.certledger.errors.AdvanceRefusedException;
import com.certledger.errors.EpochClosedException;
import com.certledger.errors.LedgerPersistenceException;
import com.certledger.models.AdvanceCause;
import com.certledger.models.Epoch;
import com.certledger.models.EpochState;
import com.certledger.models.EpochTransition;
import com.certledger.models.LedgerSnapshot;
import com.certledger.models.Reservation;
import com.certledger.models.ReservationResult;
import com.certledger.models.Tier;
import com.certledger.storage.JsonStorage;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owns the append-only epoch sequence and is the only writer of emission
 * budgets. Each epoch has its own lock; reservation and advance against the
 * active epoch serialize on it, nothing else does.
 *
 * <p>Every debit is journaled as a {@link Reservation} keyed by contribution
 * and persisted in the same document as the budget, so replays never debit twice.</p>
 */
public class EpochLedger {

    private final Path storagePath;
    private final TokenomicsPolicy policy;
    private final EpochAdvancePolicy advancePolicy;
    private final MintAuthority authority = new MintAuthority("epoch-ledger");
    private final AtomicBoolean authorityClaimed = new AtomicBoolean(false);

    private final List<EpochSlot> slots = new CopyOnWriteArrayList<>();
    private final Map<String, Reservation> reservations = new ConcurrentHashMap<>();
    private final List<EpochTransition> transitions = new CopyOnWriteArrayList<>();
    private final Object storageLock = new Object();
    private volatile int activeIndex;

    public EpochLedger(Path storagePath, TokenomicsPolicy policy) {
        this(storagePath, policy, EpochAdvancePolicy.standard());
    }

    public EpochLedger(Path storagePath, TokenomicsPolicy policy, EpochAdvancePolicy advancePolicy) {
        this.storagePath = Objects.requireNonNull(storagePath, "storagePath");
        this.policy = Objects.requireNonNull(policy, "policy").copy();
        this.advancePolicy = Objects.requireNonNull(advancePolicy, "advancePolicy");
        loadFromDisk();
        if (slots.isEmpty()) {
            genesis();
        }
    }

    /**
     * Hands out the ledger's capability token. Callable once per ledger.
     */
    public MintAuthority claimMintAuthority() {
        if (!authorityClaimed.compareAndSet(false, true)) {
            throw new SecurityException("Epoch ledger mint authority was already claimed");
        }
        return authority;
    }

    public Epoch currentEpoch() {
        return slots.get(activeIndex).snapshot();
    }

    public Epoch getEpoch(int index) {
        if (index < 0 || index >= slots.size()) {
            return null;
        }
        return slots.get(index).snapshot();
    }

    public List<Epoch> listEpochs() {
        List<Epoch> results = new ArrayList<>();
        for (EpochSlot slot : slots) {
            results.add(slot.snapshot());
        }
        return results;
    }

    public List<EpochTransition> transitions() {
        List<EpochTransition> results = new ArrayList<>();
        for (EpochTransition transition : transitions) {
            results.add(copyOf(transition));
        }
        return results;
    }

    public Reservation findReservation(String contributionId) {
        if (contributionId == null) {
            return null;
        }
        Reservation reservation = reservations.get(contributionId);
        return reservation != null ? reservation.copy() : null;
    }

    public long totalReserved() {
        long total = 0;
        for (Reservation reservation : reservations.values()) {
            total += reservation.getAmount();
        }
        return total;
    }

    public int reservationCount() {
        return reservations.size();
    }

    /**
     * Debits {@code amount} from the named epoch for one contribution. Fails
     * without side effect when the epoch is closed or cannot cover the amount.
     * A contribution that already holds a reservation gets it back unchanged.
     */
    public ReservationResult reserve(MintAuthority caller, int epochIndex, String contributionId, Tier tier, long amount) {
        verify(caller);
        if (contributionId == null || contributionId.isBlank()) {
            throw new IllegalArgumentException("contributionId is required");
        }
        if (tier == null || !tier.isRewarded()) {
            throw new IllegalArgumentException("A rewarded tier is required to reserve budget");
        }
        if (amount <= 0) {
            throw new IllegalArgumentException("Reservation amount must be positive: " + amount);
        }
        EpochSlot slot = slotAt(epochIndex);

        Reservation existing = reservations.get(contributionId);
        if (existing != null) {
            return ReservationResult.reserved(existing.copy(), remainingOf(existing.getEpochIndex()));
        }

        slot.lock.lock();
        try {
            existing = reservations.get(contributionId);
            if (existing != null) {
                return ReservationResult.reserved(existing.copy(), remainingOf(existing.getEpochIndex()));
            }
            Epoch epoch = slot.epoch;
            if (!epoch.isActive()) {
                return ReservationResult.epochClosed(epochIndex, amount);
            }
            long before = epoch.getEmissionBudget();
            if (amount > before) {
                return ReservationResult.insufficientBudget(epochIndex, amount, before);
            }

            Reservation reservation = new Reservation(contributionId, epochIndex, tier, amount, System.currentTimeMillis());
            Reservation raced = reservations.putIfAbsent(contributionId, reservation);
            if (raced != null) {
                return ReservationResult.reserved(raced.copy(), remainingOf(raced.getEpochIndex()));
            }
            epoch.setEmissionBudget(before - amount);
            try {
                persist();
            } catch (LedgerPersistenceException e) {
                epoch.setEmissionBudget(before);
                reservations.remove(contributionId);
                throw e;
            }
            log("Reserved " + amount + " for " + contributionId + " in epoch " + epochIndex
                + " (" + epoch.getEmissionBudget() + " left)");
            return ReservationResult.reserved(reservation.copy(), epoch.getEmissionBudget());
        } finally {
            slot.lock.unlock();
        }
    }

    /**
     * Closes the active epoch {@code fromIndex} and opens the next one.
     *
     * @throws EpochClosedException    if {@code fromIndex} is not the active epoch
     * @throws AdvanceRefusedException if the advance policy rejects the cause
     */
    public Epoch advance(MintAuthority caller, int fromIndex, AdvanceCause cause, long pendingAmount) {
        verify(caller);
        Objects.requireNonNull(cause, "cause");
        EpochSlot slot = slotAt(fromIndex);

        slot.lock.lock();
        try {
            Epoch closing = slot.epoch;
            if (!closing.isActive()) {
                throw new EpochClosedException(fromIndex);
            }
            if (!advancePolicy.permits(closing.copy(), cause, pendingAmount)) {
                throw new AdvanceRefusedException(fromIndex, cause);
            }

            long now = System.currentTimeMillis();
            Epoch next = buildEpoch(fromIndex + 1, closing, now);

            EpochTransition transition = new EpochTransition();
            transition.setFromIndex(fromIndex);
            transition.setToIndex(next.getIndex());
            transition.setCause(cause);
            transition.setRemainingBudget(closing.getEmissionBudget());
            transition.setNextBudget(next.getEmissionBudget());
            transition.setTransitionedAt(now);

            // Publish only after the closed and opened epochs are on disk.
            Epoch closed = closing.copy();
            closed.setState(EpochState.CLOSED);
            closed.setClosedAt(now);
            persist(closed, next, transition);

            closing.setState(EpochState.CLOSED);
            closing.setClosedAt(now);
            slots.add(new EpochSlot(next));
            transitions.add(transition);
            activeIndex = next.getIndex();
            log("Epoch " + fromIndex + " closed (" + cause + ", " + transition.getRemainingBudget()
                + " unminted); epoch " + next.getIndex() + " '" + next.getName() + "' opened with budget "
                + next.getEmissionBudget());
            return next.copy();
        } finally {
            slot.lock.unlock();
        }
    }

    public Epoch advance(MintAuthority caller, int fromIndex, AdvanceCause cause) {
        return advance(caller, fromIndex, cause, 0L);
    }

    private void genesis() {
        Epoch founder = new Epoch();
        founder.setIndex(0);
        founder.setName(policy.epochName(0));
        founder.setStartedAt(System.currentTimeMillis());
        founder.setInitialBudget(policy.getBaseBudget());
        founder.setEmissionBudget(policy.getBaseBudget());
        founder.setThresholds(policy.getFounderThresholds());
        founder.setDecayFactor(policy.getDecayFactor());
        founder.setState(EpochState.ACTIVE);
        slots.add(new EpochSlot(founder));
        activeIndex = 0;
        persist();
        log("Genesis: founder epoch opened with budget " + founder.getEmissionBudget());
    }

    private Epoch buildEpoch(int index, Epoch previous, long now) {
        long budget = (long) Math.floor(policy.getBaseBudget() * Math.pow(policy.getDecayFactor(), index));
        Epoch epoch = new Epoch();
        epoch.setIndex(index);
        epoch.setName(policy.epochName(index));
        epoch.setStartedAt(now);
        epoch.setInitialBudget(budget);
        epoch.setEmissionBudget(budget);
        epoch.setThresholds(nextThresholds(index, previous.getThresholds()));
        epoch.setDecayFactor(policy.getDecayFactor());
        epoch.setState(EpochState.ACTIVE);
        return epoch;
    }

    Map<Tier, Double> nextThresholds(int index, Map<Tier, Double> previous) {
        Map<Tier, Double> next = new EnumMap<>(Tier.class);
        for (Tier tier : Tier.values()) {
            if (!tier.isRewarded()) {
                continue;
            }
            Double prior = previous.get(tier);
            Double base = index == 1 ? policy.getBaseThresholds().get(tier) : null;
            if (base != null && (prior == null || base > prior)) {
                next.put(tier, base);
            } else if (prior != null) {
                next.put(tier, raise(prior));
            }
        }
        return next;
    }

    // Strictly above prior while staying within [0,1]; 1.0 cannot rise further.
    private double raise(double prior) {
        if (prior >= 1.0) {
            return 1.0;
        }
        double raised = prior + policy.getThresholdStep();
        if (raised > 1.0) {
            raised = prior + (1.0 - prior) / 2.0;
        }
        return raised > prior ? raised : Math.nextUp(prior);
    }

    // Informational only; read without the slot lock so nested reserves never lock two slots.
    private long remainingOf(int epochIndex) {
        return slots.get(epochIndex).epoch.getEmissionBudget();
    }

    private EpochSlot slotAt(int index) {
        if (index < 0 || index >= slots.size()) {
            throw new IllegalArgumentException("Unknown epoch index: " + index);
        }
        return slots.get(index);
    }

    private void verify(MintAuthority caller) {
        if (caller != authority) {
            throw new SecurityException("Caller does not hold the epoch ledger mint authority");
        }
    }

    private void persist() {
        persist(null, null, null);
    }

    /**
     * Writes the current state, with {@code closed} replacing its slot and
     * {@code opened} and {@code transition} appended when given.
     */
    private void persist(Epoch closed, Epoch opened, EpochTransition transition) {
        synchronized (storageLock) {
            LedgerSnapshot snapshot = new LedgerSnapshot();
            List<Epoch> epochs = new ArrayList<>();
            for (EpochSlot slot : slots) {
                epochs.add(slot.epoch.copy());
            }
            if (closed != null) {
                epochs.set(closed.getIndex(), closed.copy());
            }
            if (opened != null) {
                epochs.add(opened.copy());
            }
            List<Reservation> journal = new ArrayList<>();
            for (Reservation reservation : reservations.values()) {
                journal.add(reservation.copy());
            }
            journal.sort(Comparator.comparingLong(Reservation::getReservedAt)
                .thenComparing(Reservation::getContributionId));
            snapshot.setEpochs(epochs);
            snapshot.setReservations(journal);
            List<EpochTransition> history = new ArrayList<>(transitions);
            if (transition != null) {
                history.add(transition);
            }
            snapshot.setTransitions(history);
            snapshot.setSavedAt(System.currentTimeMillis());
            try {
                JsonStorage.writeJson(storagePath, snapshot);
            } catch (IOException e) {
                logWarning("Failed to save ledger to " + storagePath + ": " + e.getMessage());
                throw new LedgerPersistenceException("Failed to persist ledger state to " + storagePath, e);
            }
        }
    }

    private void loadFromDisk() {
        LedgerSnapshot snapshot;
        try {
            snapshot = JsonStorage.readJson(storagePath, LedgerSnapshot.class);
        } catch (IOException e) {
            // A lost ledger must not silently restart at genesis.
            throw new IllegalStateException("Unreadable ledger state at " + storagePath + ": " + e.getMessage(), e);
        }
        if (snapshot == null) {
            log("No ledger found at " + storagePath + "; starting at genesis.");
            return;
        }

        List<Epoch> epochs = new ArrayList<>(snapshot.getEpochs());
        epochs.sort(Comparator.comparingInt(Epoch::getIndex));
        int active = -1;
        for (int i = 0; i < epochs.size(); i++) {
            Epoch epoch = epochs.get(i);
            if (epoch.getIndex() != i) {
                throw new IllegalStateException("Ledger epochs are not contiguous at index " + i);
            }
            if (epoch.getEmissionBudget() < 0) {
                throw new IllegalStateException("Ledger epoch " + i + " has a negative budget");
            }
            if (epoch.isActive()) {
                if (active >= 0) {
                    throw new IllegalStateException("Ledger has more than one active epoch");
                }
                active = i;
            }
        }
        if (!epochs.isEmpty() && active != epochs.size() - 1) {
            throw new IllegalStateException("Only the latest ledger epoch may be active");
        }
        for (Epoch epoch : epochs) {
            slots.add(new EpochSlot(epoch));
        }
        activeIndex = Math.max(active, 0);
        for (Reservation reservation : snapshot.getReservations()) {
            if (reservation != null && reservation.getContributionId() != null) {
                reservations.put(reservation.getContributionId(), reservation);
            }
        }
        transitions.addAll(snapshot.getTransitions());
        log("Loaded " + epochs.size() + " epoch(s) and " + reservations.size() + " reservation(s) from disk.");
    }

    private EpochTransition copyOf(EpochTransition source) {
        EpochTransition copy = new EpochTransition();
        copy.setFromIndex(source.getFromIndex());
        copy.setToIndex(source.getToIndex());
        copy.setCause(source.getCause());
        copy.setRemainingBudget(source.getRemainingBudget());
        copy.setNextBudget(source.getNextBudget());
        copy.setTransitionedAt(source.getTransitionedAt());
        return copy;
    }

    private void log(String message) {
        AppLogger logger = AppLogger.get();
        if (logger != null) {
            logger.info("[EpochLedger] " + message);
        }
    }

    private void logWarning(String message) {
        AppLogger logger = AppLogger.get();
        if (logger != null) {
            logger.warn("[EpochLedger] " + message);
        }
    }

    private static final class EpochSlot {
        private final ReentrantLock lock = new ReentrantLock();
        private final Epoch epoch;

        private EpochSlot(Epoch epoch) {
            this.epoch = epoch;
        }

        private Epoch snapshot() {
            lock.lock();
            try {
                return epoch.copy();
            } finally {
                lock.unlock();
            }
        }
    }
}
