package com.certledger;

import com.certledger.models.Tier;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Persists the tokenomics policy so operator edits survive restarts.
 * Stored values overlay the defaults field by field; missing or nonsensical
 * entries fall back to the default.
 */
public class TokenomicsPolicyStore {

    private final ObjectMapper mapper;
    private final Path storagePath;
    private final AppLogger logger = AppLogger.get();

    public TokenomicsPolicyStore(ObjectMapper mapper, Path storagePath) {
        this.mapper = mapper;
        this.storagePath = storagePath;
    }

    public Path getStoragePath() {
        return storagePath;
    }

    /**
     * Reads the stored policy merged over {@code defaults}. On first start the
     * defaults are written out so operators have a file to edit. A stored
     * policy that merges into an invalid one is rejected rather than run.
     */
    public TokenomicsPolicy loadOrDefault(TokenomicsPolicy defaults) {
        TokenomicsPolicy base = defaults != null ? defaults.copy() : new TokenomicsPolicy();
        if (!Files.exists(storagePath)) {
            validate(base);
            save(base);
            return base;
        }

        TokenomicsPolicy stored;
        try {
            stored = mapper.readValue(storagePath.toFile(), TokenomicsPolicy.class);
        } catch (Exception e) {
            logWarn("Failed to read policy, using defaults: " + e.getMessage());
            validate(base);
            return base;
        }
        TokenomicsPolicy merged = merge(base, stored);
        validate(merged);
        log("Loaded tokenomics policy from " + storagePath);
        return merged;
    }

    public void save(TokenomicsPolicy policy) {
        if (policy == null) return;
        try {
            if (storagePath.getParent() != null) {
                Files.createDirectories(storagePath.getParent());
            }
            mapper.writerWithDefaultPrettyPrinter().writeValue(storagePath.toFile(), policy);
            log("Saved tokenomics policy to " + storagePath);
        } catch (IOException e) {
            logWarn("Failed to save tokenomics policy: " + e.getMessage());
        }
    }

    /**
     * Throws {@link IllegalArgumentException} naming the first setting that
     * cannot drive a ledger.
     */
    public static void validate(TokenomicsPolicy policy) {
        if (policy == null) {
            throw new IllegalArgumentException("policy is required");
        }
        if (policy.getBaseBudget() <= 0) {
            throw new IllegalArgumentException("baseBudget must be positive, was " + policy.getBaseBudget());
        }
        double decay = policy.getDecayFactor();
        if (Double.isNaN(decay) || decay <= 0.0 || decay > 1.0) {
            throw new IllegalArgumentException("decayFactor must be in (0, 1], was " + decay);
        }
        double step = policy.getThresholdStep();
        if (Double.isNaN(step) || step <= 0.0 || step >= 1.0) {
            throw new IllegalArgumentException("thresholdStep must be in (0, 1), was " + step);
        }
        for (Tier tier : Tier.values()) {
            if (tier.isRewarded() && policy.rewardFor(tier) <= 0) {
                throw new IllegalArgumentException("reward for " + tier + " must be positive");
            }
        }
        validateThresholds("founderThresholds", policy.getFounderThresholds());
        validateThresholds("baseThresholds", policy.getBaseThresholds());
        for (Tier tier : Tier.values()) {
            if (tier.isRewarded()
                && policy.getBaseThresholds().get(tier) <= policy.getFounderThresholds().get(tier)) {
                throw new IllegalArgumentException("baseThresholds." + tier
                    + " must exceed the founder threshold");
            }
        }
        validateWeight("coherenceWeight", policy.getCoherenceWeight());
        validateWeight("densityWeight", policy.getDensityWeight());
        validateWeight("noveltyWeight", policy.getNoveltyWeight());
        validateWeight("redundancyWeight", policy.getRedundancyWeight());
        if (policy.getScoringTimeoutSeconds() <= 0) {
            throw new IllegalArgumentException("scoringTimeoutSeconds must be positive");
        }
    }

    private static void validateThresholds(String name, Map<Tier, Double> thresholds) {
        if (thresholds == null) {
            throw new IllegalArgumentException(name + " is required");
        }
        if (thresholds.containsKey(Tier.REJECTED)) {
            throw new IllegalArgumentException(name + " must not define REJECTED");
        }
        double previous = -1.0;
        for (Tier tier : Tier.values()) {
            if (!tier.isRewarded()) {
                continue;
            }
            Double value = thresholds.get(tier);
            if (value == null || value.isNaN() || value < 0.0 || value > 1.0) {
                throw new IllegalArgumentException(name + "." + tier + " must be in [0, 1], was " + value);
            }
            if (value <= previous) {
                throw new IllegalArgumentException(name + "." + tier + " must exceed the tier below it");
            }
            previous = value;
        }
    }

    private static void validateWeight(String name, double value) {
        if (Double.isNaN(value) || value < 0.0) {
            throw new IllegalArgumentException(name + " must be non-negative, was " + value);
        }
    }

    private TokenomicsPolicy merge(TokenomicsPolicy base, TokenomicsPolicy stored) {
        if (stored == null) {
            return base;
        }
        TokenomicsPolicy result = base.copy();
        if (stored.getBaseBudget() > 0) result.setBaseBudget(stored.getBaseBudget());
        if (stored.getDecayFactor() > 0) result.setDecayFactor(stored.getDecayFactor());
        if (stored.getThresholdStep() > 0) result.setThresholdStep(stored.getThresholdStep());
        if (stored.getScoringTimeoutSeconds() > 0) result.setScoringTimeoutSeconds(stored.getScoringTimeoutSeconds());
        result.setCoherenceWeight(stored.getCoherenceWeight());
        result.setDensityWeight(stored.getDensityWeight());
        result.setNoveltyWeight(stored.getNoveltyWeight());
        result.setRedundancyWeight(stored.getRedundancyWeight());
        result.setFounderThresholds(overlay(base.getFounderThresholds(), stored.getFounderThresholds()));
        result.setBaseThresholds(overlay(base.getBaseThresholds(), stored.getBaseThresholds()));
        result.setRewards(overlay(base.getRewards(), stored.getRewards()));
        List<String> names = stored.getEpochNames();
        if (names != null && !names.isEmpty()) {
            result.setEpochNames(names);
        }
        return result;
    }

    private <V> Map<Tier, V> overlay(Map<Tier, V> defaults, Map<Tier, V> stored) {
        Map<Tier, V> result = new EnumMap<>(Tier.class);
        if (defaults != null) {
            result.putAll(defaults);
        }
        if (stored != null) {
            stored.forEach((tier, value) -> {
                if (tier != null && value != null) {
                    result.put(tier, value);
                }
            });
        }
        return result;
    }

    private void log(String message) {
        if (logger != null) {
            logger.info("[TokenomicsPolicyStore] " + message);
        }
    }

    private void logWarn(String message) {
        if (logger != null) {
            logger.warn("[TokenomicsPolicyStore] " + message);
        }
    }
}
