package com.certledger;

import com.certledger.models.Tier;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Policy knobs for emission and classification. Field defaults are the
 * shipped policy; {@link TokenomicsPolicyStore} overlays the stored file.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class TokenomicsPolicy {

    private long baseBudget = 1_000_000L;
    private double decayFactor = 0.5;
    private Map<Tier, Double> founderThresholds = defaultFounderThresholds();
    private Map<Tier, Double> baseThresholds = defaultBaseThresholds();
    private double thresholdStep = 0.02;
    private Map<Tier, Long> rewards = defaultRewards();
    private double coherenceWeight = 0.35;
    private double densityWeight = 0.30;
    private double noveltyWeight = 0.35;
    private double redundancyWeight = 0.20;
    private List<String> epochNames = defaultEpochNames();
    private long scoringTimeoutSeconds = 30;

    public long getBaseBudget() {
        return baseBudget;
    }

    public void setBaseBudget(long baseBudget) {
        this.baseBudget = baseBudget;
    }

    public double getDecayFactor() {
        return decayFactor;
    }

    public void setDecayFactor(double decayFactor) {
        this.decayFactor = decayFactor;
    }

    /**
     * Thresholds of the genesis epoch.
     */
    public Map<Tier, Double> getFounderThresholds() {
        return founderThresholds;
    }

    public void setFounderThresholds(Map<Tier, Double> founderThresholds) {
        this.founderThresholds = copyThresholds(founderThresholds);
    }

    /**
     * Thresholds of epoch 1; later epochs raise each entry by {@code thresholdStep}.
     */
    public Map<Tier, Double> getBaseThresholds() {
        return baseThresholds;
    }

    public void setBaseThresholds(Map<Tier, Double> baseThresholds) {
        this.baseThresholds = copyThresholds(baseThresholds);
    }

    public double getThresholdStep() {
        return thresholdStep;
    }

    public void setThresholdStep(double thresholdStep) {
        this.thresholdStep = thresholdStep;
    }

    /**
     * Token amount per tier at full (epoch 0) unit value.
     */
    public Map<Tier, Long> getRewards() {
        return rewards;
    }

    public void setRewards(Map<Tier, Long> rewards) {
        EnumMap<Tier, Long> copy = new EnumMap<>(Tier.class);
        if (rewards != null) {
            copy.putAll(rewards);
        }
        this.rewards = copy;
    }

    public double getCoherenceWeight() {
        return coherenceWeight;
    }

    public void setCoherenceWeight(double coherenceWeight) {
        this.coherenceWeight = coherenceWeight;
    }

    public double getDensityWeight() {
        return densityWeight;
    }

    public void setDensityWeight(double densityWeight) {
        this.densityWeight = densityWeight;
    }

    public double getNoveltyWeight() {
        return noveltyWeight;
    }

    public void setNoveltyWeight(double noveltyWeight) {
        this.noveltyWeight = noveltyWeight;
    }

    public double getRedundancyWeight() {
        return redundancyWeight;
    }

    public void setRedundancyWeight(double redundancyWeight) {
        this.redundancyWeight = redundancyWeight;
    }

    public List<String> getEpochNames() {
        return epochNames;
    }

    public void setEpochNames(List<String> epochNames) {
        this.epochNames = epochNames != null ? new ArrayList<>(epochNames) : new ArrayList<>();
    }

    public long getScoringTimeoutSeconds() {
        return scoringTimeoutSeconds;
    }

    public void setScoringTimeoutSeconds(long scoringTimeoutSeconds) {
        this.scoringTimeoutSeconds = scoringTimeoutSeconds;
    }

    public String epochName(int index) {
        if (index >= 0 && index < epochNames.size()) {
            String name = epochNames.get(index);
            if (name != null && !name.isBlank()) {
                return name;
            }
        }
        return "epoch-" + index;
    }

    public long rewardFor(Tier tier) {
        Long reward = rewards.get(tier);
        return reward != null ? reward : 0L;
    }

    public TokenomicsPolicy copy() {
        TokenomicsPolicy copy = new TokenomicsPolicy();
        copy.setBaseBudget(baseBudget);
        copy.setDecayFactor(decayFactor);
        copy.setFounderThresholds(founderThresholds);
        copy.setBaseThresholds(baseThresholds);
        copy.setThresholdStep(thresholdStep);
        copy.setRewards(rewards);
        copy.setCoherenceWeight(coherenceWeight);
        copy.setDensityWeight(densityWeight);
        copy.setNoveltyWeight(noveltyWeight);
        copy.setRedundancyWeight(redundancyWeight);
        copy.setEpochNames(epochNames);
        copy.setScoringTimeoutSeconds(scoringTimeoutSeconds);
        return copy;
    }

    private static Map<Tier, Double> copyThresholds(Map<Tier, Double> source) {
        EnumMap<Tier, Double> copy = new EnumMap<>(Tier.class);
        if (source != null) {
            copy.putAll(source);
        }
        return copy;
    }

    private static Map<Tier, Double> defaultFounderThresholds() {
        Map<Tier, Double> thresholds = new EnumMap<>(Tier.class);
        thresholds.put(Tier.BRONZE, 0.01);
        thresholds.put(Tier.SILVER, 0.05);
        thresholds.put(Tier.GOLD, 0.10);
        thresholds.put(Tier.FOUNDER, 0.20);
        return thresholds;
    }

    private static Map<Tier, Double> defaultBaseThresholds() {
        Map<Tier, Double> thresholds = new EnumMap<>(Tier.class);
        thresholds.put(Tier.BRONZE, 0.30);
        thresholds.put(Tier.SILVER, 0.50);
        thresholds.put(Tier.GOLD, 0.75);
        thresholds.put(Tier.FOUNDER, 0.95);
        return thresholds;
    }

    private static Map<Tier, Long> defaultRewards() {
        Map<Tier, Long> rewards = new EnumMap<>(Tier.class);
        rewards.put(Tier.BRONZE, 100L);
        rewards.put(Tier.SILVER, 500L);
        rewards.put(Tier.GOLD, 2_000L);
        rewards.put(Tier.FOUNDER, 10_000L);
        return rewards;
    }

    private static List<String> defaultEpochNames() {
        return new ArrayList<>(List.of("founder", "pioneer", "community", "ecosystem"));
    }
}
