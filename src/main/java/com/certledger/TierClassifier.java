package com.certledger;

import com.certledger.errors.InvalidMetricRangeException;
import com.certledger.models.Epoch;
import com.certledger.models.Evaluation;
import com.certledger.models.MetricVector;
import com.certledger.models.Tier;

import java.util.Locale;
import java.util.Map;

/**
 * Maps a metric vector to a score and a tier against one epoch's thresholds.
 * Holds no mutable state: the same vector and epoch always classify the same way.
 */
public class TierClassifier {

    private final double coherenceWeight;
    private final double densityWeight;
    private final double noveltyWeight;
    private final double redundancyWeight;

    public TierClassifier(TokenomicsPolicy policy) {
        this(policy.getCoherenceWeight(), policy.getDensityWeight(),
            policy.getNoveltyWeight(), policy.getRedundancyWeight());
    }

    public TierClassifier(double coherenceWeight, double densityWeight, double noveltyWeight, double redundancyWeight) {
        this.coherenceWeight = coherenceWeight;
        this.densityWeight = densityWeight;
        this.noveltyWeight = noveltyWeight;
        this.redundancyWeight = redundancyWeight;
    }

    public void validate(MetricVector metrics) {
        if (metrics == null) {
            throw new InvalidMetricRangeException("Metric vector is required");
        }
        checkRange("coherence", metrics.getCoherence());
        checkRange("density", metrics.getDensity());
        checkRange("novelty", metrics.getNovelty());
        checkRange("redundancy", metrics.getRedundancy());
    }

    public double score(MetricVector metrics) {
        validate(metrics);
        double raw = coherenceWeight * metrics.getCoherence()
            + densityWeight * metrics.getDensity()
            + noveltyWeight * metrics.getNovelty()
            - redundancyWeight * metrics.getRedundancy();
        return clamp(raw);
    }

    public Evaluation classify(String contributionId, MetricVector metrics, Epoch epoch) {
        if (epoch == null) {
            throw new IllegalArgumentException("Epoch is required for classification");
        }
        double score = score(metrics);
        Map<Tier, Double> thresholds = epoch.getThresholds();
        Tier tier = selectTier(score, thresholds);

        Evaluation evaluation = new Evaluation();
        evaluation.setContributionId(contributionId);
        evaluation.setMetrics(metrics.copy());
        evaluation.setScore(score);
        evaluation.setTier(tier);
        evaluation.setEpochIndex(epoch.getIndex());
        evaluation.setJustification(justify(score, tier, thresholds, metrics));
        evaluation.setEvaluatedAt(System.currentTimeMillis());
        return evaluation;
    }

    Tier selectTier(double score, Map<Tier, Double> thresholds) {
        for (Tier tier : Tier.rewardedDescending()) {
            Double threshold = thresholds.get(tier);
            if (threshold != null && threshold <= score) {
                return tier;
            }
        }
        return Tier.REJECTED;
    }

    private String justify(double score, Tier tier, Map<Tier, Double> thresholds, MetricVector metrics) {
        StringBuilder sb = new StringBuilder();
        sb.append(fmt("score %.4f", score));

        if (tier == Tier.REJECTED) {
            Tier lowest = lowestConfigured(thresholds);
            if (lowest == null) {
                sb.append(" with no thresholds configured");
            } else {
                double needed = thresholds.get(lowest);
                sb.append(fmt(" below %s threshold %.4f (gap %.4f)", lowest, needed, needed - score));
            }
        } else {
            sb.append(fmt(" met %s threshold %.4f", tier, thresholds.get(tier)));
            Tier next = nextConfigured(tier, thresholds);
            if (next != null) {
                double needed = thresholds.get(next);
                sb.append(fmt("; %s needs %.4f (gap %.4f)", next, needed, needed - score));
            } else {
                sb.append("; highest tier");
            }
        }

        double coherence = coherenceWeight * metrics.getCoherence();
        double density = densityWeight * metrics.getDensity();
        double novelty = noveltyWeight * metrics.getNovelty();
        String dominant = "coherence";
        double dominantValue = coherence;
        double dominantRaw = metrics.getCoherence();
        if (density > dominantValue) {
            dominant = "density";
            dominantValue = density;
            dominantRaw = metrics.getDensity();
        }
        if (novelty > dominantValue) {
            dominant = "novelty";
            dominantValue = novelty;
            dominantRaw = metrics.getNovelty();
        }
        sb.append(fmt("; dominant metric %s %.3f (weighted %.4f)", dominant, dominantRaw, dominantValue));
        sb.append(fmt("; redundancy penalty %.4f", redundancyWeight * metrics.getRedundancy()));
        return sb.toString();
    }

    private Tier lowestConfigured(Map<Tier, Double> thresholds) {
        for (Tier tier : Tier.values()) {
            if (tier.isRewarded() && thresholds.get(tier) != null) {
                return tier;
            }
        }
        return null;
    }

    private Tier nextConfigured(Tier current, Map<Tier, Double> thresholds) {
        Tier[] tiers = Tier.values();
        for (int i = current.ordinal() + 1; i < tiers.length; i++) {
            if (thresholds.get(tiers[i]) != null) {
                return tiers[i];
            }
        }
        return null;
    }

    private void checkRange(String name, Double value) {
        if (value == null) {
            throw new InvalidMetricRangeException("Metric '" + name + "' is missing");
        }
        if (value.isNaN() || value < 0.0 || value > 1.0) {
            throw new InvalidMetricRangeException(name, value);
        }
    }

    private double clamp(double value) {
        if (value < 0.0) {
            return 0.0;
        }
        if (value > 1.0) {
            return 1.0;
        }
        return value;
    }

    private String fmt(String format, Object... args) {
        return String.format(Locale.ROOT, format, args);
    }
}
