package com.certledger;

import com.certledger.errors.InvalidMetricRangeException;
import com.certledger.models.Epoch;
import com.certledger.models.Evaluation;
import com.certledger.models.MetricVector;
import com.certledger.models.Tier;
import org.junit.jupiter.api.Test;

import java.util.EnumMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TierClassifierTest {

    private final TierClassifier classifier = new TierClassifier(new TokenomicsPolicy());

    private Epoch epochWith(double bronze, double silver, double gold, double founder) {
        Map<Tier, Double> thresholds = new EnumMap<>(Tier.class);
        thresholds.put(Tier.BRONZE, bronze);
        thresholds.put(Tier.SILVER, silver);
        thresholds.put(Tier.GOLD, gold);
        thresholds.put(Tier.FOUNDER, founder);
        Epoch epoch = new Epoch();
        epoch.setIndex(1);
        epoch.setThresholds(thresholds);
        return epoch;
    }

    @Test
    void strongContributionLandsInGold() {
        Epoch epoch = epochWith(0.30, 0.50, 0.75, 0.95);
        Evaluation evaluation = classifier.classify("c-1", new MetricVector(0.9, 0.8, 0.7, 0.1), epoch);

        assertEquals(0.78, evaluation.getScore(), 1e-9);
        assertEquals(Tier.GOLD, evaluation.getTier());
        assertEquals(1, evaluation.getEpochIndex());
        assertTrue(evaluation.getJustification().contains("met GOLD threshold 0.7500"));
        assertTrue(evaluation.getJustification().contains("FOUNDER needs 0.9500"));
    }

    @Test
    void allZeroMetricsAreRejectedEvenInFounderEpoch() {
        Epoch founder = new Epoch();
        founder.setIndex(0);
        founder.setThresholds(new TokenomicsPolicy().getFounderThresholds());

        Evaluation evaluation = classifier.classify("c-0", new MetricVector(0, 0, 0, 0), founder);

        assertEquals(0.0, evaluation.getScore());
        assertEquals(Tier.REJECTED, evaluation.getTier());
        assertTrue(evaluation.getJustification().contains("below BRONZE threshold"));
    }

    @Test
    void redundancyPenaltyClampsAtZero() {
        assertEquals(0.0, classifier.score(new MetricVector(0, 0, 0, 1.0)));
        assertEquals(1.0, new TierClassifier(1, 1, 1, 0).score(new MetricVector(1, 1, 1, 0)));
    }

    @Test
    void rejectsMetricsOutsideUnitInterval() {
        assertThrows(InvalidMetricRangeException.class, () -> classifier.validate(new MetricVector(1.2, 0, 0, 0)));
        assertThrows(InvalidMetricRangeException.class, () -> classifier.validate(new MetricVector(0, -0.1, 0, 0)));
        assertThrows(InvalidMetricRangeException.class, () -> classifier.validate(new MetricVector(0, 0, Double.NaN, 0)));
        assertThrows(InvalidMetricRangeException.class, () -> classifier.validate(null));
        assertDoesNotThrow(() -> classifier.validate(new MetricVector(1, 1, 1, 1)));
    }

    @Test
    void missingComponentIsRejected() {
        MetricVector partial = new MetricVector();
        partial.setCoherence(1.0);

        InvalidMetricRangeException error = assertThrows(InvalidMetricRangeException.class,
            () -> classifier.validate(partial));
        assertTrue(error.getMessage().contains("density"));
    }

    @Test
    void sameInputClassifiesIdentically() {
        Epoch epoch = epochWith(0.30, 0.50, 0.75, 0.95);
        MetricVector metrics = new MetricVector(0.42, 0.61, 0.37, 0.2);

        Evaluation first = classifier.classify("c-2", metrics, epoch);
        Evaluation second = classifier.classify("c-2", metrics, epoch);

        assertEquals(first.getScore(), second.getScore());
        assertEquals(first.getTier(), second.getTier());
        assertEquals(first.getJustification(), second.getJustification());
    }

    @Test
    void higherScoreNeverYieldsLowerTier() {
        Epoch epoch = epochWith(0.30, 0.50, 0.75, 0.95);
        TierClassifier flat = new TierClassifier(1.0, 0.0, 0.0, 0.0);
        Tier previous = Tier.REJECTED;
        for (int i = 0; i <= 100; i++) {
            Tier tier = flat.classify("c-" + i, new MetricVector(i / 100.0, 0, 0, 0), epoch).getTier();
            assertTrue(tier.ordinal() >= previous.ordinal(), "tier dropped at coherence " + i / 100.0);
            previous = tier;
        }
        assertEquals(Tier.FOUNDER, previous);
    }

    @Test
    void thresholdIsInclusive() {
        Map<Tier, Double> thresholds = epochWith(0.30, 0.50, 0.75, 0.95).getThresholds();
        assertEquals(Tier.SILVER, classifier.selectTier(0.50, thresholds));
        assertEquals(Tier.BRONZE, classifier.selectTier(Math.nextDown(0.50), thresholds));
        assertEquals(Tier.REJECTED, classifier.selectTier(0.0, thresholds));
    }

    @Test
    void classifyRequiresAnEpoch() {
        assertThrows(IllegalArgumentException.class,
            () -> classifier.classify("c-3", new MetricVector(0.5, 0.5, 0.5, 0), null));
    }
}
