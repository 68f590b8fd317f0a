package com.certledger;

import com.certledger.models.Evaluation;
import com.certledger.models.MetricVector;
import com.certledger.models.Tier;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EvaluationLogTest {

    @TempDir
    Path tempDir;

    private Evaluation evaluation(String contributionId, Tier tier, double score, long at) {
        Evaluation evaluation = new Evaluation();
        evaluation.setContributionId(contributionId);
        evaluation.setMetrics(new MetricVector(score, score, score, 0));
        evaluation.setScore(score);
        evaluation.setTier(tier);
        evaluation.setEvaluatedAt(at);
        return evaluation;
    }

    @Test
    void reEvaluationAppendsInsteadOfOverwriting() {
        EvaluationLog log = new EvaluationLog(tempDir.resolve("evaluations.json"));
        log.record(evaluation("c-1", Tier.BRONZE, 0.35, 1L));
        log.record(evaluation("c-1", Tier.SILVER, 0.55, 2L));

        List<Evaluation> history = log.history("c-1");

        assertEquals(2, history.size());
        assertEquals(Tier.BRONZE, history.get(0).getTier());
        assertEquals(Tier.SILVER, log.latest("c-1").getTier());
        assertNull(log.latest("c-2"));
    }

    @Test
    void recordedEvaluationsCannotBeMutatedFromOutside() {
        EvaluationLog log = new EvaluationLog(tempDir.resolve("evaluations.json"));
        Evaluation returned = log.record(evaluation("c-1", Tier.GOLD, 0.8, 1L));
        returned.setTier(Tier.FOUNDER);
        log.history("c-1").get(0).setTier(Tier.REJECTED);

        assertEquals(Tier.GOLD, log.latest("c-1").getTier());
    }

    @Test
    void historyReloadsInOrder() {
        Path path = tempDir.resolve("evaluations.json");
        EvaluationLog log = new EvaluationLog(path);
        log.record(evaluation("c-1", Tier.REJECTED, 0.1, 10L));
        log.record(evaluation("c-2", Tier.GOLD, 0.8, 20L));
        log.record(evaluation("c-1", Tier.BRONZE, 0.4, 30L));

        EvaluationLog reopened = new EvaluationLog(path);

        assertEquals(3, reopened.count());
        assertEquals(Tier.BRONZE, reopened.latest("c-1").getTier());
        assertEquals(1, reopened.history("c-2").size());
    }
}
