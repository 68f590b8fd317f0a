package com.certledger.pipeline;

import com.certledger.models.MetricVector;
import com.certledger.models.ScoringRequest;

import java.util.concurrent.CompletableFuture;

/**
 * External evaluator producing the metric vector for a contribution. Completes
 * exceptionally when the evaluator is down; the pipeline applies its own timeout.
 */
public interface MetricScorer {

    CompletableFuture<MetricVector> score(ScoringRequest request);
}
