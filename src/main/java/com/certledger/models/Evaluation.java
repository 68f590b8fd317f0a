package com.certledger.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public class Evaluation {

    private String contributionId;
    private MetricVector metrics;
    private double score;
    private Tier tier;
    private String justification;
    private int epochIndex;
    private long evaluatedAt;

    public String getContributionId() {
        return contributionId;
    }

    public void setContributionId(String contributionId) {
        this.contributionId = contributionId;
    }

    public MetricVector getMetrics() {
        return metrics;
    }

    public void setMetrics(MetricVector metrics) {
        this.metrics = metrics;
    }

    public double getScore() {
        return score;
    }

    public void setScore(double score) {
        this.score = score;
    }

    public Tier getTier() {
        return tier;
    }

    public void setTier(Tier tier) {
        this.tier = tier;
    }

    public String getJustification() {
        return justification;
    }

    public void setJustification(String justification) {
        this.justification = justification;
    }

    public int getEpochIndex() {
        return epochIndex;
    }

    public void setEpochIndex(int epochIndex) {
        this.epochIndex = epochIndex;
    }

    public long getEvaluatedAt() {
        return evaluatedAt;
    }

    public void setEvaluatedAt(long evaluatedAt) {
        this.evaluatedAt = evaluatedAt;
    }

    public Evaluation copy() {
        Evaluation copy = new Evaluation();
        copy.setContributionId(contributionId);
        copy.setMetrics(metrics != null ? metrics.copy() : null);
        copy.setScore(score);
        copy.setTier(tier);
        copy.setJustification(justification);
        copy.setEpochIndex(epochIndex);
        copy.setEvaluatedAt(evaluatedAt);
        return copy;
    }
}
