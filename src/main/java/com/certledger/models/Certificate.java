package com.certledger.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * The registry's unit of truth. Only {@code onChainRef} may ever change, and
 * only from null to a value.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class Certificate {

    private String contributionId;
    private String contributorId;
    private Tier tier;
    private long amount;
    private int epochIndex;
    private double score;
    private long registeredAt;
    private String onChainRef;

    public String getContributionId() {
        return contributionId;
    }

    public void setContributionId(String contributionId) {
        this.contributionId = contributionId;
    }

    public String getContributorId() {
        return contributorId;
    }

    public void setContributorId(String contributorId) {
        this.contributorId = contributorId;
    }

    public Tier getTier() {
        return tier;
    }

    public void setTier(Tier tier) {
        this.tier = tier;
    }

    public long getAmount() {
        return amount;
    }

    public void setAmount(long amount) {
        this.amount = amount;
    }

    public int getEpochIndex() {
        return epochIndex;
    }

    public void setEpochIndex(int epochIndex) {
        this.epochIndex = epochIndex;
    }

    public double getScore() {
        return score;
    }

    public void setScore(double score) {
        this.score = score;
    }

    public long getRegisteredAt() {
        return registeredAt;
    }

    public void setRegisteredAt(long registeredAt) {
        this.registeredAt = registeredAt;
    }

    public String getOnChainRef() {
        return onChainRef;
    }

    public void setOnChainRef(String onChainRef) {
        this.onChainRef = onChainRef;
    }

    public Certificate copy() {
        Certificate copy = new Certificate();
        copy.setContributionId(contributionId);
        copy.setContributorId(contributorId);
        copy.setTier(tier);
        copy.setAmount(amount);
        copy.setEpochIndex(epochIndex);
        copy.setScore(score);
        copy.setRegisteredAt(registeredAt);
        copy.setOnChainRef(onChainRef);
        return copy;
    }
}
