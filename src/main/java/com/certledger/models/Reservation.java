package com.certledger.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Ledger journal entry for one budget debit. Persisted together with the
 * debited epoch, keyed by contribution.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class Reservation {

    private String contributionId;
    private int epochIndex;
    private Tier tier;
    private long amount;
    private long reservedAt;

    public Reservation() {
    }

    public Reservation(String contributionId, int epochIndex, Tier tier, long amount, long reservedAt) {
        this.contributionId = contributionId;
        this.epochIndex = epochIndex;
        this.tier = tier;
        this.amount = amount;
        this.reservedAt = reservedAt;
    }

    public String getContributionId() {
        return contributionId;
    }

    public void setContributionId(String contributionId) {
        this.contributionId = contributionId;
    }

    public int getEpochIndex() {
        return epochIndex;
    }

    public void setEpochIndex(int epochIndex) {
        this.epochIndex = epochIndex;
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

    public long getReservedAt() {
        return reservedAt;
    }

    public void setReservedAt(long reservedAt) {
        this.reservedAt = reservedAt;
    }

    public Reservation copy() {
        return new Reservation(contributionId, epochIndex, tier, amount, reservedAt);
    }
}
