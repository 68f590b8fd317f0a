package com.certledger.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.Objects;

@JsonIgnoreProperties(ignoreUnknown = true)
public class TokenAllocation {

    private String contributionId;
    private int epochIndex;
    private Tier tier;
    private long amount;
    private long allocatedAt;

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

    public long getAllocatedAt() {
        return allocatedAt;
    }

    public void setAllocatedAt(long allocatedAt) {
        this.allocatedAt = allocatedAt;
    }

    public static TokenAllocation fromReservation(Reservation reservation) {
        TokenAllocation allocation = new TokenAllocation();
        allocation.setContributionId(reservation.getContributionId());
        allocation.setEpochIndex(reservation.getEpochIndex());
        allocation.setTier(reservation.getTier());
        allocation.setAmount(reservation.getAmount());
        allocation.setAllocatedAt(reservation.getReservedAt());
        return allocation;
    }

    public TokenAllocation copy() {
        TokenAllocation copy = new TokenAllocation();
        copy.setContributionId(contributionId);
        copy.setEpochIndex(epochIndex);
        copy.setTier(tier);
        copy.setAmount(amount);
        copy.setAllocatedAt(allocatedAt);
        return copy;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TokenAllocation)) {
            return false;
        }
        TokenAllocation that = (TokenAllocation) o;
        return epochIndex == that.epochIndex
            && amount == that.amount
            && allocatedAt == that.allocatedAt
            && tier == that.tier
            && Objects.equals(contributionId, that.contributionId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(contributionId, epochIndex, tier, amount, allocatedAt);
    }
}
