package com.certledger.errors;

/**
 * No budget could be reserved even after one epoch advance. Transient: the
 * caller should retry later, the contribution itself was not judged.
 */
public class AllocationFailedException extends RuntimeException {

    private final String contributionId;
    private final int epochIndex;

    public AllocationFailedException(String contributionId, int epochIndex, String reason) {
        super("Allocation failed for " + contributionId + " in epoch " + epochIndex + ": " + reason);
        this.contributionId = contributionId;
        this.epochIndex = epochIndex;
    }

    public String getContributionId() {
        return contributionId;
    }

    public int getEpochIndex() {
        return epochIndex;
    }

    public boolean isRetryable() {
        return true;
    }
}
