package com.certledger.errors;

public class ConflictingOnChainRefException extends IllegalStateException {

    private final String contributionId;
    private final String existingRef;
    private final String rejectedRef;

    public ConflictingOnChainRefException(String contributionId, String existingRef, String rejectedRef) {
        super("Certificate " + contributionId + " is already anchored at " + existingRef
            + "; refusing " + rejectedRef);
        this.contributionId = contributionId;
        this.existingRef = existingRef;
        this.rejectedRef = rejectedRef;
    }

    public String getContributionId() {
        return contributionId;
    }

    public String getExistingRef() {
        return existingRef;
    }

    public String getRejectedRef() {
        return rejectedRef;
    }
}
