package com.certledger.models;

/**
 * Message sent to the external metric scorer.
 */
public class ScoringRequest {

    private final String contributionId;
    private final String contributorId;
    private final long requestedAt;

    public ScoringRequest(String contributionId, String contributorId, long requestedAt) {
        this.contributionId = contributionId;
        this.contributorId = contributorId;
        this.requestedAt = requestedAt;
    }

    public String getContributionId() {
        return contributionId;
    }

    public String getContributorId() {
        return contributorId;
    }

    public long getRequestedAt() {
        return requestedAt;
    }
}
