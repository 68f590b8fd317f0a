package com.certledger.errors;

/**
 * Enrichment was requested for a contribution that has no certificate; the
 * caller sequenced its calls wrongly.
 */
public class NotRegisteredException extends IllegalStateException {

    private final String contributionId;

    public NotRegisteredException(String contributionId) {
        super("No certificate registered for contribution " + contributionId);
        this.contributionId = contributionId;
    }

    public String getContributionId() {
        return contributionId;
    }
}
