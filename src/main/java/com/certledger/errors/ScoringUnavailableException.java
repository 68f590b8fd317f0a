package com.certledger.errors;

/**
 * The external metric scorer failed or timed out. Retried by whoever called
 * the pipeline, never by the core.
 */
public class ScoringUnavailableException extends RuntimeException {

    private final String contributionId;

    public ScoringUnavailableException(String contributionId, String message) {
        super(message);
        this.contributionId = contributionId;
    }

    public ScoringUnavailableException(String contributionId, String message, Throwable cause) {
        super(message, cause);
        this.contributionId = contributionId;
    }

    public String getContributionId() {
        return contributionId;
    }
}
