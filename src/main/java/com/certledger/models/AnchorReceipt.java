package com.certledger.models;

/**
 * Callback message from the anchoring collaborator once its transaction
 * finalized (or failed).
 */
public class AnchorReceipt {

    private final String contributionId;
    private final String onChainRef;
    private final String error;

    private AnchorReceipt(String contributionId, String onChainRef, String error) {
        this.contributionId = contributionId;
        this.onChainRef = onChainRef;
        this.error = error;
    }

    public static AnchorReceipt confirmed(String contributionId, String onChainRef) {
        return new AnchorReceipt(contributionId, onChainRef, null);
    }

    public static AnchorReceipt failed(String contributionId, String error) {
        return new AnchorReceipt(contributionId, null, error);
    }

    public String getContributionId() {
        return contributionId;
    }

    public String getOnChainRef() {
        return onChainRef;
    }

    public String getError() {
        return error;
    }

    public boolean isConfirmed() {
        return onChainRef != null && error == null;
    }
}
