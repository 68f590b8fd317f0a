package com.certledger.models;

/**
 * Message handed to the anchoring collaborator for one registered certificate.
 */
public class AnchorRequest {

    private final Certificate certificate;
    private final long requestedAt;

    public AnchorRequest(Certificate certificate, long requestedAt) {
        this.certificate = certificate;
        this.requestedAt = requestedAt;
    }

    public String getContributionId() {
        return certificate.getContributionId();
    }

    public Certificate getCertificate() {
        return certificate;
    }

    public long getRequestedAt() {
        return requestedAt;
    }
}
