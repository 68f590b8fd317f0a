package com.certledger;

/**
 * Capability token for the privileged operations: budget reservation, epoch
 * advance and certificate registration. Instances are only created by the
 * ledger and the registry, and each hands its token out once.
 */
public final class MintAuthority {

    private final String issuer;

    MintAuthority(String issuer) {
        this.issuer = issuer;
    }

    @Override
    public String toString() {
        return "MintAuthority[" + issuer + "]";
    }
}
