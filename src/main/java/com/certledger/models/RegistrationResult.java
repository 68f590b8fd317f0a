package com.certledger.models;

/**
 * Outcome of a registration attempt. {@code created == false} is the
 * already-registered path and carries the existing certificate.
 */
public class RegistrationResult {

    private final Certificate certificate;
    private final boolean created;

    private RegistrationResult(Certificate certificate, boolean created) {
        this.certificate = certificate;
        this.created = created;
    }

    public static RegistrationResult created(Certificate certificate) {
        return new RegistrationResult(certificate, true);
    }

    public static RegistrationResult alreadyRegistered(Certificate existing) {
        return new RegistrationResult(existing, false);
    }

    public Certificate getCertificate() {
        return certificate;
    }

    public boolean isCreated() {
        return created;
    }

    public boolean isAlreadyRegistered() {
        return !created;
    }
}
