package com.certledger.models;

public enum CertificationStatus {
    CERTIFIED,
    ALREADY_CERTIFIED,
    NOT_CERTIFIED
}
