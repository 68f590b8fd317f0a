package com.certledger.models;

public enum EpochState {
    ACTIVE,
    CLOSED
}
