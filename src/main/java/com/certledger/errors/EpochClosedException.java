package com.certledger.errors;

public class EpochClosedException extends IllegalStateException {

    private final int epochIndex;

    public EpochClosedException(int epochIndex) {
        super("Epoch " + epochIndex + " is closed");
        this.epochIndex = epochIndex;
    }

    public int getEpochIndex() {
        return epochIndex;
    }
}
