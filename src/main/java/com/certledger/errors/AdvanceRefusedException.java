package com.certledger.errors;

import com.certledger.models.AdvanceCause;

/**
 * The advance policy did not accept the given cause for the active epoch.
 */
public class AdvanceRefusedException extends IllegalStateException {

    private final int epochIndex;
    private final AdvanceCause advanceCause;

    public AdvanceRefusedException(int epochIndex, AdvanceCause cause) {
        super("Advance from epoch " + epochIndex + " refused for cause " + cause);
        this.epochIndex = epochIndex;
        this.advanceCause = cause;
    }

    public int getEpochIndex() {
        return epochIndex;
    }

    public AdvanceCause getAdvanceCause() {
        return advanceCause;
    }
}
