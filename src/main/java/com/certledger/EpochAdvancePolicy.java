package com.certledger;

import com.certledger.models.AdvanceCause;
import com.certledger.models.Epoch;

/**
 * Decides whether the active epoch may close for a given cause.
 */
public interface EpochAdvancePolicy {

    /**
     * @param epoch         copy of the active epoch
     * @param cause         why the advance was requested
     * @param pendingAmount amount the caller failed to reserve, 0 for operator requests
     */
    boolean permits(Epoch epoch, AdvanceCause cause, long pendingAmount);

    /**
     * Operators may always advance; budget exhaustion counts once the epoch
     * is empty or can no longer cover the pending reservation.
     */
    static EpochAdvancePolicy standard() {
        return (epoch, cause, pendingAmount) -> {
            switch (cause) {
                case OPERATOR_REQUEST:
                    return true;
                case BUDGET_EXHAUSTED:
                    return epoch.getEmissionBudget() == 0 || epoch.getEmissionBudget() < pendingAmount;
                default:
                    return false;
            }
        };
    }
}
