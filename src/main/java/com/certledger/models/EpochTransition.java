package com.certledger.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public class EpochTransition {

    private int fromIndex;
    private int toIndex;
    private AdvanceCause cause;
    private long remainingBudget;
    private long nextBudget;
    private long transitionedAt;

    public int getFromIndex() {
        return fromIndex;
    }

    public void setFromIndex(int fromIndex) {
        this.fromIndex = fromIndex;
    }

    public int getToIndex() {
        return toIndex;
    }

    public void setToIndex(int toIndex) {
        this.toIndex = toIndex;
    }

    public AdvanceCause getCause() {
        return cause;
    }

    public void setCause(AdvanceCause cause) {
        this.cause = cause;
    }

    /**
     * Budget left unminted in the closed epoch.
     */
    public long getRemainingBudget() {
        return remainingBudget;
    }

    public void setRemainingBudget(long remainingBudget) {
        this.remainingBudget = remainingBudget;
    }

    public long getNextBudget() {
        return nextBudget;
    }

    public void setNextBudget(long nextBudget) {
        this.nextBudget = nextBudget;
    }

    public long getTransitionedAt() {
        return transitionedAt;
    }

    public void setTransitionedAt(long transitionedAt) {
        this.transitionedAt = transitionedAt;
    }
}
