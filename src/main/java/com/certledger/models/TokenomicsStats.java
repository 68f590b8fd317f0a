package com.certledger.models;

public class TokenomicsStats {

    private int currentEpochIndex;
    private String currentEpochName;
    private long currentEmissionBudget;
    private int epochCount;
    private int transitionCount;
    private long totalReserved;
    private long totalDistributed;
    private long totalCertified;
    private int holderCount;

    public int getCurrentEpochIndex() {
        return currentEpochIndex;
    }

    public void setCurrentEpochIndex(int currentEpochIndex) {
        this.currentEpochIndex = currentEpochIndex;
    }

    public String getCurrentEpochName() {
        return currentEpochName;
    }

    public void setCurrentEpochName(String currentEpochName) {
        this.currentEpochName = currentEpochName;
    }

    public long getCurrentEmissionBudget() {
        return currentEmissionBudget;
    }

    public void setCurrentEmissionBudget(long currentEmissionBudget) {
        this.currentEmissionBudget = currentEmissionBudget;
    }

    public int getEpochCount() {
        return epochCount;
    }

    public void setEpochCount(int epochCount) {
        this.epochCount = epochCount;
    }

    public int getTransitionCount() {
        return transitionCount;
    }

    public void setTransitionCount(int transitionCount) {
        this.transitionCount = transitionCount;
    }

    /**
     * Tokens debited from epoch budgets, certified or not yet certified.
     */
    public long getTotalReserved() {
        return totalReserved;
    }

    public void setTotalReserved(long totalReserved) {
        this.totalReserved = totalReserved;
    }

    /**
     * Tokens carried by registered certificates.
     */
    public long getTotalDistributed() {
        return totalDistributed;
    }

    public void setTotalDistributed(long totalDistributed) {
        this.totalDistributed = totalDistributed;
    }

    public long getTotalCertified() {
        return totalCertified;
    }

    public void setTotalCertified(long totalCertified) {
        this.totalCertified = totalCertified;
    }

    public int getHolderCount() {
        return holderCount;
    }

    public void setHolderCount(int holderCount) {
        this.holderCount = holderCount;
    }
}
