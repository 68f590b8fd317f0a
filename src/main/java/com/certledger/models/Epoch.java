package com.certledger.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.EnumMap;
import java.util.Map;

/**
 * One bounded period of token emission. Only the ledger mutates instances;
 * everything handed out of the ledger is a copy.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class Epoch {

    private int index;
    private String name;
    private long startedAt;
    private Long closedAt;
    private long initialBudget;
    private long emissionBudget;
    private Map<Tier, Double> thresholds = new EnumMap<>(Tier.class);
    private double decayFactor;
    private EpochState state = EpochState.ACTIVE;

    public int getIndex() {
        return index;
    }

    public void setIndex(int index) {
        this.index = index;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public long getStartedAt() {
        return startedAt;
    }

    public void setStartedAt(long startedAt) {
        this.startedAt = startedAt;
    }

    public Long getClosedAt() {
        return closedAt;
    }

    public void setClosedAt(Long closedAt) {
        this.closedAt = closedAt;
    }

    public long getInitialBudget() {
        return initialBudget;
    }

    public void setInitialBudget(long initialBudget) {
        this.initialBudget = initialBudget;
    }

    /**
     * Remaining mintable tokens.
     */
    public long getEmissionBudget() {
        return emissionBudget;
    }

    public void setEmissionBudget(long emissionBudget) {
        this.emissionBudget = emissionBudget;
    }

    public Map<Tier, Double> getThresholds() {
        return thresholds;
    }

    public void setThresholds(Map<Tier, Double> thresholds) {
        EnumMap<Tier, Double> copy = new EnumMap<>(Tier.class);
        if (thresholds != null) {
            copy.putAll(thresholds);
        }
        this.thresholds = copy;
    }

    public double getDecayFactor() {
        return decayFactor;
    }

    public void setDecayFactor(double decayFactor) {
        this.decayFactor = decayFactor;
    }

    public EpochState getState() {
        return state;
    }

    public void setState(EpochState state) {
        this.state = state;
    }

    @JsonIgnore
    public boolean isActive() {
        return state == EpochState.ACTIVE;
    }

    @JsonIgnore
    public boolean isFounder() {
        return index == 0;
    }

    public Double thresholdFor(Tier tier) {
        return thresholds.get(tier);
    }

    public Epoch copy() {
        Epoch copy = new Epoch();
        copy.setIndex(index);
        copy.setName(name);
        copy.setStartedAt(startedAt);
        copy.setClosedAt(closedAt);
        copy.setInitialBudget(initialBudget);
        copy.setEmissionBudget(emissionBudget);
        copy.setThresholds(thresholds);
        copy.setDecayFactor(decayFactor);
        copy.setState(state);
        return copy;
    }
}
