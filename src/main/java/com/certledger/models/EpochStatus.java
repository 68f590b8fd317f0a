package com.certledger.models;

import java.util.EnumMap;
import java.util.Map;

/**
 * Read-only view of the active epoch for the query surface.
 */
public class EpochStatus {

    private final int index;
    private final String name;
    private final long emissionBudget;
    private final long initialBudget;
    private final long startedAt;
    private final Map<Tier, Double> thresholdTable;

    public EpochStatus(Epoch epoch) {
        this.index = epoch.getIndex();
        this.name = epoch.getName();
        this.emissionBudget = epoch.getEmissionBudget();
        this.initialBudget = epoch.getInitialBudget();
        this.startedAt = epoch.getStartedAt();
        this.thresholdTable = new EnumMap<>(epoch.getThresholds());
    }

    public int getIndex() {
        return index;
    }

    public String getName() {
        return name;
    }

    public long getEmissionBudget() {
        return emissionBudget;
    }

    public long getInitialBudget() {
        return initialBudget;
    }

    public long getStartedAt() {
        return startedAt;
    }

    public Map<Tier, Double> getThresholdTable() {
        return thresholdTable;
    }
}
