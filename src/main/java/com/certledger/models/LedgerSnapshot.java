package com.certledger.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * On-disk form of the epoch ledger. Written as one document so a budget
 * debit and its reservation entry land together.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class LedgerSnapshot {

    private List<Epoch> epochs = new ArrayList<>();
    private List<Reservation> reservations = new ArrayList<>();
    private List<EpochTransition> transitions = new ArrayList<>();
    private long savedAt;

    public List<Epoch> getEpochs() {
        return epochs;
    }

    public void setEpochs(List<Epoch> epochs) {
        this.epochs = epochs != null ? epochs : new ArrayList<>();
    }

    public List<Reservation> getReservations() {
        return reservations;
    }

    public void setReservations(List<Reservation> reservations) {
        this.reservations = reservations != null ? reservations : new ArrayList<>();
    }

    public List<EpochTransition> getTransitions() {
        return transitions;
    }

    public void setTransitions(List<EpochTransition> transitions) {
        this.transitions = transitions != null ? transitions : new ArrayList<>();
    }

    public long getSavedAt() {
        return savedAt;
    }

    public void setSavedAt(long savedAt) {
        this.savedAt = savedAt;
    }
}
