package com.certledger.models;

public class ReservationResult {

    public enum Outcome {
        RESERVED,
        INSUFFICIENT_BUDGET,
        EPOCH_CLOSED
    }

    private final Outcome outcome;
    private final int epochIndex;
    private final long requested;
    private final long available;
    private final Reservation reservation;

    private ReservationResult(Outcome outcome, int epochIndex, long requested, long available, Reservation reservation) {
        this.outcome = outcome;
        this.epochIndex = epochIndex;
        this.requested = requested;
        this.available = available;
        this.reservation = reservation;
    }

    public static ReservationResult reserved(Reservation reservation, long remaining) {
        return new ReservationResult(Outcome.RESERVED, reservation.getEpochIndex(),
            reservation.getAmount(), remaining, reservation);
    }

    public static ReservationResult insufficientBudget(int epochIndex, long requested, long available) {
        return new ReservationResult(Outcome.INSUFFICIENT_BUDGET, epochIndex, requested, available, null);
    }

    public static ReservationResult epochClosed(int epochIndex, long requested) {
        return new ReservationResult(Outcome.EPOCH_CLOSED, epochIndex, requested, 0, null);
    }

    public Outcome getOutcome() {
        return outcome;
    }

    public boolean isReserved() {
        return outcome == Outcome.RESERVED;
    }

    public int getEpochIndex() {
        return epochIndex;
    }

    public long getRequested() {
        return requested;
    }

    /**
     * Budget left in the epoch after the call.
     */
    public long getAvailable() {
        return available;
    }

    public Reservation getReservation() {
        return reservation;
    }

    public String describe() {
        switch (outcome) {
            case RESERVED:
                return "reserved " + requested + " in epoch " + epochIndex;
            case INSUFFICIENT_BUDGET:
                return "epoch " + epochIndex + " has " + available + " left, " + requested + " requested";
            default:
                return "epoch " + epochIndex + " is closed";
        }
    }
}
