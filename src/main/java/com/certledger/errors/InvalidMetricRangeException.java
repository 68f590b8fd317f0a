package com.certledger.errors;

/**
 * A metric vector is missing or has a component outside [0,1]. Fatal to the
 * request; retrying the same input fails the same way.
 */
public class InvalidMetricRangeException extends IllegalArgumentException {

    private final String metric;
    private final double value;

    public InvalidMetricRangeException(String metric, double value) {
        super("Metric '" + metric + "' must be within [0,1], got " + value);
        this.metric = metric;
        this.value = value;
    }

    public InvalidMetricRangeException(String message) {
        super(message);
        this.metric = null;
        this.value = Double.NaN;
    }

    public String getMetric() {
        return metric;
    }

    public double getValue() {
        return value;
    }
}
