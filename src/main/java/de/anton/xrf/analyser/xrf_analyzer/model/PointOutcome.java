package de.anton.xrf.analyser.xrf_analyzer.model;

import java.util.Objects;

/**
 * Result of processing one scan point. A missing source is a normal outcome, not an error:
 * the point's cells stay at zero and the reason is kept for reporting.
 */
public final class PointOutcome {

    public enum Status { PROCESSED, MISSING, FAILED }

    private final int pointIndex;
    private final Status status;
    private final String reason;   // null for PROCESSED
    private final double[] values; // One integral per element definition, empty unless PROCESSED

    private PointOutcome(int pointIndex, Status status, String reason, double[] values) {
        this.pointIndex = pointIndex;
        this.status = Objects.requireNonNull(status);
        this.reason = reason;
        this.values = values;
    }

    public static PointOutcome processed(int pointIndex, double[] values) {
        return new PointOutcome(pointIndex, Status.PROCESSED, null, values.clone());
    }

    public static PointOutcome missing(int pointIndex, String reason) {
        return new PointOutcome(pointIndex, Status.MISSING, reason, new double[0]);
    }

    public static PointOutcome failed(int pointIndex, String reason) {
        return new PointOutcome(pointIndex, Status.FAILED, reason, new double[0]);
    }

    public int getPointIndex() { return pointIndex; }
    public Status getStatus() { return status; }
    public String getReason() { return reason; }
    public boolean isProcessed() { return status == Status.PROCESSED; }

    /** @return Copy of the per-element integrals, in element definition order. */
    public double[] getValues() { return values.clone(); }

    @Override
    public String toString() {
        return "Point " + pointIndex + ": " + status + (reason != null ? " (" + reason + ")" : "");
    }
}
