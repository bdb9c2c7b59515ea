package com.telemetry.compression.model;

/**
 * 最近样本查找结果。样本池为空或无同形样本时距离为正无穷。
 */
public final class MatchResult {

    private static final MatchResult NO_MATCH = new MatchResult(null, Double.POSITIVE_INFINITY);

    private final Exemplar exemplar;
    private final double distance;

    private MatchResult(Exemplar exemplar, double distance) {
        this.exemplar = exemplar;
        this.distance = distance;
    }

    public static MatchResult of(Exemplar exemplar, double distance) {
        if (exemplar == null) {
            throw new IllegalArgumentException("Exemplar must not be null for a match");
        }
        return new MatchResult(exemplar, distance);
    }

    public static MatchResult noMatch() {
        return NO_MATCH;
    }

    public boolean isFound() { return exemplar != null; }
    public Exemplar getExemplar() { return exemplar; }
    public double getDistance() { return distance; }

    @Override
    public String toString() {
        return isFound()
                ? "MatchResult{slot=" + exemplar.getSlotIndex() + ", distance=" + distance + "}"
                : "MatchResult{none}";
    }
}
