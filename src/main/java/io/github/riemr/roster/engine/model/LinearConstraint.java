package io.github.riemr.roster.engine.model;

/**
 * {@code lowerBound <= expr <= upperBound}; a null bound is open.
 */
public record LinearConstraint(String label, ConstraintKind kind, LinearExpr expr, Long lowerBound, Long upperBound) {

    public LinearConstraint {
        if (lowerBound == null && upperBound == null) {
            throw new IllegalArgumentException("constraint " + label + " has no bound");
        }
        if (lowerBound != null && upperBound != null && lowerBound > upperBound) {
            throw new IllegalArgumentException("constraint " + label + " has empty range");
        }
    }

    public static LinearConstraint equalTo(String label, ConstraintKind kind, LinearExpr expr, long value) {
        return new LinearConstraint(label, kind, expr, value, value);
    }

    public static LinearConstraint atMost(String label, ConstraintKind kind, LinearExpr expr, long value) {
        return new LinearConstraint(label, kind, expr, null, value);
    }

    public static LinearConstraint atLeast(String label, ConstraintKind kind, LinearExpr expr, long value) {
        return new LinearConstraint(label, kind, expr, value, null);
    }

    /** Distance from the feasible range; 0 when satisfied. */
    public long violation(long[] values) {
        long v = expr.evaluate(values);
        if (lowerBound != null && v < lowerBound) {
            return lowerBound - v;
        }
        if (upperBound != null && v > upperBound) {
            return v - upperBound;
        }
        return 0;
    }

    public boolean isSatisfied(long[] values) {
        return violation(values) == 0;
    }
}
