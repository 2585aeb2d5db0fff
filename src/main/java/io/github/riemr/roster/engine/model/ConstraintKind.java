package io.github.riemr.roster.engine.model;

/**
 * Origin of a constraint. Fairness bounds link the objective variables and are not hard rules.
 */
public enum ConstraintKind {
    COVERAGE(true),
    ONE_SHIFT_PER_DAY(true),
    REST(true),
    HOLIDAY_BID(true),
    FAIRNESS_UPPER(false),
    FAIRNESS_LOWER(false);

    private final boolean hardRule;

    ConstraintKind(boolean hardRule) {
        this.hardRule = hardRule;
    }

    public boolean isHardRule() {
        return hardRule;
    }
}
