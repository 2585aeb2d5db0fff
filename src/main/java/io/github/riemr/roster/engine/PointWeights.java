package io.github.riemr.roster.engine;

import io.github.riemr.roster.domain.model.DayClass;
import io.github.riemr.roster.domain.model.Shift;

/**
 * Fixed-point shift weights. Solver terms stay integral; display values are divided by {@code scale}.
 */
public record PointWeights(int regular, int premium, int scale) {

    public static final PointWeights DEFAULT = new PointWeights(10, 15, 10);

    public PointWeights {
        if (regular < 0 || premium < 0) {
            throw new IllegalArgumentException("weights must be >= 0");
        }
        if (scale <= 0) {
            throw new IllegalArgumentException("scale must be > 0");
        }
    }

    public int weightOf(Shift shift) {
        return shift.getDayClass() == DayClass.WEEKDAY ? regular : premium;
    }

    public long scaled(int displayPoints) {
        return (long) displayPoints * scale;
    }

    public double toDisplay(long scaledPoints) {
        return scaledPoints / (double) scale;
    }
}
