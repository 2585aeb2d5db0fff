package io.github.riemr.roster.engine.model;

/**
 * A decision variable of the linear program. Boolean variables have domain [0, 1].
 * Index is the position inside the owning {@link LinearModel}.
 */
public final class ModelVariable {

    private final int index;
    private final String name;
    private final long lowerBound;
    private final long upperBound;
    private final boolean bool;

    ModelVariable(int index, String name, long lowerBound, long upperBound, boolean bool) {
        if (lowerBound > upperBound) {
            throw new IllegalArgumentException("empty domain for " + name + ": [" + lowerBound + ", " + upperBound + "]");
        }
        this.index = index;
        this.name = name;
        this.lowerBound = lowerBound;
        this.upperBound = upperBound;
        this.bool = bool;
    }

    public int getIndex() {
        return index;
    }

    public String getName() {
        return name;
    }

    public long getLowerBound() {
        return lowerBound;
    }

    public long getUpperBound() {
        return upperBound;
    }

    public boolean isBoolean() {
        return bool;
    }

    @Override
    public String toString() {
        return name;
    }
}
