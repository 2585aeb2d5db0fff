package io.github.riemr.roster.engine.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * Immutable expression {@code Σ coefficient·variable + constant}.
 */
public final class LinearExpr {

    public record Term(ModelVariable variable, long coefficient) {
    }

    private final List<Term> terms;
    private final long constant;

    private LinearExpr(List<Term> terms, long constant) {
        this.terms = Collections.unmodifiableList(terms);
        this.constant = constant;
    }

    public static LinearExpr sum(Collection<ModelVariable> variables) {
        Builder b = builder();
        for (ModelVariable v : variables) {
            b.addTerm(v, 1);
        }
        return b.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<Term> getTerms() {
        return terms;
    }

    public long getConstant() {
        return constant;
    }

    public boolean isEmpty() {
        return terms.isEmpty();
    }

    /** Evaluates against a value vector indexed by {@link ModelVariable#getIndex()}. */
    public long evaluate(long[] values) {
        long total = constant;
        for (Term t : terms) {
            total += t.coefficient() * values[t.variable().getIndex()];
        }
        return total;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (Term t : terms) {
            if (sb.length() > 0) sb.append(" + ");
            if (t.coefficient() != 1) sb.append(t.coefficient()).append('*');
            sb.append(t.variable().getName());
        }
        if (constant != 0 || sb.length() == 0) {
            if (sb.length() > 0) sb.append(" + ");
            sb.append(constant);
        }
        return sb.toString();
    }

    public static final class Builder {
        private final List<Term> terms = new ArrayList<>();
        private long constant;

        private Builder() {
        }

        public Builder addTerm(ModelVariable variable, long coefficient) {
            if (coefficient != 0) {
                terms.add(new Term(variable, coefficient));
            }
            return this;
        }

        public Builder addAll(Collection<ModelVariable> variables) {
            for (ModelVariable v : variables) {
                addTerm(v, 1);
            }
            return this;
        }

        public Builder addExpr(LinearExpr expr, long factor) {
            for (Term t : expr.terms) {
                addTerm(t.variable(), t.coefficient() * factor);
            }
            constant += expr.constant * factor;
            return this;
        }

        public Builder addConstant(long value) {
            constant += value;
            return this;
        }

        public LinearExpr build() {
            return new LinearExpr(new ArrayList<>(terms), constant);
        }
    }
}
