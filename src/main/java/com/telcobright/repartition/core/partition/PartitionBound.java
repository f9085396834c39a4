package com.telcobright.repartition.core.partition;

import com.telcobright.repartition.core.model.Identifiers;

import java.util.Objects;

/**
 * One explicitly declared slice of a target scheme: its name and the bound
 * expression exactly as the database expects it, e.g.
 * {@code TO_DATE('2024-01-01','YYYY-MM-DD')}, {@code 1000} or {@code MAXVALUE}.
 * For LIST schemes the expression is the value list.
 */
public final class PartitionBound {

    private final String name;
    private final String expression;

    public PartitionBound(String name, String expression) {
        this.name = Identifiers.requireValid(name, "Partition name");
        if (expression == null || expression.trim().isEmpty()) {
            throw new IllegalArgumentException("Bound expression cannot be null or empty for partition " + name);
        }
        if (expression.contains(";")) {
            throw new IllegalArgumentException("Bound expression must be a single expression: " + expression);
        }
        this.expression = expression.trim();
    }

    public String getName() { return name; }
    public String getExpression() { return expression; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PartitionBound)) return false;
        PartitionBound that = (PartitionBound) o;
        return name.equals(that.name) && expression.equals(that.expression);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, expression);
    }

    @Override
    public String toString() {
        return name + " < " + expression;
    }
}
