package io.github.typepath;

/// Remaining allowance for object and dictionary descent during one traversal.
///
/// The budget belongs to a traversal, not to a schema: the same schema can be
/// enumerated with different budgets. It is spent one unit per object or dictionary
/// level entered through a field or dictionary key, and never on array or tuple index
/// descent.
public record DepthBudget(int remaining) {

    /// Default maximum depth
    public static final int DEFAULT_MAX = 5;

    public DepthBudget {
        if (remaining < 0) {
            throw new IllegalArgumentException("remaining must be >= 0: " + remaining);
        }
    }

    public static DepthBudget of(int max) {
        return new DepthBudget(max);
    }

    public static DepthBudget defaults() {
        return new DepthBudget(DEFAULT_MAX);
    }

    public boolean isExhausted() {
        return remaining == 0;
    }

    /// @return the budget left after one object or dictionary descent
    /// @throws IllegalStateException if the budget is already exhausted
    public DepthBudget descend() {
        if (isExhausted()) {
            throw new IllegalStateException("Depth budget exhausted");
        }
        return new DepthBudget(remaining - 1);
    }
}
