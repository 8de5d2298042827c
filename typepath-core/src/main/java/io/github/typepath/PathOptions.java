package io.github.typepath;

/// Options shared by path enumeration and resolution.
///
/// @param maxDepth starting [DepthBudget] for enumeration
/// @param dictionaryValueDescent whether a path may continue past a dictionary key into
///        the value shape (`users.alice.name`); when off, only the key itself (`users.alice`)
///        is a valid path and enumeration stops at `users.*`
public record PathOptions(int maxDepth, boolean dictionaryValueDescent) {

    /// Depth 5, dictionary value descent on
    public static final PathOptions DEFAULT = new PathOptions(DepthBudget.DEFAULT_MAX, true);

    public PathOptions {
        if (maxDepth < 0) {
            throw new IllegalArgumentException("maxDepth must be >= 0");
        }
    }

    public PathOptions withMaxDepth(int newMaxDepth) {
        return new PathOptions(newMaxDepth, dictionaryValueDescent);
    }

    public PathOptions withDictionaryValueDescent(boolean enabled) {
        return new PathOptions(maxDepth, enabled);
    }

    DepthBudget budget() {
        return DepthBudget.of(maxDepth);
    }

    String summary() {
        return "maxDepth=" + maxDepth + ", dictionaryValueDescent=" + dictionaryValueDescent;
    }
}
