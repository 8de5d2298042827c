package io.github.typepath;

import java.util.List;
import java.util.Objects;

/// Record of how a path was resolved: every rule application that contributed to the
/// result, outermost first. Failed attempts are not listed. Union branches show up as
/// steps one level deeper than the union itself.
public record ResolutionTrace(Resolution result, List<Step> steps) {

    public ResolutionTrace {
        Objects.requireNonNull(result, "result must not be null");
        Objects.requireNonNull(steps, "steps must not be null");
        steps = List.copyOf(steps);
    }

    /// @param depth nesting level of the rule application
    /// @param rule the rule that matched
    /// @param remaining the path text the rule was applied to
    /// @param shape the shape the rule was applied at
    public record Step(int depth, ResolutionRule rule, String remaining, Schema shape) {
        public Step {
            Objects.requireNonNull(rule, "rule must not be null");
            Objects.requireNonNull(remaining, "remaining must not be null");
            Objects.requireNonNull(shape, "shape must not be null");
        }

        @Override
        public String toString() {
            return "  ".repeat(depth) + rule.description() + " '" + remaining + "' at " + shape;
        }
    }

    @Override
    public String toString() {
        final var sb = new StringBuilder();
        sb.append(result.path()).append(" => ");
        sb.append(result instanceof Resolution.Resolved resolved ? resolved.shape().toString() : "unresolvable");
        for (final var step : steps) {
            sb.append('\n').append(step);
        }
        return sb.toString();
    }
}
