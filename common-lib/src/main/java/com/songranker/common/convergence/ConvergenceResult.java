package com.songranker.common.convergence;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Immutable output of {@link ConvergenceScorer#score}.
 *
 * <ul>
 *   <li>{@code score}      — 0–100, the single number persisted with a run</li>
 *   <li>{@code coverage}   — breadth and volume of determinate comparisons [0.0, 1.0]</li>
 *   <li>{@code separation} — spread and data-backed confidence of the strengths [0.0, 1.0]</li>
 *   <li>{@code stability}  — agreement of the top 10 with the ranking before the latest outcomes [0.0, 1.0]</li>
 * </ul>
 */
public record ConvergenceResult(
    @JsonProperty("score")      int    score,
    @JsonProperty("coverage")   double coverage,
    @JsonProperty("separation") double separation,
    @JsonProperty("stability")  double stability
) {

    public static ConvergenceResult settled() {
        return new ConvergenceResult(100, 1.0, 1.0, 1.0);
    }

    public static ConvergenceResult empty() {
        return new ConvergenceResult(0, 0.0, 0.0, 0.0);
    }
}
