package com.songranker.common.solver;

import java.util.Map;

/**
 * Output of one {@link StrengthSolver} run.
 *
 * <ul>
 *   <li>{@code strengths}       — item id → log-strength, one entry per input item</li>
 *   <li>{@code iterations}      — solver iterations actually performed</li>
 *   <li>{@code converged}       — true when the tolerance was reached (or no iteration was needed)</li>
 *   <li>{@code comparisons}     — directed comparison records built from the outcomes</li>
 *   <li>{@code skippedOutcomes} — malformed outcomes or outcomes naming unknown items</li>
 *   <li>{@code degraded}        — the numerical procedure failed and strengths were reset to 0.0;
 *                                 {@code degradationReason} says why</li>
 * </ul>
 *
 * <p>The solver never logs; callers inspect {@code degraded} and {@code skippedOutcomes}.
 */
public record SolverResult(
    Map<String, Double> strengths,
    int iterations,
    boolean converged,
    int comparisons,
    int skippedOutcomes,
    boolean degraded,
    String degradationReason
) {

    public double strengthOf(String itemId) {
        return strengths.getOrDefault(itemId, 0.0);
    }
}
