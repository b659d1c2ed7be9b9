package com.songranker.common.solver;

/**
 * Tuning of {@link StrengthSolver}.
 *
 * <ul>
 *   <li>{@code regularization} — virtual wins and losses per item against an average
 *       opponent; keeps all-win / all-loss items finite. Must be ≥ 0.</li>
 *   <li>{@code maxIterations} — hard iteration cap (≥ 1).</li>
 *   <li>{@code tolerance} — stop once no strength moves by more than this (&gt; 0).</li>
 * </ul>
 */
public record SolverSettings(double regularization, int maxIterations, double tolerance) {

    public static final SolverSettings DEFAULTS = new SolverSettings(0.01, 100, 1e-8);

    public SolverSettings {
        if (regularization < 0.0 || Double.isNaN(regularization)) {
            throw new IllegalArgumentException("regularization must be >= 0 but was " + regularization);
        }
        if (maxIterations < 1) {
            throw new IllegalArgumentException("maxIterations must be >= 1 but was " + maxIterations);
        }
        if (!(tolerance > 0.0)) {
            throw new IllegalArgumentException("tolerance must be > 0 but was " + tolerance);
        }
    }
}
