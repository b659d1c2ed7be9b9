package com.songranker.common.rating;

/**
 * Converts solver strengths (natural-log units) to the human-facing rating scale.
 *
 * <pre>
 *   rating = K × strength + 1500,   K = 400 × log10(e) ≈ 173.72
 * </pre>
 *
 * <p>With this K the rating behaves like a classic logistic rating: the win
 * probability implied by two ratings,
 * {@code 1 / (1 + 10^((r_j − r_i) / 400))}, equals the paired-comparison
 * probability {@code e^{s_i} / (e^{s_i} + e^{s_j})} for the underlying strengths.
 *
 * <p>Pure static utility — no state, no failure cases.
 */
public final class RatingScale {

    public static final double BASE_RATING = 1500.0;

    /** Logistic rating spread: a 400-point gap means 10:1 odds. */
    public static final double RATING_SPREAD = 400.0;

    /** Rating points per unit of log-strength. */
    public static final double K = RATING_SPREAD / Math.log(10.0);

    private RatingScale() {}

    public static double rating(double strength) {
        return K * strength + BASE_RATING;
    }

    /** P(i beats j) from strengths, computed in a numerically stable logistic form. */
    public static double winProbability(double strengthI, double strengthJ) {
        return 1.0 / (1.0 + Math.exp(strengthJ - strengthI));
    }

    /** P(i beats j) from ratings. */
    public static double expectedScore(double ratingI, double ratingJ) {
        return 1.0 / (1.0 + Math.pow(10.0, (ratingJ - ratingI) / RATING_SPREAD));
    }
}
