package com.songranker.common.rating;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RatingScaleTest {

    @Test
    @DisplayName("K = 400 / ln 10 ≈ 173.72")
    void scaleFactor() {
        assertEquals(173.7178, RatingScale.K, 1e-4);
    }

    @Test
    @DisplayName("average strength maps to 1500")
    void baseRating() {
        assertEquals(1500.0, RatingScale.rating(0.0));
        assertEquals(1500.0 + RatingScale.K, RatingScale.rating(1.0), 1e-12);
    }

    @Test
    @DisplayName("rating probabilities equal strength probabilities")
    void probabilityIdentity() {
        double[][] pairs = { {0.0, 0.0}, {1.3, -0.4}, {-2.0, 3.5}, {5.0, 4.9} };
        for (double[] pair : pairs) {
            double fromStrengths = RatingScale.winProbability(pair[0], pair[1]);
            double fromRatings   = RatingScale.expectedScore(
                RatingScale.rating(pair[0]), RatingScale.rating(pair[1]));
            assertEquals(fromStrengths, fromRatings, 1e-12);
        }
    }

    @Test
    @DisplayName("400-point gap → 10:1 odds")
    void fourHundredPoints() {
        assertEquals(10.0 / 11.0, RatingScale.expectedScore(1900.0, 1500.0), 1e-12);
    }
}
