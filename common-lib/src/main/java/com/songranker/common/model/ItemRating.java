package com.songranker.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.songranker.common.rating.RatingScale;

/**
 * Strength, derived rating and vote count for a single item after a ranking run.
 *
 * <p>{@code strength} is log-space (0.0 = average) and is the source of truth;
 * {@code rating} is always {@link RatingScale#rating(double)} of it.
 * {@code votesCount} is only meaningful for artist-wide runs (0 for sessions).
 */
public record ItemRating(
    @JsonProperty("itemId")     String itemId,
    @JsonProperty("strength")   double strength,
    @JsonProperty("rating")     double rating,
    @JsonProperty("votesCount") long   votesCount
) {

    public static ItemRating of(String itemId, double strength) {
        return new ItemRating(itemId, strength, RatingScale.rating(strength), 0L);
    }

    public static ItemRating of(String itemId, double strength, long votesCount) {
        return new ItemRating(itemId, strength, RatingScale.rating(strength), votesCount);
    }

    /** Neutral defaults written for items that have never been compared. */
    public static ItemRating neutral(String itemId) {
        return of(itemId, 0.0, 0L);
    }
}
