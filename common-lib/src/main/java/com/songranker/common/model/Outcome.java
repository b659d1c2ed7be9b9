package com.songranker.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One recorded pairwise judgment between {@code itemA} and {@code itemB}.
 *
 * <ul>
 *   <li>{@code winner} set, {@code tie} false — a decisive result.</li>
 *   <li>{@code winner} null, {@code tie} true — both items judged equal.</li>
 *   <li>{@code winner} null, {@code tie} false — explicit "no preference" skip.
 *       Kept as history, never used for strength estimation.</li>
 * </ul>
 *
 * <p>{@code decisionLatencyMs} is the time the judge took to decide (nullable).
 * No logic beyond classification helpers — pure model.
 */
public record Outcome(
    @JsonProperty("itemA")             String  itemA,
    @JsonProperty("itemB")             String  itemB,
    @JsonProperty("winner")            String  winner,
    @JsonProperty("tie")               boolean tie,
    @JsonProperty("decisionLatencyMs") Long    decisionLatencyMs
) {

    public static Outcome win(String winner, String loser) {
        return new Outcome(winner, loser, winner, false, null);
    }

    public static Outcome win(String winner, String loser, long decisionLatencyMs) {
        return new Outcome(winner, loser, winner, false, decisionLatencyMs);
    }

    public static Outcome tie(String itemA, String itemB) {
        return new Outcome(itemA, itemB, null, true, null);
    }

    public static Outcome skip(String itemA, String itemB) {
        return new Outcome(itemA, itemB, null, false, null);
    }

    /** Winner or tie present. Skips are not determinate. */
    @JsonIgnore
    public boolean isDeterminate() {
        return tie || winner != null;
    }

    /**
     * A record is well-formed when both sides are present and distinct, a tie carries
     * no winner, and a winner (if any) is one of the two compared items.
     */
    @JsonIgnore
    public boolean isWellFormed() {
        if (itemA == null || itemB == null || itemA.equals(itemB)) return false;
        if (tie) return winner == null;
        return winner == null || winner.equals(itemA) || winner.equals(itemB);
    }

    /** The item that lost a decisive result, or {@code null} for ties and skips. */
    @JsonIgnore
    public String loser() {
        if (tie || winner == null) return null;
        return winner.equals(itemA) ? itemB : itemA;
    }

    public boolean references(String itemId) {
        return itemId != null && (itemId.equals(itemA) || itemId.equals(itemB));
    }
}
