package com.songranker.common.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class OutcomeTest {

    @Test
    @DisplayName("win, tie and skip classification")
    void classification() {
        assertTrue(Outcome.win("A", "B").isDeterminate());
        assertTrue(Outcome.tie("A", "B").isDeterminate());
        assertFalse(Outcome.skip("A", "B").isDeterminate());
        assertEquals("B", Outcome.win("A", "B").loser());
        assertNull(Outcome.tie("A", "B").loser());
    }

    @Test
    @DisplayName("malformed records are detected")
    void wellFormed() {
        assertTrue(Outcome.win("A", "B").isWellFormed());
        assertFalse(new Outcome("A", "A", null, false, null).isWellFormed());
        assertFalse(new Outcome(null, "B", null, false, null).isWellFormed());
        assertFalse(new Outcome("A", "B", "C", false, null).isWellFormed());
        assertFalse(new Outcome("A", "B", "A", true, null).isWellFormed());
    }

    @Test
    @DisplayName("neutral rating is 1500 with no votes")
    void neutralRating() {
        ItemRating rating = ItemRating.neutral("A");
        assertEquals(0.0, rating.strength());
        assertEquals(1500.0, rating.rating());
        assertEquals(0L, rating.votesCount());
    }
}
