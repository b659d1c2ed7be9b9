package com.songranker.common.trigger;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class RankingTriggerPolicyTest {

    @Nested
    @DisplayName("isSessionRankDue()")
    class SessionTrigger {

        @Test
        @DisplayName("every 5th outcome triggers")
        void multiples() {
            assertTrue(RankingTriggerPolicy.isSessionRankDue(5, 5));
            assertTrue(RankingTriggerPolicy.isSessionRankDue(10, 5));
            assertFalse(RankingTriggerPolicy.isSessionRankDue(4, 5));
            assertFalse(RankingTriggerPolicy.isSessionRankDue(11, 5));
        }

        @Test
        @DisplayName("zero outcomes or non-positive interval never triggers")
        void degenerate() {
            assertFalse(RankingTriggerPolicy.isSessionRankDue(0, 5));
            assertFalse(RankingTriggerPolicy.isSessionRankDue(5, 0));
        }
    }

    @Nested
    @DisplayName("isGlobalUpdateDue()")
    class GlobalTrigger {

        private final Instant now = Instant.parse("2024-06-01T12:00:00Z");

        @Test
        @DisplayName("nothing pending → not due, even when never aggregated")
        void nothingPending() {
            assertFalse(RankingTriggerPolicy.isGlobalUpdateDue(0, null, now, Duration.ofMinutes(2)));
        }

        @Test
        @DisplayName("pending and never aggregated → due")
        void neverAggregated() {
            assertTrue(RankingTriggerPolicy.isGlobalUpdateDue(3, null, now, Duration.ofMinutes(2)));
        }

        @Test
        @DisplayName("pending and last run inside the interval → not due")
        void tooRecent() {
            assertFalse(RankingTriggerPolicy.isGlobalUpdateDue(3, now.minusSeconds(60), now,
                Duration.ofMinutes(2)));
        }

        @Test
        @DisplayName("pending and last run exactly one interval ago → due")
        void intervalElapsed() {
            assertTrue(RankingTriggerPolicy.isGlobalUpdateDue(3, now.minusSeconds(120), now,
                Duration.ofMinutes(2)));
        }

        @Test
        @DisplayName("pending count never negative")
        void pending() {
            assertEquals(4, RankingTriggerPolicy.pendingOutcomes(10, 6));
            assertEquals(0, RankingTriggerPolicy.pendingOutcomes(3, 6));
        }
    }
}
