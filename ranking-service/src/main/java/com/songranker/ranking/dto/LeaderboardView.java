package com.songranker.ranking.dto;

import java.time.Instant;
import java.util.List;

/**
 * Artist leaderboard with aggregation freshness. {@code pending} counts outcomes
 * recorded since the last aggregation; {@code lastUpdated} is null before the first one.
 */
public record LeaderboardView(
    String                 artist,
    List<LeaderboardEntry> entries,
    long                   processed,
    long                   pending,
    Instant                lastUpdated
) {}
