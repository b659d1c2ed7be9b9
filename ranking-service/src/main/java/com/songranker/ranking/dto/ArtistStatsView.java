package com.songranker.ranking.dto;

import java.time.Instant;

public record ArtistStatsView(
    String  artist,
    long    processed,
    long    pending,
    Instant lastUpdated,
    Instant createdAt
) {}
