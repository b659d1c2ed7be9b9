package com.songranker.ranking.dto;

/**
 * @param rank     1-based position, ordered by rating descending
 * @param songId   song identifier
 * @param name     song title
 * @param strength artist-wide log-strength
 * @param rating   artist-wide display rating
 * @param votes    outcomes that referenced the song, skips included
 */
public record LeaderboardEntry(
    int    rank,
    String songId,
    String name,
    double strength,
    double rating,
    long   votes
) {}
