package com.songranker.ranking.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * Bookkeeping of the artist-wide aggregation, keyed by the normalized artist name
 * (trimmed, lower case).
 */
@Data
@NoArgsConstructor
@Table("artist_stats")
public class ArtistStats {

    @Id
    private String artist;

    private LocalDateTime lastGlobalUpdateAt;

    /** Outcomes folded into the last aggregation. */
    private long totalComparisonsCount;

    private LocalDateTime createdAt;
}
