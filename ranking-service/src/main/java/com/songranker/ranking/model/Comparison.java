package com.songranker.ranking.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * One recorded duel. {@code winnerId} null with {@code tie} false is an explicit skip.
 */
@Data
@NoArgsConstructor
@Table("comparisons")
public class Comparison {

    @Id
    private UUID id;

    private UUID sessionId;

    @Column("song_a_id")
    private UUID songAId;

    @Column("song_b_id")
    private UUID songBId;

    private UUID winnerId;

    @Column("is_tie")
    private boolean tie;

    private Long decisionTimeMs;

    private LocalDateTime createdAt;
}
