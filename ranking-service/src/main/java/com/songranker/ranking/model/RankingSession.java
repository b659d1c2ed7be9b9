package com.songranker.ranking.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.util.UUID;

@Data
@NoArgsConstructor
@Table("sessions")
public class RankingSession {

    @Id
    private UUID id;

    /** Last convergence score (0–100); null until the session has been ranked once. */
    private Integer convergenceScore;
}
