package com.songranker.ranking.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.util.UUID;

/**
 * Membership of a song in a ranking session, with the session-local strength and rating.
 * A null strength means the song has never been ranked in this session.
 */
@Data
@NoArgsConstructor
@Table("session_songs")
public class SessionSong {

    @Id
    private UUID id;

    private UUID sessionId;
    private UUID songId;

    private Double btStrength;
    private Double localElo;
}
