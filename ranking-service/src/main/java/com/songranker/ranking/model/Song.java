package com.songranker.ranking.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.util.UUID;

/**
 * A catalog song together with its artist-wide ranking state.
 *
 * <p>{@code globalBtStrength} is log-space (0.0 = average) and is the source of truth;
 * {@code globalElo} is always rewritten from it in the same update.
 */
@Data
@NoArgsConstructor
@Table("songs")
public class Song {

    @Id
    private UUID id;

    private String name;
    private String artist;

    private double globalElo;
    private double globalBtStrength;
    private long   globalVotesCount;
}
