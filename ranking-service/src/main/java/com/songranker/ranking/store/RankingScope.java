package com.songranker.ranking.store;

import java.util.Locale;
import java.util.Objects;
import java.util.UUID;

/**
 * The set of outcomes one ranking run is computed over: a single session, or every
 * session of an artist.
 */
public record RankingScope(Kind kind, String key) {

    public enum Kind { SESSION, ARTIST }

    public RankingScope {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(key, "key");
    }

    public static RankingScope session(UUID sessionId) {
        return new RankingScope(Kind.SESSION, sessionId.toString());
    }

    public static RankingScope artist(String artist) {
        return new RankingScope(Kind.ARTIST, artist);
    }

    public boolean isSession() {
        return kind == Kind.SESSION;
    }

    public UUID sessionId() {
        if (!isSession()) {
            throw new IllegalStateException("not a session scope: " + key);
        }
        return UUID.fromString(key);
    }

    /** Case- and whitespace-insensitive artist identity used for locks and stats rows. */
    public static String normalizeArtist(String artist) {
        return artist.trim().toLowerCase(Locale.ROOT);
    }

    @Override
    public String toString() {
        return kind.name().toLowerCase(Locale.ROOT) + ":" + key;
    }
}
