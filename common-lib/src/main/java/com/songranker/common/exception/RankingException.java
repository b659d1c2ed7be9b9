package com.songranker.common.exception;

/**
 * Typed failure of a ranking run. {@code scope} is the session id or artist
 * the run was computing when it failed.
 */
public class RankingException extends RuntimeException {
    private final String scope;

    public RankingException(String scope, String message) {
        super("[" + scope + "] " + message);
        this.scope = scope;
    }

    public RankingException(String scope, String message, Throwable cause) {
        super("[" + scope + "] " + message, cause);
        this.scope = scope;
    }

    public String getScope() {
        return scope;
    }
}
