package com.songranker.ranking.dto;

import com.songranker.common.convergence.ConvergenceResult;
import com.songranker.common.model.ItemRating;

import java.util.List;

/**
 * Everything one ranking run wrote, returned to the caller.
 *
 * @param scope           session id or artist the run covered
 * @param ratings         new strength, rating and vote count per item
 * @param convergence     convergence of the run (persisted for sessions only)
 * @param outcomes        outcomes read for the run, skips included
 * @param skippedOutcomes malformed outcomes or outcomes naming items outside the run
 * @param degraded        the solver failed and neutral strengths were written
 */
public record RankingRunResult(
    String            scope,
    List<ItemRating>  ratings,
    ConvergenceResult convergence,
    int               outcomes,
    int               skippedOutcomes,
    boolean           degraded
) {}
