package com.songranker.ranking.service;

import com.songranker.common.solver.SolverResult;
import com.songranker.ranking.store.RankingScope;
import org.slf4j.Logger;

/** Logs what the solver recovered from; the solver itself never logs. */
final class RunDiagnostics {

    private RunDiagnostics() {}

    static void report(Logger log, String tag, RankingScope scope, SolverResult solved) {
        if (solved.degraded()) {
            log.warn("{} Solver degraded to neutral strengths. scope={} reason={}",
                tag, scope, solved.degradationReason());
        }
        if (solved.skippedOutcomes() > 0) {
            log.warn("{} Skipped malformed or foreign outcomes. scope={} skipped={}",
                tag, scope, solved.skippedOutcomes());
        }
        if (!solved.converged() && !solved.degraded()) {
            log.warn("{} Solver hit the iteration cap. scope={} iterations={}",
                tag, scope, solved.iterations());
        }
        log.debug("{} Solver done. scope={} iterations={} records={}",
            tag, scope, solved.iterations(), solved.comparisons());
    }
}
