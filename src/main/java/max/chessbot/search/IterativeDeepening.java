package max.chessbot.search;

import max.chessbot.game.GamePosition;
import max.chessbot.game.Move;
import max.chessbot.search.evaluator.GameValues;

import java.util.function.Consumer;

final class IterativeDeepening {

    private IterativeDeepening() {}

    static SearchResult run(GamePosition position, SearchContext ctx, Consumer<String> out) {
        final SearchConfig cfg = ctx.cfg;
        final int[] rootMoves = ctx.moveBuf[0];
        final int n = position.getLegalMoves(rootMoves);
        if (n == 0) {
            throw new IllegalStateException("No legal move available: the game is already over");
        }
        if (n == 1) {
            return new SearchResult(rootMoves[0], 0, 0, 0, ctx.timer.millisElapsedThisTurn());
        }

        // Nothing may complete under a pathological budget, keep a legal move at hand
        MoveOrdering.order(rootMoves, n, Move.NO_MOVE, ctx.hintFor(position.zobristKey()), ctx.scoreBuf[0], ctx.random);
        final int fallbackMove = rootMoves[0];

        final int maxDepth = Math.min(cfg.maxDepth, SearchConstants.MAX_PLY - cfg.maxExtensionPlies);
        SearchResult last = null;
        int stableIterations = 0;

        for (int depth = 1; depth <= maxDepth; depth++) {
            if (depth > 1 && TimeControl.deadlineReached(ctx)) break;

            SearchResult r = AlphaBeta.search(position, ctx, depth);
            if (r == null) {
                out.accept("info string depth " + depth + " aborted after " + ctx.nodes + " nodes");
                break;
            }
            stableIterations = (last != null && last.move() == r.move()) ? stableIterations + 1 : 0;
            last = r;
            out.accept(r.toInfo());

            if (GameValues.isMateScore(r.score())) {
                // a forced result confirmed twice in a row will not change with depth
                if (stableIterations >= 1) break;
            } else if (cfg.stableIterationsToStop > 0
                    && stableIterations >= cfg.stableIterationsToStop
                    && depth >= cfg.minStableDepth
                    && ctx.timer.millisElapsedThisTurn() >= cfg.minThinkMs) {
                break;
            }
        }

        if (last == null) {
            return new SearchResult(fallbackMove, 0, 0, ctx.totalNodes, ctx.timer.millisElapsedThisTurn());
        }
        return last;
    }
}
