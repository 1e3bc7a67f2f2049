package max.chessbot.search;

import max.chessbot.game.GamePosition;
import max.chessbot.game.Move;
import max.chessbot.search.evaluator.GameValues;
import max.chessbot.search.transpositiontable.TranspositionTable;

import static max.chessbot.search.SearchConstants.ABORTED;
import static max.chessbot.search.SearchConstants.INF;

/**
 * Depth-limited fail-soft minimax with alpha-beta pruning, kept as two one-sided bounds.
 * Scores are always from the root color's point of view: the root color maximizes, its opponent minimizes.
 * <p>
 * A frame that sees the deadline returns {@link SearchConstants#ABORTED}; every caller checks for it and passes it
 * up, after having undone its move.
 */
public final class AlphaBeta {

    private AlphaBeta() {}

    /**
     * Searches the position to {@code depthLimit} plies.
     *
     * @return the best move and its score, a {@link Move#NO_MOVE} result with a mate or draw score if the position
     * is terminal, or {@code null} if the deadline fired before the search completed
     */
    public static SearchResult search(GamePosition position, SearchContext ctx, int depthLimit) {
        ctx.newIteration(depthLimit);
        long start = ctx.timer.millisElapsedThisTurn();
        int score = minimax(position, ctx, depthLimit, 0, -INF, INF, Move.NO_MOVE);
        ctx.totalNodes += ctx.nodes;
        if (score == ABORTED) {
            return null;
        }
        return new SearchResult(ctx.bestMove[0], score, depthLimit, ctx.nodes,
                Math.max(0, ctx.timer.millisElapsedThisTurn() - start));
    }

    static int minimax(GamePosition position, SearchContext ctx, int depthLimit, int ply,
                       int lowerBound, int upperBound, int lastMove) {
        ctx.bestMove[ply] = Move.NO_MOVE;
        ctx.nodes++;
        if (ply >= ctx.cfg.abortCheckMinPly
                && (ctx.nodes & (ctx.cfg.abortCheckInterval - 1)) == 0
                && TimeControl.deadlineReached(ctx)) {
            return ABORTED;
        }

        final boolean maximizing = position.currentPlayer() == ctx.rootColor;
        final int[] moves = ctx.moveBuf[ply];
        final int n = position.getLegalMoves(moves);

        if (n == 0) {
            if (position.inCheck()) {
                int mate = mateScore(ctx, ply);
                return maximizing ? -mate : mate;
            }
            return GameValues.DRAW_VALUE; // stalemate
        }
        // The root is always expanded: a claimable draw there still needs a move
        if (ply > 0 && position.isDraw()) {
            return GameValues.DRAW_VALUE;
        }
        if (ply >= depthLimit || ply >= SearchConstants.MAX_PLY) {
            return ctx.evaluator.evaluate(position);
        }

        final int depthRemaining = depthLimit - ply;
        final long key = position.zobristKey();

        int ttMove = Move.NO_MOVE;
        TranspositionTable.Hit hit = ctx.ttHit;
        if (ctx.tt.probe(depthRemaining, key, hit)) {
            ttMove = hit.move;
            switch (hit.flag) {
                case TranspositionTable.TT_EXACT -> {
                    ctx.ttCutoffs++;
                    ctx.bestMove[ply] = hit.move;
                    return hit.score;
                }
                case TranspositionTable.TT_LOWER -> lowerBound = Math.max(lowerBound, hit.score);
                case TranspositionTable.TT_UPPER -> upperBound = Math.min(upperBound, hit.score);
                default -> throw new IllegalStateException("Unknown bound flag " + hit.flag);
            }
        }

        MoveOrdering.order(moves, n, ttMove, ctx.hintFor(key), ctx.scoreBuf[ply], ctx.random);

        final boolean moverInCheck = position.inCheck();
        int bestMove = Move.NO_MOVE;
        int bestScore = maximizing ? -INF : INF;
        byte flag = TranspositionTable.TT_EXACT;

        for (int i = 0; i < n; i++) {
            final int move = moves[i];
            int score;
            position.playMove(move);
            try {
                int childLimit = depthLimit;
                boolean givesCheck = position.inCheck();
                if ((givesCheck || MoveOrdering.isRecapture(move, lastMove)) && depthLimit < ctx.plyCeiling) {
                    childLimit++;
                } else if (i > 0 && !givesCheck && !moverInCheck && MoveOrdering.isQuiet(move)
                        && depthRemaining >= ctx.cfg.reductionMinRemaining) {
                    childLimit -= depthRemaining / ctx.cfg.reductionDivisor;
                }
                score = minimax(position, ctx, childLimit, ply + 1, lowerBound, upperBound, move);
            } finally {
                position.undoMove(move);
            }
            if (score == ABORTED) {
                return ABORTED;
            }

            if (maximizing) {
                if (score >= upperBound) {
                    bestMove = move;
                    bestScore = score;
                    flag = TranspositionTable.TT_LOWER;
                    break;
                }
                lowerBound = Math.max(lowerBound, score);
            } else {
                if (score <= lowerBound) {
                    bestMove = move;
                    bestScore = score;
                    flag = TranspositionTable.TT_UPPER;
                    break;
                }
                upperBound = Math.min(upperBound, score);
            }
            if (bestMove == Move.NO_MOVE || (maximizing ? score > bestScore : score < bestScore)) {
                bestMove = move;
                bestScore = score;
            }
        }

        ctx.tt.store(depthRemaining, key, bestMove, bestScore, flag);
        ctx.recordHint(key, bestMove);
        ctx.bestMove[ply] = bestMove;
        return bestScore;
    }

    /** Positive magnitude of a mate seen at this ply: the closer the mate, the larger. */
    static int mateScore(SearchContext ctx, int ply) {
        return GameValues.CHECKMATE_VALUE * (ctx.plyCeiling - ply + 1);
    }
}
