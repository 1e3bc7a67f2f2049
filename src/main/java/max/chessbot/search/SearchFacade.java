package max.chessbot.search;

import max.chessbot.game.GamePosition;
import max.chessbot.game.Move;

import java.util.function.Consumer;

public final class SearchFacade {

    private final SearchContext ctx;

    public SearchFacade(SearchConfig cfg) {
        this.ctx = new SearchContext(cfg);
    }

    public SearchContext context() {
        return ctx;
    }

    /**
     * Runs one turn of iterative deepening for the side to move.
     *
     * @throws IllegalStateException if the side to move has no legal move
     */
    public SearchResult findBestMove(GamePosition position, TurnTimer timer, Consumer<String> out) {
        final long deadlineMs = TimeControl.computeDeadlineMs(timer.millisRemaining(), ctx.cfg);
        ctx.newTurn(timer, deadlineMs, position.currentPlayer());
        out.accept("info string deadline " + deadlineMs + "ms, " + timer.millisRemaining() + "ms left on the clock");

        SearchResult sr = IterativeDeepening.run(position, ctx, out);

        if (ctx.cfg.debug) {
            out.accept(ctx.tt.toInfo());
            out.accept(ctx.evaluator.toInfo());
            verifyLegal(position, sr.move());
        }
        return sr;
    }

    private void verifyLegal(GamePosition position, int move) {
        int[] buf = ctx.moveBuf[0];
        int n = position.getLegalMoves(buf);
        for (int i = 0; i < n; i++) {
            if (buf[i] == move) return;
        }
        throw new IllegalStateException("Illegal best move " + move + (move == Move.NO_MOVE ? " (no move)" : ""));
    }
}
