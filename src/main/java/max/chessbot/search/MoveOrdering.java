package max.chessbot.search;

import max.chessbot.game.Move;
import max.chessbot.search.evaluator.PieceValues;

import java.util.Random;

/**
 * Ordering only changes how fast a cutoff is found, never the result of the search.
 */
final class MoveOrdering {
    private static final int TT_MOVE_SCORE = Integer.MAX_VALUE;
    private static final int HINT_MOVE_SCORE = Integer.MAX_VALUE - 1;

    // Jitter stays below the gap between two distinct moving pieces (10 * 1 pawn)
    private static final int JITTER_SCALE = 100;

    private MoveOrdering() {}

    /**
     * Sorts {@code moves[0..n)} best first: the transposition move, then the hint move, then the others by
     * {@code 10000 x captured value + 10 x moving piece value} plus a random tie-break.
     */
    static void order(int[] moves, int n, int ttMove, int hintMove, int[] scores, Random random) {
        for (int i = 0; i < n; i++) {
            final int m = moves[i];
            final int jitter = random.nextInt(JITTER_SCALE);
            if (m == ttMove) {
                scores[i] = TT_MOVE_SCORE;
            } else if (m == hintMove) {
                scores[i] = HINT_MOVE_SCORE;
            } else {
                scores[i] = scoreMove(m) * JITTER_SCALE + jitter;
            }
        }
        // insertion sort by score desc
        for (int i = 1; i < n; i++) {
            int m = moves[i], s = scores[i], j = i - 1;
            while (j >= 0 && scores[j] < s) {
                moves[j + 1] = moves[j];
                scores[j + 1] = scores[j];
                j--;
            }
            moves[j + 1] = m;
            scores[j + 1] = s;
        }
    }

    /** King moves weigh nothing: its ordering value is 0. */
    static int scoreMove(int move) {
        return 10000 * PieceValues.ORDERING_VAL[Move.getCaptured(move)]
                + 10 * PieceValues.ORDERING_VAL[Move.getPieceType(move)];
    }

    /** Neither a capture nor a promotion. Whether it gives check is known only once played. */
    static boolean isQuiet(int move) {
        return !Move.isCapture(move) && !Move.isPromotion(move);
    }

    /** The move captures on the square the previous move just captured on. */
    static boolean isRecapture(int move, int lastMove) {
        return lastMove != Move.NO_MOVE
                && Move.isCapture(lastMove)
                && Move.isCapture(move)
                && Move.getEndPosition(move) == Move.getEndPosition(lastMove);
    }
}
