package max.chessbot.search;

import max.chessbot.game.notations.MoveIOUtils;

/**
 * @param move  best move found, {@link max.chessbot.game.Move#NO_MOVE} for a terminal position
 * @param score from the searching color's point of view, in millipawns
 * @param depth nominal depth of the completed iteration, 0 when no search was needed
 */
public record SearchResult(int move, int score, int depth, long nodes, long timeMs) {

    public String toInfo() {
        return "info depth " + depth
                + " score " + score
                + " nodes " + nodes
                + " time " + timeMs
                + " move " + MoveIOUtils.writeAlgebraicNotation(move);
    }

    @Override
    public String toString() {
        return "SearchResult\n"
                + "best move: " + MoveIOUtils.writeAlgebraicNotation(move) + "\n"
                + "score: " + score + "\n"
                + "depth: " + depth + "\n"
                + "nodes: " + nodes + "\n"
                + "search time (ms): " + timeMs;
    }
}
