package max.chessbot.game.notations;

import max.chessbot.game.GamePosition;
import max.chessbot.game.Move;
import max.chessbot.game.MoveGenerator;
import max.chessbot.utils.PieceUtils;

/** UCI long algebraic notation, e.g. {@code e2e4} or {@code e7e8q}. */
public final class MoveIOUtils {

    private MoveIOUtils() {}

    public static String writeAlgebraicNotation(int move) {
        if (move == Move.NO_MOVE) {
            return "0000";
        }
        String notation = getSquareFromIndex(Move.getStartPosition(move)) + getSquareFromIndex(Move.getEndPosition(move));
        byte promotion = Move.getPromotion(move);
        return promotion == PieceUtils.NONE ? notation : notation + PieceUtils.toLetter(promotion);
    }

    /**
     * Finds the legal move of the position matching the notation.
     *
     * @throws IllegalArgumentException if no legal move matches
     */
    public static int parseMove(GamePosition position, String notation) {
        int[] moves = new int[MoveGenerator.MAX_MOVES];
        int n = position.getLegalMoves(moves);
        String wanted = notation.trim().toLowerCase();
        for (int i = 0; i < n; i++) {
            if (writeAlgebraicNotation(moves[i]).equals(wanted)) {
                return moves[i];
            }
        }
        throw new IllegalArgumentException("No legal move " + notation + " in this position");
    }

    public static String getSquareFromIndex(int index) {
        return "" + (char) ('a' + (index & 7)) + (char) ('1' + (index >>> 3));
    }

    public static int getSquareIndex(String square) {
        if (square.length() != 2) {
            throw new IllegalArgumentException("Invalid square " + square);
        }
        int file = Character.toLowerCase(square.charAt(0)) - 'a';
        int rank = square.charAt(1) - '1';
        if (file < 0 || file > 7 || rank < 0 || rank > 7) {
            throw new IllegalArgumentException("Invalid square " + square);
        }
        return rank * 8 + file;
    }
}
