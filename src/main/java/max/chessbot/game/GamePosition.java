package max.chessbot.game;

/**
 * What the search needs from a chess position. Moves are packed ints (see {@link Move}),
 * colors are {@link max.chessbot.utils.ColorUtils#WHITE} / {@link max.chessbot.utils.ColorUtils#BLACK},
 * squares run from a1 = 0 to h8 = 63.
 * <p>
 * The position is mutated in place: every {@link #playMove(int)} must be paired with an {@link #undoMove(int)}
 * of the same move, strictly nested.
 */
public interface GamePosition {

    /**
     * Fills the buffer with the legal moves of the side to move.
     *
     * @return the number of moves written; 0 on checkmate or stalemate. Rule draws do not empty the list,
     * see {@link #isDraw()}
     */
    int getLegalMoves(int[] buffer);

    void playMove(int move);

    /**
     * Reverts the last played move.
     *
     * @throws IllegalStateException if {@code move} is not the last move played
     */
    void undoMove(int move);

    /** Side to move. */
    int currentPlayer();

    boolean inCheck();

    boolean isCheckmate();

    /** Draw by rule: repetition, fifty-move rule, insufficient material or stalemate. */
    boolean isDraw();

    /** 64-bit fingerprint: side to move, piece placement, castling and en passant rights. */
    long zobristKey();

    /** Every square attacked by the pieces of {@code color}. */
    long getAttackBB(int color);

    /** Squares attacked by the piece standing on {@code square}, 0 if empty. */
    long getPieceAttackBB(int square);

    /** Piece type on the square, {@link max.chessbot.utils.PieceUtils#NONE} when empty. */
    byte getPieceTypeAt(int square);

    /** Color of the piece on the square, 0 when empty. */
    int getColorAt(int square);

    int getKingPosition(int color);

    long getPiecesBB();

    long getPiecesBB(int color);
}
