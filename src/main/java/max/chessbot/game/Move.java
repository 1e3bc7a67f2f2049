package max.chessbot.game;

import max.chessbot.utils.PieceUtils;

/**
 * Moves are packed into an int to stay allocation-free on the hot path:
 * <pre>
 *  [22..20] captured piece type
 *  [19..17] promotion piece type
 *  [16..15] special flag (en passant / castle king side / castle queen side)
 *  [14..12] moving piece type
 *  [11..6]  start square
 *  [5..0]   end square
 * </pre>
 * A real move always carries a moving piece type, so {@link #NO_MOVE} (0) never collides with one.
 */
public final class Move {
    public static final int NO_MOVE = 0;

    private static final int FLAGS_MASK = 0b11 << 15;
    private static final int EN_PASSANT_FLAG = 0b01 << 15;
    private static final int CASTLE_KING_SIDE_FLAG = 0b10 << 15;
    private static final int CASTLE_QUEEN_SIDE_FLAG = 0b11 << 15;

    private Move() {}

    public static int asBytes(final int startPosition, final int endPosition, final byte pieceType) {
        return (pieceType << 12) | (startPosition << 6) | endPosition;
    }

    public static int asBytes(final int startPosition, final int endPosition,
                              final byte pieceType, final byte captured, final byte promotion) {
        return (captured << 20) | (promotion << 17) | asBytes(startPosition, endPosition, pieceType);
    }

    public static int asBytesEnPassant(final int startPosition, final int endPosition) {
        return asBytes(startPosition, endPosition, PieceUtils.PAWN, PieceUtils.PAWN, PieceUtils.NONE) | EN_PASSANT_FLAG;
    }

    public static int asBytesCastle(final int startPosition, final int endPosition) {
        int flag = endPosition > startPosition ? CASTLE_KING_SIDE_FLAG : CASTLE_QUEEN_SIDE_FLAG;
        return asBytes(startPosition, endPosition, PieceUtils.KING) | flag;
    }

    public static int getStartPosition(final int bytes) {
        return (bytes >>> 6) & 0b111111;
    }

    public static int getEndPosition(final int bytes) {
        return bytes & 0b111111;
    }

    public static byte getPieceType(final int bytes) {
        return (byte) ((bytes >>> 12) & 0b111);
    }

    public static byte getPromotion(final int bytes) {
        return (byte) ((bytes >>> 17) & 0b111);
    }

    public static byte getCaptured(final int bytes) {
        return (byte) ((bytes >>> 20) & 0b111);
    }

    public static boolean isCapture(final int bytes) {
        return getCaptured(bytes) != PieceUtils.NONE;
    }

    public static boolean isPromotion(final int bytes) {
        return getPromotion(bytes) != PieceUtils.NONE;
    }

    public static boolean isCastleKingSide(final int bytes) {
        return (bytes & FLAGS_MASK) == CASTLE_KING_SIDE_FLAG;
    }

    public static boolean isCastleQueenSide(final int bytes) {
        return (bytes & FLAGS_MASK) == CASTLE_QUEEN_SIDE_FLAG;
    }

    public static boolean isEnPassant(final int bytes) {
        return (bytes & FLAGS_MASK) == EN_PASSANT_FLAG;
    }
}
