package max.chessbot.search.evaluator;

import max.chessbot.utils.PieceUtils;

public final class PieceValues {
    // Evaluation values, in millipawns. The king has no material value: losing it is scored as mate.
    public static final int PAWN_VALUE = 1000;
    public static final int KNIGHT_VALUE = 3000;
    public static final int BISHOP_VALUE = 3000;
    public static final int ROOK_VALUE = 5000;
    public static final int QUEEN_VALUE = 9000;
    public static final int KING_VALUE = 0;

    public static final int[] VAL = {
            0,
            PAWN_VALUE,
            KNIGHT_VALUE,
            BISHOP_VALUE,
            ROOK_VALUE,
            QUEEN_VALUE,
            KING_VALUE
    };

    // Plain pawn units, used by move ordering
    public static final int[] ORDERING_VAL = {0, 1, 3, 3, 5, 9, 0};

    // 1/500 of a pawn per attacked square
    public static final int MOBILITY_BONUS = 2;

    // Percent added per rank a pawn advanced from its start rank
    public static final int PAWN_ADVANCE_PERCENT = 5;

    // Percent added per step closer than the far corner (Manhattan distance 14) to the enemy king
    public static final int KING_PROXIMITY_PERCENT = 1;

    private PieceValues() {}

    public static int value(byte pieceType) {
        return VAL[pieceType];
    }

    public static boolean hasMaterialValue(byte pieceType) {
        return pieceType != PieceUtils.NONE && pieceType != PieceUtils.KING;
    }
}
