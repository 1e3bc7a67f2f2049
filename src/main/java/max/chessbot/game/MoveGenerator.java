package max.chessbot.game;

import max.chessbot.utils.BitUtils;
import max.chessbot.utils.ColorUtils;
import max.chessbot.utils.PieceUtils;

/**
 * Legal move generation: pseudo-legal moves first, then each one is played and dropped if it leaves the
 * mover's king attacked.
 */
public final class MoveGenerator {
    public static final int MAX_MOVES = 256;

    private static final byte[] PROMOTIONS = {PieceUtils.QUEEN, PieceUtils.ROOK, PieceUtils.BISHOP, PieceUtils.KNIGHT};

    private MoveGenerator() {}

    public static int generateMoves(Game game, int[] buffer) {
        int n = generatePseudoLegalMoves(game, buffer);
        final int color = game.currentPlayer();
        final int opponent = ColorUtils.switchColor(color);

        int legal = 0;
        for (int i = 0; i < n; i++) {
            int move = buffer[i];
            game.playMove(move);
            boolean kingSafe = !game.isSquareAttacked(game.getKingPosition(color), opponent);
            game.undoMove(move);
            if (kingSafe) {
                buffer[legal++] = move;
            }
        }
        return legal;
    }

    static int generatePseudoLegalMoves(Game game, int[] buffer) {
        final int color = game.currentPlayer();
        final long friendlyBB = game.getPiecesBB(color);
        final long enemyBB = game.getPiecesBB(ColorUtils.switchColor(color));
        final long occupiedBB = friendlyBB | enemyBB;

        int n = generatePawnMoves(game, buffer, 0, color, enemyBB, occupiedBB);

        long piecesBB = friendlyBB & ~game.getPiecesBB(PieceUtils.PAWN, color);
        while (piecesBB != 0) {
            int from = BitUtils.bitScanForward(piecesBB);
            piecesBB &= piecesBB - 1;
            byte pieceType = game.getPieceTypeAt(from);
            long targetsBB = game.getPieceAttackBB(from) & ~friendlyBB;
            while (targetsBB != 0) {
                int to = BitUtils.bitScanForward(targetsBB);
                targetsBB &= targetsBB - 1;
                buffer[n++] = Move.asBytes(from, to, pieceType, game.getPieceTypeAt(to), PieceUtils.NONE);
            }
        }

        return generateCastleMoves(game, buffer, n, color, occupiedBB);
    }

    private static int generatePawnMoves(Game game, int[] buffer, int n, int color, long enemyBB, long occupiedBB) {
        final int forward = 8 * color;
        final int startRank = ColorUtils.isWhite(color) ? 1 : 6;
        final int promotionRank = ColorUtils.isWhite(color) ? 7 : 0;
        final int enPassantIndex = game.getEnPassantIndex();

        long pawnsBB = game.getPiecesBB(PieceUtils.PAWN, color);
        while (pawnsBB != 0) {
            int from = BitUtils.bitScanForward(pawnsBB);
            pawnsBB &= pawnsBB - 1;

            int to = from + forward;
            if (!BitUtils.isSet(occupiedBB, to)) {
                n = addPawnMove(buffer, n, from, to, PieceUtils.NONE, BitUtils.getRank(to) == promotionRank);
                int doubleTo = to + forward;
                if (BitUtils.getRank(from) == startRank && !BitUtils.isSet(occupiedBB, doubleTo)) {
                    buffer[n++] = Move.asBytes(from, doubleTo, PieceUtils.PAWN);
                }
            }

            long attacksBB = Attacks.pawn(from, color);
            long capturesBB = attacksBB & enemyBB;
            while (capturesBB != 0) {
                int target = BitUtils.bitScanForward(capturesBB);
                capturesBB &= capturesBB - 1;
                n = addPawnMove(buffer, n, from, target, game.getPieceTypeAt(target),
                        BitUtils.getRank(target) == promotionRank);
            }

            if (enPassantIndex != -1 && BitUtils.isSet(attacksBB, enPassantIndex)) {
                buffer[n++] = Move.asBytesEnPassant(from, enPassantIndex);
            }
        }
        return n;
    }

    private static int addPawnMove(int[] buffer, int n, int from, int to, byte captured, boolean promotes) {
        if (promotes) {
            for (byte promotion : PROMOTIONS) {
                buffer[n++] = Move.asBytes(from, to, PieceUtils.PAWN, captured, promotion);
            }
        } else {
            buffer[n++] = Move.asBytes(from, to, PieceUtils.PAWN, captured, PieceUtils.NONE);
        }
        return n;
    }

    private static int generateCastleMoves(Game game, int[] buffer, int n, int color, long occupiedBB) {
        final boolean white = ColorUtils.isWhite(color);
        final int kingSquare = white ? 4 : 60;
        final int kingSide = white ? ZobristHashKeys.WHITE_KING_SIDE : ZobristHashKeys.BLACK_KING_SIDE;
        final int queenSide = white ? ZobristHashKeys.WHITE_QUEEN_SIDE : ZobristHashKeys.BLACK_QUEEN_SIDE;

        boolean canKingSide = game.hasCastleRight(kingSide);
        boolean canQueenSide = game.hasCastleRight(queenSide);
        if ((!canKingSide && !canQueenSide) || game.getPiecesBB(PieceUtils.KING, color) != (1L << kingSquare)) {
            return n;
        }
        final int opponent = ColorUtils.switchColor(color);
        if (game.isSquareAttacked(kingSquare, opponent)) {
            return n;
        }

        if (canKingSide
                && hasRook(game, kingSquare + 3, color)
                && !BitUtils.isSet(occupiedBB, kingSquare + 1)
                && !BitUtils.isSet(occupiedBB, kingSquare + 2)
                && !game.isSquareAttacked(kingSquare + 1, opponent)
                && !game.isSquareAttacked(kingSquare + 2, opponent)) {
            buffer[n++] = Move.asBytesCastle(kingSquare, kingSquare + 2);
        }
        if (canQueenSide
                && hasRook(game, kingSquare - 4, color)
                && !BitUtils.isSet(occupiedBB, kingSquare - 1)
                && !BitUtils.isSet(occupiedBB, kingSquare - 2)
                && !BitUtils.isSet(occupiedBB, kingSquare - 3)
                && !game.isSquareAttacked(kingSquare - 1, opponent)
                && !game.isSquareAttacked(kingSquare - 2, opponent)) {
            buffer[n++] = Move.asBytesCastle(kingSquare, kingSquare - 2);
        }
        return n;
    }

    private static boolean hasRook(Game game, int square, int color) {
        return game.getPieceTypeAt(square) == PieceUtils.ROOK && game.getColorAt(square) == color;
    }
}
