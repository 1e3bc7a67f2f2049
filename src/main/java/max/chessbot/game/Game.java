package max.chessbot.game;

import max.chessbot.game.notations.FENUtils;
import max.chessbot.utils.BitUtils;
import max.chessbot.utils.ColorUtils;
import max.chessbot.utils.PieceUtils;

import java.util.Arrays;

/**
 * Bitboard position with in-place make/unmake. Reference implementation of {@link GamePosition}.
 */
public class Game implements GamePosition {
    private static final int INITIAL_HISTORY = 512;

    private final long[] typeBB = new long[7];
    private long whiteBB = 0;
    private long blackBB = 0;
    private final byte[] pieceAt = new byte[64];

    private int currentPlayer = ColorUtils.WHITE;
    private int castleRights = 0;
    private int enPassantIndex = -1;
    public int halfMoveClock = 0;
    public int fullMoveClock = 1;

    private long zobristKey = 0;

    // History stack, one entry per move played
    private int plyCount = 0;
    private int[] moveHistory = new int[INITIAL_HISTORY];
    private long[] keyHistory = new long[INITIAL_HISTORY];
    private long[] changesHistory = new long[INITIAL_HISTORY];

    // Last legal move count computed, so stalemate checks right after a move generation are free
    private long countedKey = 0;
    private int countedMoves = -1;

    private final int[] scratch = new int[MoveGenerator.MAX_MOVES];

    public static Game standard() {
        return FENUtils.getBoardFrom(FENUtils.STARTING_POSITION);
    }

    /* ===================== setup, used by FEN import ===================== */

    public void putPiece(int square, byte pieceType, int color) {
        addPiece(square, pieceType, color);
    }

    public void setCurrentPlayer(int currentPlayer) {
        this.currentPlayer = currentPlayer;
    }

    public void setCastleRight(int castleRight, boolean enabled) {
        if (enabled) castleRights |= 1 << castleRight;
        else castleRights &= ~(1 << castleRight);
    }

    public void setEnPassantIndex(int enPassantIndex) {
        this.enPassantIndex = enPassantIndex;
    }

    public void recomputeZobristKey() {
        zobristKey = ZobristHashKeys.getHashKey(this);
        countedMoves = -1;
    }

    /* ===================== GamePosition ===================== */

    @Override
    public int getLegalMoves(int[] buffer) {
        int n = MoveGenerator.generateMoves(this, buffer);
        countedKey = zobristKey;
        countedMoves = n;
        return n;
    }

    @Override
    public void playMove(int move) {
        ensureHistoryCapacity();
        moveHistory[plyCount] = move;
        keyHistory[plyCount] = zobristKey;
        changesHistory[plyCount] = GameChanges.asBytes(castleRights, enPassantIndex, halfMoveClock);
        plyCount++;

        final int color = currentPlayer;
        final int opponent = ColorUtils.switchColor(color);
        final int from = Move.getStartPosition(move);
        final int to = Move.getEndPosition(move);
        final byte pieceType = Move.getPieceType(move);
        final byte captured = Move.getCaptured(move);
        final byte promotion = Move.getPromotion(move);

        if (enPassantIndex != -1) {
            zobristKey ^= ZobristHashKeys.enPassantFile(enPassantIndex & 7);
            enPassantIndex = -1;
        }

        if (Move.isEnPassant(move)) {
            removePiece(to - 8 * color, PieceUtils.PAWN, opponent);
        } else if (captured != PieceUtils.NONE) {
            removePiece(to, captured, opponent);
        }

        removePiece(from, pieceType, color);
        addPiece(to, promotion != PieceUtils.NONE ? promotion : pieceType, color);

        if (Move.isCastleKingSide(move)) {
            removePiece(to + 1, PieceUtils.ROOK, color);
            addPiece(to - 1, PieceUtils.ROOK, color);
        } else if (Move.isCastleQueenSide(move)) {
            removePiece(to - 2, PieceUtils.ROOK, color);
            addPiece(to + 1, PieceUtils.ROOK, color);
        }

        if (pieceType == PieceUtils.PAWN && Math.abs(to - from) == 16) {
            enPassantIndex = from + 8 * color;
            zobristKey ^= ZobristHashKeys.enPassantFile(enPassantIndex & 7);
        }

        int rights = castleRights;
        if (pieceType == PieceUtils.KING) {
            if (ColorUtils.isWhite(color)) {
                rights &= ~((1 << ZobristHashKeys.WHITE_KING_SIDE) | (1 << ZobristHashKeys.WHITE_QUEEN_SIDE));
            } else {
                rights &= ~((1 << ZobristHashKeys.BLACK_KING_SIDE) | (1 << ZobristHashKeys.BLACK_QUEEN_SIDE));
            }
        }
        rights &= ~castleRightsTouchedBy(from);
        rights &= ~castleRightsTouchedBy(to);
        updateCastleRights(rights);

        if (pieceType == PieceUtils.PAWN || captured != PieceUtils.NONE) {
            halfMoveClock = 0;
        } else {
            halfMoveClock++;
        }
        if (ColorUtils.isBlack(color)) {
            fullMoveClock++;
        }

        currentPlayer = opponent;
        zobristKey ^= ZobristHashKeys.blackToMove();
    }

    @Override
    public void undoMove(int move) {
        if (plyCount == 0 || moveHistory[plyCount - 1] != move) {
            throw new IllegalStateException("Cannot undo move " + move + ": it is not the last move played");
        }
        plyCount--;

        final int color = ColorUtils.switchColor(currentPlayer);
        final int opponent = currentPlayer;
        final int from = Move.getStartPosition(move);
        final int to = Move.getEndPosition(move);
        final byte pieceType = Move.getPieceType(move);
        final byte captured = Move.getCaptured(move);
        final byte promotion = Move.getPromotion(move);

        if (Move.isCastleKingSide(move)) {
            removePiece(to - 1, PieceUtils.ROOK, color);
            addPiece(to + 1, PieceUtils.ROOK, color);
        } else if (Move.isCastleQueenSide(move)) {
            removePiece(to + 1, PieceUtils.ROOK, color);
            addPiece(to - 2, PieceUtils.ROOK, color);
        }

        removePiece(to, promotion != PieceUtils.NONE ? promotion : pieceType, color);
        addPiece(from, pieceType, color);

        if (Move.isEnPassant(move)) {
            addPiece(to - 8 * color, PieceUtils.PAWN, opponent);
        } else if (captured != PieceUtils.NONE) {
            addPiece(to, captured, opponent);
        }

        long changes = changesHistory[plyCount];
        castleRights = GameChanges.getPreviousCastleRights(changes);
        enPassantIndex = GameChanges.getPreviousEnPassantIndex(changes);
        halfMoveClock = GameChanges.getPreviousHalfMoveClock(changes);
        if (ColorUtils.isBlack(color)) {
            fullMoveClock--;
        }
        currentPlayer = color;
        zobristKey = keyHistory[plyCount];
    }

    @Override
    public int currentPlayer() {
        return currentPlayer;
    }

    @Override
    public boolean inCheck() {
        return isSquareAttacked(getKingPosition(currentPlayer), ColorUtils.switchColor(currentPlayer));
    }

    @Override
    public boolean isCheckmate() {
        return inCheck() && legalMovesCount() == 0;
    }

    @Override
    public boolean isDraw() {
        return halfMoveClock >= 100
                || isInsufficientMaterial()
                || isRepetition()
                || (!inCheck() && legalMovesCount() == 0);
    }

    @Override
    public long zobristKey() {
        return zobristKey;
    }

    @Override
    public long getAttackBB(int color) {
        long attackBB = 0L;
        long piecesBB = getPiecesBB(color);
        while (piecesBB != 0) {
            int sq = BitUtils.bitScanForward(piecesBB);
            piecesBB &= piecesBB - 1;
            attackBB |= getPieceAttackBB(sq);
        }
        return attackBB;
    }

    @Override
    public long getPieceAttackBB(int square) {
        long occupiedBB = getPiecesBB();
        return switch (pieceAt[square]) {
            case PieceUtils.PAWN -> Attacks.pawn(square, getColorAt(square));
            case PieceUtils.KNIGHT -> Attacks.knight(square);
            case PieceUtils.BISHOP -> Attacks.bishop(square, occupiedBB);
            case PieceUtils.ROOK -> Attacks.rook(square, occupiedBB);
            case PieceUtils.QUEEN -> Attacks.queen(square, occupiedBB);
            case PieceUtils.KING -> Attacks.king(square);
            default -> 0L;
        };
    }

    @Override
    public byte getPieceTypeAt(int square) {
        return pieceAt[square];
    }

    @Override
    public int getColorAt(int square) {
        long squareBB = BitUtils.getPositionIndexBitMask(square);
        if ((whiteBB & squareBB) != 0) return ColorUtils.WHITE;
        if ((blackBB & squareBB) != 0) return ColorUtils.BLACK;
        return 0;
    }

    @Override
    public int getKingPosition(int color) {
        return BitUtils.bitScanForward(typeBB[PieceUtils.KING] & getPiecesBB(color));
    }

    @Override
    public long getPiecesBB() {
        return whiteBB | blackBB;
    }

    @Override
    public long getPiecesBB(int color) {
        return ColorUtils.isWhite(color) ? whiteBB : blackBB;
    }

    /* ===================== queries used by move generation and notation ===================== */

    public long getPiecesBB(byte pieceType, int color) {
        return typeBB[pieceType] & getPiecesBB(color);
    }

    public boolean hasCastleRight(int castleRight) {
        return (castleRights & (1 << castleRight)) != 0;
    }

    public int getEnPassantIndex() {
        return enPassantIndex;
    }

    public boolean isSquareAttacked(int square, int byColor) {
        long occupiedBB = getPiecesBB();
        long attackersBB = getPiecesBB(byColor);
        long queensBB = typeBB[PieceUtils.QUEEN];
        return (Attacks.pawn(square, ColorUtils.switchColor(byColor)) & typeBB[PieceUtils.PAWN] & attackersBB) != 0
                || (Attacks.knight(square) & typeBB[PieceUtils.KNIGHT] & attackersBB) != 0
                || (Attacks.king(square) & typeBB[PieceUtils.KING] & attackersBB) != 0
                || (Attacks.bishop(square, occupiedBB) & (typeBB[PieceUtils.BISHOP] | queensBB) & attackersBB) != 0
                || (Attacks.rook(square, occupiedBB) & (typeBB[PieceUtils.ROOK] | queensBB) & attackersBB) != 0;
    }

    /** True when the current key already occurred, same side to move, since the last irreversible move. */
    public boolean isRepetition() {
        int oldest = Math.max(0, plyCount - halfMoveClock);
        for (int i = plyCount - 2; i >= oldest; i -= 2) {
            if (keyHistory[i] == zobristKey) return true;
        }
        return false;
    }

    public boolean isInsufficientMaterial() {
        if ((typeBB[PieceUtils.PAWN] | typeBB[PieceUtils.ROOK] | typeBB[PieceUtils.QUEEN]) != 0) {
            return false;
        }
        long minorsBB = typeBB[PieceUtils.KNIGHT] | typeBB[PieceUtils.BISHOP];
        int minors = BitUtils.bitCount(minorsBB);
        if (minors <= 1) return true;
        if (minors == 2 && typeBB[PieceUtils.KNIGHT] == 0) {
            long whiteBishops = typeBB[PieceUtils.BISHOP] & whiteBB;
            long blackBishops = typeBB[PieceUtils.BISHOP] & blackBB;
            if (whiteBishops != 0 && blackBishops != 0) {
                int w = BitUtils.bitScanForward(whiteBishops);
                int b = BitUtils.bitScanForward(blackBishops);
                return squareColor(w) == squareColor(b);
            }
        }
        return false;
    }

    /* ===================== internals ===================== */

    private int legalMovesCount() {
        if (countedMoves >= 0 && countedKey == zobristKey) {
            return countedMoves;
        }
        return getLegalMoves(scratch);
    }

    private static int squareColor(int square) {
        return (BitUtils.getFile(square) + BitUtils.getRank(square)) & 1;
    }

    private static int castleRightsTouchedBy(int square) {
        return switch (square) {
            case 0 -> 1 << ZobristHashKeys.WHITE_QUEEN_SIDE;
            case 7 -> 1 << ZobristHashKeys.WHITE_KING_SIDE;
            case 56 -> 1 << ZobristHashKeys.BLACK_QUEEN_SIDE;
            case 63 -> 1 << ZobristHashKeys.BLACK_KING_SIDE;
            default -> 0;
        };
    }

    private void updateCastleRights(int rights) {
        int changed = castleRights ^ rights;
        for (int right = 0; right < 4; right++) {
            if ((changed & (1 << right)) != 0) {
                zobristKey ^= ZobristHashKeys.castle(right);
            }
        }
        castleRights = rights;
    }

    private void addPiece(int square, byte pieceType, int color) {
        long squareBB = BitUtils.getPositionIndexBitMask(square);
        typeBB[pieceType] |= squareBB;
        if (ColorUtils.isWhite(color)) whiteBB |= squareBB;
        else blackBB |= squareBB;
        pieceAt[square] = pieceType;
        zobristKey ^= ZobristHashKeys.piece(color, pieceType, square);
    }

    private void removePiece(int square, byte pieceType, int color) {
        long squareBB = BitUtils.getPositionIndexBitMask(square);
        typeBB[pieceType] &= ~squareBB;
        if (ColorUtils.isWhite(color)) whiteBB &= ~squareBB;
        else blackBB &= ~squareBB;
        pieceAt[square] = PieceUtils.NONE;
        zobristKey ^= ZobristHashKeys.piece(color, pieceType, square);
    }

    private void ensureHistoryCapacity() {
        if (plyCount == moveHistory.length) {
            int size = moveHistory.length * 2;
            moveHistory = Arrays.copyOf(moveHistory, size);
            keyHistory = Arrays.copyOf(keyHistory, size);
            changesHistory = Arrays.copyOf(changesHistory, size);
        }
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(8 * (8 + 4));
        for (int rank = 7; rank >= 0; rank--) {
            sb.append(rank + 1).append("  ");
            for (int file = 0; file < 8; file++) {
                int sq = rank * 8 + file;
                char c = PieceUtils.toLetter(pieceAt[sq]);
                sb.append(ColorUtils.isWhite(getColorAt(sq)) ? Character.toUpperCase(c) : c).append(' ');
            }
            sb.append('\n');
        }
        sb.append("\n   a b c d e f g h");
        return sb.toString();
    }
}
