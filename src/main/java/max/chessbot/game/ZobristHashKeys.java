package max.chessbot.game;

import max.chessbot.utils.ColorUtils;

/**
 * Zobrist keys. Generated from a fixed seed so fingerprints are stable from one run to the next.
 */
public final class ZobristHashKeys {
    private static final long SEED = 0x5DEECE66DL;

    private static final long[][][] PIECE_KEYS = new long[2][7][64];
    private static final long[] CASTLE_KEYS = new long[4];
    private static final long[] EN_PASSANT_FILE_KEYS = new long[8];
    private static final long BLACK_TO_MOVE_KEY;

    public static final int WHITE_KING_SIDE = 0;
    public static final int WHITE_QUEEN_SIDE = 1;
    public static final int BLACK_KING_SIDE = 2;
    public static final int BLACK_QUEEN_SIDE = 3;

    static {
        long state = SEED;
        for (int color = 0; color < 2; color++) {
            for (int pieceType = 1; pieceType < 7; pieceType++) {
                for (int sq = 0; sq < 64; sq++) {
                    state += 0x9E3779B97F4A7C15L;
                    PIECE_KEYS[color][pieceType][sq] = mix(state);
                }
            }
        }
        for (int i = 0; i < CASTLE_KEYS.length; i++) {
            state += 0x9E3779B97F4A7C15L;
            CASTLE_KEYS[i] = mix(state);
        }
        for (int i = 0; i < EN_PASSANT_FILE_KEYS.length; i++) {
            state += 0x9E3779B97F4A7C15L;
            EN_PASSANT_FILE_KEYS[i] = mix(state);
        }
        state += 0x9E3779B97F4A7C15L;
        BLACK_TO_MOVE_KEY = mix(state);
    }

    private ZobristHashKeys() {}

    /** SplitMix64 finalizer. */
    private static long mix(long z) {
        z = (z ^ (z >>> 30)) * 0xBF58476D1CE4E5B9L;
        z = (z ^ (z >>> 27)) * 0x94D049BB133111EBL;
        return z ^ (z >>> 31);
    }

    public static long piece(int color, byte pieceType, int sq) {
        return PIECE_KEYS[ColorUtils.toIndex(color)][pieceType][sq];
    }

    public static long castle(int castleRight) {
        return CASTLE_KEYS[castleRight];
    }

    public static long enPassantFile(int file) {
        return EN_PASSANT_FILE_KEYS[file];
    }

    public static long blackToMove() {
        return BLACK_TO_MOVE_KEY;
    }

    /** Full recomputation, used when a position is loaded. Make/unmake keep the key incrementally. */
    public static long getHashKey(Game game) {
        long key = 0L;
        for (int sq = 0; sq < 64; sq++) {
            byte pieceType = game.getPieceTypeAt(sq);
            if (pieceType != 0) {
                key ^= piece(game.getColorAt(sq), pieceType, sq);
            }
        }
        for (int right = 0; right < 4; right++) {
            if (game.hasCastleRight(right)) key ^= castle(right);
        }
        if (game.getEnPassantIndex() != -1) {
            key ^= enPassantFile(game.getEnPassantIndex() & 7);
        }
        if (ColorUtils.isBlack(game.currentPlayer())) {
            key ^= blackToMove();
        }
        return key;
    }
}
