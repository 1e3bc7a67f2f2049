package max.chessbot.game;

import max.chessbot.utils.ColorUtils;

/**
 * Attack bitboards. Leapers come from precomputed tables, sliders walk their rays against the occupancy.
 * Squares: 0..63 with a1 = 0, h1 = 7, a8 = 56.
 */
public final class Attacks {
    private static final long[] KNIGHT = new long[64];
    private static final long[] KING = new long[64];
    private static final long[][] PAWN = new long[2][64];

    private static final int[][] ROOK_DIRECTIONS = {{1, 0}, {-1, 0}, {0, 1}, {0, -1}};
    private static final int[][] BISHOP_DIRECTIONS = {{1, 1}, {1, -1}, {-1, 1}, {-1, -1}};

    static {
        int[][] knightSteps = {{1, 2}, {2, 1}, {2, -1}, {1, -2}, {-1, -2}, {-2, -1}, {-2, 1}, {-1, 2}};
        int[][] kingSteps = {{1, 0}, {1, 1}, {0, 1}, {-1, 1}, {-1, 0}, {-1, -1}, {0, -1}, {1, -1}};
        for (int sq = 0; sq < 64; sq++) {
            int file = sq & 7, rank = sq >>> 3;
            KNIGHT[sq] = leaperBB(file, rank, knightSteps);
            KING[sq] = leaperBB(file, rank, kingSteps);
            PAWN[0][sq] = leaperBB(file, rank, new int[][]{{-1, 1}, {1, 1}});
            PAWN[1][sq] = leaperBB(file, rank, new int[][]{{-1, -1}, {1, -1}});
        }
    }

    private Attacks() {}

    private static long leaperBB(int file, int rank, int[][] steps) {
        long bb = 0L;
        for (int[] step : steps) {
            int f = file + step[0], r = rank + step[1];
            if (f >= 0 && f < 8 && r >= 0 && r < 8) {
                bb |= 1L << (r * 8 + f);
            }
        }
        return bb;
    }

    private static long slidingBB(int sq, long occupiedBB, int[][] directions) {
        long bb = 0L;
        int file = sq & 7, rank = sq >>> 3;
        for (int[] direction : directions) {
            int f = file + direction[0], r = rank + direction[1];
            while (f >= 0 && f < 8 && r >= 0 && r < 8) {
                long target = 1L << (r * 8 + f);
                bb |= target;
                if ((occupiedBB & target) != 0) break;
                f += direction[0];
                r += direction[1];
            }
        }
        return bb;
    }

    public static long knight(int sq) {
        return KNIGHT[sq];
    }

    public static long king(int sq) {
        return KING[sq];
    }

    /** Squares a pawn of the given color standing on sq attacks. */
    public static long pawn(int sq, int color) {
        return PAWN[ColorUtils.toIndex(color)][sq];
    }

    public static long rook(int sq, long occupiedBB) {
        return slidingBB(sq, occupiedBB, ROOK_DIRECTIONS);
    }

    public static long bishop(int sq, long occupiedBB) {
        return slidingBB(sq, occupiedBB, BISHOP_DIRECTIONS);
    }

    public static long queen(int sq, long occupiedBB) {
        return rook(sq, occupiedBB) | bishop(sq, occupiedBB);
    }
}
