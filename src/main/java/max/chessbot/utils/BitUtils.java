package max.chessbot.utils;

public final class BitUtils {

    private BitUtils() {}

    /**
     * Returns the index of the first (<i>rightmost</i>) bit set to 1 in the bitboard provided in input. The bit is the
     * Least Significant 1-bit (LS1B).
     *
     * @param bb the bitboard for which the LS1B is to be returned
     * @return the index of the first bit set to 1
     */
    public static int bitScanForward(long bb) {
        return Long.numberOfTrailingZeros(bb);
    }

    public static long getPositionIndexBitMask(int positionIndex) {
        return 1L << positionIndex;
    }

    public static int bitCount(long bb) {
        return Long.bitCount(bb);
    }

    public static boolean isSet(long bb, int positionIndex) {
        return ((bb >>> positionIndex) & 1L) != 0;
    }

    public static int getFile(int positionIndex) {
        return positionIndex & 7;
    }

    public static int getRank(int positionIndex) {
        return positionIndex >>> 3;
    }

    /** Manhattan distance between two squares on the 8x8 grid, from 0 to 14. */
    public static int manhattanDistance(int from, int to) {
        return Math.abs(getFile(from) - getFile(to)) + Math.abs(getRank(from) - getRank(to));
    }
}
