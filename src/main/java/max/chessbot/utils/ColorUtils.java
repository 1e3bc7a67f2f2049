package max.chessbot.utils;

public final class ColorUtils {
    public static final int BLACK = -1;
    public static final int WHITE = 1;

    private ColorUtils() {}

    public static int switchColor(int color) {
        return ~color + 1;
    }

    public static boolean isBlack(int color) {
        return color == BLACK;
    }

    public static boolean isWhite(int color) {
        return color == WHITE;
    }

    /** 0 for white, 1 for black. Handy to index per-color arrays. */
    public static int toIndex(int color) {
        return color == WHITE ? 0 : 1;
    }
}
