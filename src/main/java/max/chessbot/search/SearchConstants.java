package max.chessbot.search;

public final class SearchConstants {
    public static final int INF = 1_000_000_000;

    // Returned by every frame once the deadline fired; never a real score
    public static final int ABORTED = Integer.MIN_VALUE;

    // Hard bound on recursion depth, extensions included
    public static final int MAX_PLY = 128;

    public static final int MAX_MOVES = 256;

    private SearchConstants() {}
}
