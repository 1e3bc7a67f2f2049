package max.chessbot.search.evaluator;

public final class GameValues {
    // One mate "unit"; mate scores are multiples of it, scaled by the distance left to the ply ceiling
    public static final int CHECKMATE_VALUE = 1_000_000;
    public static final int DRAW_VALUE = 0;

    private GameValues() {}

    public static boolean isMateScore(int score) {
        return Math.abs(score) >= CHECKMATE_VALUE;
    }
}
