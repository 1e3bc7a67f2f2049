package max.chessbot.search;

/**
 * Monotonic game clock: a total budget that each turn is charged against.
 */
public final class GameClock implements TurnTimer {
    private long remainingNanos;
    private long turnStartNanos;

    public GameClock(long budgetMs) {
        this.remainingNanos = budgetMs * 1_000_000L;
        this.turnStartNanos = System.nanoTime();
    }

    public void startTurn() {
        turnStartNanos = System.nanoTime();
    }

    /** Charges the time spent since {@link #startTurn()} to the budget. */
    public void endTurn() {
        remainingNanos -= System.nanoTime() - turnStartNanos;
        turnStartNanos = System.nanoTime();
    }

    @Override
    public long millisElapsedThisTurn() {
        return (System.nanoTime() - turnStartNanos) / 1_000_000L;
    }

    @Override
    public long millisRemaining() {
        return Math.max(0, remainingNanos / 1_000_000L - millisElapsedThisTurn());
    }
}
