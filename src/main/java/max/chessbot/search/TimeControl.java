package max.chessbot.search;

final class TimeControl {

    private TimeControl() {}

    /** Per-turn deadline, in milliseconds elapsed since the turn started. */
    static long computeDeadlineMs(long remainingMs, SearchConfig cfg) {
        long ms = remainingMs - cfg.panicReserveMs;
        return Math.min(Math.max(ms, cfg.floorMs), cfg.ceilingMs);
    }

    static boolean deadlineReached(SearchContext ctx) {
        return ctx.timer.millisElapsedThisTurn() >= ctx.deadlineMs;
    }
}
