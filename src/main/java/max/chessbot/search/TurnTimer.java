package max.chessbot.search;

/** Clock the bot thinks against. */
public interface TurnTimer {

    /** Milliseconds since the bot was asked for its current move. */
    long millisElapsedThisTurn();

    /** Milliseconds left on the bot's game clock. */
    long millisRemaining();
}
