package max.chessbot.bot;

import max.chessbot.game.GamePosition;
import max.chessbot.search.TurnTimer;

public interface ChessBot {

    /**
     * Picks a legal move for the side to move, within the time the timer allows.
     * The position is left exactly as it was received.
     *
     * @throws IllegalStateException if the game is already over (no legal move)
     */
    int chooseMove(GamePosition position, TurnTimer timer);
}
