package max.chessbot.bot;

import max.chessbot.game.Game;
import max.chessbot.game.MoveGenerator;
import max.chessbot.game.notations.FENUtils;
import max.chessbot.game.notations.MoveIOUtils;
import max.chessbot.search.GameClock;
import max.chessbot.search.SearchConfig;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class MinimaxBotTest {

    private static boolean isLegal(Game game, int move) {
        int[] moves = new int[MoveGenerator.MAX_MOVES];
        int n = game.getLegalMoves(moves);
        for (int i = 0; i < n; i++) {
            if (moves[i] == move) return true;
        }
        return false;
    }

    @Test
    public void botMatesInOne() {
        // Given
        Game game = FENUtils.getBoardFrom("7k/1R6/8/8/8/8/R7/6K1 w - - 0 1");
        MinimaxBot bot = new MinimaxBot(SearchConfig.defaults(), s -> {});
        assertNull(bot.lastResult());
        GameClock clock = new GameClock(60_000);
        clock.startTurn();

        // When
        int move = bot.chooseMove(game, clock);

        // Then
        assertEquals("a2a8", MoveIOUtils.writeAlgebraicNotation(move));
        assertNotNull(bot.lastResult());
        assertEquals("7k/1R6/8/8/8/8/R7/6K1 w - - 0 1", FENUtils.getFENFromBoard(game));
    }

    @Test
    public void singleReplySkipsEvaluation() {
        // Given
        Game game = FENUtils.getBoardFrom("k7/8/8/8/8/8/6q1/7K w - - 0 1");
        MinimaxBot bot = new MinimaxBot(SearchConfig.defaults(), s -> {});

        // When
        int move = bot.chooseMove(game, new GameClock(60_000));

        // Then
        assertEquals("h1g2", MoveIOUtils.writeAlgebraicNotation(move));
        assertEquals(0, bot.searchFacade().context().evaluator.evaluations());
    }

    @Test
    public void selfPlayStaysLegalUnderATightClock() {
        // Given: two bots sharing nothing, half a second each for the whole game
        Game game = Game.standard();
        SearchConfig cfg = new SearchConfig.Builder().floorMs(10).ceilingMs(40).build();
        MinimaxBot white = new MinimaxBot(cfg, s -> {});
        MinimaxBot black = new MinimaxBot(cfg, s -> {});
        GameClock whiteClock = new GameClock(500);
        GameClock blackClock = new GameClock(500);

        for (int ply = 0; ply < 16 && !game.isCheckmate() && !game.isDraw(); ply++) {
            boolean whiteToMove = ply % 2 == 0;
            MinimaxBot bot = whiteToMove ? white : black;
            GameClock clock = whiteToMove ? whiteClock : blackClock;
            String fen = FENUtils.getFENFromBoard(game);

            // When
            clock.startTurn();
            int move = bot.chooseMove(game, clock);
            clock.endTurn();

            // Then
            assertEquals(fen, FENUtils.getFENFromBoard(game));
            assertTrue(isLegal(game, move), fen + " " + MoveIOUtils.writeAlgebraicNotation(move));
            game.playMove(move);
        }
    }
}
