package max.chessbot.bot;

import max.chessbot.game.GamePosition;
import max.chessbot.search.SearchConfig;
import max.chessbot.search.SearchFacade;
import max.chessbot.search.SearchResult;
import max.chessbot.search.TurnTimer;

import java.util.function.Consumer;

/**
 * Time-bounded alpha-beta bot. One instance plays one game: move hints carry over from a turn to the next.
 */
public class MinimaxBot implements ChessBot {
    private final SearchFacade searchFacade;
    private final Consumer<String> out;

    private SearchResult lastResult;

    public MinimaxBot() {
        this(SearchConfig.fromSystemProperties(), System.err::println);
    }

    public MinimaxBot(SearchConfig cfg, Consumer<String> out) {
        this.searchFacade = new SearchFacade(cfg);
        this.out = out;
    }

    @Override
    public int chooseMove(GamePosition position, TurnTimer timer) {
        lastResult = searchFacade.findBestMove(position, timer, out);
        return lastResult.move();
    }

    /** Details of the last {@link #chooseMove} call, null before the first one. */
    public SearchResult lastResult() {
        return lastResult;
    }

    SearchFacade searchFacade() {
        return searchFacade;
    }
}
