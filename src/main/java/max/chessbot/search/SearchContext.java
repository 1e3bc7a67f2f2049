package max.chessbot.search;

import it.unimi.dsi.fastutil.longs.Long2IntOpenHashMap;
import max.chessbot.game.Move;
import max.chessbot.search.evaluator.PositionEvaluator;
import max.chessbot.search.transpositiontable.TranspositionTable;
import max.chessbot.utils.ColorUtils;

import java.util.Random;

/**
 * State owned by one engine instance. Lifetimes differ per field:
 * the transposition table lives for one iteration, the evaluation cache for one turn,
 * hint moves and the ordering jitter source for the whole game.
 */
public final class SearchContext {
    // Buffers per ply
    public final int[][] moveBuf = new int[SearchConstants.MAX_PLY + 1][SearchConstants.MAX_MOVES];
    public final int[][] scoreBuf = new int[SearchConstants.MAX_PLY + 1][SearchConstants.MAX_MOVES];
    public final int[] bestMove = new int[SearchConstants.MAX_PLY + 1];

    public final TranspositionTable tt = new TranspositionTable();
    public final TranspositionTable.Hit ttHit = new TranspositionTable.Hit();
    public final PositionEvaluator evaluator = new PositionEvaluator();

    // Best move last found per position, an ordering hint only
    public final Long2IntOpenHashMap hints = new Long2IntOpenHashMap();

    public final Random random;
    public final SearchConfig cfg;

    // Current turn
    public TurnTimer timer;
    public long deadlineMs;
    public int rootColor = ColorUtils.WHITE;

    // Current iteration
    public int rootDepth;
    public int plyCeiling;

    // Counters
    public long nodes, totalNodes, ttCutoffs;

    public SearchContext(SearchConfig cfg) {
        this.cfg = cfg;
        this.random = new Random(cfg.orderingSeed);
        this.hints.defaultReturnValue(Move.NO_MOVE);
    }

    public void newTurn(TurnTimer timer, long deadlineMs, int rootColor) {
        this.timer = timer;
        this.deadlineMs = deadlineMs;
        this.rootColor = rootColor;
        this.totalNodes = 0;
        evaluator.newTurn(rootColor);
        if (hints.size() > cfg.maxHintEntries) {
            hints.clear();
        }
    }

    public void newIteration(int depth) {
        rootDepth = depth;
        plyCeiling = Math.min(depth + cfg.maxExtensionPlies, SearchConstants.MAX_PLY);
        nodes = 0;
        ttCutoffs = 0;
        tt.clear();
        tt.resetCounters();
    }

    public int hintFor(long key) {
        return hints.get(key);
    }

    public void recordHint(long key, int move) {
        hints.put(key, move);
    }
}
