package max.chessbot.search.evaluator;

import it.unimi.dsi.fastutil.longs.Long2IntOpenHashMap;
import max.chessbot.game.GamePosition;
import max.chessbot.utils.BitUtils;
import max.chessbot.utils.ColorUtils;
import max.chessbot.utils.PieceUtils;

/**
 * Static evaluation from a fixed perspective, memoized by Zobrist key.
 * <p>
 * The cache is only valid for one turn: the perspective is constant within a turn, so the key alone identifies an
 * entry, but a new turn may evaluate from the other side. {@link #newTurn(int)} must be called before each search.
 */
public final class PositionEvaluator {
    private static final int MISSING = Integer.MIN_VALUE;

    private final Long2IntOpenHashMap cache = new Long2IntOpenHashMap(1 << 16);
    private int perspective = ColorUtils.WHITE;

    private long probes;
    private long hits;
    private long evaluations;

    public PositionEvaluator() {
        cache.defaultReturnValue(MISSING);
    }

    /** Drops every cached score and sets the color scores are computed for. */
    public void newTurn(int perspective) {
        this.perspective = perspective;
        cache.clear();
        probes = hits = evaluations = 0;
    }

    public int evaluate(GamePosition position) {
        probes++;
        final long key = position.zobristKey();
        int score = cache.get(key);
        if (score != MISSING) {
            hits++;
            return score;
        }
        score = evaluatePosition(position, perspective);
        evaluations++;
        cache.put(key, score);
        return score;
    }

    /**
     * Sum over every non-king piece, positive for {@code perspective}'s pieces and negative for the opponent's, of
     * its scaled material value plus a mobility bonus.
     * <p>
     * Pieces of the side that is not to move which are attacked and not defended are left out: that side has no
     * tempo left to save them. The side to move keeps its hanging pieces since it can still react.
     */
    public static int evaluatePosition(GamePosition position, int perspective) {
        final int waitingSide = ColorUtils.switchColor(position.currentPlayer());
        final long whiteAttacksBB = position.getAttackBB(ColorUtils.WHITE);
        final long blackAttacksBB = position.getAttackBB(ColorUtils.BLACK);
        final int whiteKing = position.getKingPosition(ColorUtils.WHITE);
        final int blackKing = position.getKingPosition(ColorUtils.BLACK);

        int score = 0;
        long piecesBB = position.getPiecesBB();
        while (piecesBB != 0) {
            final int sq = BitUtils.bitScanForward(piecesBB);
            piecesBB &= piecesBB - 1;

            final byte pieceType = position.getPieceTypeAt(sq);
            if (!PieceValues.hasMaterialValue(pieceType)) continue;

            final int color = position.getColorAt(sq);
            final boolean white = ColorUtils.isWhite(color);
            final long ownAttacksBB = white ? whiteAttacksBB : blackAttacksBB;
            final long enemyAttacksBB = white ? blackAttacksBB : whiteAttacksBB;

            if (color == waitingSide && BitUtils.isSet(enemyAttacksBB, sq) && !BitUtils.isSet(ownAttacksBB, sq)) {
                continue;
            }

            int value = scaledMaterial(pieceType, sq, color, white ? blackKing : whiteKing)
                    + BitUtils.bitCount(position.getPieceAttackBB(sq)) * PieceValues.MOBILITY_BONUS;
            score += color == perspective ? value : -value;
        }
        return score;
    }

    static int scaledMaterial(byte pieceType, int sq, int color, int enemyKing) {
        final int base = PieceValues.value(pieceType);
        if (pieceType == PieceUtils.PAWN) {
            int rank = BitUtils.getRank(sq);
            int advanced = ColorUtils.isWhite(color) ? rank - 1 : 6 - rank;
            return base * (100 + PieceValues.PAWN_ADVANCE_PERCENT * Math.max(0, advanced)) / 100;
        }
        int closeness = 14 - BitUtils.manhattanDistance(sq, enemyKing);
        return base * (100 + PieceValues.KING_PROXIMITY_PERCENT * closeness) / 100;
    }

    public long probes() {
        return probes;
    }

    public long hits() {
        return hits;
    }

    /** Evaluations actually computed (cache misses) since the last {@link #newTurn(int)}. */
    public long evaluations() {
        return evaluations;
    }

    public String toInfo() {
        return String.format("info string eval cache: probes=%d hits=%d (%.1f%%) size=%d",
                probes, hits, probes == 0 ? 0.0 : 100.0 * hits / probes, cache.size());
    }
}
