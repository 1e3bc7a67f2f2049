package max.chessbot.search.transpositiontable;

import it.unimi.dsi.fastutil.longs.Long2LongOpenHashMap;

import static max.chessbot.search.SearchConstants.MAX_PLY;

/**
 * Node results keyed by (depth remaining, Zobrist key). Last write wins; the table is cleared before every
 * iterative deepening pass, a bound being only meaningful for the depth it was computed at.
 * <p>
 * Each slot packs {@code [56..34]=move, [33..2]=score, [1..0]=flag} in a long. A Zobrist collision yields a wrong
 * hit; that risk is accepted.
 */
public final class TranspositionTable {
    public static final byte TT_EXACT = 0, TT_LOWER = 1, TT_UPPER = 2;

    private static final long MISSING = -1L;

    private final Long2LongOpenHashMap[] byDepth = new Long2LongOpenHashMap[MAX_PLY + 1];

    private long probes;
    private long hits;
    private long stores;

    /** Lightweight probe result, reused across probes. */
    public static final class Hit {
        public int move;
        public int score;
        public byte flag;
    }

    public void clear() {
        for (Long2LongOpenHashMap map : byDepth) {
            if (map != null) map.clear();
        }
    }

    public void resetCounters() {
        probes = hits = stores = 0;
    }

    public boolean probe(int depthRemaining, long key, Hit out) {
        probes++;
        Long2LongOpenHashMap map = byDepth[depthRemaining];
        if (map == null) return false;
        long info = map.get(key);
        if (info == MISSING) return false;
        hits++;
        out.move = (int) (info >>> 34);
        out.score = (int) (info >>> 2);
        out.flag = (byte) (info & 0b11);
        return true;
    }

    public void store(int depthRemaining, long key, int move, int score, byte flag) {
        stores++;
        Long2LongOpenHashMap map = byDepth[depthRemaining];
        if (map == null) {
            map = new Long2LongOpenHashMap(1 << 12);
            map.defaultReturnValue(MISSING);
            byDepth[depthRemaining] = map;
        }
        map.put(key, ((long) move << 34) | ((score & 0xFFFFFFFFL) << 2) | (flag & 0b11));
    }

    public int size() {
        int size = 0;
        for (Long2LongOpenHashMap map : byDepth) {
            if (map != null) size += map.size();
        }
        return size;
    }

    public String toInfo() {
        return String.format("info string TT: probes=%d hits=%d (%.1f%%) stores=%d size=%d",
                probes, hits, probes == 0 ? 0.0 : 100.0 * hits / probes, stores, size());
    }
}
