package max.chessbot.search;

public final class SearchConfig {

    public final boolean debug;

    // Time budget: clamp(remaining - panicReserve, floor, ceiling)
    public final long panicReserveMs;
    public final long floorMs;
    public final long ceilingMs;

    // Iterative deepening stops
    public final int maxDepth;               // hard cap on the nominal depth
    public final int stableIterationsToStop; // same best move this many iterations in a row (0 disables)
    public final int minStableDepth;         // stability stop only from this depth on
    public final long minThinkMs;            // stability stop only once this much time was spent

    // Deadline polling
    public final int abortCheckMinPly;       // never poll above this ply
    public final int abortCheckInterval;     // poll every N nodes, power of two

    // Extensions / reductions
    public final int maxExtensionPlies;      // extensions stop past rootDepth + this
    public final int reductionMinRemaining;  // quiet moves are reduced only with this much depth left
    public final int reductionDivisor;       // reduction = remaining / divisor

    // Move ordering
    public final long orderingSeed;
    public final int maxHintEntries;

    private SearchConfig(Builder b) {
        debug = b.debug;
        panicReserveMs = b.panicReserveMs;
        floorMs = b.floorMs;
        ceilingMs = b.ceilingMs;
        maxDepth = b.maxDepth;
        stableIterationsToStop = b.stableIterationsToStop;
        minStableDepth = b.minStableDepth;
        minThinkMs = b.minThinkMs;
        abortCheckMinPly = b.abortCheckMinPly;
        abortCheckInterval = b.abortCheckInterval;
        maxExtensionPlies = b.maxExtensionPlies;
        reductionMinRemaining = b.reductionMinRemaining;
        reductionDivisor = b.reductionDivisor;
        orderingSeed = b.orderingSeed;
        maxHintEntries = b.maxHintEntries;

        if (floorMs > ceilingMs) {
            throw new IllegalArgumentException("floorMs (" + floorMs + ") must not exceed ceilingMs (" + ceilingMs + ")");
        }
        if (Integer.bitCount(abortCheckInterval) != 1) {
            throw new IllegalArgumentException("abortCheckInterval must be a power of two: " + abortCheckInterval);
        }
        if (maxDepth < 1 || reductionDivisor < 1) {
            throw new IllegalArgumentException("maxDepth and reductionDivisor must be positive");
        }
    }

    public static SearchConfig defaults() {
        return new Builder().build();
    }

    /** Defaults overridden by {@code -Dbot.*} system properties. */
    public static SearchConfig fromSystemProperties() {
        Builder b = new Builder();
        return b.debug(Boolean.parseBoolean(System.getProperty("bot.debug", "false")))
                .panicReserveMs(Long.getLong("bot.panicReserveMs", b.panicReserveMs))
                .floorMs(Long.getLong("bot.floorMs", b.floorMs))
                .ceilingMs(Long.getLong("bot.ceilingMs", b.ceilingMs))
                .maxDepth(Integer.getInteger("bot.maxDepth", b.maxDepth))
                .stableIterationsToStop(Integer.getInteger("bot.stableIterations", b.stableIterationsToStop))
                .minThinkMs(Long.getLong("bot.minThinkMs", b.minThinkMs))
                .orderingSeed(Long.getLong("bot.seed", b.orderingSeed))
                .build();
    }

    public static class Builder {
        private boolean debug = false;

        private long panicReserveMs = 2000;
        private long floorMs = 25;
        private long ceilingMs = 2000;

        private int maxDepth = SearchConstants.MAX_PLY;
        private int stableIterationsToStop = 3;
        private int minStableDepth = 4;
        private long minThinkMs = 100;

        private int abortCheckMinPly = 4;
        private int abortCheckInterval = 64;

        private int maxExtensionPlies = 4;
        private int reductionMinRemaining = 3;
        private int reductionDivisor = 3;

        private long orderingSeed = 0x9E3779B9L;
        private int maxHintEntries = 1 << 20;

        public Builder debug(boolean v){debug=v;return this;}
        public Builder panicReserveMs(long v){panicReserveMs=v;return this;}
        public Builder floorMs(long v){floorMs=v;return this;}
        public Builder ceilingMs(long v){ceilingMs=v;return this;}
        public Builder maxDepth(int v){maxDepth=v;return this;}
        public Builder stableIterationsToStop(int v){stableIterationsToStop=v;return this;}
        public Builder minStableDepth(int v){minStableDepth=v;return this;}
        public Builder minThinkMs(long v){minThinkMs=v;return this;}
        public Builder abortCheckMinPly(int v){abortCheckMinPly=v;return this;}
        public Builder abortCheckInterval(int v){abortCheckInterval=v;return this;}
        public Builder maxExtensionPlies(int v){maxExtensionPlies=v;return this;}
        public Builder reductionMinRemaining(int v){reductionMinRemaining=v;return this;}
        public Builder reductionDivisor(int v){reductionDivisor=v;return this;}
        public Builder orderingSeed(long v){orderingSeed=v;return this;}
        public Builder maxHintEntries(int v){maxHintEntries=v;return this;}
        public SearchConfig build(){return new SearchConfig(this);}
    }
}
