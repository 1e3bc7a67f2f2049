package max.chessbot.search;

import max.chessbot.utils.ColorUtils;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class TimeControlTest {

    @ParameterizedTest
    @CsvSource({
            "0, 25",
            "1000, 25",
            "2010, 25",
            "2100, 100",
            "3500, 1500",
            "60000, 2000"
    })
    public void deadlineIsClampedBetweenFloorAndCeiling(long remainingMs, long expectedDeadlineMs) {
        assertEquals(expectedDeadlineMs, TimeControl.computeDeadlineMs(remainingMs, SearchConfig.defaults()));
    }

    @Test
    public void deadlineIsReachedOnceElapsed() {
        // Given
        SearchContext ctx = new SearchContext(SearchConfig.defaults());
        ctx.newTurn(new FixedTimer(10, 0, 10), 25, ColorUtils.WHITE);

        // Then
        assertFalse(TimeControl.deadlineReached(ctx)); // 10
        assertFalse(TimeControl.deadlineReached(ctx)); // 20
        assertTrue(TimeControl.deadlineReached(ctx));  // 30
    }

    @Test
    public void invalidConfigIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new SearchConfig.Builder().floorMs(500).ceilingMs(100).build());
        assertThrows(IllegalArgumentException.class, () -> new SearchConfig.Builder().abortCheckInterval(100).build());
        assertThrows(IllegalArgumentException.class, () -> new SearchConfig.Builder().maxDepth(0).build());
    }

    @Test
    public void gameClockChargesEachTurn() throws InterruptedException {
        // Given
        GameClock clock = new GameClock(10_000);

        // When
        clock.startTurn();
        Thread.sleep(20);

        // Then
        assertTrue(clock.millisElapsedThisTurn() >= 20);
        assertTrue(clock.millisRemaining() <= 9_980);

        // When
        clock.endTurn();

        // Then
        assertTrue(clock.millisElapsedThisTurn() < 20);
        assertTrue(clock.millisRemaining() <= 9_980);
    }
}
