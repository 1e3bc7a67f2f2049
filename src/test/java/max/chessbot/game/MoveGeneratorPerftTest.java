package max.chessbot.game;

import max.chessbot.game.notations.FENUtils;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;

// Reference counts: https://www.chessprogramming.org/Perft_Results
public class MoveGeneratorPerftTest {
    private static final String KIWIPETE = "r3k2r/p1ppqpb1/bn2pnp1/3PN3/1p2P3/2N2Q1p/PPPBBPPP/R3K2R w KQkq - 0 1";
    private static final String POSITION_3 = "8/2p5/3p4/KP5r/1R3p1k/8/4P1P1/8 w - - 0 1";
    private static final String POSITION_4 = "r3k2r/Pppp1ppp/1b3nbN/nP6/BBP1P3/q4N2/Pp1P2PP/R2Q1RK1 w kq - 0 1";
    private static final String POSITION_5 = "rnbq1k1r/pp1Pbppp/2p5/8/2B5/8/PPP1NnPP/RNBQK2R w KQ - 1 8";

    static Stream<Arguments> perftPositions() {
        return Stream.of(
                Arguments.of(FENUtils.STARTING_POSITION, 1, 20L),
                Arguments.of(FENUtils.STARTING_POSITION, 2, 400L),
                Arguments.of(FENUtils.STARTING_POSITION, 3, 8902L),
                Arguments.of(KIWIPETE, 1, 48L),
                Arguments.of(KIWIPETE, 2, 2039L),
                Arguments.of(KIWIPETE, 3, 97862L),
                Arguments.of(POSITION_3, 1, 14L),
                Arguments.of(POSITION_3, 2, 191L),
                Arguments.of(POSITION_3, 3, 2812L),
                Arguments.of(POSITION_3, 4, 43238L),
                Arguments.of(POSITION_4, 1, 6L),
                Arguments.of(POSITION_4, 2, 264L),
                Arguments.of(POSITION_4, 3, 9467L),
                Arguments.of(POSITION_5, 1, 44L),
                Arguments.of(POSITION_5, 2, 1486L)
        );
    }

    @ParameterizedTest
    @MethodSource("perftPositions")
    public void perft(String fen, int depth, long expectedNodes) {
        // Given
        Game game = FENUtils.getBoardFrom(fen);

        // When
        long nodes = perft(game, depth, new int[depth + 1][MoveGenerator.MAX_MOVES]);

        // Then
        assertEquals(expectedNodes, nodes, "perft(" + depth + ") of " + fen);
        assertEquals(fen, FENUtils.getFENFromBoard(game));
    }

    private static long perft(Game game, int depth, int[][] buffers) {
        int[] moves = buffers[depth];
        int n = game.getLegalMoves(moves);
        if (depth == 1) {
            return n;
        }
        long nodes = 0;
        for (int i = 0; i < n; i++) {
            int move = moves[i];
            long keyBefore = game.zobristKey();
            game.playMove(move);
            assertEquals(ZobristHashKeys.getHashKey(game), game.zobristKey(), "incremental key drifted");
            nodes += perft(game, depth - 1, buffers);
            game.undoMove(move);
            assertEquals(keyBefore, game.zobristKey(), "undo did not restore the key");
        }
        return nodes;
    }
}
