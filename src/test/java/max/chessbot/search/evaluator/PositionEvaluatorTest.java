package max.chessbot.search.evaluator;

import max.chessbot.game.Game;
import max.chessbot.game.notations.FENUtils;
import max.chessbot.utils.ColorUtils;
import max.chessbot.utils.PieceUtils;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class PositionEvaluatorTest {

    @Test
    public void symmetricPositionIsBalanced() {
        Game game = Game.standard();
        assertEquals(0, PositionEvaluator.evaluatePosition(game, ColorUtils.WHITE));
        assertEquals(0, PositionEvaluator.evaluatePosition(game, ColorUtils.BLACK));
    }

    @Test
    public void perspectiveFlipsTheSign() {
        // Given
        Game game = FENUtils.getBoardFrom("4k3/pp6/8/8/8/8/3Q4/4K3 w - - 0 1");

        // When
        int white = PositionEvaluator.evaluatePosition(game, ColorUtils.WHITE);
        int black = PositionEvaluator.evaluatePosition(game, ColorUtils.BLACK);

        // Then
        assertTrue(white > 0);
        assertEquals(-white, black);
    }

    @Test
    public void hangingPiecesOfTheWaitingSideAreIgnored() {
        // Given: the black queen is attacked by the rook and undefended, the rook is defended by its king
        Game whiteToMove = FENUtils.getBoardFrom("4k3/8/8/3q4/8/8/3R4/4K3 w - - 0 1");
        Game blackToMove = FENUtils.getBoardFrom("4k3/8/8/3q4/8/8/3R4/4K3 b - - 0 1");

        // When
        int queenLost = PositionEvaluator.evaluatePosition(whiteToMove, ColorUtils.WHITE);
        int queenSafe = PositionEvaluator.evaluatePosition(blackToMove, ColorUtils.WHITE);

        // Then
        assertTrue(queenLost > 0, "the queen cannot escape, only the rook counts: " + queenLost);
        assertTrue(queenSafe < 0, "black keeps its queen: " + queenSafe);
    }

    @Test
    public void advancedPawnsAreWorthMore() {
        int a2 = 8, a7 = 48;
        assertEquals(1000, PositionEvaluator.scaledMaterial(PieceUtils.PAWN, a2, ColorUtils.WHITE, 60));
        assertEquals(1250, PositionEvaluator.scaledMaterial(PieceUtils.PAWN, a7, ColorUtils.WHITE, 60));
        assertEquals(1250, PositionEvaluator.scaledMaterial(PieceUtils.PAWN, a2, ColorUtils.BLACK, 4));
        assertEquals(1000, PositionEvaluator.scaledMaterial(PieceUtils.PAWN, a7, ColorUtils.BLACK, 4));
    }

    @Test
    public void piecesCloseToTheEnemyKingAreWorthMore() {
        // d4 is two steps from e5, a1 is fourteen steps from h8
        assertEquals(3360, PositionEvaluator.scaledMaterial(PieceUtils.KNIGHT, 27, ColorUtils.WHITE, 36));
        assertEquals(3000, PositionEvaluator.scaledMaterial(PieceUtils.KNIGHT, 0, ColorUtils.WHITE, 63));
    }

    @Test
    public void evaluationsAreCachedForTheTurn() {
        // Given
        Game game = FENUtils.getBoardFrom("r3k2r/p1ppqpb1/bn2pnp1/3PN3/1p2P3/2N2Q1p/PPPBBPPP/R3K2R w KQkq - 0 1");
        PositionEvaluator evaluator = new PositionEvaluator();
        evaluator.newTurn(ColorUtils.BLACK);

        // When
        int first = evaluator.evaluate(game);
        int second = evaluator.evaluate(game);

        // Then
        assertEquals(first, second);
        assertEquals(PositionEvaluator.evaluatePosition(game, ColorUtils.BLACK), first);
        assertEquals(2, evaluator.probes());
        assertEquals(1, evaluator.hits());
        assertEquals(1, evaluator.evaluations());

        // When
        evaluator.newTurn(ColorUtils.WHITE);

        // Then
        assertEquals(-first, evaluator.evaluate(game));
        assertEquals(1, evaluator.evaluations());
    }
}
