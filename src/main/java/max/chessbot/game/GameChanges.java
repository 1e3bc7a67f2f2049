package max.chessbot.game;

/**
 * Irreversible state saved before a move so it can be undone:
 * [26..11] half-move clock, [10..4] en passant index + 1, [3..0] castling rights.
 */
final class GameChanges {

    private GameChanges() {}

    static long asBytes(int castleRights, int enPassantIndex, int halfMoveClock) {
        return ((long) (halfMoveClock & 0xFFFF) << 11)
                | ((long) (enPassantIndex + 1) << 4)
                | (castleRights & 0b1111);
    }

    static int getPreviousCastleRights(long changes) {
        return (int) (changes & 0b1111);
    }

    static int getPreviousEnPassantIndex(long changes) {
        return (int) ((changes >>> 4) & 0b1111111) - 1;
    }

    static int getPreviousHalfMoveClock(long changes) {
        return (int) ((changes >>> 11) & 0xFFFF);
    }
}
