package max.chessbot.utils;

public final class PieceUtils {
    public static final byte NONE = 0;
    public static final byte PAWN = 1;
    public static final byte KNIGHT = 2;
    public static final byte BISHOP = 3;
    public static final byte ROOK = 4;
    public static final byte QUEEN = 5;
    public static final byte KING = 6;

    private static final char[] LETTERS = {'.', 'p', 'n', 'b', 'r', 'q', 'k'};

    private PieceUtils() {}

    public static char toLetter(byte pieceType) {
        return LETTERS[pieceType];
    }

    public static byte fromLetter(char letter) {
        return switch (Character.toLowerCase(letter)) {
            case 'p' -> PAWN;
            case 'n' -> KNIGHT;
            case 'b' -> BISHOP;
            case 'r' -> ROOK;
            case 'q' -> QUEEN;
            case 'k' -> KING;
            default -> throw new IllegalArgumentException("Unknown piece letter " + letter);
        };
    }
}
