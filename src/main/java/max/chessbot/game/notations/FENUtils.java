package max.chessbot.game.notations;

import max.chessbot.game.Game;
import max.chessbot.game.ZobristHashKeys;
import max.chessbot.utils.ColorUtils;
import max.chessbot.utils.PieceUtils;

// https://en.wikipedia.org/wiki/Forsyth%E2%80%93Edwards_Notation
public final class FENUtils {
    public static final String STARTING_POSITION = "rnbqkbnr/pppppppp/8/8/8/8/PPPPPPPP/RNBQKBNR w KQkq - 0 1";

    private static final char[] CASTLE_LETTERS = {'K', 'Q', 'k', 'q'};

    private FENUtils() {}

    public static Game getBoardFrom(String fen) {
        String[] fenFields = fen.trim().split("\\s+");
        if (fenFields.length != 6) {
            throw new IllegalArgumentException("Invalid FEN record: " + fen);
        }

        Game game = new Game();
        injectPiecePlacement(game, fenFields[0]);
        game.setCurrentPlayer("b".equals(fenFields[1]) ? ColorUtils.BLACK : ColorUtils.WHITE);
        for (char character : fenFields[2].toCharArray()) {
            switch (character) {
                case 'K' -> game.setCastleRight(ZobristHashKeys.WHITE_KING_SIDE, true);
                case 'Q' -> game.setCastleRight(ZobristHashKeys.WHITE_QUEEN_SIDE, true);
                case 'k' -> game.setCastleRight(ZobristHashKeys.BLACK_KING_SIDE, true);
                case 'q' -> game.setCastleRight(ZobristHashKeys.BLACK_QUEEN_SIDE, true);
                case '-' -> { }
                default -> throw new IllegalArgumentException("Invalid castling rights in FEN: " + fenFields[2]);
            }
        }
        game.setEnPassantIndex("-".equals(fenFields[3]) ? -1 : MoveIOUtils.getSquareIndex(fenFields[3]));
        try {
            game.halfMoveClock = Integer.parseInt(fenFields[4]);
            game.fullMoveClock = Integer.parseInt(fenFields[5]);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid move counters in FEN: " + fen, e);
        }

        game.recomputeZobristKey();
        return game;
    }

    private static void injectPiecePlacement(Game game, String piecePlacement) {
        String[] rows = piecePlacement.split("/");
        if (rows.length != 8) {
            throw new IllegalArgumentException("Invalid piece placement in FEN: " + piecePlacement);
        }
        for (int i = 0; i < 8; i++) {
            int rank = 7 - i;
            int file = 0;
            for (char character : rows[i].toCharArray()) {
                if (Character.isDigit(character)) {
                    file += character - '0';
                } else {
                    if (file > 7) {
                        throw new IllegalArgumentException("Invalid piece placement in FEN: " + piecePlacement);
                    }
                    int color = Character.isUpperCase(character) ? ColorUtils.WHITE : ColorUtils.BLACK;
                    game.putPiece(rank * 8 + file, PieceUtils.fromLetter(character), color);
                    file++;
                }
            }
        }
    }

    public static String getFENFromBoard(Game game) {
        StringBuilder fen = new StringBuilder();
        for (int rank = 7; rank >= 0; rank--) {
            int emptySpaceCounter = 0;
            for (int file = 0; file < 8; file++) {
                int sq = rank * 8 + file;
                byte pieceType = game.getPieceTypeAt(sq);
                if (pieceType == PieceUtils.NONE) {
                    emptySpaceCounter++;
                    continue;
                }
                if (emptySpaceCounter != 0) {
                    fen.append(emptySpaceCounter);
                    emptySpaceCounter = 0;
                }
                char letter = PieceUtils.toLetter(pieceType);
                fen.append(ColorUtils.isWhite(game.getColorAt(sq)) ? Character.toUpperCase(letter) : letter);
            }
            if (emptySpaceCounter != 0) {
                fen.append(emptySpaceCounter);
            }
            if (rank != 0) {
                fen.append('/');
            }
        }

        fen.append(' ').append(ColorUtils.isBlack(game.currentPlayer()) ? 'b' : 'w').append(' ');
        int length = fen.length();
        for (int right = 0; right < 4; right++) {
            if (game.hasCastleRight(right)) fen.append(CASTLE_LETTERS[right]);
        }
        if (fen.length() == length) {
            fen.append('-');
        }

        fen.append(' ');
        int enPassantIndex = game.getEnPassantIndex();
        fen.append(enPassantIndex == -1 ? "-" : MoveIOUtils.getSquareFromIndex(enPassantIndex));
        fen.append(' ').append(game.halfMoveClock).append(' ').append(game.fullMoveClock);
        return fen.toString();
    }
}
