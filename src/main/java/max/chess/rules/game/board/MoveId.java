package max.chess.rules.game.board;

import max.chess.rules.common.Color;

/**
 * Ply counter of a game. Even values are white's turn, odd values black's, so the side to move can
 * never disagree with the ply count.
 */
public record MoveId(int value) {
    public static final MoveId INITIAL = new MoveId(0);

    public MoveId {
        if(value < 0) {
            throw new IllegalArgumentException("MoveId must be positive, got " + value);
        }
    }

    public static MoveId of(int fullMoveNumber, Color turn) {
        if(fullMoveNumber < 1) {
            throw new IllegalArgumentException("Full move number starts at 1, got " + fullMoveNumber);
        }
        return new MoveId((fullMoveNumber - 1) * 2 + (turn.isWhite() ? 0 : 1));
    }

    public Color turn() {
        return value % 2 == 0 ? Color.WHITE : Color.BLACK;
    }

    public int moveNumber() {
        return value / 2 + 1;
    }

    public MoveId next() {
        return new MoveId(value + 1);
    }

    @Override
    public String toString() {
        return moveNumber() + (turn().isWhite() ? "." : "...");
    }
}
