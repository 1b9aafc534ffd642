package max.chess.rules.movegen;

public enum MoveType {
    NORMAL,
    DOUBLE_PAWN_PUSH,
    EN_PASSANT,
    CASTLE_KING_SIDE,
    CASTLE_QUEEN_SIDE;

    public boolean isCastle() {
        return this == CASTLE_KING_SIDE || this == CASTLE_QUEEN_SIDE;
    }
}
