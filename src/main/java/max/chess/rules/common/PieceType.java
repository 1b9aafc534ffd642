package max.chess.rules.common;

public enum PieceType {
    PAWN, KNIGHT, BISHOP, ROOK, QUEEN, KING;

    public static final PieceType[] VALUES = PieceType.values();
    public static final PieceType[] PROMOTIONS = { QUEEN, ROOK, BISHOP, KNIGHT };

    public boolean isPromotionTarget() {
        return this == QUEEN || this == ROOK || this == BISHOP || this == KNIGHT;
    }

    public boolean isSlider() {
        return this == BISHOP || this == ROOK || this == QUEEN;
    }

    public boolean isMinor() {
        return this == KNIGHT || this == BISHOP;
    }
}
