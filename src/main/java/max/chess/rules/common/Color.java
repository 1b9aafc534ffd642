package max.chess.rules.common;

public enum Color {
    WHITE, BLACK;

    public static final Color[] VALUES = Color.values();

    public Color getOppositeColor() {
        if(this == WHITE) {
            return BLACK;
        } else {
            return WHITE;
        }
    }

    public boolean isWhite() {
        return this == WHITE;
    }

    // Rank index (0..7) of the back rank of this color
    public int backRank() {
        return this == WHITE ? 0 : 7;
    }

    // Rank index a pawn of this color promotes on
    public int promotionRank() {
        return this == WHITE ? 7 : 0;
    }

    // Square index offset of a single pawn push
    public int pawnPushOffset() {
        return this == WHITE ? 8 : -8;
    }
}
