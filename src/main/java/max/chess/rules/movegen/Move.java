package max.chess.rules.movegen;

import max.chess.rules.common.PieceType;
import max.chess.rules.common.Square;

import java.util.Objects;

/**
 * A move as submitted by a caller: squares plus an optional promotion piece, not validated yet.
 * Castling is given as the king's move, either to its destination square or onto its own rook.
 */
public record Move(Square from, Square to, PieceType promotion) {

    public Move {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
        if(promotion != null && !promotion.isPromotionTarget()) {
            throw new IllegalArgumentException("Cannot promote to " + promotion);
        }
    }

    public static Move of(Square from, Square to) {
        return new Move(from, to, null);
    }

    public static Move of(String from, String to) {
        return new Move(Square.of(from), Square.of(to), null);
    }

    public static Move of(String from, String to, PieceType promotion) {
        return new Move(Square.of(from), Square.of(to), promotion);
    }

    public boolean isPromotion() {
        return promotion != null;
    }

    @Override
    public String toString() {
        return from.name() + to.name() + (promotion == null ? "" : "=" + promotion.name().charAt(0));
    }
}
