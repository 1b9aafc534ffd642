package max.chess.rules.movegen;

import max.chess.rules.common.PieceType;
import max.chess.rules.common.Square;
import max.chess.rules.game.board.CastlingSide;

import java.util.Objects;

/**
 * A move validated against a position. For castling moves {@code to} is the king destination and
 * {@code castlingRook} the square the rook starts from; it is null for every other move.
 */
public record LegalMove(Square from, Square to, PieceType promotion, MoveType type, Square castlingRook) {

    public LegalMove {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
        Objects.requireNonNull(type, "type");
        if(type.isCastle() != (castlingRook != null)) {
            throw new IllegalArgumentException("Only castling moves carry a rook square");
        }
    }

    static LegalMove normal(int from, int to) {
        return new LegalMove(Square.of(from), Square.of(to), null, MoveType.NORMAL, null);
    }

    static LegalMove promotion(int from, int to, PieceType promotion) {
        return new LegalMove(Square.of(from), Square.of(to), promotion, MoveType.NORMAL, null);
    }

    static LegalMove doublePawnPush(int from, int to) {
        return new LegalMove(Square.of(from), Square.of(to), null, MoveType.DOUBLE_PAWN_PUSH, null);
    }

    static LegalMove enPassant(int from, int to) {
        return new LegalMove(Square.of(from), Square.of(to), null, MoveType.EN_PASSANT, null);
    }

    static LegalMove castle(int kingFrom, int kingTo, int rookFrom, CastlingSide side) {
        MoveType type = side == CastlingSide.KING_SIDE ? MoveType.CASTLE_KING_SIDE : MoveType.CASTLE_QUEEN_SIDE;
        return new LegalMove(Square.of(kingFrom), Square.of(kingTo), null, type, Square.of(rookFrom));
    }

    public boolean isCastle() {
        return type.isCastle();
    }

    public CastlingSide castlingSide() {
        return switch (type) {
            case CASTLE_KING_SIDE -> CastlingSide.KING_SIDE;
            case CASTLE_QUEEN_SIDE -> CastlingSide.QUEEN_SIDE;
            default -> null;
        };
    }

    public boolean isPromotion() {
        return promotion != null;
    }

    // The plain move a caller would submit to play this one
    public Move toMove() {
        return new Move(from, to, promotion);
    }

    @Override
    public String toString() {
        return switch (type) {
            case CASTLE_KING_SIDE -> "O-O(" + from.name() + castlingRook.name() + ")";
            case CASTLE_QUEEN_SIDE -> "O-O-O(" + from.name() + castlingRook.name() + ")";
            default -> toMove().toString();
        };
    }
}
