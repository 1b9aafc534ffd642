package max.chess.rules.movegen;

import max.chess.rules.common.Square;

import java.util.List;
import java.util.Optional;

// Legal move capability of a position or board
public interface LegalMoves {

    List<LegalMove> legalMoves();

    // Destinations of the piece on a square, as a bitboard
    default long moveDestinations(Square from) {
        long destinationsBB = 0L;
        for(LegalMove legalMove : legalMoves()) {
            if(legalMove.from() == from) {
                destinationsBB |= legalMove.to().bitMask();
                if(legalMove.isCastle()) {
                    destinationsBB |= legalMove.castlingRook().bitMask();
                }
            }
        }
        return destinationsBB;
    }

    default boolean isLegal(Move move) {
        return find(move).isPresent();
    }

    /**
     * Resolves a submitted move to its legal counterpart. A king moving onto its own castling rook always
     * castles; a king moving to its castling destination castles only if no plain king move goes there.
     */
    default Optional<LegalMove> find(Move move) {
        LegalMove castle = null;
        for(LegalMove legalMove : legalMoves()) {
            if(legalMove.from() != move.from()) {
                continue;
            }
            if(legalMove.isCastle()) {
                if(move.promotion() == null && (legalMove.castlingRook() == move.to()
                        || (legalMove.to() == move.to() && legalMove.from() != legalMove.to()))) {
                    if(legalMove.castlingRook() == move.to()) {
                        return Optional.of(legalMove);
                    }
                    castle = legalMove;
                }
            } else if(legalMove.to() == move.to() && legalMove.promotion() == move.promotion()) {
                return Optional.of(legalMove);
            }
        }
        return Optional.ofNullable(castle);
    }
}
