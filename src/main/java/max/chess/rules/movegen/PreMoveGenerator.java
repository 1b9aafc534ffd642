package max.chess.rules.movegen;

import max.chess.rules.common.Color;
import max.chess.rules.common.Material;
import max.chess.rules.common.PieceType;
import max.chess.rules.common.Square;
import max.chess.rules.exceptions.IllegalMoveException;
import max.chess.rules.game.board.CastlingRights;
import max.chess.rules.game.board.CastlingSide;
import max.chess.rules.game.board.Position;
import max.chess.rules.movegen.pieces.Bishop;
import max.chess.rules.movegen.pieces.King;
import max.chess.rules.movegen.pieces.Knight;
import max.chess.rules.movegen.pieces.Pawn;
import max.chess.rules.movegen.pieces.Rook;
import max.chess.rules.utils.BitUtils;

/**
 * Geometry-only destinations for pre-moves. The opponent has not replied yet, so occupancy is ignored:
 * any square a piece could reach on an empty board is accepted, pawn captures included.
 */
public final class PreMoveGenerator {

    private PreMoveGenerator() {
    }

    public static long getDestinationsBB(Position position, Square from, Color mover) {
        Material material = position.getMaterialAt(from.getFlatIndex());
        if(material == null || material.color() != mover) {
            return 0L;
        }

        int fromIndex = from.getFlatIndex();
        return switch (material.type()) {
            case PAWN -> Pawn.getReachableBB(fromIndex, mover);
            case KNIGHT -> Knight.getAttackBB(fromIndex);
            case BISHOP -> Bishop.BISHOP_MOVES_BB[fromIndex];
            case ROOK -> Rook.ROOK_MOVES_BB[fromIndex];
            case QUEEN -> Bishop.BISHOP_MOVES_BB[fromIndex] | Rook.ROOK_MOVES_BB[fromIndex];
            case KING -> King.getAttackBB(fromIndex) | getCastleTargetsBB(position, fromIndex, mover);
        };
    }

    /**
     * Checks that a move could become legal once the opponent has replied.
     *
     * @throws IllegalMoveException if the geometry or the promotion piece is wrong
     */
    public static void validate(Position position, Move move, Color mover) {
        if(!BitUtils.contains(getDestinationsBB(position, move.from(), mover), move.to().getFlatIndex())) {
            throw new IllegalMoveException(move, "not a possible pre-move for " + mover);
        }
        Material material = position.getMaterialAt(move.from().getFlatIndex());
        boolean promoting = material.type() == PieceType.PAWN && move.to().getY() == mover.promotionRank();
        if(promoting && move.promotion() == null) {
            throw new IllegalMoveException(move, "a promotion piece is required");
        }
        if(!promoting && move.promotion() != null) {
            throw new IllegalMoveException(move, "only a pawn reaching the last rank can promote");
        }
    }

    private static long getCastleTargetsBB(Position position, int kingIndex, Color mover) {
        CastlingRights rights = position.castlingRights(mover);
        int rank = mover.backRank();
        long targetsBB = 0L;
        for(CastlingSide side : CastlingSide.VALUES) {
            if(rights.has(side)) {
                targetsBB |= BitUtils.getPositionIndexBitMask(rank * 8 + side.kingDestinationFile);
                targetsBB |= BitUtils.getPositionIndexBitMask(rank * 8 + rights.rookFile(side));
            }
        }
        return targetsBB & ~BitUtils.getPositionIndexBitMask(kingIndex);
    }
}
