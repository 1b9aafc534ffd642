package max.chess.rules.movegen.utils;

import max.chess.rules.common.Color;
import max.chess.rules.common.PieceType;
import max.chess.rules.game.board.Position;
import max.chess.rules.movegen.pieces.Bishop;
import max.chess.rules.movegen.pieces.King;
import max.chess.rules.movegen.pieces.Knight;
import max.chess.rules.movegen.pieces.Pawn;
import max.chess.rules.movegen.pieces.Rook;
import max.chess.rules.utils.BitUtils;

public final class CheckUtils {

    private CheckUtils() {
    }

    public static boolean isKingInCheck(long kingPositionBB, long enemyAttackBB) {
        return (kingPositionBB & enemyAttackBB) != 0;
    }

    public static boolean isKingInCheck(Position position, Color kingColor) {
        return getAttackersBB(position, position.kingIndex(kingColor), kingColor.getOppositeColor(), position.occupiedBB()) != 0;
    }

    /**
     * Pieces of {@code attackerColor} attacking a square, with sliders blocked by {@code occupiedBB}
     * rather than by the position's actual occupancy.
     */
    public static long getAttackersBB(Position position, int positionIndex, Color attackerColor, long occupiedBB) {
        long bishopsBB = position.pieceBB(PieceType.BISHOP) | position.pieceBB(PieceType.QUEEN);
        long rooksBB = position.pieceBB(PieceType.ROOK) | position.pieceBB(PieceType.QUEEN);
        long attackersBB = (Knight.getAttackBB(positionIndex) & position.pieceBB(PieceType.KNIGHT))
                | (King.getAttackBB(positionIndex) & position.pieceBB(PieceType.KING))
                // A pawn attacks us from where our own pawn would capture
                | (Pawn.getAttackBB(positionIndex, attackerColor.getOppositeColor()) & position.pieceBB(PieceType.PAWN))
                | (Bishop.getAttackBB(positionIndex, occupiedBB) & bishopsBB)
                | (Rook.getAttackBB(positionIndex, occupiedBB) & rooksBB);
        return attackersBB & position.colorBB(attackerColor) & occupiedBB;
    }

    /**
     * Plays an en passant capture on a scratch occupancy and looks for attackers of the king. Needed
     * because taking two pawns off the same rank can open a line that the pin detection does not see.
     */
    public static boolean wouldKingBeInCheckAfterEnPassant(Position position, int from, int to, Color kingColor) {
        int capturedIndex = to - kingColor.pawnPushOffset();
        long occupiedBB = position.occupiedBB();
        occupiedBB &= ~BitUtils.getPositionIndexBitMask(from);
        occupiedBB &= ~BitUtils.getPositionIndexBitMask(capturedIndex);
        occupiedBB |= BitUtils.getPositionIndexBitMask(to);

        return getAttackersBB(position, position.kingIndex(kingColor), kingColor.getOppositeColor(), occupiedBB) != 0;
    }
}
