package max.chess.rules.movegen.pieces;

import max.chess.rules.common.Color;
import max.chess.rules.common.Square;
import max.chess.rules.game.board.CastlingRights;
import max.chess.rules.game.board.CastlingSide;
import max.chess.rules.game.board.Position;
import max.chess.rules.movegen.utils.CheckUtils;
import max.chess.rules.movegen.utils.ObstructedLinesUtils;
import max.chess.rules.utils.BitUtils;

public final class King {
    public static final long[] KING_MOVES_BB = new long[64];

    static {
        generateKingMovesBB();
    }

    private King() {
    }

    public static void warmUp() {
        // To init the caches
    }

    public static long getAttackBB(int positionIndex) {
        return KING_MOVES_BB[positionIndex];
    }

    // enemyAttackBB must be computed with our king removed from the board
    public static long getNonCastleLegalMovesBB(int positionIndex, long enemyAttackBB, long friendlySquaresBB) {
        return getAttackBB(positionIndex) & ~enemyAttackBB & ~friendlySquaresBB;
    }

    /**
     * Castling works the same way for standard chess and Chess960: the king ends on the g or c file and the
     * rook on the f or d file. Every square the king or the rook crosses or lands on must be empty apart
     * from those two pieces, and no square the king stands on, crosses or lands on may be attacked.
     */
    public static boolean isCastleLegal(Position position, Color kingColor, CastlingSide side, boolean isKingInCheck) {
        CastlingRights rights = position.castlingRights(kingColor);
        if(isKingInCheck || !rights.has(side)) {
            return false;
        }

        int rank = kingColor.backRank();
        int kingIndex = rank * 8 + rights.kingFile();
        int rookIndex = rank * 8 + rights.rookFile(side);
        int kingDestination = rank * 8 + side.kingDestinationFile;
        int rookDestination = rank * 8 + side.rookDestinationFile;

        long castlersBB = BitUtils.getPositionIndexBitMask(kingIndex) | BitUtils.getPositionIndexBitMask(rookIndex);
        long occupiedBB = position.occupiedBB() & ~castlersBB;

        long kingPathBB = ObstructedLinesUtils.OBSTRUCTED_BB[kingIndex][kingDestination] | BitUtils.getPositionIndexBitMask(kingDestination);
        long rookPathBB = ObstructedLinesUtils.OBSTRUCTED_BB[rookIndex][rookDestination] | BitUtils.getPositionIndexBitMask(rookDestination);
        if(((kingPathBB | rookPathBB) & occupiedBB) != 0) {
            return false;
        }

        Color oppositeColor = kingColor.getOppositeColor();
        while(kingPathBB != 0) {
            int passageIndex = BitUtils.bitScanForward(kingPathBB);
            kingPathBB &= kingPathBB - 1;
            if(CheckUtils.getAttackersBB(position, passageIndex, oppositeColor, occupiedBB) != 0) {
                return false;
            }
        }
        return true;
    }

    private static void generateKingMovesBB() {
        for(int i=0;i<64;i++) {
            KING_MOVES_BB[i]= generateKingMovesAt(Square.of(i));
        }
    }

    private static long generateKingMovesAt(Square kingSquare) {
        long kingMovesBitboard = 0;
        int positionIndex = kingSquare.getFlatIndex();

        // move in any of the 8 directions
        // right
        if(kingSquare.getX() < 7) {
            kingMovesBitboard |= 1L << (positionIndex + 1);
        }
        // left
        if(kingSquare.getX() > 0) {
            kingMovesBitboard |= 1L << (positionIndex - 1);
        }

        // up
        if(kingSquare.getY() < 7) {
            kingMovesBitboard |= 1L << (positionIndex + 8);
        }

        // down
        if(kingSquare.getY() > 0) {
            kingMovesBitboard |= 1L << (positionIndex - 8);
        }

        // down - left
        if(kingSquare.getY() > 0 && kingSquare.getX() > 0) {
            kingMovesBitboard |= 1L << (positionIndex - 9);
        }

        // down - right
        if(kingSquare.getY() > 0 && kingSquare.getX() < 7) {
            kingMovesBitboard |= 1L << (positionIndex - 7);
        }

        // up - left
        if(kingSquare.getY() < 7 && kingSquare.getX() > 0) {
            kingMovesBitboard |= 1L << (positionIndex + 7);
        }

        // up - right
        if(kingSquare.getY() < 7 && kingSquare.getX() < 7) {
            kingMovesBitboard |= 1L << (positionIndex + 9);
        }

        return kingMovesBitboard;
    }
}
