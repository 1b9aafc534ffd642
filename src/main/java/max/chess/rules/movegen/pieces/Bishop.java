package max.chess.rules.movegen.pieces;

import max.chess.rules.movegen.utils.BitBoardUtils;

public final class Bishop {
    // Diagonal moves on an empty board
    public static final long[] BISHOP_MOVES_BB = new long[64];

    static {
        for(int i = 0; i < 64; i++) {
            BISHOP_MOVES_BB[i] = getAttackBB(i, 0L);
        }
    }

    private Bishop() {
    }

    public static void warmUp() {
        // To init the caches
    }

    public static long getAttackBB(int positionIndex, long occupiedSquaresBB) {
        return BitBoardUtils.generateRayAttacks(positionIndex, BitBoardUtils.Direction.DIAGONALS, occupiedSquaresBB);
    }

    public static long getLegalMovesBB(int positionIndex, long occupiedSquaresBB, long friendlyOccupiedSquaresBB) {
        return getAttackBB(positionIndex, occupiedSquaresBB) & ~friendlyOccupiedSquaresBB;
    }
}
