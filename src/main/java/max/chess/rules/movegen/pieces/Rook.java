package max.chess.rules.movegen.pieces;

import max.chess.rules.movegen.utils.BitBoardUtils;

public final class Rook {
    // Orthogonal moves on an empty board
    public static final long[] ROOK_MOVES_BB = new long[64];

    static {
        for(int i = 0; i < 64; i++) {
            ROOK_MOVES_BB[i] = getAttackBB(i, 0L);
        }
    }

    private Rook() {
    }

    public static void warmUp() {
        // To init the caches
    }

    public static long getAttackBB(int positionIndex, long occupiedSquaresBB) {
        return BitBoardUtils.generateRayAttacks(positionIndex, BitBoardUtils.Direction.ORTHOGONALS, occupiedSquaresBB);
    }

    public static long getLegalMovesBB(int positionIndex, long occupiedSquaresBB, long friendlyOccupiedSquaresBB) {
        return getAttackBB(positionIndex, occupiedSquaresBB) & ~friendlyOccupiedSquaresBB;
    }
}
