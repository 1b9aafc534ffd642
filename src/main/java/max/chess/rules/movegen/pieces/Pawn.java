package max.chess.rules.movegen.pieces;

import max.chess.rules.common.Color;
import max.chess.rules.common.Square;
import max.chess.rules.movegen.utils.BitBoardUtils;

public final class Pawn {
    public static final long[] BLACK_PAWN_ATTACKING_MOVES_BB = new long[64];
    public static final long[] WHITE_PAWN_ATTACKING_MOVES_BB = new long[64];
    // Pushes and captures a pawn could ever make from a square, regardless of occupancy
    public static final long[] BLACK_PAWN_REACHABLE_BB = new long[64];
    public static final long[] WHITE_PAWN_REACHABLE_BB = new long[64];

    static {
        generatePawnAttackingMovesLookUp();
        generatePawnReachableLookUp();
    }

    private Pawn() {
    }

    public static void warmUp() {
        // To init the caches
    }

    public static long getAttackBB(int pawnPosition, Color color) {
        return color.isWhite()
                ? WHITE_PAWN_ATTACKING_MOVES_BB[pawnPosition]
                : BLACK_PAWN_ATTACKING_MOVES_BB[pawnPosition];
    }

    // Batch generation
    public static long getAttackBB(long pawnBB, Color color) {
        return color.isWhite()
                ? BitBoardUtils.shift(pawnBB, BitBoardUtils.Direction.NORTHEAST) | BitBoardUtils.shift(pawnBB, BitBoardUtils.Direction.NORTHWEST)
                : BitBoardUtils.shift(pawnBB, BitBoardUtils.Direction.SOUTHEAST) | BitBoardUtils.shift(pawnBB, BitBoardUtils.Direction.SOUTHWEST);
    }

    public static long getPushMovesBB(int pawnPosition, Color color, long occupiedSquaresBB) {
        long pawnBB = 1L << pawnPosition;
        BitBoardUtils.Direction forward = color.isWhite() ? BitBoardUtils.Direction.NORTH : BitBoardUtils.Direction.SOUTH;
        long singlePushBB = BitBoardUtils.shift(pawnBB, forward) & ~occupiedSquaresBB;
        if(singlePushBB == 0 || !isOnStartRank(pawnPosition, color)) {
            return singlePushBB;
        }
        return singlePushBB | (BitBoardUtils.shift(singlePushBB, forward) & ~occupiedSquaresBB);
    }

    public static long getReachableBB(int pawnPosition, Color color) {
        return color.isWhite()
                ? WHITE_PAWN_REACHABLE_BB[pawnPosition]
                : BLACK_PAWN_REACHABLE_BB[pawnPosition];
    }

    public static boolean isOnStartRank(int pawnPosition, Color color) {
        return pawnPosition / 8 == (color.isWhite() ? 1 : 6);
    }

    private static void generatePawnAttackingMovesLookUp() {
        for(int i=0;i<64;i++) {
            long pawnBB = 1L << i;
            WHITE_PAWN_ATTACKING_MOVES_BB[i] = getAttackBB(pawnBB, Color.WHITE);
            BLACK_PAWN_ATTACKING_MOVES_BB[i] = getAttackBB(pawnBB, Color.BLACK);
        }
    }

    private static void generatePawnReachableLookUp() {
        for(int i=0;i<64;i++) {
            Square square = Square.of(i);
            WHITE_PAWN_REACHABLE_BB[i] = generatePawnReachableAt(square, Color.WHITE);
            BLACK_PAWN_REACHABLE_BB[i] = generatePawnReachableAt(square, Color.BLACK);
        }
    }

    private static long generatePawnReachableAt(Square square, Color color) {
        // A pawn never stands on a back rank
        if (square.getY() == 0 || square.getY() == 7) {
            return 0;
        }

        int positionIndex = square.getFlatIndex();
        long pawnMovesBB = getAttackBB(positionIndex, color);
        pawnMovesBB |= 1L << (positionIndex + color.pawnPushOffset());
        if(isOnStartRank(positionIndex, color)) {
            pawnMovesBB |= 1L << (positionIndex + 2 * color.pawnPushOffset());
        }

        return pawnMovesBB;
    }
}
