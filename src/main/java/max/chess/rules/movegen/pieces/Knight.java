package max.chess.rules.movegen.pieces;

import max.chess.rules.common.Square;

public final class Knight {
    public static final long[] KNIGHT_MOVES_BB = new long[64];

    static {
        generateKnightMovesBB();
    }

    private Knight() {
    }

    public static void warmUp() {
        // To init the caches
    }

    public static long getLegalMovesBB(int positionIndex, long friendlyOccupiedSquareBB) {
        return getAttackBB(positionIndex) & ~friendlyOccupiedSquareBB;
    }

    public static long getAttackBB(int positionIndex) {
        return KNIGHT_MOVES_BB[positionIndex];
    }

    private static void generateKnightMovesBB() {
        for(int i=0;i<64;i++) {
            KNIGHT_MOVES_BB[i]= generateKnightMovesAt(Square.of(i));
        }
    }

    private static long generateKnightMovesAt(Square knightSquare) {
        int positionIndex = knightSquare.getFlatIndex();
        long movesBB = 0;

        // up - left
        if(knightSquare.getX() > 0 && knightSquare.getY() < 6)
            movesBB |= 1L << (positionIndex + 8 + 7);
        // up - right
        if(knightSquare.getX() < 7 && knightSquare.getY() < 6)
            movesBB |= 1L << (positionIndex + 8 + 9);
        // down - left
        if(knightSquare.getX() > 0 && knightSquare.getY() > 1)
            movesBB |= 1L << (positionIndex - 8 - 9);
        // down - right
        if(knightSquare.getX() < 7 && knightSquare.getY() > 1)
            movesBB |= 1L << (positionIndex - 8 - 7);
        // left - up
        if(knightSquare.getX() > 1 && knightSquare.getY() < 7)
            movesBB |= 1L << (positionIndex - 1 + 7);
        // left - down
        if(knightSquare.getX() > 1 && knightSquare.getY() > 0)
            movesBB |= 1L << (positionIndex - 1 - 9);
        // right - up
        if(knightSquare.getX() < 6 && knightSquare.getY() < 7)
            movesBB |= 1L << (positionIndex + 1 + 9);
        // right - down
        if(knightSquare.getX() < 6 && knightSquare.getY() > 0)
            movesBB |= 1L << (positionIndex + 1 - 7);

        return movesBB;
    }
}
