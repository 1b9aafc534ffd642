package max.chess.rules.movegen.utils;

import max.chess.rules.movegen.utils.BitBoardUtils.Direction;
import max.chess.rules.utils.BitUtils;

/**
 * Square pair tables. {@link #OBSTRUCTED_BB} holds the squares strictly between two aligned squares,
 * {@link #LINE_BB} the whole board line going through both of them. Both are empty for squares that
 * do not share a rank, file or diagonal.
 */
public final class ObstructedLinesUtils {
    public static final long[][] OBSTRUCTED_BB = new long[64][64];
    public static final long[][] LINE_BB = new long[64][64];

    static {
        fillLinesBB();
    }

    private ObstructedLinesUtils() {
    }

    public static void warmUp() {
        // To init static block
    }

    public static boolean areAligned(int square1, int square2) {
        return LINE_BB[square1][square2] != 0;
    }

    private static void fillLinesBB() {
        for(int i = 0; i < 64; i++) {
            for(Direction direction : Direction.values()) {
                Direction opposite = opposite(direction);
                long rayBB = BitBoardUtils.RAYS_BB[direction.ordinal()][i];
                long lineBB = rayBB | BitBoardUtils.RAYS_BB[opposite.ordinal()][i] | BitUtils.getPositionIndexBitMask(i);

                long remaining = rayBB;
                while(remaining != 0) {
                    int j = BitUtils.bitScanForward(remaining);
                    remaining &= remaining - 1;
                    OBSTRUCTED_BB[i][j] = rayBB & BitBoardUtils.RAYS_BB[opposite.ordinal()][j];
                    LINE_BB[i][j] = lineBB;
                }
            }
        }
    }

    private static Direction opposite(Direction direction) {
        return switch (direction) {
            case NORTH -> Direction.SOUTH;
            case SOUTH -> Direction.NORTH;
            case EAST -> Direction.WEST;
            case WEST -> Direction.EAST;
            case NORTHEAST -> Direction.SOUTHWEST;
            case SOUTHWEST -> Direction.NORTHEAST;
            case NORTHWEST -> Direction.SOUTHEAST;
            case SOUTHEAST -> Direction.NORTHWEST;
        };
    }
}
