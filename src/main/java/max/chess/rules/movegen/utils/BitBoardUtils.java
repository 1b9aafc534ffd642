package max.chess.rules.movegen.utils;

import max.chess.rules.utils.BitUtils;

public final class BitBoardUtils {

    public enum Direction {
        NORTH, SOUTH, EAST, WEST, NORTHEAST, NORTHWEST, SOUTHEAST, SOUTHWEST;

        public static final Direction[] ORTHOGONALS = { NORTH, SOUTH, EAST, WEST };
        public static final Direction[] DIAGONALS = { NORTHEAST, NORTHWEST, SOUTHEAST, SOUTHWEST };
    }

    /**
     * The bitboard representing the light squares on a chessboard.
     */
    public static final long LIGHT_SQUARES = 0x55AA55AA55AA55AAL;
    /**
     * The bitboard representing the dark squares on a chessboard.
     */
    public static final long DARK_SQUARES = 0xAA55AA55AA55AA55L;

    /**
     * The bitboards representing the ranks on a chessboard. Bitboard at index 0
     * identifies the 1st rank on a board, bitboard at index 1 the 2nd rank, etc.
     */
    public final static long[] RANK_BB = { 0x00000000000000FFL, 0x000000000000FF00L, 0x0000000000FF0000L, 0x00000000FF000000L,
            0x000000FF00000000L, 0x0000FF0000000000L, 0x00FF000000000000L, 0xFF00000000000000L };
    /**
     * The bitboards representing the files on a chessboard. Bitboard at index 0
     * identifies the 1st file on a board, bitboard at index 1 the 2nd file, etc.
     */
    public final static long[] FILE_BB = { 0x0101010101010101L, 0x0202020202020202L, 0x0404040404040404L, 0x0808080808080808L,
            0x1010101010101010L, 0x2020202020202020L, 0x4040404040404040L, 0x8080808080808080L };

    // Empty board rays, indexed by direction ordinal then square
    public static final long[][] RAYS_BB = new long[Direction.values().length][64];

    static {
        for(Direction direction : Direction.values()) {
            for(int i = 0; i < 64; i++) {
                RAYS_BB[direction.ordinal()][i] = generateRayAttack(i, direction, 0L);
            }
        }
    }

    private BitBoardUtils() {
    }

    public static void warmUp() {
        // To init static block
    }

    // The ray stops on the first occupied square, which is included
    public static long generateRayAttack(int positionIndex, Direction direction, long occ)
    {
        long attack = 0L;
        long sqBB = BitUtils.getPositionIndexBitMask(positionIndex);

        while (true)
        {
            sqBB = BitBoardUtils.shift(sqBB, direction);
            attack |= sqBB;

            if (sqBB == 0 || 0L != (sqBB & occ))
            {
                break;
            }
        }

        return attack;
    }

    public static long generateRayAttacks(int positionIndex, Direction[] directions, long occ) {
        long attack = 0L;
        for(Direction direction : directions) {
            attack |= generateRayAttack(positionIndex, direction, occ);
        }
        return attack;
    }

    public static long shift(long bitboard, Direction direction) {
        return switch (direction) {
            case NORTH -> bitboard << 8;
            case SOUTH -> bitboard >>> 8;
            case EAST -> (bitboard & ~FILE_BB[7]) << 1;
            case WEST -> (bitboard & ~FILE_BB[0]) >>> 1;
            case NORTHEAST -> (bitboard & ~FILE_BB[7]) << 9;
            case NORTHWEST -> (bitboard & ~FILE_BB[0]) << 7;
            case SOUTHEAST -> (bitboard & ~FILE_BB[7]) >>> 7;
            case SOUTHWEST -> (bitboard & ~FILE_BB[0]) >>> 9;
        };
    }
}
