package max.chess.rules.utils;

import max.chess.rules.common.Square;

import java.util.ArrayList;
import java.util.List;

public final class BitUtils {

    private BitUtils() {
    }

    /**
     * Returns the index of the first (<i>rightmost</i>) bit set to 1 in the bitboard provided in input. The bit is the
     * Least Significant 1-bit (LS1B).
     *
     * @param bb the bitboard for which the LS1B is to be returned
     * @return the index of the first bit set to 1
     */
    public static int bitScanForward(long bb) {
        return Long.numberOfTrailingZeros(bb);
    }

    public static long getPositionIndexBitMask(int positionIndex) {
        return 1L << positionIndex;
    }

    public static boolean contains(long bb, int positionIndex) {
        return (bb & (1L << positionIndex)) != 0;
    }

    public static int bitCount(long bb) {
        return Long.bitCount(bb);
    }

    public static List<Square> toSquares(long bb) {
        List<Square> squares = new ArrayList<>(bitCount(bb));
        while(bb != 0) {
            squares.add(Square.of(bitScanForward(bb)));
            bb &= bb - 1;
        }
        return squares;
    }
}
