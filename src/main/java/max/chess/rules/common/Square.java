package max.chess.rules.common;

/**
 * One of the 64 board squares. Instances are cached, so identity comparison is fine.
 * Index layout: a1 = 0, h1 = 7, a8 = 56, h8 = 63.
 */
public final class Square {

    private final static Square[] SQUARE_CACHE = new Square[64];
    static {
        for(int i = 0; i < 64; i++) {
            SQUARE_CACHE[i] = new Square(i % 8, i / 8);
        }
    }

    public static Square of(int x, int y) {
        if(!isOnBoard(x, y)) {
            throw new IllegalArgumentException("Square out of the board: x=" + x + ", y=" + y);
        }

        return SQUARE_CACHE[x + 8 * y];
    }

    public static Square of(int flatIndex) {
        if(flatIndex < 0 || flatIndex >= 64) {
            throw new IllegalArgumentException("Square index out of the board: " + flatIndex);
        }

        return SQUARE_CACHE[flatIndex];
    }

    // e.g. "e4"
    public static Square of(String name) {
        if(name == null || name.length() != 2) {
            throw new IllegalArgumentException("Invalid square name: " + name);
        }
        return Square.of(name.charAt(0) - 'a', name.charAt(1) - '1');
    }

    public static boolean isOnBoard(int x, int y) {
        return x >= 0 && x < 8 && y >= 0 && y < 8;
    }

    public final int x;
    public final int y;
    public final int flatIndex;

    private Square(int x, int y) {
        this.x = x;
        this.y = y;
        this.flatIndex = x + 8*y;
    }

    public int getX() {
        return x;
    }

    public int getY() {
        return y;
    }

    public int getFlatIndex() {
        return flatIndex;
    }

    public long bitMask() {
        return 1L << flatIndex;
    }

    public boolean isLight() {
        return (x + y) % 2 != 0;
    }

    public String name() {
        return "" + (char) ('a' + x) + (char) ('1' + y);
    }

    @Override
    public boolean equals(Object obj) {
        return obj == this;
    }

    @Override
    public int hashCode() {
        return flatIndex;
    }

    @Override
    public String toString() {
        return name();
    }
}
