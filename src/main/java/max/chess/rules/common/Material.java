package max.chess.rules.common;

import java.util.Objects;

/**
 * A piece kind owned by a color. All twelve values are cached, use {@link #of(PieceType, Color)}.
 */
public record Material(PieceType type, Color color) {
    private static final Material[] CACHE = new Material[PieceType.VALUES.length * Color.VALUES.length];

    static {
        for(PieceType type : PieceType.VALUES) {
            for(Color color : Color.VALUES) {
                CACHE[cacheIndex(type, color)] = new Material(type, color);
            }
        }
    }

    public Material {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(color, "color");
    }

    public static Material of(PieceType type, Color color) {
        return CACHE[cacheIndex(type, color)];
    }

    public static Material white(PieceType type) {
        return of(type, Color.WHITE);
    }

    public static Material black(PieceType type) {
        return of(type, Color.BLACK);
    }

    private static int cacheIndex(PieceType type, Color color) {
        return type.ordinal() * 2 + color.ordinal();
    }

    @Override
    public String toString() {
        return color.name().toLowerCase() + " " + type.name().toLowerCase();
    }
}
