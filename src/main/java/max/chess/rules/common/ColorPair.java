package max.chess.rules.common;

import java.util.Objects;
import java.util.function.Function;

// Color-symmetric data, stored once per color and looked up by color
public record ColorPair<T>(T white, T black) {

    public static <T> ColorPair<T> of(T white, T black) {
        return new ColorPair<>(white, black);
    }

    public static <T> ColorPair<T> both(T value) {
        return new ColorPair<>(value, value);
    }

    public static <T> ColorPair<T> from(Function<Color, T> factory) {
        return new ColorPair<>(factory.apply(Color.WHITE), factory.apply(Color.BLACK));
    }

    public T get(Color color) {
        return color == Color.WHITE ? white : black;
    }

    public ColorPair<T> with(Color color, T value) {
        Objects.requireNonNull(color, "color");
        return color == Color.WHITE ? new ColorPair<>(value, black) : new ColorPair<>(white, value);
    }
}
