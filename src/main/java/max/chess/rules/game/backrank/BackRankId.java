package max.chess.rules.game.backrank;

import max.chess.rules.exceptions.InvalidPositionException;

import java.util.Objects;
import java.util.Random;

/**
 * Scharnagl number of a back rank arrangement, from 0 to 959. Standard chess is 518.
 */
public record BackRankId(int value) {
    public static final int COUNT = 960;
    public static final BackRankId STANDARD = new BackRankId(518);

    public BackRankId {
        if(value < 0 || value >= COUNT) {
            throw new InvalidPositionException("Back rank id must be in [0, " + (COUNT - 1) + "], got " + value);
        }
    }

    public static BackRankId of(int value) {
        return new BackRankId(value);
    }

    // The only place that needs entropy
    public static BackRankId shuffled(Random random) {
        Objects.requireNonNull(random, "random");
        return new BackRankId(random.nextInt(COUNT));
    }

    public boolean isStandard() {
        return value == STANDARD.value;
    }

    public BackRank backRank() {
        return BackRank.of(this);
    }
}
