package max.chess.rules.game;

import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import max.chess.rules.game.board.PositionKey;

/**
 * Multiset of the positions reached since the last irreversible move.
 */
public final class RepetitionCounter {
    private final Object2IntOpenHashMap<PositionKey> counts;

    public RepetitionCounter() {
        this.counts = new Object2IntOpenHashMap<>(64);
        this.counts.defaultReturnValue(0);
    }

    /** Forgets every position, used after a pawn move or a capture since none of them can occur again. */
    public void reset() {
        counts.clear();
    }

    /** Increments the count of a key and returns the new count. */
    public int inc(PositionKey key) {
        return counts.addTo(key, 1) + 1;
    }

    /** Current count (0 if absent). */
    public int get(PositionKey key) {
        return counts.getInt(key);
    }

    public int size() {
        return counts.size();
    }
}
