package max.chess.rules.review;

import max.chess.rules.game.History;
import max.chess.rules.game.board.Position;
import max.chess.rules.movegen.LegalMove;

import java.util.Objects;
import java.util.Optional;

/**
 * {@link Review} over a live {@link History}. While the cursor sits on the latest position it follows
 * the game as plies are added; once moved back it stays where it was put.
 */
public final class ReviewNavigator implements Review {
    private final History history;
    private int cursor;
    private boolean followsEnd;

    public ReviewNavigator(History history) {
        this.history = Objects.requireNonNull(history, "history");
        this.cursor = history.plyCount();
        this.followsEnd = true;
    }

    @Override
    public int length() {
        return history.plyCount();
    }

    @Override
    public int offset() {
        return followsEnd ? history.plyCount() : cursor;
    }

    @Override
    public Position get(int ply) {
        return history.positionAt(ply);
    }

    @Override
    public Optional<LegalMove> currentMove() {
        int offset = offset();
        return offset == 0 ? Optional.empty() : Optional.of(history.moveTo(offset));
    }

    @Override
    public Position forward() {
        return moveTo(Math.min(offset() + 1, length()));
    }

    @Override
    public Position back() {
        return moveTo(Math.max(offset() - 1, 0));
    }

    @Override
    public Position toStart() {
        return moveTo(0);
    }

    @Override
    public Position toEnd() {
        return moveTo(length());
    }

    @Override
    public Position jumpTo(int ply) {
        if(ply < 0 || ply > length()) {
            throw new IllegalArgumentException("Ply " + ply + " outside of [0, " + length() + "]");
        }
        return moveTo(ply);
    }

    private Position moveTo(int ply) {
        cursor = ply;
        followsEnd = ply == length();
        return current();
    }
}
