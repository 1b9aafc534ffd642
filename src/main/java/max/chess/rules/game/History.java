package max.chess.rules.game;

import max.chess.rules.game.board.Position;
import max.chess.rules.game.board.PositionKey;
import max.chess.rules.movegen.LegalMove;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Positions and moves of a game in order, {@code positionAt(0)} being the starting position and
 * {@code positionAt(n)} the position after {@code n} plies. Also counts repetitions for the threefold rule.
 */
public final class History {
    private final List<Position> positions = new ArrayList<>();
    private final List<LegalMove> moves = new ArrayList<>();
    private final RepetitionCounter repetitionCounter = new RepetitionCounter();

    History(Position initial) {
        positions.add(initial);
        repetitionCounter.inc(initial.key());
    }

    void push(LegalMove move, Position next) {
        if(next.halfMoveClock() == 0) {
            repetitionCounter.reset();
        }
        moves.add(move);
        positions.add(next);
        repetitionCounter.inc(next.key());
    }

    public int plyCount() {
        return moves.size();
    }

    public Position initial() {
        return positions.get(0);
    }

    public Position last() {
        return positions.get(positions.size() - 1);
    }

    public Position positionAt(int ply) {
        if(ply < 0 || ply > moves.size()) {
            throw new IndexOutOfBoundsException("Ply " + ply + " outside of [0, " + moves.size() + "]");
        }
        return positions.get(ply);
    }

    // The move that led to positionAt(ply)
    public LegalMove moveTo(int ply) {
        if(ply < 1 || ply > moves.size()) {
            throw new IndexOutOfBoundsException("Ply " + ply + " outside of [1, " + moves.size() + "]");
        }
        return moves.get(ply - 1);
    }

    public List<LegalMove> moves() {
        return Collections.unmodifiableList(moves);
    }

    public int repetitions(PositionKey key) {
        return repetitionCounter.get(key);
    }
}
