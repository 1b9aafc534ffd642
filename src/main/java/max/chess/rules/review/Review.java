package max.chess.rules.review;

import max.chess.rules.game.board.Position;
import max.chess.rules.movegen.LegalMove;

import java.util.Optional;

/**
 * Read-only cursor over the positions of a game. Ply 0 is the starting position, ply {@link #length()} the
 * latest one. Moving the cursor never changes the game.
 */
public interface Review {

    // Number of plies played so far
    int length();

    // Ply the cursor is on
    int offset();

    Position get(int ply);

    // The move that led to the current position, empty at the start
    Optional<LegalMove> currentMove();

    Position forward();

    Position back();

    Position toStart();

    Position toEnd();

    Position jumpTo(int ply);

    default boolean atStart() {
        return offset() == 0;
    }

    default boolean atEnd() {
        return offset() == length();
    }

    default Position first() {
        return get(0);
    }

    default Position last() {
        return get(length());
    }

    default Position current() {
        return get(offset());
    }
}
