package max.chess.rules.movegen;

import max.chess.rules.game.board.MoveId;

import java.util.Objects;

/**
 * A speculative move queued while waiting for the opponent. It is only checked for geometry against
 * the position observed when it was queued ({@code queuedAt}); legality is decided once the opponent
 * has moved.
 */
public record PreMove(Move move, MoveId queuedAt) {

    public PreMove {
        Objects.requireNonNull(move, "move");
        Objects.requireNonNull(queuedAt, "queuedAt");
    }
}
