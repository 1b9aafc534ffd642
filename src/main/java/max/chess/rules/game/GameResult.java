package max.chess.rules.game;

import max.chess.rules.common.Color;

import java.util.Objects;

/**
 * Outcome of a finished game: either a winner with its {@link WinReason}, or a {@link DrawReason}.
 */
public record GameResult(Color winner, WinReason winReason, DrawReason drawReason) {

    public GameResult {
        boolean decisive = winner != null && winReason != null && drawReason == null;
        boolean drawn = winner == null && winReason == null && drawReason != null;
        if(!decisive && !drawn) {
            throw new IllegalArgumentException("A result is either a win with its reason or a draw with its reason");
        }
    }

    public static GameResult win(Color winner, WinReason reason) {
        return new GameResult(Objects.requireNonNull(winner, "winner"), Objects.requireNonNull(reason, "reason"), null);
    }

    public static GameResult draw(DrawReason reason) {
        return new GameResult(null, null, Objects.requireNonNull(reason, "reason"));
    }

    public boolean isDraw() {
        return drawReason != null;
    }

    public boolean isWin() {
        return winner != null;
    }

    public Color loser() {
        return winner == null ? null : winner.getOppositeColor();
    }

    @Override
    public String toString() {
        return isDraw() ? "draw by " + drawReason : winner + " wins by " + winReason;
    }
}
