package max.chess.rules.game;

public enum WinReason {
    CHECKMATE,
    // Reported by the caller, the rules engine never decides these on its own
    RESIGNATION,
    TIME_EXPIRED,
    ABANDONMENT
}
