package max.chess.rules.game;

public enum DrawReason {
    STALEMATE,
    THREEFOLD_REPETITION,
    FIFTY_MOVE_RULE,
    INSUFFICIENT_MATERIAL,
    AGREEMENT
}
