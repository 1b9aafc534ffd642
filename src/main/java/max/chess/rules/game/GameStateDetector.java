package max.chess.rules.game;

import max.chess.rules.game.board.Position;
import max.chess.rules.movegen.MoveState;

import java.util.Optional;

public final class GameStateDetector {

    private GameStateDetector() {
    }

    /**
     * Decides whether the game is over in the state reached after a move. The first matching rule wins:
     * checkmate, stalemate, repetition, fifty-move rule, then insufficient material.
     */
    public static Optional<GameResult> detect(MoveState state, History history, RulesConfig config) {
        Position position = state.position();
        if(state.legalMoves().isEmpty()) {
            return Optional.of(state.isInCheck()
                    // The side that just moved delivered mate
                    ? GameResult.win(position.sideToMove().getOppositeColor(), WinReason.CHECKMATE)
                    : GameResult.draw(DrawReason.STALEMATE));
        }
        if(history.repetitions(position.key()) >= config.repetitionLimit) {
            return Optional.of(GameResult.draw(DrawReason.THREEFOLD_REPETITION));
        }
        if(position.halfMoveClock() >= config.fiftyMoveLimitPlies) {
            return Optional.of(GameResult.draw(DrawReason.FIFTY_MOVE_RULE));
        }
        if(config.detectInsufficientMaterial && MatingMaterial.isInsufficient(position)) {
            return Optional.of(GameResult.draw(DrawReason.INSUFFICIENT_MATERIAL));
        }
        return Optional.empty();
    }
}
