package max.chess.rules.exceptions;

import max.chess.rules.game.GameResult;

public class GameAlreadyTerminalException extends RulesException {
    private final transient GameResult result;

    public GameAlreadyTerminalException(GameResult result) {
        super("Game is already over: " + result);
        this.result = result;
    }

    public GameResult getResult() {
        return result;
    }
}
