package max.chess.rules.exceptions;

public class NoPendingPreMoveException extends RulesException {

    public NoPendingPreMoveException(String message) {
        super(message);
    }
}
