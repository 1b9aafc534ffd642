package max.chess.rules.exceptions;

public class InvalidPositionException extends RulesException {

    public InvalidPositionException(String message) {
        super(message);
    }
}
