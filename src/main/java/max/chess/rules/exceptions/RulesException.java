package max.chess.rules.exceptions;

/**
 * Base of every error the rules engine reports. A call failing with one of them left the board untouched.
 */
public abstract class RulesException extends RuntimeException {

    protected RulesException(String message) {
        super(message);
    }
}
