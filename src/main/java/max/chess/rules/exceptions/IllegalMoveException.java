package max.chess.rules.exceptions;

import max.chess.rules.movegen.Move;

public class IllegalMoveException extends RulesException {
    private final transient Move move;

    public IllegalMoveException(Move move, String reason) {
        super("Illegal move " + move + ": " + reason);
        this.move = move;
    }

    public Move getMove() {
        return move;
    }
}
