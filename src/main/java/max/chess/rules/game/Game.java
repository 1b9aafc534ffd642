package max.chess.rules.game;

import max.chess.rules.common.Color;
import max.chess.rules.common.Material;
import max.chess.rules.exceptions.GameAlreadyTerminalException;
import max.chess.rules.exceptions.IllegalMoveException;
import max.chess.rules.game.backrank.BackRankId;
import max.chess.rules.game.backrank.BackRanks;
import max.chess.rules.game.board.Castling;
import max.chess.rules.game.board.CastlingRights;
import max.chess.rules.game.board.Position;
import max.chess.rules.movegen.LegalMove;
import max.chess.rules.movegen.LegalMoves;
import max.chess.rules.movegen.Move;
import max.chess.rules.movegen.MoveGenerator;
import max.chess.rules.movegen.MoveState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Rules core shared by {@link EngineBoard} and {@link PlayerBoard}: current position and its move state,
 * history and result. Not thread safe, a game must be driven by a single caller at a time.
 * <p>
 * Every mutating call validates first and only then changes state, so a call that throws has no effect.
 */
public final class Game implements LegalMoves, BackRanks, Castling {
    private static final Logger logger = LoggerFactory.getLogger(Game.class);

    public static void warmUp() {
        MoveGenerator.warmUp();
    }

    private final RulesConfig config;
    private final BackRankId backRankId;
    private final History history;
    private MoveState moveState;
    private GameResult result;

    Game(Position initial, BackRankId backRankId, RulesConfig config) {
        this.config = Objects.requireNonNull(config, "config");
        this.backRankId = backRankId;
        this.history = new History(Objects.requireNonNull(initial, "initial"));
        this.moveState = MoveGenerator.analyze(initial);
        this.result = GameStateDetector.detect(moveState, history, config).orElse(null);
        if(result != null) {
            logger.debug("Game starts in a finished position: {}", result);
        }
    }

    static Game start(BackRankId backRankId, RulesConfig config) {
        Objects.requireNonNull(backRankId, "backRankId");
        return new Game(Position.initial(backRankId), backRankId, config);
    }

    public Position position() {
        return moveState.position();
    }

    public MoveState moveState() {
        return moveState;
    }

    public History history() {
        return history;
    }

    public RulesConfig config() {
        return config;
    }

    public Color sideToMove() {
        return position().sideToMove();
    }

    public boolean isInCheck() {
        return moveState.isInCheck();
    }

    public Optional<GameResult> result() {
        return Optional.ofNullable(result);
    }

    public boolean isTerminal() {
        return result != null;
    }

    // No move is legal once the game is over
    @Override
    public List<LegalMove> legalMoves() {
        return isTerminal() ? List.of() : moveState.legalMoves();
    }

    @Override
    public Optional<BackRankId> backRankId() {
        return Optional.ofNullable(backRankId);
    }

    @Override
    public CastlingRights castlingRights(Color color) {
        return position().castlingRights(color);
    }

    /**
     * Resolves a submitted move against the legal moves of the current position.
     *
     * @throws GameAlreadyTerminalException if the game is over
     * @throws IllegalMoveException if no legal move matches
     */
    public LegalMove resolve(Move move) {
        Objects.requireNonNull(move, "move");
        ensureNotTerminal();
        Optional<LegalMove> legalMove = find(move);
        if(legalMove.isPresent()) {
            return legalMove.get();
        }
        throw illegal(move, explainIllegal(move));
    }

    public LegalMove play(Move move) {
        LegalMove legalMove = resolve(move);
        apply(legalMove);
        return legalMove;
    }

    /**
     * Plays a legal move, records it and checks whether the game ended with it.
     */
    public void apply(LegalMove move) {
        Objects.requireNonNull(move, "move");
        ensureNotTerminal();
        if(!moveState.legalMoves().contains(move)) {
            throw illegal(move.toMove(), "not a legal move in this position");
        }

        Position next = position().apply(move);
        MoveState nextState = MoveGenerator.analyze(next);
        history.push(move, next);
        moveState = nextState;
        logger.debug("Move played: {} ({}), {} to move", move, next.moveId(), next.sideToMove());

        result = GameStateDetector.detect(nextState, history, config).orElse(null);
        if(result != null) {
            logger.debug("Game over after {} plies: {}", history.plyCount(), result);
        }
    }

    /**
     * Ends the game on an event the rules do not decide, like a resignation or an agreed draw.
     */
    public void terminate(GameResult gameResult) {
        Objects.requireNonNull(gameResult, "gameResult");
        ensureNotTerminal();
        result = gameResult;
        logger.debug("Game ended by the players after {} plies: {}", history.plyCount(), gameResult);
    }

    private void ensureNotTerminal() {
        if(result != null) {
            throw new GameAlreadyTerminalException(result);
        }
    }

    private String explainIllegal(Move move) {
        Material material = position().getMaterialAt(move.from().getFlatIndex());
        if(material == null) {
            return "no piece on " + move.from();
        }
        if(material.color() != sideToMove()) {
            return "it is " + sideToMove() + "'s turn";
        }
        boolean reachesSquare = legalMoves().stream()
                .anyMatch(legalMove -> legalMove.from() == move.from() && legalMove.to() == move.to());
        if(reachesSquare) {
            return move.promotion() == null ? "a promotion piece is required" : "only a pawn reaching the last rank can promote";
        }
        if(isInCheck()) {
            return "it does not get the king out of check";
        }
        return "not a legal move in this position";
    }

    private static IllegalMoveException illegal(Move move, String reason) {
        logger.debug("Rejecting move {}: {}", move, reason);
        return new IllegalMoveException(move, reason);
    }
}
