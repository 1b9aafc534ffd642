package max.chess.rules.game;

import max.chess.rules.common.Color;
import max.chess.rules.common.Square;
import max.chess.rules.exceptions.GameAlreadyTerminalException;
import max.chess.rules.exceptions.IllegalMoveException;
import max.chess.rules.exceptions.NoPendingPreMoveException;
import max.chess.rules.game.backrank.BackRankId;
import max.chess.rules.game.backrank.BackRanks;
import max.chess.rules.game.board.Castling;
import max.chess.rules.game.board.CastlingRights;
import max.chess.rules.game.board.Position;
import max.chess.rules.movegen.LegalMove;
import max.chess.rules.movegen.LegalMoves;
import max.chess.rules.movegen.Move;
import max.chess.rules.movegen.PreMove;
import max.chess.rules.movegen.PreMoveGenerator;
import max.chess.rules.review.Review;
import max.chess.rules.review.ReviewNavigator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Client side board playing one color. While the opponent thinks, a single pre-move can be queued; it is
 * played as soon as the opponent's move arrives if it is still legal by then, and dropped otherwise.
 */
public final class PlayerBoard implements LegalMoves, BackRanks, Castling {
    private static final Logger logger = LoggerFactory.getLogger(PlayerBoard.class);

    private final Game game;
    private final Color playerColor;
    private final ReviewNavigator navigator;
    private PreMove preMove;
    private Position preview;

    private PlayerBoard(Game game, Color playerColor) {
        this.game = game;
        this.playerColor = Objects.requireNonNull(playerColor, "playerColor");
        this.navigator = new ReviewNavigator(game.history());
    }

    public static PlayerBoard standard(Color playerColor) {
        return chess960(BackRankId.STANDARD, playerColor, RulesConfig.DEFAULT);
    }

    public static PlayerBoard chess960(BackRankId backRankId, Color playerColor) {
        return chess960(backRankId, playerColor, RulesConfig.DEFAULT);
    }

    public static PlayerBoard chess960(BackRankId backRankId, Color playerColor, RulesConfig config) {
        return new PlayerBoard(Game.start(backRankId, config), playerColor);
    }

    public static PlayerBoard fromPosition(Position position, Color playerColor) {
        return new PlayerBoard(new Game(position, null, RulesConfig.DEFAULT), playerColor);
    }

    public static PlayerBoard replay(BackRankId backRankId, Color playerColor, List<Move> moves) {
        return replay(backRankId, playerColor, moves, RulesConfig.DEFAULT);
    }

    /**
     * Rebuilds the board from the moves of both sides. The pre-move queue is always empty afterwards.
     */
    public static PlayerBoard replay(BackRankId backRankId, Color playerColor, List<Move> moves, RulesConfig config) {
        Objects.requireNonNull(moves, "moves");
        PlayerBoard board = chess960(backRankId, playerColor, config);
        logger.debug("Replaying {} moves as {} from back rank {}", moves.size(), playerColor, backRankId.value());
        for(Move move : moves) {
            board.game.play(move);
        }
        return board;
    }

    public Color playerColor() {
        return playerColor;
    }

    public boolean isOurTurn() {
        return game.sideToMove() == playerColor;
    }

    /**
     * Plays our move if it is our turn, otherwise queues it as a pre-move, replacing any queued one.
     *
     * @return the move played, or empty if it was queued
     * @throws IllegalMoveException if the move is illegal now or cannot be a pre-move
     */
    public Optional<LegalMove> submitOurMove(Move move) {
        Objects.requireNonNull(move, "move");
        ensureNotTerminal();
        if(isOurTurn()) {
            LegalMove played = game.play(move);
            // A pre-move left waiting for confirmation is stale once we moved
            cancelPreMove();
            return Optional.of(played);
        }

        Position position = game.position();
        PreMoveGenerator.validate(position, move, playerColor);
        preMove = new PreMove(move, position.moveId());
        preview = position.preview(move, playerColor);
        logger.debug("Pre-move queued: {} at {}", move, position.moveId());
        return Optional.empty();
    }

    /**
     * Plays the opponent's confirmed move, then the queued pre-move if it is still legal.
     *
     * @return the pre-move that was played, or empty if there was none or it was dropped
     * @throws IllegalMoveException if the opponent's move is illegal, the board and queue are then unchanged
     */
    public Optional<LegalMove> submitTheirMove(Move move) {
        Objects.requireNonNull(move, "move");
        ensureNotTerminal();
        if(isOurTurn()) {
            throw new IllegalMoveException(move, "it is " + playerColor + "'s turn");
        }
        game.play(move);

        PreMove pending = preMove;
        preview = null;
        if(pending == null) {
            return Optional.empty();
        }
        if(game.isTerminal()) {
            preMove = null;
            logger.debug("Pre-move {} dropped, the game is over", pending.move());
            return Optional.empty();
        }
        if(!game.config().autoApplyPreMoves) {
            // Kept until the caller confirms or cancels it
            preview = game.position().preview(pending.move(), playerColor);
            return Optional.empty();
        }
        return playPreMove(pending);
    }

    /**
     * Plays the queued pre-move now, for boards configured without automatic pre-moves.
     *
     * @throws NoPendingPreMoveException if no pre-move is queued or the opponent has not replied yet
     * @throws IllegalMoveException if the pre-move is not legal any more, the queue is then emptied
     */
    public LegalMove confirmPreMove() {
        ensureNotTerminal();
        if(preMove == null) {
            throw new NoPendingPreMoveException("No pre-move waiting for confirmation");
        }
        if(!isOurTurn()) {
            throw new NoPendingPreMoveException("Pre-move " + preMove.move() + " waits for the opponent's reply");
        }
        PreMove pending = preMove;
        return playPreMove(pending).orElseThrow(() -> new IllegalMoveException(pending.move(), "pre-move is not legal any more"));
    }

    public void cancelPreMove() {
        if(preMove != null) {
            logger.debug("Pre-move cancelled: {}", preMove.move());
        }
        preMove = null;
        preview = null;
    }

    public Optional<PreMove> pendingPreMove() {
        return Optional.ofNullable(preMove);
    }

    private Optional<LegalMove> playPreMove(PreMove pending) {
        preMove = null;
        preview = null;
        Optional<LegalMove> legalMove = game.find(pending.move());
        if(legalMove.isEmpty()) {
            logger.debug("Pre-move {} dropped, not legal after the opponent's reply", pending.move());
            return Optional.empty();
        }
        game.apply(legalMove.get());
        logger.debug("Pre-move played: {}", legalMove.get());
        return legalMove;
    }

    /**
     * Position to show: the reviewed one while reviewing, else the pre-move preview if any, else the
     * current position.
     */
    public Position view() {
        if(!navigator.atEnd()) {
            return navigator.current();
        }
        return preview != null ? preview : game.position();
    }

    public Position position() {
        return game.position();
    }

    public Review review() {
        return navigator;
    }

    public Optional<GameResult> result() {
        return game.result();
    }

    public boolean isTerminal() {
        return game.isTerminal();
    }

    public boolean isInCheck() {
        return game.isInCheck();
    }

    public History history() {
        return game.history();
    }

    // Legal moves of the side to move, which is the opponent while we wait
    @Override
    public List<LegalMove> legalMoves() {
        return game.legalMoves();
    }

    // Pre-move destinations while the opponent is to move
    @Override
    public long moveDestinations(Square from) {
        if(isTerminal()) {
            return 0L;
        }
        if(isOurTurn()) {
            return game.moveDestinations(from);
        }
        return PreMoveGenerator.getDestinationsBB(game.position(), from, playerColor);
    }

    @Override
    public Optional<BackRankId> backRankId() {
        return game.backRankId();
    }

    @Override
    public CastlingRights castlingRights(Color color) {
        return game.castlingRights(color);
    }

    private void ensureNotTerminal() {
        game.result().ifPresent(result -> {
            throw new GameAlreadyTerminalException(result);
        });
    }
}
