package max.chess.rules.game;

import max.chess.rules.common.Color;
import max.chess.rules.game.backrank.BackRankId;
import max.chess.rules.game.backrank.BackRanks;
import max.chess.rules.game.board.Castling;
import max.chess.rules.game.board.CastlingRights;
import max.chess.rules.game.board.Position;
import max.chess.rules.movegen.LegalMove;
import max.chess.rules.movegen.LegalMoves;
import max.chess.rules.movegen.Move;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Random;

/**
 * Authoritative board playing both sides. It only exposes what a referee needs: playing moves, reading
 * the state and ending the game on events reported by the players.
 */
public final class EngineBoard implements LegalMoves, BackRanks, Castling {
    private static final Logger logger = LoggerFactory.getLogger(EngineBoard.class);

    private final Game game;

    private EngineBoard(Game game) {
        this.game = game;
    }

    public static EngineBoard standard() {
        return chess960(BackRankId.STANDARD, RulesConfig.DEFAULT);
    }

    public static EngineBoard chess960(BackRankId backRankId) {
        return chess960(backRankId, RulesConfig.DEFAULT);
    }

    public static EngineBoard chess960(BackRankId backRankId, RulesConfig config) {
        return new EngineBoard(Game.start(backRankId, config));
    }

    public static EngineBoard shuffled(Random random) {
        return chess960(BackRankId.shuffled(random));
    }

    public static EngineBoard fromPosition(Position position) {
        return fromPosition(position, RulesConfig.DEFAULT);
    }

    public static EngineBoard fromPosition(Position position, RulesConfig config) {
        return new EngineBoard(new Game(position, null, config));
    }

    public static EngineBoard replay(BackRankId backRankId, List<Move> moves) {
        return replay(backRankId, moves, RulesConfig.DEFAULT);
    }

    /**
     * Rebuilds a game from its starting back rank and the moves played, in order.
     *
     * @throws max.chess.rules.exceptions.IllegalMoveException on the first move that is not legal
     * @throws max.chess.rules.exceptions.GameAlreadyTerminalException if moves follow the end of the game
     */
    public static EngineBoard replay(BackRankId backRankId, List<Move> moves, RulesConfig config) {
        Objects.requireNonNull(moves, "moves");
        EngineBoard board = chess960(backRankId, config);
        logger.debug("Replaying {} moves from back rank {}", moves.size(), backRankId.value());
        for(Move move : moves) {
            board.apply(move);
        }
        return board;
    }

    public LegalMove apply(Move move) {
        return game.play(move);
    }

    public void apply(LegalMove move) {
        game.apply(move);
    }

    public void resign(Color color) {
        game.terminate(GameResult.win(color.getOppositeColor(), WinReason.RESIGNATION));
    }

    public void abandon(Color color) {
        game.terminate(GameResult.win(color.getOppositeColor(), WinReason.ABANDONMENT));
    }

    // Clocks are kept by the caller, this only records the flag fall it reports
    public void timeExpired(Color color) {
        game.terminate(GameResult.win(color.getOppositeColor(), WinReason.TIME_EXPIRED));
    }

    public void agreeDraw() {
        game.terminate(GameResult.draw(DrawReason.AGREEMENT));
    }

    public Position position() {
        return game.position();
    }

    public Color sideToMove() {
        return game.sideToMove();
    }

    public boolean isInCheck() {
        return game.isInCheck();
    }

    public Optional<GameResult> result() {
        return game.result();
    }

    public boolean isTerminal() {
        return game.isTerminal();
    }

    public History history() {
        return game.history();
    }

    @Override
    public List<LegalMove> legalMoves() {
        return game.legalMoves();
    }

    @Override
    public Optional<BackRankId> backRankId() {
        return game.backRankId();
    }

    @Override
    public CastlingRights castlingRights(Color color) {
        return game.castlingRights(color);
    }
}
