package max.chess.rules.game;

import max.chess.rules.FenFixtures;
import max.chess.rules.common.Color;
import max.chess.rules.common.PieceType;
import max.chess.rules.common.Square;
import max.chess.rules.exceptions.GameAlreadyTerminalException;
import max.chess.rules.exceptions.IllegalMoveException;
import max.chess.rules.game.backrank.BackRankId;
import max.chess.rules.game.board.CastlingSide;
import max.chess.rules.game.board.Position;
import max.chess.rules.movegen.LegalMove;
import max.chess.rules.movegen.Move;
import max.chess.rules.movegen.MoveType;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class EngineBoardTest {
    private static final List<Move> FOOLS_MATE = List.of(
            Move.of("f2", "f3"), Move.of("e7", "e5"), Move.of("g2", "g4"), Move.of("d8", "h4"));

    @BeforeAll
    public static void warmUp() {
        Game.warmUp();
    }

    @Test
    public void standardBoard_shouldStartAsClassicalChess() {
        // Given
        EngineBoard board = EngineBoard.standard();

        // Then
        assertEquals(Color.WHITE, board.sideToMove());
        assertEquals(20, board.legalMoves().size());
        assertEquals(Optional.of(BackRankId.STANDARD), board.backRankId());
        assertFalse(board.isChess960());
        assertTrue(board.canCastle(Color.WHITE, CastlingSide.KING_SIDE));
        assertTrue(board.canCastle(Color.BLACK, CastlingSide.QUEEN_SIDE));
        assertEquals(FenFixtures.positionFrom(FenFixtures.STANDARD_GAME), board.position());
        assertTrue(board.result().isEmpty());
    }

    @Test
    public void chess960Board_shouldStartFromItsBackRank() {
        // Given
        EngineBoard board = EngineBoard.chess960(BackRankId.of(0));

        // Then
        assertTrue(board.isChess960());
        assertEquals(PieceType.BISHOP, board.position().materialAt(Square.of("a1")).orElseThrow().type());
        assertEquals(PieceType.KING, board.position().materialAt(Square.of("g8")).orElseThrow().type());
        assertEquals(Color.BLACK, board.position().materialAt(Square.of("g8")).orElseThrow().color());
    }

    @Test
    public void shuffledBoards_shouldBeReproducibleFromTheSeed() {
        EngineBoard first = EngineBoard.shuffled(new Random(7));
        EngineBoard second = EngineBoard.shuffled(new Random(7));

        assertEquals(first.backRankId(), second.backRankId());
        assertEquals(first.position(), second.position());
    }

    @Test
    public void doublePawnPush_shouldAlwaysSetTheEnPassantSquare() {
        // Given
        EngineBoard board = EngineBoard.standard();

        // When
        LegalMove played = board.apply(Move.of("e2", "e4"));

        // Then
        assertEquals(MoveType.DOUBLE_PAWN_PUSH, played.type());
        assertEquals(Optional.of(Square.of("e3")), board.position().enPassantSquare());
        assertEquals(Color.BLACK, board.sideToMove());

        // When
        board.apply(Move.of("g8", "f6"));

        // Then
        assertTrue(board.position().enPassantSquare().isEmpty());
    }

    @Test
    public void gameShouldDetect_drawBy3FoldRepetition() {
        // Given
        EngineBoard board = EngineBoard.standard();
        List<Move> knightDance = List.of(
                Move.of("g1", "f3"), Move.of("g8", "f6"), Move.of("f3", "g1"), Move.of("f6", "g8"));

        // When
        knightDance.forEach(board::apply);
        knightDance.subList(0, 3).forEach(board::apply);

        // Then
        assertFalse(board.isTerminal(), "Start position only seen twice so far");

        // When
        board.apply(knightDance.get(3));

        // Then
        assertEquals(Optional.of(GameResult.draw(DrawReason.THREEFOLD_REPETITION)), board.result());
        assertTrue(board.legalMoves().isEmpty());
    }

    @Test
    public void repetitionLimit_shouldBeConfigurable() {
        // Given
        RulesConfig config = new RulesConfig.Builder().repetitionLimit(2).build();
        EngineBoard board = EngineBoard.chess960(BackRankId.STANDARD, config);

        // When
        board.apply(Move.of("g1", "f3"));
        board.apply(Move.of("g8", "f6"));
        board.apply(Move.of("f3", "g1"));
        board.apply(Move.of("f6", "g8"));

        // Then
        assertEquals(Optional.of(GameResult.draw(DrawReason.THREEFOLD_REPETITION)), board.result());
    }

    @Test
    public void gameShouldDetect_drawByFiftyMoveRule() {
        // Given
        EngineBoard board = EngineBoard.fromPosition(FenFixtures.positionFrom("4k3/8/8/8/8/8/8/R3K3 w - - 99 80"));

        // When
        board.apply(Move.of("a1", "a2"));

        // Then
        assertEquals(100, board.position().halfMoveClock());
        assertEquals(Optional.of(GameResult.draw(DrawReason.FIFTY_MOVE_RULE)), board.result());
    }

    @Test
    public void pawnMove_shouldResetTheFiftyMoveClock() {
        // Given
        EngineBoard board = EngineBoard.fromPosition(FenFixtures.positionFrom("4k3/8/8/8/8/8/4P3/R3K3 w - - 98 80"));

        // When
        board.apply(Move.of("e2", "e3"));
        board.apply(Move.of("e8", "d8"));
        board.apply(Move.of("a1", "a2"));

        // Then
        assertEquals(2, board.position().halfMoveClock());
        assertFalse(board.isTerminal());
    }

    @Test
    public void gameShouldDetect_drawByInsufficientMaterial() {
        // Given
        EngineBoard board = EngineBoard.fromPosition(FenFixtures.positionFrom("4k3/8/8/8/8/8/3r4/4K3 w - - 0 1"));

        // When
        board.apply(Move.of("e1", "d2"));

        // Then
        assertEquals(Optional.of(GameResult.draw(DrawReason.INSUFFICIENT_MATERIAL)), board.result());
    }

    @Test
    public void insufficientMaterial_canBeLeftToThePlayers() {
        // Given
        RulesConfig config = new RulesConfig.Builder().detectInsufficientMaterial(false).build();
        EngineBoard board = EngineBoard.fromPosition(FenFixtures.positionFrom("4k3/8/8/8/8/8/3r4/4K3 w - - 0 1"), config);

        // When
        board.apply(Move.of("e1", "d2"));

        // Then
        assertFalse(board.isTerminal());
    }

    @Test
    public void gameShouldDetect_stalemate() {
        // Given
        EngineBoard board = EngineBoard.fromPosition(FenFixtures.positionFrom("7k/4Q3/6K1/8/8/8/8/8 w - - 0 1"));

        // When
        board.apply(Move.of("e7", "f7"));

        // Then
        assertFalse(board.isInCheck());
        assertEquals(Optional.of(GameResult.draw(DrawReason.STALEMATE)), board.result());
    }

    @Test
    public void gameShouldDetect_checkmate() {
        // Given
        EngineBoard board = EngineBoard.standard();

        // When
        FOOLS_MATE.forEach(board::apply);

        // Then
        assertTrue(board.isInCheck());
        assertEquals(Optional.of(GameResult.win(Color.BLACK, WinReason.CHECKMATE)), board.result());
        assertEquals(Color.WHITE, board.result().orElseThrow().loser());
    }

    @Test
    public void finishedPosition_shouldBeTerminalFromTheStart() {
        EngineBoard board = EngineBoard.fromPosition(FenFixtures.positionFrom("7k/6Q1/6K1/8/8/8/8/8 b - - 0 1"));

        assertEquals(Optional.of(GameResult.win(Color.WHITE, WinReason.CHECKMATE)), board.result());
        assertTrue(board.backRankId().isEmpty());
    }

    @Test
    public void illegalMove_shouldLeaveTheBoardUnchanged() {
        // Given
        EngineBoard board = EngineBoard.standard();
        board.apply(Move.of("e2", "e4"));
        Position before = board.position();

        // When
        IllegalMoveException exception = assertThrows(IllegalMoveException.class, () -> board.apply(Move.of("e7", "e4")));

        // Then
        assertEquals(Move.of("e7", "e4"), exception.getMove());
        assertEquals(before, board.position());
        assertEquals(1, board.history().plyCount());
        assertEquals(Color.BLACK, board.sideToMove());
    }

    @Test
    public void movingTheOpponentsPiece_shouldBeRejected() {
        EngineBoard board = EngineBoard.standard();

        assertThrows(IllegalMoveException.class, () -> board.apply(Move.of("e7", "e5")));
        assertThrows(IllegalMoveException.class, () -> board.apply(Move.of("e3", "e4")));
    }

    @Test
    public void pawnReachingTheLastRank_shouldRequireAPromotionPiece() {
        // Given
        EngineBoard board = EngineBoard.fromPosition(FenFixtures.positionFrom("4k3/P7/8/8/8/8/8/4K3 w - - 0 1"));

        // Then
        assertThrows(IllegalMoveException.class, () -> board.apply(Move.of("a7", "a8")));

        // When
        LegalMove played = board.apply(Move.of("a7", "a8", PieceType.KNIGHT));

        // Then
        assertEquals(PieceType.KNIGHT, played.promotion());
        assertEquals(PieceType.KNIGHT, board.position().materialAt(Square.of("a8")).orElseThrow().type());
    }

    @Test
    public void promotionPiece_shouldBeRejectedOnOrdinaryMoves() {
        EngineBoard board = EngineBoard.standard();

        assertThrows(IllegalMoveException.class, () -> board.apply(Move.of("e2", "e4", PieceType.QUEEN)));
        assertEquals(0, board.history().plyCount());
    }

    @Test
    public void legalMoveFromAnotherPosition_shouldBeRejected() {
        // Given
        EngineBoard board = EngineBoard.standard();
        LegalMove e4 = board.apply(Move.of("e2", "e4"));

        // Then
        assertThrows(IllegalMoveException.class, () -> board.apply(e4));
    }

    @Test
    public void finishedGame_shouldRejectEveryChange() {
        // Given
        EngineBoard board = EngineBoard.replay(BackRankId.STANDARD, FOOLS_MATE);

        // Then
        GameAlreadyTerminalException exception = assertThrows(GameAlreadyTerminalException.class,
                () -> board.apply(Move.of("e2", "e4")));
        assertEquals(WinReason.CHECKMATE, exception.getResult().winReason());
        assertThrows(GameAlreadyTerminalException.class, () -> board.resign(Color.WHITE));
        assertThrows(GameAlreadyTerminalException.class, board::agreeDraw);
    }

    @Test
    public void replay_shouldMatchMovesPlayedOneByOne() {
        // Given
        List<Move> moves = List.of(
                Move.of("e2", "e4"), Move.of("c7", "c5"), Move.of("g1", "f3"), Move.of("d7", "d6"),
                Move.of("f1", "b5"), Move.of("c8", "d7"), Move.of("e1", "g1"));
        EngineBoard played = EngineBoard.standard();
        moves.forEach(played::apply);

        // When
        EngineBoard replayed = EngineBoard.replay(BackRankId.STANDARD, moves);

        // Then
        assertEquals(played.position(), replayed.position());
        assertEquals(played.history().moves(), replayed.history().moves());
        assertTrue(replayed.history().moveTo(7).isCastle());
        assertFalse(replayed.castlingRights(Color.WHITE).hasAny());
        assertTrue(replayed.canCastle(Color.BLACK, CastlingSide.KING_SIDE));
    }

    @Test
    public void replayOfAFinishedGame_shouldReachTheSameResult() {
        // Given
        EngineBoard played = EngineBoard.standard();
        FOOLS_MATE.forEach(played::apply);

        // When
        EngineBoard replayed = EngineBoard.replay(BackRankId.STANDARD, FOOLS_MATE);

        // Then
        assertEquals(played.position(), replayed.position());
        assertEquals(played.result(), replayed.result());
        assertEquals(Optional.of(GameResult.win(Color.BLACK, WinReason.CHECKMATE)), replayed.result());
    }

    @Test
    public void replay_shouldFailOnTheFirstIllegalMove() {
        List<Move> moves = List.of(Move.of("e2", "e4"), Move.of("e7", "e5"), Move.of("e4", "e5"));

        assertThrows(IllegalMoveException.class, () -> EngineBoard.replay(BackRankId.STANDARD, moves));
    }

    @Test
    public void resignation_shouldAwardTheGameToTheOpponent() {
        // Given
        EngineBoard board = EngineBoard.standard();

        // When
        board.resign(Color.WHITE);

        // Then
        assertEquals(Optional.of(GameResult.win(Color.BLACK, WinReason.RESIGNATION)), board.result());
        assertTrue(board.legalMoves().isEmpty());
    }

    @Test
    public void flagFallAndAbandonment_shouldBeRecorded() {
        EngineBoard timeout = EngineBoard.standard();
        timeout.timeExpired(Color.BLACK);
        assertEquals(Optional.of(GameResult.win(Color.WHITE, WinReason.TIME_EXPIRED)), timeout.result());

        EngineBoard abandoned = EngineBoard.standard();
        abandoned.abandon(Color.WHITE);
        assertEquals(Optional.of(GameResult.win(Color.BLACK, WinReason.ABANDONMENT)), abandoned.result());
    }

    @Test
    public void agreedDraw_shouldEndTheGame() {
        // Given
        EngineBoard board = EngineBoard.standard();

        // When
        board.agreeDraw();

        // Then
        assertEquals(Optional.of(GameResult.draw(DrawReason.AGREEMENT)), board.result());
        assertTrue(board.result().orElseThrow().isDraw());
    }
}
