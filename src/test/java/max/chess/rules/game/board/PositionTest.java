package max.chess.rules.game.board;

import max.chess.rules.FenFixtures;
import max.chess.rules.common.Color;
import max.chess.rules.common.Material;
import max.chess.rules.common.PieceType;
import max.chess.rules.common.Square;
import max.chess.rules.exceptions.IllegalMoveException;
import max.chess.rules.exceptions.InvalidPositionException;
import max.chess.rules.movegen.LegalMove;
import max.chess.rules.movegen.Move;
import max.chess.rules.movegen.MoveGenerator;
import max.chess.rules.movegen.MoveType;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class PositionTest {

    private static Position play(Position position, String from, String to) {
        LegalMove move = MoveGenerator.analyze(position).find(Move.of(from, to)).orElseThrow();
        return position.apply(move);
    }

    @Test
    public void apply_shouldReturnANewPositionAndKeepTheOldOne() {
        // Given
        Position start = Position.standard();

        // When
        Position next = play(start, "e2", "e4");

        // Then
        assertTrue(start.materialAt(Square.of("e2")).isPresent());
        assertTrue(start.materialAt(Square.of("e4")).isEmpty());
        assertEquals(Material.white(PieceType.PAWN), next.materialAt(Square.of("e4")).orElseThrow());
        assertEquals(Color.WHITE, start.sideToMove());
        assertEquals(Color.BLACK, next.sideToMove());
        assertEquals(1, next.fullMoveNumber());
        assertEquals(2, play(next, "e7", "e5").fullMoveNumber());
    }

    @Test
    public void halfMoveClock_shouldCountQuietPliesOnly() {
        // Given
        Position position = FenFixtures.positionFrom("4k3/8/8/3p4/8/8/8/R3K2R w - - 5 30");

        // When
        Position quiet = play(position, "a1", "a5");
        Position capture = play(quiet, "e8", "d7");
        Position afterCapture = play(capture, "a5", "d5");

        // Then
        assertEquals(6, quiet.halfMoveClock());
        assertEquals(7, capture.halfMoveClock());
        assertEquals(0, afterCapture.halfMoveClock());
    }

    @Test
    public void enPassantCapture_shouldRemoveThePassedPawn() {
        // Given
        Position position = FenFixtures.positionFrom("4k3/8/8/3pP3/8/8/8/4K3 w - d6 0 2");

        // When
        Position next = play(position, "e5", "d6");

        // Then
        assertTrue(next.materialAt(Square.of("d5")).isEmpty());
        assertEquals(Material.white(PieceType.PAWN), next.materialAt(Square.of("d6")).orElseThrow());
        assertTrue(next.enPassantSquare().isEmpty());
    }

    @Test
    public void kingAndRookMoves_shouldRevokeCastlingRights() {
        // Given
        Position position = FenFixtures.positionFrom("r3k2r/8/8/8/8/8/8/R3K2R w KQkq - 0 1");

        // When
        Position rookMoved = play(position, "h1", "h2");
        Position kingMoved = play(rookMoved, "e8", "d8");

        // Then
        assertFalse(rookMoved.canCastle(Color.WHITE, CastlingSide.KING_SIDE));
        assertTrue(rookMoved.canCastle(Color.WHITE, CastlingSide.QUEEN_SIDE));
        assertEquals(CastlingRights.NONE, kingMoved.castlingRights(Color.BLACK));
        assertTrue(kingMoved.castlingRights(Color.WHITE).isSubsetOf(position.castlingRights(Color.WHITE)));
    }

    @Test
    public void capturedRook_shouldLoseItsCastlingRight() {
        // Given
        Position position = FenFixtures.positionFrom("r3k2r/8/8/8/8/8/8/R3K2R w KQkq - 0 1");

        // When
        Position next = play(position, "a1", "a8");

        // Then
        assertFalse(next.canCastle(Color.BLACK, CastlingSide.QUEEN_SIDE));
        assertTrue(next.canCastle(Color.BLACK, CastlingSide.KING_SIDE));
        assertFalse(next.canCastle(Color.WHITE, CastlingSide.QUEEN_SIDE));
    }

    @Test
    public void castling_shouldMoveKingAndRook() {
        // Given
        Position position = FenFixtures.positionFrom("r3k2r/8/8/8/8/8/8/R3K2R b KQkq - 0 1");

        // When
        Position next = play(position, "e8", "c8");

        // Then
        assertEquals(Material.black(PieceType.KING), next.materialAt(Square.of("c8")).orElseThrow());
        assertEquals(Material.black(PieceType.ROOK), next.materialAt(Square.of("d8")).orElseThrow());
        assertTrue(next.materialAt(Square.of("a8")).isEmpty());
        assertEquals(Square.of("c8").getFlatIndex(), next.kingIndex(Color.BLACK));
        assertFalse(next.castlingRights(Color.BLACK).hasAny());
    }

    @Test
    public void moveFromAnotherPosition_shouldBeRejected() {
        // Given
        Position start = Position.standard();
        LegalMove e4 = MoveGenerator.analyze(start).find(Move.of("e2", "e4")).orElseThrow();
        Position afterE4 = start.apply(e4);

        // Then
        assertThrows(IllegalMoveException.class, () -> afterE4.apply(e4));
        LegalMove fromEmptySquare = new LegalMove(Square.of("e3"), Square.of("e4"), null, MoveType.NORMAL, null);
        assertThrows(IllegalMoveException.class, () -> start.apply(fromEmptySquare));
    }

    @Test
    public void sameArrangement_shouldShareAKeyWhateverTheClocks() {
        Position early = FenFixtures.positionFrom("4k3/8/8/8/8/8/8/R3K3 w - - 0 1");
        Position late = FenFixtures.positionFrom("4k3/8/8/8/8/8/8/R3K3 w - - 12 40");
        Position otherSide = FenFixtures.positionFrom("4k3/8/8/8/8/8/8/R3K3 b - - 0 1");

        assertEquals(early.key(), late.key());
        assertNotEquals(early, late);
        assertNotEquals(early.key(), otherSide.key());
    }

    @Test
    public void moveId_shouldGiveTheSideToMove() {
        assertEquals(Color.WHITE, MoveId.INITIAL.turn());
        assertEquals(Color.BLACK, MoveId.INITIAL.next().turn());
        assertEquals(new MoveId(79), MoveId.of(40, Color.BLACK));
        assertEquals(40, MoveId.of(40, Color.BLACK).moveNumber());
        assertThrows(IllegalArgumentException.class, () -> MoveId.of(0, Color.WHITE));
    }

    @Test
    public void builder_shouldBuildAValidPosition() {
        // When
        Position position = new PositionBuilder()
                .place("e1", Material.white(PieceType.KING))
                .place("h1", Material.white(PieceType.ROOK))
                .place("e8", Material.black(PieceType.KING))
                .castlingRights(Color.WHITE, CastlingRights.of(4, 7, CastlingRights.NO_FILE))
                .sideToMove(Color.BLACK)
                .fullMoveNumber(12)
                .build();

        // Then
        assertEquals(Color.BLACK, position.sideToMove());
        assertEquals(12, position.fullMoveNumber());
        assertTrue(position.canCastle(Color.WHITE, CastlingSide.KING_SIDE));
        assertFalse(position.canCastle(Color.WHITE, CastlingSide.QUEEN_SIDE));
        assertEquals(Optional.empty(), position.enPassantSquare());
    }

    @Test
    public void builder_shouldRejectMissingOrExtraKings() {
        PositionBuilder noBlackKing = new PositionBuilder().place("e1", Material.white(PieceType.KING));
        PositionBuilder twoWhiteKings = new PositionBuilder()
                .place("e1", Material.white(PieceType.KING))
                .place("a1", Material.white(PieceType.KING))
                .place("e8", Material.black(PieceType.KING));

        assertThrows(InvalidPositionException.class, noBlackKing::build);
        assertThrows(InvalidPositionException.class, twoWhiteKings::build);
    }

    @Test
    public void builder_shouldRejectPawnsOnBackRanks() {
        PositionBuilder builder = kings().place("c8", Material.white(PieceType.PAWN));

        assertThrows(InvalidPositionException.class, builder::build);
    }

    @Test
    public void builder_shouldRejectCastlingRightsWithoutRook() {
        PositionBuilder builder = kings().castlingRights(Color.WHITE, CastlingRights.of(4, 7, CastlingRights.NO_FILE));

        assertThrows(InvalidPositionException.class, builder::build);
    }

    @Test
    public void builder_shouldRejectInconsistentEnPassant() {
        PositionBuilder noPawn = kings().sideToMove(Color.BLACK).enPassantSquare(Square.of("d3"));
        PositionBuilder wrongRank = kings()
                .place("d4", Material.white(PieceType.PAWN))
                .sideToMove(Color.BLACK)
                .enPassantSquare(Square.of("d5"));

        assertThrows(InvalidPositionException.class, noPawn::build);
        assertThrows(InvalidPositionException.class, wrongRank::build);

        Position valid = kings()
                .place("d4", Material.white(PieceType.PAWN))
                .sideToMove(Color.BLACK)
                .enPassantSquare(Square.of("d3"))
                .build();
        assertEquals(Optional.of(Square.of("d3")), valid.enPassantSquare());
    }

    @Test
    public void builder_shouldRejectTheSideNotToMoveInCheck() {
        PositionBuilder builder = kings().place("e4", Material.white(PieceType.ROOK)).sideToMove(Color.WHITE);

        assertThrows(InvalidPositionException.class, builder::build);
    }

    @Test
    public void builder_shouldRejectNegativeClocks() {
        assertThrows(InvalidPositionException.class, () -> kings().halfMoveClock(-1).build());
        assertThrows(InvalidPositionException.class, () -> kings().fullMoveNumber(0).build());
    }

    private static PositionBuilder kings() {
        return new PositionBuilder()
                .place("e1", Material.white(PieceType.KING))
                .place("e8", Material.black(PieceType.KING));
    }
}
