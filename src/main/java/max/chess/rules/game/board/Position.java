package max.chess.rules.game.board;

import max.chess.rules.common.Color;
import max.chess.rules.common.ColorPair;
import max.chess.rules.common.Material;
import max.chess.rules.common.PieceType;
import max.chess.rules.common.Square;
import max.chess.rules.exceptions.IllegalMoveException;
import max.chess.rules.game.backrank.BackRank;
import max.chess.rules.game.backrank.BackRankId;
import max.chess.rules.movegen.LegalMove;
import max.chess.rules.movegen.Move;
import max.chess.rules.movegen.MoveType;
import max.chess.rules.utils.BitUtils;

import java.util.Objects;
import java.util.Optional;

/**
 * Immutable chess position. Moves are applied on a private copy which is returned as a new position,
 * so a position handed out is never changed afterwards.
 */
public final class Position implements Castling {
    public static final int NO_EN_PASSANT = -1;

    // One bitboard per piece type and per color, they are kept in sync with pieceAt
    private final long[] pieceBB;
    private final long[] colorBB;
    private final Material[] pieceAt;

    private ColorPair<CastlingRights> castlingRights;
    private int enPassantIndex;
    private int halfMoveClock;
    private MoveId moveId;

    public static Position initial(BackRankId backRankId) {
        Objects.requireNonNull(backRankId, "backRankId");
        BackRank backRank = backRankId.backRank();
        Position position = new Position();
        for(int file = 0; file < 8; file++) {
            position.add(file, Material.white(backRank.pieceAt(file)));
            position.add(8 + file, Material.white(PieceType.PAWN));
            position.add(48 + file, Material.black(PieceType.PAWN));
            position.add(56 + file, Material.black(backRank.pieceAt(file)));
        }
        CastlingRights rights = CastlingRights.of(backRank.kingFile(), backRank.kingSideRookFile(), backRank.queenSideRookFile());
        position.castlingRights = ColorPair.both(rights);
        return position;
    }

    public static Position standard() {
        return initial(BackRankId.STANDARD);
    }

    private Position() {
        pieceBB = new long[PieceType.VALUES.length];
        colorBB = new long[Color.VALUES.length];
        pieceAt = new Material[64];
        castlingRights = ColorPair.both(CastlingRights.NONE);
        enPassantIndex = NO_EN_PASSANT;
        halfMoveClock = 0;
        moveId = MoveId.INITIAL;
    }

    private Position(Position other) {
        pieceBB = other.pieceBB.clone();
        colorBB = other.colorBB.clone();
        pieceAt = other.pieceAt.clone();
        castlingRights = other.castlingRights;
        enPassantIndex = other.enPassantIndex;
        halfMoveClock = other.halfMoveClock;
        moveId = other.moveId;
    }

    // Used by the builder, which validates the result
    static Position of(Material[] placement, ColorPair<CastlingRights> castlingRights, int enPassantIndex,
                       int halfMoveClock, MoveId moveId) {
        Position position = new Position();
        for(int i = 0; i < 64; i++) {
            if(placement[i] != null) {
                position.add(i, placement[i]);
            }
        }
        position.castlingRights = castlingRights;
        position.enPassantIndex = enPassantIndex;
        position.halfMoveClock = halfMoveClock;
        position.moveId = moveId;
        return position;
    }

    /**
     * Plays a move that was generated for this position. Full legality is not checked again here, only that
     * the side to move has a piece on the start square.
     *
     * @throws IllegalMoveException if the start square holds no piece of the side to move
     */
    public Position apply(LegalMove move) {
        Color us = sideToMove();
        Color them = us.getOppositeColor();
        int from = move.from().getFlatIndex();
        int to = move.to().getFlatIndex();
        Material moving = pieceAt[from];
        if(moving == null || moving.color() != us) {
            throw new IllegalMoveException(move.toMove(), "no " + us + " piece on " + move.from());
        }
        Position next = new Position(this);
        boolean irreversible = moving.type() == PieceType.PAWN;

        switch (move.type()) {
            case CASTLE_KING_SIDE, CASTLE_QUEEN_SIDE -> next.castle(us, from, move.castlingRook().getFlatIndex(), move.castlingSide());
            case EN_PASSANT -> {
                next.remove(to - us.pawnPushOffset());
                next.remove(from);
                next.add(to, moving);
            }
            default -> {
                if(pieceAt[to] != null) {
                    next.remove(to);
                    irreversible = true;
                }
                next.remove(from);
                next.add(to, move.promotion() != null ? Material.of(move.promotion(), us) : moving);
            }
        }

        if(moving.type() == PieceType.KING) {
            next.castlingRights = next.castlingRights.with(us, CastlingRights.NONE);
        }
        next.revokeCastlingRightsOn(us, from);
        next.revokeCastlingRightsOn(them, to);

        next.enPassantIndex = move.type() == MoveType.DOUBLE_PAWN_PUSH ? from + us.pawnPushOffset() : NO_EN_PASSANT;
        next.halfMoveClock = irreversible ? 0 : halfMoveClock + 1;
        next.moveId = moveId.next();
        return next;
    }

    /**
     * Draws a pre-move on the board without handing the turn over, for display while the opponent thinks.
     * The move is only checked for having one of our pieces on its start square.
     */
    public Position preview(Move move, Color mover) {
        int from = move.from().getFlatIndex();
        int to = move.to().getFlatIndex();
        Material moving = pieceAt[from];
        if(moving == null || moving.color() != mover) {
            return this;
        }

        Position next = new Position(this);
        if(moving.type() == PieceType.KING) {
            CastlingRights rights = castlingRights.get(mover);
            for(CastlingSide side : CastlingSide.VALUES) {
                if(rights.has(side)) {
                    int rank = mover.backRank();
                    int rookSquare = rank * 8 + rights.rookFile(side);
                    int kingDestination = rank * 8 + side.kingDestinationFile;
                    if(to == rookSquare || (to == kingDestination && !isKingStep(from, to))) {
                        next.castle(mover, from, rookSquare, side);
                        return next;
                    }
                }
            }
            next.castlingRights = next.castlingRights.with(mover, CastlingRights.NONE);
        }

        if(pieceAt[to] != null) {
            next.remove(to);
        }
        next.remove(from);
        next.add(to, move.promotion() != null ? Material.of(move.promotion(), mover) : moving);
        next.revokeCastlingRightsOn(mover, from);
        next.revokeCastlingRightsOn(mover.getOppositeColor(), to);
        return next;
    }

    private static boolean isKingStep(int from, int to) {
        return Math.abs(from % 8 - to % 8) <= 1 && Math.abs(from / 8 - to / 8) <= 1;
    }

    private void castle(Color us, int kingFrom, int rookFrom, CastlingSide side) {
        int rank = us.backRank();
        Material king = pieceAt[kingFrom];
        Material rook = pieceAt[rookFrom];
        // Both leave first, Chess960 king and rook may land on each other's squares
        remove(kingFrom);
        remove(rookFrom);
        add(rank * 8 + side.kingDestinationFile, king);
        add(rank * 8 + side.rookDestinationFile, rook);
        castlingRights = castlingRights.with(us, CastlingRights.NONE);
    }

    private void revokeCastlingRightsOn(Color color, int positionIndex) {
        if(positionIndex / 8 == color.backRank()) {
            CastlingRights rights = castlingRights.get(color);
            CastlingRights revoked = rights.revokeOn(positionIndex % 8);
            if(!revoked.equals(rights)) {
                castlingRights = castlingRights.with(color, revoked);
            }
        }
    }

    private void add(int positionIndex, Material material) {
        long bit = BitUtils.getPositionIndexBitMask(positionIndex);
        pieceBB[material.type().ordinal()] |= bit;
        colorBB[material.color().ordinal()] |= bit;
        pieceAt[positionIndex] = material;
    }

    private void remove(int positionIndex) {
        Material material = pieceAt[positionIndex];
        if(material == null) {
            return;
        }
        long bit = BitUtils.getPositionIndexBitMask(positionIndex);
        pieceBB[material.type().ordinal()] &= ~bit;
        colorBB[material.color().ordinal()] &= ~bit;
        pieceAt[positionIndex] = null;
    }

    public Color sideToMove() {
        return moveId.turn();
    }

    public MoveId moveId() {
        return moveId;
    }

    public int fullMoveNumber() {
        return moveId.moveNumber();
    }

    public int halfMoveClock() {
        return halfMoveClock;
    }

    public int enPassantIndex() {
        return enPassantIndex;
    }

    public Optional<Square> enPassantSquare() {
        return enPassantIndex == NO_EN_PASSANT ? Optional.empty() : Optional.of(Square.of(enPassantIndex));
    }

    public Material getMaterialAt(int positionIndex) {
        return pieceAt[positionIndex];
    }

    public Optional<Material> materialAt(Square square) {
        return Optional.ofNullable(pieceAt[square.getFlatIndex()]);
    }

    public long pieceBB(PieceType pieceType) {
        return pieceBB[pieceType.ordinal()];
    }

    public long pieceBB(PieceType pieceType, Color color) {
        return pieceBB[pieceType.ordinal()] & colorBB[color.ordinal()];
    }

    public long colorBB(Color color) {
        return colorBB[color.ordinal()];
    }

    public long occupiedBB() {
        return colorBB[0] | colorBB[1];
    }

    public int kingIndex(Color color) {
        return BitUtils.bitScanForward(pieceBB(PieceType.KING, color));
    }

    @Override
    public CastlingRights castlingRights(Color color) {
        return castlingRights.get(color);
    }

    public ColorPair<CastlingRights> castlingRights() {
        return castlingRights;
    }

    public PositionKey key() {
        return new PositionKey(colorBB[Color.WHITE.ordinal()], colorBB[Color.BLACK.ordinal()],
                pieceBB[PieceType.PAWN.ordinal()], pieceBB[PieceType.KNIGHT.ordinal()],
                pieceBB[PieceType.BISHOP.ordinal()], pieceBB[PieceType.ROOK.ordinal()],
                pieceBB[PieceType.QUEEN.ordinal()], pieceBB[PieceType.KING.ordinal()],
                sideToMove(), castlingRights.white(), castlingRights.black(), enPassantIndex);
    }

    @Override
    public boolean equals(Object obj) {
        if(this == obj) {
            return true;
        }
        if(!(obj instanceof Position other)) {
            return false;
        }
        return halfMoveClock == other.halfMoveClock && moveId.equals(other.moveId) && key().equals(other.key());
    }

    @Override
    public int hashCode() {
        return Objects.hash(key(), halfMoveClock, moveId);
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder();
        for(int y = 7; y >= 0; y--) {
            for(int x = 0; x < 8; x++) {
                Material material = pieceAt[x + 8 * y];
                builder.append(material == null ? '.' : letterOf(material));
            }
            builder.append('\n');
        }
        builder.append(sideToMove()).append(" to move, move ").append(fullMoveNumber())
                .append(", half move clock ").append(halfMoveClock);
        return builder.toString();
    }

    private static char letterOf(Material material) {
        char letter = switch (material.type()) {
            case PAWN -> 'p';
            case KNIGHT -> 'n';
            case BISHOP -> 'b';
            case ROOK -> 'r';
            case QUEEN -> 'q';
            case KING -> 'k';
        };
        return material.color().isWhite() ? Character.toUpperCase(letter) : letter;
    }
}
