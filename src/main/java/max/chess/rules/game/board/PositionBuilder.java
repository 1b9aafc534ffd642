package max.chess.rules.game.board;

import max.chess.rules.common.Color;
import max.chess.rules.common.ColorPair;
import max.chess.rules.common.Material;
import max.chess.rules.common.PieceType;
import max.chess.rules.common.Square;
import max.chess.rules.exceptions.InvalidPositionException;
import max.chess.rules.movegen.utils.CheckUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Builds an arbitrary position, e.g. to start a game from a puzzle. {@link #build()} refuses anything
 * that could not occur in a game.
 */
public final class PositionBuilder {
    private static final Logger logger = LoggerFactory.getLogger(PositionBuilder.class);

    private final Material[] placement = new Material[64];
    private ColorPair<CastlingRights> castlingRights = ColorPair.both(CastlingRights.NONE);
    private Color sideToMove = Color.WHITE;
    private Square enPassantSquare;
    private int halfMoveClock = 0;
    private int fullMoveNumber = 1;

    public PositionBuilder place(Square square, Material material) {
        placement[square.getFlatIndex()] = Objects.requireNonNull(material, "material");
        return this;
    }

    public PositionBuilder place(String square, Material material) {
        return place(Square.of(square), material);
    }

    public PositionBuilder clear(Square square) {
        placement[square.getFlatIndex()] = null;
        return this;
    }

    public PositionBuilder sideToMove(Color sideToMove) {
        this.sideToMove = Objects.requireNonNull(sideToMove, "sideToMove");
        return this;
    }

    public PositionBuilder castlingRights(Color color, CastlingRights rights) {
        this.castlingRights = castlingRights.with(color, Objects.requireNonNull(rights, "rights"));
        return this;
    }

    public PositionBuilder enPassantSquare(Square enPassantSquare) {
        this.enPassantSquare = enPassantSquare;
        return this;
    }

    public PositionBuilder halfMoveClock(int halfMoveClock) {
        this.halfMoveClock = halfMoveClock;
        return this;
    }

    public PositionBuilder fullMoveNumber(int fullMoveNumber) {
        this.fullMoveNumber = fullMoveNumber;
        return this;
    }

    public Position build() {
        validatePlacement();
        for(Color color : Color.VALUES) {
            validateCastlingRights(color);
        }
        validateEnPassant();
        if(halfMoveClock < 0) {
            throw invalid("Half move clock cannot be negative: " + halfMoveClock);
        }
        if(fullMoveNumber < 1) {
            throw invalid("Full move number starts at 1, got " + fullMoveNumber);
        }

        Position position = Position.of(placement, castlingRights,
                enPassantSquare == null ? Position.NO_EN_PASSANT : enPassantSquare.getFlatIndex(),
                halfMoveClock, MoveId.of(fullMoveNumber, sideToMove));

        if(CheckUtils.isKingInCheck(position, sideToMove.getOppositeColor())) {
            throw invalid(sideToMove.getOppositeColor() + " king is in check while " + sideToMove + " is to move");
        }
        return position;
    }

    private void validatePlacement() {
        int[] kings = new int[Color.VALUES.length];
        for(int i = 0; i < 64; i++) {
            Material material = placement[i];
            if(material == null) {
                continue;
            }
            if(material.type() == PieceType.KING) {
                kings[material.color().ordinal()]++;
            } else if(material.type() == PieceType.PAWN && (i / 8 == 0 || i / 8 == 7)) {
                throw invalid("Pawn on a back rank at " + Square.of(i));
            }
        }
        for(Color color : Color.VALUES) {
            if(kings[color.ordinal()] != 1) {
                throw invalid(color + " must have exactly one king, found " + kings[color.ordinal()]);
            }
        }
    }

    private void validateCastlingRights(Color color) {
        CastlingRights rights = castlingRights.get(color);
        if(!rights.hasAny()) {
            return;
        }
        int rank = color.backRank();
        if(!holds(rank * 8 + rights.kingFile(), PieceType.KING, color)) {
            throw invalid(color + " castling rights need the king on " + Square.of(rights.kingFile(), rank));
        }
        for(CastlingSide side : CastlingSide.VALUES) {
            if(!rights.has(side)) {
                continue;
            }
            int rookFile = rights.rookFile(side);
            boolean rightSide = side == CastlingSide.KING_SIDE ? rookFile > rights.kingFile() : rookFile < rights.kingFile();
            if(!rightSide || !holds(rank * 8 + rookFile, PieceType.ROOK, color)) {
                throw invalid(color + " " + side + " castling rights need a rook on " + Square.of(rookFile, rank));
            }
        }
    }

    private void validateEnPassant() {
        if(enPassantSquare == null) {
            return;
        }
        // The side that just moved pushed a pawn over the en passant square
        Color mover = sideToMove.getOppositeColor();
        int target = enPassantSquare.getFlatIndex();
        int expectedRank = mover.isWhite() ? 2 : 5;
        if(enPassantSquare.getY() != expectedRank
                || placement[target] != null
                || placement[target - mover.pawnPushOffset()] != null
                || !holds(target + mover.pawnPushOffset(), PieceType.PAWN, mover)) {
            throw invalid("Inconsistent en passant square " + enPassantSquare);
        }
    }

    private boolean holds(int positionIndex, PieceType pieceType, Color color) {
        return Material.of(pieceType, color).equals(placement[positionIndex]);
    }

    private static InvalidPositionException invalid(String message) {
        logger.debug("Rejecting position: {}", message);
        return new InvalidPositionException(message);
    }
}
