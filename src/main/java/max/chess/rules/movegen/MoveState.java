package max.chess.rules.movegen;

import max.chess.rules.common.Color;
import max.chess.rules.common.ColorPair;
import max.chess.rules.common.Square;
import max.chess.rules.game.board.Position;
import max.chess.rules.utils.BitUtils;

import java.util.List;

/**
 * A position with everything move generation derived from it. Built by {@link MoveGenerator#analyze(Position)}
 * and never changed afterwards.
 */
public final class MoveState implements LegalMoves {
    private final Position position;
    // The side to move's enemy attacks are computed with the king of the side to move off the board
    private final ColorPair<Long> attackedBB;
    private final long checkersBB;
    private final long pinnedBB;
    private final long[] pinRaysBB;
    private final List<LegalMove> legalMoves;

    MoveState(Position position, ColorPair<Long> attackedBB, long checkersBB, long pinnedBB, long[] pinRaysBB,
              List<LegalMove> legalMoves) {
        this.position = position;
        this.attackedBB = attackedBB;
        this.checkersBB = checkersBB;
        this.pinnedBB = pinnedBB;
        this.pinRaysBB = pinRaysBB;
        this.legalMoves = List.copyOf(legalMoves);
    }

    public Position position() {
        return position;
    }

    public long attackedBB(Color color) {
        return attackedBB.get(color);
    }

    public long checkersBB() {
        return checkersBB;
    }

    public boolean isInCheck() {
        return checkersBB != 0;
    }

    public boolean isDoubleCheck() {
        return BitUtils.bitCount(checkersBB) > 1;
    }

    public long pinnedBB() {
        return pinnedBB;
    }

    // Squares a pinned piece may still move to, or every square if the piece is not pinned
    public long pinRayBB(Square square) {
        return BitUtils.contains(pinnedBB, square.getFlatIndex()) ? pinRaysBB[square.getFlatIndex()] : ~0L;
    }

    @Override
    public List<LegalMove> legalMoves() {
        return legalMoves;
    }

    public boolean isCheckmate() {
        return legalMoves.isEmpty() && isInCheck();
    }

    public boolean isStalemate() {
        return legalMoves.isEmpty() && !isInCheck();
    }
}
