package max.chess.rules.movegen;

import max.chess.rules.common.Color;
import max.chess.rules.common.ColorPair;
import max.chess.rules.common.PieceType;
import max.chess.rules.game.backrank.BackRank;
import max.chess.rules.game.board.CastlingRights;
import max.chess.rules.game.board.CastlingSide;
import max.chess.rules.game.board.Position;
import max.chess.rules.movegen.pieces.Bishop;
import max.chess.rules.movegen.pieces.King;
import max.chess.rules.movegen.pieces.Knight;
import max.chess.rules.movegen.pieces.Pawn;
import max.chess.rules.movegen.pieces.Rook;
import max.chess.rules.movegen.utils.BitBoardUtils;
import max.chess.rules.movegen.utils.CheckUtils;
import max.chess.rules.movegen.utils.ObstructedLinesUtils;
import max.chess.rules.utils.BitUtils;

import java.util.ArrayList;
import java.util.List;

public final class MoveGenerator {

    private MoveGenerator() {
    }

    public static void warmUp() {
        BitBoardUtils.warmUp();
        ObstructedLinesUtils.warmUp();
        Knight.warmUp();
        Bishop.warmUp();
        Rook.warmUp();
        King.warmUp();
        Pawn.warmUp();
        BackRank.warmUp();
    }

    /**
     * Computes the attack maps, checkers, pins and the full legal move set of the side to move.
     */
    public static MoveState analyze(Position position) {
        Color us = position.sideToMove();
        Color them = us.getOppositeColor();
        long occupiedBB = position.occupiedBB();
        int kingIndex = position.kingIndex(us);
        long kingBB = BitUtils.getPositionIndexBitMask(kingIndex);

        // Enemy attacks go through our king so it cannot step back along a checking line
        long enemyAttackBB = getAttackBB(position, them, occupiedBB & ~kingBB);
        long friendlyAttackBB = getAttackBB(position, us, occupiedBB);
        long checkersBB = CheckUtils.getAttackersBB(position, kingIndex, them, occupiedBB);
        long[] pinRaysBB = new long[64];
        long pinnedBB = getPinnedBB(position, us, pinRaysBB);

        List<LegalMove> legalMoves = new ArrayList<>(48);
        generateMoves(position, enemyAttackBB, checkersBB, pinnedBB, pinRaysBB, legalMoves);

        ColorPair<Long> attackedBB = us.isWhite()
                ? ColorPair.of(friendlyAttackBB, enemyAttackBB)
                : ColorPair.of(enemyAttackBB, friendlyAttackBB);
        return new MoveState(position, attackedBB, checkersBB, pinnedBB, pinRaysBB, legalMoves);
    }

    public static List<LegalMove> getLegalMoves(Position position) {
        return analyze(position).legalMoves();
    }

    // Every square attacked by a color, sliders being blocked by occupiedBB
    public static long getAttackBB(Position position, Color color, long occupiedBB) {
        long attackBB = Pawn.getAttackBB(position.pieceBB(PieceType.PAWN, color), color);
        attackBB |= King.getAttackBB(position.kingIndex(color));

        long knightsBB = position.pieceBB(PieceType.KNIGHT, color);
        while(knightsBB != 0) {
            attackBB |= Knight.getAttackBB(BitUtils.bitScanForward(knightsBB));
            knightsBB &= knightsBB - 1;
        }

        long queensBB = position.pieceBB(PieceType.QUEEN, color);
        long diagonalsBB = position.pieceBB(PieceType.BISHOP, color) | queensBB;
        while(diagonalsBB != 0) {
            attackBB |= Bishop.getAttackBB(BitUtils.bitScanForward(diagonalsBB), occupiedBB);
            diagonalsBB &= diagonalsBB - 1;
        }
        long orthogonalsBB = position.pieceBB(PieceType.ROOK, color) | queensBB;
        while(orthogonalsBB != 0) {
            attackBB |= Rook.getAttackBB(BitUtils.bitScanForward(orthogonalsBB), occupiedBB);
            orthogonalsBB &= orthogonalsBB - 1;
        }
        return attackBB;
    }

    /**
     * Finds the pieces of {@code kingColor} pinned to their king. For each of them, {@code pinRaysBB} receives
     * the squares it may still move to: the line up to and including the pinning piece.
     */
    public static long getPinnedBB(Position position, Color kingColor, long[] pinRaysBB) {
        Color enemyColor = kingColor.getOppositeColor();
        int kingIndex = position.kingIndex(kingColor);
        long occupiedBB = position.occupiedBB();
        long friendlyBB = position.colorBB(kingColor);
        long enemyQueensBB = position.pieceBB(PieceType.QUEEN, enemyColor);

        // Enemy sliders that would see our king on an empty board
        long snipersBB = (Rook.ROOK_MOVES_BB[kingIndex] & (position.pieceBB(PieceType.ROOK, enemyColor) | enemyQueensBB))
                | (Bishop.BISHOP_MOVES_BB[kingIndex] & (position.pieceBB(PieceType.BISHOP, enemyColor) | enemyQueensBB));

        long pinnedBB = 0L;
        while(snipersBB != 0) {
            int sniperIndex = BitUtils.bitScanForward(snipersBB);
            snipersBB &= snipersBB - 1;

            long obstructedBB = ObstructedLinesUtils.OBSTRUCTED_BB[kingIndex][sniperIndex];
            long blockersBB = obstructedBB & occupiedBB;
            if(BitUtils.bitCount(blockersBB) == 1 && (blockersBB & friendlyBB) != 0) {
                pinnedBB |= blockersBB;
                pinRaysBB[BitUtils.bitScanForward(blockersBB)] = obstructedBB | BitUtils.getPositionIndexBitMask(sniperIndex);
            }
        }
        return pinnedBB;
    }

    private static void generateMoves(Position position, long enemyAttackBB, long checkersBB, long pinnedBB,
                                      long[] pinRaysBB, List<LegalMove> moves) {
        Color us = position.sideToMove();
        long friendlyBB = position.colorBB(us);
        long enemyBB = position.colorBB(us.getOppositeColor());
        long occupiedBB = friendlyBB | enemyBB;
        int kingIndex = position.kingIndex(us);

        // The king always has a chance
        addMovesFromBitboard(kingIndex, King.getNonCastleLegalMovesBB(kingIndex, enemyAttackBB, friendlyBB), moves);

        int checkersCount = BitUtils.bitCount(checkersBB);
        if(checkersCount > 1) {
            // Double check: only the king can move
            return;
        }

        // Moves must capture the checker or block its line
        long checkMaskBB = ~0L;
        if(checkersCount == 1) {
            checkMaskBB = checkersBB | ObstructedLinesUtils.OBSTRUCTED_BB[kingIndex][BitUtils.bitScanForward(checkersBB)];
        }

        // A pinned knight can never move
        long knightsBB = position.pieceBB(PieceType.KNIGHT, us) & ~pinnedBB;
        while(knightsBB != 0) {
            int from = BitUtils.bitScanForward(knightsBB);
            knightsBB &= knightsBB - 1;
            addMovesFromBitboard(from, Knight.getLegalMovesBB(from, friendlyBB) & checkMaskBB, moves);
        }

        // Queens go through both slider loops, diagonal and orthogonal targets never overlap
        long queensBB = position.pieceBB(PieceType.QUEEN, us);
        long diagonalsBB = position.pieceBB(PieceType.BISHOP, us) | queensBB;
        while(diagonalsBB != 0) {
            int from = BitUtils.bitScanForward(diagonalsBB);
            diagonalsBB &= diagonalsBB - 1;
            long targetsBB = Bishop.getLegalMovesBB(from, occupiedBB, friendlyBB) & checkMaskBB & pinRay(from, pinnedBB, pinRaysBB);
            addMovesFromBitboard(from, targetsBB, moves);
        }
        long orthogonalsBB = position.pieceBB(PieceType.ROOK, us) | queensBB;
        while(orthogonalsBB != 0) {
            int from = BitUtils.bitScanForward(orthogonalsBB);
            orthogonalsBB &= orthogonalsBB - 1;
            long targetsBB = Rook.getLegalMovesBB(from, occupiedBB, friendlyBB) & checkMaskBB & pinRay(from, pinnedBB, pinRaysBB);
            addMovesFromBitboard(from, targetsBB, moves);
        }

        addPawnMoves(position, us, enemyBB, occupiedBB, checkMaskBB, pinnedBB, pinRaysBB, moves);

        if(checkersCount == 0) {
            addCastleMoves(position, us, moves);
        }
    }

    private static void addPawnMoves(Position position, Color us, long enemyBB, long occupiedBB, long checkMaskBB,
                                     long pinnedBB, long[] pinRaysBB, List<LegalMove> moves) {
        int enPassantIndex = position.enPassantIndex();
        long pawnsBB = position.pieceBB(PieceType.PAWN, us);
        while(pawnsBB != 0) {
            int from = BitUtils.bitScanForward(pawnsBB);
            pawnsBB &= pawnsBB - 1;

            long pushesBB = Pawn.getPushMovesBB(from, us, occupiedBB);
            long capturesBB = Pawn.getAttackBB(from, us) & enemyBB;
            long targetsBB = (pushesBB | capturesBB) & checkMaskBB & pinRay(from, pinnedBB, pinRaysBB);

            while(targetsBB != 0) {
                int to = BitUtils.bitScanForward(targetsBB);
                targetsBB &= targetsBB - 1;
                if(to / 8 == us.promotionRank()) {
                    for(PieceType promotion : PieceType.PROMOTIONS) {
                        moves.add(LegalMove.promotion(from, to, promotion));
                    }
                } else if(Math.abs(to - from) == 16) {
                    moves.add(LegalMove.doublePawnPush(from, to));
                } else {
                    moves.add(LegalMove.normal(from, to));
                }
            }

            // Decided by playing it out, pins and checks included
            if(enPassantIndex != Position.NO_EN_PASSANT
                    && BitUtils.contains(Pawn.getAttackBB(from, us), enPassantIndex)
                    && !CheckUtils.wouldKingBeInCheckAfterEnPassant(position, from, enPassantIndex, us)) {
                moves.add(LegalMove.enPassant(from, enPassantIndex));
            }
        }
    }

    private static void addCastleMoves(Position position, Color us, List<LegalMove> moves) {
        CastlingRights rights = position.castlingRights(us);
        int rank = us.backRank();
        for(CastlingSide side : CastlingSide.VALUES) {
            if(King.isCastleLegal(position, us, side, false)) {
                moves.add(LegalMove.castle(rank * 8 + rights.kingFile(), rank * 8 + side.kingDestinationFile,
                        rank * 8 + rights.rookFile(side), side));
            }
        }
    }

    private static long pinRay(int from, long pinnedBB, long[] pinRaysBB) {
        return BitUtils.contains(pinnedBB, from) ? pinRaysBB[from] : ~0L;
    }

    private static void addMovesFromBitboard(int from, long targetsBB, List<LegalMove> moves) {
        while(targetsBB != 0) {
            moves.add(LegalMove.normal(from, BitUtils.bitScanForward(targetsBB)));
            targetsBB &= targetsBB - 1;
        }
    }

    /**
     * Counts the leaf nodes of the legal move tree, for checking the generator against known counts.
     */
    public static long perft(Position position, int depth) {
        if(depth == 0) {
            return 1;
        }
        List<LegalMove> moves = getLegalMoves(position);
        if(depth == 1) {
            return moves.size();
        }
        long nodes = 0;
        for(LegalMove move : moves) {
            nodes += perft(position.apply(move), depth - 1);
        }
        return nodes;
    }
}
