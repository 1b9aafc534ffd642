package max.chess.rules.game.board;

import max.chess.rules.common.Color;

/**
 * What makes two positions the same for repetition purposes: placement, side to move, castling rights
 * and en passant target. Clocks are left out.
 */
public record PositionKey(long whiteBB, long blackBB,
                          long pawnBB, long knightBB, long bishopBB, long rookBB, long queenBB, long kingBB,
                          Color sideToMove,
                          CastlingRights whiteCastlingRights, CastlingRights blackCastlingRights,
                          int enPassantIndex) {
}
