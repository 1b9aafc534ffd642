package max.chess.rules.game.board;

import max.chess.rules.common.Color;

// Castling capability: exposes each side's remaining rights
public interface Castling {

    CastlingRights castlingRights(Color color);

    default boolean canCastle(Color color, CastlingSide side) {
        return castlingRights(color).has(side);
    }
}
