package max.chess.rules.game;

import max.chess.rules.common.Color;
import max.chess.rules.common.PieceType;
import max.chess.rules.game.board.Position;
import max.chess.rules.movegen.utils.BitBoardUtils;
import max.chess.rules.utils.BitUtils;

/**
 * What one side has left to mate with, as far as the insufficient material draw is concerned.
 * <p>
 * The draw is called for king against king, a single minor piece against a lone king, and bishop against
 * bishop when both run on the same square color. This is the usual simplified test rather than the FIDE
 * dead position rule: king and two knights against a lone king or opposite colored bishops are played on.
 */
public enum MatingMaterial {
    SUFFICIENT,
    TWO_KNIGHTS,
    ONE_KNIGHT,
    ONE_BISHOP,
    LONE_KING;

    public static MatingMaterial of(Position position, Color color) {
        long heavyBB = position.pieceBB(PieceType.PAWN, color)
                | position.pieceBB(PieceType.ROOK, color)
                | position.pieceBB(PieceType.QUEEN, color);
        if(heavyBB != 0) {
            return SUFFICIENT;
        }

        int knights = BitUtils.bitCount(position.pieceBB(PieceType.KNIGHT, color));
        int bishops = BitUtils.bitCount(position.pieceBB(PieceType.BISHOP, color));
        if(knights == 0 && bishops == 0) {
            return LONE_KING;
        } else if(knights == 1 && bishops == 0) {
            return ONE_KNIGHT;
        } else if(knights == 0 && bishops == 1) {
            return ONE_BISHOP;
        } else if(knights == 2 && bishops == 0) {
            return TWO_KNIGHTS;
        }
        return SUFFICIENT;
    }

    public static boolean isInsufficient(Position position) {
        MatingMaterial white = of(position, Color.WHITE);
        MatingMaterial black = of(position, Color.BLACK);

        if(white == LONE_KING || black == LONE_KING) {
            MatingMaterial other = white == LONE_KING ? black : white;
            return other == LONE_KING || other == ONE_KNIGHT || other == ONE_BISHOP;
        }
        if(white == ONE_BISHOP && black == ONE_BISHOP) {
            long bishopsBB = position.pieceBB(PieceType.BISHOP);
            return (bishopsBB & BitBoardUtils.LIGHT_SQUARES) == 0 || (bishopsBB & BitBoardUtils.DARK_SQUARES) == 0;
        }
        return false;
    }
}
