package max.chess.rules.game.backrank;

import max.chess.rules.common.PieceType;
import max.chess.rules.exceptions.InvalidPositionException;

import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;

/**
 * Piece arrangement of a back rank, from the a file to the h file. The 960 arrangements are built once
 * from their Scharnagl numbers:
 * <ul>
 *     <li>id % 4 places the light squared bishop on b, d, f or h</li>
 *     <li>(id / 4) % 4 places the dark squared bishop on a, c, e or g</li>
 *     <li>(id / 16) % 6 places the queen on one of the six free files</li>
 *     <li>id / 96 picks one of the ten ways to place both knights on the five free files</li>
 * </ul>
 * The last three free files get rook, king, rook.
 */
public final class BackRank {
    private static final int[][] KNIGHT_PLACEMENTS = {
            {0, 1}, {0, 2}, {0, 3}, {0, 4}, {1, 2}, {1, 3}, {1, 4}, {2, 3}, {2, 4}, {3, 4}
    };

    private static final BackRank[] BACK_RANKS = new BackRank[BackRankId.COUNT];
    private static final Map<String, BackRankId> IDS_BY_ARRANGEMENT = new HashMap<>();

    static {
        for(int i = 0; i < BackRankId.COUNT; i++) {
            BackRankId id = new BackRankId(i);
            BACK_RANKS[i] = new BackRank(id, generateArrangement(i));
            IDS_BY_ARRANGEMENT.put(BACK_RANKS[i].toString(), id);
        }
    }

    public static void warmUp() {
        // To init static block
    }

    public static BackRank of(BackRankId id) {
        return BACK_RANKS[id.value()];
    }

    /**
     * Finds the id of an arrangement.
     *
     * @throws InvalidPositionException if the arrangement is not one of the 960 legal back ranks
     */
    public static BackRankId idOf(PieceType[] pieces) {
        if(pieces == null || pieces.length != 8) {
            throw new InvalidPositionException("A back rank needs exactly 8 pieces");
        }
        BackRankId id = IDS_BY_ARRANGEMENT.get(arrangementName(pieces));
        if(id == null) {
            throw new InvalidPositionException("Not a Chess960 back rank: " + Arrays.toString(pieces));
        }
        return id;
    }

    private final BackRankId id;
    private final PieceType[] pieces;
    private final int kingFile;
    private final int kingSideRookFile;
    private final int queenSideRookFile;

    private BackRank(BackRankId id, PieceType[] pieces) {
        this.id = id;
        this.pieces = pieces;
        int king = -1;
        int queenSideRook = -1;
        int kingSideRook = -1;
        for(int file = 0; file < 8; file++) {
            if(pieces[file] == PieceType.KING) {
                king = file;
            } else if(pieces[file] == PieceType.ROOK) {
                if(king == -1) {
                    queenSideRook = file;
                } else {
                    kingSideRook = file;
                }
            }
        }
        this.kingFile = king;
        this.kingSideRookFile = kingSideRook;
        this.queenSideRookFile = queenSideRook;
    }

    private static PieceType[] generateArrangement(int id) {
        PieceType[] pieces = new PieceType[8];
        int n = id;

        pieces[2 * (n % 4) + 1] = PieceType.BISHOP;
        n /= 4;
        pieces[2 * (n % 4)] = PieceType.BISHOP;
        n /= 4;
        placeOnFreeFile(pieces, n % 6, PieceType.QUEEN);
        n /= 6;

        int[] knights = KNIGHT_PLACEMENTS[n];
        // Second knight first so the first knight index is not shifted
        placeOnFreeFile(pieces, knights[1], PieceType.KNIGHT);
        placeOnFreeFile(pieces, knights[0], PieceType.KNIGHT);

        placeOnFreeFile(pieces, 0, PieceType.ROOK);
        placeOnFreeFile(pieces, 0, PieceType.KING);
        placeOnFreeFile(pieces, 0, PieceType.ROOK);

        return pieces;
    }

    private static void placeOnFreeFile(PieceType[] pieces, int freeIndex, PieceType pieceType) {
        int seen = 0;
        for(int file = 0; file < 8; file++) {
            if(pieces[file] == null) {
                if(seen == freeIndex) {
                    pieces[file] = pieceType;
                    return;
                }
                seen++;
            }
        }
        throw new IllegalStateException("No free file left for " + pieceType);
    }

    private static String arrangementName(PieceType[] pieces) {
        StringBuilder builder = new StringBuilder(8);
        for(PieceType pieceType : pieces) {
            builder.append(pieceType == null ? '?' : letterOf(pieceType));
        }
        return builder.toString();
    }

    private static char letterOf(PieceType pieceType) {
        return switch (pieceType) {
            case PAWN -> 'P';
            case KNIGHT -> 'N';
            case BISHOP -> 'B';
            case ROOK -> 'R';
            case QUEEN -> 'Q';
            case KING -> 'K';
        };
    }

    public BackRankId id() {
        return id;
    }

    public PieceType pieceAt(int file) {
        return pieces[file];
    }

    public PieceType[] pieces() {
        return pieces.clone();
    }

    public int kingFile() {
        return kingFile;
    }

    public int kingSideRookFile() {
        return kingSideRookFile;
    }

    public int queenSideRookFile() {
        return queenSideRookFile;
    }

    @Override
    public String toString() {
        return arrangementName(pieces);
    }
}
