package max.chess.rules.game.board;

/**
 * Castling rights of one color, expressed as the original files of the king and of each rook still
 * allowed to castle ({@link #NO_FILE} once revoked). Storing files rather than flags is what lets
 * Chess960 back ranks use the same rules as standard chess.
 * <p>
 * Rights only ever shrink: every operation returns rights that are a subset of the current ones.
 */
public record CastlingRights(int kingFile, int kingSideRookFile, int queenSideRookFile) {
    public static final int NO_FILE = -1;
    public static final CastlingRights NONE = new CastlingRights(NO_FILE, NO_FILE, NO_FILE);

    public CastlingRights {
        if(kingFile < NO_FILE || kingFile > 7 || kingSideRookFile < NO_FILE || kingSideRookFile > 7
                || queenSideRookFile < NO_FILE || queenSideRookFile > 7) {
            throw new IllegalArgumentException("Castling files must be in [0, 7] or NO_FILE");
        }
        if(kingFile == NO_FILE && (kingSideRookFile != NO_FILE || queenSideRookFile != NO_FILE)) {
            throw new IllegalArgumentException("A castling rook file needs a king file");
        }
        if(kingSideRookFile == NO_FILE && queenSideRookFile == NO_FILE) {
            kingFile = NO_FILE;
        }
    }

    public static CastlingRights of(int kingFile, int kingSideRookFile, int queenSideRookFile) {
        return new CastlingRights(kingFile, kingSideRookFile, queenSideRookFile);
    }

    public boolean has(CastlingSide side) {
        return rookFile(side) != NO_FILE;
    }

    public boolean hasAny() {
        return kingSideRookFile != NO_FILE || queenSideRookFile != NO_FILE;
    }

    public int rookFile(CastlingSide side) {
        return side == CastlingSide.KING_SIDE ? kingSideRookFile : queenSideRookFile;
    }

    public CastlingRights without(CastlingSide side) {
        return side == CastlingSide.KING_SIDE
                ? new CastlingRights(kingFile, NO_FILE, queenSideRookFile)
                : new CastlingRights(kingFile, kingSideRookFile, NO_FILE);
    }

    // Called with the file of a back rank square that was left or captured on
    public CastlingRights revokeOn(int file) {
        if(!hasAny()) {
            return this;
        }
        if(file == kingFile) {
            return NONE;
        }
        CastlingRights rights = this;
        if(file == kingSideRookFile) {
            rights = rights.without(CastlingSide.KING_SIDE);
        }
        if(file == queenSideRookFile) {
            rights = rights.without(CastlingSide.QUEEN_SIDE);
        }
        return rights;
    }

    public boolean isSubsetOf(CastlingRights other) {
        return (kingSideRookFile == NO_FILE || kingSideRookFile == other.kingSideRookFile)
                && (queenSideRookFile == NO_FILE || queenSideRookFile == other.queenSideRookFile);
    }
}
