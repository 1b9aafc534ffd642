package max.chess.rules.game.board;

public enum CastlingSide {
    KING_SIDE(6, 5),
    QUEEN_SIDE(2, 3);

    public static final CastlingSide[] VALUES = CastlingSide.values();

    // Chess960 keeps the standard destination files whatever the starting files are
    public final int kingDestinationFile;
    public final int rookDestinationFile;

    CastlingSide(int kingDestinationFile, int rookDestinationFile) {
        this.kingDestinationFile = kingDestinationFile;
        this.rookDestinationFile = rookDestinationFile;
    }
}
