package max.chess.rules.game;

public final class RulesConfig {

    public static final RulesConfig DEFAULT = new Builder().build();

    // Draws
    public final int repetitionLimit;             // occurrences of a position that draw (default 3)
    public final int fiftyMoveLimitPlies;         // plies without pawn move or capture that draw (default 100)
    public final boolean detectInsufficientMaterial;

    // Player mode
    public final boolean autoApplyPreMoves;       // play a still legal pre-move as soon as the opponent replied

    private RulesConfig(Builder b) {
        repetitionLimit = b.repetitionLimit;
        fiftyMoveLimitPlies = b.fiftyMoveLimitPlies;
        detectInsufficientMaterial = b.detectInsufficientMaterial;
        autoApplyPreMoves = b.autoApplyPreMoves;
    }

    @Override
    public String toString() {
        return "RulesConfig{repetitionLimit=" + repetitionLimit
                + ", fiftyMoveLimitPlies=" + fiftyMoveLimitPlies
                + ", detectInsufficientMaterial=" + detectInsufficientMaterial
                + ", autoApplyPreMoves=" + autoApplyPreMoves + '}';
    }

    public static class Builder {
        private int repetitionLimit = 3, fiftyMoveLimitPlies = 100;
        private boolean detectInsufficientMaterial = true;
        private boolean autoApplyPreMoves = true;

        public Builder repetitionLimit(int v){
            if(v < 2) throw new IllegalArgumentException("Repetition limit must be at least 2, got " + v);
            repetitionLimit=v;return this;
        }
        public Builder fiftyMoveLimitPlies(int v){
            if(v < 1) throw new IllegalArgumentException("Fifty move limit must be positive, got " + v);
            fiftyMoveLimitPlies=v;return this;
        }
        public Builder detectInsufficientMaterial(boolean v){detectInsufficientMaterial=v;return this;}
        public Builder autoApplyPreMoves(boolean v){autoApplyPreMoves=v;return this;}

        public RulesConfig build(){return new RulesConfig(this);}
    }
}
