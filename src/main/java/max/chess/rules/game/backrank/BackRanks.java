package max.chess.rules.game.backrank;

import java.util.Optional;

// Back rank capability of a game: the arrangement it started from, when it started from one
public interface BackRanks {

    Optional<BackRankId> backRankId();

    default boolean isChess960() {
        return backRankId().map(id -> !id.isStandard()).orElse(false);
    }
}
