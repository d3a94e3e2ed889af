package com.example.triviaroom.persistence;

import com.example.triviaroom.model.GameResult;
import com.example.triviaroom.model.LeaderboardEntry;
import com.example.triviaroom.repository.GameResultRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Adapter auf JPA-Repository: one GameResult row per player.
 * Only active with features.game-results.enabled=true. Retries a bounded number of times.
 */
public class JpaGameSettlementService implements GameSettlementService {

    private static final Logger log = LoggerFactory.getLogger(JpaGameSettlementService.class);

    private final GameResultRepository repo;
    private final int maxAttempts;

    public JpaGameSettlementService(GameResultRepository repo, int maxAttempts) {
        this.repo = repo;
        this.maxAttempts = Math.max(1, maxAttempts);
    }

    @Override
    public void settle(FinishedGame game) {
        if (repo.existsByRoomId(game.roomId())) {
            log.info("SETTLE skipped room={} (already recorded)", game.roomId());
            return;
        }
        List<GameResult> rows = toRows(game);

        DataAccessException last = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                repo.saveAll(rows);
                log.info("SETTLE room={} rows={} attempt={}", game.roomId(), rows.size(), attempt);
                return;
            } catch (DataAccessException e) {
                last = e;
                log.warn("SETTLE attempt {}/{} failed room={}: {}", attempt, maxAttempts, game.roomId(), e.toString());
            }
        }
        throw new IllegalStateException("Settlement failed for room " + game.roomId(), last);
    }

    static List<GameResult> toRows(FinishedGame game) {
        List<GameResult> rows = new ArrayList<>();
        for (LeaderboardEntry e : game.leaderboard()) {
            GameResult r = new GameResult(game.roomId(), e.userId());
            r.setDisplayName(e.displayName());
            r.setTopic(game.topic());
            r.setDifficulty(game.difficulty());
            r.setFinalRank(e.rank());
            r.setScore(e.score());
            r.setCorrectAnswers(e.correctAnswers());
            r.setTotalQuestions(game.totalQuestions());
            r.setWinner(Objects.equals(e.userId(), game.winnerId()));
            r.setFinishedAt(game.endedAt());
            rows.add(r);
        }
        return rows;
    }
}
