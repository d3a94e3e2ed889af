package com.example.triviaroom.persistence;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * No-op adapter for deployments without a results store.
 */
public class NoOpGameSettlementService implements GameSettlementService {

    private static final Logger log = LoggerFactory.getLogger(NoOpGameSettlementService.class);

    @Override
    public void settle(FinishedGame game) {
        // No DB -> only log the outcome
        log.info("SETTLE (no-op) room={} winner={} players={}",
                game.roomId(), game.winnerId(), game.leaderboard().size());
    }
}
