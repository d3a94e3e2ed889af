package com.example.triviaroom.persistence;

/**
 * Records a finished game (history, score settlement). Invoked once per finished game,
 * outside the room lock. Implementations own their retry policy and throw when they give up.
 */
public interface GameSettlementService {

    void settle(FinishedGame game);
}
