package com.example.triviaroom.service;

import com.example.triviaroom.model.Difficulty;
import org.springframework.stereotype.Component;

/** Points for one answer: difficulty base + speed bonus + streak bonus. Wrong answers score 0. */
@Component
public class ScoreCalculator {

    static final int MAX_TIME_BONUS = 10;
    static final int STREAK_STEP = 2;
    static final int MAX_STREAK_BONUS = 20;

    /**
     * @param seconds effective answer time in seconds
     * @param streak  consecutive correct answers before this one
     */
    public int score(boolean correct, Difficulty difficulty, double seconds, int streak) {
        if (!correct) return 0;

        int base = (difficulty == null ? Difficulty.MEDIUM : difficulty).getBaseScore();
        int timeBonus = Math.max(0, MAX_TIME_BONUS - (int) Math.floor(Math.max(0, seconds)));
        int streakBonus = Math.min(Math.max(0, streak) * STREAK_STEP, MAX_STREAK_BONUS);

        return base + timeBonus + streakBonus;
    }
}
