package com.example.triviaroom.provider;

import com.example.triviaroom.model.Difficulty;
import com.example.triviaroom.model.TriviaQuestion;

import java.util.List;

/**
 * Supplies the ordered question batch for a game.
 * Implementations throw GameException(PROVIDER_UNAVAILABLE) when no batch can be produced.
 */
public interface QuestionProvider {

    List<TriviaQuestion> fetchQuestions(String topic, Difficulty difficulty, int count);
}
