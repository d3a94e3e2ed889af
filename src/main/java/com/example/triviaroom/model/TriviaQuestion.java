package com.example.triviaroom.model;

import java.util.List;

public record TriviaQuestion(
        String id,
        String topic,
        Difficulty difficulty,
        String question,
        List<String> answers,
        int correctAnswerIndex
) {
    public TriviaQuestion {
        answers = (answers == null) ? List.of() : List.copyOf(answers);
    }

    public boolean isCorrect(int answerIndex) {
        return answerIndex == correctAnswerIndex;
    }

    public String correctAnswer() {
        return (correctAnswerIndex >= 0 && correctAnswerIndex < answers.size()) ? answers.get(correctAnswerIndex) : null;
    }
}
