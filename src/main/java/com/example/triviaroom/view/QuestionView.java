package com.example.triviaroom.view;

import com.example.triviaroom.model.Difficulty;
import com.example.triviaroom.model.TriviaQuestion;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/** Question as sent to clients. The correct index is only filled in once the question has ended. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record QuestionView(
        String id,
        String topic,
        Difficulty difficulty,
        String question,
        List<String> answers,
        Integer correctAnswerIndex
) {
    public static QuestionView hidden(TriviaQuestion q) {
        if (q == null) return null;
        return new QuestionView(q.id(), q.topic(), q.difficulty(), q.question(), q.answers(), null);
    }

    public static QuestionView revealed(TriviaQuestion q) {
        if (q == null) return null;
        return new QuestionView(q.id(), q.topic(), q.difficulty(), q.question(), q.answers(), q.correctAnswerIndex());
    }
}
