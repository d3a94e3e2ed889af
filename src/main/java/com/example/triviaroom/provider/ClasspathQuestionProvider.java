package com.example.triviaroom.provider;

import com.example.triviaroom.config.GameProperties;
import com.example.triviaroom.error.ErrorCode;
import com.example.triviaroom.error.GameException;
import com.example.triviaroom.model.Difficulty;
import com.example.triviaroom.model.TriviaQuestion;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.*;

/**
 * Question source backed by a JSON bank on the classpath.
 * Filters by difficulty (custom accepts any) and topic; when the topic has no questions
 * the whole difficulty pool is used. The batch is shuffled per call.
 */
@Component
public class ClasspathQuestionProvider implements QuestionProvider {

    private static final Logger log = LoggerFactory.getLogger(ClasspathQuestionProvider.class);

    private final ObjectMapper objectMapper;
    private final String location;
    private final Random random;

    private volatile List<TriviaQuestion> bank;

    @Autowired
    public ClasspathQuestionProvider(ObjectMapper objectMapper, GameProperties props) {
        this(objectMapper, props.getQuestionBank(), new Random());
    }

    ClasspathQuestionProvider(ObjectMapper objectMapper, String location, Random random) {
        this.objectMapper = objectMapper;
        this.location = location;
        this.random = random;
    }

    @Override
    public List<TriviaQuestion> fetchQuestions(String topic, Difficulty difficulty, int count) {
        if (count <= 0) {
            throw new GameException(ErrorCode.INVALID_REQUEST, "Question count must be positive");
        }

        List<TriviaQuestion> pool = new ArrayList<>();
        for (TriviaQuestion q : bank()) {
            if (difficulty == null || difficulty == Difficulty.CUSTOM || q.difficulty() == difficulty) pool.add(q);
        }

        List<TriviaQuestion> onTopic = new ArrayList<>();
        if (topic != null && !topic.isBlank()) {
            for (TriviaQuestion q : pool) {
                if (q.topic() != null && q.topic().equalsIgnoreCase(topic.trim())) onTopic.add(q);
            }
        }
        List<TriviaQuestion> chosen = onTopic.isEmpty() ? pool : onTopic;
        if (chosen.isEmpty()) {
            throw new GameException(ErrorCode.PROVIDER_UNAVAILABLE,
                    "No questions available for topic=" + topic + " difficulty=" + difficulty);
        }

        Collections.shuffle(chosen, random);
        List<TriviaQuestion> batch = List.copyOf(chosen.subList(0, Math.min(count, chosen.size())));
        log.info("QUESTIONS topic={} difficulty={} requested={} served={} onTopic={}",
                topic, difficulty == null ? null : difficulty.wire(), count, batch.size(), !onTopic.isEmpty());
        return batch;
    }

    private List<TriviaQuestion> bank() {
        List<TriviaQuestion> b = bank;
        if (b != null) return b;
        synchronized (this) {
            if (bank == null) bank = load();
            return bank;
        }
    }

    private List<TriviaQuestion> load() {
        ClassPathResource resource = new ClassPathResource(location);
        try (InputStream in = resource.getInputStream()) {
            List<TriviaQuestion> loaded = objectMapper.readValue(in, new TypeReference<List<TriviaQuestion>>() {});
            log.info("QUESTIONS bank loaded from {} ({} questions)", location, loaded.size());
            return List.copyOf(loaded);
        } catch (IOException e) {
            throw new GameException(ErrorCode.PROVIDER_UNAVAILABLE, "Question bank unavailable: " + location, e);
        }
    }
}
