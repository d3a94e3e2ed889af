package com.example.triviaroom.service;

/** Raw create-room input from either transport; TriviaGameService validates it into a RoomConfig. */
public record CreateRoomCommand(
        String topic,
        String difficulty,
        Integer questionsPerRequest,
        Integer maxPlayers,
        Integer timePerQuestion,
        String gameMode
) {
}
